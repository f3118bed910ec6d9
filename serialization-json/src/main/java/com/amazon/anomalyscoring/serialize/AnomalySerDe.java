/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyscoring.serialize;

import java.time.Instant;

import lombok.Getter;

import com.amazon.anomalyscoring.returntypes.EvaluationResult;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.google.gson.Gson;

/**
 * JSON serialization of flagged observations and evaluation results. Internally
 * we use the {@link AnomalyRecordMapper} class to convert results into record
 * objects, and we use <a href="https://github.com/google/gson">Gson</a> to
 * write the records as JSON strings. The Gson instance is exposed so users can
 * customize the output (e.g., by enabling pretty printing).
 */
@Getter
public class AnomalySerDe {

    private final AnomalyRecordMapper mapper;
    private final Gson gson;

    public AnomalySerDe() {
        this(new AnomalyRecordMapper(), new Gson());
    }

    public AnomalySerDe(AnomalyRecordMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * Serializes a flagged observation to a json string.
     *
     * @param anomaly    a flagged observation
     * @param detectedAt when the anomaly was recorded
     * @return a single-line json document
     */
    public String toJson(ScoredObservation anomaly, Instant detectedAt) {
        return gson.toJson(mapper.toRecord(anomaly, detectedAt));
    }

    public AnomalyRecord anomalyFromJson(String json) {
        return gson.fromJson(json, AnomalyRecord.class);
    }

    public String toJson(EvaluationResult evaluation) {
        return gson.toJson(mapper.toRecord(evaluation));
    }

    public EvaluationResult evaluationFromJson(String json) {
        return mapper.toModel(gson.fromJson(json, EvaluationRecord.class));
    }
}
