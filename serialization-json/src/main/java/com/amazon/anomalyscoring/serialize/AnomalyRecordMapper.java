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

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

import com.amazon.anomalyscoring.returntypes.EvaluationResult;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;

/**
 * Converts scoring results to and from the record classes that are written as
 * JSON.
 */
public class AnomalyRecordMapper {

    /**
     * @param anomaly    a flagged observation
     * @param detectedAt when the anomaly was recorded
     * @return the record of the anomaly
     */
    public AnomalyRecord toRecord(ScoredObservation anomaly, Instant detectedAt) {
        checkNotNull(anomaly, "anomaly must not be null");
        checkNotNull(detectedAt, "detectedAt must not be null");
        checkArgument(anomaly.isAnomaly(), "only flagged observations are recorded");
        Double value = anomaly.getObservation().isValueMissing() ? null : anomaly.getValue();
        return new AnomalyRecord(anomaly.getId(), anomaly.getGroupKey(), anomaly.getPeriod(), value,
                anomaly.getScore(), anomaly.getMethod().getLabel(), DateTimeFormatter.ISO_INSTANT.format(detectedAt));
    }

    public EvaluationRecord toRecord(EvaluationResult evaluation) {
        checkNotNull(evaluation, "evaluation must not be null");
        return new EvaluationRecord(evaluation.getTruePositives(), evaluation.getFalsePositives(),
                evaluation.getFalseNegatives(), evaluation.getPrecision(), evaluation.getRecall());
    }

    /**
     * Precision and recall are recomputed from the counts.
     */
    public EvaluationResult toModel(EvaluationRecord record) {
        checkNotNull(record, "record must not be null");
        return new EvaluationResult(record.getTruePositives(), record.getFalsePositives(),
                record.getFalseNegatives());
    }
}
