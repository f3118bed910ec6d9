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

package com.amazon.anomalyscoring.returntypes;

import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.inputtypes.Observation;

/**
 * An observation together with the score, the flag and the method a scoring run
 * assigned to it. The meaning of the score depends on the method: a z-score for
 * {@link DetectionMethod#ZSCORE}, the negated isolation forest sample score for
 * {@link DetectionMethod#ISOLATION_FOREST}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ScoredObservation {

    private final Observation observation;

    private final double score;

    private final boolean anomaly;

    private final DetectionMethod method;

    public ScoredObservation(Observation observation, double score, boolean anomaly, DetectionMethod method) {
        this.observation = checkNotNull(observation, "observation must not be null");
        this.method = checkNotNull(method, "method must not be null");
        this.score = score;
        this.anomaly = anomaly;
    }

    public long getId() {
        return observation.getId();
    }

    public String getGroupKey() {
        return observation.getGroupKey();
    }

    public String getPeriod() {
        return observation.getPeriod();
    }

    public Double getValue() {
        return observation.getValue();
    }
}
