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

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Detection quality against a set of labeled anomalies. Precision and recall
 * are 0.0 whenever their denominator is 0.
 */
@Getter
@ToString
@EqualsAndHashCode
public class EvaluationResult {

    private final int truePositives;

    private final int falsePositives;

    private final int falseNegatives;

    private final double precision;

    private final double recall;

    public EvaluationResult(int truePositives, int falsePositives, int falseNegatives) {
        checkArgument(truePositives >= 0 && falsePositives >= 0 && falseNegatives >= 0,
                "counts cannot be negative");
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.falseNegatives = falseNegatives;
        this.precision = ratio(truePositives, truePositives + falsePositives);
        this.recall = ratio(truePositives, truePositives + falseNegatives);
    }

    private static double ratio(int numerator, int denominator) {
        return (denominator > 0) ? (double) numerator / denominator : 0.0;
    }
}
