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

import java.util.Optional;
import java.util.OptionalDouble;

import lombok.Getter;
import lombok.ToString;

/**
 * The numbers of a run that an instrumentation layer forwards: how many
 * observations were flagged and, when labels were supplied, precision and
 * recall.
 */
@ToString
public class RunSummary {

    @Getter
    private final int anomalyCount;

    private final EvaluationResult evaluation;

    public RunSummary(int anomalyCount, EvaluationResult evaluation) {
        this.anomalyCount = anomalyCount;
        this.evaluation = evaluation;
    }

    public Optional<EvaluationResult> getEvaluation() {
        return Optional.ofNullable(evaluation);
    }

    public OptionalDouble getPrecision() {
        return (evaluation == null) ? OptionalDouble.empty() : OptionalDouble.of(evaluation.getPrecision());
    }

    public OptionalDouble getRecall() {
        return (evaluation == null) ? OptionalDouble.empty() : OptionalDouble.of(evaluation.getRecall());
    }
}
