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

package com.amazon.anomalyscoring.evaluation;

import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

import com.amazon.anomalyscoring.returntypes.EvaluationResult;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;

/**
 * Compares flagged observation ids with a set of ids known to be anomalous.
 *
 * <p>
 * Precision is the fraction of flagged ids that are true anomalies and recall
 * the fraction of true anomalies that were flagged. Either is 0.0 when its
 * denominator is 0; in particular, an empty set of true anomalies gives a
 * recall of 0.0 rather than an undefined value.
 */
public class Evaluator {

    private Evaluator() {
    }

    /**
     * @param flaggedIds ids of the observations flagged as anomalous
     * @param trueIds    ids of the observations that are anomalous
     * @return counts, precision and recall
     */
    public static EvaluationResult evaluate(Set<Long> flaggedIds, Set<Long> trueIds) {
        checkNotNull(flaggedIds, "flaggedIds must not be null");
        checkNotNull(trueIds, "trueIds must not be null");

        int truePositives = 0;
        for (Long id : flaggedIds) {
            if (trueIds.contains(id)) {
                ++truePositives;
            }
        }
        int falsePositives = flaggedIds.size() - truePositives;
        int falseNegatives = trueIds.size() - truePositives;
        return new EvaluationResult(truePositives, falsePositives, falseNegatives);
    }

    /**
     * Evaluate the flagged members of a collection of scored observations.
     * Observations that are not flagged are ignored.
     *
     * @param scored  scored observations
     * @param trueIds ids of the observations that are anomalous
     * @return counts, precision and recall
     */
    public static EvaluationResult evaluateFlagged(Collection<ScoredObservation> scored, Set<Long> trueIds) {
        checkNotNull(scored, "scored must not be null");
        Set<Long> flaggedIds = scored.stream().filter(ScoredObservation::isAnomaly).map(ScoredObservation::getId)
                .collect(Collectors.toSet());
        return evaluate(flaggedIds, trueIds);
    }
}
