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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.Getter;

import com.amazon.anomalyscoring.ModelFitException;
import com.amazon.anomalyscoring.config.DetectionMethod;

/**
 * The outcome of one scoring run: one {@link ScoredObservation} per input
 * observation of every group that was scored, and the failures of the groups
 * that were skipped.
 */
public class ScoringResult {

    private static final ScoringResult EMPTY = new ScoringResult(Collections.emptyList(), Collections.emptyList());

    @Getter
    private final List<ScoredObservation> scoredObservations;

    @Getter
    private final List<ModelFitException> failures;

    public ScoringResult(List<ScoredObservation> scoredObservations, List<ModelFitException> failures) {
        checkNotNull(scoredObservations, "scoredObservations must not be null");
        checkNotNull(failures, "failures must not be null");
        this.scoredObservations = Collections.unmodifiableList(scoredObservations);
        this.failures = Collections.unmodifiableList(failures);
    }

    public static ScoringResult empty() {
        return EMPTY;
    }

    /**
     * @return the flagged observations, in output order
     */
    public List<ScoredObservation> getAnomalies() {
        return scoredObservations.stream().filter(ScoredObservation::isAnomaly).collect(Collectors.toList());
    }

    public int getAnomalyCount() {
        return (int) scoredObservations.stream().filter(ScoredObservation::isAnomaly).count();
    }

    /**
     * @return the number of flagged observations per detection method; methods
     *         that flagged nothing are absent
     */
    public Map<DetectionMethod, Long> getMethodBreakdown() {
        Map<DetectionMethod, Long> breakdown = new EnumMap<>(DetectionMethod.class);
        for (ScoredObservation scored : scoredObservations) {
            if (scored.isAnomaly()) {
                breakdown.merge(scored.getMethod(), 1L, Long::sum);
            }
        }
        return breakdown;
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
