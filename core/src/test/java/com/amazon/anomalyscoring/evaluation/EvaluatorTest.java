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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.returntypes.EvaluationResult;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;

public class EvaluatorTest {

    private static Set<Long> ids(long... values) {
        Set<Long> result = new HashSet<>();
        for (long value : values) {
            result.add(value);
        }
        return result;
    }

    @Test
    public void testEvaluate() {
        EvaluationResult result = Evaluator.evaluate(ids(1, 2, 3), ids(2, 3, 4));

        assertEquals(2, result.getTruePositives());
        assertEquals(1, result.getFalsePositives());
        assertEquals(1, result.getFalseNegatives());
        assertThat(result.getPrecision(), closeTo(2.0 / 3.0, 1e-12));
        assertThat(result.getRecall(), closeTo(2.0 / 3.0, 1e-12));
    }

    @Test
    public void testPerfectDetection() {
        EvaluationResult result = Evaluator.evaluate(ids(5, 6), ids(6, 5));
        assertEquals(new EvaluationResult(2, 0, 0), result);
        assertEquals(1.0, result.getPrecision());
        assertEquals(1.0, result.getRecall());
    }

    @Test
    public void testNothingFlagged() {
        EvaluationResult result = Evaluator.evaluate(Collections.emptySet(), ids(1, 2));
        assertEquals(0, result.getTruePositives());
        assertEquals(0, result.getFalsePositives());
        assertEquals(2, result.getFalseNegatives());
        assertEquals(0.0, result.getPrecision());
        assertEquals(0.0, result.getRecall());
    }

    @Test
    public void testNoTrueAnomalies() {
        EvaluationResult result = Evaluator.evaluate(ids(1), Collections.emptySet());
        assertEquals(1, result.getFalsePositives());
        assertEquals(0.0, result.getPrecision());
        assertEquals(0.0, result.getRecall());

        EvaluationResult empty = Evaluator.evaluate(Collections.emptySet(), Collections.emptySet());
        assertEquals(new EvaluationResult(0, 0, 0), empty);
        assertEquals(0.0, empty.getPrecision());
        assertEquals(0.0, empty.getRecall());
    }

    @Test
    public void testIdempotent() {
        Set<Long> flagged = ids(1, 2, 3, 10);
        Set<Long> truth = ids(3, 10, 11);
        EvaluationResult first = Evaluator.evaluate(flagged, truth);
        assertEquals(first, Evaluator.evaluate(flagged, truth));
        assertEquals(ids(1, 2, 3, 10), flagged);
        assertEquals(ids(3, 10, 11), truth);
    }

    @Test
    public void testEvaluateFlaggedIgnoresUnflagged() {
        List<ScoredObservation> scored = Arrays.asList(
                new ScoredObservation(new Observation(1, "A", "2000", 1.0), 4.0, true, DetectionMethod.ZSCORE),
                new ScoredObservation(new Observation(2, "A", "2001", 1.0), 0.1, false, DetectionMethod.ZSCORE),
                new ScoredObservation(new Observation(3, "B", "2000", 9.0), 0.7, true,
                        DetectionMethod.ISOLATION_FOREST));

        EvaluationResult result = Evaluator.evaluateFlagged(scored, ids(2, 3));

        assertEquals(new EvaluationResult(1, 1, 1), result);
    }

    @Test
    public void testNullArguments() {
        assertThrows(NullPointerException.class, () -> Evaluator.evaluate(null, ids(1)));
        assertThrows(NullPointerException.class, () -> Evaluator.evaluate(ids(1), null));
        assertThrows(IllegalArgumentException.class, () -> new EvaluationResult(-1, 0, 0));
    }
}
