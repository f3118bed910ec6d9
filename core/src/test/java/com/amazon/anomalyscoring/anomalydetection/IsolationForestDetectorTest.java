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

package com.amazon.anomalyscoring.anomalydetection;

import static com.amazon.anomalyscoring.anomalydetection.ZScoreDetectorTest.group;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyscoring.ModelFitException;
import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.inputtypes.ObservationGroup;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;

public class IsolationForestDetectorTest {

    private IsolationForestDetector detector;
    private double[] values;

    @BeforeEach
    public void setUp() {
        detector = new IsolationForestDetector(100, 256, 42L);
        Random random = new Random(99);
        values = new double[51];
        for (int i = 0; i < 50; i++) {
            values[i] = 20.0 + random.nextGaussian();
        }
        values[50] = 150.0;
    }

    @Test
    public void testGetters() {
        assertEquals(DetectionMethod.ISOLATION_FOREST, detector.getMethod());
        assertEquals(100, detector.getNumberOfTrees());
        assertEquals(256, detector.getSampleSize());
        assertEquals(42L, detector.getRandomSeed());
    }

    @Test
    public void testOutlierIsFlagged() {
        List<ScoredObservation> scored = detector.detect(group("BR", values), 0.01);

        assertEquals(51, scored.size());
        ScoredObservation outlier = scored.get(50);
        assertTrue(outlier.isAnomaly());
        assertEquals(150.0, outlier.getValue());
        for (int i = 0; i < 50; i++) {
            assertFalse(scored.get(i).isAnomaly());
            assertThat(scored.get(i).getScore(), lessThan(outlier.getScore()));
        }
        for (ScoredObservation observation : scored) {
            assertEquals(DetectionMethod.ISOLATION_FOREST, observation.getMethod());
            // the negated sample score lies in (0, 1)
            assertThat(observation.getScore(), greaterThan(0.0));
            assertThat(observation.getScore(), lessThan(1.0));
        }
    }

    @Test
    public void testReproducible() {
        assertEquals(detector.detect(group("BR", values), 0.05), detector.detect(group("BR", values), 0.05));
    }

    @Test
    public void testMissingValueFailsTheGroup() {
        values[3] = Double.NaN;
        ModelFitException exception = assertThrows(ModelFitException.class,
                () -> detector.detect(group("CL", values), 0.01));
        assertEquals("CL", exception.getGroupKey());
        assertEquals(51, exception.getRowCount());
        assertThat(exception.getCause(), instanceOf(IllegalArgumentException.class));
    }

    @Test
    public void testFitFailureIsWrapped() {
        IsolationForestDetector failing = spy(new IsolationForestDetector(10, 16, 0L));
        IllegalStateException cause = new IllegalStateException("out of resources");
        doThrow(cause).when(failing).newForest(anyDouble());

        ObservationGroup group = group(null, values);
        ModelFitException exception = assertThrows(ModelFitException.class, () -> failing.detect(group, 0.01));
        assertNull(exception.getGroupKey());
        assertEquals(51, exception.getRowCount());
        assertSame(cause, exception.getCause());
    }

    @Test
    public void testEmptyGroup() {
        assertTrue(detector.detect(group("PE"), 0.01).isEmpty());
    }
}
