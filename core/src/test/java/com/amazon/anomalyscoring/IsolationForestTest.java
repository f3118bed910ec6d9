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

package com.amazon.anomalyscoring;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class IsolationForestTest {

    private double[][] points;

    @BeforeEach
    public void setUp() {
        Random random = new Random(2024);
        points = new double[51][];
        for (int i = 0; i < 50; i++) {
            points[i] = new double[] { random.nextGaussian() };
        }
        points[50] = new double[] { 100.0 };
    }

    @Test
    public void testDefaults() {
        IsolationForest forest = IsolationForest.builder().build();
        assertEquals(IsolationForest.DEFAULT_NUMBER_OF_TREES, forest.getNumberOfTrees());
        assertEquals(IsolationForest.DEFAULT_SAMPLE_SIZE, forest.getSampleSize());
        assertEquals(IsolationForest.DEFAULT_CONTAMINATION, forest.getContamination());
        assertFalse(forest.isParallelExecutionEnabled());
        assertFalse(forest.isFitted());
        assertTrue(Double.isNaN(forest.getOffset()));
    }

    @Test
    public void testFitUsesAllPointsWhenFewerThanSampleSize() {
        IsolationForest forest = IsolationForest.builder().randomSeed(42L).build();
        forest.fit(points);
        assertTrue(forest.isFitted());
        assertEquals(51, forest.getSubsampleSize());
        assertEquals(1, forest.getDimensions());

        IsolationForest small = IsolationForest.builder().sampleSize(16).randomSeed(42L).build();
        small.fit(points);
        assertEquals(16, small.getSubsampleSize());
    }

    @Test
    public void testScoresAreInRange() {
        IsolationForest forest = IsolationForest.builder().randomSeed(42L).build();
        forest.fit(points);
        for (double score : forest.scoreSamples(points)) {
            assertThat(score, lessThan(0.0));
            assertThat(score, greaterThan(-1.0));
        }
    }

    @Test
    public void testOutlierIsFlagged() {
        IsolationForest forest = IsolationForest.builder().randomSeed(42L).contamination(0.01).build();
        forest.fit(points);

        double[] scores = forest.scoreSamples(points);
        for (int i = 0; i < 50; i++) {
            assertThat(scores[50], lessThan(scores[i]));
            assertFalse(forest.isOutlier(points[i]));
        }
        assertTrue(forest.isOutlier(points[50]));
        assertThat(forest.decisionFunction(points[50]), lessThan(0.0));
    }

    @Test
    public void testSameSeedGivesSameScores() {
        IsolationForest first = IsolationForest.builder().randomSeed(42L).build();
        IsolationForest second = IsolationForest.builder().randomSeed(42L).build();
        first.fit(points);
        second.fit(points);
        assertArrayEquals(first.scoreSamples(points), second.scoreSamples(points));
        assertEquals(first.getOffset(), second.getOffset());
    }

    @Test
    public void testParallelTreeGrowthGivesSameScores() {
        IsolationForest sequential = IsolationForest.builder().randomSeed(7L).build();
        IsolationForest parallel = IsolationForest.builder().randomSeed(7L).parallelExecutionEnabled(true)
                .threadPoolSize(2).build();
        sequential.fit(points);
        parallel.fit(points);
        assertTrue(parallel.isParallelExecutionEnabled());
        assertEquals(2, parallel.getThreadPoolSize());
        assertArrayEquals(sequential.scoreSamples(points), parallel.scoreSamples(points));
    }

    @Test
    public void testConstantDataFlagsNothing() {
        double[][] constant = new double[20][];
        for (int i = 0; i < constant.length; i++) {
            constant[i] = new double[] { 5.0 };
        }
        IsolationForest forest = IsolationForest.builder().randomSeed(42L).contamination(0.1).build();
        forest.fit(constant);

        double expected = forest.scoreSample(constant[0]);
        for (double[] point : constant) {
            assertEquals(expected, forest.scoreSample(point));
            assertFalse(forest.isOutlier(point));
        }
    }

    @Test
    public void testSinglePoint() {
        IsolationForest forest = IsolationForest.builder().randomSeed(42L).build();
        forest.fit(new double[][] { { 3.0 } });
        assertEquals(-0.5, forest.scoreSample(new double[] { 3.0 }));
        assertFalse(forest.isOutlier(new double[] { 3.0 }));
    }

    @Test
    public void testFitRejectsNonFiniteValues() {
        IsolationForest forest = IsolationForest.builder().randomSeed(42L).build();
        assertThrows(IllegalArgumentException.class, () -> forest.fit(new double[][] { { 1.0 }, { Double.NaN } }));
        assertThrows(IllegalArgumentException.class,
                () -> forest.fit(new double[][] { { 1.0 }, { Double.POSITIVE_INFINITY } }));
        assertThrows(IllegalArgumentException.class, () -> forest.fit(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> forest.fit(new double[][] { { 1.0 }, { 1.0, 2.0 } }));
        assertFalse(forest.isFitted());
    }

    @Test
    public void testScoreBeforeFit() {
        IsolationForest forest = IsolationForest.builder().build();
        assertThrows(IllegalStateException.class, () -> forest.scoreSample(new double[] { 1.0 }));
    }

    @Test
    public void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> IsolationForest.builder().numberOfTrees(0).build());
        assertThrows(IllegalArgumentException.class, () -> IsolationForest.builder().sampleSize(0).build());
        assertThrows(InvalidInputException.class, () -> IsolationForest.builder().contamination(0.0).build());
    }
}
