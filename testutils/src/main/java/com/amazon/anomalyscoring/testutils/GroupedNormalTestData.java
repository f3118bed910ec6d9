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

package com.amazon.anomalyscoring.testutils;

import java.util.Collections;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * This class samples grouped one-dimensional data. Group {@code g} is drawn
 * from a normal distribution with mean {@code groupSpacing * (g + 1)} and
 * standard deviation {@code sigma}. With probability
 * {@code anomalyProbability} a row is replaced by an anomaly that sits between
 * {@code anomalyShift} and {@code anomalyShift + 1} standard deviations above or
 * below the group mean.
 */
public class GroupedNormalTestData {

    public static final String GROUP_PREFIX = "G";

    public static final int FIRST_PERIOD = 1960;

    private final double groupSpacing;
    private final double sigma;
    private final double anomalyShift;
    private final double anomalyProbability;

    public GroupedNormalTestData(double groupSpacing, double sigma, double anomalyShift,
            double anomalyProbability) {
        this.groupSpacing = groupSpacing;
        this.sigma = sigma;
        this.anomalyShift = anomalyShift;
        this.anomalyProbability = anomalyProbability;
    }

    public GroupedNormalTestData() {
        this(100.0, 1.0, 12.0, 0.02);
    }

    public GroupedDataWithLabels generateTestData(int numberOfGroups, int rowsPerGroup, long seed) {
        int[] groupSizes = new int[numberOfGroups];
        for (int g = 0; g < numberOfGroups; g++) {
            groupSizes[g] = rowsPerGroup;
        }
        return generateTestData(groupSizes, seed);
    }

    /**
     * Generate one group per entry of {@code groupSizes}. Ids are consecutive
     * from 0, and within a group the periods are consecutive years.
     *
     * @param groupSizes number of rows of each group
     * @param seed       random seed
     * @return the rows with the ids of the anomalies
     */
    public GroupedDataWithLabels generateTestData(int[] groupSizes, long seed) {
        int total = 0;
        for (int size : groupSizes) {
            total += size;
        }

        long[] ids = new long[total];
        String[] groupKeys = new String[total];
        String[] periods = new String[total];
        double[] values = new double[total];
        Set<Long> anomalyIds = new HashSet<>();

        Random random = new Random(seed);
        NormalDistribution dist = new NormalDistribution(random);
        int row = 0;
        for (int g = 0; g < groupSizes.length; g++) {
            double mu = groupSpacing * (g + 1);
            for (int i = 0; i < groupSizes[g]; i++) {
                ids[row] = row;
                groupKeys[row] = GROUP_PREFIX + g;
                periods[row] = Integer.toString(FIRST_PERIOD + i);
                if (random.nextDouble() < anomalyProbability) {
                    double direction = random.nextBoolean() ? 1.0 : -1.0;
                    values[row] = mu + direction * (anomalyShift + random.nextDouble()) * sigma;
                    anomalyIds.add((long) row);
                } else {
                    values[row] = dist.nextDouble(mu, sigma);
                }
                row++;
            }
        }

        return new GroupedDataWithLabels(ids, groupKeys, periods, values, Collections.unmodifiableSet(anomalyIds));
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
