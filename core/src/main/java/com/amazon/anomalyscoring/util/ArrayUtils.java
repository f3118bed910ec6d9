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

package com.amazon.anomalyscoring.util;

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A utility class for summary statistics over value arrays. Methods whose name
 * starts with {@code nan} ignore NaN entries, which stand for missing values.
 */
public class ArrayUtils {

    private ArrayUtils() {
    }

    /**
     * @param values the values
     * @return the number of entries that are not NaN
     */
    public static int countPresent(double[] values) {
        checkNotNull(values, "values must not be null");
        int count = 0;
        for (double value : values) {
            if (!Double.isNaN(value)) {
                ++count;
            }
        }
        return count;
    }

    /**
     * @param values the values
     * @return the mean of the entries that are not NaN, or NaN if there are none
     */
    public static double nanMean(double[] values) {
        checkNotNull(values, "values must not be null");
        double sum = 0;
        int count = 0;
        for (double value : values) {
            if (!Double.isNaN(value)) {
                sum += value;
                ++count;
            }
        }
        return (count == 0) ? Double.NaN : sum / count;
    }

    /**
     * The population standard deviation (divisor equal to the number of values)
     * of the entries that are not NaN.
     *
     * @param values the values
     * @return the standard deviation, or NaN if there are no values
     */
    public static double nanPopulationStandardDeviation(double[] values) {
        double mean = nanMean(values);
        if (Double.isNaN(mean)) {
            return Double.NaN;
        }
        double sumOfSquares = 0;
        int count = 0;
        for (double value : values) {
            if (!Double.isNaN(value)) {
                double difference = value - mean;
                sumOfSquares += difference * difference;
                ++count;
            }
        }
        return Math.sqrt(sumOfSquares / count);
    }

    /**
     * @param values the values
     * @return the median of the entries that are not NaN, or NaN if there are none
     */
    public static double nanMedian(double[] values) {
        checkNotNull(values, "values must not be null");
        double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
        if (present.length == 0) {
            return Double.NaN;
        }
        int middle = present.length / 2;
        return (present.length % 2 == 1) ? present[middle] : (present[middle - 1] + present[middle]) / 2;
    }

    /**
     * The q-th percentile of the values, interpolating linearly between the two
     * nearest ranks. The 0th percentile is the minimum and the 100th the maximum.
     *
     * @param values     the values, none of which may be NaN
     * @param percentile a percentile in [0, 100]
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double percentile) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "cannot compute a percentile of no values");
        checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in [0, 100]");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
