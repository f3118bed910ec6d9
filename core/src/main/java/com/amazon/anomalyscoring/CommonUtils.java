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

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link InvalidInputException} with the specified message if the
     * specified input is false. Used for conditions on caller supplied data, which
     * are rejected before any scoring starts.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the exception.
     * @throws InvalidInputException if {@code condition} is false.
     */
    public static void checkInput(boolean condition, String message) {
        if (!condition) {
            throw new InvalidInputException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Checks that a contamination fraction lies in (0, 1].
     *
     * @param contamination the expected fraction of anomalous observations
     * @throws InvalidInputException if the value is outside (0, 1] or NaN
     */
    public static void checkContamination(double contamination) {
        checkInput(contamination > 0 && contamination <= 1,
                String.format("contamination must be in (0, 1], found %s", contamination));
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * built from n points. This is the normalizer of isolation depths: a leaf
     * holding n points that were not separated further contributes this much
     * additional depth.
     *
     * @param n the number of points
     * @return the expected path length, 0 for n at most 1 and 1 for n equal to 2
     */
    public static double averagePathLength(long n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    static final double EULER_GAMMA = 0.5772156649015329;
}
