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

package com.amazon.anomalyscoring.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class DetectionMethodTest {

    @Test
    public void testForGroupSizeBoundary() {
        assertEquals(DetectionMethod.ZSCORE, DetectionMethod.forGroupSize(0, 10));
        assertEquals(DetectionMethod.ZSCORE, DetectionMethod.forGroupSize(1, 10));
        assertEquals(DetectionMethod.ZSCORE, DetectionMethod.forGroupSize(9, 10));
        assertEquals(DetectionMethod.ISOLATION_FOREST, DetectionMethod.forGroupSize(10, 10));
        assertEquals(DetectionMethod.ISOLATION_FOREST, DetectionMethod.forGroupSize(10_000, 10));
    }

    @Test
    public void testForGroupSizeCustomThreshold() {
        assertEquals(DetectionMethod.ZSCORE, DetectionMethod.forGroupSize(24, 25));
        assertEquals(DetectionMethod.ISOLATION_FOREST, DetectionMethod.forGroupSize(25, 25));
        assertEquals(DetectionMethod.ISOLATION_FOREST, DetectionMethod.forGroupSize(1, 1));
    }

    @Test
    public void testForGroupSizeInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> DetectionMethod.forGroupSize(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> DetectionMethod.forGroupSize(5, 0));
    }

    @ParameterizedTest
    @EnumSource(DetectionMethod.class)
    public void testFromLabel(DetectionMethod method) {
        assertEquals(method, DetectionMethod.fromLabel(method.getLabel()));
    }

    @Test
    public void testLabels() {
        assertEquals("zscore", DetectionMethod.ZSCORE.getLabel());
        assertEquals("isolation_forest", DetectionMethod.ISOLATION_FOREST.getLabel());
        assertThrows(IllegalArgumentException.class, () -> DetectionMethod.fromLabel("lof"));
    }
}
