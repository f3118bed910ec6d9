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
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CommonUtilsTest {

    @Test
    public void testCheckArgument() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkArgument(false, "error message"));
        assertDoesNotThrow(() -> CommonUtils.checkArgument(true, "error message"));
    }

    @Test
    public void testCheckInput() {
        InvalidInputException exception = assertThrows(InvalidInputException.class,
                () -> CommonUtils.checkInput(false, "bad input"));
        assertEquals("bad input", exception.getMessage());
        assertDoesNotThrow(() -> CommonUtils.checkInput(true, "bad input"));
    }

    @Test
    public void testCheckState() {
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "error message"));
        assertDoesNotThrow(() -> CommonUtils.checkState(true, "error message"));
    }

    @Test
    public void testCheckNotNull() {
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "error message"));
        String value = "value";
        assertSame(value, CommonUtils.checkNotNull(value, "error message"));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -0.1, 1.0000001, Double.NaN, Double.POSITIVE_INFINITY })
    public void testCheckContaminationOutOfRange(double contamination) {
        assertThrows(InvalidInputException.class, () -> CommonUtils.checkContamination(contamination));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 1e-6, 0.01, 0.5, 1.0 })
    public void testCheckContamination(double contamination) {
        assertDoesNotThrow(() -> CommonUtils.checkContamination(contamination));
    }

    @Test
    public void testAveragePathLength() {
        assertEquals(0.0, CommonUtils.averagePathLength(0));
        assertEquals(0.0, CommonUtils.averagePathLength(1));
        assertEquals(1.0, CommonUtils.averagePathLength(2));
        assertThat(CommonUtils.averagePathLength(5), closeTo(2.327020052, 1e-8));
        assertThat(CommonUtils.averagePathLength(256), closeTo(10.244770920, 1e-8));
    }
}
