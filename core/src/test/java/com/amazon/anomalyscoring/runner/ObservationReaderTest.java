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

package com.amazon.anomalyscoring.runner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.anomalyscoring.InvalidInputException;
import com.amazon.anomalyscoring.inputtypes.Observation;

public class ObservationReaderTest {

    private static BufferedReader input(String... lines) {
        return new BufferedReader(new StringReader(String.join("\n", lines)));
    }

    @Test
    public void testRead() throws IOException {
        ObservationReader reader = new ObservationReader(",", true, 0);
        List<Observation> observations = reader.read(
                input("id,country,date,value", "1,US,2001,3.5", "", "2,FR,2002,-1e3", "3, DE , 2003 , 7 "));

        assertEquals(3, observations.size());
        assertEquals(new Observation(1, "US", "2001", 3.5), observations.get(0));
        assertEquals(new Observation(2, "FR", "2002", -1000.0), observations.get(1));
        assertEquals(new Observation(3, "DE", "2003", 7.0), observations.get(2));
    }

    @Test
    public void testWithoutHeaderRow() throws IOException {
        ObservationReader reader = new ObservationReader(",", false, 0);
        List<Observation> observations = reader.read(input("1,US,2001,3.5", "2,US,2002,4.5"));
        assertEquals(2, observations.size());
        assertEquals(1L, observations.get(0).getId());
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "NA", "na", "NaN", "null", "None", " NONE " })
    public void testMissingTokens(String token) throws IOException {
        ObservationReader reader = new ObservationReader(",", false, 0);
        Observation observation = reader.read(input("5," + token + "," + token + "," + token)).get(0);

        assertEquals(5L, observation.getId());
        assertNull(observation.getGroupKey());
        assertNull(observation.getPeriod());
        assertNull(observation.getValue());
        assertTrue(observation.isValueMissing());
    }

    @Test
    public void testLimit() throws IOException {
        ObservationReader reader = new ObservationReader(",", true, 2);
        List<Observation> observations = reader
                .read(input("id,group,period,value", "1,A,1,1", "2,A,2,2", "3,A,3,3", "4,A,4,4"));
        assertEquals(2, observations.size());
        assertEquals(2L, observations.get(1).getId());
    }

    @Test
    public void testDelimiterIsLiteral() throws IOException {
        ObservationReader reader = new ObservationReader("|", false, 0);
        List<Observation> observations = reader.read(input("1|A|2001|2.5"));
        assertEquals(new Observation(1, "A", "2001", 2.5), observations.get(0));
    }

    @Test
    public void testWrongNumberOfFields() {
        ObservationReader reader = new ObservationReader(",", true, 0);
        InvalidInputException exception = assertThrows(InvalidInputException.class,
                () -> reader.read(input("id,group,period,value", "1,A,2001,1.0", "2,A,2002")));
        assertThat(exception.getMessage(), containsString("line 3"));
        assertThrows(InvalidInputException.class, () -> reader.read(input("h", "1,A,2001,1.0,extra")));
    }

    @Test
    public void testUnparseableFields() {
        ObservationReader reader = new ObservationReader(",", false, 0);
        InvalidInputException exception = assertThrows(InvalidInputException.class,
                () -> reader.read(input("x,A,2001,1.0")));
        assertThat(exception.getMessage(), containsString("line 1"));
        assertThrows(InvalidInputException.class, () -> reader.read(input("1,A,2001,lots")));
    }

    @Test
    public void testEmptyInput() throws IOException {
        assertTrue(new ObservationReader(",", true, 0).read(input("id,group,period,value")).isEmpty());
        assertTrue(new ObservationReader(",", false, 0).read(new BufferedReader(new StringReader(""))).isEmpty());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ObservationReader("", false, 0));
        assertThrows(IllegalArgumentException.class, () -> new ObservationReader(",", false, -1));
    }
}
