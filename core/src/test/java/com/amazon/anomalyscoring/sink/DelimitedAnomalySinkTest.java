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

package com.amazon.anomalyscoring.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;

public class DelimitedAnomalySinkTest {

    private PrintWriter out;
    private ScoredObservation first;
    private ScoredObservation second;

    @BeforeEach
    public void setUp() {
        out = mock(PrintWriter.class);
        first = new ScoredObservation(new Observation(7, "US", "2001", 12.5), 4.2, true, DetectionMethod.ZSCORE);
        second = new ScoredObservation(new Observation(8, null, null, null), 1.5, true,
                DetectionMethod.ISOLATION_FOREST);
    }

    @Test
    public void testFormat() {
        DelimitedAnomalySink sink = new DelimitedAnomalySink(out, ",", false);
        assertEquals("7,US,2001,12.5,4.2,zscore", sink.format(first));
        assertEquals("8,NA,NA,NA,1.5,isolation_forest", sink.format(second));

        DelimitedAnomalySink tabs = new DelimitedAnomalySink(out, "\t", false);
        assertEquals("7\tUS\t2001\t12.5\t4.2\tzscore", tabs.format(first));
    }

    @Test
    public void testWriteWithHeader() {
        DelimitedAnomalySink sink = new DelimitedAnomalySink(out, ",", true);
        sink.write(Arrays.asList(first, second));
        sink.write(Collections.singletonList(first));

        InOrder inOrder = inOrder(out);
        inOrder.verify(out).println("id,group,period,value,score,method");
        inOrder.verify(out).println("7,US,2001,12.5,4.2,zscore");
        inOrder.verify(out).println("8,NA,NA,NA,1.5,isolation_forest");
        verify(out, times(1)).println("id,group,period,value,score,method");
        verify(out, times(2)).println("7,US,2001,12.5,4.2,zscore");
    }

    @Test
    public void testWriteWithoutHeader() {
        DelimitedAnomalySink sink = new DelimitedAnomalySink(out, ",", false);
        sink.write(Collections.singletonList(second));
        verify(out, times(1)).println(anyString());
        verify(out).println("8,NA,NA,NA,1.5,isolation_forest");
    }

    @Test
    public void testEmptyWriteWritesNothing() {
        DelimitedAnomalySink sink = new DelimitedAnomalySink(out, ",", true);
        sink.write(Collections.emptyList());
        verify(out, never()).println(anyString());
    }

    @Test
    public void testOnlyFlaggedObservationsAreAccepted() {
        DelimitedAnomalySink sink = new DelimitedAnomalySink(out, ",", false);
        ScoredObservation normal = new ScoredObservation(new Observation(9, "US", "2002", 1.0), 0.1, false,
                DetectionMethod.ZSCORE);
        assertThrows(IllegalArgumentException.class, () -> sink.write(Collections.singletonList(normal)));
        assertThrows(NullPointerException.class, () -> sink.write(null));
    }
}
