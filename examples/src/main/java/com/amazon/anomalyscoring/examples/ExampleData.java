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

package com.amazon.anomalyscoring.examples;

import java.util.ArrayList;
import java.util.List;

import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.testutils.GroupedDataWithLabels;

/**
 * Turns generated test data into observations.
 */
public class ExampleData {

    private ExampleData() {
    }

    public static List<Observation> toObservations(GroupedDataWithLabels data) {
        List<Observation> observations = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            observations.add(new Observation(data.ids[i], data.groupKeys[i], data.periods[i], data.values[i]));
        }
        return observations;
    }
}
