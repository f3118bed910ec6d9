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

import java.util.Set;

/**
 * Column-oriented grouped test data. Row {@code i} is the observation with id
 * {@code ids[i]}, group key {@code groupKeys[i]}, period {@code periods[i]} and
 * value {@code values[i]}. The ids of the rows drawn from the anomaly
 * distribution are in {@code anomalyIds}.
 */
public class GroupedDataWithLabels {

    public final long[] ids;
    public final String[] groupKeys;
    public final String[] periods;
    public final double[] values;
    public final Set<Long> anomalyIds;

    public GroupedDataWithLabels(long[] ids, String[] groupKeys, String[] periods, double[] values,
            Set<Long> anomalyIds) {
        this.ids = ids;
        this.groupKeys = groupKeys;
        this.periods = periods;
        this.values = values;
        this.anomalyIds = anomalyIds;
    }

    public int size() {
        return ids.length;
    }
}
