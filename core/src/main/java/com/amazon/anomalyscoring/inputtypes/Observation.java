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

package com.amazon.anomalyscoring.inputtypes;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single labeled reading, for example the value of one indicator for one
 * country and one year. Observations are immutable.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Observation {

    /**
     * unique identifier of the reading in the originating data set
     */
    private final long id;

    /**
     * categorical label used to partition a batch, may be null
     */
    private final String groupKey;

    /**
     * opaque ordering or display value, never interpreted
     */
    private final String period;

    /**
     * the reading, null when missing
     */
    private final Double value;

    public Observation(long id, String groupKey, String period, Double value) {
        this.id = id;
        this.groupKey = groupKey;
        this.period = period;
        this.value = value;
    }

    /**
     * @return true if the value is absent; NaN counts as absent
     */
    public boolean isValueMissing() {
        return value == null || value.isNaN();
    }

    /**
     * @return the value as a primitive, NaN when missing
     */
    public double getValueOrNaN() {
        return isValueMissing() ? Double.NaN : value;
    }
}
