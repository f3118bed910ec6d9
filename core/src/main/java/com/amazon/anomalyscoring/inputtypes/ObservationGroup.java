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

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * The observations of one group together with the values they are scored on.
 * The i-th value belongs to the i-th observation; values can differ from the
 * observed ones once a missing value policy has imputed them. Missing values
 * are NaN.
 */
public class ObservationGroup {

    public static final String NO_KEY_LABEL = "<none>";

    @Getter
    private final String key;

    @Getter
    private final List<Observation> observations;

    private final double[] values;

    public ObservationGroup(String key, List<Observation> observations, double[] values) {
        checkNotNull(observations, "observations must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(observations.size() == values.length, "expected one value per observation");
        this.key = key;
        this.observations = Collections.unmodifiableList(observations);
        this.values = values;
    }

    public int size() {
        return values.length;
    }

    public double getValue(int index) {
        return values[index];
    }

    /**
     * @return a copy of the values, in observation order
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * @return the key, or a placeholder for the group without a key; for messages
     */
    public String getLabel() {
        return (key == null) ? NO_KEY_LABEL : key;
    }
}
