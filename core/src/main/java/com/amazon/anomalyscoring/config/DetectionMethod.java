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

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;

/**
 * The detection methods a group can be scored with. Which one applies is a
 * pure function of the group size, see {@link #forGroupSize(int, int)}.
 */
public enum DetectionMethod {

    /**
     * standardized distance from the group mean; used for groups too small to fit
     * a model on
     */
    ZSCORE("zscore"),
    /**
     * isolation forest fit on the values of the group
     */
    ISOLATION_FOREST("isolation_forest");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    /**
     * @return the external name of the method, as written to sinks and reports
     */
    public String getLabel() {
        return label;
    }

    /**
     * Selects the method for a group. Groups strictly smaller than the threshold
     * use {@link #ZSCORE}; the boundary is inclusive for
     * {@link #ISOLATION_FOREST}.
     *
     * @param groupSize     number of observations in the group
     * @param sizeThreshold the smallest group size scored by an isolation forest
     * @return the method to apply
     */
    public static DetectionMethod forGroupSize(int groupSize, int sizeThreshold) {
        checkArgument(groupSize >= 0, "group size cannot be negative");
        checkArgument(sizeThreshold > 0, "size threshold must be positive");
        return (groupSize < sizeThreshold) ? ZSCORE : ISOLATION_FOREST;
    }

    public static DetectionMethod fromLabel(String label) {
        for (DetectionMethod method : values()) {
            if (method.label.equals(label)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + label);
    }
}
