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

import lombok.Getter;

/**
 * A detection model could not be fit on one group. The failure is confined to
 * that group; it carries the group key and row count so that the caller can
 * log it and retry at group granularity.
 */
@Getter
public class ModelFitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * the key of the failed group, null when the group collects observations
     * without a key
     */
    private final String groupKey;

    private final int rowCount;

    public ModelFitException(String groupKey, int rowCount, Throwable cause) {
        super(String.format("failed to fit model for group %s (%d rows): %s", groupKey, rowCount,
                cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.groupKey = groupKey;
        this.rowCount = rowCount;
    }
}
