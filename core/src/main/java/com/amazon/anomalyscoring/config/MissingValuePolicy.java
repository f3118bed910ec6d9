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

/**
 * How a scoring run treats observations whose value is missing. The policy is
 * resolved once per batch, before the batch is partitioned into groups.
 */
public enum MissingValuePolicy {

    /**
     * missing values pass through unchanged; z-score groups give them a NaN score
     * and never flag them, isolation forest groups fail to fit
     */
    PROPAGATE,
    /**
     * any missing value rejects the whole batch
     */
    REJECT,
    /**
     * missing values are replaced by the median of the non-missing values of the
     * batch before scoring
     */
    IMPUTE_MEDIAN;
}
