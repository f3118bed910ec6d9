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

package com.amazon.anomalyscoring.serialize;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.google.gson.annotations.SerializedName;

/**
 * The document written for one flagged observation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecord {

    @SerializedName("source_id")
    private long sourceId;

    private String country;

    private String date;

    private Double value;

    private double score;

    private String method;

    /**
     * ISO-8601 instant at which the anomaly was recorded
     */
    @SerializedName("detected_at")
    private String detectedAt;
}
