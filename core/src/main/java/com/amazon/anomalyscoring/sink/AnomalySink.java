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

import java.io.IOException;
import java.util.List;

import com.amazon.anomalyscoring.returntypes.ScoredObservation;

/**
 * A downstream store for flagged observations. Sinks receive only flagged
 * observations and get no deduplication from the scorer: scoring overlapping
 * batches twice hands the same anomalies over twice.
 */
public interface AnomalySink {

    /**
     * @param anomalies flagged observations, possibly empty
     * @throws IOException              if the store cannot be written
     * @throws IllegalArgumentException if an observation is not flagged
     */
    void write(List<ScoredObservation> anomalies) throws IOException;
}
