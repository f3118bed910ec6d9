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

package com.amazon.anomalyscoring.anomalydetection;

import java.util.List;

import com.amazon.anomalyscoring.ModelFitException;
import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.inputtypes.ObservationGroup;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;

/**
 * Scores all observations of one group with a single detection method. Each
 * detector owns its decision rule; scores of different detectors are not on a
 * common scale.
 */
public interface IGroupDetector {

    /**
     * @return the method recorded on every observation this detector scores
     */
    DetectionMethod getMethod();

    /**
     * Score a group.
     *
     * @param group         the group, possibly empty
     * @param contamination expected fraction of anomalies in the group, in (0, 1]
     * @return one scored observation per observation of the group, in group order
     * @throws ModelFitException if the detector cannot be fit on the group
     */
    List<ScoredObservation> detect(ObservationGroup group, double contamination);
}
