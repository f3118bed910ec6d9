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

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.inputtypes.ObservationGroup;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.util.ArrayUtils;

/**
 * Scores each value by its distance from the group mean in units of the
 * population standard deviation, and flags it when the magnitude exceeds a
 * fixed threshold. The contamination is not used.
 *
 * <p>
 * Mean and standard deviation are taken over the values that are present; a
 * missing value gets a NaN score and is never flagged. A small constant is
 * added to the standard deviation so that a group of identical values scores 0
 * everywhere.
 */
public class ZScoreDetector implements IGroupDetector {

    public static final double EPSILON = 1e-9;

    public static final double DEFAULT_THRESHOLD = 3.0;

    @Getter
    private final double threshold;

    public ZScoreDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public ZScoreDetector(double threshold) {
        checkArgument(threshold > 0, "threshold must be positive");
        this.threshold = threshold;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public List<ScoredObservation> detect(ObservationGroup group, double contamination) {
        double[] values = group.getValues();
        double mean = ArrayUtils.nanMean(values);
        double standardDeviation = ArrayUtils.nanPopulationStandardDeviation(values);

        List<ScoredObservation> result = new ArrayList<>(group.size());
        for (int i = 0; i < group.size(); i++) {
            double score = (values[i] - mean) / (standardDeviation + EPSILON);
            // NaN never exceeds the threshold
            boolean anomaly = Math.abs(score) > threshold;
            result.add(new ScoredObservation(group.getObservations().get(i), score, anomaly, getMethod()));
        }
        return result;
    }
}
