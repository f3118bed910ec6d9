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

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscoring.IsolationForest;
import com.amazon.anomalyscoring.ModelFitException;
import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.inputtypes.ObservationGroup;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;

/**
 * Fits an {@link IsolationForest} on the values of the group and scores every
 * value with it. The reported score is the negated sample score of the
 * forest, and the flag is the forest's own outlier prediction at the given
 * contamination.
 *
 * <p>
 * The forest cannot consume missing values: callers impute them beforehand or
 * the fit fails with a {@link ModelFitException}.
 */
public class IsolationForestDetector implements IGroupDetector {

    @Getter
    private final int numberOfTrees;

    @Getter
    private final int sampleSize;

    @Getter
    private final long randomSeed;

    public IsolationForestDetector(int numberOfTrees, int sampleSize, long randomSeed) {
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ISOLATION_FOREST;
    }

    @Override
    public List<ScoredObservation> detect(ObservationGroup group, double contamination) {
        List<ScoredObservation> result = new ArrayList<>(group.size());
        if (group.size() == 0) {
            return result;
        }

        double[][] points = new double[group.size()][];
        for (int i = 0; i < group.size(); i++) {
            points[i] = new double[] { group.getValue(i) };
        }

        IsolationForest forest;
        try {
            forest = newForest(contamination);
            forest.fit(points);
        } catch (RuntimeException e) {
            throw new ModelFitException(group.getKey(), group.size(), e);
        }

        for (int i = 0; i < group.size(); i++) {
            double sampleScore = forest.scoreSample(points[i]);
            boolean anomaly = sampleScore < forest.getOffset();
            result.add(new ScoredObservation(group.getObservations().get(i), -sampleScore, anomaly, getMethod()));
        }
        return result;
    }

    protected IsolationForest newForest(double contamination) {
        return IsolationForest.builder().numberOfTrees(numberOfTrees).sampleSize(sampleSize)
                .contamination(contamination).randomSeed(randomSeed).build();
    }
}
