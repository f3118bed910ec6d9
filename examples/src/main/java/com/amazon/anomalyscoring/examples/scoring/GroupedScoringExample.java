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

package com.amazon.anomalyscoring.examples.scoring;

import java.util.List;
import java.util.Map;

import com.amazon.anomalyscoring.GroupedAnomalyScorer;
import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.evaluation.Evaluator;
import com.amazon.anomalyscoring.examples.Example;
import com.amazon.anomalyscoring.examples.ExampleData;
import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.returntypes.EvaluationResult;
import com.amazon.anomalyscoring.returntypes.ScoringResult;
import com.amazon.anomalyscoring.testutils.GroupedDataWithLabels;
import com.amazon.anomalyscoring.testutils.GroupedNormalTestData;

/**
 * Score groups of very different sizes, some small enough to fall back to a
 * z-score, and compare the flags with the generated labels.
 */
public class GroupedScoringExample implements Example {

    public static void main(String[] args) throws Exception {
        new GroupedScoringExample().run();
    }

    @Override
    public String command() {
        return "grouped";
    }

    @Override
    public String description() {
        return "score groups of mixed sizes and evaluate the flags against known anomalies";
    }

    @Override
    public void run() throws Exception {
        int[] groupSizes = new int[] { 400, 250, 120, 60, 9, 6, 3 };
        double contamination = 0.03;

        GroupedDataWithLabels data = new GroupedNormalTestData().generateTestData(groupSizes, 2024L);
        List<Observation> observations = ExampleData.toObservations(data);

        GroupedAnomalyScorer scorer = GroupedAnomalyScorer.builder().contamination(contamination).build();
        ScoringResult result = scorer.scoreBatch(observations);

        System.out.printf("observations = %d, groups = %d, contamination = %.2f%n", observations.size(),
                groupSizes.length, contamination);
        System.out.printf("anomalies flagged = %d%n", result.getAnomalyCount());

        Map<DetectionMethod, Long> breakdown = result.getMethodBreakdown();
        for (DetectionMethod method : DetectionMethod.values()) {
            System.out.printf("\t%-16s %d%n", method.getLabel(), breakdown.getOrDefault(method, 0L));
        }

        EvaluationResult evaluation = Evaluator.evaluateFlagged(result.getScoredObservations(), data.anomalyIds);
        System.out.printf("true positives = %d, false positives = %d, false negatives = %d%n",
                evaluation.getTruePositives(), evaluation.getFalsePositives(), evaluation.getFalseNegatives());
        System.out.printf("precision = %.3f, recall = %.3f%n", evaluation.getPrecision(), evaluation.getRecall());

        if (result.getScoredObservations().size() != observations.size()) {
            throw new IllegalStateException("every observation should be scored exactly once");
        }
        if (evaluation.getTruePositives() == 0) {
            throw new IllegalStateException("no generated anomaly was flagged");
        }
        System.out.println("Looks good!");
    }
}
