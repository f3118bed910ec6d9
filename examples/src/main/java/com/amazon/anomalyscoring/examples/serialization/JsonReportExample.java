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

package com.amazon.anomalyscoring.examples.serialization;

import java.util.List;
import java.util.Map;

import com.amazon.anomalyscoring.GroupedAnomalyScorer;
import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.evaluation.Evaluator;
import com.amazon.anomalyscoring.examples.Example;
import com.amazon.anomalyscoring.examples.ExampleData;
import com.amazon.anomalyscoring.returntypes.EvaluationResult;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.returntypes.ScoringResult;
import com.amazon.anomalyscoring.testutils.GroupedDataWithLabels;
import com.amazon.anomalyscoring.testutils.GroupedNormalTestData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Write a run report (counts per method, precision, recall and the flagged
 * rows) as JSON using <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonReportExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonReportExample().run();
    }

    @Override
    public String command() {
        return "json-report";
    }

    @Override
    public String description() {
        return "write a scoring and evaluation report as JSON";
    }

    @Override
    public void run() throws Exception {
        GroupedDataWithLabels data = new GroupedNormalTestData().generateTestData(new int[] { 200, 80, 7 }, 5L);
        ScoringResult result = GroupedAnomalyScorer.builder().contamination(0.02).build()
                .scoreBatch(ExampleData.toObservations(data));
        EvaluationResult evaluation = Evaluator.evaluateFlagged(result.getScoredObservations(), data.anomalyIds);

        ObjectMapper jsonMapper = new ObjectMapper();
        ObjectNode report = jsonMapper.createObjectNode();
        report.put("observations", result.getScoredObservations().size());
        report.put("anomaly_count", result.getAnomalyCount());

        ObjectNode methods = report.putObject("method_breakdown");
        for (Map.Entry<DetectionMethod, Long> entry : result.getMethodBreakdown().entrySet()) {
            methods.put(entry.getKey().getLabel(), entry.getValue());
        }

        ObjectNode quality = report.putObject("evaluation");
        quality.put("true_positives", evaluation.getTruePositives());
        quality.put("false_positives", evaluation.getFalsePositives());
        quality.put("false_negatives", evaluation.getFalseNegatives());
        quality.put("precision", evaluation.getPrecision());
        quality.put("recall", evaluation.getRecall());

        ArrayNode anomalies = report.putArray("anomalies");
        List<ScoredObservation> flagged = result.getAnomalies();
        for (ScoredObservation anomaly : flagged) {
            ObjectNode row = anomalies.addObject();
            row.put("id", anomaly.getId());
            row.put("group", anomaly.getGroupKey());
            row.put("period", anomaly.getPeriod());
            row.put("value", anomaly.getValue());
            row.put("score", anomaly.getScore());
            row.put("method", anomaly.getMethod().getLabel());
        }

        String json = jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        System.out.println(json);

        // read the report back and check it against the result
        JsonNode restored = jsonMapper.readTree(json);
        if (restored.get("anomalies").size() != flagged.size()
                || restored.get("anomaly_count").asInt() != result.getAnomalyCount()) {
            throw new IllegalStateException("report does not match the scoring result");
        }
        System.out.println("Looks good!");
    }
}
