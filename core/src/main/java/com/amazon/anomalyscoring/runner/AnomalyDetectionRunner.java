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

package com.amazon.anomalyscoring.runner;

import static com.amazon.anomalyscoring.CommonUtils.checkInput;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyscoring.GroupedAnomalyScorer;
import com.amazon.anomalyscoring.evaluation.Evaluator;
import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.returntypes.EvaluationResult;
import com.amazon.anomalyscoring.returntypes.RunSummary;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.returntypes.ScoringResult;
import com.amazon.anomalyscoring.sink.DelimitedAnomalySink;

/**
 * A command-line application that reads observations from STDIN, scores them
 * group by group and writes the flagged observations to STDOUT. When a label
 * file is given, the flagged ids are compared to the labeled anomalies and
 * precision and recall are logged.
 */
public class AnomalyDetectionRunner {

    private static final Logger logger = LogManager.getLogger(AnomalyDetectionRunner.class);

    protected final ArgumentParser argumentParser;

    public AnomalyDetectionRunner() {
        this(new ArgumentParser(AnomalyDetectionRunner.class.getName(),
                "Score grouped observations (rows of id, group, period, value) and write the rows flagged as "
                        + "anomalous, with their score and detection method."));
    }

    public AnomalyDetectionRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        AnomalyDetectionRunner runner = new AnomalyDetectionRunner();
        runner.parse(args);
        logger.info("Reading from stdin... (Ctrl-c to exit)");
        RunSummary summary = runner.run(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        logger.info("Done. {}", summary);
    }

    /**
     * Parse the given command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read observations, score them and write the anomalies.
     *
     * @param in  the delimited observations
     * @param out where the anomalies are written
     * @return the anomaly count, with precision and recall if a label file was
     *         given
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public RunSummary run(BufferedReader in, PrintWriter out) throws IOException {
        ObservationReader reader = new ObservationReader(argumentParser.getDelimiter(),
                argumentParser.getHeaderRow(), argumentParser.getLimit());
        List<Observation> observations = reader.read(in);
        checkInput(!observations.isEmpty(), "No observations found");
        logger.info("Read {} observations", observations.size());

        GroupedAnomalyScorer scorer = newScorer();
        ScoringResult result;
        try {
            result = scorer.scoreBatch(observations);
        } finally {
            scorer.shutdown();
        }
        List<ScoredObservation> anomalies = result.getAnomalies();
        logger.info("Flagged {} of {} observations", anomalies.size(), result.getScoredObservations().size());
        result.getMethodBreakdown()
                .forEach((method, count) -> logger.info("  {}: {} anomalies", method.getLabel(), count));
        if (!result.isComplete()) {
            logger.warn("{} groups were skipped", result.getFailures().size());
        }

        new DelimitedAnomalySink(out, argumentParser.getDelimiter(), argumentParser.getHeaderRow())
                .write(anomalies);
        out.flush();

        EvaluationResult evaluation = null;
        if (argumentParser.getLabelFile() != null) {
            Set<Long> trueIds = new LabelReader(argumentParser.getDelimiter())
                    .read(Paths.get(argumentParser.getLabelFile()));
            evaluation = Evaluator.evaluateFlagged(anomalies, trueIds);
            logger.info("True positives: {}, false positives: {}, false negatives: {}",
                    evaluation.getTruePositives(), evaluation.getFalsePositives(), evaluation.getFalseNegatives());
            logger.info(String.format(Locale.ROOT, "Precision: %.3f, Recall: %.3f", evaluation.getPrecision(),
                    evaluation.getRecall()));
        }
        return new RunSummary(anomalies.size(), evaluation);
    }

    protected GroupedAnomalyScorer newScorer() {
        return GroupedAnomalyScorer.builder().contamination(argumentParser.getContamination())
                .sizeThreshold(argumentParser.getSizeThreshold()).numberOfTrees(argumentParser.getNumberOfTrees())
                .sampleSize(argumentParser.getSampleSize()).randomSeed(argumentParser.getRandomSeed())
                .missingValuePolicy(argumentParser.getMissingValuePolicy())
                .groupFailurePolicy(argumentParser.getGroupFailurePolicy())
                .parallelExecutionEnabled(argumentParser.getParallel())
                .threadPoolSize(argumentParser.getThreadPoolSize()).build();
    }
}
