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

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.anomalyscoring.GroupedAnomalyScorer;
import com.amazon.anomalyscoring.IsolationForest;
import com.amazon.anomalyscoring.config.GroupFailurePolicy;
import com.amazon.anomalyscoring.config.MissingValuePolicy;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/grouped-anomaly-scoring-1.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final DoubleArgument contamination;
    private final IntegerArgument sizeThreshold;
    private final IntegerArgument numberOfTrees;
    private final IntegerArgument sampleSize;
    private final IntegerArgument randomSeed;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;
    private final StringArgument labelFile;
    private final IntegerArgument limit;
    private final StringArgument missingValues;
    private final BooleanArgument skipFailedGroups;
    private final BooleanArgument parallel;
    private final IntegerArgument threadPoolSize;

    /**
     * Create a new ArgumentParser.The runner class and runner description will be
     * used in help text.
     * 
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        contamination = new DoubleArgument(null, "--contamination",
                "Expected fraction of anomalies in each group, in (0, 1].",
                GroupedAnomalyScorer.DEFAULT_CONTAMINATION,
                n -> checkArgument(n > 0.0 && n <= 1.0, "contamination should be in (0, 1]"));

        addArgument(contamination);

        sizeThreshold = new IntegerArgument("-t", "--size-threshold",
                "Groups with fewer rows are scored with a z-score instead of an isolation forest.",
                GroupedAnomalyScorer.DEFAULT_SIZE_THRESHOLD,
                n -> checkArgument(n > 0, "size threshold should be greater than 0"));

        addArgument(sizeThreshold);

        numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees in each isolation forest.",
                IsolationForest.DEFAULT_NUMBER_OF_TREES,
                n -> checkArgument(n > 0, "number of trees should be greater than 0"));

        addArgument(numberOfTrees);

        sampleSize = new IntegerArgument("-s", "--sample-size", "Number of points each tree is grown on.",
                IsolationForest.DEFAULT_SAMPLE_SIZE,
                n -> checkArgument(n > 0, "sample size should be greater than 0"));

        addArgument(sampleSize);

        randomSeed = new IntegerArgument(null, "--random-seed", "Random seed to use in the isolation forests.",
                (int) GroupedAnomalyScorer.DEFAULT_RANDOM_SEED);

        addArgument(randomSeed);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);

        labelFile = new StringArgument("-l", "--label-file",
                "Optional delimited file with an 'id' or 'source_id' column of true anomalies.", null);

        addArgument(labelFile);

        limit = new IntegerArgument(null, "--limit", "Read at most this many rows, or 0 for all rows.", 0,
                n -> checkArgument(n >= 0, "limit should not be negative"));

        addArgument(limit);

        missingValues = new StringArgument(null, "--missing-values",
                "Treatment of missing values: propagate, reject or impute_median.", "impute_median",
                s -> checkArgument(isMissingValuePolicy(s), "unknown missing value policy " + s));

        addArgument(missingValues);

        skipFailedGroups = new BooleanArgument(null, "--skip-failed-groups",
                "Set to 'true' to skip groups whose model cannot be fit instead of failing.", false);

        addArgument(skipFailedGroups);

        parallel = new BooleanArgument("-p", "--parallel", "Set to 'true' to score groups in parallel.", false);

        addArgument(parallel);

        threadPoolSize = new IntegerArgument(null, "--thread-pool-size",
                "Number of worker threads when scoring in parallel.",
                Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
                n -> checkArgument(n > 0, "thread pool size should be greater than 0"));

        addArgument(threadPoolSize);
    }

    private static boolean isMissingValuePolicy(String value) {
        return value != null && Arrays.stream(MissingValuePolicy.values())
                .anyMatch(p -> p.name().equalsIgnoreCase(value));
    }

    /**
     * Add a new argument to this argument parser.
     * 
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     * 
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file",
                ARCHIVE_NAME, runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     * 
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    public double getContamination() {
        return contamination.getValue();
    }

    public int getSizeThreshold() {
        return sizeThreshold.getValue();
    }

    public int getNumberOfTrees() {
        return numberOfTrees.getValue();
    }

    public int getSampleSize() {
        return sampleSize.getValue();
    }

    public int getRandomSeed() {
        return randomSeed.getValue();
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    /**
     * @return the label file path, or null if none was given
     */
    public String getLabelFile() {
        return labelFile.getValue();
    }

    public int getLimit() {
        return limit.getValue();
    }

    public MissingValuePolicy getMissingValuePolicy() {
        return MissingValuePolicy.valueOf(missingValues.getValue().toUpperCase(Locale.ROOT));
    }

    public GroupFailurePolicy getGroupFailurePolicy() {
        return skipFailedGroups.getValue() ? GroupFailurePolicy.SKIP_GROUP : GroupFailurePolicy.FAIL_FAST;
    }

    public boolean getParallel() {
        return parallel.getValue();
    }

    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
