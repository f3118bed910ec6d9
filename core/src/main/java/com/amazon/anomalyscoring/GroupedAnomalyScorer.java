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

package com.amazon.anomalyscoring;

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkContamination;
import static com.amazon.anomalyscoring.CommonUtils.checkInput;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyscoring.anomalydetection.IGroupDetector;
import com.amazon.anomalyscoring.anomalydetection.IsolationForestDetector;
import com.amazon.anomalyscoring.anomalydetection.ZScoreDetector;
import com.amazon.anomalyscoring.config.DetectionMethod;
import com.amazon.anomalyscoring.config.GroupFailurePolicy;
import com.amazon.anomalyscoring.config.MissingValuePolicy;
import com.amazon.anomalyscoring.executor.AbstractTaskExecutor;
import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.inputtypes.ObservationGroup;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.returntypes.ScoringResult;
import com.amazon.anomalyscoring.util.ArrayUtils;

/**
 * The GroupedAnomalyScorer flags anomalous values in a batch of observations.
 * The batch is partitioned by group key; each group is scored on its own with a
 * detection method chosen from its size: groups smaller than the size
 * threshold are scored with a z-score, larger ones with an isolation forest.
 * Every observation comes back exactly once, tagged with its score, its flag
 * and the method that produced them.
 *
 * <p>
 * When the batch holds at most one distinct non-null group key the whole batch
 * is a single group, including observations that have no key.
 *
 * <p>
 * Scoring performs no I/O and keeps no state between calls. Groups are
 * independent and may be scored in parallel; the per-group results are
 * concatenated in group order.
 */
public class GroupedAnomalyScorer {

    private static final Logger logger = LogManager.getLogger(GroupedAnomalyScorer.class);

    /**
     * Default expected fraction of anomalies per group.
     */
    public static final double DEFAULT_CONTAMINATION = IsolationForest.DEFAULT_CONTAMINATION;

    /**
     * Groups with fewer observations than this are scored with a z-score.
     */
    public static final int DEFAULT_SIZE_THRESHOLD = 10;

    /**
     * Default seed of the isolation forests, fixed so that runs are reproducible.
     */
    public static final long DEFAULT_RANDOM_SEED = 42L;

    public static final MissingValuePolicy DEFAULT_MISSING_VALUE_POLICY = MissingValuePolicy.PROPAGATE;

    public static final GroupFailurePolicy DEFAULT_GROUP_FAILURE_POLICY = GroupFailurePolicy.FAIL_FAST;

    @Getter
    private final double contamination;

    @Getter
    private final int sizeThreshold;

    @Getter
    private final MissingValuePolicy missingValuePolicy;

    @Getter
    private final GroupFailurePolicy groupFailurePolicy;

    @Getter
    private final boolean parallelExecutionEnabled;

    private final Map<DetectionMethod, IGroupDetector> detectors;

    private final AbstractTaskExecutor executor;

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected GroupedAnomalyScorer(Builder<?> builder) {
        this(builder, new ZScoreDetector(builder.zScoreThreshold),
                new IsolationForestDetector(builder.numberOfTrees, builder.sampleSize, builder.randomSeed));
    }

    GroupedAnomalyScorer(Builder<?> builder, IGroupDetector zScoreDetector, IGroupDetector isolationForestDetector) {
        checkContamination(builder.contamination);
        checkArgument(builder.sizeThreshold > 0, "sizeThreshold must be greater than 0");
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 0, "sampleSize must be greater than 0");
        checkNotNull(builder.missingValuePolicy, "missingValuePolicy must not be null");
        checkNotNull(builder.groupFailurePolicy, "groupFailurePolicy must not be null");

        contamination = builder.contamination;
        sizeThreshold = builder.sizeThreshold;
        missingValuePolicy = builder.missingValuePolicy;
        groupFailurePolicy = builder.groupFailurePolicy;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;

        detectors = new EnumMap<>(DetectionMethod.class);
        detectors.put(DetectionMethod.ZSCORE, checkNotNull(zScoreDetector, "zScoreDetector must not be null"));
        detectors.put(DetectionMethod.ISOLATION_FOREST,
                checkNotNull(isolationForestDetector, "isolationForestDetector must not be null"));

        int threadPoolSize = builder.threadPoolSize
                .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        executor = AbstractTaskExecutor.create(parallelExecutionEnabled, threadPoolSize);
    }

    /**
     * Score a batch with the configured contamination.
     *
     * @param observations the batch
     * @return one scored observation per input observation, grouped by group key
     * @throws InvalidInputException if the batch is malformed
     * @throws ModelFitException     if a group cannot be scored and the failure
     *                               policy is fail-fast
     */
    public List<ScoredObservation> score(List<Observation> observations) {
        return scoreBatch(observations, contamination).getScoredObservations();
    }

    /**
     * Score a batch.
     *
     * @param observations  the batch
     * @param contamination expected fraction of anomalies per group, in (0, 1]
     * @return one scored observation per input observation, grouped by group key
     * @throws InvalidInputException if the contamination is out of range or the
     *                               batch is malformed
     * @throws ModelFitException     if a group cannot be scored and the failure
     *                               policy is fail-fast
     */
    public List<ScoredObservation> score(List<Observation> observations, double contamination) {
        return scoreBatch(observations, contamination).getScoredObservations();
    }

    public ScoringResult scoreBatch(List<Observation> observations) {
        return scoreBatch(observations, contamination);
    }

    /**
     * Score a batch and report skipped groups alongside the results. Under the
     * skip policy the observations of a failed group are absent from the scored
     * observations and the failure is listed instead.
     *
     * @param observations  the batch
     * @param contamination expected fraction of anomalies per group, in (0, 1]
     * @return the scored observations and the group failures
     */
    public ScoringResult scoreBatch(List<Observation> observations, double contamination) {
        checkContamination(contamination);
        checkInput(observations != null, "observations must not be null");
        validate(observations);
        if (observations.isEmpty()) {
            return ScoringResult.empty();
        }

        double[] values = resolveValues(observations);
        List<ObservationGroup> groups = partition(observations, values);
        logger.debug("Scoring {} observations in {} groups", observations.size(), groups.size());

        List<GroupOutcome> outcomes = executor.execute(groups, group -> scoreGroup(group, contamination));

        List<ScoredObservation> scored = new ArrayList<>(observations.size());
        List<ModelFitException> failures = new ArrayList<>();
        for (GroupOutcome outcome : outcomes) {
            if (outcome.failure != null) {
                if (groupFailurePolicy == GroupFailurePolicy.FAIL_FAST) {
                    throw outcome.failure;
                }
                logger.warn("Skipping group {} ({} rows) after a failed model fit", outcome.group.getLabel(),
                        outcome.group.size(), outcome.failure);
                failures.add(outcome.failure);
            } else {
                scored.addAll(outcome.scored);
            }
        }
        return new ScoringResult(scored, failures);
    }

    private GroupOutcome scoreGroup(ObservationGroup group, double contamination) {
        DetectionMethod method = DetectionMethod.forGroupSize(group.size(), sizeThreshold);
        logger.debug("Group {} has {} rows, using {}", group.getLabel(), group.size(), method.getLabel());
        try {
            return new GroupOutcome(group, detectors.get(method).detect(group, contamination), null);
        } catch (ModelFitException e) {
            return new GroupOutcome(group, null, e);
        }
    }

    private void validate(List<Observation> observations) {
        Set<Long> ids = new HashSet<>();
        for (Observation observation : observations) {
            checkInput(observation != null, "observations must not contain null");
            checkInput(observation.getId() >= 0,
                    String.format("observation id must not be negative, found %d", observation.getId()));
            checkInput(ids.add(observation.getId()),
                    String.format("observation id %d appears more than once", observation.getId()));
            checkInput(observation.isValueMissing() || Double.isFinite(observation.getValue()),
                    String.format("observation %d has a non-finite value %s", observation.getId(),
                            observation.getValue()));
            checkInput(missingValuePolicy != MissingValuePolicy.REJECT || !observation.isValueMissing(),
                    String.format("observation %d has a missing value", observation.getId()));
        }
    }

    /**
     * Applies the missing value policy once for the whole batch.
     *
     * @return the values to score, in observation order; NaN stands for missing
     */
    double[] resolveValues(List<Observation> observations) {
        double[] values = observations.stream().mapToDouble(Observation::getValueOrNaN).toArray();
        if (missingValuePolicy == MissingValuePolicy.IMPUTE_MEDIAN) {
            int missing = values.length - ArrayUtils.countPresent(values);
            if (missing > 0) {
                double median = ArrayUtils.nanMedian(values);
                checkInput(!Double.isNaN(median), "cannot impute missing values, the batch has no values");
                for (int i = 0; i < values.length; i++) {
                    if (Double.isNaN(values[i])) {
                        values[i] = median;
                    }
                }
                logger.debug("Imputed {} missing values with the batch median {}", missing, median);
            }
        }
        return values;
    }

    /**
     * Partition the batch by group key, keeping the first-seen order of keys and
     * the input order within each group. A batch with at most one distinct
     * non-null key is returned as one group under that key, rows without a key
     * included.
     */
    static List<ObservationGroup> partition(List<Observation> observations, double[] values) {
        Set<String> keys = new LinkedHashSet<>();
        for (Observation observation : observations) {
            if (observation.getGroupKey() != null) {
                keys.add(observation.getGroupKey());
            }
        }
        if (keys.size() <= 1) {
            String key = keys.isEmpty() ? null : keys.iterator().next();
            return Collections.singletonList(new ObservationGroup(key, new ArrayList<>(observations), values));
        }

        Map<String, List<Integer>> indexesByKey = new LinkedHashMap<>();
        for (int i = 0; i < observations.size(); i++) {
            indexesByKey.computeIfAbsent(observations.get(i).getGroupKey(), k -> new ArrayList<>()).add(i);
        }

        List<ObservationGroup> groups = new ArrayList<>(indexesByKey.size());
        for (Map.Entry<String, List<Integer>> entry : indexesByKey.entrySet()) {
            List<Integer> indexes = entry.getValue();
            List<Observation> members = new ArrayList<>(indexes.size());
            double[] memberValues = new double[indexes.size()];
            for (int j = 0; j < indexes.size(); j++) {
                members.add(observations.get(indexes.get(j)));
                memberValues[j] = values[indexes.get(j)];
            }
            groups.add(new ObservationGroup(entry.getKey(), members, memberValues));
        }
        return groups;
    }

    private static class GroupOutcome {
        final ObservationGroup group;
        final List<ScoredObservation> scored;
        final ModelFitException failure;

        GroupOutcome(ObservationGroup group, List<ScoredObservation> scored, ModelFitException failure) {
            this.group = group;
            this.scored = scored;
            this.failure = failure;
        }
    }

    /**
     * Release the worker threads of parallel execution. The scorer stays usable and
     * starts new threads when it next needs them.
     */
    public void shutdown() {
        executor.shutdown();
    }

    public static class Builder<T extends Builder<T>> {

        private double contamination = DEFAULT_CONTAMINATION;
        private int sizeThreshold = DEFAULT_SIZE_THRESHOLD;
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = IsolationForest.DEFAULT_SAMPLE_SIZE;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private double zScoreThreshold = ZScoreDetector.DEFAULT_THRESHOLD;
        private MissingValuePolicy missingValuePolicy = DEFAULT_MISSING_VALUE_POLICY;
        private GroupFailurePolicy groupFailurePolicy = DEFAULT_GROUP_FAILURE_POLICY;
        private boolean parallelExecutionEnabled = false;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T sizeThreshold(int sizeThreshold) {
            this.sizeThreshold = sizeThreshold;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        public T zScoreThreshold(double zScoreThreshold) {
            this.zScoreThreshold = zScoreThreshold;
            return (T) this;
        }

        public T missingValuePolicy(MissingValuePolicy missingValuePolicy) {
            this.missingValuePolicy = missingValuePolicy;
            return (T) this;
        }

        public T groupFailurePolicy(GroupFailurePolicy groupFailurePolicy) {
            this.groupFailurePolicy = groupFailurePolicy;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public GroupedAnomalyScorer build() {
            return new GroupedAnomalyScorer(this);
        }
    }
}
