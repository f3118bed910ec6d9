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

import static com.amazon.anomalyscoring.CommonUtils.averagePathLength;
import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkContamination;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;
import static com.amazon.anomalyscoring.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import lombok.Getter;

import com.amazon.anomalyscoring.executor.AbstractTaskExecutor;
import com.amazon.anomalyscoring.tree.IsolationTree;
import com.amazon.anomalyscoring.util.ArrayUtils;

/**
 * An IsolationForest is an ensemble of {@link IsolationTree}s, each grown on a
 * random subsample (drawn without replacement) of a fixed set of points. A
 * point that the trees isolate after few cuts is likely an outlier.
 *
 * <p>
 * The forest is fit once and then queried. {@link #scoreSample(double[])}
 * returns {@code -2^(-E[h(x)] / c(psi))} where {@code E[h(x)]} is the mean
 * path length over the trees and {@code c(psi)} the average path length for
 * the subsample size; higher values are more normal. The binary prediction
 * compares that score to an offset, the {@code 100 * contamination}
 * percentile of the scores of the training points, so that about a
 * contamination fraction of the training points is flagged.
 *
 * <p>
 * Every tree draws its randomness from a seed taken in order from one master
 * {@link Random}, so a forest built with a fixed random seed is reproducible,
 * whether its trees are grown sequentially or in parallel.
 */
public class IsolationForest {

    /**
     * Default number of trees to use in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Default subsample size. Each tree is grown on at most this many points.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * Default expected fraction of outliers among the training points.
     */
    public static final double DEFAULT_CONTAMINATION = 0.01;

    /**
     * By default, trees are grown on the calling thread.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    @Getter
    private final int numberOfTrees;

    @Getter
    private final int sampleSize;

    @Getter
    private final double contamination;

    @Getter
    private final boolean parallelExecutionEnabled;

    @Getter
    private final int threadPoolSize;

    private final Random random;

    private final AbstractTaskExecutor executor;

    private List<IsolationTree> trees;

    /**
     * the subsample size actually used, the smaller of sampleSize and the number
     * of training points
     */
    @Getter
    private int subsampleSize;

    @Getter
    private int dimensions;

    /**
     * the score below which a point is an outlier; NaN until the forest is fit
     */
    @Getter
    private double offset = Double.NaN;

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected IsolationForest(Builder<?> builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 0, "sampleSize must be greater than 0");
        checkContamination(builder.contamination);
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        contamination = builder.contamination;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize.orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        random = builder.getRandom();
        executor = AbstractTaskExecutor.create(parallelExecutionEnabled, threadPoolSize);
    }

    /**
     * Grow the trees on the given points and compute the outlier offset. Fitting
     * again replaces the previous trees.
     *
     * @param points the training points, all of the same dimension with finite
     *               coordinates
     * @throws IllegalArgumentException if the points are empty, ragged or contain
     *                                  a non-finite coordinate
     */
    public void fit(double[][] points) {
        checkNotNull(points, "points must not be null");
        checkArgument(points.length > 0, "cannot fit on an empty set of points");
        checkNotNull(points[0], "point must not be null");
        int pointDimensions = points[0].length;
        checkArgument(pointDimensions > 0, "points must have at least one dimension");
        for (int i = 0; i < points.length; i++) {
            checkNotNull(points[i], "point must not be null");
            checkArgument(points[i].length == pointDimensions,
                    String.format("point %d has %d dimensions, expected %d", i, points[i].length, pointDimensions));
            for (double coordinate : points[i]) {
                checkArgument(Double.isFinite(coordinate),
                        String.format("isolation forest requires finite values, found %s in point %d", coordinate, i));
            }
        }

        dimensions = pointDimensions;
        subsampleSize = Math.min(sampleSize, points.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(subsampleSize, 2)) / Math.log(2.0));

        long[] seeds = new long[numberOfTrees];
        for (int i = 0; i < numberOfTrees; i++) {
            seeds[i] = random.nextLong();
        }
        List<Integer> treeIndexes = IntStream.range(0, numberOfTrees).boxed().collect(Collectors.toList());
        trees = executor.execute(treeIndexes, i -> growTree(points, seeds[i], maxDepth));

        offset = ArrayUtils.percentile(scoreSamples(points), 100.0 * contamination);
    }

    private IsolationTree growTree(double[][] points, long seed, int maxDepth) {
        Random treeRandom = new Random(seed);
        int[] indexes = IntStream.range(0, points.length).toArray();
        List<double[]> sample = new ArrayList<>(subsampleSize);
        for (int i = 0; i < subsampleSize; i++) {
            int j = i + treeRandom.nextInt(points.length - i);
            int swap = indexes[i];
            indexes[i] = indexes[j];
            indexes[j] = swap;
            sample.add(points[indexes[i]]);
        }
        return new IsolationTree(sample, maxDepth, treeRandom);
    }

    public boolean isFitted() {
        return trees != null;
    }

    /**
     * @param point a point of the fitted dimension
     * @return the sample score of the point, in [-1, 0); higher is more normal
     */
    public double scoreSample(double[] point) {
        checkState(isFitted(), "the forest must be fit before scoring");
        double total = 0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double meanPathLength = total / trees.size();
        double normalizer = averagePathLength(subsampleSize);
        double ratio = (normalizer > 0) ? meanPathLength / normalizer : 1.0;
        return -Math.pow(2.0, -ratio);
    }

    public double[] scoreSamples(double[][] points) {
        checkNotNull(points, "points must not be null");
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = scoreSample(points[i]);
        }
        return scores;
    }

    /**
     * @param point a point of the fitted dimension
     * @return the sample score shifted by the offset; negative for outliers
     */
    public double decisionFunction(double[] point) {
        return scoreSample(point) - offset;
    }

    /**
     * @param point a point of the fitted dimension
     * @return true if the forest predicts the point to be an outlier
     */
    public boolean isOutlier(double[] point) {
        return decisionFunction(point) < 0;
    }

    /**
     * Release the worker threads of parallel execution. The forest stays usable and
     * starts new threads when it next needs them.
     */
    public void shutdown() {
        executor.shutdown();
    }

    public static class Builder<T extends Builder<T>> {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private double contamination = DEFAULT_CONTAMINATION;
        private Optional<Long> randomSeed = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
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

        public IsolationForest build() {
            return new IsolationForest(this);
        }

        public Random getRandom() {
            // If a random seed was given, use it to create a new Random. Otherwise, call
            // the 0-argument constructor
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }
    }
}
