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

package com.amazon.anomalyscoring.tree;

import static com.amazon.anomalyscoring.CommonUtils.averagePathLength;
import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import lombok.Getter;

/**
 * An isolation tree is grown by recursively cutting a sample of points at
 * uniformly random positions until every point is alone, the points of a node
 * are identical, or the maximum depth is reached. Points that are easy to
 * separate from the rest end up in shallow leaves.
 */
public class IsolationTree {

    private final Node root;

    /**
     * the depth at which growth stops
     */
    @Getter
    private final int maxDepth;

    /**
     * the number of points the tree was grown on
     */
    @Getter
    private final int mass;

    @Getter
    private final int dimensions;

    /**
     * Grow a tree on the given sample.
     *
     * @param points   the sample, all of the same dimension and with finite
     *                 coordinates
     * @param maxDepth depth at which nodes become leaves
     * @param random   source of the cut dimensions and positions
     */
    public IsolationTree(List<double[]> points, int maxDepth, Random random) {
        checkNotNull(points, "points must not be null");
        checkNotNull(random, "random must not be null");
        checkArgument(!points.isEmpty(), "cannot grow a tree on an empty sample");
        checkArgument(maxDepth >= 0, "maxDepth cannot be negative");
        this.maxDepth = maxDepth;
        this.mass = points.size();
        this.dimensions = points.get(0).length;
        this.root = grow(points, 0, random);
    }

    /**
     * The isolation depth of a point: the number of cuts on its path plus the
     * expected further depth of the leaf it lands in, given the number of sample
     * points that were left unseparated in that leaf.
     *
     * @param point a point of the tree's dimension
     * @return the path length
     */
    public double pathLength(double[] point) {
        checkNotNull(point, "point must not be null");
        checkArgument(point.length == dimensions, "point has the wrong dimension");
        Node node = root;
        int depth = 0;
        while (node.cut != null) {
            node = Cut.isLeftOf(point, node.cut) ? node.left : node.right;
            ++depth;
        }
        return depth + averagePathLength(node.mass);
    }

    private Node grow(List<double[]> points, int depth, Random random) {
        if (depth >= maxDepth || points.size() <= 1) {
            return new Node(points.size());
        }

        double[] min = points.get(0).clone();
        double[] max = points.get(0).clone();
        for (double[] point : points) {
            for (int i = 0; i < dimensions; i++) {
                min[i] = Math.min(min[i], point[i]);
                max[i] = Math.max(max[i], point[i]);
            }
        }

        // only dimensions with spread can separate anything
        int[] candidates = new int[dimensions];
        int count = 0;
        for (int i = 0; i < dimensions; i++) {
            if (max[i] > min[i]) {
                candidates[count++] = i;
            }
        }
        if (count == 0) {
            return new Node(points.size());
        }

        int dimension = candidates[random.nextInt(count)];
        Cut cut = new Cut(dimension, min[dimension] + random.nextDouble() * (max[dimension] - min[dimension]));

        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] point : points) {
            if (Cut.isLeftOf(point, cut)) {
                left.add(point);
            } else {
                right.add(point);
            }
        }
        return new Node(cut, grow(left, depth + 1, random), grow(right, depth + 1, random));
    }

    private static class Node {
        final Cut cut;
        final Node left;
        final Node right;
        final int mass;

        Node(int mass) {
            this.cut = null;
            this.left = null;
            this.right = null;
            this.mass = mass;
        }

        Node(Cut cut, Node left, Node right) {
            this.cut = cut;
            this.left = left;
            this.right = right;
            this.mass = left.mass + right.mass;
        }
    }
}
