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

package com.amazon.rootcauseforest.tree;

import static com.amazon.rootcauseforest.CommonUtils.averagePathLength;
import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * An isolation tree: a binary tree that partitions a subsample of points with
 * axis-parallel cuts chosen at random. Points that lie far from the bulk of the
 * data are separated after few cuts, so a short path from the root to the leaf
 * of a point indicates an outlier.
 *
 * Nodes are stored column-wise in arrays indexed by node id, with the root at
 * index 0. An internal node holds a cut dimension and a cut value; points with
 * a coordinate below the cut value go left, all others go right. A leaf holds the number of sample
 * points that reached it. The tree is grown from an explicit work-list of
 * (node, slice of the sample, depth) rather than by recursion.
 */
public class IsolationTree {

    public static final int NULL = -1;

    /**
     * number of attempts at drawing a cut value strictly above the minimum before
     * falling back to the midpoint of the range
     */
    static final int MAX_CUT_ATTEMPTS = 16;

    private final int sampleSize;
    private final int maxDepth;
    private final int dimensions;
    private final int[] leftIndex;
    private final int[] rightIndex;
    private final int[] cutDimension;
    private final double[] cutValue;
    private final int[] mass;
    private int nodeCount;

    private IsolationTree(int sampleSize, int dimensions) {
        this.sampleSize = sampleSize;
        this.dimensions = dimensions;
        this.maxDepth = maxDepth(sampleSize);
        int capacity = Math.max(1, 2 * sampleSize - 1);
        leftIndex = new int[capacity];
        rightIndex = new int[capacity];
        cutDimension = new int[capacity];
        cutValue = new double[capacity];
        mass = new int[capacity];
    }

    /**
     * Draws a subsample of the rows of the data without replacement and builds a
     * tree on it.
     *
     * @param data       the training matrix, rows are points
     * @param sampleSize the maximum subsample size; all rows are used if there are
     *                   fewer
     * @param seed       the seed of the generator that drives both the subsample
     *                   and the cuts
     * @return the tree
     */
    public static IsolationTree fit(double[][] data, int sampleSize, long seed) {
        checkNotNull(data, "data must not be null");
        checkArgument(data.length > 0, "cannot build a tree on an empty matrix");
        checkArgument(sampleSize > 0, "sampleSize must be greater than 0");
        Random rng = new Random(seed);
        int[] rows = subsample(data.length, Math.min(sampleSize, data.length), rng);
        return build(data, rows, rng);
    }

    /**
     * Builds a tree on the given rows of the data.
     *
     * @param data the training matrix
     * @param rows indices of the rows forming the sample
     * @param rng  the generator for the cuts
     * @return the tree
     */
    public static IsolationTree build(double[][] data, int[] rows, Random rng) {
        checkNotNull(data, "data must not be null");
        checkNotNull(rows, "rows must not be null");
        checkNotNull(rng, "rng must not be null");
        checkArgument(rows.length > 0, "cannot build a tree on an empty sample");
        int dimensions = data[rows[0]].length;
        IsolationTree tree = new IsolationTree(rows.length, dimensions);
        tree.grow(data, rows.clone(), rng);
        return tree;
    }

    /**
     * @param sampleSize number of points a tree is built on
     * @return the depth limit ceil(log2(sampleSize))
     */
    public static int maxDepth(int sampleSize) {
        if (sampleSize <= 1) {
            return 0;
        }
        return 32 - Integer.numberOfLeadingZeros(sampleSize - 1);
    }

    static int[] subsample(int populationSize, int sampleSize, Random rng) {
        int[] indices = new int[populationSize];
        for (int i = 0; i < populationSize; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < sampleSize; i++) {
            int j = i + rng.nextInt(populationSize - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] answer = new int[sampleSize];
        System.arraycopy(indices, 0, answer, 0, sampleSize);
        return answer;
    }

    private void grow(double[][] data, int[] order, Random rng) {
        nodeCount = 1;
        Deque<int[]> workList = new ArrayDeque<>();
        // node, start (inclusive), end (exclusive), depth
        workList.push(new int[] { 0, 0, order.length, 0 });
        double[] min = new double[dimensions];
        double[] max = new double[dimensions];
        int[] candidates = new int[dimensions];

        while (!workList.isEmpty()) {
            int[] item = workList.pop();
            int node = item[0];
            int start = item[1];
            int end = item[2];
            int depth = item[3];
            int size = end - start;

            if (size <= 1 || depth >= maxDepth) {
                makeLeaf(node, size);
                continue;
            }

            int numberOfCandidates = rangeOf(data, order, start, end, min, max, candidates);
            if (numberOfCandidates == 0) {
                makeLeaf(node, size);
                continue;
            }

            int dimension = candidates[rng.nextInt(numberOfCandidates)];
            double value = drawCutValue(min[dimension], max[dimension], rng);
            int middle = partition(data, order, start, end, dimension, value);

            int left = nodeCount++;
            int right = nodeCount++;
            leftIndex[node] = left;
            rightIndex[node] = right;
            cutDimension[node] = dimension;
            cutValue[node] = value;
            mass[node] = size;

            workList.push(new int[] { right, middle, end, depth + 1 });
            workList.push(new int[] { left, start, middle, depth + 1 });
        }
    }

    private void makeLeaf(int node, int size) {
        leftIndex[node] = NULL;
        rightIndex[node] = NULL;
        cutDimension[node] = NULL;
        mass[node] = size;
    }

    /**
     * Computes the range of every dimension over a slice of the sample and records
     * the dimensions whose range is not degenerate.
     */
    private int rangeOf(double[][] data, int[] order, int start, int end, double[] min, double[] max,
            int[] candidates) {
        for (int j = 0; j < dimensions; j++) {
            min[j] = Double.POSITIVE_INFINITY;
            max[j] = Double.NEGATIVE_INFINITY;
        }
        for (int i = start; i < end; i++) {
            double[] point = data[order[i]];
            for (int j = 0; j < dimensions; j++) {
                if (point[j] < min[j]) {
                    min[j] = point[j];
                }
                if (point[j] > max[j]) {
                    max[j] = point[j];
                }
            }
        }
        int count = 0;
        for (int j = 0; j < dimensions; j++) {
            if (max[j] > min[j]) {
                candidates[count++] = j;
            }
        }
        return count;
    }

    /**
     * Draws a value uniformly from [min, max), rejecting min itself so that both
     * sides of the cut receive at least one point.
     */
    static double drawCutValue(double min, double max, Random rng) {
        for (int attempt = 0; attempt < MAX_CUT_ATTEMPTS; attempt++) {
            double value = min + rng.nextDouble() * (max - min);
            if (value > min && value <= max) {
                return value;
            }
        }
        double middle = min + (max - min) / 2;
        return (middle > min) ? middle : max;
    }

    /**
     * Reorders the slice so that points below the cut value come first.
     *
     * @return the index of the first point at or above the cut value
     */
    private static int partition(double[][] data, int[] order, int start, int end, int dimension, double value) {
        int i = start;
        int j = end - 1;
        while (i <= j) {
            if (data[order[i]][dimension] < value) {
                i++;
            } else {
                int tmp = order[i];
                order[i] = order[j];
                order[j] = tmp;
                j--;
            }
        }
        return i;
    }

    public boolean isLeaf(int node) {
        return leftIndex[node] == NULL;
    }

    /**
     * @param point a point of the same dimension as the training data
     * @return the id of the leaf the point falls into
     */
    public int getLeaf(double[] point) {
        checkArgument(point.length == dimensions, "incorrect dimensions");
        int node = 0;
        while (!isLeaf(node)) {
            node = isLeftOf(point, node) ? leftIndex[node] : rightIndex[node];
        }
        return node;
    }

    /**
     * @param point a point
     * @return the number of edges from the root to the leaf of the point
     */
    public int getDepth(double[] point) {
        checkArgument(point.length == dimensions, "incorrect dimensions");
        int node = 0;
        int depth = 0;
        while (!isLeaf(node)) {
            node = isLeftOf(point, node) ? leftIndex[node] : rightIndex[node];
            depth++;
        }
        return depth;
    }

    /**
     * The path length of a point: the depth of its leaf plus the expected path
     * length c(m) of the m sample points that remained unseparated in that leaf.
     *
     * @param point a point
     * @return the corrected path length
     */
    public double getPathLength(double[] point) {
        return getDepth(point) + averagePathLength(mass[getLeaf(point)]);
    }

    /**
     * @param point a point
     * @param node  an internal node
     * @return true if the point goes to the left child of the node
     */
    public boolean isLeftOf(double[] point, int node) {
        return point[cutDimension[node]] < cutValue[node];
    }

    public int getCutDimension(int node) {
        checkArgument(!isLeaf(node), "leaves have no cut");
        return cutDimension[node];
    }

    public double getCutValue(int node) {
        checkArgument(!isLeaf(node), "leaves have no cut");
        return cutValue[node];
    }

    public int getMass(int node) {
        checkArgument(node >= 0 && node < nodeCount, "node out of range");
        return mass[node];
    }

    public int getLeftChild(int node) {
        return leftIndex[node];
    }

    public int getRightChild(int node) {
        return rightIndex[node];
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getDimensions() {
        return dimensions;
    }
}
