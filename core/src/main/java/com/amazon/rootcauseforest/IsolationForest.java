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

package com.amazon.rootcauseforest;

import static com.amazon.rootcauseforest.CommonUtils.averagePathLength;
import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;
import static com.amazon.rootcauseforest.CommonUtils.checkState;

import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import com.amazon.rootcauseforest.executor.AbstractForestExecutor;
import com.amazon.rootcauseforest.executor.ParallelForestExecutor;
import com.amazon.rootcauseforest.executor.SequentialForestExecutor;
import com.amazon.rootcauseforest.tree.IsolationTree;

/**
 * The IsolationForest class is an ensemble of {@link IsolationTree}s trained in
 * one batch on an unlabeled matrix. Each tree is built on an independent random
 * subsample. A point is scored by its path length averaged over the trees and
 * normalized by c(psi), the expected path length for the subsample size psi.
 * The anomaly score 2^(-normalized path length) lies in (0, 1] and grows as the
 * average path shrinks, so a point that is isolated after fewer cuts in every
 * tree always scores strictly higher.
 *
 * Every tree receives its own seed drawn from a generator seeded with the
 * forest seed, so sequential and parallel training give identical forests.
 */
@Getter
public class IsolationForest {

    /**
     * Default number of trees to use in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Default maximum subsample size of each tree.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * Parallel execution is not enabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;
    private final AbstractForestExecutor executor;

    private List<IsolationTree> trees = Collections.emptyList();
    /**
     * the subsample size actually used, at most the number of training rows
     */
    private int effectiveSampleSize;
    private int dimensions;

    protected IsolationForest(Builder builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 0, "sampleSize must be greater than 0");
        checkArgument(builder.threadPoolSize > 0, "threadPoolSize must be greater than 0");
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        randomSeed = builder.randomSeed;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize;
        executor = parallelExecutionEnabled ? new ParallelForestExecutor(threadPoolSize)
                : new SequentialForestExecutor();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Train the forest on the rows of the matrix, replacing any previous trees.
     *
     * @param data the training matrix; rows are points of equal dimension
     * @throws ModelTrainingException if the matrix is empty, ragged, contains
     *                                non-finite values, or if every column is
     *                                constant
     */
    public void fit(double[][] data) {
        checkNotNull(data, "data must not be null");
        validateTrainingData(data);

        Random rng = new Random(randomSeed);
        long[] seeds = new long[numberOfTrees];
        for (int i = 0; i < numberOfTrees; i++) {
            seeds[i] = rng.nextLong();
        }
        try {
            trees = Collections.unmodifiableList(executor.buildTrees(data, sampleSize, seeds));
        } catch (RuntimeException e) {
            throw new ModelTrainingException("failed to build isolation trees", e);
        }
        effectiveSampleSize = Math.min(sampleSize, data.length);
        dimensions = data[0].length;
    }

    private static void validateTrainingData(double[][] data) {
        if (data.length == 0) {
            throw new ModelTrainingException("cannot train on an empty matrix");
        }
        int columns = data[0].length;
        if (columns == 0) {
            throw new ModelTrainingException("cannot train on a matrix without columns");
        }
        boolean degenerate = true;
        for (double[] row : data) {
            if (row == null || row.length != columns) {
                throw new ModelTrainingException("training matrix rows must have equal length");
            }
            for (int j = 0; j < columns; j++) {
                if (!Double.isFinite(row[j])) {
                    throw new ModelTrainingException("training matrix contains a non-finite value in column " + j);
                }
                if (row[j] != data[0][j]) {
                    degenerate = false;
                }
            }
        }
        if (degenerate) {
            throw new ModelTrainingException(
                    "every column of the training matrix is constant across " + data.length + " rows");
        }
    }

    public boolean isFitted() {
        return !trees.isEmpty();
    }

    /**
     * @param point a point of the training dimension
     * @return the path length of the point averaged over all trees
     */
    public double getAveragePathLength(double[] point) {
        return getAveragePathLengths(new double[][] { point })[0];
    }

    public double[] getAveragePathLengths(double[][] points) {
        checkState(isFitted(), "forest has not been trained");
        checkNotNull(points, "points must not be null");
        for (double[] point : points) {
            checkArgument(point.length == dimensions, "incorrect dimensions");
        }
        return executor.averagePathLengths(trees, points);
    }

    /**
     * @return c(psi) for the subsample size psi the trees were built on
     */
    public double getNormalizer() {
        checkState(isFitted(), "forest has not been trained");
        return averagePathLength(effectiveSampleSize);
    }

    public double getAnomalyScore(double[] point) {
        return getAnomalyScores(new double[][] { point })[0];
    }

    /**
     * @param points points of the training dimension
     * @return the anomaly score 2^(-E[h]/c(psi)) of each point
     */
    public double[] getAnomalyScores(double[][] points) {
        double[] pathLengths = getAveragePathLengths(points);
        double normalizer = getNormalizer();
        double[] scores = new double[pathLengths.length];
        for (int i = 0; i < pathLengths.length; i++) {
            scores[i] = toAnomalyScore(pathLengths[i], normalizer);
        }
        return scores;
    }

    /**
     * @param averagePathLength average path length of a point
     * @param normalizer        c(psi)
     * @return 2^(-averagePathLength/normalizer)
     */
    public static double toAnomalyScore(double averagePathLength, double normalizer) {
        checkArgument(normalizer > 0, "normalizer must be positive");
        return Math.pow(2.0, -averagePathLength / normalizer);
    }

    public static class Builder {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private long randomSeed = new Random().nextLong();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private int threadPoolSize = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return this;
        }

        public IsolationForest build() {
            return new IsolationForest(this);
        }
    }
}
