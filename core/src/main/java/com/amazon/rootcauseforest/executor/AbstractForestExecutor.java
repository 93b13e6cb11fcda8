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

package com.amazon.rootcauseforest.executor;

import java.util.List;

import com.amazon.rootcauseforest.tree.IsolationTree;

/**
 * Builds the trees of a forest and evaluates points against them. Every tree is
 * driven by its own seed and shares no mutable state with any other tree, so
 * implementations may build and visit trees in any order without changing the
 * result.
 */
public abstract class AbstractForestExecutor {

    /**
     * Build one tree per seed on subsamples of the data.
     *
     * @param data       the training matrix
     * @param sampleSize the maximum subsample size of each tree
     * @param seeds      one seed per tree
     * @return the trees, in the order of the seeds
     */
    public abstract List<IsolationTree> buildTrees(double[][] data, int sampleSize, long[] seeds);

    /**
     * Compute the path length of every point averaged over all trees.
     *
     * @param trees  a non-empty list of trees
     * @param points the points to evaluate
     * @return the average path length of each point, in the order of the points
     */
    public abstract double[] averagePathLengths(List<IsolationTree> trees, double[][] points);

    protected static double averagePathLength(List<IsolationTree> trees, double[] point) {
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.getPathLength(point);
        }
        return sum / trees.size();
    }
}
