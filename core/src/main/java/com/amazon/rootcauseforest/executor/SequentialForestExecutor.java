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

import java.util.ArrayList;
import java.util.List;

import com.amazon.rootcauseforest.tree.IsolationTree;

/**
 * Builds and visits the trees one after another on the calling thread.
 */
public class SequentialForestExecutor extends AbstractForestExecutor {

    @Override
    public List<IsolationTree> buildTrees(double[][] data, int sampleSize, long[] seeds) {
        List<IsolationTree> trees = new ArrayList<>(seeds.length);
        for (long seed : seeds) {
            trees.add(IsolationTree.fit(data, sampleSize, seed));
        }
        return trees;
    }

    @Override
    public double[] averagePathLengths(List<IsolationTree> trees, double[][] points) {
        double[] answer = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            answer[i] = averagePathLength(trees, points[i]);
        }
        return answer;
    }
}
