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
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.amazon.rootcauseforest.tree.IsolationTree;

/**
 * An implementation of the forest operations that uses a private thread pool to
 * build trees and to evaluate points in parallel. Results are identical to
 * those of {@link SequentialForestExecutor} for the same seeds.
 */
public class ParallelForestExecutor extends AbstractForestExecutor {

    private final ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelForestExecutor(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public List<IsolationTree> buildTrees(double[][] data, int sampleSize, long[] seeds) {
        return submitAndJoin(() -> IntStream.range(0, seeds.length).parallel()
                .mapToObj(i -> IsolationTree.fit(data, sampleSize, seeds[i])).collect(Collectors.toList()));
    }

    @Override
    public double[] averagePathLengths(List<IsolationTree> trees, double[][] points) {
        return submitAndJoin(() -> IntStream.range(0, points.length).parallel()
                .mapToDouble(i -> averagePathLength(trees, points[i])).toArray());
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
