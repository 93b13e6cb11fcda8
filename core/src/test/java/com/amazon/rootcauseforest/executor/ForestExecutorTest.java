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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.amazon.rootcauseforest.testutils.NormalMixtureTestData;
import com.amazon.rootcauseforest.tree.IsolationTree;

public class ForestExecutorTest {

    private static final int numberOfTrees = 20;
    private static final int sampleSize = 64;

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) throws Exception {
            return Stream.of(new SequentialForestExecutor(), new ParallelForestExecutor(1),
                    new ParallelForestExecutor(3)).map(Arguments::of);
        }
    }

    private static long[] seeds() {
        Random random = new Random(31);
        long[] seeds = new long[numberOfTrees];
        for (int i = 0; i < numberOfTrees; i++) {
            seeds[i] = random.nextLong();
        }
        return seeds;
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testBuildTrees(AbstractForestExecutor executor) {
        double[][] data = new NormalMixtureTestData().generateTestData(500, 3, 4L);
        long[] seeds = seeds();

        List<IsolationTree> trees = executor.buildTrees(data, sampleSize, seeds);

        assertEquals(numberOfTrees, trees.size());
        for (int i = 0; i < numberOfTrees; i++) {
            IsolationTree expected = IsolationTree.fit(data, sampleSize, seeds[i]);
            assertEquals(expected.getNodeCount(), trees.get(i).getNodeCount());
            for (double[] point : data) {
                assertEquals(expected.getPathLength(point), trees.get(i).getPathLength(point));
            }
        }
    }

    @Test
    public void testParallelMatchesSequential() {
        double[][] data = new NormalMixtureTestData().generateTestData(2000, 5, 8L);
        long[] seeds = seeds();
        SequentialForestExecutor sequential = new SequentialForestExecutor();
        ParallelForestExecutor parallel = new ParallelForestExecutor(4);

        List<IsolationTree> sequentialTrees = sequential.buildTrees(data, sampleSize, seeds);
        List<IsolationTree> parallelTrees = parallel.buildTrees(data, sampleSize, seeds);

        double[] expected = sequential.averagePathLengths(sequentialTrees, data);
        assertArrayEquals(expected, parallel.averagePathLengths(parallelTrees, data), 0.0);
        assertArrayEquals(expected, parallel.averagePathLengths(sequentialTrees, data), 0.0);
    }

    @Test
    public void testAveragePathLength() {
        double[][] data = { { 0.0 }, { 1.0 }, { 2.0 }, { 10.0 } };
        List<IsolationTree> trees = new SequentialForestExecutor().buildTrees(data, 4, seeds());
        double[] averages = new SequentialForestExecutor().averagePathLengths(trees, data);

        for (int i = 0; i < data.length; i++) {
            double sum = 0;
            for (IsolationTree tree : trees) {
                sum += tree.getPathLength(data[i]);
            }
            assertEquals(sum / trees.size(), averages[i], 1e-12);
        }
    }

    @Test
    public void testInvalidThreadPoolSize() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelForestExecutor(0));
    }
}
