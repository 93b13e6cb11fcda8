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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.rootcauseforest.feature.FeatureName;
import com.amazon.rootcauseforest.testutils.NormalMixtureTestData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class IsolationForestBenchmark {

    public final static int DATA_SIZE = 20_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "100" })
        int numberOfTrees;

        @Param({ "256" })
        int sampleSize;

        @Param({ "false", "true" })
        boolean parallel;

        double[][] data;
        IsolationForest forest;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData gen = new NormalMixtureTestData();
            data = gen.generateTestDataWithOutliers(DATA_SIZE, FeatureName.dimensions(), DATA_SIZE / 100, 17L)
                    .getData();
        }

        @Setup(Level.Invocation)
        public void setUpForest() {
            forest = IsolationForest.builder().numberOfTrees(numberOfTrees).sampleSize(sampleSize)
                    .parallelExecutionEnabled(parallel).randomSeed(99).build();
        }
    }

    @Benchmark
    public IsolationForest fitOnly(BenchmarkState state) {
        IsolationForest forest = state.forest;
        forest.fit(state.data);
        return forest;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public double[] fitAndScore(BenchmarkState state, Blackhole blackhole) {
        IsolationForest forest = state.forest;
        forest.fit(state.data);
        double[] scores = forest.getAnomalyScores(state.data);
        blackhole.consume(forest.getNormalizer());
        return scores;
    }
}
