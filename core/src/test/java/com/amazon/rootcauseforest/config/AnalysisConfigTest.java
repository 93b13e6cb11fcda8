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

package com.amazon.rootcauseforest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class AnalysisConfigTest {

    @Test
    public void testDefaults() {
        AnalysisConfig config = AnalysisConfig.builder().build();

        assertEquals(0.08, config.getContamination());
        assertEquals(100, config.getNumberOfTrees());
        assertEquals(256, config.getSampleSize());
        assertEquals(42L, config.getRandomSeed());
        assertFalse(config.isParallelExecutionEnabled());
        assertEquals(Duration.ofSeconds(15), config.getJoinTolerance());
        assertEquals(10, config.getTopErrorsLimit());
        assertEquals(TrainingFailurePolicy.ALL_NORMAL, config.getTrainingFailurePolicy());
        assertEquals(Arrays.asList("completed initialization", "application started", "service ready",
                "server started", "started successfully"), config.getIgnoreMessages());

        assertEquals(1000.0, config.getThreshold(ExceedanceMetric.LATENCY_P95_MS));
        assertEquals(0.85, config.getThreshold(ExceedanceMetric.CPU_USAGE));
        assertEquals(0.10, config.getThreshold(ExceedanceMetric.ERROR_RATE));
        assertEquals(0.85, config.getThreshold(ExceedanceMetric.JVM_HEAP_USAGE_RATIO));
        assertEquals(9.0, config.getThreshold(ExceedanceMetric.HIKARICP_ACTIVE));
    }

    @Test
    public void testOverrides() {
        AnalysisConfig config = AnalysisConfig.builder().contamination(0.2).numberOfTrees(10).sampleSize(64)
                .randomSeed(7).threshold(ExceedanceMetric.CPU_USAGE, 0.5).joinTolerance(Duration.ofSeconds(5))
                .ignoreMessages(Arrays.asList("Health Check OK")).topErrorsLimit(3)
                .trainingFailurePolicy(TrainingFailurePolicy.ABORT).build();

        assertEquals(0.2, config.getContamination());
        assertEquals(10, config.getNumberOfTrees());
        assertEquals(64, config.getSampleSize());
        assertEquals(7L, config.getRandomSeed());
        assertEquals(0.5, config.getThreshold(ExceedanceMetric.CPU_USAGE));
        assertEquals(1000.0, config.getThreshold(ExceedanceMetric.LATENCY_P95_MS));
        assertEquals(Duration.ofSeconds(5), config.getJoinTolerance());
        assertEquals(Arrays.asList("health check ok"), config.getIgnoreMessages());
        assertEquals(3, config.getTopErrorsLimit());
        assertEquals(TrainingFailurePolicy.ABORT, config.getTrainingFailurePolicy());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -0.1, 0.51, Double.NaN })
    public void testInvalidContamination(double contamination) {
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisConfig.builder().contamination(contamination).build());
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.builder().numberOfTrees(0).build());
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.builder().sampleSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.builder().threadPoolSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.builder().topErrorsLimit(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisConfig.builder().joinTolerance(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisConfig.builder().threshold(ExceedanceMetric.ERROR_RATE, Double.NaN).build());
        assertThrows(NullPointerException.class, () -> AnalysisConfig.builder().joinTolerance(null).build());
        assertThrows(NullPointerException.class, () -> AnalysisConfig.builder().ignoreMessages(null));
    }
}
