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

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.Getter;

/**
 * The parameters of one analysis run. Instances are immutable and are created
 * with {@link #builder()}; every value has a default so that
 * {@code AnalysisConfig.builder().build()} is a valid configuration.
 */
@Getter
public class AnalysisConfig {

    /**
     * Default proportion of scored records that are flagged as anomalies.
     */
    public static final double DEFAULT_CONTAMINATION = 0.08;

    /**
     * Default number of isolation trees.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Default maximum number of records sampled for each tree.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    /**
     * Default maximum time gap between a log event and the metric snapshot it is
     * joined with.
     */
    public static final Duration DEFAULT_JOIN_TOLERANCE = Duration.ofSeconds(15);

    public static final int DEFAULT_TOP_ERRORS_LIMIT = 10;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    /**
     * Benign startup messages that are never scored.
     */
    public static final List<String> DEFAULT_IGNORE_MESSAGES = Collections.unmodifiableList(Arrays.asList(
            "completed initialization", "application started", "service ready", "server started",
            "started successfully"));

    public static final TrainingFailurePolicy DEFAULT_TRAINING_FAILURE_POLICY = TrainingFailurePolicy.ALL_NORMAL;

    private final double contamination;
    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;
    private final Map<ExceedanceMetric, Double> thresholds;
    private final Duration joinTolerance;
    private final List<String> ignoreMessages;
    private final int topErrorsLimit;
    private final TrainingFailurePolicy trainingFailurePolicy;

    private AnalysisConfig(Builder builder) {
        checkArgument(builder.contamination > 0 && builder.contamination <= 0.5,
                "contamination must be in (0, 0.5]");
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 0, "sampleSize must be greater than 0");
        checkArgument(builder.threadPoolSize > 0, "threadPoolSize must be greater than 0");
        checkNotNull(builder.joinTolerance, "joinTolerance must not be null");
        checkArgument(!builder.joinTolerance.isNegative(), "joinTolerance must not be negative");
        checkArgument(builder.topErrorsLimit >= 0, "topErrorsLimit must not be negative");
        checkNotNull(builder.trainingFailurePolicy, "trainingFailurePolicy must not be null");
        for (Map.Entry<ExceedanceMetric, Double> entry : builder.thresholds.entrySet()) {
            checkArgument(Double.isFinite(entry.getValue()),
                    "threshold for " + entry.getKey().getExternalName() + " must be finite");
        }

        contamination = builder.contamination;
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        randomSeed = builder.randomSeed;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize;
        thresholds = Collections.unmodifiableMap(new EnumMap<>(builder.thresholds));
        joinTolerance = builder.joinTolerance;
        List<String> lowered = new ArrayList<>();
        for (String message : builder.ignoreMessages) {
            checkNotNull(message, "ignore messages must not contain null");
            lowered.add(message.toLowerCase(Locale.ROOT));
        }
        ignoreMessages = Collections.unmodifiableList(lowered);
        topErrorsLimit = builder.topErrorsLimit;
        trainingFailurePolicy = builder.trainingFailurePolicy;
    }

    /**
     * @param metric an exceedance signal
     * @return the configured alert threshold of the signal
     */
    public double getThreshold(ExceedanceMetric metric) {
        return thresholds.get(metric);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private double contamination = DEFAULT_CONTAMINATION;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private int threadPoolSize = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        private final Map<ExceedanceMetric, Double> thresholds = new EnumMap<>(ExceedanceMetric.class);
        private Duration joinTolerance = DEFAULT_JOIN_TOLERANCE;
        private List<String> ignoreMessages = DEFAULT_IGNORE_MESSAGES;
        private int topErrorsLimit = DEFAULT_TOP_ERRORS_LIMIT;
        private TrainingFailurePolicy trainingFailurePolicy = DEFAULT_TRAINING_FAILURE_POLICY;

        private Builder() {
            for (ExceedanceMetric metric : ExceedanceMetric.values()) {
                thresholds.put(metric, metric.getDefaultThreshold());
            }
        }

        public Builder contamination(double contamination) {
            this.contamination = contamination;
            return this;
        }

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

        public Builder threshold(ExceedanceMetric metric, double threshold) {
            checkNotNull(metric, "metric must not be null");
            thresholds.put(metric, threshold);
            return this;
        }

        public Builder joinTolerance(Duration joinTolerance) {
            this.joinTolerance = joinTolerance;
            return this;
        }

        public Builder ignoreMessages(List<String> ignoreMessages) {
            this.ignoreMessages = checkNotNull(ignoreMessages, "ignoreMessages must not be null");
            return this;
        }

        public Builder topErrorsLimit(int topErrorsLimit) {
            this.topErrorsLimit = topErrorsLimit;
            return this;
        }

        public Builder trainingFailurePolicy(TrainingFailurePolicy trainingFailurePolicy) {
            this.trainingFailurePolicy = trainingFailurePolicy;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(this);
        }
    }
}
