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

package com.amazon.rootcauseforest.runner;

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.rootcauseforest.config.AnalysisConfig;
import com.amazon.rootcauseforest.config.ExceedanceMetric;
import com.amazon.rootcauseforest.config.TrainingFailurePolicy;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/rootcauseforest-runner-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument logs;
    private final StringArgument metrics;
    private final StringArgument output;
    private final IntegerArgument numberOfTrees;
    private final IntegerArgument sampleSize;
    private final DoubleArgument contamination;
    private final LongArgument randomSeed;
    private final BooleanArgument parallelExecutionEnabled;
    private final IntegerArgument threadPoolSize;
    private final LongArgument joinToleranceSeconds;
    private final Map<ExceedanceMetric, DoubleArgument> thresholds;
    private final StringArgument ignoreMessages;
    private final IntegerArgument topErrors;
    private final Argument<TrainingFailurePolicy> trainingFailurePolicy;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new LinkedHashMap<>();
        longFlags = new LinkedHashMap<>();

        logs = new StringArgument("-l", "--logs", "Log dump file, or directory of per-service log dumps.",
                "ops/logs");
        addArgument(logs);

        metrics = new StringArgument("-m", "--metrics",
                "Metric dump file, or directory of per-service metric dumps. Analysis continues without metrics "
                        + "if the path does not exist.",
                "ops/metrics");
        addArgument(metrics);

        output = new StringArgument("-o", "--output", "File the JSON report is written to.", "aiops_report.json");
        addArgument(output);

        numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees to use in the forest.",
                AnalysisConfig.DEFAULT_NUMBER_OF_TREES,
                n -> checkArgument(n > 0, "number of trees should be greater than 0"));
        addArgument(numberOfTrees);

        sampleSize = new IntegerArgument("-s", "--sample-size", "Number of records sampled for each tree.",
                AnalysisConfig.DEFAULT_SAMPLE_SIZE, n -> checkArgument(n > 0, "sample size should be greater than 0"));
        addArgument(sampleSize);

        contamination = new DoubleArgument("-c", "--contamination",
                "Proportion of scored records flagged as anomalies.", AnalysisConfig.DEFAULT_CONTAMINATION,
                x -> checkArgument(x > 0 && x <= 0.5, "contamination should be in (0, 0.5]"));
        addArgument(contamination);

        randomSeed = new LongArgument(null, "--random-seed", "Random seed to use in the isolation forest.",
                AnalysisConfig.DEFAULT_RANDOM_SEED);
        addArgument(randomSeed);

        parallelExecutionEnabled = new BooleanArgument(null, "--parallel-execution-enabled",
                "Set to 'true' to build and score the trees in parallel.",
                AnalysisConfig.DEFAULT_PARALLEL_EXECUTION_ENABLED);
        addArgument(parallelExecutionEnabled);

        threadPoolSize = new IntegerArgument(null, "--thread-pool-size",
                "Number of threads used when parallel execution is enabled.",
                Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
                n -> checkArgument(n > 0, "thread pool size should be greater than 0"));
        addArgument(threadPoolSize);

        joinToleranceSeconds = new LongArgument("-t", "--join-tolerance-seconds",
                "Maximum distance in seconds between a log event and the metrics it is joined with.",
                AnalysisConfig.DEFAULT_JOIN_TOLERANCE.getSeconds(),
                n -> checkArgument(n >= 0, "join tolerance should not be negative"));
        addArgument(joinToleranceSeconds);

        thresholds = new LinkedHashMap<>();
        for (ExceedanceMetric metric : ExceedanceMetric.values()) {
            DoubleArgument threshold = new DoubleArgument(null,
                    "--" + metric.getExternalName().replace('_', '-') + "-threshold",
                    "Alert threshold of " + metric.getExternalName() + ".", metric.getDefaultThreshold());
            thresholds.put(metric, threshold);
            addArgument(threshold);
        }

        ignoreMessages = new StringArgument(null, "--ignore-messages",
                "Comma separated phrases of benign messages that are never scored.",
                String.join(",", AnalysisConfig.DEFAULT_IGNORE_MESSAGES));
        addArgument(ignoreMessages);

        topErrors = new IntegerArgument(null, "--top-errors", "Number of most frequent anomalous messages reported.",
                AnalysisConfig.DEFAULT_TOP_ERRORS_LIMIT,
                n -> checkArgument(n >= 0, "top errors should not be negative"));
        addArgument(topErrors);

        trainingFailurePolicy = new Argument<>(null, "--training-failure-policy",
                "ABORT or ALL_NORMAL; what to do when the isolation forest cannot be trained.",
                AnalysisConfig.DEFAULT_TRAINING_FAILURE_POLICY,
                x -> TrainingFailurePolicy.valueOf(x.trim().toUpperCase(Locale.ROOT)));
        addArgument(trainingFailurePolicy);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options]", ARCHIVE_NAME, runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the analysis configuration described by the parsed arguments
     */
    public AnalysisConfig toAnalysisConfig() {
        AnalysisConfig.Builder builder = AnalysisConfig.builder().numberOfTrees(getNumberOfTrees())
                .sampleSize(getSampleSize()).contamination(getContamination()).randomSeed(getRandomSeed())
                .parallelExecutionEnabled(getParallelExecutionEnabled()).threadPoolSize(getThreadPoolSize())
                .joinTolerance(getJoinTolerance()).ignoreMessages(getIgnoreMessages()).topErrorsLimit(getTopErrors())
                .trainingFailurePolicy(getTrainingFailurePolicy());
        for (ExceedanceMetric metric : ExceedanceMetric.values()) {
            builder.threshold(metric, getThreshold(metric));
        }
        return builder.build();
    }

    public String getLogs() {
        return logs.getValue();
    }

    public String getMetrics() {
        return metrics.getValue();
    }

    public String getOutput() {
        return output.getValue();
    }

    /**
     * @return the user-specified value of the number-of-trees parameter.
     */
    public int getNumberOfTrees() {
        return numberOfTrees.getValue();
    }

    /**
     * @return the user-specified value of the sample-size parameter.
     */
    public int getSampleSize() {
        return sampleSize.getValue();
    }

    public double getContamination() {
        return contamination.getValue();
    }

    /**
     * @return the user-specified value of the random-seed parameter
     */
    public long getRandomSeed() {
        return randomSeed.getValue();
    }

    public boolean getParallelExecutionEnabled() {
        return parallelExecutionEnabled.getValue();
    }

    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    public Duration getJoinTolerance() {
        return Duration.ofSeconds(joinToleranceSeconds.getValue());
    }

    public double getThreshold(ExceedanceMetric metric) {
        return thresholds.get(metric).getValue();
    }

    /**
     * @return the ignored phrases, without surrounding whitespace or empty
     *         entries
     */
    public List<String> getIgnoreMessages() {
        List<String> phrases = new ArrayList<>();
        for (String phrase : Arrays.asList(ignoreMessages.getValue().split(","))) {
            if (!phrase.trim().isEmpty()) {
                phrases.add(phrase.trim());
            }
        }
        return phrases;
    }

    public int getTopErrors() {
        return topErrors.getValue();
    }

    public TrainingFailurePolicy getTrainingFailurePolicy() {
        return trainingFailurePolicy.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }
    }

    public static class LongArgument extends Argument<Long> {
        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue,
                Consumer<Long> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Long::parseLong, validateFunction);
        }

        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Long::parseLong);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
