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

package com.amazon.rootcauseforest.feature;

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;
import static com.amazon.rootcauseforest.CommonUtils.safeDivide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.amazon.rootcauseforest.config.ExceedanceMetric;
import com.amazon.rootcauseforest.config.MetricName;
import com.amazon.rootcauseforest.model.EnrichedRecord;

/**
 * Derives the fixed-order {@link FeatureVector} of an enriched record. The
 * derivation is a pure function of the record, the alert thresholds and the
 * service vocabulary.
 */
public class FeatureEngineer {

    public static final double HEAP_RATIO_EPSILON = 1e-9;

    public static final double PER_REQUEST_EPSILON = 1e-6;

    private final Map<ExceedanceMetric, Double> thresholds;

    public FeatureEngineer(Map<ExceedanceMetric, Double> thresholds) {
        checkNotNull(thresholds, "thresholds must not be null");
        for (ExceedanceMetric metric : ExceedanceMetric.values()) {
            checkArgument(thresholds.containsKey(metric), "missing threshold for " + metric.getExternalName());
        }
        this.thresholds = Collections.unmodifiableMap(new EnumMap<>(thresholds));
    }

    public List<FeatureVector> featurize(List<EnrichedRecord> records, CategoricalVocabulary vocabulary) {
        checkNotNull(records, "records must not be null");
        List<FeatureVector> vectors = new ArrayList<>(records.size());
        for (EnrichedRecord record : records) {
            vectors.add(featurize(record, vocabulary));
        }
        return vectors;
    }

    public FeatureVector featurize(EnrichedRecord record, CategoricalVocabulary vocabulary) {
        checkNotNull(record, "record must not be null");
        checkNotNull(vocabulary, "vocabulary must not be null");
        double[] values = new double[FeatureName.dimensions()];

        values[FeatureName.MESSAGE_LEN.ordinal()] = record.getMessage().length();
        values[FeatureName.SERVICE_ENCODED.ordinal()] = vocabulary.encode(record.getService());
        values[FeatureName.LEVEL_SCORE.ordinal()] = record.getLevel().getScore();

        double cpu = record.getMetric(MetricName.CPU_USAGE);
        double errorRate = record.getMetric(MetricName.ERROR_RATE);
        double hikari = record.getMetric(MetricName.HIKARICP_ACTIVE);
        double heapUsed = record.getMetric(MetricName.JVM_HEAP_USED_BYTES);
        double heapMax = record.getMetric(MetricName.JVM_HEAP_MAX_BYTES);
        double latency = record.getMetric(MetricName.LATENCY_P95_MS);
        double throughput = record.getMetric(MetricName.THROUGHPUT_REQUESTS_PER_SECOND);
        double heapRatio = heapUsageRatio(heapUsed, heapMax);

        values[FeatureName.CPU_USAGE.ordinal()] = cpu;
        values[FeatureName.ERROR_RATE.ordinal()] = errorRate;
        values[FeatureName.HIKARICP_ACTIVE.ordinal()] = hikari;
        values[FeatureName.JVM_HEAP_USED_BYTES.ordinal()] = heapUsed;
        values[FeatureName.JVM_HEAP_MAX_BYTES.ordinal()] = heapMax;
        values[FeatureName.LATENCY_P95_MS.ordinal()] = latency;
        values[FeatureName.THROUGHPUT_REQUESTS_PER_SECOND.ordinal()] = throughput;
        values[FeatureName.JVM_HEAP_USAGE_RATIO.ordinal()] = heapRatio;

        values[FeatureName.LATENCY_P95_MS_EXCEEDANCE.ordinal()] = exceedance(ExceedanceMetric.LATENCY_P95_MS, latency);
        values[FeatureName.CPU_USAGE_EXCEEDANCE.ordinal()] = exceedance(ExceedanceMetric.CPU_USAGE, cpu);
        values[FeatureName.ERROR_RATE_EXCEEDANCE.ordinal()] = exceedance(ExceedanceMetric.ERROR_RATE, errorRate);
        values[FeatureName.JVM_HEAP_USAGE_RATIO_EXCEEDANCE.ordinal()] = exceedance(
                ExceedanceMetric.JVM_HEAP_USAGE_RATIO, heapRatio);
        values[FeatureName.HIKARICP_ACTIVE_EXCEEDANCE.ordinal()] = exceedance(ExceedanceMetric.HIKARICP_ACTIVE, hikari);

        values[FeatureName.CPU_PER_REQUEST.ordinal()] = safeDivide(cpu, throughput + PER_REQUEST_EPSILON);
        values[FeatureName.LATENCY_PER_REQUEST.ordinal()] = safeDivide(latency, throughput + PER_REQUEST_EPSILON);
        values[FeatureName.HEAP_PER_REQUEST.ordinal()] = safeDivide(heapUsed, throughput + PER_REQUEST_EPSILON);

        return new FeatureVector(values);
    }

    /**
     * @param metric a thresholded signal
     * @param value  the observed value
     * @return max(0, value - threshold)
     */
    public double exceedance(ExceedanceMetric metric, double value) {
        return Math.max(0.0, value - thresholds.get(metric));
    }

    public static double heapUsageRatio(double heapUsed, double heapMax) {
        return safeDivide(heapUsed, heapMax + HEAP_RATIO_EPSILON);
    }

    public Map<ExceedanceMetric, Double> getThresholds() {
        return thresholds;
    }
}
