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

package com.amazon.rootcauseforest.suggestion;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rootcauseforest.config.ExceedanceMetric;
import com.amazon.rootcauseforest.feature.FeatureName;
import com.amazon.rootcauseforest.feature.FeatureVector;

/**
 * The immutable view of a root-cause record that suggestion rules are evaluated
 * against.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SuggestionContext {

    private final String service;
    private final String message;
    /**
     * the message in lower case
     */
    private final String normalizedMessage;
    private final double heapUsageRatio;
    private final Map<ExceedanceMetric, Double> exceedances;

    public SuggestionContext(String service, String message, double heapUsageRatio,
            Map<ExceedanceMetric, Double> exceedances) {
        this.service = service;
        this.message = checkNotNull(message, "message must not be null");
        this.normalizedMessage = message.toLowerCase(Locale.ROOT);
        this.heapUsageRatio = heapUsageRatio;
        EnumMap<ExceedanceMetric, Double> copy = new EnumMap<>(ExceedanceMetric.class);
        copy.putAll(checkNotNull(exceedances, "exceedances must not be null"));
        this.exceedances = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads the heap ratio and the exceedance columns of the raw (not
     * standardized) feature vector.
     *
     * @param service  service of the record
     * @param message  message of the record
     * @param features raw features of the record
     * @return the context of the record
     */
    public static SuggestionContext of(String service, String message, FeatureVector features) {
        checkNotNull(features, "features must not be null");
        Map<ExceedanceMetric, Double> exceedances = new EnumMap<>(ExceedanceMetric.class);
        exceedances.put(ExceedanceMetric.LATENCY_P95_MS, features.get(FeatureName.LATENCY_P95_MS_EXCEEDANCE));
        exceedances.put(ExceedanceMetric.CPU_USAGE, features.get(FeatureName.CPU_USAGE_EXCEEDANCE));
        exceedances.put(ExceedanceMetric.ERROR_RATE, features.get(FeatureName.ERROR_RATE_EXCEEDANCE));
        exceedances.put(ExceedanceMetric.JVM_HEAP_USAGE_RATIO,
                features.get(FeatureName.JVM_HEAP_USAGE_RATIO_EXCEEDANCE));
        exceedances.put(ExceedanceMetric.HIKARICP_ACTIVE, features.get(FeatureName.HIKARICP_ACTIVE_EXCEEDANCE));
        return new SuggestionContext(service, message, features.get(FeatureName.JVM_HEAP_USAGE_RATIO), exceedances);
    }

    public double getExceedance(ExceedanceMetric metric) {
        Double value = exceedances.get(metric);
        return (value == null) ? 0.0 : value;
    }

    public boolean isExceeded(ExceedanceMetric metric) {
        return getExceedance(metric) > 0;
    }
}
