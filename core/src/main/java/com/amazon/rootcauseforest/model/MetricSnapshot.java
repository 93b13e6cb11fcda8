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

package com.amazon.rootcauseforest.model;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rootcauseforest.config.MetricName;

/**
 * The metrics of one service at one instant, pivoted from several
 * {@link MetricSample}s into a wide record. A metric that was not observed
 * reads as 0. An absent snapshot has no timestamp and no values; it stands in
 * for a log event that could not be matched to any metrics.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MetricSnapshot {

    private final Instant timestamp;
    private final String service;
    private final Map<MetricName, Double> values;

    public MetricSnapshot(Instant timestamp, String service, Map<MetricName, Double> values) {
        checkNotNull(values, "values must not be null");
        this.timestamp = timestamp;
        this.service = service;
        EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static MetricSnapshot absent(String service) {
        return new MetricSnapshot(null, service, Collections.emptyMap());
    }

    public boolean isPresent() {
        return timestamp != null;
    }

    /**
     * @param metric a metric
     * @return the value of the metric, or 0 if it was not observed
     */
    public double getValue(MetricName metric) {
        Double value = values.get(metric);
        return (value == null) ? 0.0 : value;
    }

    public boolean hasValue(MetricName metric) {
        return values.containsKey(metric);
    }
}
