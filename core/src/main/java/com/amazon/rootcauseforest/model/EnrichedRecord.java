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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rootcauseforest.config.LogLevel;
import com.amazon.rootcauseforest.config.MetricName;

/**
 * A log event joined with the metric snapshot of its service that is nearest in
 * time. The snapshot is absent (all metrics 0) when no snapshot lies within the
 * join tolerance.
 */
@Getter
@EqualsAndHashCode
@ToString
public class EnrichedRecord {

    private final LogEvent event;
    private final MetricSnapshot metrics;

    public EnrichedRecord(LogEvent event, MetricSnapshot metrics) {
        this.event = checkNotNull(event, "event must not be null");
        this.metrics = checkNotNull(metrics, "metrics must not be null");
    }

    public Instant getTimestamp() {
        return event.getTimestamp();
    }

    public String getService() {
        return event.getService();
    }

    public String getTraceId() {
        return event.getTraceId();
    }

    public LogLevel getLevel() {
        return event.getLevel();
    }

    public String getMessage() {
        return event.getMessage();
    }

    public double getMetric(MetricName metric) {
        return metrics.getValue(metric);
    }

    public boolean isMetricsMatched() {
        return metrics.isPresent();
    }
}
