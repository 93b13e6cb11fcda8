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

import java.time.Instant;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rootcauseforest.config.MetricName;

/**
 * One value of one metric of one service at one instant, in the long format
 * produced by the metric collector.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MetricSample {

    private final Instant timestamp;
    private final String service;
    private final MetricName metricName;
    private final double value;

    public MetricSample(Instant timestamp, String service, MetricName metricName, double value) {
        this.timestamp = timestamp;
        this.service = service;
        this.metricName = metricName;
        this.value = value;
    }
}
