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

import java.util.Optional;

/**
 * The closed set of service metrics that can be correlated with log events.
 * The external name is the name used by the metric collector.
 */
public enum MetricName {

    ERROR_RATE("error_rate"),
    LATENCY_P95_MS("latency_p95_ms"),
    CPU_USAGE("cpu_usage"),
    JVM_HEAP_USED_BYTES("jvm_heap_used_bytes"),
    JVM_HEAP_MAX_BYTES("jvm_heap_max_bytes"),
    HIKARICP_ACTIVE("hikaricp_active"),
    THROUGHPUT_REQUESTS_PER_SECOND("throughput_requests_per_second");

    private final String externalName;

    MetricName(String externalName) {
        this.externalName = externalName;
    }

    public String getExternalName() {
        return externalName;
    }

    public static Optional<MetricName> fromExternalName(String name) {
        for (MetricName metric : values()) {
            if (metric.externalName.equals(name)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
