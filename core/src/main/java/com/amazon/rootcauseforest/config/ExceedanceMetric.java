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

/**
 * Signals that are compared against an alert threshold. The exceedance of a
 * signal is max(0, value - threshold).
 */
public enum ExceedanceMetric {

    LATENCY_P95_MS("latency_p95_ms", 1000.0),
    CPU_USAGE("cpu_usage", 0.85),
    ERROR_RATE("error_rate", 0.10),
    JVM_HEAP_USAGE_RATIO("jvm_heap_usage_ratio", 0.85),
    HIKARICP_ACTIVE("hikaricp_active", 9.0);

    private final String externalName;
    private final double defaultThreshold;

    ExceedanceMetric(String externalName, double defaultThreshold) {
        this.externalName = externalName;
        this.defaultThreshold = defaultThreshold;
    }

    public String getExternalName() {
        return externalName;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }
}
