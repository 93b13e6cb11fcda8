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

/**
 * The columns of a {@link FeatureVector}, in their fixed order.
 */
public enum FeatureName {

    MESSAGE_LEN("message_len"),
    SERVICE_ENCODED("service_encoded"),
    LEVEL_SCORE("level_score"),
    CPU_USAGE("cpu_usage"),
    ERROR_RATE("error_rate"),
    HIKARICP_ACTIVE("hikaricp_active"),
    JVM_HEAP_USED_BYTES("jvm_heap_used_bytes"),
    JVM_HEAP_MAX_BYTES("jvm_heap_max_bytes"),
    LATENCY_P95_MS("latency_p95_ms"),
    THROUGHPUT_REQUESTS_PER_SECOND("throughput_requests_per_second"),
    JVM_HEAP_USAGE_RATIO("jvm_heap_usage_ratio"),
    LATENCY_P95_MS_EXCEEDANCE("latency_p95_ms_exceedance"),
    CPU_USAGE_EXCEEDANCE("cpu_usage_exceedance"),
    ERROR_RATE_EXCEEDANCE("error_rate_exceedance"),
    JVM_HEAP_USAGE_RATIO_EXCEEDANCE("jvm_heap_usage_ratio_exceedance"),
    HIKARICP_ACTIVE_EXCEEDANCE("hikaricp_active_exceedance"),
    CPU_PER_REQUEST("cpu_per_request"),
    LATENCY_PER_REQUEST("latency_per_request"),
    HEAP_PER_REQUEST("heap_per_request");

    private final String columnName;

    FeatureName(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }

    /**
     * @return the number of feature columns
     */
    public static int dimensions() {
        return values().length;
    }
}
