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

package com.amazon.rootcauseforest.rootcause;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The diagnosis of one trace that contains at least one anomaly. The record
 * names the most anomalous event of the trace, the metrics observed with it,
 * the remediation hints for it and every service the trace touched. Instances
 * are immutable.
 */
@Getter
@EqualsAndHashCode
@ToString
public class RCARecord {

    private final String traceId;
    private final String rootCauseService;
    private final Instant timestamp;
    private final String message;
    private final double anomalyScore;
    /**
     * metric values keyed by metric name, in a fixed order
     */
    private final Map<String, Double> metricSnapshot;
    private final List<String> suggestions;
    /**
     * services of the trace in order of first appearance
     */
    private final Set<String> affectedServices;

    public RCARecord(String traceId, String rootCauseService, Instant timestamp, String message, double anomalyScore,
            Map<String, Double> metricSnapshot, List<String> suggestions, Collection<String> affectedServices) {
        this.traceId = checkNotNull(traceId, "traceId must not be null");
        this.rootCauseService = checkNotNull(rootCauseService, "rootCauseService must not be null");
        this.timestamp = checkNotNull(timestamp, "timestamp must not be null");
        this.message = checkNotNull(message, "message must not be null");
        this.anomalyScore = anomalyScore;
        this.metricSnapshot = Collections
                .unmodifiableMap(new LinkedHashMap<>(checkNotNull(metricSnapshot, "metricSnapshot must not be null")));
        this.suggestions = Collections
                .unmodifiableList(new ArrayList<>(checkNotNull(suggestions, "suggestions must not be null")));
        Set<String> services = new LinkedHashSet<>();
        services.add(rootCauseService);
        services.addAll(checkNotNull(affectedServices, "affectedServices must not be null"));
        this.affectedServices = Collections.unmodifiableSet(services);
    }
}
