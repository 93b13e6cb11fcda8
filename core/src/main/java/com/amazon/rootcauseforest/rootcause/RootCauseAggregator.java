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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import com.amazon.rootcauseforest.anomalydetection.ScoredRecord;
import com.amazon.rootcauseforest.config.MetricName;
import com.amazon.rootcauseforest.feature.FeatureName;
import com.amazon.rootcauseforest.model.EnrichedRecord;
import com.amazon.rootcauseforest.suggestion.SuggestionContext;
import com.amazon.rootcauseforest.suggestion.SuggestionEngine;

/**
 * Groups anomalies by trace and elects one root-cause record per trace: the
 * anomaly with the highest score, the earliest one among equal scores. The
 * affected services of a trace are taken from all correlated records, including
 * those that were filtered out before scoring.
 */
@Slf4j
public class RootCauseAggregator {

    private final SuggestionEngine suggestionEngine;

    public RootCauseAggregator(SuggestionEngine suggestionEngine) {
        this.suggestionEngine = checkNotNull(suggestionEngine, "suggestionEngine must not be null");
    }

    /**
     * @param scored     scored records
     * @param allRecords every correlated record of the run
     * @return one record per trace with an anomaly, in order of the first anomaly
     *         of each trace
     */
    public List<RCARecord> aggregate(List<ScoredRecord> scored, List<EnrichedRecord> allRecords) {
        checkNotNull(scored, "scored must not be null");
        checkNotNull(allRecords, "allRecords must not be null");

        Map<String, ScoredRecord> rootCauses = new LinkedHashMap<>();
        for (ScoredRecord candidate : scored) {
            if (!candidate.isAnomaly()) {
                continue;
            }
            rootCauses.merge(candidate.getRecord().getTraceId(), candidate, RootCauseAggregator::moreAnomalous);
        }

        Map<String, Set<String>> servicesByTrace = new LinkedHashMap<>();
        for (EnrichedRecord record : allRecords) {
            if (rootCauses.containsKey(record.getTraceId())) {
                servicesByTrace.computeIfAbsent(record.getTraceId(), k -> new LinkedHashSet<>())
                        .add(record.getService());
            }
        }

        List<RCARecord> result = new ArrayList<>(rootCauses.size());
        for (Map.Entry<String, ScoredRecord> entry : rootCauses.entrySet()) {
            ScoredRecord rootCause = entry.getValue();
            EnrichedRecord record = rootCause.getRecord();
            List<String> suggestions = suggestionEngine
                    .suggest(SuggestionContext.of(record.getService(), record.getMessage(), rootCause.getFeatures()));
            Set<String> affected = servicesByTrace.getOrDefault(entry.getKey(), new LinkedHashSet<>());
            result.add(new RCARecord(entry.getKey(), record.getService(), record.getTimestamp(), record.getMessage(),
                    rootCause.getAnomalyScore(), metricSnapshot(rootCause), suggestions, affected));
            log.debug("trace {} root cause in {}, affected services {}", entry.getKey(), record.getService(),
                    affected);
        }
        log.info("elected root causes for {} traces", result.size());
        return result;
    }

    static ScoredRecord moreAnomalous(ScoredRecord current, ScoredRecord candidate) {
        if (candidate.getAnomalyScore() > current.getAnomalyScore()) {
            return candidate;
        }
        if (candidate.getAnomalyScore() == current.getAnomalyScore()
                && candidate.getRecord().getTimestamp().isBefore(current.getRecord().getTimestamp())) {
            return candidate;
        }
        return current;
    }

    /**
     * @param scored a scored record
     * @return the raw metrics of the record and its heap usage ratio
     */
    static Map<String, Double> metricSnapshot(ScoredRecord scored) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        for (MetricName metric : MetricName.values()) {
            snapshot.put(metric.getExternalName(), scored.getRecord().getMetric(metric));
        }
        snapshot.put(FeatureName.JVM_HEAP_USAGE_RATIO.getColumnName(),
                scored.getFeatures().get(FeatureName.JVM_HEAP_USAGE_RATIO));
        return snapshot;
    }
}
