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

package com.amazon.rootcauseforest.correlation;

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;
import static com.amazon.rootcauseforest.CommonUtils.isBlank;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.rootcauseforest.MalformedRecordException;
import com.amazon.rootcauseforest.config.MetricName;
import com.amazon.rootcauseforest.model.EnrichedRecord;
import com.amazon.rootcauseforest.model.LogEvent;
import com.amazon.rootcauseforest.model.MetricSample;
import com.amazon.rootcauseforest.model.MetricSnapshot;

/**
 * Joins log events to the metric snapshot of the same service whose timestamp
 * is nearest to the event, provided the gap does not exceed the tolerance.
 * Events without such a snapshot carry an absent snapshot, which reads as 0 for
 * every metric.
 *
 * The join produces exactly one {@link EnrichedRecord} per input event, in the
 * input order, and never reads metrics of another service. Equal gaps on both
 * sides resolve to the earlier snapshot; a gap equal to the tolerance still
 * matches.
 */
@Slf4j
public class TimeCorrelator {

    @Getter
    private final Duration tolerance;

    public TimeCorrelator(Duration tolerance) {
        checkNotNull(tolerance, "tolerance must not be null");
        checkArgument(!tolerance.isNegative(), "tolerance must not be negative");
        this.tolerance = tolerance;
    }

    /**
     * Pivots long-format samples into one wide snapshot per (timestamp, service).
     * Repeated samples of the same metric at the same key are averaged.
     *
     * @param samples metric samples in any order
     * @return snapshots ordered by timestamp, then service
     */
    public static List<MetricSnapshot> pivot(List<MetricSample> samples) {
        checkNotNull(samples, "samples must not be null");
        Map<SnapshotKey, Map<MetricName, double[]>> accumulators = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            validate(sample);
            Map<MetricName, double[]> sums = accumulators.computeIfAbsent(
                    new SnapshotKey(sample.getTimestamp(), sample.getService()),
                    k -> new EnumMap<>(MetricName.class));
            double[] sumAndCount = sums.computeIfAbsent(sample.getMetricName(), k -> new double[2]);
            sumAndCount[0] += sample.getValue();
            sumAndCount[1] += 1;
        }

        List<MetricSnapshot> snapshots = new ArrayList<>(accumulators.size());
        for (Map.Entry<SnapshotKey, Map<MetricName, double[]>> entry : accumulators.entrySet()) {
            Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
            entry.getValue().forEach((metric, sumAndCount) -> values.put(metric, sumAndCount[0] / sumAndCount[1]));
            snapshots.add(new MetricSnapshot(entry.getKey().timestamp, entry.getKey().service, values));
        }
        snapshots.sort(Comparator.comparing(MetricSnapshot::getTimestamp).thenComparing(MetricSnapshot::getService));
        return snapshots;
    }

    /**
     * Pivots the samples and joins them to the events.
     *
     * @param events  log events
     * @param samples metric samples, possibly empty
     * @return one enriched record per event, in event order
     */
    public List<EnrichedRecord> correlate(List<LogEvent> events, List<MetricSample> samples) {
        return correlateSnapshots(events, pivot(samples));
    }

    /**
     * Joins already pivoted snapshots to the events.
     *
     * @param events    log events
     * @param snapshots wide metric records in any order, possibly empty
     * @return one enriched record per event, in event order
     */
    public List<EnrichedRecord> correlateSnapshots(List<LogEvent> events, List<MetricSnapshot> snapshots) {
        checkNotNull(events, "events must not be null");
        checkNotNull(snapshots, "snapshots must not be null");
        if (snapshots.isEmpty()) {
            log.warn("no metric snapshots available, {} log events are correlated with zero-filled metrics",
                    events.size());
        }

        Map<String, Timeline> timelines = buildTimelines(snapshots);
        List<EnrichedRecord> records = new ArrayList<>(events.size());
        int matched = 0;
        for (LogEvent event : events) {
            validate(event);
            Timeline timeline = timelines.get(event.getService());
            MetricSnapshot snapshot = (timeline == null) ? null : timeline.nearest(event.getTimestamp(), tolerance);
            if (snapshot == null) {
                snapshot = MetricSnapshot.absent(event.getService());
            } else {
                matched++;
            }
            records.add(new EnrichedRecord(event, snapshot));
        }
        log.info("correlated {} log events with {} metric snapshots: {} matched, {} without metrics", events.size(),
                snapshots.size(), matched, events.size() - matched);
        return records;
    }

    private static Map<String, Timeline> buildTimelines(List<MetricSnapshot> snapshots) {
        Map<String, List<MetricSnapshot>> byService = new HashMap<>();
        for (MetricSnapshot snapshot : snapshots) {
            checkNotNull(snapshot, "snapshots must not contain null");
            if (isBlank(snapshot.getService()) || snapshot.getTimestamp() == null) {
                throw new MalformedRecordException("metric snapshot without service or timestamp: " + snapshot);
            }
            byService.computeIfAbsent(snapshot.getService(), k -> new ArrayList<>()).add(snapshot);
        }
        Map<String, Timeline> timelines = new HashMap<>();
        byService.forEach((service, list) -> timelines.put(service, new Timeline(list)));
        return timelines;
    }

    private static void validate(LogEvent event) {
        checkNotNull(event, "events must not contain null");
        if (isBlank(event.getService())) {
            throw new MalformedRecordException("log event without service at " + event.getTimestamp());
        }
        if (isBlank(event.getTraceId())) {
            throw new MalformedRecordException(
                    "log event without trace id at " + event.getTimestamp() + " for service " + event.getService());
        }
    }

    private static void validate(MetricSample sample) {
        checkNotNull(sample, "samples must not contain null");
        if (isBlank(sample.getService()) || sample.getTimestamp() == null || sample.getMetricName() == null) {
            throw new MalformedRecordException("metric sample without service, timestamp or metric: " + sample);
        }
        if (!Double.isFinite(sample.getValue())) {
            throw new MalformedRecordException("metric sample with non-finite value: " + sample);
        }
    }

    /**
     * The snapshots of one service, sorted by time.
     */
    static class Timeline {

        private final Instant[] times;
        private final MetricSnapshot[] snapshots;

        Timeline(List<MetricSnapshot> list) {
            MetricSnapshot[] sorted = list.toArray(new MetricSnapshot[0]);
            Arrays.sort(sorted, Comparator.comparing(MetricSnapshot::getTimestamp));
            snapshots = sorted;
            times = new Instant[sorted.length];
            for (int i = 0; i < sorted.length; i++) {
                times[i] = sorted[i].getTimestamp();
            }
        }

        MetricSnapshot nearest(Instant instant, Duration tolerance) {
            int index = Arrays.binarySearch(times, instant);
            if (index >= 0) {
                return snapshots[index];
            }
            int insertion = -index - 1;
            int best = -1;
            Duration bestGap = null;
            if (insertion > 0) {
                best = insertion - 1;
                bestGap = Duration.between(times[best], instant);
            }
            if (insertion < times.length) {
                Duration gap = Duration.between(instant, times[insertion]);
                // strictly smaller, so that ties keep the earlier snapshot
                if (bestGap == null || gap.compareTo(bestGap) < 0) {
                    best = insertion;
                    bestGap = gap;
                }
            }
            if (best < 0 || bestGap.compareTo(tolerance) > 0) {
                return null;
            }
            return snapshots[best];
        }
    }

    @EqualsAndHashCode
    private static class SnapshotKey {

        private final Instant timestamp;
        private final String service;

        SnapshotKey(Instant timestamp, String service) {
            this.timestamp = timestamp;
            this.service = service;
        }
    }
}
