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

import static com.amazon.rootcauseforest.TestUtils.at;
import static com.amazon.rootcauseforest.TestUtils.event;
import static com.amazon.rootcauseforest.TestUtils.sample;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.rootcauseforest.MalformedRecordException;
import com.amazon.rootcauseforest.config.LogLevel;
import com.amazon.rootcauseforest.config.MetricName;
import com.amazon.rootcauseforest.model.EnrichedRecord;
import com.amazon.rootcauseforest.model.LogEvent;
import com.amazon.rootcauseforest.model.MetricSample;
import com.amazon.rootcauseforest.model.MetricSnapshot;

public class TimeCorrelatorTest {

    private TimeCorrelator correlator;

    @BeforeEach
    public void setUp() {
        correlator = new TimeCorrelator(Duration.ofSeconds(15));
    }

    @Test
    public void testPivotAveragesDuplicatesAndSorts() {
        List<MetricSample> samples = Arrays.asList(sample(20, "b", MetricName.CPU_USAGE, 0.1),
                sample(10, "a", MetricName.CPU_USAGE, 0.4), sample(10, "a", MetricName.LATENCY_P95_MS, 50),
                sample(10, "a", MetricName.CPU_USAGE, 0.6), sample(10, "b", MetricName.CPU_USAGE, 0.2));

        List<MetricSnapshot> snapshots = TimeCorrelator.pivot(samples);

        assertThat(snapshots, hasSize(3));
        assertEquals(at(10), snapshots.get(0).getTimestamp());
        assertEquals("a", snapshots.get(0).getService());
        assertEquals(0.5, snapshots.get(0).getValue(MetricName.CPU_USAGE), 1e-12);
        assertEquals(50.0, snapshots.get(0).getValue(MetricName.LATENCY_P95_MS));
        assertFalse(snapshots.get(0).hasValue(MetricName.ERROR_RATE));
        assertEquals(0.0, snapshots.get(0).getValue(MetricName.ERROR_RATE));
        assertEquals("b", snapshots.get(1).getService());
        assertEquals(at(20), snapshots.get(2).getTimestamp());
    }

    @Test
    public void testNearestSnapshotOfSameService() {
        List<LogEvent> events = Arrays.asList(event(12, LogLevel.ERROR, "a", "t1", "boom"),
                event(12, LogLevel.ERROR, "b", "t1", "boom"));
        List<MetricSample> samples = Arrays.asList(sample(0, "a", MetricName.CPU_USAGE, 0.1),
                sample(10, "a", MetricName.CPU_USAGE, 0.2), sample(30, "a", MetricName.CPU_USAGE, 0.3),
                sample(12, "c", MetricName.CPU_USAGE, 0.9), sample(40, "b", MetricName.CPU_USAGE, 0.7));

        List<EnrichedRecord> records = correlator.correlate(events, samples);

        assertThat(records, hasSize(2));
        assertTrue(records.get(0).isMetricsMatched());
        assertEquals(at(10), records.get(0).getMetrics().getTimestamp());
        assertEquals(0.2, records.get(0).getMetric(MetricName.CPU_USAGE));
        // the only snapshot of b is 28 seconds away, c is never used for b
        assertFalse(records.get(1).isMetricsMatched());
        assertEquals(0.0, records.get(1).getMetric(MetricName.CPU_USAGE));
    }

    @Test
    public void testToleranceBoundIsInclusive() {
        List<LogEvent> events = Arrays.asList(event(15, LogLevel.WARN, "a", "t1", "at the bound"),
                event(15.001, LogLevel.WARN, "a", "t1", "beyond the bound"));
        List<MetricSample> samples = Collections.singletonList(sample(0, "a", MetricName.CPU_USAGE, 0.5));

        List<EnrichedRecord> records = correlator.correlate(events, samples);

        assertTrue(records.get(0).isMetricsMatched());
        assertFalse(records.get(1).isMetricsMatched());
    }

    @Test
    public void testEqualGapsPreferEarlierSnapshot() {
        List<LogEvent> events = Collections.singletonList(event(10, LogLevel.WARN, "a", "t1", "in between"));
        List<MetricSample> samples = Arrays.asList(sample(15, "a", MetricName.CPU_USAGE, 0.9),
                sample(5, "a", MetricName.CPU_USAGE, 0.1));

        EnrichedRecord record = correlator.correlate(events, samples).get(0);

        assertEquals(at(5), record.getMetrics().getTimestamp());
    }

    @Test
    public void testJoinIsIndependentOfInputOrder() {
        Random random = new Random(17);
        List<LogEvent> events = new ArrayList<>();
        List<MetricSample> samples = new ArrayList<>();
        String[] services = { "a", "b", "c" };
        for (int i = 0; i < 60; i++) {
            String service = services[random.nextInt(services.length)];
            events.add(event(random.nextInt(600) + random.nextDouble(), LogLevel.WARN, service, "t" + i, "e" + i));
        }
        for (int i = 0; i < 40; i++) {
            String service = services[i % services.length];
            samples.add(sample(15.0 * (i / 3), service, MetricName.LATENCY_P95_MS, 100 + i));
        }

        List<EnrichedRecord> expected = correlator.correlate(events, samples);
        for (EnrichedRecord record : expected) {
            if (record.isMetricsMatched()) {
                assertEquals(record.getService(), record.getMetrics().getService());
                Duration gap = Duration.between(record.getTimestamp(), record.getMetrics().getTimestamp()).abs();
                assertTrue(gap.compareTo(correlator.getTolerance()) <= 0);
            }
        }

        for (int round = 0; round < 5; round++) {
            List<MetricSample> shuffled = new ArrayList<>(samples);
            Collections.shuffle(shuffled, random);
            List<EnrichedRecord> actual = correlator.correlate(events, shuffled);
            assertEquals(expected, actual);
        }
    }

    @Test
    public void testEventOrderIsKept() {
        List<LogEvent> events = Arrays.asList(event(30, LogLevel.WARN, "a", "t1", "late"),
                event(1, LogLevel.WARN, "a", "t2", "early"), event(30, LogLevel.WARN, "a", "t1", "late"));

        List<EnrichedRecord> records = correlator.correlate(events, Collections.emptyList());

        assertThat(records.stream().map(EnrichedRecord::getEvent).collect(Collectors.toList()),
                contains(events.get(0), events.get(1), events.get(2)));
    }

    @Test
    public void testEmptyMetricStreamZeroFills() {
        List<LogEvent> events = Collections.singletonList(event(1, LogLevel.ERROR, "a", "t1", "boom"));

        List<EnrichedRecord> records = correlator.correlate(events, Collections.emptyList());

        assertThat(records, hasSize(1));
        assertSame(events.get(0), records.get(0).getEvent());
        for (MetricName metric : MetricName.values()) {
            assertEquals(0.0, records.get(0).getMetric(metric));
        }
    }

    @Test
    public void testMalformedRecords() {
        List<MetricSample> none = Collections.emptyList();
        assertThrows(MalformedRecordException.class,
                () -> correlator.correlate(Collections.singletonList(event(1, LogLevel.ERROR, " ", "t1", "x")), none));
        assertThrows(MalformedRecordException.class,
                () -> correlator.correlate(Collections.singletonList(event(1, LogLevel.ERROR, "a", null, "x")), none));

        List<LogEvent> events = Collections.singletonList(event(1, LogLevel.ERROR, "a", "t1", "x"));
        assertThrows(MalformedRecordException.class, () -> correlator.correlate(events,
                Collections.singletonList(sample(1, "", MetricName.CPU_USAGE, 0.1))));
        assertThrows(MalformedRecordException.class, () -> correlator.correlate(events,
                Collections.singletonList(sample(1, "a", MetricName.CPU_USAGE, Double.NaN))));
        assertThrows(MalformedRecordException.class, () -> correlator.correlate(events,
                Collections.singletonList(new MetricSample(null, "a", MetricName.CPU_USAGE, 0.1))));
    }

    @Test
    public void testNegativeTolerance() {
        assertThrows(IllegalArgumentException.class, () -> new TimeCorrelator(Duration.ofSeconds(-1)));
    }
}
