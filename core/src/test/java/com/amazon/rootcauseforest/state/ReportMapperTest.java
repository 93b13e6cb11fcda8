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

package com.amazon.rootcauseforest.state;

import static com.amazon.rootcauseforest.TestUtils.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.rootcauseforest.MalformedRecordException;
import com.amazon.rootcauseforest.report.Report;
import com.amazon.rootcauseforest.report.Summary;
import com.amazon.rootcauseforest.report.TopError;
import com.amazon.rootcauseforest.rootcause.RCARecord;

public class ReportMapperTest {

    private final ReportMapper mapper = new ReportMapper();

    private static Report report() {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        snapshot.put("cpu_usage", 0.9);
        snapshot.put("jvm_heap_usage_ratio", 0.5);
        RCARecord rca = new RCARecord("T1", "loans", at(12.5), "java.lang.OutOfMemoryError", 0.73, snapshot,
                Arrays.asList("first", "second"), Arrays.asList("gateway", "loans"));
        return new Report(new Summary(3, Arrays.asList(new TopError("java.lang.OutOfMemoryError", 2),
                new TopError("timeout", 1))), Collections.singletonList(rca));
    }

    @Test
    public void testToState() {
        ReportState state = mapper.toState(report());

        assertEquals(3, state.getSummary().getAnomalyCount());
        assertEquals(2, state.getSummary().getTopErrors().size());
        assertEquals("timeout", state.getSummary().getTopErrors().get(1).getMessage());
        RCARecordState record = state.getAnomalies().get(0);
        assertEquals("2024-05-01T10:00:12.500Z", record.getTimestamp());
        // the root cause service always comes first
        assertEquals(Arrays.asList("loans", "gateway"), record.getAffectedServices());
        assertEquals(Arrays.asList("cpu_usage", "jvm_heap_usage_ratio"),
                Arrays.asList(record.getMetricSnapshot().keySet().toArray()));
    }

    @Test
    public void testRoundTrip() {
        Report report = report();

        assertEquals(report, mapper.toModel(mapper.toState(report)));
        assertEquals(Report.empty(), mapper.toModel(mapper.toState(Report.empty())));
    }

    @Test
    public void testMissingParts() {
        ReportState state = new ReportState();

        assertEquals(Report.empty(), mapper.toModel(state));

        RCARecordState record = new RCARecordState();
        record.setTraceId("T1");
        record.setRootCauseService("loans");
        record.setMessage("boom");
        record.setTimestamp("2024-05-01T10:00:00Z");
        state.setAnomalies(Collections.singletonList(record));
        RCARecord model = mapper.toModel(state).getAnomalies().get(0);
        assertTrue(model.getSuggestions().isEmpty());
        assertEquals(Collections.singleton("loans"), model.getAffectedServices());
    }

    @Test
    public void testInvalidTimestamp() {
        RCARecordState record = new RCARecordState();
        record.setTraceId("T1");
        record.setRootCauseService("loans");
        record.setMessage("boom");
        record.setTimestamp("yesterday");
        ReportState state = new ReportState();
        state.setAnomalies(Collections.singletonList(record));

        MalformedRecordException e = assertThrows(MalformedRecordException.class, () -> mapper.toModel(state));
        assertTrue(e.getMessage().contains("yesterday"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "trace_id", "root_cause_service", "message", "timestamp" })
    public void testMissingRecordField(String field) {
        RCARecordState record = new RCARecordState();
        record.setTraceId(field.equals("trace_id") ? null : "T1");
        record.setRootCauseService(field.equals("root_cause_service") ? null : "loans");
        record.setMessage(field.equals("message") ? null : "boom");
        record.setTimestamp(field.equals("timestamp") ? null : "2024-01-01T00:00:00Z");
        ReportState state = new ReportState();
        state.setAnomalies(Collections.singletonList(record));

        MalformedRecordException e = assertThrows(MalformedRecordException.class, () -> mapper.toModel(state));
        assertTrue(e.getMessage().endsWith(field));
    }
}
