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

package com.amazon.rootcauseforest.runner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.rootcauseforest.EmptyInputException;
import com.amazon.rootcauseforest.report.Report;
import com.amazon.rootcauseforest.rootcause.RCARecord;
import com.amazon.rootcauseforest.serialize.ReportSerDe;
import com.amazon.rootcauseforest.suggestion.SuggestionEngine;
import com.amazon.rootcauseforest.testutils.IncidentScenario;

public class RootCauseAnalysisRunnerTest {

    @TempDir
    Path workspace;

    private IncidentScenario scenario;
    private Path logs;
    private Path metrics;
    private Path output;
    private ByteArrayOutputStream stdout;

    @BeforeEach
    public void setUp() throws IOException {
        scenario = new IncidentScenario(120, 11L);
        logs = Files.createDirectories(workspace.resolve("ops").resolve("logs"));
        metrics = Files.createDirectories(workspace.resolve("ops").resolve("metrics"));
        for (Map.Entry<String, List<String>> entry : scenario.logLinesByService(true).entrySet()) {
            Files.write(logs.resolve(entry.getKey() + ".log"), entry.getValue(), StandardCharsets.UTF_8);
            Files.write(metrics.resolve(entry.getKey() + ".txt"), scenario.metricDump(entry.getKey()),
                    StandardCharsets.UTF_8);
        }
        output = workspace.resolve("reports").resolve("aiops_report.json");
        stdout = new ByteArrayOutputStream();
    }

    private RootCauseAnalysisRunner runner(String... extra) {
        RootCauseAnalysisRunner runner = new RootCauseAnalysisRunner();
        runner.parse("--logs", logs.toString(), "--metrics", metrics.toString(), "--output", output.toString());
        runner.parse(extra);
        return runner;
    }

    private String stdout() {
        return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testRun() throws IOException {
        Report report = runner().run(new PrintStream(stdout, true, "UTF-8"));

        assertTrue(Files.exists(output));
        Report written = new ReportSerDe().fromJson(new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
        assertEquals(report, written);
        assertTrue(stdout().contains("AIOps JSON report created: " + output));
        assertTrue(stdout().contains("Total anomalies detected: " + report.getSummary().getAnomalyCount()));

        RCARecord incident = report.getAnomalies().stream()
                .filter(r -> r.getTraceId().equals(scenario.getIncidentTraceId())).findFirst().get();
        assertEquals(scenario.getIncidentService(), incident.getRootCauseService());
        assertEquals(scenario.getIncidentTime(), incident.getTimestamp());
        assertTrue(incident.getMessage().startsWith(IncidentScenario.INCIDENT_MESSAGE));
        assertEquals(SuggestionEngine.HEAP_LEAK_SUGGESTION, incident.getSuggestions().get(0));
        assertThat(incident.getAffectedServices(),
                hasItems(scenario.getIncidentService(), scenario.getGatewayService()));
        assertTrue(incident.getMetricSnapshot().get("jvm_heap_usage_ratio") > 0.85);
    }

    @Test
    public void testRunIsRepeatable() throws IOException {
        String first;
        runner().run(new PrintStream(stdout, true, "UTF-8"));
        first = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        runner().run(new PrintStream(new ByteArrayOutputStream(), true, "UTF-8"));

        assertEquals(first, new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
    }

    @Test
    public void testRunWithoutMetrics() throws IOException {
        metrics = workspace.resolve("no-metrics");

        Report report = runner("--contamination", "0.05").run(new PrintStream(stdout, true, "UTF-8"));

        assertTrue(Files.exists(output));
        for (RCARecord record : report.getAnomalies()) {
            assertTrue(record.getMetricSnapshot().values().stream().allMatch(value -> value == 0.0));
        }
    }

    @Test
    public void testMissingLogs() {
        logs = workspace.resolve("no-logs");

        assertThrows(IOException.class, () -> runner().run(new PrintStream(stdout, true, "UTF-8")));
    }

    @Test
    public void testEmptyLogs() throws IOException {
        Path empty = Files.createFile(workspace.resolve("empty.log"));
        logs = empty;

        assertThrows(EmptyInputException.class, () -> runner().run(new PrintStream(stdout, true, "UTF-8")));
    }
}
