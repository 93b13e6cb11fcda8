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

package com.amazon.rootcauseforest.runner.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.rootcauseforest.config.MetricName;
import com.amazon.rootcauseforest.model.MetricSample;
import com.amazon.rootcauseforest.testutils.IncidentScenario;

public class MetricDumpParserTest {

    private final MetricDumpParser parser = new MetricDumpParser();

    @Test
    public void testSections() {
        List<MetricSample> samples = parser.parse(Arrays.asList("# PROM_URL=http://localhost:9090",
                "# SERVICE=loans-ms", "", "## METRIC: cpu_usage",
                "## PROMQL: rate(process_cpu_usage{service=\"loans-ms\"}[5m])", "2024-05-01T10:00:00Z\t0.31",
                "2024-05-01T10:00:15+00:00\t0.35", "", "## METRIC: latency_p95_ms",
                "## PROMQL: histogram_quantile(0.95, sum(rate(http_server_requests_seconds_bucket[5m])) by (le))",
                "2024-05-01T10:00:00.500Z\t120"), null);

        assertEquals(3, samples.size());
        assertEquals(new MetricSample(Instant.parse("2024-05-01T10:00:00Z"), "loans-ms", MetricName.CPU_USAGE, 0.31),
                samples.get(0));
        assertEquals(Instant.parse("2024-05-01T10:00:15Z"), samples.get(1).getTimestamp());
        // a query without a service matcher falls back to the header
        assertEquals(new MetricSample(Instant.parse("2024-05-01T10:00:00.500Z"), "loans-ms",
                MetricName.LATENCY_P95_MS, 120), samples.get(2));
    }

    @Test
    public void testServiceResolution() {
        List<String> lines = Arrays.asList("## METRIC: error_rate", "2024-05-01T10:00:00Z\t0.1",
                "## METRIC: error_rate", "## PROMQL: errors{service=\"cards-ms\"}", "2024-05-01T10:00:00Z\t0.2");

        List<MetricSample> samples = parser.parse(lines, "fallback-ms");

        assertEquals("fallback-ms", samples.get(0).getService());
        assertEquals("cards-ms", samples.get(1).getService());
        // without any service the samples cannot be attributed
        assertTrue(parser.parse(lines.subList(0, 2), null).isEmpty());
    }

    @Test
    public void testSkippedSections() {
        List<MetricSample> samples = parser.parse(Arrays.asList("# SERVICE=a", "## METRIC: cpu_seconds_rate",
                "2024-05-01T10:00:00Z\t0.12", "## METRIC: hikaricp_active",
                "## ERROR: 503 Server Error: Service Unavailable", "2024-05-01T10:00:00Z\t3",
                "## METRIC: throughput_requests_per_second", "2024-05-01T10:00:00Z\tNaN",
                "2024-05-01T10:00:15Z\t+Inf", "2024-05-01T10:00:30Z\tnot-a-number", "yesterday\t1",
                "2024-05-01T10:00:45Z 12", "2024-05-01T10:01:00Z\t12"), null);

        assertEquals(Collections.singletonList(new MetricSample(Instant.parse("2024-05-01T10:01:00Z"), "a",
                MetricName.THROUGHPUT_REQUESTS_PER_SECOND, 12)), samples);
    }

    @Test
    public void testParseInstant() {
        assertEquals(Instant.parse("2024-05-01T08:00:00Z"), MetricDumpParser.parseInstant("2024-05-01T10:00:00+02:00"));
        assertThrows(DateTimeParseException.class, () -> MetricDumpParser.parseInstant("2024-05-01 10:00:00"));
    }

    @Test
    public void testParseDirectory(@TempDir Path directory) throws IOException {
        IncidentScenario scenario = new IncidentScenario(30, 5L);
        for (String service : scenario.getServices()) {
            Files.write(directory.resolve(service + ".txt"), scenario.metricDump(service), StandardCharsets.UTF_8);
        }

        List<MetricSample> samples = parser.parse(directory);

        // 7 known metrics every 15 seconds over one minute, for each service
        assertEquals(4 * 7 * 5, samples.size());
        assertTrue(samples.stream().anyMatch(s -> s.getService().equals(scenario.getIncidentService())
                && s.getMetricName() == MetricName.CPU_USAGE && s.getValue() == 0.95));
        assertEquals(samples, parser.parse(directory));
    }

    @Test
    public void testDumpFiles(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("loans-ms.metrics.txt");
        Files.write(file, Collections.singletonList("x"), StandardCharsets.UTF_8);
        Files.createDirectory(directory.resolve("nested"));
        Files.write(directory.resolve("accounts-ms"), Collections.singletonList("y"), StandardCharsets.UTF_8);

        assertEquals(Arrays.asList(directory.resolve("accounts-ms"), file), DumpFiles.list(directory));
        assertEquals(Collections.singletonList(file), DumpFiles.list(file));
        assertEquals("loans-ms.metrics", DumpFiles.baseName(file));
        assertEquals("accounts-ms", DumpFiles.baseName(directory.resolve("accounts-ms")));
        assertThrows(IOException.class, () -> DumpFiles.list(directory.resolve("missing")));
    }
}
