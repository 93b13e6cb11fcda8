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

package com.amazon.rootcauseforest.testutils;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Generates the text dumps of a small microservice system in which one request
 * fails. Every request enters through a gateway service and is routed to one
 * downstream service. The failing request ends in an out-of-memory error in the
 * incident service, whose metrics spike around the time of the failure.
 *
 * Log lines follow the layout
 * {@code <instant> <LEVEL> [<service>,<trace>,<span>] 1 --- [<thread>] <class> : <message>},
 * optionally preceded by a collector timestamp and a TAB. Metric dumps hold one
 * section per metric with TAB separated timestamp and value lines.
 */
public class IncidentScenario {

    public static final List<String> DEFAULT_SERVICES = Collections
            .unmodifiableList(Arrays.asList("gatewayserver-ms", "accounts-ms", "loans-ms", "cards-ms"));

    public static final Instant DEFAULT_START = Instant.parse("2024-05-01T10:00:00Z");

    public static final String INCIDENT_MESSAGE = "java.lang.OutOfMemoryError: Java heap space";

    /**
     * spacing of the metric samples
     */
    public static final Duration METRIC_STEP = Duration.ofSeconds(15);

    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final Duration REQUEST_SPACING = Duration.ofSeconds(2);

    private static final Duration INCIDENT_WINDOW = Duration.ofSeconds(30);

    private final List<String> services;
    private final Instant start;
    private final int numberOfRequests;
    private final long seed;
    private final int incidentRequest;
    private final String incidentService;

    public IncidentScenario(List<String> services, Instant start, int numberOfRequests, long seed) {
        if (services.size() < 2) {
            throw new IllegalArgumentException("a gateway and at least one downstream service are required");
        }
        if (numberOfRequests < 1) {
            throw new IllegalArgumentException("at least one request is required");
        }
        this.services = Collections.unmodifiableList(new ArrayList<>(services));
        this.start = start;
        this.numberOfRequests = numberOfRequests;
        this.seed = seed;
        this.incidentRequest = numberOfRequests / 2;
        this.incidentService = services.get(Math.min(2, services.size() - 1));
    }

    public IncidentScenario(int numberOfRequests, long seed) {
        this(DEFAULT_SERVICES, DEFAULT_START, numberOfRequests, seed);
    }

    public List<String> getServices() {
        return services;
    }

    public String getGatewayService() {
        return services.get(0);
    }

    public String getIncidentService() {
        return incidentService;
    }

    public String getIncidentTraceId() {
        return traceId(incidentRequest);
    }

    public Instant getIncidentTime() {
        return requestTime(incidentRequest).plusMillis(40);
    }

    public Instant getEnd() {
        return requestTime(numberOfRequests);
    }

    private Instant requestTime(int request) {
        return start.plus(REQUEST_SPACING.multipliedBy(request));
    }

    private static String traceId(int request) {
        return String.format(Locale.ROOT, "%016x", 0x5eedL * 1_000_003L + request);
    }

    /**
     * @param withCollectorPrefix whether each record line starts with a collector
     *                            timestamp and a TAB
     * @return the log lines of all services, grouped by service
     */
    public Map<String, List<String>> logLinesByService(boolean withCollectorPrefix) {
        Random rng = new Random(seed);
        Map<String, List<String>> lines = new LinkedHashMap<>();
        for (String service : services) {
            lines.put(service, new ArrayList<>());
            String applicationName = className(service, "Application");
            add(lines, service, withCollectorPrefix, start.minusSeconds(30), "INFO", service, "-", "-", "main",
                    applicationName, "Started " + applicationName + " in 4.2 seconds, started successfully");
        }

        String gateway = getGatewayService();
        for (int request = 0; request < numberOfRequests; request++) {
            Instant time = requestTime(request);
            String trace = traceId(request);
            String downstream = (request == incidentRequest) ? incidentService
                    : services.get(1 + rng.nextInt(services.size() - 1));
            String thread = "nio-8072-exec-" + (1 + rng.nextInt(10));

            add(lines, gateway, withCollectorPrefix, time, "INFO", gateway, trace, trace.substring(8), thread,
                    "c.e.gateway.filters.RequestTraceFilter", "Routing request to " + downstream);
            if (request == incidentRequest) {
                Instant failure = getIncidentTime();
                add(lines, incidentService, withCollectorPrefix, failure, "ERROR", incidentService, trace,
                        "a1b2c3d4e5f60718", "nio-8080-exec-3", className(incidentService, "Controller"),
                        INCIDENT_MESSAGE);
                lines.get(incidentService).add("\tat java.base/java.util.Arrays.copyOf(Arrays.java:3537)");
                lines.get(incidentService).add("\tat com.example.service.ReportService.render(ReportService.java:88)");
                add(lines, gateway, withCollectorPrefix, failure.plusMillis(15), "WARN", gateway, trace,
                        trace.substring(8), thread, "c.e.gateway.filters.ResponseTraceFilter",
                        "Downstream " + incidentService + " responded with 500 INTERNAL_SERVER_ERROR");
            } else if (rng.nextDouble() < 0.1) {
                add(lines, downstream, withCollectorPrefix, time.plusMillis(300), "WARN", downstream, trace,
                        "0f1e2d3c4b5a6978", "nio-8080-exec-1", className(downstream, "Controller"),
                        "Slow response while fetching details, retrying");
            } else {
                add(lines, downstream, withCollectorPrefix, time.plusMillis(20 + rng.nextInt(30)), "DEBUG",
                        downstream, trace, "0f1e2d3c4b5a6978", "nio-8080-exec-1", className(downstream, "Controller"),
                        "Fetched details for request " + request);
            }
        }
        return lines;
    }

    /**
     * @param withCollectorPrefix whether each record line starts with a collector
     *                            timestamp and a TAB
     * @return the log lines of all services, one service after the other
     */
    public List<String> logLines(boolean withCollectorPrefix) {
        List<String> all = new ArrayList<>();
        logLinesByService(withCollectorPrefix).values().forEach(all::addAll);
        return all;
    }

    private static void add(Map<String, List<String>> lines, String owner, boolean withCollectorPrefix, Instant time,
            String level, String service, String trace, String span, String thread, String className, String message) {
        String prefix = withCollectorPrefix ? time.plusMillis(5).toString() + "\t" : "";
        lines.get(owner).add(String.format(Locale.ROOT, "%s%s %5s [%s,%s,%s] 1 --- [%s] %s : %s", prefix,
                LOG_TIMESTAMP.format(time), level, service, trace, span, thread, className, message));
    }

    private static String className(String service, String suffix) {
        String name = service.replace("-ms", "").replace("server", "");
        return "com.example." + name + "." + Character.toUpperCase(name.charAt(0)) + name.substring(1) + suffix;
    }

    /**
     * @param service one of the services of the scenario
     * @return the metric dump of the service
     */
    public List<String> metricDump(String service) {
        if (!services.contains(service)) {
            throw new IllegalArgumentException("unknown service " + service);
        }
        Random rng = new Random(seed ^ service.hashCode());
        List<String> lines = new ArrayList<>();
        lines.add("# PROM_URL=http://localhost:9090");
        lines.add("# SERVICE=" + service);
        lines.add("# RANGE=" + start + ".." + getEnd() + " UTC STEP=" + METRIC_STEP.getSeconds() + "s");
        lines.add("");

        Map<String, double[]> metrics = new LinkedHashMap<>();
        // base level, noise, incident level
        metrics.put("error_rate", new double[] { 0.01, 0.005, 0.4 });
        metrics.put("latency_p95_ms", new double[] { 120, 20, 2500 });
        metrics.put("cpu_usage", new double[] { 0.3, 0.05, 0.95 });
        metrics.put("jvm_heap_used_bytes", new double[] { 2.0e8, 1.0e7, 5.0e8 });
        metrics.put("jvm_heap_max_bytes", new double[] { 5.12e8, 0, 5.12e8 });
        metrics.put("hikaricp_active", new double[] { 2, 1, 10 });
        metrics.put("throughput_requests_per_second", new double[] { 20, 3, 4 });

        for (Map.Entry<String, double[]> metric : metrics.entrySet()) {
            lines.add("## METRIC: " + metric.getKey());
            lines.add("## PROMQL: " + metric.getKey() + "{service=\"" + service + "\"}");
            double[] levels = metric.getValue();
            for (Instant time = start; !time.isAfter(getEnd()); time = time.plus(METRIC_STEP)) {
                boolean incident = service.equals(incidentService)
                        && Duration.between(time, getIncidentTime()).abs().compareTo(INCIDENT_WINDOW) <= 0;
                double value = incident ? levels[2] : Math.max(0, levels[0] + levels[1] * (rng.nextDouble() - 0.5));
                lines.add(time + "\t" + value);
            }
            lines.add("");
        }

        lines.add("## METRIC: cpu_seconds_rate");
        lines.add("## PROMQL: rate(process_cpu_seconds_total{service=\"" + service + "\"}[5m])");
        lines.add(start + "\t0.12");
        lines.add("");
        lines.add("## METRIC: gc_pause_seconds");
        lines.add("## PROMQL: rate(jvm_gc_pause_seconds_sum{service=\"" + service + "\"}[5m])");
        lines.add("## ERROR: 503 Server Error: Service Unavailable");
        lines.add("");
        return lines;
    }
}
