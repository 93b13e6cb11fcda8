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

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.rootcauseforest.AnalysisException;
import com.amazon.rootcauseforest.RootCauseAnalyzer;
import com.amazon.rootcauseforest.model.LogEvent;
import com.amazon.rootcauseforest.model.MetricSample;
import com.amazon.rootcauseforest.report.Report;
import com.amazon.rootcauseforest.runner.parse.LogLineParser;
import com.amazon.rootcauseforest.runner.parse.MetricDumpParser;
import com.amazon.rootcauseforest.serialize.ReportSerDe;

/**
 * Reads collected log and metric dumps, runs the root cause analysis and writes
 * the JSON report. The report location and the number of anomalies are printed
 * to STDOUT.
 */
@Slf4j
public class RootCauseAnalysisRunner {

    protected final ArgumentParser argumentParser;
    private final LogLineParser logParser = new LogLineParser();
    private final MetricDumpParser metricParser = new MetricDumpParser();
    private final ReportSerDe serDe = new ReportSerDe();

    public RootCauseAnalysisRunner() {
        this(new ArgumentParser(RootCauseAnalysisRunner.class.getName(),
                "Correlate log events with service metrics, score them with an isolation forest and report the "
                        + "likely root cause of every anomalous trace."));
    }

    public RootCauseAnalysisRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        RootCauseAnalysisRunner runner = new RootCauseAnalysisRunner();
        runner.parse(args);
        try {
            runner.run(System.out);
        } catch (AnalysisException e) {
            log.error("analysis failed", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * @param out destination of the run summary
     * @return the written report
     * @throws IOException if a dump cannot be read or the report cannot be
     *                     written
     */
    public Report run(PrintStream out) throws IOException {
        List<LogEvent> events = logParser.parse(Paths.get(argumentParser.getLogs()));
        List<MetricSample> samples = readMetrics(Paths.get(argumentParser.getMetrics()));

        Report report = new RootCauseAnalyzer(argumentParser.toAnalysisConfig()).analyze(events, samples);

        Path output = Paths.get(argumentParser.getOutput());
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            serDe.toJson(report, writer);
        }
        log.info("wrote report with {} root cause records to {}", report.getAnomalies().size(), output);

        out.println("AIOps JSON report created: " + output);
        out.println("Total anomalies detected: " + report.getSummary().getAnomalyCount());
        return report;
    }

    private List<MetricSample> readMetrics(Path location) throws IOException {
        if (!Files.exists(location)) {
            log.warn("no metric dumps at {}, continuing with logs only", location);
            return Collections.emptyList();
        }
        return metricParser.parse(location);
    }
}
