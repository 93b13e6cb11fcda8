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

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;
import static com.amazon.rootcauseforest.CommonUtils.isBlank;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.amazon.rootcauseforest.config.MetricName;
import com.amazon.rootcauseforest.model.MetricSample;

/**
 * Parses metric dumps into {@link MetricSample}s. A dump holds one section per
 * metric:
 *
 * <pre>
 * # SERVICE=loans-ms
 * ## METRIC: cpu_usage
 * ## PROMQL: rate(process_cpu_usage{service="loans-ms"}[5m])
 * 2024-05-01T10:00:00Z	0.31
 * </pre>
 *
 * The service of a section is the one named by a {@code service="..."} matcher
 * in its query, else the one of the {@code # SERVICE=} header, else the given
 * default. Sections of metrics outside {@link MetricName}, sections that report
 * a collection error and non-finite values are skipped.
 */
@Slf4j
public class MetricDumpParser {

    public static final String SERVICE_HEADER = "# SERVICE=";
    public static final String METRIC_HEADER = "## METRIC:";
    public static final String QUERY_HEADER = "## PROMQL:";
    public static final String ERROR_HEADER = "## ERROR";

    private static final Pattern SERVICE_MATCHER = Pattern.compile("service=\"([^\"]+)\"");

    /**
     * @param lines          lines of one metric dump
     * @param defaultService service of sections that do not name one, may be null
     * @return the samples in the order of the dump
     */
    public List<MetricSample> parse(List<String> lines, String defaultService) {
        checkNotNull(lines, "lines must not be null");
        List<MetricSample> samples = new ArrayList<>();
        String fileService = defaultService;
        String sectionService = null;
        MetricName metric = null;
        int skipped = 0;

        for (String raw : lines) {
            String line = raw.trim();
            if (line.startsWith(METRIC_HEADER)) {
                String name = line.substring(METRIC_HEADER.length()).trim();
                Optional<MetricName> known = MetricName.fromExternalName(name);
                if (!known.isPresent()) {
                    log.warn("skipping unknown metric {}", name);
                }
                metric = known.orElse(null);
                sectionService = null;
            } else if (line.startsWith(QUERY_HEADER)) {
                Matcher matcher = SERVICE_MATCHER.matcher(line);
                if (matcher.find()) {
                    sectionService = matcher.group(1);
                }
            } else if (line.startsWith(ERROR_HEADER)) {
                if (metric != null) {
                    log.warn("skipping metric {} of a failed collection: {}", metric.getExternalName(), line);
                }
                metric = null;
            } else if (line.startsWith(SERVICE_HEADER)) {
                fileService = line.substring(SERVICE_HEADER.length()).trim();
            } else if (!line.isEmpty() && !line.startsWith("#") && metric != null) {
                String service = (sectionService != null) ? sectionService : fileService;
                MetricSample sample = isBlank(service) ? null : parseSample(line, service, metric);
                if (sample == null) {
                    skipped++;
                } else {
                    samples.add(sample);
                }
            }
        }
        if (skipped > 0) {
            log.debug("skipped {} metric lines without a service or a finite value", skipped);
        }
        return samples;
    }

    /**
     * @param location a metric dump, or a directory of per-service metric dumps
     * @return the samples of all dumps
     * @throws IOException if the location cannot be read
     */
    public List<MetricSample> parse(Path location) throws IOException {
        List<MetricSample> samples = new ArrayList<>();
        for (Path file : DumpFiles.list(location)) {
            samples.addAll(parse(DumpFiles.readLines(file), DumpFiles.baseName(file)));
        }
        log.info("parsed {} metric samples from {}", samples.size(), location);
        return samples;
    }

    private static MetricSample parseSample(String line, String service, MetricName metric) {
        String[] parts = line.split("\t");
        if (parts.length != 2) {
            return null;
        }
        try {
            Instant timestamp = parseInstant(parts[0].trim());
            double value = Double.parseDouble(parts[1].trim());
            if (!Double.isFinite(value)) {
                return null;
            }
            return new MetricSample(timestamp, service, metric, value);
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("skipping malformed metric line for {}: {}", metric.getExternalName(), e.getMessage());
            return null;
        }
    }

    /**
     * @param text an ISO-8601 date-time with a zone offset, {@code Z} or
     *             {@code +00:00}
     * @return the instant
     */
    static Instant parseInstant(String text) {
        return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }
}
