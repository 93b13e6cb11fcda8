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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.amazon.rootcauseforest.config.LogLevel;
import com.amazon.rootcauseforest.model.LogEvent;

/**
 * Parses application log dumps into {@link LogEvent}s. A record line carries an
 * ISO-8601 instant with a fraction of a second, the level, the
 * {@code [service,trace,span]} tracing block, the logger class and the message:
 *
 * <pre>
 * 2024-05-01T10:00:02.123Z ERROR [loans-ms,5eed,a1b2] 1 --- [exec-3] c.e.LoansController : Boom
 * </pre>
 *
 * Anything before the instant, such as the timestamp and TAB written by the log
 * collector, is ignored. A line that is not a record line continues the message
 * of the previous record; continuation lines before the first record of a file
 * are dropped. Blank lines and lines starting with {@code #} are skipped.
 */
@Slf4j
public class LogLineParser {

    public static final Pattern RECORD_PATTERN = Pattern
            .compile("(?<timestamp>\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d+)Z\\s+(?<level>[A-Z]+)\\s+"
                    + "\\[(?<service>[^,\\]]+),(?<trace>[^,\\]]+),(?<span>[^\\]]+)\\]\\s.*?"
                    + "(?<className>[a-zA-Z0-9_.$]+)\\s*:\\s(?<message>.*)");

    public static final String CONTINUATION_SEPARATOR = " | ";

    /**
     * Parses the lines of one dump.
     *
     * @param lines lines of a log dump
     * @return the events in the order of their timestamps; events with equal
     *         timestamps keep their order in the dump
     */
    public List<LogEvent> parse(List<String> lines) {
        checkNotNull(lines, "lines must not be null");
        List<LogEvent> events = new ArrayList<>();
        parseInto(lines, events);
        events.sort(Comparator.comparing(LogEvent::getTimestamp));
        return events;
    }

    /**
     * @param location a log dump, or a directory of log dumps
     * @return the events of all dumps in the order of their timestamps
     * @throws IOException if the location cannot be read
     */
    public List<LogEvent> parse(Path location) throws IOException {
        List<LogEvent> events = new ArrayList<>();
        for (Path file : DumpFiles.list(location)) {
            int before = events.size();
            parseInto(DumpFiles.readLines(file), events);
            log.debug("parsed {} log events from {}", events.size() - before, file);
        }
        events.sort(Comparator.comparing(LogEvent::getTimestamp));
        log.info("parsed {} log events from {}", events.size(), location);
        return events;
    }

    private void parseInto(List<String> lines, List<LogEvent> events) {
        PendingRecord pending = null;
        int dropped = 0;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            Matcher matcher = RECORD_PATTERN.matcher(line);
            if (matcher.find()) {
                if (pending != null) {
                    events.add(pending.toEvent());
                }
                try {
                    pending = PendingRecord.of(matcher);
                } catch (DateTimeParseException e) {
                    log.warn("skipping log record with an invalid timestamp: {}", e.getMessage());
                    pending = null;
                }
            } else if (pending != null) {
                pending.message.append(CONTINUATION_SEPARATOR).append(line);
            } else {
                dropped++;
            }
        }
        if (pending != null) {
            events.add(pending.toEvent());
        }
        if (dropped > 0) {
            log.debug("dropped {} lines that do not belong to any record", dropped);
        }
    }

    private static class PendingRecord {
        private Instant timestamp;
        private LogLevel level;
        private String service;
        private String traceId;
        private String spanId;
        private String className;
        private final StringBuilder message = new StringBuilder();

        static PendingRecord of(Matcher matcher) {
            PendingRecord record = new PendingRecord();
            record.timestamp = Instant.parse(matcher.group("timestamp") + "Z");
            record.level = LogLevel.fromName(matcher.group("level"));
            record.service = matcher.group("service").trim();
            record.traceId = matcher.group("trace").trim();
            record.spanId = matcher.group("span").trim();
            record.className = matcher.group("className");
            record.message.append(matcher.group("message").trim());
            return record;
        }

        LogEvent toEvent() {
            return new LogEvent(timestamp, level, service, traceId, spanId, className, message.toString());
        }
    }
}
