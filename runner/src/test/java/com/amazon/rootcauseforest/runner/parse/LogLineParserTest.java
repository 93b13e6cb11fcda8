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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.rootcauseforest.config.LogLevel;
import com.amazon.rootcauseforest.model.LogEvent;
import com.amazon.rootcauseforest.testutils.IncidentScenario;

public class LogLineParserTest {

    private final LogLineParser parser = new LogLineParser();

    @Test
    public void testRecordLine() {
        List<LogEvent> events = parser.parse(Arrays.asList(
                "2024-05-01T10:00:02.123456Z ERROR [loans-ms,5eed00a1,a1b2c3] 1 --- [nio-8090-exec-3] "
                        + "c.e.loans.LoansController : Failed to process: java.lang.IllegalStateException: boom"));

        assertEquals(1, events.size());
        LogEvent event = events.get(0);
        assertEquals(Instant.parse("2024-05-01T10:00:02.123456Z"), event.getTimestamp());
        assertEquals(LogLevel.ERROR, event.getLevel());
        assertEquals("loans-ms", event.getService());
        assertEquals("5eed00a1", event.getTraceId());
        assertEquals("a1b2c3", event.getSpanId());
        assertEquals("c.e.loans.LoansController", event.getClassName());
        assertEquals("Failed to process: java.lang.IllegalStateException: boom", event.getMessage());
    }

    @Test
    public void testPaddedLevelAndCollectorPrefix() {
        List<LogEvent> events = parser.parse(Arrays.asList(
                "2024-05-01T10:00:05.001Z\t2024-05-01T10:00:05.000Z  INFO [cards-ms,-,-] 1 --- [main] "
                        + "c.e.cards.CardsApplication : Started CardsApplication",
                "2024-05-01T10:00:06.000Z WARNING [cards-ms,t1,s1] 1 --- [main] c.e.cards.Cards : slow"));

        assertEquals(2, events.size());
        assertEquals(LogLevel.INFO, events.get(0).getLevel());
        assertEquals(Instant.parse("2024-05-01T10:00:05Z"), events.get(0).getTimestamp());
        assertEquals("-", events.get(0).getTraceId());
        assertEquals(LogLevel.WARN, events.get(1).getLevel());
    }

    @Test
    public void testContinuationLines() {
        List<LogEvent> events = parser.parse(Arrays.asList("\tat orphan.Frame(Frame.java:1)",
                "2024-05-01T10:00:02.000Z ERROR [loans-ms,t1,s1] 1 --- [exec-1] c.e.Loans : java.lang.OutOfMemoryError",
                "\tat java.base/java.util.Arrays.copyOf(Arrays.java:3537)", "",
                "\tat com.example.Report.render(Report.java:88)",
                "2024-05-01T10:00:03.000Z DEBUG [loans-ms,t2,s2] 1 --- [exec-2] c.e.Loans : next"));

        assertEquals(2, events.size());
        assertEquals("java.lang.OutOfMemoryError | at java.base/java.util.Arrays.copyOf(Arrays.java:3537)"
                + " | at com.example.Report.render(Report.java:88)", events.get(0).getMessage());
        assertEquals("next", events.get(1).getMessage());
    }

    @Test
    public void testCommentsAndInvalidTimestamps() {
        List<LogEvent> events = parser.parse(Arrays.asList("# collected from loans-ms",
                "2024-13-01T10:00:02.000Z ERROR [loans-ms,t1,s1] 1 --- [exec-1] c.e.Loans : bad month",
                "\tat lost.Frame(Frame.java:1)",
                "2024-05-01T10:00:02.000Z ERROR [loans-ms,t2,s1] 1 --- [exec-1] c.e.Loans : good"));

        assertEquals(1, events.size());
        assertEquals("good", events.get(0).getMessage());
    }

    @Test
    public void testEventsAreSortedByTimestamp() {
        List<LogEvent> events = parser.parse(Arrays.asList(
                "2024-05-01T10:00:03.000Z ERROR [a,t1,s] 1 --- [x] c.e.A : third",
                "2024-05-01T10:00:01.000Z ERROR [b,t2,s] 1 --- [x] c.e.B : first",
                "2024-05-01T10:00:03.000Z ERROR [c,t3,s] 1 --- [x] c.e.C : fourth",
                "2024-05-01T10:00:02.000Z ERROR [d,t4,s] 1 --- [x] c.e.D : second"));

        assertEquals(Arrays.asList("first", "second", "third", "fourth"),
                Arrays.asList(events.get(0).getMessage(), events.get(1).getMessage(), events.get(2).getMessage(),
                        events.get(3).getMessage()));
    }

    @Test
    public void testParseDirectory(@TempDir Path directory) throws IOException {
        IncidentScenario scenario = new IncidentScenario(20, 3L);
        for (Map.Entry<String, List<String>> entry : scenario.logLinesByService(true).entrySet()) {
            Files.write(directory.resolve(entry.getKey() + ".log"), entry.getValue(), StandardCharsets.UTF_8);
        }

        List<LogEvent> events = parser.parse(directory);

        // one start line per service, a gateway line and a downstream line per
        // request, and the gateway warning of the incident
        assertEquals(4 + 2 * 20 + 1, events.size());
        for (int i = 1; i < events.size(); i++) {
            assertTrue(!events.get(i).getTimestamp().isBefore(events.get(i - 1).getTimestamp()));
        }
        LogEvent incident = events.stream().filter(e -> e.getLevel() == LogLevel.ERROR).findFirst().get();
        assertEquals(scenario.getIncidentService(), incident.getService());
        assertEquals(scenario.getIncidentTraceId(), incident.getTraceId());
        assertEquals(scenario.getIncidentTime(), incident.getTimestamp());
        assertTrue(incident.getMessage().startsWith(IncidentScenario.INCIDENT_MESSAGE + " | at "));
        // start lines of all services share one timestamp, so only the content is compared
        assertEquals(new HashSet<>(parser.parse(scenario.logLines(false))), new HashSet<>(events));
    }
}
