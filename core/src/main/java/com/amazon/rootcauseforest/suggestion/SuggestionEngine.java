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

package com.amazon.rootcauseforest.suggestion;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.amazon.rootcauseforest.config.ExceedanceMetric;

/**
 * Maps a root-cause record to an ordered list of remediation hints. Rules are
 * evaluated in three tiers:
 * <ol>
 * <li>the out-of-memory rule, whose text depends on the heap usage ratio;</li>
 * <li>one rule per exceeded metric threshold, where the heap rule is skipped
 * when the out-of-memory rule fired;</li>
 * <li>if nothing above matched, the first matching message keyword rule, ending
 * in a generic hint that always matches.</li>
 * </ol>
 */
public class SuggestionEngine {

    public static final Pattern OUT_OF_MEMORY_PATTERN = Pattern
            .compile("outofmemoryerror|out of memory|java heap space|gc overhead|\\boom\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Heap usage ratio above which an out-of-memory error is attributed to the
     * heap itself.
     */
    public static final double OUT_OF_MEMORY_HEAP_RATIO = 0.85;

    public static final String HEAP_LEAK_SUGGESTION = "OutOfMemoryError with heap usage above 85%: "
            + "inspect heap dumps for memory leaks or increase -Xmx";
    public static final String NATIVE_MEMORY_SUGGESTION = "OutOfMemoryError with heap usage below 85%: "
            + "check container memory limits, native memory and metaspace";
    public static final String LATENCY_SUGGESTION = "High p95 latency: "
            + "inspect slow dependencies, thread pools and downstream calls";
    public static final String CPU_SUGGESTION = "High CPU usage: profile hot code paths or scale out the service";
    public static final String HEAP_SUGGESTION = "High JVM heap usage: "
            + "review memory allocation, caches and GC configuration";
    public static final String ERROR_RATE_SUGGESTION = "High error rate: "
            + "inspect recent deployments and failing endpoints";
    public static final String CONNECTION_POOL_SUGGESTION = "Connection pool saturation: "
            + "increase the HikariCP pool size or look for connection leaks and slow queries";
    public static final String GENERIC_SUGGESTION = "Review logs and metrics for deeper context";

    private static final SuggestionRule HEAP_EXCEEDANCE_RULE = exceedance(ExceedanceMetric.JVM_HEAP_USAGE_RATIO,
            HEAP_SUGGESTION);

    private static final List<SuggestionRule> EXCEEDANCE_RULES = Collections.unmodifiableList(Arrays.asList(
            exceedance(ExceedanceMetric.LATENCY_P95_MS, LATENCY_SUGGESTION),
            exceedance(ExceedanceMetric.CPU_USAGE, CPU_SUGGESTION), HEAP_EXCEEDANCE_RULE,
            exceedance(ExceedanceMetric.ERROR_RATE, ERROR_RATE_SUGGESTION),
            exceedance(ExceedanceMetric.HIKARICP_ACTIVE, CONNECTION_POOL_SUGGESTION)));

    private static final List<SuggestionRule> FALLBACK_RULES = Collections.unmodifiableList(Arrays.asList(
            SuggestionRule.keyword("timeout", "Increase timeout or inspect slow dependencies", "timeout",
                    "timed out"),
            SuggestionRule.keyword("connection-refused",
                    "Connection refused: verify the target service is up and reachable on the expected port",
                    "connection refused"),
            SuggestionRule.keyword("customer-details", "Check DB connection or downstream customer API",
                    "failed to retrieve customer details"),
            SuggestionRule.keyword("missing-mapping", "Verify controller endpoint or routing config", "nomapping",
                    "page not found"),
            SuggestionRule.keyword("mail-batch", "Check notification queue or mail server", "emailbatch"),
            SuggestionRule.keyword("transaction", "Review transaction boundaries or DB locks", "jta",
                    "transaction"),
            SuggestionRule.keyword("connection", "Investigate DB or network connection stability", "connection"),
            SuggestionRule.keyword("database", "Review DB performance or slow queries", "database", "query"),
            SuggestionRule.keyword("exception", "Check stack trace and root exception", "exception"),
            new SuggestionRule("generic", context -> true, GENERIC_SUGGESTION)));

    private static final SuggestionRule HEAP_LEAK_RULE = new SuggestionRule("out-of-memory-heap",
            context -> isOutOfMemory(context) && context.getHeapUsageRatio() > OUT_OF_MEMORY_HEAP_RATIO,
            HEAP_LEAK_SUGGESTION);

    private static final SuggestionRule NATIVE_MEMORY_RULE = new SuggestionRule("out-of-memory-native",
            context -> isOutOfMemory(context) && context.getHeapUsageRatio() <= OUT_OF_MEMORY_HEAP_RATIO,
            NATIVE_MEMORY_SUGGESTION);

    private static SuggestionRule exceedance(ExceedanceMetric metric, String text) {
        return new SuggestionRule(metric.getExternalName() + "-exceedance", context -> context.isExceeded(metric),
                text);
    }

    static boolean isOutOfMemory(SuggestionContext context) {
        return OUT_OF_MEMORY_PATTERN.matcher(context.getMessage()).find();
    }

    /**
     * @param context the root-cause record
     * @return the matched suggestions in rule order; never empty
     */
    public List<String> suggest(SuggestionContext context) {
        checkNotNull(context, "context must not be null");
        List<SuggestionRule> outOfMemory = Stream.of(HEAP_LEAK_RULE, NATIVE_MEMORY_RULE)
                .filter(rule -> rule.matches(context)).collect(Collectors.toList());
        List<SuggestionRule> matched = new ArrayList<>(outOfMemory);
        EXCEEDANCE_RULES.stream().filter(rule -> outOfMemory.isEmpty() || rule != HEAP_EXCEEDANCE_RULE)
                .filter(rule -> rule.matches(context)).forEach(matched::add);
        if (matched.isEmpty()) {
            FALLBACK_RULES.stream().filter(rule -> rule.matches(context)).findFirst().ifPresent(matched::add);
        }
        return matched.stream().map(SuggestionRule::getSuggestion).collect(Collectors.toList());
    }

    public static List<SuggestionRule> getExceedanceRules() {
        return EXCEEDANCE_RULES;
    }

    public static List<SuggestionRule> getFallbackRules() {
        return FALLBACK_RULES;
    }
}
