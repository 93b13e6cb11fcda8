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

package com.amazon.rootcauseforest.report;

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.rootcauseforest.anomalydetection.ScoredRecord;
import com.amazon.rootcauseforest.rootcause.RCARecord;

/**
 * Assembles the {@link Report} of a run from the scored records and the
 * root-cause records.
 */
public class ReportBuilder {

    private final int topErrorsLimit;

    public ReportBuilder(int topErrorsLimit) {
        checkArgument(topErrorsLimit >= 0, "topErrorsLimit must not be negative");
        this.topErrorsLimit = topErrorsLimit;
    }

    public Report build(List<ScoredRecord> scored, List<RCARecord> rcaRecords) {
        checkNotNull(scored, "scored must not be null");
        checkNotNull(rcaRecords, "rcaRecords must not be null");
        List<String> anomalousMessages = new ArrayList<>();
        for (ScoredRecord record : scored) {
            if (record.isAnomaly()) {
                anomalousMessages.add(record.getRecord().getMessage());
            }
        }
        Summary summary = new Summary(anomalousMessages.size(), topErrors(anomalousMessages, topErrorsLimit));
        return new Report(summary, rcaRecords);
    }

    /**
     * @param messages messages in discovery order
     * @param limit    maximum number of entries
     * @return distinct messages by descending count; equal counts keep the order
     *         in which the messages were first seen
     */
    public static List<TopError> topErrors(List<String> messages, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String message : messages) {
            counts.merge(message, 1L, Long::sum);
        }
        List<TopError> errors = new ArrayList<>();
        counts.forEach((message, count) -> errors.add(new TopError(message, count)));
        // List.sort is stable
        errors.sort(Comparator.comparingLong(TopError::getCount).reversed());
        return new ArrayList<>(errors.subList(0, Math.min(limit, errors.size())));
    }

    public int getTopErrorsLimit() {
        return topErrorsLimit;
    }
}
