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

package com.amazon.rootcauseforest.anomalydetection;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.amazon.rootcauseforest.config.LogLevel;
import com.amazon.rootcauseforest.model.EnrichedRecord;

/**
 * Selects the records that are worth scoring. INFO records and records whose
 * message contains one of the ignored phrases, compared case-insensitively, are
 * dropped.
 */
public class RecordFilter {

    private final List<String> ignoreMessages;

    /**
     * @param ignoreMessages lower case phrases of benign messages
     */
    public RecordFilter(List<String> ignoreMessages) {
        checkNotNull(ignoreMessages, "ignoreMessages must not be null");
        List<String> lowered = new ArrayList<>(ignoreMessages.size());
        for (String message : ignoreMessages) {
            lowered.add(message.toLowerCase(Locale.ROOT));
        }
        this.ignoreMessages = Collections.unmodifiableList(lowered);
    }

    public boolean accept(EnrichedRecord record) {
        if (record.getLevel() == LogLevel.INFO) {
            return false;
        }
        String message = record.getMessage().toLowerCase(Locale.ROOT);
        for (String ignored : ignoreMessages) {
            if (message.contains(ignored)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param records enriched records
     * @return the accepted records in their original order
     */
    public List<EnrichedRecord> filter(List<EnrichedRecord> records) {
        checkNotNull(records, "records must not be null");
        List<EnrichedRecord> accepted = new ArrayList<>();
        for (EnrichedRecord record : records) {
            if (accept(record)) {
                accepted.add(record);
            }
        }
        return accepted;
    }

    public List<String> getIgnoreMessages() {
        return ignoreMessages;
    }
}
