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

package com.amazon.rootcauseforest.model;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.time.Instant;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rootcauseforest.config.LogLevel;

/**
 * A single parsed log record. Continuation lines of a multi-line record are
 * already folded into the message. Identity fields (service, trace id) are not
 * validated here; the correlator rejects events that lack them.
 */
@Getter
@EqualsAndHashCode
@ToString
public class LogEvent {

    private final Instant timestamp;
    private final LogLevel level;
    private final String service;
    private final String traceId;
    private final String spanId;
    private final String className;
    private final String message;

    public LogEvent(Instant timestamp, LogLevel level, String service, String traceId, String spanId,
            String className, String message) {
        this.timestamp = checkNotNull(timestamp, "timestamp must not be null");
        this.level = (level == null) ? LogLevel.UNKNOWN : level;
        this.service = service;
        this.traceId = traceId;
        this.spanId = spanId;
        this.className = className;
        this.message = (message == null) ? "" : message;
    }
}
