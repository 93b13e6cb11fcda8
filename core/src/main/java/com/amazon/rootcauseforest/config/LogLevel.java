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

package com.amazon.rootcauseforest.config;

import java.util.Locale;

/**
 * Severity of a log event. The score is the ordinal severity used as a
 * feature: DEBUG=1, INFO=2, WARN=3, ERROR=4, CRITICAL=5 and 0 for levels that
 * are not recognised.
 */
public enum LogLevel {

    UNKNOWN(0), DEBUG(1), INFO(2), WARN(3), ERROR(4), CRITICAL(5);

    private final int score;

    LogLevel(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    /**
     * Maps a level name as written by the logging framework. WARNING is an alias of
     * WARN; anything unrecognised (including null) is {@link #UNKNOWN}.
     *
     * @param name the level name
     * @return the level
     */
    public static LogLevel fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return UNKNOWN;
    }
}
