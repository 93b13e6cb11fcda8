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

package com.amazon.rootcauseforest.state;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;

import com.amazon.rootcauseforest.MalformedRecordException;
import com.amazon.rootcauseforest.rootcause.RCARecord;

public class RCARecordMapper implements IStateMapper<RCARecord, RCARecordState> {

    @Override
    public RCARecord toModel(RCARecordState state) {
        checkNotNull(state, "state must not be null");
        String traceId = required(state.getTraceId(), "trace_id");
        String rootCauseService = required(state.getRootCauseService(), "root_cause_service");
        String message = required(state.getMessage(), "message");
        Instant timestamp;
        try {
            timestamp = Instant.parse(required(state.getTimestamp(), "timestamp"));
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("invalid timestamp in report record: " + state.getTimestamp(), e);
        }
        return new RCARecord(traceId, rootCauseService, timestamp, message,
                state.getAnomalyScore(),
                (state.getMetricSnapshot() == null) ? Collections.emptyMap() : state.getMetricSnapshot(),
                (state.getSuggestions() == null) ? Collections.emptyList() : state.getSuggestions(),
                (state.getAffectedServices() == null) ? Collections.emptyList() : state.getAffectedServices());
    }

    private static String required(String value, String field) {
        if (value == null) {
            throw new MalformedRecordException("report record has no " + field);
        }
        return value;
    }

    @Override
    public RCARecordState toState(RCARecord model) {
        RCARecordState state = new RCARecordState();
        state.setTraceId(model.getTraceId());
        state.setRootCauseService(model.getRootCauseService());
        state.setTimestamp(model.getTimestamp().toString());
        state.setMessage(model.getMessage());
        state.setAnomalyScore(model.getAnomalyScore());
        state.setMetricSnapshot(new LinkedHashMap<>(model.getMetricSnapshot()));
        state.setSuggestions(new ArrayList<>(model.getSuggestions()));
        state.setAffectedServices(new ArrayList<>(model.getAffectedServices()));
        return state;
    }
}
