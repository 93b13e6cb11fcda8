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

import java.util.ArrayList;
import java.util.List;

import com.amazon.rootcauseforest.report.Report;
import com.amazon.rootcauseforest.report.Summary;
import com.amazon.rootcauseforest.report.TopError;
import com.amazon.rootcauseforest.rootcause.RCARecord;

/**
 * Maps a {@link Report} to a {@link ReportState} and back. A missing summary or
 * list reads as empty.
 */
public class ReportMapper implements IStateMapper<Report, ReportState> {

    private final RCARecordMapper recordMapper = new RCARecordMapper();

    @Override
    public Report toModel(ReportState state) {
        checkNotNull(state, "state must not be null");
        long anomalyCount = 0;
        List<TopError> topErrors = new ArrayList<>();
        SummaryState summaryState = state.getSummary();
        if (summaryState != null) {
            anomalyCount = summaryState.getAnomalyCount();
            if (summaryState.getTopErrors() != null) {
                for (TopErrorState topError : summaryState.getTopErrors()) {
                    topErrors.add(new TopError(topError.getMessage(), topError.getCount()));
                }
            }
        }
        List<RCARecord> anomalies = new ArrayList<>();
        if (state.getAnomalies() != null) {
            for (RCARecordState recordState : state.getAnomalies()) {
                anomalies.add(recordMapper.toModel(recordState));
            }
        }
        return new Report(new Summary(anomalyCount, topErrors), anomalies);
    }

    @Override
    public ReportState toState(Report model) {
        checkNotNull(model, "model must not be null");
        SummaryState summaryState = new SummaryState();
        summaryState.setAnomalyCount(model.getSummary().getAnomalyCount());
        List<TopErrorState> topErrors = new ArrayList<>();
        for (TopError topError : model.getSummary().getTopErrors()) {
            TopErrorState topErrorState = new TopErrorState();
            topErrorState.setMessage(topError.getMessage());
            topErrorState.setCount(topError.getCount());
            topErrors.add(topErrorState);
        }
        summaryState.setTopErrors(topErrors);

        List<RCARecordState> anomalies = new ArrayList<>();
        for (RCARecord record : model.getAnomalies()) {
            anomalies.add(recordMapper.toState(record));
        }
        ReportState state = new ReportState();
        state.setSummary(summaryState);
        state.setAnomalies(anomalies);
        return state;
    }
}
