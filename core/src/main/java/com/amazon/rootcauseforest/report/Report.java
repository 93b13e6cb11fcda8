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

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rootcauseforest.rootcause.RCARecord;

/**
 * The outcome of one analysis run: aggregate statistics and the root-cause
 * records in trace discovery order. Instances are immutable.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Report {

    private final Summary summary;
    private final List<RCARecord> anomalies;

    public Report(Summary summary, List<RCARecord> anomalies) {
        this.summary = checkNotNull(summary, "summary must not be null");
        this.anomalies = Collections
                .unmodifiableList(new ArrayList<>(checkNotNull(anomalies, "anomalies must not be null")));
    }

    /**
     * @return a report without anomalies
     */
    public static Report empty() {
        return new Report(Summary.empty(), Collections.emptyList());
    }
}
