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
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public class Summary {

    private final long anomalyCount;
    /**
     * most frequent anomalous messages, most frequent first
     */
    private final List<TopError> topErrors;

    public Summary(long anomalyCount, List<TopError> topErrors) {
        checkArgument(anomalyCount >= 0, "anomalyCount must not be negative");
        this.anomalyCount = anomalyCount;
        this.topErrors = Collections
                .unmodifiableList(new ArrayList<>(checkNotNull(topErrors, "topErrors must not be null")));
    }

    public static Summary empty() {
        return new Summary(0, Collections.emptyList());
    }
}
