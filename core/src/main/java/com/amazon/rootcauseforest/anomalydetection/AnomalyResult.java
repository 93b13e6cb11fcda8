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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The verdict of the detector for one scored record.
 */
@Getter
@EqualsAndHashCode
@ToString
public class AnomalyResult {

    /**
     * anomaly score in (0, 1], higher is more anomalous
     */
    private final double anomalyScore;
    private final boolean anomaly;

    public AnomalyResult(double anomalyScore, boolean anomaly) {
        this.anomalyScore = anomalyScore;
        this.anomaly = anomaly;
    }
}
