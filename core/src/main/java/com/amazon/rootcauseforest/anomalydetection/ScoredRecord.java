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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rootcauseforest.feature.FeatureVector;
import com.amazon.rootcauseforest.model.EnrichedRecord;

/**
 * An enriched record together with its features and the detector verdict.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ScoredRecord {

    private final EnrichedRecord record;
    private final FeatureVector features;
    private final AnomalyResult result;

    public ScoredRecord(EnrichedRecord record, FeatureVector features, AnomalyResult result) {
        this.record = checkNotNull(record, "record must not be null");
        this.features = checkNotNull(features, "features must not be null");
        this.result = checkNotNull(result, "result must not be null");
    }

    public double getAnomalyScore() {
        return result.getAnomalyScore();
    }

    public boolean isAnomaly() {
        return result.isAnomaly();
    }
}
