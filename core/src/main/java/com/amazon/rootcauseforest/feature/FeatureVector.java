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

package com.amazon.rootcauseforest.feature;

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.EqualsAndHashCode;

/**
 * The numeric features of one enriched record, indexed by {@link FeatureName}.
 * Instances are immutable.
 */
@EqualsAndHashCode
public class FeatureVector {

    private final double[] values;

    public FeatureVector(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length == FeatureName.dimensions(), "incorrect number of features");
        this.values = Arrays.copyOf(values, values.length);
    }

    public double get(FeatureName feature) {
        return values[feature.ordinal()];
    }

    /**
     * @return a copy of the feature values in column order
     */
    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("FeatureVector(");
        for (FeatureName feature : FeatureName.values()) {
            if (feature.ordinal() > 0) {
                builder.append(", ");
            }
            builder.append(feature.getColumnName()).append('=').append(values[feature.ordinal()]);
        }
        return builder.append(')').toString();
    }
}
