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

package com.amazon.rootcauseforest.statistics;

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Column-wise standardization to zero mean and unit variance. A standardizer is
 * fitted on one batch and applied to the same batch; it is never reused across
 * analysis runs. Constant columns are centered but not scaled.
 */
public class Standardizer {

    private final double[] means;
    private final double[] scales;

    private Standardizer(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    /**
     * @param data a non-empty matrix with rows of equal length
     * @return the standardizer fitted on the columns of the matrix
     */
    public static Standardizer fit(double[][] data) {
        checkNotNull(data, "data must not be null");
        checkArgument(data.length > 0, "cannot fit on an empty matrix");
        int dimensions = data[0].length;
        Deviation[] deviations = new Deviation[dimensions];
        for (int j = 0; j < dimensions; j++) {
            deviations[j] = new Deviation();
        }
        for (double[] row : data) {
            checkArgument(row.length == dimensions, "rows must have equal length");
            for (int j = 0; j < dimensions; j++) {
                deviations[j].update(row[j]);
            }
        }
        double[] means = new double[dimensions];
        double[] scales = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            means[j] = deviations[j].getMean();
            double deviation = deviations[j].getDeviation();
            scales[j] = (deviation > 0 && Double.isFinite(deviation)) ? deviation : 1.0;
        }
        return new Standardizer(means, scales);
    }

    public double[] transform(double[] point) {
        checkArgument(point.length == means.length, "incorrect dimensions");
        double[] result = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            result[j] = (point[j] - means[j]) / scales[j];
        }
        return result;
    }

    public double[][] transform(double[][] data) {
        double[][] result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            result[i] = transform(data[i]);
        }
        return result;
    }

    public double[] getMeans() {
        return Arrays.copyOf(means, means.length);
    }

    public double[] getScales() {
        return Arrays.copyOf(scales, scales.length);
    }
}
