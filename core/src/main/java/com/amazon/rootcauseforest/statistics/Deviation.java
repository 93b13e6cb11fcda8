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

/**
 * Running mean and population standard deviation of a stream of values, using
 * Welford's update so that a constant stream has a deviation of exactly 0.
 */
public class Deviation {

    protected long count = 0;

    protected double mean = 0;

    protected double sumSquaredDifferences = 0;

    public void update(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        sumSquaredDifferences += delta * (value - mean);
    }

    public double getMean() {
        checkArgument(count > 0, "incorrect invocation for mean");
        return mean;
    }

    public double getDeviation() {
        checkArgument(count > 0, "incorrect invocation for standard deviation");
        double answer = sumSquaredDifferences / count;
        return (answer > 0) ? Math.sqrt(answer) : 0;
    }

    public long getCount() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
