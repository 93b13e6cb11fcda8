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

package com.amazon.rootcauseforest.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * This class samples points from a multi-variate normal distribution with
 * covariance matrix sigma * I and replaces a few rows, at known positions, with
 * points from a second, distant normal distribution. The planted rows are the
 * outliers a detector is expected to find. All randomness comes from the seed.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double outlierMu;
    private final double outlierSigma;

    public NormalMixtureTestData(double baseMu, double baseSigma, double outlierMu, double outlierSigma) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.outlierMu = outlierMu;
        this.outlierSigma = outlierSigma;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 8.0, 0.5);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateTestDataWithOutliers(numberOfRows, numberOfColumns, 0, seed).getData();
    }

    /**
     * @param numberOfRows     number of rows
     * @param numberOfColumns  number of columns
     * @param numberOfOutliers number of rows drawn from the outlier distribution
     * @param seed             random seed
     * @return the matrix and the sorted indices of the planted outliers
     */
    public LabeledTestData generateTestDataWithOutliers(int numberOfRows, int numberOfColumns, int numberOfOutliers,
            long seed) {
        if (numberOfOutliers > numberOfRows) {
            throw new IllegalArgumentException("more outliers than rows");
        }
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);
        double[][] data = new double[numberOfRows][numberOfColumns];
        for (int i = 0; i < numberOfRows; i++) {
            fillRow(data[i], dist, baseMu, baseSigma);
        }

        int[] rows = new int[numberOfRows];
        for (int i = 0; i < numberOfRows; i++) {
            rows[i] = i;
        }
        for (int i = 0; i < numberOfOutliers; i++) {
            int j = i + rng.nextInt(numberOfRows - i);
            int swap = rows[i];
            rows[i] = rows[j];
            rows[j] = swap;
        }
        int[] outliers = Arrays.copyOf(rows, numberOfOutliers);
        Arrays.sort(outliers);
        for (int index : outliers) {
            fillRow(data[index], dist, outlierMu, outlierSigma);
        }
        return new LabeledTestData(data, outliers);
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    public static class LabeledTestData {
        private final double[][] data;
        private final int[] outlierIndices;

        LabeledTestData(double[][] data, int[] outlierIndices) {
            this.data = data;
            this.outlierIndices = outlierIndices;
        }

        public double[][] getData() {
            return data;
        }

        public int[] getOutlierIndices() {
            return outlierIndices;
        }

        public boolean isOutlier(int row) {
            return Arrays.binarySearch(outlierIndices, row) >= 0;
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
