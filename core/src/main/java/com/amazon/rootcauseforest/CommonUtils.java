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

package com.amazon.rootcauseforest;

import java.util.Objects;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    /**
     * The Euler-Mascheroni constant, used in the asymptotic expansion of harmonic
     * numbers.
     */
    public static final double EULER_MASCHERONI = 0.5772156649015329;

    /**
     * Harmonic numbers up to this argument are summed exactly, larger ones use the
     * asymptotic expansion.
     */
    static final int EXACT_HARMONIC_LIMIT = 1024;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * @param value a string, possibly null
     * @return true if the value is null or contains only whitespace
     */
    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * The n-th harmonic number H(n) = 1 + 1/2 + ... + 1/n. Small arguments are
     * summed exactly so that the path length correction of tiny leaves is exact;
     * larger arguments use ln(n) + gamma + 1/(2n).
     *
     * @param n a non-negative integer
     * @return H(n), and 0 for n = 0
     */
    public static double harmonicNumber(long n) {
        checkArgument(n >= 0, "harmonic number is defined for non-negative arguments");
        if (n <= EXACT_HARMONIC_LIMIT) {
            double sum = 0;
            for (long i = n; i >= 1; i--) {
                sum += 1.0 / i;
            }
            return sum;
        }
        return Math.log(n) + EULER_MASCHERONI + 1.0 / (2.0 * n);
    }

    /**
     * The expected path length of an unsuccessful search in a binary search tree
     * built on n points, c(n) = 2H(n-1) - 2(n-1)/n. This is the correction added at
     * a leaf which still holds n points, and the normalizer of the average path
     * length over a forest built on subsamples of size n.
     *
     * @param n number of points
     * @return c(n), and 0 for n at most 1
     */
    public static double averagePathLength(long n) {
        if (n <= 1) {
            return 0;
        }
        return 2.0 * harmonicNumber(n - 1) - 2.0 * (n - 1) / n;
    }

    /**
     * Divides and maps non-finite results to 0, so that downstream numeric code
     * never observes NaN or infinity.
     *
     * @param numerator   numerator
     * @param denominator denominator
     * @return the finite quotient or 0
     */
    public static double safeDivide(double numerator, double denominator) {
        double answer = numerator / denominator;
        return Double.isFinite(answer) ? answer : 0;
    }
}
