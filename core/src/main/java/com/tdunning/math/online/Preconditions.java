/*
 * Licensed to Ted Dunning under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tdunning.math.online;

/**
 * Argument and state checks shared by the weights and the statistics.
 */
public final class Preconditions {
    private Preconditions() {
    }

    /**
     * Ensures the truth of an expression involving one or more parameters to the calling method.
     *
     * @param expression a boolean expression
     * @param errorMessage the exception message to use if the check fails; will be converted to a string using
     *                     {@link String#valueOf(Object)}
     * @throws IllegalArgumentException if {@code expression} is false
     */
    public static void checkArgument(boolean expression, Object errorMessage) {
        if (!expression) {
            throw new IllegalArgumentException(String.valueOf(errorMessage));
        }
    }

    /**
     * Like {@link #checkArgument(boolean, Object)} but the message is only formatted on failure.
     */
    public static void checkArgument(boolean expression, String format, Object... args) {
        if (!expression) {
            throw new IllegalArgumentException(String.format(format, args));
        }
    }

    /**
     * Ensures the truth of an expression involving the state of the calling instance, but not involving any parameters
     * to the calling method.
     *
     * @param expression a boolean expression
     * @param errorMessage the exception message to use if the check fails
     * @throws IllegalStateException if {@code expression} is false
     */
    public static void checkState(boolean expression, Object errorMessage) {
        if (!expression) {
            throw new IllegalStateException(String.valueOf(errorMessage));
        }
    }

    /**
     * Rejects NaN observations.  Infinite values are allowed through since extrema can use them.
     */
    public static void checkValue(double x) {
        if (Double.isNaN(x)) {
            throw new IllegalArgumentException("Cannot add NaN");
        }
    }

    /**
     * Ensures a vector has the length an accumulator was built for.
     *
     * @throws ShapeMismatchException if the lengths differ
     */
    public static void checkLength(int expected, double[] x) {
        if (x.length != expected) {
            throw new ShapeMismatchException(expected, x.length);
        }
    }

    /**
     * Ensures a matrix is {@code rows} by {@code columns}.
     *
     * @throws ShapeMismatchException if any dimension differs
     */
    public static void checkShape(int rows, int columns, double[][] x) {
        if (x.length != rows) {
            throw new ShapeMismatchException(rows, x.length);
        }
        for (double[] row : x) {
            if (row.length != columns) {
                throw new ShapeMismatchException(columns, row.length);
            }
        }
    }
}
