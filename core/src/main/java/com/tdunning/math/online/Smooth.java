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
 * The numerical kernel behind every statistic, {@code (1 - gamma) * old + gamma * x}.
 *
 * The convex form is used instead of {@code old + gamma * (x - old)} so that {@code gamma = 1} replaces the old value
 * exactly and small {@code gamma} never subtracts two large, nearly equal numbers.
 */
public final class Smooth {
    private Smooth() {
    }

    public static double smooth(double old, double x, double gamma) {
        return (1 - gamma) * old + gamma * x;
    }

    /**
     * Smooths {@code x} into {@code into} elementwise.
     *
     * @throws ShapeMismatchException if the vectors have different lengths
     */
    public static void smooth(double[] into, double[] x, double gamma) {
        Preconditions.checkLength(into.length, x);
        double keep = 1 - gamma;
        for (int i = 0; i < into.length; i++) {
            into[i] = keep * into[i] + gamma * x[i];
        }
    }

    /**
     * Smooths the matrix {@code x} into {@code into} elementwise.
     */
    public static void smooth(double[][] into, double[][] x, double gamma) {
        Preconditions.checkShape(into.length, into.length == 0 ? 0 : into[0].length, x);
        for (int i = 0; i < into.length; i++) {
            smooth(into[i], x[i], gamma);
        }
    }

    /**
     * Smooths the outer product {@code x x'} into the symmetric matrix {@code a}.  Only the upper triangle is computed,
     * the lower triangle is mirrored from it so that {@code a} stays exactly symmetric.
     *
     * @param a     A square matrix with the same dimension as {@code x}.
     * @param x     The new observation.
     * @param gamma The smoothing coefficient.
     */
    public static void smoothRank1(double[][] a, double[] x, double gamma) {
        int d = x.length;
        Preconditions.checkShape(d, d, a);
        double keep = 1 - gamma;
        for (int i = 0; i < d; i++) {
            double gx = gamma * x[i];
            for (int j = i; j < d; j++) {
                double v = keep * a[i][j] + gx * x[j];
                a[i][j] = v;
                a[j][i] = v;
            }
        }
    }
}
