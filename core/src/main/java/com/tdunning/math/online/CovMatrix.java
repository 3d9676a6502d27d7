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
 * Covariance matrix of {@code d} variables.
 *
 * The sufficient statistics are the mean vector {@code b} and the raw second moment {@code A = E[x x']}, each updated
 * by smoothing.  Since both are raw moments, merging is a plain smooth of each and needs no shift correction.  The
 * covariance {@code (A - b b') * unbias} is computed on every read into a new matrix, reading never changes the
 * accumulator.
 *
 * The difference of raw moments loses precision when the means are large compared to the spread.  Data with an
 * offset of many orders of magnitude beyond its standard deviation should be centered before it is added, or
 * tracked with {@link Variances} when only the variances are needed.  Variances that cancel below zero are reported
 * as zero.
 */
public class CovMatrix extends VectorStat<CovMatrix> {
    private static final double ZERO_VARIANCE = 1e-12;

    private final double[] b;
    private final double[][] a;

    public CovMatrix(int dimension) {
        this(dimension, Weight.equal());
    }

    public CovMatrix(int dimension, Weight weight) {
        super(dimension, weight);
        b = new double[dimension];
        a = new double[dimension][dimension];
    }

    @Override
    protected void fit(double[] x, double gamma) {
        Smooth.smooth(b, x, gamma);
        Smooth.smoothRank1(a, x, gamma);
    }

    @Override
    protected void combine(CovMatrix other, double gamma) {
        Smooth.smooth(a, other.a, gamma);
        Smooth.smooth(b, other.b, gamma);
    }

    /**
     * Returns the bias-corrected covariance matrix.  The result is exactly symmetric and is not shared with the
     * accumulator.
     */
    public double[][] value() {
        int d = b.length;
        double unbias = unbias();
        double[][] r = new double[d][d];
        for (int i = 0; i < d; i++) {
            r[i][i] = Math.max(0, (a[i][i] - b[i] * b[i]) * unbias);
            for (int j = i + 1; j < d; j++) {
                double v = (a[i][j] - b[i] * b[j]) * unbias;
                r[i][j] = v;
                r[j][i] = v;
            }
        }
        return r;
    }

    public double[][] cov() {
        return value();
    }

    public double[] mean() {
        return b.clone();
    }

    /**
     * Returns the diagonal of the covariance matrix.
     */
    public double[] var() {
        int d = b.length;
        double unbias = unbias();
        double[] r = new double[d];
        for (int i = 0; i < d; i++) {
            r[i] = Math.max(0, (a[i][i] - b[i] * b[i]) * unbias);
        }
        return r;
    }

    public double[] std() {
        double[] r = var();
        for (int i = 0; i < r.length; i++) {
            r[i] = Math.sqrt(r[i]);
        }
        return r;
    }

    /**
     * Returns the correlation matrix.  The diagonal is exactly 1.  A variable with no variance is reported as
     * uncorrelated with every other variable.  Variances that are within rounding of zero relative to the second
     * moment count as none.
     */
    public double[][] cor() {
        double[][] r = value();
        int d = r.length;
        double[] scale = new double[d];
        for (int i = 0; i < d; i++) {
            scale[i] = r[i][i] > ZERO_VARIANCE * a[i][i] ? 1 / Math.sqrt(r[i][i]) : 0;
        }
        for (int i = 0; i < d; i++) {
            for (int j = i + 1; j < d; j++) {
                double v = r[i][j] * scale[i] * scale[j];
                r[i][j] = v;
                r[j][i] = v;
            }
            r[i][i] = 1.0;
        }
        return r;
    }

    @Override
    public String toString() {
        return "CovMatrix{d=" + dimension() + ", n=" + count() + '}';
    }
}
