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
 * The first four non-central moments, from which the mean, variance, skewness and kurtosis are derived.
 *
 * Skewness and kurtosis are the moment estimators based on the population variance.  Kurtosis is reported as excess
 * kurtosis so a normal distribution gives 0.
 */
public class Moments extends ScalarStat<Moments> {
    private final double[] m = new double[4];

    public Moments() {
        this(Weight.equal());
    }

    public Moments(Weight weight) {
        super(weight);
    }

    @Override
    protected void fit(double y, double gamma) {
        double y2 = y * y;
        m[0] = Smooth.smooth(m[0], y, gamma);
        m[1] = Smooth.smooth(m[1], y2, gamma);
        m[2] = Smooth.smooth(m[2], y2 * y, gamma);
        m[3] = Smooth.smooth(m[3], y2 * y2, gamma);
    }

    @Override
    protected void combine(Moments other, double gamma) {
        Smooth.smooth(m, other.m, gamma);
    }

    /**
     * Returns a copy of the raw moments {@code E[y], E[y^2], E[y^3], E[y^4]}.
     */
    public double[] value() {
        return m.clone();
    }

    public double mean() {
        return m[0];
    }

    /**
     * Returns the bias-corrected variance.
     */
    public double variance() {
        return centralVariance() * unbias();
    }

    public double std() {
        return Math.sqrt(variance());
    }

    /**
     * Returns the skewness, or NaN when the variance is zero.
     */
    public double skewness() {
        double mu = m[0];
        double v = centralVariance();
        double third = m[2] - 3 * mu * m[1] + 2 * mu * mu * mu;
        return third / Math.pow(v, 1.5);
    }

    /**
     * Returns the excess kurtosis, or NaN when the variance is zero.
     */
    public double kurtosis() {
        double mu = m[0];
        double v = centralVariance();
        double fourth = m[3] - 4 * mu * m[2] + 6 * mu * mu * m[1] - 3 * mu * mu * mu * mu;
        return fourth / (v * v) - 3;
    }

    private double centralVariance() {
        return Math.max(0, m[1] - m[0] * m[0]);
    }

    @Override
    public String toString() {
        return "Moments{mean=" + mean() + ", variance=" + variance() + ", n=" + count() + '}';
    }
}
