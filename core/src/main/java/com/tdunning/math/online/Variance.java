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
 * Running variance of a single variable.
 *
 * The update is Welford's algorithm rewritten in terms of a blend coefficient so that it works under any weight,
 * not only equal weighting.  The stored second moment is the biased (population) one; the bias correction is only
 * applied when the variance is read so that merges work on the uncorrected form.
 *
 * Merging uses the parallel form of the update, which adds {@code gamma * (1 - gamma) * delta^2} for the difference
 * {@code delta} between the two means.
 */
public class Variance extends ScalarStat<Variance> {
    private double mean = 0;
    // biased variance
    private double sigma2 = 0;

    public Variance() {
        this(Weight.equal());
    }

    public Variance(Weight weight) {
        super(weight);
    }

    @Override
    protected void fit(double y, double gamma) {
        double previous = mean;
        mean = Smooth.smooth(mean, y, gamma);
        sigma2 = Smooth.smooth(sigma2, (y - mean) * (y - previous), gamma);
    }

    @Override
    protected void combine(Variance other, double gamma) {
        double delta = other.mean - mean;
        sigma2 = Smooth.smooth(sigma2, other.sigma2, gamma) + delta * delta * gamma * (1 - gamma);
        mean = Smooth.smooth(mean, other.mean, gamma);
    }

    /**
     * Returns the bias-corrected variance.  With fewer than two observations this is 0.
     */
    public double value() {
        return sigma2 * unbias();
    }

    public double variance() {
        return value();
    }

    public double std() {
        return Math.sqrt(value());
    }

    public double mean() {
        return mean;
    }

    @Override
    public String toString() {
        return "Variance{mean=" + mean + ", variance=" + value() + ", n=" + count() + '}';
    }
}
