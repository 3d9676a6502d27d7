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
 * Running variances of each component of a vector, treating the components independently.  Uses the same update and
 * merge as {@link Variance}.
 */
public class Variances extends VectorStat<Variances> {
    private final double[] mean;
    private final double[] sigma2;

    public Variances(int dimension) {
        this(dimension, Weight.equal());
    }

    public Variances(int dimension, Weight weight) {
        super(dimension, weight);
        mean = new double[dimension];
        sigma2 = new double[dimension];
    }

    @Override
    protected void fit(double[] x, double gamma) {
        for (int i = 0; i < x.length; i++) {
            double previous = mean[i];
            mean[i] = Smooth.smooth(mean[i], x[i], gamma);
            sigma2[i] = Smooth.smooth(sigma2[i], (x[i] - mean[i]) * (x[i] - previous), gamma);
        }
    }

    @Override
    protected void combine(Variances other, double gamma) {
        for (int i = 0; i < mean.length; i++) {
            double delta = other.mean[i] - mean[i];
            sigma2[i] = Smooth.smooth(sigma2[i], other.sigma2[i], gamma) + delta * delta * gamma * (1 - gamma);
            mean[i] = Smooth.smooth(mean[i], other.mean[i], gamma);
        }
    }

    /**
     * Returns the bias-corrected variances.
     */
    public double[] value() {
        double[] r = new double[sigma2.length];
        double unbias = unbias();
        for (int i = 0; i < r.length; i++) {
            r[i] = sigma2[i] * unbias;
        }
        return r;
    }

    public double[] std() {
        double[] r = value();
        for (int i = 0; i < r.length; i++) {
            r[i] = Math.sqrt(r[i]);
        }
        return r;
    }

    public double[] mean() {
        return mean.clone();
    }

    @Override
    public String toString() {
        return "Variances{d=" + dimension() + ", n=" + count() + '}';
    }
}
