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
 * Running means of each component of a vector.
 */
public class Means extends VectorStat<Means> {
    private final double[] mean;

    public Means(int dimension) {
        this(dimension, Weight.equal());
    }

    public Means(int dimension, Weight weight) {
        super(dimension, weight);
        mean = new double[dimension];
    }

    @Override
    protected void fit(double[] x, double gamma) {
        Smooth.smooth(mean, x, gamma);
    }

    @Override
    protected void combine(Means other, double gamma) {
        Smooth.smooth(mean, other.mean, gamma);
    }

    /**
     * Returns a copy of the means.
     */
    public double[] value() {
        return mean.clone();
    }

    @Override
    public String toString() {
        return "Means{d=" + dimension() + ", n=" + count() + '}';
    }
}
