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
 * Minimum and maximum.  Before any observation the minimum is positive infinity and the maximum negative infinity.
 */
public class Extrema extends ScalarStat<Extrema> {
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public Extrema() {
        this(Weight.equal());
    }

    public Extrema(Weight weight) {
        super(weight);
    }

    @Override
    protected void fit(double y, double gamma) {
        min = Math.min(min, y);
        max = Math.max(max, y);
    }

    @Override
    protected void combine(Extrema other, double gamma) {
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
    }

    /**
     * Returns {@code {min, max}}.
     */
    public double[] value() {
        return new double[]{min, max};
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    @Override
    public String toString() {
        return "Extrema{min=" + min + ", max=" + max + ", n=" + count() + '}';
    }
}
