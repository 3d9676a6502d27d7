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
 * Cauchy distribution from quantiles.  The location is the median and the scale is half the interquartile range,
 * both tracked by {@link QuantileMM}.
 */
public class FitCauchy extends AbstractFit<FitCauchy, QuantileMM> implements ScalarInput {
    public FitCauchy() {
        this(Weight.learningRate());
    }

    public FitCauchy(Weight weight) {
        super(new QuantileMM(weight, 0.25, 0.5, 0.75));
    }

    @Override
    public void add(double y) {
        stat.add(y);
    }

    /**
     * Returns {@code {location, scale}}, or {@code {0, 1}} before two observations.
     */
    public double[] value() {
        if (stat.count() > 1) {
            double[] q = stat.value();
            return new double[]{q[1], 0.5 * (q[2] - q[0])};
        } else {
            return new double[]{0, 1};
        }
    }

    public double location() {
        return value()[0];
    }

    public double scale() {
        return value()[1];
    }
}
