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
 * Gamma distribution by the method of moments, parameterized by shape and scale.
 */
public class FitGamma extends AbstractFit<FitGamma, Variance> implements ScalarInput {
    public FitGamma() {
        this(Weight.equal());
    }

    public FitGamma(Weight weight) {
        super(new Variance(weight));
    }

    @Override
    public void add(double y) {
        stat.add(y);
    }

    /**
     * Returns {@code {shape, scale}}, or {@code {1, 1}} before two observations, while the observations have no
     * spread or while their mean is zero.
     */
    public double[] value() {
        if (stat.count() > 1 && stat.variance() > 0 && stat.mean() != 0) {
            double m = stat.mean();
            double theta = stat.variance() / m;
            return new double[]{m / theta, theta};
        } else {
            return new double[]{1, 1};
        }
    }

    public double shape() {
        return value()[0];
    }

    public double scale() {
        return value()[1];
    }
}
