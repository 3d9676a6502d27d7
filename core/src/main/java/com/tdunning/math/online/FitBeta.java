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
 * Beta distribution by the method of moments.
 */
public class FitBeta extends AbstractFit<FitBeta, Variance> implements ScalarInput {
    public FitBeta() {
        this(Weight.equal());
    }

    public FitBeta(Weight weight) {
        super(new Variance(weight));
    }

    @Override
    public void add(double y) {
        stat.add(y);
    }

    /**
     * Returns {@code {alpha, beta}}, or {@code {1, 1}} before two observations or while the observations have no
     * spread.
     */
    public double[] value() {
        if (stat.count() > 1 && stat.variance() > 0) {
            double m = stat.mean();
            double v = stat.variance();
            double k = m * (1 - m) / v - 1;
            return new double[]{m * k, (1 - m) * k};
        } else {
            return new double[]{1, 1};
        }
    }

    public double alpha() {
        return value()[0];
    }

    public double beta() {
        return value()[1];
    }
}
