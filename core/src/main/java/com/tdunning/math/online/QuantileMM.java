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
 * Quantiles by an online majorize-minimize algorithm.
 *
 * The pinball loss at the current estimate is majorized by a quadratic with weight {@code w = 1 / (|y - v| + eps)}.
 * The minimizer of the smoothed majorizers has the closed form {@code v = (s + o * (2 * tau - 1)) / t}, where
 * {@code s} and {@code t} are smoothed averages of {@code w * y} and {@code w} and {@code o} is the smoothed constant 1.
 * These converge faster and more smoothly than a single noisy subgradient step.
 */
public class QuantileMM extends AbstractQuantile<QuantileMM> {
    static final double EPSILON = 1e-8;

    private final double[] s;
    private final double[] t;
    private double o = 0;

    public QuantileMM() {
        this(DEFAULT_TAU);
    }

    public QuantileMM(double... tau) {
        this(Weight.learningRate(), tau);
    }

    public QuantileMM(Weight weight, double... tau) {
        super(weight, tau);
        s = new double[tau.length];
        t = new double[tau.length];
    }

    @Override
    protected void fit(double y, double gamma) {
        o = Smooth.smooth(o, 1.0, gamma);
        for (int j = 0; j < tau.length; j++) {
            double w = 1.0 / (Math.abs(y - value[j]) + EPSILON);
            s[j] = Smooth.smooth(s[j], w * y, gamma);
            t[j] = Smooth.smooth(t[j], w, gamma);
            value[j] = (s[j] + o * (2.0 * tau[j] - 1.0)) / t[j];
        }
    }

    @Override
    protected void combine(QuantileMM other, double gamma) {
        o = Smooth.smooth(o, other.o, gamma);
        Smooth.smooth(s, other.s, gamma);
        Smooth.smooth(t, other.t, gamma);
        for (int j = 0; j < tau.length; j++) {
            if (t[j] > 0) {
                value[j] = (s[j] + o * (2.0 * tau[j] - 1.0)) / t[j];
            }
        }
    }
}
