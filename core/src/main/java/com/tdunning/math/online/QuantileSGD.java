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
 * Quantiles by stochastic subgradient descent on the pinball loss.  Each observation moves every estimate up by
 * {@code gamma * tau} if the observation is at or above it, and down by {@code gamma * (1 - tau)} otherwise.
 */
public class QuantileSGD extends AbstractQuantile<QuantileSGD> {
    /**
     * Tracks the quartiles with the default learning rate.
     */
    public QuantileSGD() {
        this(DEFAULT_TAU);
    }

    public QuantileSGD(double... tau) {
        this(Weight.learningRate(), tau);
    }

    public QuantileSGD(Weight weight, double... tau) {
        super(weight, tau);
    }

    @Override
    protected void fit(double y, double gamma) {
        for (int i = 0; i < tau.length; i++) {
            value[i] += gamma * descent(tau[i], y, value[i]);
        }
    }

    @Override
    protected void combine(QuantileSGD other, double gamma) {
        Smooth.smooth(value, other.value, gamma);
    }
}
