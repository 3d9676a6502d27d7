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
 * Quantiles by implicit stochastic gradient descent.
 *
 * The implicit update {@code v' = v + gamma * d(y, v')} evaluates the subgradient at the new estimate rather than the
 * old one.  It is approximated by {@code K} fixed-point iterations, where iteration {@code k} smooths the candidate
 * {@code v + gamma * d(y, x)} into the iterate {@code x} with coefficient {@code min(1, c / k)}.  With the default
 * {@code c = 1} the iterate is the running average of the candidates.  When the observation lies outside the step
 * every candidate is the same and the result matches {@link QuantileSGD}.  When a full step would overshoot the
 * observation the average is pulled onto it, as the exact proximal step would be.  This costs {@code K} times the
 * work of {@link QuantileSGD} per observation and has lower variance.
 */
public class QuantileISGD extends AbstractQuantile<QuantileISGD> {
    public static final int DEFAULT_ITERATIONS = 20;
    public static final double DEFAULT_DAMPING = 1;

    private final int iterations;
    private final double damping;

    public QuantileISGD() {
        this(DEFAULT_TAU);
    }

    public QuantileISGD(double... tau) {
        this(Weight.learningRate(), DEFAULT_ITERATIONS, DEFAULT_DAMPING, tau);
    }

    /**
     * @param weight     The step size schedule, usually a learning rate.
     * @param iterations The number of fixed-point iterations per observation.
     * @param damping    The constant {@code c} in the iteration coefficient {@code c / k}.
     * @param tau        The quantile levels.
     */
    public QuantileISGD(Weight weight, int iterations, double damping, double... tau) {
        super(weight, tau);
        Preconditions.checkArgument(iterations >= 1, "Iterations must be positive, got %d", iterations);
        Preconditions.checkArgument(damping > 0, "Damping must be positive, got %s", damping);
        this.iterations = iterations;
        this.damping = damping;
    }

    @Override
    protected void fit(double y, double gamma) {
        for (int i = 0; i < tau.length; i++) {
            double v = value[i];
            double x = v;
            for (int k = 1; k <= iterations; k++) {
                double candidate = v + gamma * descent(tau[i], y, x);
                x = Smooth.smooth(x, candidate, Math.min(1.0, damping / k));
            }
            value[i] = x;
        }
    }

    @Override
    protected void checkCompatible(QuantileISGD other) {
        super.checkCompatible(other);
        if (iterations != other.iterations || damping != other.damping) {
            throw new IncompatibleConfigException("Objects use different fixed-point iterations");
        }
    }

    @Override
    protected void combine(QuantileISGD other, double gamma) {
        Smooth.smooth(value, other.value, gamma);
    }

    public int iterations() {
        return iterations;
    }

    public double damping() {
        return damping;
    }
}
