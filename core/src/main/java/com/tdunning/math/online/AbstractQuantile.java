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

import java.util.Arrays;

/**
 * Common state of the stochastic quantile estimators: the quantile levels and one estimate per level.
 *
 * All the estimators minimize the pinball loss {@code rho(y - v) = (y - v) * (tau - [y < v])}, whose minimizer is the
 * {@code tau} quantile.  The estimates for different levels evolve independently but share one weight, so they see
 * the same step sizes.
 *
 * @param <S> The concrete estimator type.
 */
public abstract class AbstractQuantile<S extends AbstractQuantile<S>> extends ScalarStat<S> {
    static final double[] DEFAULT_TAU = {0.25, 0.5, 0.75};

    protected final double[] tau;
    protected final double[] value;

    protected AbstractQuantile(Weight weight, double... tau) {
        super(weight);
        Preconditions.checkArgument(tau != null && tau.length > 0, "At least one quantile level is required");
        for (double t : tau) {
            Preconditions.checkArgument(t > 0 && t < 1, "Quantile levels must be in (0, 1), got %s", t);
        }
        this.tau = tau.clone();
        this.value = new double[tau.length];
    }

    /**
     * The pinball loss subgradient with respect to the estimate, negated so that it is the step direction.
     */
    static double descent(double tau, double y, double v) {
        return y < v ? tau - 1 : tau;
    }

    @Override
    protected void checkCompatible(S other) {
        if (!Arrays.equals(tau, other.tau)) {
            throw new IncompatibleConfigException(
                    "Objects track different quantiles: " + Arrays.toString(tau) + " and " + Arrays.toString(other.tau));
        }
    }

    /**
     * Returns a copy of the estimates in the order of {@link #tau()}.
     */
    public double[] value() {
        return value.clone();
    }

    /**
     * Returns the estimate for a level this estimator tracks.
     *
     * @throws IllegalArgumentException if {@code q} is not one of the tracked levels
     */
    public double quantile(double q) {
        for (int i = 0; i < tau.length; i++) {
            if (tau[i] == q) {
                return value[i];
            }
        }
        throw new IllegalArgumentException("Quantile " + q + " is not tracked, levels are " + Arrays.toString(tau));
    }

    public double[] tau() {
        return tau.clone();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{tau=" + Arrays.toString(tau) + ", value=" + Arrays.toString(value)
                + ", n=" + count() + '}';
    }
}
