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
 * A weight policy converts a count of new observations into the coefficient used to fold those observations
 * into a running statistic with {@link Smooth}.
 *
 * The family of policies is closed:
 *
 * - {@link EqualWeight} gives every observation the same weight, so statistics are true running averages.
 *
 * - {@link ExponentialWeight} holds the coefficient constant, giving recency-biased, bounded-memory statistics.
 *
 * - {@link BoundedExponentialWeight} starts like equal weighting and holds once the coefficient reaches the decay.
 *
 * - {@link LearningRate} and {@link LearningRate2} decay with the number of updates, as stochastic approximation
 *   needs.
 *
 * - {@link UserWeight} normalizes caller supplied weights.
 *
 * Every coefficient returned lies in (0, 1] apart from an exponential decay explicitly configured as zero.  A weight
 * is mutated by every call to {@link #next(long)} or {@link #skip(long)} and is not thread-safe.
 */
public abstract class Weight {
    // number of observations seen
    long n = 0;

    Weight() {
    }

    /**
     * Creates a policy that weights every observation equally.
     */
    public static Weight equal() {
        return new EqualWeight();
    }

    /**
     * Creates a policy with a fixed coefficient.
     *
     * @param lambda The decay, which must be in [0, 1].
     */
    public static Weight exponential(double lambda) {
        return new ExponentialWeight(lambda);
    }

    /**
     * Creates a policy with a fixed coefficient of {@code 2 / (lookback + 1)}.
     *
     * @param lookback The effective number of observations remembered, at least 1.
     */
    public static Weight exponential(int lookback) {
        return new ExponentialWeight(lookback);
    }

    /**
     * Creates a policy that weights equally until the coefficient would fall below {@code lambda}.
     */
    public static Weight boundedExponential(double lambda) {
        return new BoundedExponentialWeight(lambda);
    }

    /**
     * Like {@link #boundedExponential(double)} with the decay given as a lookback.
     */
    public static Weight boundedExponential(int lookback) {
        return new BoundedExponentialWeight(lookback);
    }

    /**
     * Creates a learning rate policy decaying as {@code t^-r}.
     *
     * @param r       The decay exponent.  Values in (0.5, 1] satisfy the usual stochastic approximation conditions.
     * @param minStep The smallest coefficient ever returned.
     */
    public static Weight learningRate(double r, double minStep) {
        return new LearningRate(r, minStep);
    }

    /**
     * Creates the default learning rate policy, {@code t^-0.6} with no floor.
     */
    public static Weight learningRate() {
        return new LearningRate();
    }

    /**
     * Creates a learning rate policy decaying as {@code gamma / (1 + gamma * c * t)}.
     */
    public static Weight learningRate2(double gamma, double c, double minStep) {
        return new LearningRate2(gamma, c, minStep);
    }

    /**
     * Creates a policy that normalizes weights supplied with each observation.
     */
    public static UserWeight user() {
        return new UserWeight();
    }

    /**
     * Records a single new observation and returns its coefficient.
     */
    public final double next() {
        return next(1);
    }

    /**
     * Records {@code count} new observations and returns the coefficient to use when folding them in as one step.
     *
     * @param count The number of new observations, at least 1.
     * @return The coefficient for the next smoothing step.
     */
    public abstract double next(long count);

    /**
     * Records {@code count} new observations without producing a coefficient.  This keeps the counters in step for
     * statistics that do not smooth every observation.
     */
    public void skip(long count) {
        checkCount(count);
        n += count;
    }

    /**
     * Records the observations of a merged peer and returns the coefficient that folds the peer in.  Counting
     * policies only need the peer's observation count.
     *
     * @param other The peer's weight, never modified.
     * @param count The peer's observation count, at least 1.
     */
    double nextMerged(Weight other, long count) {
        return next(count);
    }

    /**
     * Records the observations of a merged peer without producing a coefficient.
     */
    void skipMerged(Weight other, long count) {
        skip(count);
    }

    /**
     * Returns the coefficient a single observation gets at the current state, without changing any state.  After a
     * batched {@link #next(long)} this is not necessarily what that call returned.  Before the first observation this
     * is 1, which means full replacement.
     */
    public abstract double current();

    /**
     * Returns the total number of observations recorded.
     */
    public long count() {
        return n;
    }

    /**
     * Returns the number of update steps.  The learning rates count one step per call to {@link #next(long)} or
     * {@link #skip(long)} whatever its count.  All other policies return the observation count.
     */
    public long updates() {
        return n;
    }

    /**
     * Returns the factor that turns a population second moment into an unbiased estimate.
     */
    public double biasCorrection() {
        return 1.0;
    }

    /**
     * Forgets all observations, keeping the parameters.
     */
    public void reset() {
        n = 0;
    }

    /**
     * Returns a policy with the same parameters and no observations.
     */
    public abstract Weight copy();

    static void checkCount(long count) {
        Preconditions.checkArgument(count >= 1, "Observation count must be positive, got %d", count);
    }

    static double checkDecay(double lambda) {
        Preconditions.checkArgument(lambda >= 0 && lambda <= 1, "Decay must be in [0, 1], got %s", lambda);
        return lambda;
    }

    static double lookbackDecay(int lookback) {
        Preconditions.checkArgument(lookback >= 1, "Lookback must be at least 1, got %d", lookback);
        return 2.0 / (lookback + 1);
    }
}
