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
 * The coefficient at update {@code t} is {@code max(minStep, t^-r)}.  Updates are counted once per call no matter how
 * many observations the call covers.
 *
 * @see LearningRate2
 */
public final class LearningRate extends Weight {
    private final double r;
    private final double minStep;

    // number of updates, distinct from observations when batched
    private long t = 0;

    public LearningRate() {
        this(0.6, 0.0);
    }

    public LearningRate(double r, double minStep) {
        Preconditions.checkArgument(r >= 0, "Learning rate exponent must be non-negative, got %s", r);
        Preconditions.checkArgument(minStep >= 0 && minStep <= 1, "Minimum step must be in [0, 1], got %s", minStep);
        this.r = r;
        this.minStep = minStep;
    }

    @Override
    public double next(long count) {
        skip(count);
        return rate(t);
    }

    @Override
    public void skip(long count) {
        super.skip(count);
        t++;
    }

    @Override
    public double current() {
        return t == 0 ? 1.0 : rate(t);
    }

    private double rate(long t) {
        return Math.max(minStep, Math.exp(-r * Math.log(t)));
    }

    @Override
    public long updates() {
        return t;
    }

    @Override
    public void reset() {
        super.reset();
        t = 0;
    }

    public double exponent() {
        return r;
    }

    public double minStep() {
        return minStep;
    }

    @Override
    public LearningRate copy() {
        return new LearningRate(r, minStep);
    }

    @Override
    public String toString() {
        return "LearningRate{r=" + r + ", minStep=" + minStep + ", n=" + n + ", t=" + t + '}';
    }
}
