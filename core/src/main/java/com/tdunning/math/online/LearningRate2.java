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
 * The coefficient at update {@code t} is {@code gamma / (1 + gamma * c * t)}, floored at {@code minStep} and capped
 * at 1.  See Bottou, "Stochastic Gradient Descent Tricks", for the motivation of this schedule.
 *
 * @see LearningRate
 */
public final class LearningRate2 extends Weight {
    private final double gamma;
    private final double c;
    private final double minStep;

    private long t = 0;

    public LearningRate2(double gamma) {
        this(gamma, 1.0, 0.0);
    }

    public LearningRate2(double gamma, double c, double minStep) {
        Preconditions.checkArgument(gamma > 0, "Gamma must be positive, got %s", gamma);
        Preconditions.checkArgument(c >= 0, "Scale must be non-negative, got %s", c);
        Preconditions.checkArgument(minStep >= 0 && minStep <= 1, "Minimum step must be in [0, 1], got %s", minStep);
        this.gamma = gamma;
        this.c = c;
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
        return Math.min(1.0, Math.max(minStep, gamma / (1.0 + gamma * c * t)));
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

    @Override
    public LearningRate2 copy() {
        return new LearningRate2(gamma, c, minStep);
    }

    @Override
    public String toString() {
        return "LearningRate2{gamma=" + gamma + ", c=" + c + ", minStep=" + minStep + ", n=" + n + ", t=" + t + '}';
    }
}
