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
 * Uses equal weights until they would drop below {@code lambda}, then holds the coefficient at {@code lambda}.  This
 * avoids the start-up bias of a pure exponential weight.
 */
public final class BoundedExponentialWeight extends Weight {
    private final double lambda;

    public BoundedExponentialWeight(double lambda) {
        this.lambda = checkDecay(lambda);
    }

    public BoundedExponentialWeight(int lookback) {
        this(lookbackDecay(lookback));
    }

    @Override
    public double next(long count) {
        checkCount(count);
        n += count;
        return Math.max((double) count / n, lambda);
    }

    @Override
    public double current() {
        return n == 0 ? 1.0 : Math.max(1.0 / n, lambda);
    }

    public double lambda() {
        return lambda;
    }

    @Override
    public BoundedExponentialWeight copy() {
        return new BoundedExponentialWeight(lambda);
    }

    @Override
    public String toString() {
        return "BoundedExponentialWeight{lambda=" + lambda + ", n=" + n + '}';
    }
}
