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
 * Weights are held constant at {@code lambda}, so an observation's influence decays geometrically with age.
 */
public final class ExponentialWeight extends Weight {
    private final double lambda;

    public ExponentialWeight(double lambda) {
        this.lambda = checkDecay(lambda);
    }

    public ExponentialWeight(int lookback) {
        this(lookbackDecay(lookback));
    }

    @Override
    public double next(long count) {
        checkCount(count);
        n += count;
        return lambda;
    }

    @Override
    public double current() {
        return lambda;
    }

    public double lambda() {
        return lambda;
    }

    @Override
    public ExponentialWeight copy() {
        return new ExponentialWeight(lambda);
    }

    @Override
    public String toString() {
        return "ExponentialWeight{lambda=" + lambda + ", n=" + n + '}';
    }
}
