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
 * All observations are weighted equally.  The k-th coefficient is {@code 1/k}, so smoothing reproduces the exact
 * running average.
 */
public final class EqualWeight extends Weight {
    public EqualWeight() {
    }

    @Override
    public double next(long count) {
        checkCount(count);
        n += count;
        return (double) count / n;
    }

    /**
     * Returns {@code 1/n}, the share of a single observation.  A batched {@link #next(long)} returns {@code count/n}
     * instead.
     */
    @Override
    public double current() {
        return n == 0 ? 1.0 : 1.0 / n;
    }

    /**
     * Returns {@code n / (n - 1)} once more than one observation has been seen, otherwise 1.
     */
    @Override
    public double biasCorrection() {
        return n > 1 ? (double) n / (n - 1) : 1.0;
    }

    @Override
    public EqualWeight copy() {
        return new EqualWeight();
    }

    @Override
    public String toString() {
        return "EqualWeight{n=" + n + '}';
    }
}
