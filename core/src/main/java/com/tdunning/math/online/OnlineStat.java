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
 * A statistic that is computed incrementally and that can absorb another statistic of the same kind.
 *
 * Merging lets independent accumulators be built per partition and then reduced pairwise or as a tree.  The result
 * is statistically equivalent to having seen the observations of both sides, up to floating point rounding.
 *
 * Implementations are not thread-safe.
 *
 * @param <S> The concrete statistic type, only accumulators of the same type can be merged.
 */
public interface OnlineStat<S extends OnlineStat<S>> {
    /**
     * Returns the number of observations absorbed, including those of merged peers.
     */
    long count();

    /**
     * Absorbs another statistic as if its observations had been appended to this one.  The other statistic is not
     * changed.
     */
    void merge(S other);

    /**
     * Absorbs another statistic, choosing the blend coefficient with {@code strategy}.
     */
    void merge(S other, MergeStrategy strategy);

    /**
     * Absorbs another statistic with an explicitly chosen blend coefficient.  The observation count still grows by
     * the other side's count.  An empty statistic takes the other side's state whole, whatever the coefficient.
     *
     * @param gamma The share of the result that comes from {@code other}, in [0, 1].
     */
    void merge(S other, double gamma);
}
