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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Categorical distribution over arbitrary observed values, estimated from a frequency table.
 *
 * Frequencies are exact counts, so merging takes the union of the categories and sums their counts.  The blend
 * coefficient and the merge strategy have no effect.
 *
 * @param <T> The category type, which must have consistent {@code equals} and {@code hashCode}.
 */
public class FitCategorical<T> implements OnlineStat<FitCategorical<T>> {
    private final Map<T, Long> counts = new HashMap<>();
    private long n = 0;

    public FitCategorical() {
    }

    public void add(T y) {
        Preconditions.checkArgument(y != null, "Categories must not be null");
        counts.merge(y, 1L, Long::sum);
        n++;
    }

    @Override
    public long count() {
        return n;
    }

    @Override
    public void merge(FitCategorical<T> other) {
        Preconditions.checkArgument(other != null, "Cannot merge null");
        Preconditions.checkArgument(other != this, "Cannot merge a statistic with itself");
        for (Map.Entry<T, Long> entry : other.counts.entrySet()) {
            counts.merge(entry.getKey(), entry.getValue(), Long::sum);
        }
        n += other.n;
    }

    @Override
    public void merge(FitCategorical<T> other, MergeStrategy strategy) {
        merge(other);
    }

    @Override
    public void merge(FitCategorical<T> other, double gamma) {
        merge(other);
    }

    /**
     * Returns the relative frequency of each category seen, empty before any observation.
     */
    public Map<T, Double> value() {
        Map<T, Double> r = new LinkedHashMap<>();
        for (Map.Entry<T, Long> entry : counts.entrySet()) {
            r.put(entry.getKey(), (double) entry.getValue() / n);
        }
        return r;
    }

    /**
     * Returns the relative frequency of {@code y}, 0 if it was never seen.
     */
    public double probability(T y) {
        Long c = counts.get(y);
        return c == null ? 0 : (double) c / n;
    }

    public Set<T> keys() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    @Override
    public String toString() {
        return "FitCategorical{categories=" + counts.size() + ", n=" + n + '}';
    }
}
