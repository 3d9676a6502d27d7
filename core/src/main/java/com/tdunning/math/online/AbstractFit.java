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
 * Base for distribution fits that delegate to a single inner statistic.  The fit's parameters are a closed-form
 * function of the inner statistic's value, computed when asked for and never cached.
 *
 * @param <S> The concrete fit type.
 * @param <T> The inner statistic type.
 */
public abstract class AbstractFit<S extends AbstractFit<S, T>, T extends OnlineStat<T>> implements OnlineStat<S> {
    protected final T stat;

    protected AbstractFit(T stat) {
        this.stat = stat;
    }

    @Override
    public long count() {
        return stat.count();
    }

    @Override
    public void merge(S other) {
        stat.merge(other.stat);
    }

    @Override
    public void merge(S other, MergeStrategy strategy) {
        stat.merge(other.stat, strategy);
    }

    @Override
    public void merge(S other, double gamma) {
        stat.merge(other.stat, gamma);
    }
}
