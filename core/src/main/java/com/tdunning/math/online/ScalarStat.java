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
 * Base for statistics of a single real variable.
 *
 * @param <S> The concrete statistic type.
 */
public abstract class ScalarStat<S extends ScalarStat<S>> extends AbstractOnlineStat<S> implements ScalarInput {
    protected ScalarStat(Weight weight) {
        super(weight);
    }

    /**
     * Adds an observation.
     *
     * @param y The value to add, must not be NaN.
     */
    @Override
    public void add(double y) {
        Preconditions.checkValue(y);
        fit(y, weight.next());
    }

    /**
     * Adds an observation with a caller supplied weight.  Only statistics built with a {@link UserWeight} accept
     * weights.
     *
     * @param y The value to add.
     * @param w The positive weight of this observation.
     */
    public void add(double y, double w) {
        Preconditions.checkState(weight instanceof UserWeight, "Weights can only be supplied when using UserWeight");
        Preconditions.checkValue(y);
        ((UserWeight) weight).setWeight(w);
        fit(y, weight.next());
    }

    public void addAll(double... ys) {
        for (double y : ys) {
            add(y);
        }
    }

    /**
     * Updates the sufficient statistics with one observation.
     *
     * @param y     The observation.
     * @param gamma The coefficient the weight assigned to it.
     */
    protected abstract void fit(double y, double gamma);
}
