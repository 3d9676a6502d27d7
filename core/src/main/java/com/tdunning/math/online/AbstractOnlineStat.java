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
 * Holds the weight policy of a statistic and implements the merge protocol on top of {@link #combine}.
 *
 * @param <S> The concrete statistic type.
 */
public abstract class AbstractOnlineStat<S extends AbstractOnlineStat<S>> implements OnlineStat<S> {
    protected final Weight weight;

    protected AbstractOnlineStat(Weight weight) {
        Preconditions.checkArgument(weight != null, "Weight must not be null");
        this.weight = weight;
    }

    public Weight weight() {
        return weight;
    }

    @Override
    public long count() {
        return weight.count();
    }

    /**
     * Returns the bias correction for this statistic's current count.
     */
    protected double unbias() {
        return weight.biasCorrection();
    }

    @Override
    public void merge(S other) {
        merge(other, MergeStrategy.APPEND);
    }

    @Override
    public void merge(S other, MergeStrategy strategy) {
        checkMergeable(other);
        long n2 = other.count();
        if (n2 == 0) {
            return;
        }
        boolean empty = count() == 0;
        double gamma = strategy.coefficient(weight, other.weight, n2);
        // an empty side holds nothing worth keeping
        combine(other, empty ? 1.0 : gamma);
    }

    @Override
    public void merge(S other, double gamma) {
        checkMergeable(other);
        Preconditions.checkArgument(gamma >= 0 && gamma <= 1, "Merge coefficient must be in [0, 1], got %s", gamma);
        long n2 = other.count();
        if (n2 == 0) {
            return;
        }
        boolean empty = count() == 0;
        weight.skipMerged(other.weight, n2);
        combine(other, empty ? 1.0 : gamma);
    }

    private void checkMergeable(S other) {
        Preconditions.checkArgument(other != null, "Cannot merge null");
        Preconditions.checkArgument(other != this, "Cannot merge a statistic with itself");
        checkCompatible(other);
    }

    /**
     * Rejects peers whose shape or configuration differs from this statistic's.  Nothing is rejected by default.
     *
     * @throws ShapeMismatchException       if the dimensions differ
     * @throws IncompatibleConfigException if the structural parameters differ
     */
    protected void checkCompatible(S other) {
    }

    /**
     * Folds the other side's sufficient statistics into this one.  The weight has already been advanced.
     *
     * @param other The peer, never modified.
     * @param gamma The share of the result contributed by {@code other}.
     */
    protected abstract void combine(S other, double gamma);
}
