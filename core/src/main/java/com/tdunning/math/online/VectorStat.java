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
 * Base for statistics of a fixed-length vector.  The dimension is set at construction and never changes.
 *
 * @param <S> The concrete statistic type.
 */
public abstract class VectorStat<S extends VectorStat<S>> extends AbstractOnlineStat<S> implements VectorInput {
    private final int dimension;

    protected VectorStat(int dimension, Weight weight) {
        super(weight);
        Preconditions.checkArgument(dimension >= 1, "Dimension must be positive, got %d", dimension);
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void add(double[] x) {
        Preconditions.checkLength(dimension, x);
        for (double v : x) {
            Preconditions.checkValue(v);
        }
        fit(x, weight.next());
    }

    /**
     * Adds each row of {@code xs} as one observation.
     */
    public void addAll(double[][] xs) {
        for (double[] x : xs) {
            add(x);
        }
    }

    @Override
    protected void checkCompatible(S other) {
        if (other.dimension() != dimension) {
            throw new ShapeMismatchException(dimension, other.dimension());
        }
    }

    protected abstract void fit(double[] x, double gamma);
}
