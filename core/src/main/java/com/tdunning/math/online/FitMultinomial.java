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

import java.util.Arrays;

/**
 * Multinomial distribution with one trial per observation, estimated from the mean count vector.
 *
 * Each observation is a vector of counts over {@code p} categories.
 */
public class FitMultinomial extends AbstractFit<FitMultinomial, Means> implements VectorInput {
    public FitMultinomial(int p) {
        this(p, Weight.equal());
    }

    public FitMultinomial(int p, Weight weight) {
        super(new Means(p, weight));
    }

    @Override
    public void add(double[] x) {
        stat.add(x);
    }

    @Override
    public int dimension() {
        return stat.dimension();
    }

    /**
     * Returns the number of trials the estimated distribution describes, always 1.
     */
    public int trials() {
        return 1;
    }

    /**
     * Returns the category probabilities, uniform before any observation or if no counts have been seen.
     */
    public double[] value() {
        double[] m = stat.value();
        double total = 0;
        for (double v : m) {
            total += v;
        }
        if (stat.count() > 0 && total > 0) {
            for (int i = 0; i < m.length; i++) {
                m[i] /= total;
            }
        } else {
            Arrays.fill(m, 1.0 / m.length);
        }
        return m;
    }

    public double[] probabilities() {
        return value();
    }
}
