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
 * Running mean of a single variable.
 */
public class Mean extends ScalarStat<Mean> {
    private double mean = 0;

    public Mean() {
        this(Weight.equal());
    }

    public Mean(Weight weight) {
        super(weight);
    }

    @Override
    protected void fit(double y, double gamma) {
        mean = Smooth.smooth(mean, y, gamma);
    }

    @Override
    protected void combine(Mean other, double gamma) {
        mean = Smooth.smooth(mean, other.mean, gamma);
    }

    /**
     * Returns the mean, or 0 before any observation.
     */
    public double value() {
        return mean;
    }

    @Override
    public String toString() {
        return "Mean{" + mean + ", n=" + count() + '}';
    }
}
