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
 * Log-normal distribution from the mean and standard deviation of the logged observations.
 */
public class FitLogNormal extends AbstractFit<FitLogNormal, Variance> implements ScalarInput {
    public FitLogNormal() {
        this(Weight.equal());
    }

    public FitLogNormal(Weight weight) {
        super(new Variance(weight));
    }

    /**
     * @param y A strictly positive observation.
     */
    @Override
    public void add(double y) {
        Preconditions.checkArgument(y > 0, "Log-normal observations must be positive, got %s", y);
        stat.add(Math.log(y));
    }

    /**
     * Returns {@code {meanlog, sdlog}}, or {@code {0, 1}} before two observations.
     */
    public double[] value() {
        if (stat.count() > 1) {
            return new double[]{stat.mean(), stat.std()};
        } else {
            return new double[]{0, 1};
        }
    }

    public double meanLog() {
        return value()[0];
    }

    public double sdLog() {
        return value()[1];
    }
}
