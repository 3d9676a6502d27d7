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
 * Running total.  The weight only counts observations, every value is added in full.
 */
public class Sum extends ScalarStat<Sum> {
    private double sum = 0;

    public Sum() {
        this(Weight.equal());
    }

    public Sum(Weight weight) {
        super(weight);
    }

    @Override
    protected void fit(double y, double gamma) {
        sum += y;
    }

    @Override
    protected void combine(Sum other, double gamma) {
        sum += other.sum;
    }

    public double value() {
        return sum;
    }

    @Override
    public String toString() {
        return "Sum{" + sum + ", n=" + count() + '}';
    }
}
