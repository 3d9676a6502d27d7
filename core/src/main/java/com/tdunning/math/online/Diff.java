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
 * The most recent value and its difference from the value before it.
 *
 * A merge treats the other side as later data: its last value becomes the last value and, if it saw a single value,
 * the difference bridges the two sides.
 */
public class Diff extends ScalarStat<Diff> {
    private double last = 0;
    private double diff = 0;

    public Diff() {
        this(Weight.equal());
    }

    public Diff(Weight weight) {
        super(weight);
    }

    @Override
    protected void fit(double y, double gamma) {
        // the weight has already counted y
        diff = count() > 1 ? y - last : 0;
        last = y;
    }

    @Override
    protected void combine(Diff other, double gamma) {
        long before = count() - other.count();
        if (other.count() > 1) {
            diff = other.diff;
        } else {
            diff = before > 0 ? other.last - last : 0;
        }
        last = other.last;
    }

    /**
     * Returns the difference between the last two values, or 0 before two values have been seen.
     */
    public double diff() {
        return diff;
    }

    public double last() {
        return last;
    }

    @Override
    public String toString() {
        return "Diff{diff=" + diff + ", last=" + last + ", n=" + count() + '}';
    }
}
