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
 * Weights supplied by the caller.  Each observation's weight must be set with {@link #setWeight(double)} before the
 * observation is added, the coefficient is then that weight's share of all weights seen so far.
 */
public final class UserWeight extends Weight {
    // most recent weight
    private double w = 1.0;
    // sum of weights
    private double total = 0;

    public UserWeight() {
    }

    /**
     * Sets the weight used by the next update.  The weight stays in effect until it is set again.
     */
    public void setWeight(double w) {
        Preconditions.checkArgument(w > 0 && !Double.isInfinite(w), "User weight must be positive and finite, got %s", w);
        this.w = w;
    }

    public double weight() {
        return w;
    }

    @Override
    public double next(long count) {
        skip(count);
        return w / total;
    }

    @Override
    public void skip(long count) {
        super.skip(count);
        total += w;
    }

    /**
     * A user-weighted peer contributes its total weight rather than this side's most recent weight.
     */
    @Override
    double nextMerged(Weight other, long count) {
        if (!(other instanceof UserWeight)) {
            return super.nextMerged(other, count);
        }
        double otherTotal = ((UserWeight) other).total;
        skipMerged(other, count);
        return otherTotal / total;
    }

    @Override
    void skipMerged(Weight other, long count) {
        if (other instanceof UserWeight) {
            checkCount(count);
            n += count;
            total += ((UserWeight) other).total;
        } else {
            skip(count);
        }
    }

    @Override
    public double current() {
        return total == 0 ? 1.0 : w / total;
    }

    /**
     * Returns the sum of all weights recorded.
     */
    public double totalWeight() {
        return total;
    }

    @Override
    public void reset() {
        super.reset();
        total = 0;
        w = 1.0;
    }

    @Override
    public UserWeight copy() {
        return new UserWeight();
    }

    @Override
    public String toString() {
        return "UserWeight{w=" + w + ", total=" + total + ", n=" + n + '}';
    }
}
