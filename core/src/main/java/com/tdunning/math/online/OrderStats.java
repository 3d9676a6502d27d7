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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Average order statistics of batches of size {@code p}.
 *
 * Observations are buffered until {@code p} have arrived, the batch is then sorted and smoothed into the running
 * order statistics.  The unit of weighting is the batch, so this statistic has two weights: the usual one that counts
 * observations and a batch weight that provides the coefficient for each sorted batch.  With the default equal batch
 * weight, the k-th batch gets coefficient {@code 1/k}.
 */
public class OrderStats extends ScalarStat<OrderStats> {
    private static final Logger LOG = LoggerFactory.getLogger(OrderStats.class);

    private final Weight batchWeight;
    private final double[] value;
    private final double[] buffer;
    // number of buffered observations
    private int used = 0;

    public OrderStats(int p) {
        this(p, Weight.equal());
    }

    /**
     * @param p           The batch size.
     * @param batchWeight The weight applied per completed batch.
     */
    public OrderStats(int p, Weight batchWeight) {
        this(p, Weight.equal(), batchWeight);
    }

    public OrderStats(int p, Weight weight, Weight batchWeight) {
        super(weight);
        Preconditions.checkArgument(p >= 1, "Batch size must be positive, got %d", p);
        Preconditions.checkArgument(batchWeight != null, "Batch weight must not be null");
        this.batchWeight = batchWeight;
        this.value = new double[p];
        this.buffer = new double[p];
    }

    @Override
    protected void fit(double y, double gamma) {
        push(y);
    }

    private void push(double y) {
        buffer[used++] = y;
        if (used == buffer.length) {
            Arrays.sort(buffer);
            Smooth.smooth(value, buffer, batchWeight.next());
            used = 0;
        }
    }

    @Override
    protected void checkCompatible(OrderStats other) {
        if (other.value.length != value.length) {
            throw new IncompatibleConfigException(
                    String.format("Batch sizes differ: %d and %d", value.length, other.value.length));
        }
    }

    @Override
    protected void combine(OrderStats other, double gamma) {
        long batches = other.batches();
        if (batches > 0) {
            boolean empty = batches() == 0;
            double g = batchWeight.next(batches);
            Smooth.smooth(value, other.value, empty ? 1.0 : g);
        }
        if (other.used > 0) {
            LOG.debug("Carrying {} buffered observations over from merged order statistics", other.used);
            for (int i = 0; i < other.used; i++) {
                push(other.buffer[i]);
            }
        }
    }

    /**
     * Returns a copy of the averaged order statistics, all zero before the first batch completes.
     */
    public double[] value() {
        return value.clone();
    }

    /**
     * Returns the number of completed batches.
     */
    public long batches() {
        return batchWeight.count();
    }

    public int batchSize() {
        return value.length;
    }

    @Override
    public String toString() {
        return "OrderStats{p=" + value.length + ", batches=" + batches() + ", n=" + count() + '}';
    }
}
