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

import com.google.common.collect.Lists;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class OrderStatsTest extends AbstractTest {
    @Test
    public void testSingleBatchIsSorted() {
        List<Double> batch = Lists.newArrayList(1.0, 2.0, 3.0, 4.0, 5.0);
        Collections.shuffle(batch, getRandom());
        OrderStats o = new OrderStats(5);
        for (double y : batch) {
            o.add(y);
        }
        assertArrayEquals(new double[]{1, 2, 3, 4, 5}, o.value(), 0);
        assertEquals(1, o.batches());
        assertEquals(5, o.count());
    }

    @Test
    public void testBatchesAreAveraged() {
        OrderStats o = new OrderStats(5);
        o.addAll(5, 4, 3, 2, 1);
        o.addAll(10, 6, 8, 9, 7);
        assertArrayEquals(new double[]{3.5, 4.5, 5.5, 6.5, 7.5}, o.value(), 0);

        // an incomplete batch leaves the value alone
        o.addAll(100, 200);
        assertArrayEquals(new double[]{3.5, 4.5, 5.5, 6.5, 7.5}, o.value(), 0);
        assertEquals(2, o.batches());
        assertEquals(12, o.count());
    }

    @Test
    public void testMergeCarriesBufferedValues() {
        OrderStats a = new OrderStats(5);
        a.addAll(1, 2, 3, 4, 5);
        OrderStats b = new OrderStats(5);
        b.addAll(6, 7, 8, 9, 10, 11, 12);

        a.merge(b);
        assertEquals(12, a.count());
        assertEquals(2, a.batches());
        assertArrayEquals(new double[]{3.5, 4.5, 5.5, 6.5, 7.5}, a.value(), 1e-12);

        a.addAll(13, 14, 15);
        assertEquals(3, a.batches());
        assertArrayEquals(new double[]{6, 7, 8, 9, 10}, a.value(), 1e-12);

        // the merged peer is unchanged
        assertEquals(7, b.count());
        assertArrayEquals(new double[]{6, 7, 8, 9, 10}, b.value(), 0);
    }

    @Test
    public void testMergeIntoEmpty() {
        OrderStats a = new OrderStats(2);
        OrderStats b = new OrderStats(2);
        b.addAll(4, 2);
        a.merge(b);
        assertArrayEquals(new double[]{2, 4}, a.value(), 0);
        assertEquals(1, a.batches());
    }

    @Test
    public void testBatchWeight() {
        OrderStats o = new OrderStats(2, Weight.exponential(0.5));
        o.addAll(4, 2);
        assertArrayEquals(new double[]{1, 2}, o.value(), 0);
        o.addAll(4, 2);
        assertArrayEquals(new double[]{1.5, 3}, o.value(), 0);
    }

    @Test
    public void testDifferentBatchSizes() {
        OrderStats a = new OrderStats(3);
        OrderStats b = new OrderStats(4);
        b.addAll(1, 2, 3, 4);
        try {
            a.merge(b);
            fail("Expected IncompatibleConfigException");
        } catch (IncompatibleConfigException e) {
            assertEquals(0, a.count());
        }
    }
}
