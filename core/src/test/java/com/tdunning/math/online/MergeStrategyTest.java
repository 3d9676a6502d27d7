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

import org.junit.Test;

import static org.junit.Assert.*;

public class MergeStrategyTest extends AbstractTest {
    private static Mean mean(double... data) {
        Mean r = new Mean();
        r.addAll(data);
        return r;
    }

    @Test
    public void testAppend() {
        Mean a = mean(0, 0, 0);
        a.merge(mean(10, 10));
        assertEquals(4, a.value(), 1e-12);
        assertEquals(5, a.count());
    }

    @Test
    public void testSingleton() {
        Mean a = mean(0, 0, 0);
        a.merge(mean(10, 10), MergeStrategy.SINGLETON);
        // the peer gets the weight of one more observation among five
        assertEquals(2, a.value(), 1e-12);
        assertEquals(5, a.count());
    }

    @Test
    public void testMean() {
        Mean a = mean(0, 0, 0);
        a.merge(mean(10, 10), MergeStrategy.MEAN);
        assertEquals(3.5, a.value(), 1e-12);
        assertEquals(5, a.count());
    }

    @Test
    public void testExplicitCoefficient() {
        Mean a = mean(0);
        a.merge(mean(10), 0.25);
        assertEquals(2.5, a.value(), 1e-12);
        assertEquals(2, a.count());

        try {
            a.merge(mean(10), 1.5);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(2, a.count());
        }
    }

    @Test
    public void testEmptyPeerIsIgnored() {
        for (MergeStrategy strategy : MergeStrategy.values()) {
            Mean a = mean(1, 2, 3);
            a.merge(new Mean(), strategy);
            assertEquals(2, a.value(), 0);
            assertEquals(3, a.count());
        }
        Variance v = new Variance();
        v.addAll(1, 2, 3);
        v.merge(new Variance(), 0.9);
        assertEquals(1, v.value(), 1e-12);
    }

    @Test
    public void testMergeIntoEmpty() {
        for (MergeStrategy strategy : MergeStrategy.values()) {
            Mean a = new Mean();
            Mean b = mean(10, 20);
            a.merge(b, strategy);
            assertEquals(15, a.value(), 0);
            assertEquals(2, a.count());
            assertEquals(2, b.count());
        }
    }

    @Test
    public void testOtherSideUnchanged() {
        Variance a = new Variance();
        Variance b = new Variance();
        a.addAll(1, 2, 3);
        b.addAll(4, 5, 6, 7);
        a.merge(b);
        assertEquals(4, b.count());
        assertEquals(5.5, b.mean(), 1e-12);
        assertEquals(4, a.mean(), 1e-12);
        assertEquals(4.666666666666667, a.value(), 1e-9);
    }

    @Test
    public void testExplicitCoefficientIntoEmpty() {
        Mean a = new Mean();
        a.merge(mean(10, 20), 0.5);
        assertEquals(15, a.value(), 0);
        assertEquals(2, a.count());
    }

    @Test
    public void testUserWeightedAppend() {
        Mean a = new Mean(Weight.user());
        Mean b = new Mean(Weight.user());
        a.add(1, 1);
        a.add(1, 1);
        b.add(10, 1);
        b.add(10, 1);
        a.merge(b);
        assertEquals(5.5, a.value(), 1e-12);
        assertEquals(4, a.count());
        assertEquals(4, ((UserWeight) a.weight()).totalWeight(), 0);

        Mean c = new Mean(Weight.user());
        Mean d = new Mean(Weight.user());
        c.add(1, 1);
        d.add(10, 9);
        c.merge(d);
        // same as adding both observations to one statistic
        Mean single = new Mean(Weight.user());
        single.add(1, 1);
        single.add(10, 9);
        assertEquals(9.1, c.value(), 1e-12);
        assertEquals(single.value(), c.value(), 1e-12);
        assertEquals(10, ((UserWeight) c.weight()).totalWeight(), 0);
    }
}
