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
package com.tdunning.math.online.quality;

import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

import org.apache.mahout.math.jet.random.Normal;
import org.junit.Test;

import com.google.common.collect.Lists;
import com.tdunning.math.online.CovMatrix;
import com.tdunning.math.online.Extrema;
import com.tdunning.math.online.Mean;
import com.tdunning.math.online.Moments;
import com.tdunning.math.online.OnlineStat;
import com.tdunning.math.online.ScalarStat;
import com.tdunning.math.online.Variance;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/**
 * Partitions a stream, reduces the partial statistics pairwise and compares the result with a single pass.
 */
public class MergeEquivalenceTest {
    private static final int N = 10_000;

    @Test
    public void testScalarStats() {
        double[] data = sample(N, 1);
        for (int parts : new int[]{2, 5, 10, 17, 100}) {
            Mean mean = reduce(Mean::new, data, parts);
            Variance variance = reduce(Variance::new, data, parts);
            Extrema extrema = reduce(Extrema::new, data, parts);
            Moments moments = reduce(Moments::new, data, parts);

            Mean mean1 = new Mean();
            Variance variance1 = new Variance();
            Extrema extrema1 = new Extrema();
            Moments moments1 = new Moments();
            for (double y : data) {
                mean1.add(y);
                variance1.add(y);
                extrema1.add(y);
                moments1.add(y);
            }

            assertEquals(N, mean.count());
            assertEquals(mean1.value(), mean.value(), 1e-9);
            assertEquals(variance1.value(), variance.value(), 1e-9);
            assertEquals(variance1.mean(), variance.mean(), 1e-9);
            assertArrayEquals(extrema1.value(), extrema.value(), 0);
            assertArrayEquals(moments1.value(), moments.value(), 1e-8);
            assertEquals(moments1.kurtosis(), moments.kurtosis(), 1e-6);
        }
    }

    @Test
    public void testCovariance() {
        double[] z = sample(3 * N, 2);
        double[][] rows = new double[N][3];
        for (int i = 0; i < N; i++) {
            rows[i][0] = z[3 * i];
            rows[i][1] = z[3 * i] + z[3 * i + 1];
            rows[i][2] = 10 + 2 * z[3 * i + 2] - z[3 * i];
        }
        CovMatrix single = new CovMatrix(3);
        single.addAll(rows);

        for (int parts : new int[]{2, 7, 50}) {
            List<CovMatrix> pieces = Lists.newArrayList();
            for (int k = 0; k < parts; k++) {
                pieces.add(new CovMatrix(3));
            }
            for (int i = 0; i < N; i++) {
                pieces.get(i % parts).add(rows[i]);
            }
            CovMatrix merged = treeReduce(pieces);
            assertEquals(N, merged.count());
            double[][] expected = single.cov();
            double[][] actual = merged.cov();
            for (int i = 0; i < 3; i++) {
                assertArrayEquals(expected[i], actual[i], 1e-8);
            }
            assertArrayEquals(single.mean(), merged.mean(), 1e-9);
        }
    }

    private static <S extends ScalarStat<S>> S reduce(Supplier<S> factory, double[] data, int parts) {
        List<S> pieces = Lists.newArrayList();
        for (int k = 0; k < parts; k++) {
            pieces.add(factory.get());
        }
        // contiguous blocks of uneven size
        int start = 0;
        for (int k = 0; k < parts; k++) {
            int end = k == parts - 1 ? data.length : start + (data.length - start) / (parts - k) + (k % 3);
            for (int i = start; i < end; i++) {
                pieces.get(k).add(data[i]);
            }
            start = end;
        }
        return treeReduce(pieces);
    }

    private static <S extends OnlineStat<S>> S treeReduce(List<S> pieces) {
        List<S> level = pieces;
        while (level.size() > 1) {
            List<S> next = Lists.newArrayList();
            for (int i = 0; i < level.size(); i += 2) {
                S left = level.get(i);
                if (i + 1 < level.size()) {
                    left.merge(level.get(i + 1));
                }
                next.add(left);
            }
            level = next;
        }
        return level.get(0);
    }

    private static double[] sample(int n, long seed) {
        Normal normal = new Normal(3, 2, new Random(seed));
        double[] r = new double[n];
        for (int i = 0; i < n; i++) {
            r[i] = normal.nextDouble();
        }
        return r;
    }
}
