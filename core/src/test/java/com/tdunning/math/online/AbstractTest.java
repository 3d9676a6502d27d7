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

import org.apache.mahout.math.jet.random.Normal;
import org.junit.Ignore;
import org.junit.runner.RunWith;

import com.carrotsearch.randomizedtesting.JUnit3MethodProvider;
import com.carrotsearch.randomizedtesting.JUnit4MethodProvider;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.Listeners;
import com.carrotsearch.randomizedtesting.annotations.TestMethodProviders;

/**
 * Base test case for the statistics.  Runs under the randomized runner so that every failure can be reproduced from
 * the printed seed.
 */
@Ignore
@Listeners({
        ReproduceInfoPrinterRunListener.class
})
@TestMethodProviders({
        JUnit3MethodProvider.class, // test names starting with test*
        JUnit4MethodProvider.class  // test methods annotated with @Test
})
@RunWith(value = com.carrotsearch.randomizedtesting.RandomizedRunner.class)
public abstract class AbstractTest extends RandomizedTest {
    /**
     * Returns {@code n} draws from a normal distribution using the test's random source.
     */
    protected static double[] normalSample(int n, double mean, double sd) {
        Normal normal = new Normal(mean, sd, getRandom());
        double[] r = new double[n];
        for (int i = 0; i < n; i++) {
            r[i] = normal.nextDouble();
        }
        return r;
    }

    /**
     * Returns {@code n} rows of {@code d} correlated normal values.
     */
    protected static double[][] correlatedSample(int n, int d) {
        double[][] r = new double[n][d];
        double[] z = normalSample(n * d, 0, 1);
        for (int i = 0; i < n; i++) {
            double common = z[i * d];
            for (int j = 0; j < d; j++) {
                r[i][j] = (j + 1) * z[i * d + j] + 0.5 * common + j;
            }
        }
        return r;
    }
}
