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

import java.util.Random;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.mahout.math.jet.random.Normal;
import org.junit.Test;

import com.tdunning.math.online.AbstractQuantile;
import com.tdunning.math.online.QuantileISGD;
import com.tdunning.math.online.QuantileMM;
import com.tdunning.math.online.QuantileSGD;

import static org.junit.Assert.assertEquals;

/**
 * Checks that the stochastic quantile estimators settle near the true quartiles of a normal distribution and that
 * the error shrinks with more data.
 */
public class QuantileConvergenceTest {
    private static final double[] TAU = {0.25, 0.5, 0.75};

    @Test
    public void testSgd() {
        check(new QuantileSGD(TAU), new QuantileSGD(TAU));
    }

    @Test
    public void testImplicitSgd() {
        check(new QuantileISGD(TAU), new QuantileISGD(TAU));
    }

    @Test
    public void testMajorizeMinimize() {
        check(new QuantileMM(TAU), new QuantileMM(TAU));
    }

    private static void check(AbstractQuantile<?> shortRun, AbstractQuantile<?> longRun) {
        feed(shortRun, 10_000, 1);
        feed(longRun, 100_000, 2);
        NormalDistribution truth = new NormalDistribution();
        for (int i = 0; i < TAU.length; i++) {
            double q = truth.inverseCumulativeProbability(TAU[i]);
            assertEquals(shortRun.getClass().getSimpleName() + " at " + TAU[i], q, shortRun.value()[i], 0.2);
            assertEquals(longRun.getClass().getSimpleName() + " at " + TAU[i], q, longRun.value()[i], 0.1);
        }
    }

    private static void feed(AbstractQuantile<?> q, int n, long seed) {
        Normal normal = new Normal(0, 1, new Random(seed));
        for (int i = 0; i < n; i++) {
            q.add(normal.nextDouble());
        }
    }
}
