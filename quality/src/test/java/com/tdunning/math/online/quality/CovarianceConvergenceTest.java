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

import org.apache.mahout.math.jet.random.Normal;
import org.junit.Test;

import com.tdunning.math.online.CovMatrix;

import static org.junit.Assert.assertEquals;

public class CovarianceConvergenceTest {
    // lower triangular factor of the target covariance
    private static final double[][] L = {
            {1, 0, 0},
            {0.5, 1, 0},
            {0.2, 0.3, 1}
    };
    private static final double[] MU = {1, -2, 0.5};

    @Test
    public void testConvergesToKnownCovariance() {
        Normal normal = new Normal(0, 1, new Random(42));
        CovMatrix stat = new CovMatrix(3);
        double[] z = new double[3];
        for (int n = 0; n < 100_000; n++) {
            for (int i = 0; i < 3; i++) {
                z[i] = normal.nextDouble();
            }
            double[] x = new double[3];
            for (int i = 0; i < 3; i++) {
                x[i] = MU[i];
                for (int j = 0; j <= i; j++) {
                    x[i] += L[i][j] * z[j];
                }
            }
            stat.add(x);
        }

        double[][] sigma = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                for (int k = 0; k < 3; k++) {
                    sigma[i][j] += L[i][k] * L[j][k];
                }
            }
        }

        double[][] cov = stat.cov();
        double[][] cor = stat.cor();
        double[] mean = stat.mean();
        for (int i = 0; i < 3; i++) {
            assertEquals(MU[i], mean[i], 0.02);
            assertEquals(1.0, cor[i][i], 0);
            for (int j = 0; j < 3; j++) {
                assertEquals(sigma[i][j], cov[i][j], 0.05);
                assertEquals(cov[j][i], cov[i][j], 0);
                double expected = sigma[i][j] / Math.sqrt(sigma[i][i] * sigma[j][j]);
                assertEquals(expected, cor[i][j], 0.02);
            }
        }
    }
}
