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

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multivariate normal distribution from a running {@link CovMatrix}.
 */
public class FitMvNormal extends AbstractFit<FitMvNormal, CovMatrix> implements VectorInput {
    private static final Logger LOG = LoggerFactory.getLogger(FitMvNormal.class);

    public FitMvNormal(int dimension) {
        this(dimension, Weight.equal());
    }

    public FitMvNormal(int dimension, Weight weight) {
        super(new CovMatrix(dimension, weight));
    }

    @Override
    public void add(double[] x) {
        stat.add(x);
    }

    @Override
    public int dimension() {
        return stat.dimension();
    }

    /**
     * Returns the mean and covariance.  Until the covariance is positive definite, which needs more than
     * {@code dimension} observations in general position, the standard normal is returned instead.
     */
    public Estimate value() {
        double[][] cov = stat.cov();
        if (isPositiveDefinite(cov)) {
            return new Estimate(stat.mean(), cov);
        }
        LOG.debug("Covariance of {} observations is not positive definite, using the standard normal", stat.count());
        int d = dimension();
        return new Estimate(new double[d], MatrixUtils.createRealIdentityMatrix(d).getData());
    }

    private static boolean isPositiveDefinite(double[][] cov) {
        try {
            new CholeskyDecomposition(MatrixUtils.createRealMatrix(cov));
            return true;
        } catch (NonPositiveDefiniteMatrixException e) {
            return false;
        }
    }

    /**
     * Parameters of a fitted multivariate normal.
     */
    public static final class Estimate {
        private final double[] mean;
        private final double[][] cov;

        Estimate(double[] mean, double[][] cov) {
            this.mean = mean;
            this.cov = cov;
        }

        public double[] mean() {
            return mean.clone();
        }

        public double[][] cov() {
            double[][] r = new double[cov.length][];
            for (int i = 0; i < cov.length; i++) {
                r[i] = cov[i].clone();
            }
            return r;
        }
    }
}
