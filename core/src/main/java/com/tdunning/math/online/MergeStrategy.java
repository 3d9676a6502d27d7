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
 * How the blend coefficient for a merge is chosen.  Each strategy first adds the other side's observations to the
 * receiving weight.
 */
public enum MergeStrategy {
    /**
     * The other side's observations are treated as if they followed this side's, so the coefficient is what the
     * weight gives for a batch of that size.  With {@link EqualWeight} this is {@code n2 / (n1 + n2)}.
     */
    APPEND {
        @Override
        double coefficient(Weight mine, Weight theirs, long n2) {
            return mine.nextMerged(theirs, n2);
        }
    },

    /**
     * The coefficient is the average of the two sides' current coefficients.
     */
    MEAN {
        @Override
        double coefficient(Weight mine, Weight theirs, long n2) {
            mine.skipMerged(theirs, n2);
            return (mine.current() + theirs.current()) / 2;
        }
    },

    /**
     * The other side is treated as a single observation.
     */
    SINGLETON {
        @Override
        double coefficient(Weight mine, Weight theirs, long n2) {
            mine.skipMerged(theirs, n2);
            return mine.current();
        }
    };

    abstract double coefficient(Weight mine, Weight theirs, long n2);
}
