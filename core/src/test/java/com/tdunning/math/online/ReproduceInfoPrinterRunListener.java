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

import org.junit.runner.Result;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;

import com.carrotsearch.randomizedtesting.RandomizedContext;

/**
 * Prints the maven command line that reruns a failed test class with the same seed.
 */
public final class ReproduceInfoPrinterRunListener extends RunListener {

    private boolean failed = false;

    @Override
    public void testFailure(Failure failure) throws Exception {
        failed = true;
    }

    @Override
    public void testRunFinished(Result result) throws Exception {
        if (failed) {
            printReproLine();
        }
        failed = false;
    }

    private void printReproLine() {
        RandomizedContext context = RandomizedContext.current();
        System.out.printf("NOTE: reproduce with: mvn test -pl core -Dtests.seed=%s -Dtest=%s\n",
                context.getRunnerSeedAsString(), context.getTargetClass().getSimpleName());
    }
}
