/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyscoring.examples.scoring;

import java.util.List;

import com.amazon.anomalyscoring.GroupedAnomalyScorer;
import com.amazon.anomalyscoring.examples.Example;
import com.amazon.anomalyscoring.examples.ExampleData;
import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.testutils.GroupedNormalTestData;

/**
 * Score many groups on a private thread pool and check that the result matches
 * sequential scoring.
 */
public class ParallelScoringExample implements Example {

    public static void main(String[] args) throws Exception {
        new ParallelScoringExample().run();
    }

    @Override
    public String command() {
        return "parallel";
    }

    @Override
    public String description() {
        return "score groups in parallel and compare with sequential scoring";
    }

    @Override
    public void run() throws Exception {
        int numberOfGroups = 40;
        int rowsPerGroup = 150;
        int threadPoolSize = 4;

        List<Observation> observations = ExampleData
                .toObservations(new GroupedNormalTestData().generateTestData(numberOfGroups, rowsPerGroup, 99L));

        GroupedAnomalyScorer sequential = GroupedAnomalyScorer.builder().build();
        GroupedAnomalyScorer parallel = GroupedAnomalyScorer.builder().parallelExecutionEnabled(true)
                .threadPoolSize(threadPoolSize).build();

        long start = System.nanoTime();
        List<ScoredObservation> sequentialResult = sequential.score(observations);
        long sequentialMillis = (System.nanoTime() - start) / 1_000_000;

        start = System.nanoTime();
        List<ScoredObservation> parallelResult = parallel.score(observations);
        long parallelMillis = (System.nanoTime() - start) / 1_000_000;

        System.out.printf("groups = %d, rows per group = %d, threads = %d%n", numberOfGroups, rowsPerGroup,
                threadPoolSize);
        System.out.printf("sequential = %d ms, parallel = %d ms%n", sequentialMillis, parallelMillis);

        if (!sequentialResult.equals(parallelResult)) {
            throw new IllegalStateException("parallel scoring does not match sequential scoring");
        }
        System.out.println("Looks good!");
    }
}
