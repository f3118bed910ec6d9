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

package com.amazon.anomalyscoring;

import java.util.ArrayList;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.anomalyscoring.inputtypes.Observation;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.testutils.GroupedDataWithLabels;
import com.amazon.anomalyscoring.testutils.GroupedNormalTestData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class GroupedAnomalyScorerBenchmark {

    public final static int DATA_SIZE = 20_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "5", "50", "500" })
        int numberOfGroups;

        @Param({ "100" })
        int numberOfTrees;

        @Param({ "false", "true" })
        boolean parallel;

        List<Observation> observations;
        GroupedAnomalyScorer scorer;

        @Setup(Level.Trial)
        public void setUpData() {
            GroupedDataWithLabels data = new GroupedNormalTestData().generateTestData(numberOfGroups,
                    DATA_SIZE / numberOfGroups, 99L);
            observations = new ArrayList<>(data.size());
            for (int i = 0; i < data.size(); i++) {
                observations.add(new Observation(data.ids[i], data.groupKeys[i], data.periods[i], data.values[i]));
            }
        }

        @Setup(Level.Trial)
        public void setUpScorer() {
            scorer = GroupedAnomalyScorer.builder().numberOfTrees(numberOfTrees).parallelExecutionEnabled(parallel)
                    .build();
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public List<ScoredObservation> scoreBatch(BenchmarkState state) {
        return state.scorer.score(state.observations);
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public void scoreAndCountAnomalies(BenchmarkState state, Blackhole blackhole) {
        blackhole.consume(state.scorer.scoreBatch(state.observations).getAnomalyCount());
    }
}
