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

package com.amazon.anomalyscoring.examples.serialization;

import java.io.StringWriter;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.amazon.anomalyscoring.GroupedAnomalyScorer;
import com.amazon.anomalyscoring.examples.Example;
import com.amazon.anomalyscoring.examples.ExampleData;
import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.serialize.AnomalyRecord;
import com.amazon.anomalyscoring.serialize.AnomalySerDe;
import com.amazon.anomalyscoring.serialize.JsonLinesAnomalySink;
import com.amazon.anomalyscoring.testutils.GroupedNormalTestData;

/**
 * Hand the flagged observations to a sink that writes one JSON document per
 * anomaly, using <a href="https://github.com/google/gson">Gson</a>.
 */
public class JsonLinesExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonLinesExample().run();
    }

    @Override
    public String command() {
        return "json-lines";
    }

    @Override
    public String description() {
        return "write flagged observations as JSON lines documents";
    }

    @Override
    public void run() throws Exception {
        List<ScoredObservation> anomalies = GroupedAnomalyScorer.builder().contamination(0.02).build()
                .scoreBatch(ExampleData.toObservations(new GroupedNormalTestData().generateTestData(3, 150, 17L)))
                .getAnomalies();

        StringWriter writer = new StringWriter();
        AnomalySerDe serDe = new AnomalySerDe();
        new JsonLinesAnomalySink(writer).write(anomalies);
        System.out.print(writer);

        Set<Long> written = writer.toString().lines().map(serDe::anomalyFromJson).map(AnomalyRecord::getSourceId)
                .collect(Collectors.toSet());
        Set<Long> flagged = anomalies.stream().map(ScoredObservation::getId).collect(Collectors.toSet());
        if (!written.equals(flagged)) {
            throw new IllegalStateException("written documents do not match the flagged observations");
        }
        System.out.printf("%d documents written%n", written.size());
        System.out.println("Looks good!");
    }
}
