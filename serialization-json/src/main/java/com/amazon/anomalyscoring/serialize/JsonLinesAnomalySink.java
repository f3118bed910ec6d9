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

package com.amazon.anomalyscoring.serialize;

import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyscoring.returntypes.ScoredObservation;
import com.amazon.anomalyscoring.sink.AnomalySink;

/**
 * Writes one JSON document per flagged observation, one document per line. All
 * documents of one write share the same detection time.
 */
public class JsonLinesAnomalySink implements AnomalySink {

    private static final Logger logger = LogManager.getLogger(JsonLinesAnomalySink.class);

    private final Writer writer;
    private final AnomalySerDe serDe;
    private final Clock clock;

    public JsonLinesAnomalySink(Writer writer) {
        this(writer, new AnomalySerDe(), Clock.systemUTC());
    }

    public JsonLinesAnomalySink(Writer writer, AnomalySerDe serDe, Clock clock) {
        this.writer = checkNotNull(writer, "writer must not be null");
        this.serDe = checkNotNull(serDe, "serDe must not be null");
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    @Override
    public void write(List<ScoredObservation> anomalies) throws IOException {
        checkNotNull(anomalies, "anomalies must not be null");
        if (anomalies.isEmpty()) {
            logger.info("No anomalies to write");
            return;
        }

        Instant detectedAt = clock.instant();
        for (ScoredObservation anomaly : anomalies) {
            writer.write(serDe.toJson(anomaly, detectedAt));
            writer.write("\n");
        }
        writer.flush();
        logger.info("Wrote {} anomaly documents", anomalies.size());
    }
}
