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

package com.amazon.anomalyscoring.sink;

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyscoring.returntypes.ScoredObservation;

/**
 * Writes flagged observations as delimited text rows
 * {@code id,group,period,value,score,method}. Absent fields are written as
 * {@value #MISSING}.
 */
public class DelimitedAnomalySink implements AnomalySink {

    private static final Logger logger = LogManager.getLogger(DelimitedAnomalySink.class);

    public static final String MISSING = "NA";

    public static final List<String> COLUMN_NAMES = Arrays.asList("id", "group", "period", "value", "score",
            "method");

    private final PrintWriter out;
    private final String delimiter;
    private final boolean headerRow;
    private boolean headerWritten;

    public DelimitedAnomalySink(PrintWriter out, String delimiter, boolean headerRow) {
        this.out = checkNotNull(out, "out must not be null");
        this.delimiter = checkNotNull(delimiter, "delimiter must not be null");
        this.headerRow = headerRow;
    }

    @Override
    public void write(List<ScoredObservation> anomalies) {
        checkNotNull(anomalies, "anomalies must not be null");
        if (anomalies.isEmpty()) {
            logger.info("No anomalies to write");
            return;
        }

        if (headerRow && !headerWritten) {
            StringJoiner joiner = new StringJoiner(delimiter);
            COLUMN_NAMES.forEach(joiner::add);
            out.println(joiner.toString());
            headerWritten = true;
        }

        for (ScoredObservation anomaly : anomalies) {
            checkArgument(anomaly.isAnomaly(), "only flagged observations can be written");
            out.println(format(anomaly));
        }
        out.flush();
        logger.info("Wrote {} anomalies", anomalies.size());
    }

    String format(ScoredObservation anomaly) {
        StringJoiner joiner = new StringJoiner(delimiter);
        joiner.add(Long.toString(anomaly.getId()));
        joiner.add(orMissing(anomaly.getGroupKey()));
        joiner.add(orMissing(anomaly.getPeriod()));
        joiner.add(anomaly.getObservation().isValueMissing() ? MISSING : Double.toString(anomaly.getValue()));
        joiner.add(Double.toString(anomaly.getScore()));
        joiner.add(anomaly.getMethod().getLabel());
        return joiner.toString();
    }

    private static String orMissing(String field) {
        return (field == null) ? MISSING : field;
    }
}
