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

package com.amazon.anomalyscoring.runner;

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;
import static com.amazon.anomalyscoring.CommonUtils.checkInput;
import static com.amazon.anomalyscoring.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.amazon.anomalyscoring.InvalidInputException;
import com.amazon.anomalyscoring.inputtypes.Observation;

/**
 * Reads observations from delimited text with the four columns
 * {@code id, group, period, value}. Empty fields and the tokens {@code NA},
 * {@code NaN}, {@code null} and {@code None} (in any case) are read as missing.
 * Blank lines are skipped.
 */
public class ObservationReader {

    public static final int NUMBER_OF_COLUMNS = 4;

    static final Set<String> MISSING_TOKENS = new HashSet<>(Arrays.asList("", "na", "nan", "null", "none"));

    private final Pattern delimiter;
    private final boolean headerRow;
    private final int limit;

    /**
     * @param delimiter field delimiter, taken literally
     * @param headerRow whether the first line is a header row to skip
     * @param limit     maximum number of observations to read, 0 for no limit
     */
    public ObservationReader(String delimiter, boolean headerRow, int limit) {
        checkNotNull(delimiter, "delimiter must not be null");
        checkArgument(!delimiter.isEmpty(), "delimiter must not be empty");
        checkArgument(limit >= 0, "limit must not be negative");
        this.delimiter = Pattern.compile(Pattern.quote(delimiter));
        this.headerRow = headerRow;
        this.limit = limit;
    }

    /**
     * Read observations until the end of the input or the limit.
     *
     * @param in the input
     * @return the observations in input order
     * @throws IOException           if the input cannot be read
     * @throws InvalidInputException if a row is malformed
     */
    public List<Observation> read(BufferedReader in) throws IOException {
        List<Observation> observations = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((limit == 0 || observations.size() < limit) && (line = in.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && headerRow) {
                continue;
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            observations.add(parseLine(line, lineNumber));
        }
        return observations;
    }

    Observation parseLine(String line, int lineNumber) {
        String[] fields = delimiter.split(line, -1);
        checkInput(fields.length == NUMBER_OF_COLUMNS,
                String.format("Wrong number of values on line %d. Expected %d but found %d.", lineNumber,
                        NUMBER_OF_COLUMNS, fields.length));

        long id;
        Double value = null;
        try {
            id = Long.parseLong(fields[0].trim());
            if (!isMissing(fields[3])) {
                value = Double.parseDouble(fields[3].trim());
            }
        } catch (NumberFormatException e) {
            throw new InvalidInputException(String.format("Cannot parse line %d: %s", lineNumber, e.getMessage()),
                    e);
        }

        String groupKey = isMissing(fields[1]) ? null : fields[1].trim();
        String period = isMissing(fields[2]) ? null : fields[2].trim();
        return new Observation(id, groupKey, period, value);
    }

    static boolean isMissing(String field) {
        return MISSING_TOKENS.contains(field.trim().toLowerCase(Locale.ROOT));
    }
}
