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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.amazon.anomalyscoring.InvalidInputException;

/**
 * Reads the ids of known anomalies from a delimited file with a header row. The
 * ids are taken from the {@code source_id} column, or from the {@code id}
 * column when there is no {@code source_id} column.
 */
public class LabelReader {

    public static final String SOURCE_ID_COLUMN = "source_id";

    public static final String ID_COLUMN = "id";

    private final Pattern delimiter;

    public LabelReader(String delimiter) {
        checkNotNull(delimiter, "delimiter must not be null");
        checkArgument(!delimiter.isEmpty(), "delimiter must not be empty");
        this.delimiter = Pattern.compile(Pattern.quote(delimiter));
    }

    public Set<Long> read(Path path) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    /**
     * @param in the label file contents
     * @return the ids of the known anomalies
     * @throws IOException           if the input cannot be read
     * @throws InvalidInputException if there is no id column or an id is not a
     *                               number
     */
    public Set<Long> read(BufferedReader in) throws IOException {
        String header = in.readLine();
        checkInput(header != null, "label file is empty");

        List<String> columns = Arrays.asList(delimiter.split(header.trim(), -1));
        int column = columns.indexOf(SOURCE_ID_COLUMN);
        if (column < 0) {
            column = columns.indexOf(ID_COLUMN);
        }
        checkInput(column >= 0, String.format("label file must have a '%s' or '%s' column, found %s",
                SOURCE_ID_COLUMN, ID_COLUMN, columns));

        Set<Long> ids = new HashSet<>();
        int lineNumber = 1;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] fields = delimiter.split(line, -1);
            checkInput(column < fields.length,
                    String.format("Line %d of the label file has no value in column %d", lineNumber, column));
            try {
                ids.add(Long.parseLong(fields[column].trim()));
            } catch (NumberFormatException e) {
                throw new InvalidInputException(
                        String.format("Cannot parse label id on line %d: %s", lineNumber, e.getMessage()), e);
            }
        }
        return ids;
    }
}
