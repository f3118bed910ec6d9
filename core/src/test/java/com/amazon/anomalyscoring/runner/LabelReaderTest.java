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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.anomalyscoring.InvalidInputException;

public class LabelReaderTest {

    @TempDir
    Path directory;

    private LabelReader reader;

    @BeforeEach
    public void setUp() {
        reader = new LabelReader(",");
    }

    private Path write(String... lines) throws IOException {
        Path file = directory.resolve("labels.csv");
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testSourceIdColumn() throws IOException {
        Path file = write("source_id,country", "3,US", "5,FR", "", "3,US");
        assertEquals(new HashSet<>(Arrays.asList(3L, 5L)), reader.read(file));
    }

    @Test
    public void testIdColumn() throws IOException {
        Path file = write("country,id", "US,1", "FR,2");
        assertEquals(new HashSet<>(Arrays.asList(1L, 2L)), reader.read(file));
    }

    @Test
    public void testSourceIdIsPreferred() throws IOException {
        Path file = write("id,source_id", "1,10", "2,20");
        assertEquals(new HashSet<>(Arrays.asList(10L, 20L)), reader.read(file));
    }

    @Test
    public void testHeaderOnly() throws IOException {
        assertTrue(reader.read(write("id")).isEmpty());
    }

    @Test
    public void testMissingIdColumn() throws IOException {
        Path file = write("key,country", "1,US");
        assertThrows(InvalidInputException.class, () -> reader.read(file));
    }

    @Test
    public void testEmptyFile() throws IOException {
        Path file = directory.resolve("empty.csv");
        Files.createFile(file);
        assertThrows(InvalidInputException.class, () -> reader.read(file));
    }

    @Test
    public void testMalformedId() throws IOException {
        assertThrows(InvalidInputException.class, () -> reader.read(write("id,country", "one,US")));
        assertThrows(InvalidInputException.class, () -> reader.read(write("country,id", "US")));
    }
}
