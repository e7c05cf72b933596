/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.columnar.dictcodec.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.columnar.dictcodec.algorithm.DictionaryCodec;
import org.columnar.dictcodec.algorithm.dictionary.StringDictionary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test cases for {@link EncodedColumnStore}.
 */
public class TestEncodedColumnStore {

  private BufferAllocator allocator;

  @TempDir
  Path directory;

  private EncodedColumnStore store;

  @BeforeEach
  public void prepare() {
    allocator = new RootAllocator(Long.MAX_VALUE);
    store = new EncodedColumnStore(directory.resolve("dictionary.txt"), directory.resolve("data.txt"));
  }

  @AfterEach
  public void shutdown() {
    allocator.close();
  }

  @Test
  public void testRoundTrip() throws Exception {
    List<String> values = Arrays.asList("b,c", "", "中文", "a", "b,c", "𝄞", "");
    try (VarCharVector rows = newColumn(values);
         StringDictionary dictionary = DictionaryCodec.buildDictionary(rows, 2, allocator);
         IntVector encoded = DictionaryCodec.encode(rows, dictionary, 2, allocator)) {
      store.write(dictionary, encoded);

      try (EncodedColumn column = store.read(allocator)) {
        assertEquals(dictionary.getValues(), column.getDictionary().getValues());
        assertArrayEquals(toArray(encoded), toArray(column.getEncoded()));
        try (VarCharVector decoded = DictionaryCodec.decode(column.getEncoded(), column.getDictionary(), allocator)) {
          assertEquals(values, toStrings(decoded));
        }
      }
    }
  }

  @Test
  public void testFileLayout() throws Exception {
    try (VarCharVector rows = newColumn(Arrays.asList("a", "b", "a", "c", "ab"));
         StringDictionary dictionary = DictionaryCodec.buildDictionary(rows, 2, allocator);
         IntVector encoded = DictionaryCodec.encode(rows, dictionary, 2, allocator)) {
      store.write(dictionary, encoded);
    }
    assertEquals(Arrays.asList("0,a", "1,ab", "2,b", "3,c"),
        Files.readAllLines(store.getDictionaryFile(), StandardCharsets.UTF_8));
    assertEquals(Arrays.asList("0", "2", "0", "3", "1"),
        Files.readAllLines(store.getDataFile(), StandardCharsets.UTF_8));
  }

  @Test
  public void testEmptyColumn() throws Exception {
    try (VarCharVector rows = newColumn(new ArrayList<>());
         StringDictionary dictionary = DictionaryCodec.buildDictionary(rows, 4, allocator);
         IntVector encoded = DictionaryCodec.encode(rows, dictionary, 4, allocator)) {
      store.write(dictionary, encoded);
    }
    try (EncodedColumn column = store.read(allocator)) {
      assertEquals(0, column.getDictionary().size());
      assertEquals(0, column.getEncoded().getValueCount());
    }
  }

  @Test
  public void testRejectLineBreaks() throws Exception {
    try (VarCharVector rows = newColumn(Arrays.asList("a", "b\nc"));
         StringDictionary dictionary = DictionaryCodec.buildDictionary(rows, 1, allocator);
         IntVector encoded = DictionaryCodec.encode(rows, dictionary, 1, allocator)) {
      assertThrows(IllegalArgumentException.class, () -> store.write(dictionary, encoded));
    }
    assertFalse(Files.exists(store.getDictionaryFile()));
    assertFalse(Files.exists(store.getDataFile()));
  }

  @Test
  public void testMissingDelimiter() throws Exception {
    writeFiles("0,a\nb\n", "0\n");
    assertInvalid(store.getDictionaryFile(), 2);
  }

  @Test
  public void testInvalidCode() throws Exception {
    writeFiles("x,a\n", "0\n");
    InvalidDictionaryFileException e = assertInvalid(store.getDictionaryFile(), 1);
    assertEquals(NumberFormatException.class, e.getCause().getClass());
  }

  @Test
  public void testCodeGap() throws Exception {
    writeFiles("0,a\n2,b\n", "0\n");
    assertInvalid(store.getDictionaryFile(), 2);
  }

  @Test
  public void testUnsortedValues() throws Exception {
    writeFiles("0,b\n1,a\n", "0\n");
    assertInvalid(store.getDictionaryFile(), 2);
  }

  @Test
  public void testDuplicateValues() throws Exception {
    writeFiles("0,a\n1,b\n2,b\n", "0\n");
    assertInvalid(store.getDictionaryFile(), 3);
  }

  @Test
  public void testInvalidDataLine() throws Exception {
    writeFiles("0,a\n", "0\nz\n");
    assertInvalid(store.getDataFile(), 2);
  }

  @Test
  public void testDataCodeOutOfRange() throws Exception {
    writeFiles("0,a\n1,b\n", "0\n1\n0\n2\n");
    assertInvalid(store.getDataFile(), 4);
  }

  @Test
  public void testMalformedDictionaryValue() throws Exception {
    byte[] dictionary = {'0', ',', 'a', '\n', '1', ',', (byte) 0xC3, '\n', '2', ',', 'z', '\n'};
    Files.write(store.getDictionaryFile(), dictionary);
    Files.write(store.getDataFile(), "0\n".getBytes(StandardCharsets.UTF_8));
    assertInvalid(store.getDictionaryFile(), 2);
  }

  @Test
  public void testMalformedDataLine() throws Exception {
    Files.write(store.getDictionaryFile(), "0,a\n".getBytes(StandardCharsets.UTF_8));
    Files.write(store.getDataFile(), new byte[] {'0', '\n', '0', '\n', (byte) 0xFF, '\n'});
    assertInvalid(store.getDataFile(), 3);
  }

  private InvalidDictionaryFileException assertInvalid(Path file, long lineNumber) {
    InvalidDictionaryFileException e = assertThrows(InvalidDictionaryFileException.class, () -> store.read(allocator));
    assertEquals(file, e.getFile());
    assertEquals(lineNumber, e.getLineNumber());
    return e;
  }

  private void writeFiles(String dictionary, String data) throws IOException {
    Files.write(store.getDictionaryFile(), dictionary.getBytes(StandardCharsets.UTF_8));
    Files.write(store.getDataFile(), data.getBytes(StandardCharsets.UTF_8));
  }

  private VarCharVector newColumn(List<String> values) {
    VarCharVector vector = new VarCharVector("rows", allocator);
    vector.allocateNew();
    for (int i = 0; i < values.size(); i++) {
      vector.setSafe(i, values.get(i).getBytes(StandardCharsets.UTF_8));
    }
    vector.setValueCount(values.size());
    return vector;
  }

  private static List<String> toStrings(VarCharVector vector) {
    List<String> result = new ArrayList<>(vector.getValueCount());
    for (int i = 0; i < vector.getValueCount(); i++) {
      result.add(new String(vector.get(i), StandardCharsets.UTF_8));
    }
    return result;
  }

  private static int[] toArray(IntVector vector) {
    int[] result = new int[vector.getValueCount()];
    for (int i = 0; i < result.length; i++) {
      result[i] = vector.get(i);
    }
    return result;
  }
}
