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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.columnar.dictcodec.algorithm.dictionary.StringDictionary;
import org.columnar.dictcodec.algorithm.dictionary.Utf8Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists a dictionary and the column encoded with it as a pair of UTF-8 text files.
 *
 * <p>The dictionary file has one {@code code,value} line per value, in ascending code order. Only the
 * first comma is a delimiter, so values may contain commas. The data file has one decimal code per
 * line, in row order.
 *
 * <p>Reading is strict: any malformed line fails the whole read with an
 * {@link InvalidDictionaryFileException}, and nothing read so far is returned. The store assumes no
 * concurrent writers.
 */
public class EncodedColumnStore {

  private static final Logger logger = LoggerFactory.getLogger(EncodedColumnStore.class);

  private static final char DELIMITER = ',';

  private static final char LINE_SEPARATOR = '\n';

  static final String DICTIONARY_VECTOR_NAME = "dictionary";

  static final String ENCODED_VECTOR_NAME = "encoded";

  private final Path dictionaryFile;

  private final Path dataFile;

  /**
   * Constructs a store.
   * @param dictionaryFile the path of the dictionary file.
   * @param dataFile the path of the encoded data file.
   */
  public EncodedColumnStore(Path dictionaryFile, Path dataFile) {
    Preconditions.checkNotNull(dictionaryFile, "dictionary file must not be null");
    Preconditions.checkNotNull(dataFile, "data file must not be null");
    this.dictionaryFile = dictionaryFile;
    this.dataFile = dataFile;
  }

  public Path getDictionaryFile() {
    return dictionaryFile;
  }

  public Path getDataFile() {
    return dataFile;
  }

  /**
   * Writes a dictionary and an encoded column, replacing existing files.
   * @param dictionary the dictionary.
   * @param encoded the column encoded with the dictionary.
   * @throws IllegalArgumentException if a value contains a line break, or a code is null or outside
   *     the dictionary. Nothing is written in this case.
   * @throws IOException if the files cannot be written.
   */
  public void write(StringDictionary dictionary, IntVector encoded) throws IOException {
    Preconditions.checkNotNull(dictionary, "dictionary must not be null");
    Preconditions.checkNotNull(encoded, "encoded vector must not be null");
    validate(dictionary, encoded);

    try (BufferedWriter writer = Files.newBufferedWriter(dictionaryFile, StandardCharsets.UTF_8)) {
      for (int code = 0; code < dictionary.size(); code++) {
        writer.write(Integer.toString(code));
        writer.write(DELIMITER);
        writer.write(dictionary.valueOf(code));
        writer.write(LINE_SEPARATOR);
      }
    }

    try (BufferedWriter writer = Files.newBufferedWriter(dataFile, StandardCharsets.UTF_8)) {
      for (int i = 0; i < encoded.getValueCount(); i++) {
        writer.write(Integer.toString(encoded.get(i)));
        writer.write(LINE_SEPARATOR);
      }
    }

    logger.debug("Wrote {} dictionary values to {} and {} codes to {}",
        dictionary.size(), dictionaryFile, encoded.getValueCount(), dataFile);
  }

  /**
   * Reads a dictionary and its encoded column.
   * @param allocator the allocator for the dictionary and the encoded vector.
   * @return the pair read, owned by the caller.
   * @throws InvalidDictionaryFileException if a file is malformed.
   * @throws IOException if the files cannot be read.
   */
  public EncodedColumn read(BufferAllocator allocator) throws IOException {
    Preconditions.checkNotNull(allocator, "allocator must not be null");
    StringDictionary dictionary = readDictionary(allocator);
    try {
      IntVector encoded = readCodes(dictionary.size(), allocator);
      logger.debug("Read {} dictionary values from {} and {} codes from {}",
          dictionary.size(), dictionaryFile, encoded.getValueCount(), dataFile);
      return new EncodedColumn(dictionary, encoded);
    } catch (IOException | RuntimeException e) {
      dictionary.close();
      throw e;
    }
  }

  private static void validate(StringDictionary dictionary, IntVector encoded) {
    for (int code = 0; code < dictionary.size(); code++) {
      String value = dictionary.valueOf(code);
      if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
        throw new IllegalArgumentException("The value of code " + code + " contains a line break");
      }
    }
    for (int i = 0; i < encoded.getValueCount(); i++) {
      Preconditions.checkArgument(!encoded.isNull(i), "null code at row %s", i);
      int code = encoded.get(i);
      Preconditions.checkArgument(code >= 0 && code < dictionary.size(),
          "code %s at row %s is outside the dictionary of size %s", code, i, dictionary.size());
    }
  }

  private StringDictionary readDictionary(BufferAllocator allocator) throws IOException {
    VarCharVector values = new VarCharVector(DICTIONARY_VECTOR_NAME, allocator);
    try (BufferedReader reader = newLineReader(dictionaryFile)) {
      values.allocateNew();
      int expectedCode = 0;
      byte[] previous = null;
      String line;
      while ((line = reader.readLine()) != null) {
        long lineNumber = expectedCode + 1L;
        int delimiter = line.indexOf(DELIMITER);
        if (delimiter < 0) {
          throw new InvalidDictionaryFileException(dictionaryFile, lineNumber, "missing delimiter '" + DELIMITER + "'");
        }

        int code = parseCode(dictionaryFile, lineNumber, line.substring(0, delimiter));
        if (code != expectedCode) {
          throw new InvalidDictionaryFileException(dictionaryFile, lineNumber,
              "expected code " + expectedCode + " but found " + code);
        }

        byte[] value = line.substring(delimiter + 1).getBytes(StandardCharsets.ISO_8859_1);
        if (!Utf8Values.isWellFormed(value)) {
          throw new InvalidDictionaryFileException(dictionaryFile, lineNumber, "value is not well-formed UTF-8");
        }
        if (previous != null && StringDictionary.VALUE_ORDER.compare(previous, value) >= 0) {
          throw new InvalidDictionaryFileException(dictionaryFile, lineNumber,
              "values must be distinct and in ascending order");
        }
        values.setSafe(code, value);
        previous = value;
        expectedCode++;
      }
      values.setValueCount(expectedCode);
      return StringDictionary.fromSortedVector(values);
    } catch (IOException | RuntimeException e) {
      values.close();
      throw e;
    }
  }

  private IntVector readCodes(int dictionarySize, BufferAllocator allocator) throws IOException {
    IntVector encoded = new IntVector(ENCODED_VECTOR_NAME, allocator);
    try (BufferedReader reader = newLineReader(dataFile)) {
      encoded.allocateNew();
      int row = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        long lineNumber = row + 1L;
        int code = parseCode(dataFile, lineNumber, line);
        if (code < 0 || code >= dictionarySize) {
          throw new InvalidDictionaryFileException(dataFile, lineNumber,
              "code " + code + " is outside the dictionary of size " + dictionarySize);
        }
        encoded.setSafe(row, code);
        row++;
      }
      encoded.setValueCount(row);
      return encoded;
    } catch (IOException | RuntimeException e) {
      encoded.close();
      throw e;
    }
  }

  // ISO-8859-1 maps each byte to one char, so lines split at the same bytes as in UTF-8, and a
  // malformed value is reported with its own line number
  private static BufferedReader newLineReader(Path file) throws IOException {
    return Files.newBufferedReader(file, StandardCharsets.ISO_8859_1);
  }

  private static int parseCode(Path file, long lineNumber, String text) {
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new InvalidDictionaryFileException(file, lineNumber, "invalid code \"" + text + "\"", e);
    }
  }
}
