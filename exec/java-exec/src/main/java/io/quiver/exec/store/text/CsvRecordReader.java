/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.quiver.exec.store.text;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.base.Preconditions;
import com.google.common.io.CharSource;

import io.quiver.common.config.QuiverConfig;
import io.quiver.common.exceptions.ExecutionSetupException;
import io.quiver.common.exceptions.UserException;
import io.quiver.exec.ExecConstants;
import io.quiver.exec.ops.OperatorContext;
import io.quiver.exec.store.RecordReader;
import io.quiver.exec.vector.ScalarValue;
import io.quiver.exec.vector.ScalarValues;

/**
 * Reads delimited text against a declared schema. Fields may be quoted; an
 * empty field is NULL. The delimiter and whether the first line is a header
 * default to the {@code quiver.exec.text} settings.
 */
public class CsvRecordReader implements RecordReader {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(CsvRecordReader.class);

  private static final CsvMapper MAPPER = CsvMapper.builder()
      .enable(CsvParser.Feature.WRAP_AS_ARRAY)
      .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
      .build();

  private final String name;
  private final CharSource source;
  private final Schema schema;
  private final MinorType[] types;

  private Character delimiter;
  private Boolean extractHeader;

  private int batchSize;
  private Reader reader;
  private MappingIterator<String[]> rows;
  private long recordCount;

  /**
   * @param name   name of the source, reported in errors
   * @param source the text to read
   * @param schema the columns of every line, in order
   */
  public CsvRecordReader(String name, CharSource source, Schema schema) {
    this.name = name;
    this.source = source;
    this.schema = schema;
    final List<Field> fields = schema.getFields();
    this.types = new MinorType[fields.size()];
    for (int i = 0; i < types.length; i++) {
      types[i] = ScalarValues.minorType(fields.get(i));
    }
  }

  public CsvRecordReader withDelimiter(char delimiter) {
    this.delimiter = delimiter;
    return this;
  }

  public CsvRecordReader withHeader(boolean extractHeader) {
    this.extractHeader = extractHeader;
    return this;
  }

  @Override
  public Schema getSchema() {
    return schema;
  }

  @Override
  public void setup(OperatorContext context) throws ExecutionSetupException {
    for (int i = 0; i < types.length; i++) {
      if (!ScalarValue.isSupported(types[i])) {
        throw UserException.unsupportedTypeError()
            .message("Cannot read text into a %s column", types[i])
            .addContext("Column", schema.getFields().get(i).getName())
            .addContext("File", name)
            .build(logger);
      }
    }

    final QuiverConfig config = context.getConfig();
    batchSize = config.getInt(ExecConstants.SCAN_BATCH_SIZE);
    Preconditions.checkArgument(batchSize > 0, "%s must be positive", ExecConstants.SCAN_BATCH_SIZE);
    final char separator = delimiter != null ? delimiter : configuredDelimiter(config);
    final boolean header = extractHeader != null ? extractHeader : config.getBoolean(ExecConstants.TEXT_EXTRACT_HEADER);

    final CsvSchema csvSchema = CsvSchema.emptySchema()
        .withColumnSeparator(separator)
        .withSkipFirstDataRow(header);
    try {
      reader = source.openBufferedStream();
      rows = MAPPER.readerFor(String[].class).with(csvSchema).readValues(reader);
    } catch (IOException e) {
      throw new ExecutionSetupException("Failure while opening " + name, e);
    }
    logger.debug("Reading {} with delimiter '{}', header {}, batch size {}", name, separator, header, batchSize);
  }

  private static char configuredDelimiter(QuiverConfig config) {
    final String value = config.getString(ExecConstants.TEXT_DELIMITER);
    if (value.length() != 1) {
      throw UserException.validationError()
          .message("Text delimiter must be a single character, got '%s'", value)
          .addContext("Configuration path", ExecConstants.TEXT_DELIMITER)
          .build(logger);
    }
    return value.charAt(0);
  }

  @Override
  public int next(VectorSchemaRoot output) {
    output.allocateNew();
    int row = 0;
    try {
      while (row < batchSize && rows.hasNextValue()) {
        final String[] cells = rows.nextValue();
        recordCount++;
        if (cells.length != types.length) {
          throw UserException.dataReadError()
              .message("Expected %d fields but found %d", types.length, cells.length)
              .addContext("File", name)
              .addContext("Record", recordCount)
              .build(logger);
        }
        for (int col = 0; col < cells.length; col++) {
          writeCell(output.getVector(col), row, col, cells[col]);
        }
        row++;
      }
    } catch (IOException e) {
      throw UserException.dataReadError(e)
          .message("Failure while reading %s", name)
          .addContext("File", name)
          .addContext("Record", recordCount)
          .build(logger);
    }
    return row;
  }

  private void writeCell(FieldVector vector, int row, int col, String cell) {
    final ScalarValue value;
    if (cell.isEmpty()) {
      value = ScalarValue.nullOf(types[col]);
    } else {
      try {
        value = ScalarValue.parse(types[col], cell);
      } catch (IllegalArgumentException e) {
        throw UserException.dataReadError(e)
            .message("Cannot parse '%s' as %s", cell, types[col])
            .addContext("File", name)
            .addContext("Record", recordCount)
            .addContext("Column", vector.getName())
            .build(logger);
      }
    }
    ScalarValues.write(vector, row, value);
  }

  @Override
  public void close() throws Exception {
    logger.debug("Read {} records from {}", recordCount, name);
    try {
      if (rows != null) {
        rows.close();
      }
    } finally {
      if (reader != null) {
        reader.close();
      }
    }
  }

  @Override
  public String toString() {
    return "CsvRecordReader[" + name + "]";
  }
}
