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

import static org.hamcrest.CoreMatchers.hasItem;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharSource;
import com.google.common.io.Resources;

import io.quiver.common.config.QuiverConfig;
import io.quiver.common.exceptions.ErrorType;
import io.quiver.common.exceptions.UserException;
import io.quiver.exec.ExecConstants;
import io.quiver.exec.ExecTest;
import io.quiver.exec.ops.ExecutionContext;
import io.quiver.exec.ops.OperatorContext;
import io.quiver.exec.record.BatchBuilder;
import io.quiver.exec.vector.ScalarValue;

public class TestCsvRecordReader extends ExecTest {

  static CharSource resource(String name) {
    return Resources.asCharSource(Resources.getResource(name), StandardCharsets.UTF_8);
  }

  private static Schema schema(Object... namesAndTypes) {
    List<Field> fields = new ArrayList<>();
    for (int i = 0; i < namesAndTypes.length; i += 2) {
      fields.add(Field.nullable((String) namesAndTypes[i], ((MinorType) namesAndTypes[i + 1]).getType()));
    }
    return new Schema(fields);
  }

  /**
   * Reads everything into one list of values per column, recording the size
   * of every batch.
   */
  private static List<List<ScalarValue>> readAll(CsvRecordReader reader, OperatorContext oContext,
      List<Integer> batchSizes) throws Exception {
    List<List<ScalarValue>> columns = new ArrayList<>();
    for (int i = 0; i < reader.getSchema().getFields().size(); i++) {
      columns.add(new ArrayList<>());
    }
    try {
      reader.setup(oContext);
      while (true) {
        try (VectorSchemaRoot root = VectorSchemaRoot.create(reader.getSchema(), oContext.getAllocator())) {
          int rows = reader.next(root);
          if (rows == 0) {
            break;
          }
          root.setRowCount(rows);
          batchSizes.add(rows);
          for (int i = 0; i < columns.size(); i++) {
            columns.get(i).addAll(BatchBuilder.values(root, i));
          }
        }
      }
    } finally {
      reader.close();
      oContext.close();
    }
    return columns;
  }

  private List<List<ScalarValue>> readAll(CsvRecordReader reader) throws Exception {
    return readAll(reader, newOperatorContext("CsvRecordReader"), new ArrayList<>());
  }

  @Test
  public void testQuotedFields() throws Exception {
    CsvRecordReader reader = new CsvRecordReader("uk_cities.csv", resource("uk_cities.csv"),
        schema("name", MinorType.VARCHAR, "lat", MinorType.FLOAT8, "lng", MinorType.FLOAT8));
    List<List<ScalarValue>> columns = readAll(reader);
    assertEquals(26, columns.get(0).size());
    assertEquals(ScalarValue.ofVarChar("Plymouth, England, UK"), columns.get(0).get(0));
    assertEquals(ScalarValue.ofFloat8(50.376289), columns.get(1).get(0));
    assertEquals(ScalarValue.ofFloat8(-4.143841), columns.get(2).get(0));
  }

  @Test
  public void testHeaderAndDelimiter() throws Exception {
    CsvRecordReader reader = new CsvRecordReader("pipes.txt", resource("pipes.txt"),
        schema("a", MinorType.INT, "b", MinorType.VARCHAR))
        .withDelimiter('|')
        .withHeader(true);
    List<List<ScalarValue>> columns = readAll(reader);
    assertEquals(BatchBuilder.ints(1, 2, 3), columns.get(0));
    assertEquals(Arrays.asList(ScalarValue.ofVarChar("x"), ScalarValue.ofVarChar("y"), ScalarValue.ofVarChar("z")),
        columns.get(1));
  }

  @Test
  public void testDelimiterAndHeaderFromConfig() throws Exception {
    Properties props = new Properties();
    props.setProperty(ExecConstants.TEXT_DELIMITER, "|");
    props.setProperty(ExecConstants.TEXT_EXTRACT_HEADER, "true");
    ExecutionContext pipes = new ExecutionContext(QuiverConfig.create(props), allocator);

    CsvRecordReader reader = new CsvRecordReader("pipes.txt", resource("pipes.txt"),
        schema("a", MinorType.INT, "b", MinorType.VARCHAR));
    List<List<ScalarValue>> columns = readAll(reader, pipes.newOperatorContext("CsvRecordReader"), new ArrayList<>());
    assertEquals(BatchBuilder.ints(1, 2, 3), columns.get(0));
  }

  @Test
  public void testEmptyFieldIsNull() throws Exception {
    CsvRecordReader reader = new CsvRecordReader("people.csv", resource("people.csv"),
        schema("id", MinorType.INT, "name", MinorType.VARCHAR, "dept", MinorType.VARCHAR, "salary", MinorType.INT))
        .withHeader(true);
    List<List<ScalarValue>> columns = readAll(reader);
    assertEquals(7, columns.get(0).size());
    assertEquals(ScalarValue.nullOf(MinorType.VARCHAR), columns.get(2).get(3));
    assertEquals(ScalarValue.nullOf(MinorType.INT), columns.get(3).get(4));
    assertEquals(ScalarValue.ofInt(110), columns.get(3).get(5));
  }

  @Test
  public void testBatchSizeFromConfig() throws Exception {
    Properties props = new Properties();
    props.setProperty(ExecConstants.SCAN_BATCH_SIZE, "2");
    ExecutionContext small = new ExecutionContext(QuiverConfig.create(props), allocator);

    CsvRecordReader reader = new CsvRecordReader("pipes.txt", resource("pipes.txt"),
        schema("a", MinorType.INT, "b", MinorType.VARCHAR))
        .withDelimiter('|')
        .withHeader(true);
    List<Integer> batchSizes = new ArrayList<>();
    List<List<ScalarValue>> columns = readAll(reader, small.newOperatorContext("CsvRecordReader"), batchSizes);
    assertEquals(ImmutableList.of(2, 1), batchSizes);
    assertEquals(BatchBuilder.ints(1, 2, 3), columns.get(0));
  }

  @Test
  public void testUnparseableField() throws Exception {
    CsvRecordReader reader = new CsvRecordReader("bad_numbers.csv", resource("bad_numbers.csv"),
        schema("id", MinorType.INT, "amount", MinorType.INT));
    try {
      readAll(reader);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
      assertThat(e.getContext(), hasItem("File: bad_numbers.csv"));
      assertThat(e.getContext(), hasItem("Record: 2"));
      assertThat(e.getContext(), hasItem("Column: amount"));
      assertTrue(e.getCause() instanceof IllegalArgumentException);
    }
  }

  @Test
  public void testWrongFieldCount() throws Exception {
    CsvRecordReader reader = new CsvRecordReader("inline", CharSource.wrap("1,2\n3\n4,5\n"),
        schema("a", MinorType.INT, "b", MinorType.INT));
    try {
      readAll(reader);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
      assertThat(e.getContext(), hasItem("Record: 2"));
    }
  }

  @Test
  public void testUnsupportedColumnType() throws Exception {
    Schema schema = new Schema(ImmutableList.of(
        Field.nullable("day", new ArrowType.Date(DateUnit.DAY))));
    CsvRecordReader reader = new CsvRecordReader("inline", CharSource.wrap("2024-01-01\n"), schema);
    try {
      readAll(reader);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.UNSUPPORTED_TYPE, e.getErrorType());
      assertThat(e.getContext(), hasItem("Column: day"));
    }
  }

  @Test
  public void testDelimiterMustBeOneCharacter() throws Exception {
    Properties props = new Properties();
    props.setProperty(ExecConstants.TEXT_DELIMITER, "||");
    ExecutionContext bad = new ExecutionContext(QuiverConfig.create(props), allocator);

    CsvRecordReader reader = new CsvRecordReader("pipes.txt", resource("pipes.txt"),
        schema("a", MinorType.INT, "b", MinorType.VARCHAR));
    try {
      readAll(reader, bad.newOperatorContext("CsvRecordReader"), new ArrayList<>());
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
    }
  }
}
