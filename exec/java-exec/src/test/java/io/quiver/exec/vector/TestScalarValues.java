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
package io.quiver.exec.vector;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.Field;
import org.junit.Test;

import io.quiver.common.exceptions.ErrorType;
import io.quiver.common.exceptions.UserException;
import io.quiver.exec.ExecTest;

public class TestScalarValues extends ExecTest {

  private FieldVector newVector(String name, MinorType type) {
    return Field.nullable(name, type.getType()).createVector(allocator);
  }

  @Test
  public void testUnsignedValuesAreWidened() {
    try (UInt1Vector u1 = new UInt1Vector("u1", allocator);
         UInt4Vector u4 = new UInt4Vector("u4", allocator)) {
      u1.allocateNew(1);
      u1.set(0, (byte) 0xFF);
      u1.setValueCount(1);
      u4.allocateNew(1);
      u4.set(0, 0xFFFFFFFF);
      u4.setValueCount(1);

      assertEquals(ScalarValue.ofUInt1(255), ScalarValues.read(u1, 0));
      assertEquals(ScalarValue.ofUInt4(4294967295L), ScalarValues.read(u4, 0));
    }
  }

  @Test
  public void testWriteThenReadWithNulls() {
    try (FieldVector vector = newVector("city", MinorType.VARCHAR)) {
      vector.allocateNew();
      ScalarValues.write(vector, 0, ScalarValue.ofVarChar("Zürich"));
      ScalarValues.write(vector, 1, ScalarValue.nullOf(MinorType.VARCHAR));
      ScalarValues.write(vector, 2, ScalarValue.ofVarChar(""));
      vector.setValueCount(3);

      assertEquals(ScalarValue.ofVarChar("Zürich"), ScalarValues.read(vector, 0));
      assertTrue(ScalarValues.read(vector, 1).isNull());
      assertEquals(ScalarValue.ofVarChar(""), ScalarValues.read(vector, 2));
      assertEquals(1, vector.getNullCount());
      assertTrue(vector instanceof VarCharVector);
    }
  }

  @Test
  public void testWriteGrowsVector() {
    try (FieldVector vector = newVector("n", MinorType.BIGINT)) {
      vector.setInitialCapacity(1);
      vector.allocateNew();
      for (int i = 0; i < 5000; i++) {
        ScalarValues.write(vector, i, ScalarValue.ofBigInt(i * 3L));
      }
      vector.setValueCount(5000);
      assertEquals(ScalarValue.ofBigInt(4999 * 3L), ScalarValues.read(vector, 4999));
    }
  }

  @Test
  public void testWriteWrongType() {
    try (FieldVector vector = newVector("n", MinorType.INT)) {
      vector.allocateNew();
      ScalarValues.write(vector, 0, ScalarValue.ofBigInt(1));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.SCHEMA_MISMATCH, e.getErrorType());
      assertEquals("Column: n", e.getContext().get(0));
    }
  }

  @Test
  public void testReadUnsupportedType() {
    try (DateDayVector dates = new DateDayVector("d", allocator)) {
      dates.allocateNew(1);
      dates.set(0, 19000);
      dates.setValueCount(1);
      ScalarValues.read(dates, 0);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.UNSUPPORTED_TYPE, e.getErrorType());
    }
  }
}
