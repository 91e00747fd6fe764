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

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.Types;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.Field;

import io.quiver.common.exceptions.UserException;

/**
 * Moves single values between Arrow vectors and {@link ScalarValue}s,
 * dispatching on the vector's minor type.
 */
public final class ScalarValues {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ScalarValues.class);

  private ScalarValues() {
  }

  /**
   * Reads the value at {@code index}.
   *
   * @throws UserException UNSUPPORTED_TYPE if the vector type has no scalar form
   */
  public static ScalarValue read(FieldVector vector, int index) {
    final MinorType type = vector.getMinorType();
    if (vector.isNull(index)) {
      return ScalarValue.nullOf(type);
    }
    switch (type) {
      case BIT:
        return ScalarValue.ofBit(((BitVector) vector).get(index) != 0);
      case TINYINT:
        return ScalarValue.ofTinyInt(((TinyIntVector) vector).get(index));
      case SMALLINT:
        return ScalarValue.ofSmallInt(((SmallIntVector) vector).get(index));
      case INT:
        return ScalarValue.ofInt(((IntVector) vector).get(index));
      case BIGINT:
        return ScalarValue.ofBigInt(((BigIntVector) vector).get(index));
      case UINT1:
        return ScalarValue.ofUInt1(((UInt1Vector) vector).get(index) & 0xFF);
      case UINT2:
        return ScalarValue.ofUInt2(((UInt2Vector) vector).get(index));
      case UINT4:
        return ScalarValue.ofUInt4(((UInt4Vector) vector).get(index) & 0xFFFFFFFFL);
      case UINT8:
        return ScalarValue.ofUInt8(((UInt8Vector) vector).get(index));
      case FLOAT4:
        return ScalarValue.ofFloat4(((Float4Vector) vector).get(index));
      case FLOAT8:
        return ScalarValue.ofFloat8(((Float8Vector) vector).get(index));
      case VARCHAR:
        return ScalarValue.ofVarChar(new String(((VarCharVector) vector).get(index), StandardCharsets.UTF_8));
      default:
        throw ScalarValue.unsupported(type);
    }
  }

  /**
   * Writes {@code value} at {@code index}, growing the vector if needed.
   * The caller sets the value count once all rows are written.
   */
  public static void write(FieldVector vector, int index, ScalarValue value) {
    final MinorType type = vector.getMinorType();
    if (value.getType() != type) {
      throw UserException.schemaMismatchError()
          .message("Cannot write a %s value into %s column", value.getType(), type)
          .addContext("Column", vector.getName())
          .build(logger);
    }
    if (value.isNull()) {
      setNull(vector, index);
      return;
    }
    final Object payload = value.getValue();
    switch (type) {
      case BIT:
        ((BitVector) vector).setSafe(index, (Boolean) payload ? 1 : 0);
        break;
      case TINYINT:
        ((TinyIntVector) vector).setSafe(index, (Byte) payload);
        break;
      case SMALLINT:
        ((SmallIntVector) vector).setSafe(index, (Short) payload);
        break;
      case INT:
        ((IntVector) vector).setSafe(index, (Integer) payload);
        break;
      case BIGINT:
        ((BigIntVector) vector).setSafe(index, (Long) payload);
        break;
      case UINT1:
        ((UInt1Vector) vector).setSafe(index, (int) (Short) payload);
        break;
      case UINT2:
        ((UInt2Vector) vector).setSafe(index, (int) (Integer) payload);
        break;
      case UINT4:
        ((UInt4Vector) vector).setSafe(index, (int) (long) (Long) payload);
        break;
      case UINT8:
        ((UInt8Vector) vector).setSafe(index, (Long) payload);
        break;
      case FLOAT4:
        ((Float4Vector) vector).setSafe(index, (Float) payload);
        break;
      case FLOAT8:
        ((Float8Vector) vector).setSafe(index, (Double) payload);
        break;
      case VARCHAR:
        ((VarCharVector) vector).setSafe(index, ((String) payload).getBytes(StandardCharsets.UTF_8));
        break;
      default:
        throw ScalarValue.unsupported(type);
    }
  }

  private static void setNull(FieldVector vector, int index) {
    if (vector instanceof BaseFixedWidthVector) {
      ((BaseFixedWidthVector) vector).setNull(index);
    } else if (vector instanceof BaseVariableWidthVector) {
      ((BaseVariableWidthVector) vector).setNull(index);
    } else {
      throw ScalarValue.unsupported(vector.getMinorType());
    }
  }

  public static MinorType minorType(Field field) {
    return Types.getMinorTypeForArrowType(field.getType());
  }

  /**
   * Builds a vector for {@code field} holding {@code values} in order.
   */
  public static FieldVector toVector(Field field, List<ScalarValue> values, BufferAllocator allocator) {
    ScalarValue.checkSupported(minorType(field));
    final FieldVector vector = field.createVector(allocator);
    try {
      vector.setInitialCapacity(values.size());
      vector.allocateNew();
      for (int i = 0; i < values.size(); i++) {
        write(vector, i, values.get(i));
      }
      vector.setValueCount(values.size());
      return vector;
    } catch (RuntimeException e) {
      vector.close();
      throw e;
    }
  }
}
