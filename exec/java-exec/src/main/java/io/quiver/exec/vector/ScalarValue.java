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

import java.util.Objects;
import java.util.Set;

import org.apache.arrow.vector.types.Types.MinorType;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;

import io.quiver.common.exceptions.UserException;

/**
 * A single typed value, possibly SQL NULL. Values are immutable and compare
 * structurally over their type and payload, which makes lists of them usable
 * as grouping keys.
 *
 * <p>Payloads per type:
 * <table>
 * <tr><td>BIT</td><td>Boolean</td></tr>
 * <tr><td>TINYINT, SMALLINT, INT, BIGINT</td><td>Byte, Short, Integer, Long</td></tr>
 * <tr><td>UINT1, UINT2, UINT4</td><td>Short, Integer, Long (widened, never negative)</td></tr>
 * <tr><td>UINT8</td><td>Long holding the raw 64 bits, compared unsigned</td></tr>
 * <tr><td>FLOAT4, FLOAT8</td><td>Float, Double</td></tr>
 * <tr><td>VARCHAR</td><td>String</td></tr>
 * </table>
 */
public final class ScalarValue implements Comparable<ScalarValue> {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ScalarValue.class);

  private static final Set<MinorType> SUPPORTED_TYPES = Sets.immutableEnumSet(
      MinorType.BIT,
      MinorType.TINYINT, MinorType.SMALLINT, MinorType.INT, MinorType.BIGINT,
      MinorType.UINT1, MinorType.UINT2, MinorType.UINT4, MinorType.UINT8,
      MinorType.FLOAT4, MinorType.FLOAT8,
      MinorType.VARCHAR);

  private final MinorType type;
  private final Object value;

  private ScalarValue(MinorType type, Object value) {
    this.type = type;
    this.value = value;
  }

  public static ScalarValue nullOf(MinorType type) {
    checkSupported(type);
    return new ScalarValue(type, null);
  }

  public static ScalarValue ofBit(boolean value) {
    return new ScalarValue(MinorType.BIT, value);
  }

  public static ScalarValue ofTinyInt(byte value) {
    return new ScalarValue(MinorType.TINYINT, value);
  }

  public static ScalarValue ofSmallInt(short value) {
    return new ScalarValue(MinorType.SMALLINT, value);
  }

  public static ScalarValue ofInt(int value) {
    return new ScalarValue(MinorType.INT, value);
  }

  public static ScalarValue ofBigInt(long value) {
    return new ScalarValue(MinorType.BIGINT, value);
  }

  public static ScalarValue ofUInt1(int value) {
    Preconditions.checkArgument(value >= 0 && value <= 0xFF, "UINT1 value out of range: %s", value);
    return new ScalarValue(MinorType.UINT1, (short) value);
  }

  public static ScalarValue ofUInt2(int value) {
    Preconditions.checkArgument(value >= 0 && value <= 0xFFFF, "UINT2 value out of range: %s", value);
    return new ScalarValue(MinorType.UINT2, value);
  }

  public static ScalarValue ofUInt4(long value) {
    Preconditions.checkArgument(value >= 0 && value <= 0xFFFFFFFFL, "UINT4 value out of range: %s", value);
    return new ScalarValue(MinorType.UINT4, value);
  }

  /**
   * @param rawBits the unsigned value as a two's complement bit pattern
   */
  public static ScalarValue ofUInt8(long rawBits) {
    return new ScalarValue(MinorType.UINT8, rawBits);
  }

  public static ScalarValue ofFloat4(float value) {
    return new ScalarValue(MinorType.FLOAT4, value);
  }

  public static ScalarValue ofFloat8(double value) {
    return new ScalarValue(MinorType.FLOAT8, value);
  }

  public static ScalarValue ofVarChar(String value) {
    return new ScalarValue(MinorType.VARCHAR, Preconditions.checkNotNull(value));
  }

  /**
   * Narrows a signed 64 bit integer to an integral type.
   *
   * @throws ArithmeticException if the value does not fit the target type
   */
  public static ScalarValue fromLong(MinorType type, long value) {
    switch (type) {
      case TINYINT:
        return ofTinyInt((byte) checkRange(type, value, Byte.MIN_VALUE, Byte.MAX_VALUE));
      case SMALLINT:
        return ofSmallInt((short) checkRange(type, value, Short.MIN_VALUE, Short.MAX_VALUE));
      case INT:
        return ofInt(Math.toIntExact(value));
      case BIGINT:
        return ofBigInt(value);
      case UINT1:
        return ofUInt1((int) checkRange(type, value, 0, 0xFF));
      case UINT2:
        return ofUInt2((int) checkRange(type, value, 0, 0xFFFF));
      case UINT4:
        return ofUInt4(checkRange(type, value, 0, 0xFFFFFFFFL));
      case UINT8:
        return ofUInt8(checkRange(type, value, 0, Long.MAX_VALUE));
      default:
        throw new IllegalArgumentException("Not an integral type: " + type);
    }
  }

  public static ScalarValue fromDouble(MinorType type, double value) {
    switch (type) {
      case FLOAT4:
        return ofFloat4((float) value);
      case FLOAT8:
        return ofFloat8(value);
      default:
        throw new IllegalArgumentException("Not a floating point type: " + type);
    }
  }

  private static long checkRange(MinorType type, long value, long min, long max) {
    if (value < min || value > max) {
      throw new ArithmeticException(String.format("%d out of range for %s", value, type));
    }
    return value;
  }

  /**
   * Parses the textual form of a value. Booleans accept true/false and 1/0.
   *
   * @throws IllegalArgumentException if the text is not a valid value of the type
   */
  public static ScalarValue parse(MinorType type, String text) {
    final String trimmed = type == MinorType.VARCHAR ? text : text.trim();
    switch (type) {
      case BIT:
        if ("true".equalsIgnoreCase(trimmed) || "1".equals(trimmed)) {
          return ofBit(true);
        } else if ("false".equalsIgnoreCase(trimmed) || "0".equals(trimmed)) {
          return ofBit(false);
        }
        throw new IllegalArgumentException("Not a boolean: " + text);
      case TINYINT:
        return ofTinyInt(Byte.parseByte(trimmed));
      case SMALLINT:
        return ofSmallInt(Short.parseShort(trimmed));
      case INT:
        return ofInt(Integer.parseInt(trimmed));
      case BIGINT:
        return ofBigInt(Long.parseLong(trimmed));
      case UINT1:
        return ofUInt1(Integer.parseInt(trimmed));
      case UINT2:
        return ofUInt2(Integer.parseInt(trimmed));
      case UINT4:
        return ofUInt4(Long.parseLong(trimmed));
      case UINT8:
        return ofUInt8(UnsignedLongs.parseUnsignedLong(trimmed));
      case FLOAT4:
        return ofFloat4(Float.parseFloat(trimmed));
      case FLOAT8:
        return ofFloat8(Double.parseDouble(trimmed));
      case VARCHAR:
        return ofVarChar(trimmed);
      default:
        throw unsupported(type);
    }
  }

  public static boolean isSupported(MinorType type) {
    return SUPPORTED_TYPES.contains(type);
  }

  public static void checkSupported(MinorType type) {
    if (!isSupported(type)) {
      throw unsupported(type);
    }
  }

  static UserException unsupported(MinorType type) {
    return UserException.unsupportedTypeError()
        .message("Scalar type %s is not supported", type)
        .build(logger);
  }

  public static boolean isIntegral(MinorType type) {
    switch (type) {
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
      case UINT1:
      case UINT2:
      case UINT4:
      case UINT8:
        return true;
      default:
        return false;
    }
  }

  public static boolean isFloatingPoint(MinorType type) {
    return type == MinorType.FLOAT4 || type == MinorType.FLOAT8;
  }

  public static boolean isNumeric(MinorType type) {
    return isIntegral(type) || isFloatingPoint(type);
  }

  public MinorType getType() {
    return type;
  }

  public boolean isNull() {
    return value == null;
  }

  /**
   * @return the boxed payload, or null for SQL NULL
   */
  public Object getValue() {
    return value;
  }

  public boolean getBoolean() {
    Preconditions.checkState(type == MinorType.BIT && value != null, "Not a non-null BIT: %s", this);
    return (Boolean) value;
  }

  public String getString() {
    Preconditions.checkState(type == MinorType.VARCHAR && value != null, "Not a non-null VARCHAR: %s", this);
    return (String) value;
  }

  /**
   * Value of a non-null integral scalar. UINT8 returns its raw bits.
   */
  public long longValue() {
    Preconditions.checkState(isIntegral(type) && value != null, "Not a non-null integral value: %s", this);
    return ((Number) value).longValue();
  }

  public double doubleValue() {
    Preconditions.checkState(isNumeric(type) && value != null, "Not a non-null numeric value: %s", this);
    if (type == MinorType.UINT8) {
      return UnsignedLong.fromLongBits((Long) value).doubleValue();
    }
    return ((Number) value).doubleValue();
  }

  /**
   * Orders two non-null values of the same type. Floating point values follow
   * {@link Double#compare(double, double)}, so NaN sorts last.
   */
  @Override
  public int compareTo(ScalarValue o) {
    Preconditions.checkArgument(type == o.type, "Cannot compare %s with %s", type, o.type);
    Preconditions.checkArgument(value != null && o.value != null, "Cannot compare NULL values");
    switch (type) {
      case BIT:
        return Boolean.compare((Boolean) value, (Boolean) o.value);
      case UINT8:
        return UnsignedLongs.compare((Long) value, (Long) o.value);
      case FLOAT4:
        return Float.compare((Float) value, (Float) o.value);
      case FLOAT8:
        return Double.compare((Double) value, (Double) o.value);
      case VARCHAR:
        return ((String) value).compareTo((String) o.value);
      default:
        return Long.compare(((Number) value).longValue(), ((Number) o.value).longValue());
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ScalarValue)) {
      return false;
    }
    ScalarValue other = (ScalarValue) obj;
    return type == other.type && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    if (value == null) {
      return "NULL:" + type;
    }
    if (type == MinorType.UINT8) {
      return UnsignedLongs.toString((Long) value) + ":" + type;
    }
    return value + ":" + type;
  }
}
