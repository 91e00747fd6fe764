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

import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.types.Types.MinorType;

import com.google.common.base.Preconditions;

/**
 * Whole-vector reductions. INT, BIGINT, FLOAT4 and FLOAT8 have dedicated
 * loops; every other supported type goes through {@link ScalarValues#read}.
 * NULL slots are skipped by every reduction.
 */
public final class VectorReductions {

  private VectorReductions() {
  }

  /**
   * @return the smallest non-null value, or a NULL of the vector's type
   */
  public static ScalarValue min(FieldVector vector) {
    return extremum(vector, false);
  }

  /**
   * @return the largest non-null value, or a NULL of the vector's type
   */
  public static ScalarValue max(FieldVector vector) {
    return extremum(vector, true);
  }

  private static ScalarValue extremum(FieldVector vector, boolean max) {
    final int count = vector.getValueCount();
    switch (vector.getMinorType()) {
      case INT: {
        final IntVector v = (IntVector) vector;
        boolean seen = false;
        int best = 0;
        for (int i = 0; i < count; i++) {
          if (v.isNull(i)) {
            continue;
          }
          final int x = v.get(i);
          if (!seen || (max ? x > best : x < best)) {
            best = x;
            seen = true;
          }
        }
        return seen ? ScalarValue.ofInt(best) : ScalarValue.nullOf(MinorType.INT);
      }
      case BIGINT: {
        final BigIntVector v = (BigIntVector) vector;
        boolean seen = false;
        long best = 0;
        for (int i = 0; i < count; i++) {
          if (v.isNull(i)) {
            continue;
          }
          final long x = v.get(i);
          if (!seen || (max ? x > best : x < best)) {
            best = x;
            seen = true;
          }
        }
        return seen ? ScalarValue.ofBigInt(best) : ScalarValue.nullOf(MinorType.BIGINT);
      }
      case FLOAT4: {
        final Float4Vector v = (Float4Vector) vector;
        boolean seen = false;
        float best = 0;
        for (int i = 0; i < count; i++) {
          if (v.isNull(i)) {
            continue;
          }
          final float x = v.get(i);
          final int cmp = Float.compare(x, best);
          if (!seen || (max ? cmp > 0 : cmp < 0)) {
            best = x;
            seen = true;
          }
        }
        return seen ? ScalarValue.ofFloat4(best) : ScalarValue.nullOf(MinorType.FLOAT4);
      }
      case FLOAT8: {
        final Float8Vector v = (Float8Vector) vector;
        boolean seen = false;
        double best = 0;
        for (int i = 0; i < count; i++) {
          if (v.isNull(i)) {
            continue;
          }
          final double x = v.get(i);
          final int cmp = Double.compare(x, best);
          if (!seen || (max ? cmp > 0 : cmp < 0)) {
            best = x;
            seen = true;
          }
        }
        return seen ? ScalarValue.ofFloat8(best) : ScalarValue.nullOf(MinorType.FLOAT8);
      }
      default: {
        ScalarValue best = ScalarValue.nullOf(vector.getMinorType());
        for (int i = 0; i < count; i++) {
          final ScalarValue x = ScalarValues.read(vector, i);
          if (x.isNull()) {
            continue;
          }
          if (best.isNull()) {
            best = x;
          } else {
            final int cmp = x.compareTo(best);
            if (max ? cmp > 0 : cmp < 0) {
              best = x;
            }
          }
        }
        return best;
      }
    }
  }

  /**
   * Sums an integral vector into a signed 64 bit total. UINT8 slots are
   * added as unsigned values and the total is returned as raw bits.
   *
   * @throws ArithmeticException if the total overflows
   */
  public static long sumAsLong(FieldVector vector) {
    final MinorType type = vector.getMinorType();
    Preconditions.checkArgument(ScalarValue.isIntegral(type), "Not an integral vector: %s", type);
    final int count = vector.getValueCount();
    long sum = 0;
    switch (type) {
      case INT: {
        final IntVector v = (IntVector) vector;
        for (int i = 0; i < count; i++) {
          if (!v.isNull(i)) {
            sum = Math.addExact(sum, v.get(i));
          }
        }
        return sum;
      }
      case BIGINT: {
        final BigIntVector v = (BigIntVector) vector;
        for (int i = 0; i < count; i++) {
          if (!v.isNull(i)) {
            sum = Math.addExact(sum, v.get(i));
          }
        }
        return sum;
      }
      case UINT8:
        for (int i = 0; i < count; i++) {
          final ScalarValue x = ScalarValues.read(vector, i);
          if (!x.isNull()) {
            sum = addUnsignedExact(sum, x.longValue());
          }
        }
        return sum;
      default:
        for (int i = 0; i < count; i++) {
          final ScalarValue x = ScalarValues.read(vector, i);
          if (!x.isNull()) {
            sum = Math.addExact(sum, x.longValue());
          }
        }
        return sum;
    }
  }

  /**
   * Sums any numeric vector exactly; the caller rounds once at the end.
   */
  public static ExactSum sumExact(FieldVector vector) {
    final MinorType type = vector.getMinorType();
    Preconditions.checkArgument(ScalarValue.isNumeric(type), "Not a numeric vector: %s", type);
    final int count = vector.getValueCount();
    final ExactSum sum = new ExactSum();
    switch (type) {
      case FLOAT4: {
        final Float4Vector v = (Float4Vector) vector;
        for (int i = 0; i < count; i++) {
          if (!v.isNull(i)) {
            sum.add(v.get(i));
          }
        }
        return sum;
      }
      case FLOAT8: {
        final Float8Vector v = (Float8Vector) vector;
        for (int i = 0; i < count; i++) {
          if (!v.isNull(i)) {
            sum.add(v.get(i));
          }
        }
        return sum;
      }
      default:
        for (int i = 0; i < count; i++) {
          final ScalarValue x = ScalarValues.read(vector, i);
          if (!x.isNull()) {
            sum.add(x.doubleValue());
          }
        }
        return sum;
    }
  }

  /**
   * @return the number of non-null slots
   */
  public static long count(FieldVector vector) {
    return vector.getValueCount() - vector.getNullCount();
  }

  /**
   * Adds two unsigned 64 bit values given as raw bits.
   *
   * @throws ArithmeticException if the result does not fit in 64 unsigned bits
   */
  public static long addUnsignedExact(long a, long b) {
    final long r = a + b;
    if (Long.compareUnsigned(r, a) < 0) {
      throw new ArithmeticException("unsigned long overflow");
    }
    return r;
  }
}
