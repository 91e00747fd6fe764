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
package io.quiver.exec.physical.impl.aggregate;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.Types.MinorType;

import io.quiver.exec.expr.AggregateFunction;
import io.quiver.exec.vector.ExactSum;
import io.quiver.exec.vector.ScalarValue;
import io.quiver.exec.vector.VectorReductions;

/**
 * SUM over a numeric argument. Integral input is summed exactly in a
 * {@code long} (unsigned for UINT8 input) and narrowed to the output type;
 * floating point input is summed exactly and rounded once, so the result
 * does not depend on input order.
 */
public class SumAccumulator extends AbstractAccumulator {

  private final boolean floatingPoint;
  private final boolean unsigned;

  private long longSum;
  private ExactSum doubleSum = new ExactSum();
  private boolean seen;

  public SumAccumulator(MinorType inputType, MinorType outputType) {
    super(AggregateFunction.SUM, inputType, outputType);
    this.floatingPoint = ScalarValue.isFloatingPoint(inputType);
    this.unsigned = inputType == MinorType.UINT8;
  }

  @Override
  public void add(ScalarValue value) {
    if (value.isNull()) {
      return;
    }
    if (floatingPoint) {
      doubleSum.add(value.doubleValue());
    } else {
      longSum = plus(longSum, value.longValue());
    }
    seen = true;
  }

  @Override
  public void accumulate(FieldVector values) {
    if (VectorReductions.count(values) == 0) {
      return;
    }
    if (floatingPoint) {
      doubleSum.add(VectorReductions.sumExact(values));
    } else {
      final long batchSum;
      try {
        batchSum = VectorReductions.sumAsLong(values);
      } catch (ArithmeticException e) {
        throw overflow(e);
      }
      longSum = plus(longSum, batchSum);
    }
    seen = true;
  }

  private long plus(long a, long b) {
    try {
      return unsigned ? VectorReductions.addUnsignedExact(a, b) : Math.addExact(a, b);
    } catch (ArithmeticException e) {
      throw overflow(e);
    }
  }

  @Override
  public ScalarValue getResult() {
    if (!seen) {
      return ScalarValue.nullOf(getOutputType());
    }
    if (floatingPoint) {
      return ScalarValue.fromDouble(getOutputType(), doubleSum.doubleValue());
    }
    try {
      if (unsigned) {
        if (getOutputType() == MinorType.UINT8) {
          return ScalarValue.ofUInt8(longSum);
        }
        if (longSum < 0) {
          throw new ArithmeticException("unsigned sum exceeds " + getOutputType());
        }
      }
      return ScalarValue.fromLong(getOutputType(), longSum);
    } catch (ArithmeticException e) {
      throw overflow(e);
    }
  }

  @Override
  public void reset() {
    longSum = 0;
    doubleSum = new ExactSum();
    seen = false;
  }
}
