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

public class AvgAccumulator extends AbstractAccumulator {

  private ExactSum sum = new ExactSum();
  private long count;

  public AvgAccumulator(MinorType inputType, MinorType outputType) {
    super(AggregateFunction.AVG, inputType, outputType);
  }

  @Override
  public void add(ScalarValue value) {
    if (value.isNull()) {
      return;
    }
    sum.add(value.doubleValue());
    count++;
  }

  @Override
  public void accumulate(FieldVector values) {
    final long nonNull = VectorReductions.count(values);
    if (nonNull == 0) {
      return;
    }
    sum.add(VectorReductions.sumExact(values));
    count += nonNull;
  }

  @Override
  public ScalarValue getResult() {
    return count == 0
        ? ScalarValue.nullOf(getOutputType())
        : ScalarValue.fromDouble(getOutputType(), sum.doubleValue() / count);
  }

  @Override
  public void reset() {
    sum = new ExactSum();
    count = 0;
  }
}
