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
import io.quiver.exec.vector.ScalarValue;
import io.quiver.exec.vector.VectorReductions;

/**
 * Counts non-null values. The result is never NULL; empty input counts 0.
 */
public class CountAccumulator extends AbstractAccumulator {

  private long count;

  public CountAccumulator(MinorType inputType, MinorType outputType) {
    super(AggregateFunction.COUNT, inputType, outputType);
  }

  @Override
  public void add(ScalarValue value) {
    if (!value.isNull()) {
      count++;
    }
  }

  @Override
  public void accumulate(FieldVector values) {
    count += VectorReductions.count(values);
  }

  @Override
  public ScalarValue getResult() {
    try {
      return ScalarValue.fromLong(getOutputType(), count);
    } catch (ArithmeticException e) {
      throw overflow(e);
    }
  }

  @Override
  public void reset() {
    count = 0;
  }
}
