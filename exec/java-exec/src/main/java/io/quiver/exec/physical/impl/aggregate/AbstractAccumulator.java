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

import org.apache.arrow.vector.types.Types.MinorType;

import io.quiver.common.exceptions.UserException;
import io.quiver.exec.expr.AggregateFunction;

public abstract class AbstractAccumulator implements Accumulator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractAccumulator.class);

  private final AggregateFunction function;
  private final MinorType inputType;
  private final MinorType outputType;

  protected AbstractAccumulator(AggregateFunction function, MinorType inputType, MinorType outputType) {
    this.function = function;
    this.inputType = inputType;
    this.outputType = outputType;
  }

  @Override
  public AggregateFunction getFunction() {
    return function;
  }

  @Override
  public MinorType getInputType() {
    return inputType;
  }

  @Override
  public MinorType getOutputType() {
    return outputType;
  }

  protected UserException overflow(ArithmeticException e) {
    return UserException.evaluationError(e)
        .message("Numeric overflow in %s over %s producing %s", function, inputType, outputType)
        .build(logger);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + inputType + " -> " + outputType + "] = " + getResult();
  }
}
