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
import io.quiver.exec.expr.AggregateExpression;
import io.quiver.exec.expr.AggregateFunction;
import io.quiver.exec.vector.ScalarValue;

/**
 * Creates accumulators, checking that the function applies to the argument
 * type and that the declared output type fits the function.
 */
public final class Accumulators {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Accumulators.class);

  private Accumulators() {
  }

  public static Accumulator create(AggregateExpression expr) {
    return create(expr.getFunction(), expr.getArgument().getType(), expr.getOutputType());
  }

  public static Accumulator create(AggregateFunction function, MinorType inputType, MinorType outputType) {
    ScalarValue.checkSupported(inputType);
    ScalarValue.checkSupported(outputType);
    switch (function) {
      case MIN:
        checkOutput(function, inputType, outputType, outputType == inputType);
        return new MinAccumulator(inputType);
      case MAX:
        checkOutput(function, inputType, outputType, outputType == inputType);
        return new MaxAccumulator(inputType);
      case SUM:
        checkNumeric(function, inputType);
        checkOutput(function, inputType, outputType, ScalarValue.isFloatingPoint(inputType)
            ? ScalarValue.isFloatingPoint(outputType)
            : ScalarValue.isIntegral(outputType));
        return new SumAccumulator(inputType, outputType);
      case COUNT:
        checkOutput(function, inputType, outputType, ScalarValue.isIntegral(outputType));
        return new CountAccumulator(inputType, outputType);
      case AVG:
        checkNumeric(function, inputType);
        checkOutput(function, inputType, outputType, ScalarValue.isFloatingPoint(outputType));
        return new AvgAccumulator(inputType, outputType);
      default:
        throw UserException.unsupportedFunctionError()
            .message("Aggregate function %s is not supported", function)
            .build(logger);
    }
  }

  private static void checkNumeric(AggregateFunction function, MinorType inputType) {
    if (!ScalarValue.isNumeric(inputType)) {
      throw UserException.unsupportedFunctionError()
          .message("%s is not supported for argument type %s", function, inputType)
          .build(logger);
    }
  }

  private static void checkOutput(AggregateFunction function, MinorType inputType, MinorType outputType, boolean valid) {
    if (!valid) {
      throw UserException.schemaMismatchError()
          .message("%s over %s cannot produce %s", function, inputType, outputType)
          .build(logger);
    }
  }
}
