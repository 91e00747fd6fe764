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
package io.quiver.exec.expr;

import java.util.Locale;

import org.apache.arrow.vector.types.Types.MinorType;

import io.quiver.common.exceptions.UserException;
import io.quiver.exec.vector.ScalarValue;

/**
 * The aggregate functions the aggregate operator knows how to evaluate.
 */
public enum AggregateFunction {
  MIN,
  MAX,
  SUM,
  COUNT,
  AVG;

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AggregateFunction.class);

  /**
   * Resolves a function by its case-insensitive name.
   *
   * @throws UserException UNSUPPORTED_FUNCTION for an unknown name
   */
  public static AggregateFunction fromName(String name) {
    for (AggregateFunction function : values()) {
      if (function.name().equals(name.toUpperCase(Locale.ROOT))) {
        return function;
      }
    }
    throw UserException.unsupportedFunctionError()
        .message("Aggregate function '%s' is not supported", name)
        .build(logger);
  }

  /**
   * The output type used when a query does not declare one. Integral sums
   * widen to BIGINT, or stay UINT8 for unsigned 64 bit input.
   */
  public MinorType defaultOutputType(MinorType argumentType) {
    switch (this) {
      case MIN:
      case MAX:
        return argumentType;
      case SUM:
        if (ScalarValue.isFloatingPoint(argumentType)) {
          return MinorType.FLOAT8;
        }
        return argumentType == MinorType.UINT8 ? MinorType.UINT8 : MinorType.BIGINT;
      case COUNT:
        return MinorType.BIGINT;
      case AVG:
        return MinorType.FLOAT8;
      default:
        throw new AssertionError(this);
    }
  }
}
