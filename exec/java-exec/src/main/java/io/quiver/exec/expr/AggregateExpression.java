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

import org.apache.arrow.vector.types.Types.MinorType;

import com.google.common.base.Preconditions;

/**
 * One aggregate call of a query, such as {@code MAX(lat)}: the function, the
 * evaluator of its argument and the declared output type.
 */
public class AggregateExpression {

  private final AggregateFunction function;
  private final ColumnEvaluator argument;
  private final MinorType outputType;
  private final String name;

  public AggregateExpression(AggregateFunction function, ColumnEvaluator argument, MinorType outputType, String name) {
    this.function = Preconditions.checkNotNull(function);
    this.argument = Preconditions.checkNotNull(argument);
    this.outputType = Preconditions.checkNotNull(outputType);
    this.name = name;
  }

  public AggregateExpression(AggregateFunction function, ColumnEvaluator argument, MinorType outputType) {
    this(function, argument, outputType, function.name() + "(" + argument.getName() + ")");
  }

  public static AggregateExpression of(AggregateFunction function, ColumnEvaluator argument) {
    return new AggregateExpression(function, argument, function.defaultOutputType(argument.getType()));
  }

  public static AggregateExpression of(String functionName, ColumnEvaluator argument) {
    return of(AggregateFunction.fromName(functionName), argument);
  }

  public AggregateFunction getFunction() {
    return function;
  }

  public ColumnEvaluator getArgument() {
    return argument;
  }

  public MinorType getOutputType() {
    return outputType;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name + ":" + outputType;
  }
}
