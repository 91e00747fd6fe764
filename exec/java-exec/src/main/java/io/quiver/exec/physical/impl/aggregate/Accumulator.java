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

/**
 * Running state of one aggregate function. Accumulation is commutative and
 * associative: the result does not depend on the order values arrive in.
 * NULL inputs are ignored.
 */
public interface Accumulator {

  AggregateFunction getFunction();

  MinorType getInputType();

  MinorType getOutputType();

  /**
   * Folds a single value into the running result.
   */
  void add(ScalarValue value);

  /**
   * Folds every value of a column into the running result at once.
   */
  void accumulate(FieldVector values);

  /**
   * @return the current result, typed {@link #getOutputType()}; NULL when no
   *         input has been seen and the function has no value for empty input
   */
  ScalarValue getResult();

  void reset();
}
