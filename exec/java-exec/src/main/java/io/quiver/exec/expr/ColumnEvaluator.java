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

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * A compiled expression that computes one column from a batch. Evaluators
 * are pure and may be reused for any number of batches.
 */
public interface ColumnEvaluator {

  /**
   * @return the display name of the produced column
   */
  String getName();

  /**
   * @return the minor type of the produced column
   */
  MinorType getType();

  /**
   * @return the full declared type of the produced column, including
   *         parameters such as decimal precision or timestamp zone
   */
  ArrowType getArrowType();

  /**
   * Computes the column for every row of {@code batch}. The returned vector
   * is allocated from {@code allocator} and owned by the caller.
   */
  FieldVector evaluate(VectorSchemaRoot batch, BufferAllocator allocator);
}
