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
package io.quiver.exec.record;

import java.util.Optional;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * A record batch is the unit of data an operator hands to its consumer. Every
 * operator is itself a source of batches: the consumer pulls by calling
 * {@link #next()} until it returns an empty result.
 *
 * <p>Contract:
 * <ul>
 * <li>{@link #getSchema()} is fixed for the lifetime of the operator and may
 *     be called before or after {@link #next()}.</li>
 * <li>Once {@link #next()} has returned an empty result it keeps doing so.</li>
 * <li>A failure is raised as a {@link io.quiver.common.exceptions.UserException}.
 *     An operator that failed stays failed: later calls to {@link #next()}
 *     throw {@link IllegalStateException}.</li>
 * <li>The caller owns every returned {@link VectorSchemaRoot} and must close it.</li>
 * <li>Only one consumer pulls from a given operator.</li>
 * </ul>
 */
public interface RecordBatch extends AutoCloseable {

  /**
   * Gets the schema of the batches this operator produces.
   *
   * @return the output schema, never null
   */
  Schema getSchema();

  /**
   * Updates the data in each Field reading interface for the next range of
   * records, pulling from upstream as needed.
   *
   * @return the next batch, or empty once the input is exhausted
   */
  Optional<VectorSchemaRoot> next();

  /**
   * Releases the memory held by this operator and closes its inputs.
   */
  @Override
  void close();
}
