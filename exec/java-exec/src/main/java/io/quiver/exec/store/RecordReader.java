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
package io.quiver.exec.store;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import io.quiver.common.exceptions.ExecutionSetupException;
import io.quiver.exec.ops.OperatorContext;

/**
 * A source of rows for {@link io.quiver.exec.physical.impl.scan.ScanBatch}.
 */
public interface RecordReader extends AutoCloseable {

  /**
   * @return the layout of the rows this reader produces
   */
  Schema getSchema();

  /**
   * Configure the RecordReader with the operator context it reads for, and
   * open the underlying source.
   *
   * @throws ExecutionSetupException if the source cannot be opened
   */
  void setup(OperatorContext context) throws ExecutionSetupException;

  /**
   * Increment record reader forward, writing into the provided output batch.
   * The batch has the reader's schema and no rows yet; the caller sets the
   * row count from the returned value.
   *
   * @return The number of additional records added to the output, 0 once the
   *         source is exhausted
   */
  int next(VectorSchemaRoot output);
}
