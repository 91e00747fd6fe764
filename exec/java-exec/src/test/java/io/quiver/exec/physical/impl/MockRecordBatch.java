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
package io.quiver.exec.physical.impl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import io.quiver.exec.record.RecordBatch;

/**
 * Replays a fixed list of batches as an upstream operator. Batches not pulled
 * before {@link #close()} are released by it.
 */
public class MockRecordBatch implements RecordBatch {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MockRecordBatch.class);

  private final Schema schema;
  private final Deque<VectorSchemaRoot> batches;
  private RuntimeException failure;
  private int failAfter = -1;
  private int nextCalls;
  private int batchesReturned;
  private boolean closed;

  public MockRecordBatch(Schema schema, List<VectorSchemaRoot> batches) {
    this.schema = schema;
    this.batches = new ArrayDeque<>(batches);
  }

  /**
   * Makes {@link #next()} throw {@code failure} once {@code batches} batches
   * have been returned.
   */
  public MockRecordBatch failAfter(int batches, RuntimeException failure) {
    this.failAfter = batches;
    this.failure = failure;
    return this;
  }

  @Override
  public Schema getSchema() {
    return schema;
  }

  @Override
  public Optional<VectorSchemaRoot> next() {
    nextCalls++;
    if (failure != null && batchesReturned == failAfter) {
      throw failure;
    }
    final VectorSchemaRoot batch = batches.poll();
    if (batch == null) {
      return Optional.empty();
    }
    batchesReturned++;
    logger.debug("Returning mock batch {} with {} rows", batchesReturned, batch.getRowCount());
    return Optional.of(batch);
  }

  public int getNextCalls() {
    return nextCalls;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    for (VectorSchemaRoot batch : batches) {
      batch.close();
    }
    batches.clear();
    closed = true;
  }
}
