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
package io.quiver.exec.physical.impl.scan;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import io.quiver.common.exceptions.ExecutionSetupException;
import io.quiver.common.exceptions.UserException;
import io.quiver.exec.ops.OperatorContext;
import io.quiver.exec.record.AbstractRecordBatch;
import io.quiver.exec.store.RecordReader;

/**
 * Record batch used for a particular scan. Reads from one or more readers in
 * turn; every reader must produce the same schema.
 */
public class ScanBatch extends AbstractRecordBatch {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ScanBatch.class);

  private final Iterator<RecordReader> readers;
  private RecordReader currentReader;
  private String currentReaderClassName;

  public ScanBatch(OperatorContext context, List<RecordReader> readerList) {
    super(context, firstSchema(readerList));
    this.readers = ImmutableList.copyOf(readerList).iterator();
  }

  public ScanBatch(OperatorContext context, RecordReader reader) {
    this(context, ImmutableList.of(reader));
  }

  private static Schema firstSchema(List<RecordReader> readerList) {
    Preconditions.checkArgument(!readerList.isEmpty(), "A scan batch must contain at least one reader.");
    return readerList.get(0).getSchema();
  }

  @Override
  protected Optional<VectorSchemaRoot> innerNext() {
    while (true) {
      if (currentReader == null && !getNextReaderIfHas()) {
        return Optional.empty();
      }

      final VectorSchemaRoot root = VectorSchemaRoot.create(schema, oContext.getAllocator());
      final int recordCount;
      try {
        recordCount = currentReader.next(root);
        Preconditions.checkState(recordCount >= 0, "recordCount from RecordReader.next() should not be negative");
      } catch (RuntimeException e) {
        root.close();
        throw e;
      }

      if (recordCount > 0) {
        root.setRowCount(recordCount);
        stats.batchReceived(recordCount);
        logger.debug("Read {} records from {}", recordCount, currentReaderClassName);
        return Optional.of(root);
      }

      // current reader is complete, move on to the next one
      root.close();
      closeCurrentReader();
    }
  }

  private boolean getNextReaderIfHas() {
    if (!readers.hasNext()) {
      return false;
    }
    currentReader = readers.next();
    currentReaderClassName = currentReader.getClass().getSimpleName();
    if (!schema.equals(currentReader.getSchema())) {
      throw UserException.schemaMismatchError()
          .message("Reader schema %s differs from the scan schema %s", currentReader.getSchema(), schema)
          .addContext("Reader", currentReaderClassName)
          .build(logger);
    }
    try {
      currentReader.setup(oContext);
    } catch (ExecutionSetupException e) {
      throw UserException.dataReadError(e)
          .addContext("Setup failed for", currentReaderClassName)
          .build(logger);
    }
    return true;
  }

  private void closeCurrentReader() {
    if (currentReader == null) {
      return;
    }
    try {
      currentReader.close();
    } catch (Exception e) {
      throw UserException.dataReadError(e)
          .message("Close failed for reader %s", currentReaderClassName)
          .build(logger);
    } finally {
      currentReader = null;
    }
  }

  @Override
  protected void discardState() {
    closeCurrentReader();
  }

  @Override
  public void close() {
    try {
      super.close();
    } finally {
      while (readers.hasNext()) {
        final RecordReader reader = readers.next();
        try {
          reader.close();
        } catch (Exception e) {
          logger.error("Close failed for reader " + reader.getClass().getSimpleName(), e);
        }
      }
    }
  }
}
