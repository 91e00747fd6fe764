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

import org.apache.arrow.memory.OutOfMemoryException;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Schema;

import io.quiver.common.exceptions.UserException;
import io.quiver.exec.expr.ColumnEvaluator;
import io.quiver.exec.ops.OperatorContext;
import io.quiver.exec.ops.OperatorStats;

/**
 * Drives the state machine shared by every operator. Subclasses produce data
 * in {@link #innerNext()}; this class takes care of terminality, error
 * normalization, statistics and releasing the operator context.
 */
public abstract class AbstractRecordBatch implements RecordBatch {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(new Object() {}.getClass().getEnclosingClass());

  protected final OperatorContext oContext;
  protected final OperatorStats stats;
  protected final Schema schema;
  protected BatchState state;

  private UserException failure;

  protected AbstractRecordBatch(final OperatorContext oContext, final Schema schema) {
    this.oContext = oContext;
    this.stats = oContext.getStats();
    this.schema = schema;
    this.state = BatchState.FIRST;
  }

  public enum BatchState {
    /** This is still the first data batch. */
    FIRST,
    /** The first data batch has already been returned. */
    NOT_FIRST,
    /** The operator failed; every later call reports the original failure. */
    FAILED,
    /** All work is done, no more data to be sent. */
    DONE
  }

  @Override
  public Schema getSchema() {
    return schema;
  }

  public OperatorContext getOperatorContext() {
    return oContext;
  }

  public BatchState getState() {
    return state;
  }

  @Override
  public final Optional<VectorSchemaRoot> next() {
    switch (state) {
      case DONE:
        return Optional.empty();
      case FAILED:
        throw new IllegalStateException(
            String.format("%s already failed: %s", oContext.getName(), failure.getOriginalMessage()), failure);
      default:
        break;
    }

    stats.startProcessing();
    try {
      final Optional<VectorSchemaRoot> result = innerNext();
      if (result.isPresent()) {
        stats.batchOutput(result.get().getRowCount());
        state = BatchState.NOT_FIRST;
      } else {
        state = BatchState.DONE;
        logger.debug("{} done. {}", oContext.getName(), stats);
      }
      return result;
    } catch (final UserException e) {
      throw fail(e);
    } catch (final OutOfMemoryException e) {
      throw fail(UserException.memoryError(e)
          .addContext("Operator", oContext.getName())
          .build(logger));
    } catch (final RuntimeException e) {
      throw fail(UserException.systemError(e)
          .addContext("Operator", oContext.getName())
          .build(logger));
    } finally {
      stats.stopProcessing();
    }
  }

  private UserException fail(final UserException e) {
    state = BatchState.FAILED;
    failure = e;
    try {
      discardState();
    } catch (final RuntimeException suppressed) {
      e.addSuppressed(suppressed);
    }
    return e;
  }

  /**
   * Pulls the next batch from an input, keeping the processing timer out of
   * the time spent upstream.
   */
  protected final Optional<VectorSchemaRoot> next(final RecordBatch b) {
    final Optional<VectorSchemaRoot> next;
    stats.stopProcessing();
    try {
      next = b.next();
    } finally {
      stats.startProcessing();
    }
    if (next.isPresent()) {
      final int rows = next.get().getRowCount();
      stats.batchReceived(rows);
      logger.debug("Number of records in received batch: {}", rows);
    } else {
      logger.debug("Received end of data from {}", b.getClass().getSimpleName());
    }
    return next;
  }

  /**
   * Evaluates an expression over an input batch into this operator's memory,
   * checking the produced column against the declared type and row count.
   */
  protected final FieldVector evaluate(ColumnEvaluator evaluator, VectorSchemaRoot root) {
    final FieldVector vector;
    try {
      vector = evaluator.evaluate(root, oContext.getAllocator());
    } catch (OutOfMemoryException e) {
      throw e;
    } catch (RuntimeException e) {
      throw UserException.evaluationError(e)
          .message("Failed to evaluate %s", evaluator.getName())
          .addContext("Expression", evaluator.getName())
          .build(logger);
    }
    if (!vector.getField().getType().equals(evaluator.getArrowType())) {
      final ArrowType produced = vector.getField().getType();
      vector.close();
      throw UserException.schemaMismatchError()
          .message("Expression %s is declared %s but produced %s", evaluator.getName(), evaluator.getArrowType(), produced)
          .build(logger);
    }
    if (vector.getValueCount() != root.getRowCount()) {
      final int produced = vector.getValueCount();
      vector.close();
      throw UserException.evaluationError()
          .message("Expression %s produced %d values for %d rows", evaluator.getName(), produced, root.getRowCount())
          .build(logger);
    }
    return vector;
  }

  /**
   * Produces the next output batch, or empty when there is nothing left.
   * Called at most until it first returns empty or throws.
   */
  protected abstract Optional<VectorSchemaRoot> innerNext();

  /**
   * Drops whatever partial state the operator accumulated. Called when
   * {@link #innerNext()} fails and again on close.
   */
  protected void discardState() {
  }

  @Override
  public void close() {
    try {
      discardState();
    } finally {
      oContext.close();
    }
  }
}
