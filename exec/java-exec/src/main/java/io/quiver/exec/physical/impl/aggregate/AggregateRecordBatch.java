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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import io.quiver.common.exceptions.UserException;
import io.quiver.exec.ExecConstants;
import io.quiver.exec.expr.AggregateExpression;
import io.quiver.exec.expr.ColumnEvaluator;
import io.quiver.exec.ops.MetricDef;
import io.quiver.exec.ops.OperatorContext;
import io.quiver.exec.record.AbstractSingleRecordBatch;
import io.quiver.exec.record.RecordBatch;
import io.quiver.exec.vector.ScalarValue;
import io.quiver.exec.vector.ScalarValues;

/**
 * Hash aggregation over the whole input. The operator drains its input before
 * producing its single result batch.
 *
 * <p>Without group-by expressions each aggregate argument is reduced a whole
 * column at a time into one accumulator, and the result is one row, even for
 * empty input. With group-by expressions every row is routed to the
 * {@link GroupEntry} of its {@link GroupKey}; the result has one row per
 * distinct key, in the order keys were first seen, and no batch at all for
 * empty input.
 *
 * <p>Output columns are the group-by columns followed by the aggregates, both
 * in declaration order, and must match the configured schema.
 *
 * <p>Any failure discards the accumulated state before it is reported.
 */
public class AggregateRecordBatch extends AbstractSingleRecordBatch {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AggregateRecordBatch.class);

  public enum Metric implements MetricDef {
    NUM_GROUPS,
    NUM_BATCHES_AGGREGATED;

    @Override
    public int metricId() {
      return ordinal();
    }
  }

  private final List<ColumnEvaluator> groupExprs;
  private final List<AggregateExpression> aggrExprs;
  private final int initialCapacity;

  private Map<GroupKey, GroupEntry> groups;
  private List<Accumulator> accumulators;

  public AggregateRecordBatch(OperatorContext context, Schema outputSchema, RecordBatch incoming,
      List<ColumnEvaluator> groupExprs, List<AggregateExpression> aggrExprs) {
    super(context, outputSchema, incoming);
    this.groupExprs = ImmutableList.copyOf(groupExprs);
    this.aggrExprs = ImmutableList.copyOf(aggrExprs);
    this.initialCapacity = context.getConfig().getInt(ExecConstants.HASHAGG_INITIAL_CAPACITY);
  }

  /**
   * @return the number of groups currently held, 0 once the state is released
   */
  public int getNumGroups() {
    return groups == null ? 0 : groups.size();
  }

  @Override
  protected Optional<VectorSchemaRoot> innerNext() {
    if (state != BatchState.FIRST) {
      // the single result has already been returned
      return Optional.empty();
    }
    setup();

    final Stopwatch watch = Stopwatch.createStarted();
    Optional<VectorSchemaRoot> batch;
    while ((batch = next(incoming)).isPresent()) {
      try (VectorSchemaRoot root = batch.get()) {
        if (groupExprs.isEmpty()) {
          aggregate(root);
        } else {
          aggregateByGroup(root);
        }
      }
      stats.addLongStat(Metric.NUM_BATCHES_AGGREGATED, 1);
    }

    final Optional<VectorSchemaRoot> result = groupExprs.isEmpty() ? outputSingleRow() : outputGroups();
    logger.info("{}: aggregated {} records into {} row(s) in {} ms", oContext.getName(),
        stats.getRecordsReceived(), result.isPresent() ? result.get().getRowCount() : 0,
        watch.elapsed(TimeUnit.MILLISECONDS));
    discardState();
    return result;
  }

  /**
   * Checks the configured schema and the aggregate types before any input is
   * read, so a bad configuration fails even for empty input.
   */
  private void setup() {
    final List<Field> fields = schema.getFields();
    if (fields.size() != groupExprs.size() + aggrExprs.size()) {
      throw UserException.schemaMismatchError()
          .message("Output schema has %d columns but the aggregation produces %d",
              fields.size(), groupExprs.size() + aggrExprs.size())
          .addContext("Schema", schema.toString())
          .build(logger);
    }
    for (int i = 0; i < groupExprs.size(); i++) {
      checkField(fields.get(i), groupExprs.get(i).getType());
    }
    for (int i = 0; i < aggrExprs.size(); i++) {
      checkField(fields.get(groupExprs.size() + i), aggrExprs.get(i).getOutputType());
    }

    // creating the accumulators validates every aggregate against its argument type
    accumulators = GroupEntry.create(aggrExprs).getAccumulators();
    groups = Maps.newLinkedHashMapWithExpectedSize(initialCapacity);
  }

  private void checkField(Field field, MinorType expected) {
    final MinorType actual = ScalarValues.minorType(field);
    if (actual != expected) {
      throw UserException.schemaMismatchError()
          .message("Output column %s is declared %s but the aggregation produces %s",
              field.getName(), actual, expected)
          .build(logger);
    }
  }

  private void aggregate(VectorSchemaRoot root) {
    for (int i = 0; i < aggrExprs.size(); i++) {
      try (FieldVector values = evaluate(aggrExprs.get(i).getArgument(), root)) {
        accumulators.get(i).accumulate(values);
      }
    }
    logger.debug("Aggregated batch of {} records", root.getRowCount());
  }

  private void aggregateByGroup(VectorSchemaRoot root) {
    final List<FieldVector> keys = new ArrayList<>(groupExprs.size());
    final List<FieldVector> args = new ArrayList<>(aggrExprs.size());
    try {
      for (ColumnEvaluator groupExpr : groupExprs) {
        keys.add(evaluate(groupExpr, root));
      }
      for (AggregateExpression aggrExpr : aggrExprs) {
        args.add(evaluate(aggrExpr.getArgument(), root));
      }

      final int rows = root.getRowCount();
      for (int row = 0; row < rows; row++) {
        final List<ScalarValue> keyValues = new ArrayList<>(keys.size());
        for (FieldVector key : keys) {
          keyValues.add(ScalarValues.read(key, row));
        }
        final GroupEntry entry = groups.computeIfAbsent(new GroupKey(keyValues), k -> GroupEntry.create(aggrExprs));
        for (int i = 0; i < args.size(); i++) {
          entry.update(i, ScalarValues.read(args.get(i), row));
        }
      }
    } finally {
      closeAll(keys);
      closeAll(args);
    }
    logger.debug("Aggregated batch of {} records, {} groups so far", root.getRowCount(), groups.size());
  }

  private Optional<VectorSchemaRoot> outputSingleRow() {
    final List<List<ScalarValue>> columns = new ArrayList<>(accumulators.size());
    for (Accumulator accumulator : accumulators) {
      columns.add(Collections.singletonList(accumulator.getResult()));
    }
    return Optional.of(materialize(columns, 1));
  }

  private Optional<VectorSchemaRoot> outputGroups() {
    stats.setLongStat(Metric.NUM_GROUPS, groups.size());
    if (groups.isEmpty()) {
      return Optional.empty();
    }
    final int width = groupExprs.size() + aggrExprs.size();
    final List<List<ScalarValue>> columns = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      columns.add(new ArrayList<>(groups.size()));
    }
    for (Map.Entry<GroupKey, GroupEntry> group : groups.entrySet()) {
      int column = 0;
      for (ScalarValue keyValue : group.getKey().getValues()) {
        columns.get(column++).add(keyValue);
      }
      for (int i = 0; i < aggrExprs.size(); i++) {
        columns.get(column++).add(group.getValue().getResult(i));
      }
    }
    return Optional.of(materialize(columns, groups.size()));
  }

  private VectorSchemaRoot materialize(List<List<ScalarValue>> columns, int rowCount) {
    final List<Field> fields = schema.getFields();
    final List<FieldVector> vectors = new ArrayList<>(fields.size());
    try {
      for (int i = 0; i < fields.size(); i++) {
        vectors.add(ScalarValues.toVector(fields.get(i), columns.get(i), oContext.getAllocator()));
      }
    } catch (RuntimeException e) {
      closeAll(vectors);
      throw e;
    }
    return new VectorSchemaRoot(schema, vectors, rowCount);
  }

  private static void closeAll(List<FieldVector> vectors) {
    for (FieldVector vector : vectors) {
      vector.close();
    }
  }

  @Override
  protected void discardState() {
    groups = null;
    accumulators = null;
  }
}
