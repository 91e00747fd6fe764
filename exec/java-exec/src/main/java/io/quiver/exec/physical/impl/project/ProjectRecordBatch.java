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
package io.quiver.exec.physical.impl.project;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import com.google.common.collect.ImmutableList;

import io.quiver.exec.expr.ColumnEvaluator;
import io.quiver.exec.ops.OperatorContext;
import io.quiver.exec.record.AbstractSingleRecordBatch;
import io.quiver.exec.record.RecordBatch;

/**
 * Computes one output column per evaluator for every incoming batch. The
 * output schema is built from the evaluators' names and full Arrow types;
 * every column is nullable.
 */
public class ProjectRecordBatch extends AbstractSingleRecordBatch {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ProjectRecordBatch.class);

  private final List<ColumnEvaluator> exprs;

  public ProjectRecordBatch(OperatorContext context, RecordBatch incoming, List<ColumnEvaluator> exprs) {
    super(context, buildSchema(exprs), incoming);
    this.exprs = ImmutableList.copyOf(exprs);
  }

  private static Schema buildSchema(List<ColumnEvaluator> exprs) {
    final List<Field> fields = new ArrayList<>(exprs.size());
    for (ColumnEvaluator expr : exprs) {
      fields.add(Field.nullable(expr.getName(), expr.getArrowType()));
    }
    return new Schema(fields);
  }

  @Override
  protected Optional<VectorSchemaRoot> innerNext() {
    final Optional<VectorSchemaRoot> batch = next(incoming);
    if (!batch.isPresent()) {
      return Optional.empty();
    }
    try (VectorSchemaRoot input = batch.get()) {
      return Optional.of(doWork(input));
    }
  }

  private VectorSchemaRoot doWork(VectorSchemaRoot input) {
    final List<Field> fields = schema.getFields();
    final List<FieldVector> outputs = new ArrayList<>(exprs.size());
    try {
      for (int i = 0; i < exprs.size(); i++) {
        try (FieldVector evaluated = evaluate(exprs.get(i), input)) {
          final FieldVector output = fields.get(i).createVector(oContext.getAllocator());
          outputs.add(output);
          evaluated.makeTransferPair(output).transfer();
        }
      }
    } catch (RuntimeException e) {
      for (FieldVector output : outputs) {
        output.close();
      }
      throw e;
    }
    logger.debug("Projected {} records into {} columns", input.getRowCount(), outputs.size());
    return new VectorSchemaRoot(schema, outputs, input.getRowCount());
  }
}
