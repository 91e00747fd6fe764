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
import org.apache.arrow.vector.types.Types;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.TransferPair;

import com.google.common.base.Preconditions;

/**
 * Evaluates to the input column at a fixed position. The result shares the
 * input buffers instead of copying them.
 */
public class ColumnReference implements ColumnEvaluator {

  private final int index;
  private final String name;
  private final ArrowType arrowType;
  private final MinorType type;

  public ColumnReference(int index, String name, ArrowType arrowType) {
    Preconditions.checkArgument(index >= 0, "Negative column index %s", index);
    this.index = index;
    this.name = name;
    this.arrowType = Preconditions.checkNotNull(arrowType);
    this.type = Types.getMinorTypeForArrowType(arrowType);
  }

  public static ColumnReference of(Schema schema, int index) {
    final Field field = schema.getFields().get(index);
    return new ColumnReference(index, field.getName(), field.getType());
  }

  public static ColumnReference of(Schema schema, String name) {
    final Field field = schema.findField(name);
    return new ColumnReference(schema.getFields().indexOf(field), name, field.getType());
  }

  public int getIndex() {
    return index;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public MinorType getType() {
    return type;
  }

  @Override
  public ArrowType getArrowType() {
    return arrowType;
  }

  @Override
  public FieldVector evaluate(VectorSchemaRoot batch, BufferAllocator allocator) {
    final FieldVector source = batch.getVector(index);
    final int rows = batch.getRowCount();
    final TransferPair transfer = source.getTransferPair(source.getField().getName(), allocator);
    if (rows == 0) {
      final FieldVector empty = (FieldVector) transfer.getTo();
      empty.allocateNew();
      empty.setValueCount(0);
      return empty;
    }
    transfer.splitAndTransfer(0, rows);
    return (FieldVector) transfer.getTo();
  }

  @Override
  public String toString() {
    return "ColumnReference[" + index + ":" + name + "]";
  }
}
