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

import java.util.List;

import com.google.common.collect.ImmutableList;

import io.quiver.exec.expr.AggregateExpression;
import io.quiver.exec.vector.ScalarValue;

/**
 * The accumulators of one group, one per aggregate expression.
 */
public class GroupEntry {

  private final ImmutableList<Accumulator> accumulators;

  GroupEntry(List<Accumulator> accumulators) {
    this.accumulators = ImmutableList.copyOf(accumulators);
  }

  public static GroupEntry create(List<AggregateExpression> aggregates) {
    final ImmutableList.Builder<Accumulator> builder = ImmutableList.builder();
    for (AggregateExpression aggregate : aggregates) {
      builder.add(Accumulators.create(aggregate));
    }
    return new GroupEntry(builder.build());
  }

  public void update(int i, ScalarValue value) {
    accumulators.get(i).add(value);
  }

  public ScalarValue getResult(int i) {
    return accumulators.get(i).getResult();
  }

  public List<Accumulator> getAccumulators() {
    return accumulators;
  }

  public int size() {
    return accumulators.size();
  }
}
