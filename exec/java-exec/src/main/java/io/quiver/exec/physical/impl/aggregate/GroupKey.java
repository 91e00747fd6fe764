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

import org.apache.arrow.vector.types.Types.MinorType;

import com.google.common.collect.ImmutableList;

import io.quiver.exec.vector.ScalarValue;

/**
 * The values of the group-by expressions for one row, in declaration order.
 * NULLs of the same type are equal, so they form a single group. Floating
 * point zeros are stored as {@code +0.0}, so {@code -0.0} joins the zero
 * group; NaN equals NaN.
 */
public final class GroupKey {

  private final ImmutableList<ScalarValue> values;
  private final int hash;

  public GroupKey(List<ScalarValue> values) {
    final ImmutableList.Builder<ScalarValue> builder = ImmutableList.builderWithExpectedSize(values.size());
    for (ScalarValue value : values) {
      builder.add(normalize(value));
    }
    this.values = builder.build();
    this.hash = this.values.hashCode();
  }

  private static ScalarValue normalize(ScalarValue value) {
    if (!ScalarValue.isFloatingPoint(value.getType()) || value.isNull() || value.doubleValue() != 0) {
      return value;
    }
    return value.getType() == MinorType.FLOAT4 ? ScalarValue.ofFloat4(0.0f) : ScalarValue.ofFloat8(0.0);
  }

  public List<ScalarValue> getValues() {
    return values;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this || (obj instanceof GroupKey && values.equals(((GroupKey) obj).values));
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
