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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import io.quiver.common.exceptions.ErrorType;
import io.quiver.common.exceptions.UserException;
import io.quiver.test.QuiverTest;

public class TestAggregateFunction extends QuiverTest {

  @Test
  public void testFromName() {
    assertEquals(AggregateFunction.MIN, AggregateFunction.fromName("min"));
    assertEquals(AggregateFunction.AVG, AggregateFunction.fromName("Avg"));
    assertEquals(AggregateFunction.COUNT, AggregateFunction.fromName("COUNT"));
  }

  @Test
  public void testUnknownName() {
    try {
      AggregateFunction.fromName("median");
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.UNSUPPORTED_FUNCTION, e.getErrorType());
    }
  }

  @Test
  public void testDefaultOutputType() {
    assertEquals(MinorType.SMALLINT, AggregateFunction.MIN.defaultOutputType(MinorType.SMALLINT));
    assertEquals(MinorType.VARCHAR, AggregateFunction.MAX.defaultOutputType(MinorType.VARCHAR));
    assertEquals(MinorType.BIGINT, AggregateFunction.SUM.defaultOutputType(MinorType.TINYINT));
    assertEquals(MinorType.BIGINT, AggregateFunction.SUM.defaultOutputType(MinorType.UINT4));
    assertEquals(MinorType.UINT8, AggregateFunction.SUM.defaultOutputType(MinorType.UINT8));
    assertEquals(MinorType.FLOAT8, AggregateFunction.SUM.defaultOutputType(MinorType.FLOAT4));
    assertEquals(MinorType.BIGINT, AggregateFunction.COUNT.defaultOutputType(MinorType.VARCHAR));
    assertEquals(MinorType.FLOAT8, AggregateFunction.AVG.defaultOutputType(MinorType.INT));
  }

  @Test
  public void testExpressionNames() {
    Schema schema = new Schema(ImmutableList.of(Field.nullable("lat", MinorType.FLOAT8.getType())));
    ColumnReference lat = ColumnReference.of(schema, "lat");

    AggregateExpression min = AggregateExpression.of("min", lat);
    assertEquals(AggregateFunction.MIN, min.getFunction());
    assertEquals(MinorType.FLOAT8, min.getOutputType());
    assertEquals("MIN(lat)", min.getName());

    AggregateExpression named = new AggregateExpression(AggregateFunction.COUNT, lat, MinorType.BIGINT, "cities");
    assertEquals("cities", named.getName());
  }
}
