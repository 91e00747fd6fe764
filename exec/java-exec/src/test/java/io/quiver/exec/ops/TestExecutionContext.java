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
package io.quiver.exec.ops;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Properties;

import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.OutOfMemoryException;
import org.junit.Test;

import io.quiver.common.config.QuiverConfig;
import io.quiver.exec.ExecConstants;
import io.quiver.exec.ExecTest;

public class TestExecutionContext extends ExecTest {

  private enum TestMetric implements MetricDef {
    ROWS_SKIPPED;

    @Override
    public int metricId() {
      return ordinal();
    }
  }

  @Test
  public void testOperatorNamesAreUnique() {
    try (OperatorContext first = newOperatorContext("ScanBatch");
         OperatorContext second = newOperatorContext("ScanBatch")) {
      assertEquals("ScanBatch:0", first.getName());
      assertEquals("ScanBatch:1", second.getName());
      assertEquals(first.getName(), first.getAllocator().getName());
      assertNotSame(first.getAllocator(), second.getAllocator());
      assertEquals(allocator, first.getAllocator().getParentAllocator());
    }
  }

  @Test
  public void testCloseIsIdempotent() {
    OperatorContext oContext = newOperatorContext("ProjectRecordBatch");
    assertFalse(oContext.isClosed());
    oContext.close();
    oContext.close();
    assertTrue(oContext.isClosed());
  }

  @Test
  public void testOperatorMemoryLimit() {
    Properties props = new Properties();
    props.setProperty(ExecConstants.OPERATOR_MEMORY_INITIAL, "0");
    props.setProperty(ExecConstants.OPERATOR_MEMORY_MAX, "64K");
    ExecutionContext limited = new ExecutionContext(QuiverConfig.create(props), allocator);

    try (OperatorContext oContext = limited.newOperatorContext("AggregateRecordBatch")) {
      assertEquals(64 * 1024, oContext.getAllocator().getLimit());
      try (ArrowBuf buf = oContext.getAllocator().buffer(128 * 1024)) {
        fail();
      } catch (OutOfMemoryException e) {
        // expected
      }
    }
  }

  @Test
  public void testStats() {
    OperatorStats stats = new OperatorStats("AggregateRecordBatch:0");
    stats.startProcessing();
    stats.batchReceived(10);
    stats.batchReceived(5);
    stats.batchOutput(1);
    stats.addLongStat(TestMetric.ROWS_SKIPPED, 2);
    stats.addLongStat(TestMetric.ROWS_SKIPPED, 3);
    stats.stopProcessing();

    assertEquals(15, stats.getRecordsReceived());
    assertEquals(2, stats.getBatchesReceived());
    assertEquals(1, stats.getRecordsOutput());
    assertEquals(1, stats.getBatchesOutput());
    assertEquals(5, stats.getLongStat(TestMetric.ROWS_SKIPPED));
    stats.setLongStat(TestMetric.ROWS_SKIPPED, 1);
    assertEquals(1, stats.getLongStat(TestMetric.ROWS_SKIPPED));
    assertTrue(stats.getProcessingNanos() >= 0);
  }
}
