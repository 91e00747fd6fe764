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

import java.util.HashMap;
import java.util.Map;

/**
 * Per-operator counters: batches and records flowing in and out, time spent
 * processing, and operator specific metrics keyed by {@link MetricDef}.
 */
public class OperatorStats {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(OperatorStats.class);

  private final String operatorName;

  private final Map<Integer, Long> longMetrics = new HashMap<>();

  private long recordsReceived;
  private long batchesReceived;
  private long recordsOutput;
  private long batchesOutput;

  private boolean inProcessing = false;
  private long processingNanos;
  private long processingMark;

  public OperatorStats(String operatorName) {
    this.operatorName = operatorName;
  }

  private String assertionError(String msg) {
    return String.format("Failure while %s for operator %s. Currently processing: %s.", msg, operatorName, inProcessing);
  }

  public void startProcessing() {
    assert !inProcessing : assertionError("starting processing");
    processingMark = System.nanoTime();
    inProcessing = true;
  }

  public void stopProcessing() {
    assert inProcessing : assertionError("stopping processing");
    processingNanos += System.nanoTime() - processingMark;
    inProcessing = false;
  }

  public void batchReceived(long records) {
    recordsReceived += records;
    batchesReceived++;
  }

  public void batchOutput(long records) {
    recordsOutput += records;
    batchesOutput++;
  }

  public void addLongStat(MetricDef metric, long value) {
    longMetrics.merge(metric.metricId(), value, Long::sum);
  }

  public void setLongStat(MetricDef metric, long value) {
    longMetrics.put(metric.metricId(), value);
  }

  public long getLongStat(MetricDef metric) {
    return longMetrics.getOrDefault(metric.metricId(), 0L);
  }

  public String getOperatorName() {
    return operatorName;
  }

  public long getRecordsReceived() {
    return recordsReceived;
  }

  public long getBatchesReceived() {
    return batchesReceived;
  }

  public long getRecordsOutput() {
    return recordsOutput;
  }

  public long getBatchesOutput() {
    return batchesOutput;
  }

  public long getProcessingNanos() {
    return processingNanos;
  }

  @Override
  public String toString() {
    return String.format("%s: received %d records in %d batches, produced %d records in %d batches, processing %d us",
        operatorName, recordsReceived, batchesReceived, recordsOutput, batchesOutput, processingNanos / 1000);
  }
}
