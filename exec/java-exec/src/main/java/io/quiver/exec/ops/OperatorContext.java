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

import org.apache.arrow.memory.BufferAllocator;

import io.quiver.common.config.QuiverConfig;

/**
 * Per-operator resources: a child allocator, the configuration and the
 * operator's statistics. Closed by the operator that owns it.
 */
public class OperatorContext implements AutoCloseable {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(OperatorContext.class);

  private final String name;
  private final BufferAllocator allocator;
  private final QuiverConfig config;
  private final OperatorStats stats;
  private boolean closed = false;

  OperatorContext(String name, BufferAllocator allocator, QuiverConfig config) {
    this.name = name;
    this.allocator = allocator;
    this.config = config;
    this.stats = new OperatorStats(name);
  }

  public String getName() {
    return name;
  }

  public BufferAllocator getAllocator() {
    return allocator;
  }

  public QuiverConfig getConfig() {
    return config;
  }

  public OperatorStats getStats() {
    return stats;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      logger.debug("Attempted to close Operator context for {}, but context is already closed", name);
      return;
    }
    logger.debug("Closing context for {}", name);
    closed = true;
    allocator.close();
  }
}
