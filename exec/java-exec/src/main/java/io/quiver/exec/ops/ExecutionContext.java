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

import java.util.concurrent.atomic.AtomicInteger;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.OutOfMemoryException;

import com.google.common.base.Preconditions;

import io.quiver.common.config.QuiverConfig;
import io.quiver.common.exceptions.UserException;
import io.quiver.exec.ExecConstants;

/**
 * Shared state of one pipeline: the configuration and the parent allocator
 * from which every operator gets its own child allocator. The parent
 * allocator belongs to the caller and is not closed here.
 */
public class ExecutionContext {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ExecutionContext.class);

  private final QuiverConfig config;
  private final BufferAllocator allocator;
  private final AtomicInteger operatorIds = new AtomicInteger();

  public ExecutionContext(QuiverConfig config, BufferAllocator allocator) {
    this.config = Preconditions.checkNotNull(config);
    this.allocator = Preconditions.checkNotNull(allocator);
  }

  public QuiverConfig getConfig() {
    return config;
  }

  public BufferAllocator getAllocator() {
    return allocator;
  }

  /**
   * Creates the context of a new operator. Its allocator is a child of the
   * pipeline allocator named after the operator, with the reservation and
   * limit taken from the configuration.
   *
   * @param operatorName simple name of the operator, used in logs and errors
   */
  public OperatorContext newOperatorContext(String operatorName) {
    String name = operatorName + ":" + operatorIds.getAndIncrement();
    long initial = config.getBytes(ExecConstants.OPERATOR_MEMORY_INITIAL);
    long max = config.getBytes(ExecConstants.OPERATOR_MEMORY_MAX);
    try {
      BufferAllocator child = allocator.newChildAllocator(name, Math.min(initial, max), max);
      logger.debug("Created allocator {} (initial {}, max {})", name, initial, max);
      return new OperatorContext(name, child, config);
    } catch (OutOfMemoryException e) {
      throw UserException.memoryError(e)
          .addContext("Operator", name)
          .build(logger);
    }
  }
}
