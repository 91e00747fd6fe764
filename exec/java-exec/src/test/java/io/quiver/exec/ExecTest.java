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
package io.quiver.exec;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.After;
import org.junit.Before;

import io.quiver.common.config.QuiverConfig;
import io.quiver.exec.ops.ExecutionContext;
import io.quiver.exec.ops.OperatorContext;
import io.quiver.test.QuiverTest;

/**
 * Gives every test a fresh root allocator. Closing it after the test fails
 * the test if any Arrow memory is still held.
 */
public class ExecTest extends QuiverTest {

  protected static final QuiverConfig c = QuiverConfig.create();

  protected BufferAllocator allocator;
  protected ExecutionContext context;

  @Before
  public void setupAllocator() {
    allocator = new RootAllocator(Long.MAX_VALUE);
    context = new ExecutionContext(c, allocator);
  }

  @After
  public void closeAllocator() {
    allocator.close();
  }

  protected OperatorContext newOperatorContext(String name) {
    return context.newOperatorContext(name);
  }
}
