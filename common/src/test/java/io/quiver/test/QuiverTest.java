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
package io.quiver.test;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.slf4j.Logger;

public class QuiverTest {
  static final Logger logger = org.slf4j.LoggerFactory.getLogger(QuiverTest.class);

  static {
    System.setProperty("line.separator", "\n");
  }

  static final Logger testReporter = org.slf4j.LoggerFactory.getLogger("io.quiver.TestReporter");
  static final TestLogReporter LOG_OUTCOME = new TestLogReporter();

  static MemWatcher memWatcher;
  static String className;

  @Rule public final TestRule TIMEOUT = TestTools.getTimeoutRule(50000);
  @Rule public final TestLogReporter logOutcome = LOG_OUTCOME;

  @Rule public TestName TEST_NAME = new TestName();

  @Before
  public void printID() throws Exception {
    logger.debug("Running {}#{}", getClass().getName(), TEST_NAME.getMethodName());
  }

  @BeforeClass
  public static void initQuiverTest() throws Exception {
    memWatcher = new MemWatcher();
  }

  @AfterClass
  public static void finiQuiverTest() {
    testReporter.info(String.format("Test Class done (%s): %s.", memWatcher.getMemString(true), className));
  }

  protected static class MemWatcher {
    private static final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    private final long startHeap;

    public MemWatcher() {
      startHeap = memoryBean.getHeapMemoryUsage().getUsed();
    }

    public String getMemString() {
      return getMemString(false);
    }

    public String getMemString(boolean runGC) {
      if (runGC) {
        Runtime.getRuntime().gc();
      }
      long endHeap = memoryBean.getHeapMemoryUsage().getUsed();
      return String.format("h: %dk(%dk)", (endHeap - startHeap) / 1024, endHeap / 1024);
    }
  }

  private static class TestLogReporter extends TestWatcher {

    private MemWatcher memWatcher;

    @Override
    protected void starting(Description description) {
      super.starting(description);
      className = description.getClassName();
      memWatcher = new MemWatcher();
    }

    @Override
    protected void failed(Throwable e, Description description) {
      testReporter.error(String.format("Test Failed (%s): %s", memWatcher.getMemString(), description.getDisplayName()), e);
    }

    @Override
    public void succeeded(Description description) {
      testReporter.info(String.format("Test Succeeded (%s): %s", memWatcher.getMemString(), description.getDisplayName()));
    }
  }
}
