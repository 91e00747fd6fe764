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
package io.quiver.common.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Properties;

import org.junit.Test;

import com.typesafe.config.ConfigFactory;

import io.quiver.common.exceptions.ErrorType;
import io.quiver.common.exceptions.UserException;
import io.quiver.test.QuiverTest;

public class TestQuiverConfig extends QuiverTest {

  @Test
  public void testDefaultsAreLoaded() {
    QuiverConfig config = QuiverConfig.create();

    assertEquals(1024, config.getInt("quiver.exec.scan.batch_size"));
    assertEquals(",", config.getString("quiver.exec.text.delimiter"));
    assertFalse(config.getBoolean("quiver.exec.text.extract_header"));
    assertEquals(1024L * 1024, config.getBytes("quiver.exec.memory.operator.initial"));
    assertEquals(10L * 1024 * 1024 * 1024, config.getBytes("quiver.exec.memory.operator.max"));
  }

  @Test
  public void testPropertiesOverrideDefaults() {
    Properties props = new Properties();
    props.put("quiver.exec.scan.batch_size", "16");

    QuiverConfig config = QuiverConfig.create(props);

    assertEquals(16, config.getInt("quiver.exec.scan.batch_size"));
    assertEquals(1024L, config.getLong("quiver.exec.hashagg.initial_capacity"));
  }

  @Test
  public void testSystemPropertyOverridesDefaults() {
    String key = "quiver.exec.text.delimiter";
    System.setProperty(key, "|");
    try {
      ConfigFactory.invalidateCaches();
      assertEquals("|", QuiverConfig.create().getString(key));
    } finally {
      System.clearProperty(key);
      ConfigFactory.invalidateCaches();
    }
  }

  @Test
  public void testMissingPath() {
    QuiverConfig config = QuiverConfig.create();
    assertFalse(config.hasPath("quiver.no.such.key"));
    assertTrue(config.hasPath("quiver.exec"));
    try {
      config.getInt("quiver.no.such.key");
      fail("missing key must be rejected");
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertEquals("Configuration path: quiver.no.such.key", e.getContext().get(0));
    }
  }

  @Test
  public void testWrongValueType() {
    QuiverConfig config = new QuiverConfig(ConfigFactory.parseString("quiver.exec.scan.batch_size = lots"));
    try {
      config.getInt("quiver.exec.scan.batch_size");
      fail("non numeric value must be rejected");
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
    }
  }
}
