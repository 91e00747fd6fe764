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

public interface ExecConstants {

  /** Maximum number of rows a record reader writes into one batch. */
  String SCAN_BATCH_SIZE = "quiver.exec.scan.batch_size";

  String TEXT_DELIMITER = "quiver.exec.text.delimiter";
  String TEXT_EXTRACT_HEADER = "quiver.exec.text.extract_header";

  /** Expected number of distinct groups; sizes the grouping map up front. */
  String HASHAGG_INITIAL_CAPACITY = "quiver.exec.hashagg.initial_capacity";

  String OPERATOR_MEMORY_INITIAL = "quiver.exec.memory.operator.initial";
  String OPERATOR_MEMORY_MAX = "quiver.exec.memory.operator.max";
}
