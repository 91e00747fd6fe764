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
package io.quiver.common.exceptions;

/**
 * Categories of {@link UserException}. The type is part of the rendered message
 * and is what callers inspect to decide how to react to a failed pull.
 */
public enum ErrorType {

  /** An aggregate function is unknown or not defined for the argument type. */
  UNSUPPORTED_FUNCTION,

  /** A scalar type has no dispatch branch (group key, argument or output column). */
  UNSUPPORTED_TYPE,

  /** A column evaluator failed, or a computation overflowed. */
  EVALUATION,

  /** Declared and produced column types disagree. */
  SCHEMA_MISMATCH,

  /** Source data could not be read or parsed. */
  DATA_READ,

  /** An operator was configured with invalid arguments. */
  VALIDATION,

  /** Memory limits were hit. */
  RESOURCE,

  /** Anything else; indicates a bug rather than bad input. */
  SYSTEM
}
