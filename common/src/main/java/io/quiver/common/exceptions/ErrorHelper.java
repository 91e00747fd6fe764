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

import java.util.regex.Pattern;

/**
 * Utility class that handles error message generation for user exceptions.
 */
public final class ErrorHelper {

  private static final Pattern IGNORE = Pattern.compile("^(sun|com\\.sun|java|jdk).*");

  private ErrorHelper() {
  }

  static String buildCausesMessage(final Throwable t) {

    StringBuilder sb = new StringBuilder();
    Throwable ex = t;
    boolean cause = false;
    while (ex != null) {

      sb.append("  ");

      if (cause) {
        sb.append("Caused By ");
      }

      sb.append("(");
      sb.append(ex.getClass().getCanonicalName());
      sb.append(") ");
      sb.append(ex.getMessage());
      sb.append("\n");

      boolean hidden = false;
      for (StackTraceElement st : ex.getStackTrace()) {
        if (IGNORE.matcher(st.getClassName()).matches()) {
          if (!hidden) {
            sb.append("    ...\n");
            hidden = true;
          }
          continue;
        }
        hidden = false;
        sb.append("    ");
        sb.append(st.getClassName());
        sb.append('.');
        sb.append(st.getMethodName());
        sb.append("():");
        sb.append(st.getLineNumber());
        sb.append("\n");
      }
      cause = true;

      if (ex.getCause() != null && ex.getCause() != ex) {
        ex = ex.getCause();
      } else {
        ex = null;
      }
    }

    return sb.toString();
  }

  /**
   * @return the message of the innermost cause, prefixed by its class name
   */
  static String getRootMessage(final Throwable t) {
    if (t == null) {
      return null;
    }
    Throwable ex = t;
    while (ex.getCause() != null && ex.getCause() != ex) {
      ex = ex.getCause();
    }
    String message = ex.getMessage();
    return ex.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }

  /**
   * searches for a UserException wrapped inside the exception
   * @param ex exception
   * @return null if exception is null or no UserException was found
   */
  static UserException findWrappedUserException(Throwable ex) {
    if (ex == null) {
      return null;
    }

    Throwable cause = ex;
    while (!(cause instanceof UserException)) {
      if (cause.getCause() != null && cause.getCause() != cause) {
        cause = cause.getCause();
      } else {
        return null;
      }
    }

    return (UserException) cause;
  }
}
