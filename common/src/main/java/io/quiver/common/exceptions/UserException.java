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

import java.util.List;

/**
 * Base class for all errors surfaced by an operator pipeline. The goal is to
 * separate out common error conditions so callers can inspect the
 * {@link ErrorType} and decide whether to retry, abort or report.
 * <p>Throwing a user exception guarantees its message reaches the caller of
 * {@code next()}, along with any context information added to it at the
 * various levels it passed through.
 * <p>Wrapping an exception that already is, or wraps, a user exception does
 * not create a new one: {@link Builder#build(org.slf4j.Logger)} returns the
 * original, so the first error of a pipeline is the one the caller sees.
 *
 * @see ErrorType
 */
public class UserException extends QuiverRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(UserException.class);

  public static final String MEMORY_ERROR_MSG = "Operator ran out of memory while executing the query.";

  /**
   * Creates a RESOURCE error with a prebuilt message for out of memory exceptions
   *
   * @param cause exception that will be wrapped inside a memory error
   * @return resource error builder
   */
  public static Builder memoryError(final Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause)
        .message(MEMORY_ERROR_MSG);
  }

  /**
   * Wraps the passed exception inside a system error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   *
   * @param cause exception we want the user exception to wrap. If cause is, or wraps, a user exception it will be
   *              returned by the builder instead of creating a new user exception
   * @return user exception builder
   */
  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  public static Builder unsupportedFunctionError() {
    return unsupportedFunctionError(null);
  }

  /**
   * Wraps the passed exception inside an unsupported function error.
   *
   * @see ErrorType#UNSUPPORTED_FUNCTION
   */
  public static Builder unsupportedFunctionError(final Throwable cause) {
    return new Builder(ErrorType.UNSUPPORTED_FUNCTION, cause);
  }

  public static Builder unsupportedTypeError() {
    return unsupportedTypeError(null);
  }

  /**
   * Wraps the passed exception inside an unsupported type error.
   *
   * @see ErrorType#UNSUPPORTED_TYPE
   */
  public static Builder unsupportedTypeError(final Throwable cause) {
    return new Builder(ErrorType.UNSUPPORTED_TYPE, cause);
  }

  public static Builder evaluationError() {
    return evaluationError(null);
  }

  /**
   * Wraps the passed exception inside an evaluation error. Used when a column
   * evaluator throws; if it threw a user exception, that exception is kept.
   *
   * @see ErrorType#EVALUATION
   */
  public static Builder evaluationError(final Throwable cause) {
    return new Builder(ErrorType.EVALUATION, cause);
  }

  public static Builder schemaMismatchError() {
    return new Builder(ErrorType.SCHEMA_MISMATCH, null);
  }

  public static Builder dataReadError() {
    return dataReadError(null);
  }

  /**
   * Wraps the passed exception inside a data read error.
   *
   * @see ErrorType#DATA_READ
   */
  public static Builder dataReadError(final Throwable cause) {
    return new Builder(ErrorType.DATA_READ, cause);
  }

  public static Builder validationError() {
    return new Builder(ErrorType.VALIDATION, null);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will first check if
   * this exception is, or wraps, a UserException. If it does then the builder will use the user exception as it is
   * (it will ignore the message passed to the constructor) and will add any additional context information to the
   * exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && format != null) {
        this.message = String.format(format, args);
      }
      return this;
    }

    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final double value) {
      context.add(name, value);
      return this;
    }

    public Builder pushContext(final String value) {
      context.push(value);
      return this;
    }

    public Builder pushContext(final String name, final String value) {
      context.push(name, value);
      return this;
    }

    public Builder pushContext(final String name, final long value) {
      context.push(name, value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one. New exceptions are
     * logged through the passed logger: system errors at ERROR, everything
     * else at INFO since those are caused by the query or its data.
     *
     * @param logger the logger of the class that raises the error
     * @return user exception
     */
    public UserException build(final org.slf4j.Logger logger) {
      if (uex != null) {
        return uex;
      }

      boolean isSystemError = errorType == ErrorType.SYSTEM;

      // make sure system errors use the root error message and display the root cause class name
      if (isSystemError && cause != null) {
        message = ErrorHelper.getRootMessage(cause);
      }

      final UserException newException = new UserException(this);

      if (isSystemError) {
        logger.error(newException.getMessage(), newException);
      } else {
        logger.info("User Error Occurred: {}", newException.getMessage(false));
        logger.debug("User Error Occurred", newException);
      }

      return newException;
    }

    public UserException build() {
      return build(logger);
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  public List<String> getContext() {
    return context.getContextList();
  }

  /**
   * generates the message that will be displayed to the caller without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return generateMessage(true);
  }

  public String getMessage(boolean includeErrorId) {
    return generateMessage(includeErrorId);
  }

  /**
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  /**
   * generates the message that will be displayed to the client. The message also contains the stack trace.
   *
   * @return verbose error message
   */
  public String getVerboseMessage() {
    return generateMessage(true) + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  /**
   * Generates a user error message that has the following structure:
   * ERROR TYPE ERROR: ERROR_MESSAGE
   * CONTEXT
   * [Error Id: ERROR_ID]
   */
  private String generateMessage(boolean includeErrorId) {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" +
        context.generateContextMessage(includeErrorId);
  }
}
