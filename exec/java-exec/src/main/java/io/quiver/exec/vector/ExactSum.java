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
package io.quiver.exec.vector;

import java.math.BigDecimal;

/**
 * Sum of doubles kept exactly in a {@link BigDecimal}, so the result does not
 * depend on the order of the addends. Non-finite addends follow IEEE rules:
 * any NaN, or infinities of both signs, make the sum NaN.
 */
public final class ExactSum {

  private BigDecimal finite = BigDecimal.ZERO;
  private boolean nan;
  private boolean positiveInfinity;
  private boolean negativeInfinity;

  public void add(double value) {
    if (Double.isNaN(value)) {
      nan = true;
    } else if (value == Double.POSITIVE_INFINITY) {
      positiveInfinity = true;
    } else if (value == Double.NEGATIVE_INFINITY) {
      negativeInfinity = true;
    } else {
      finite = finite.add(new BigDecimal(value));
    }
  }

  public void add(ExactSum other) {
    finite = finite.add(other.finite);
    nan |= other.nan;
    positiveInfinity |= other.positiveInfinity;
    negativeInfinity |= other.negativeInfinity;
  }

  /**
   * @return the exact sum rounded to the nearest double
   */
  public double doubleValue() {
    if (nan || (positiveInfinity && negativeInfinity)) {
      return Double.NaN;
    }
    if (positiveInfinity) {
      return Double.POSITIVE_INFINITY;
    }
    if (negativeInfinity) {
      return Double.NEGATIVE_INFINITY;
    }
    return finite.doubleValue();
  }
}
