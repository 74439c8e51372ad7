/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.mathopt.compile;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/**
 * Value of a constant expression: a number or a boolean.
 *
 * <p>Numbers are always finite.
 */
public final class Scalar {
  public static final Scalar TRUE = new Scalar(true);
  public static final Scalar FALSE = new Scalar(false);

  @SuppressWarnings("rawtypes")
  private final Comparable value;

  private Scalar(double value) {
    checkArgument(Double.isFinite(value), "not finite: %s", value);
    this.value = value;
  }

  private Scalar(boolean value) {
    this.value = value;
  }

  /** Creates a numeric scalar. */
  public static Scalar of(double value) {
    return new Scalar(value);
  }

  /** Returns the boolean scalar. */
  public static Scalar of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean isNumber() {
    return value instanceof Double;
  }

  public boolean isBoolean() {
    return value instanceof Boolean;
  }

  /** Returns the value of a numeric scalar. */
  public double doubleValue() {
    checkArgument(isNumber(), "not a number: %s", value);
    return (Double) value;
  }

  /**
   * Returns whether this value counts as true in a condition. A boolean is
   * itself; a number is true if it is greater than 0.5.
   */
  public boolean isTruthy() {
    return isBoolean() ? (Boolean) value : (Double) value > 0.5;
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Scalar && Objects.equals(value, ((Scalar) o).value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}

// End Scalar.java
