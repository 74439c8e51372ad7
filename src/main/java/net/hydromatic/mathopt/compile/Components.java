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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Product of a numeric coefficient and opaque factors raised to integer
 * exponents.
 *
 * <p>For example, {@code 3 * a * b / a / a} is coefficient 3 with factors
 * {@code {a: -1, b: 1}}. Factors are keyed by their source text and keep the
 * order in which they were first seen. A factor whose exponent is zero is not
 * retained.
 */
public final class Components {
  static final double TOLERANCE = 1e-10;

  public final double coefficient;
  public final ImmutableMap<String, Integer> factors;

  private Components(double coefficient,
      ImmutableMap<String, Integer> factors) {
    this.coefficient = coefficient;
    this.factors = requireNonNull(factors);
  }

  /** Creates a product with a coefficient and no factors. */
  public static Components of(double coefficient) {
    return new Components(coefficient, ImmutableMap.of());
  }

  /** Creates a product with a coefficient and the given factors. */
  public static Components of(double coefficient,
      Map<String, Integer> factors) {
    return new Components(coefficient, nonZero(factors));
  }

  /** Creates a product consisting of one factor. */
  public static Components factor(String text) {
    return new Components(1, ImmutableMap.of(text, 1));
  }

  private static ImmutableMap<String, Integer> nonZero(
      Map<String, Integer> factors) {
    final ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
    factors.forEach(
        (factor, exponent) -> {
          if (exponent != 0) {
            b.put(factor, exponent);
          }
        });
    return b.build();
  }

  /** Returns the product of this and another. */
  public Components times(Components o) {
    return combine(o, 1, coefficient * o.coefficient);
  }

  /** Returns the quotient of this and another. */
  public Components divide(Components o) {
    return combine(o, -1, coefficient / o.coefficient);
  }

  private Components combine(Components o, int sign, double coefficient) {
    final Map<String, Integer> map = new LinkedHashMap<>(factors);
    o.factors.forEach(
        (factor, exponent) -> map.merge(factor, sign * exponent, Integer::sum));
    return of(coefficient, map);
  }

  /** Returns this product with its coefficient negated. */
  public Components negate() {
    return new Components(-coefficient, factors);
  }

  /** Returns this product with its coefficient multiplied by a number. */
  public Components scale(double multiplier) {
    return new Components(coefficient * multiplier, factors);
  }

  /** Returns whether any factor has a negative exponent. */
  public boolean hasNegativeExponent() {
    return factors.values().stream().anyMatch(exponent -> exponent < 0);
  }

  /**
   * Returns whether this product is the same as another: coefficients that
   * differ by less than {@code 1e-10} and the same factors with the same
   * exponents, in any order.
   */
  public boolean isEquivalentTo(Components o) {
    return Math.abs(coefficient - o.coefficient) < TOLERANCE
        && factors.equals(o.factors);
  }

  @Override
  public int hashCode() {
    return Objects.hash(coefficient, factors);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Components
            && coefficient == ((Components) o).coefficient
            && factors.equals(((Components) o).factors);
  }

  @Override
  public String toString() {
    return "{" + coefficient + ", " + factors + "}";
  }
}

// End Components.java
