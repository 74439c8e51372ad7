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

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.mathopt.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Renders {@link Components} as canonical source text. */
public class Rebuilder {
  /** Ulps by which a rounded coefficient may differ from the exact one. */
  private static final int ULP_TOLERANCE = 4;

  private final Prop.CoefficientPlacement placement;
  private final int precision;

  public Rebuilder(Map<Prop, Object> propMap) {
    this.placement =
        Prop.COEFFICIENT_PLACEMENT.enumValue(
            propMap, Prop.CoefficientPlacement.class);
    this.precision = Prop.COEFFICIENT_PRECISION.intValue(propMap);
  }

  /** Creates a Rebuilder with default properties. */
  public Rebuilder() {
    this(ImmutableMap.of());
  }

  /**
   * Returns the canonical text of a product, or null if it cannot be written
   * as a product (that is, if a factor has a negative exponent).
   *
   * <p>A coefficient that is zero to within {@code 1e-10} gives "0". A
   * coefficient of 1 is omitted unless there are no factors. Factors are
   * written in the order they were collected, each repeated as many times as
   * its exponent, and parenthesized if they contain a top-level {@code +} or
   * {@code -}.
   */
  public @Nullable String rebuild(Components components) {
    if (Math.abs(components.coefficient) < Components.TOLERANCE) {
      return "0";
    }
    if (components.hasNegativeExponent()) {
      return null;
    }
    final String coefficient = format(components.coefficient, precision);
    if (coefficient == null) {
      return null;
    }
    final List<String> terms = new ArrayList<>();
    components.factors.forEach(
        (factor, exponent) -> {
          final String term =
              Parsers.hasTopLevelAdditive(factor) ? "(" + factor + ")" : factor;
          for (int i = 0; i < exponent; i++) {
            terms.add(term);
          }
        });
    if (terms.isEmpty()) {
      return coefficient;
    }
    if (!coefficient.equals("1")) {
      if (suffix(components.coefficient)) {
        terms.add(coefficient);
      } else {
        terms.add(0, coefficient);
      }
    }
    return String.join(" * ", terms);
  }

  /** Returns whether a coefficient goes after the factors. */
  private boolean suffix(double coefficient) {
    switch (placement) {
      case PREFIX:
        return false;
      case FRACTION_SUFFIX:
        return coefficient > 0 && coefficient < 1;
      default:
        throw new AssertionError(placement);
    }
  }

  /**
   * Returns whether replacing {@code original} with {@code rebuilt} would
   * change nothing but enclosing parentheses and surrounding white space.
   */
  public static boolean isNoOp(String original, String rebuilt) {
    return Parsers.trimOuterParentheses(original)
        .equals(Parsers.trimOuterParentheses(rebuilt));
  }

  /**
   * Formats a number without trailing zeros or exponent. Returns null if the
   * number is not finite.
   *
   * <p>The text always parses back to {@code value}, or to a value within a
   * few units in the last place of it. If rounding to {@code precision}
   * significant digits stays that close, the rounded form is used, so that
   * 0.1 + 0.2 becomes "0.3"; otherwise the shortest form that round-trips is
   * used, so that 1 / 3 becomes "0.3333333333333333". Integral values are
   * never rounded; 1e20 becomes "100000000000000000000".
   */
  public static @Nullable String format(double value, int precision) {
    if (!Double.isFinite(value)) {
      return null;
    }
    if (value == 0) {
      return "0";
    }
    final BigDecimal exact = BigDecimal.valueOf(value);
    if (value != Math.rint(value)) {
      final BigDecimal rounded = exact.round(new MathContext(precision));
      if (Math.abs(rounded.doubleValue() - value)
          <= ULP_TOLERANCE * Math.ulp(value)) {
        return rounded.stripTrailingZeros().toPlainString();
      }
    }
    return exact.stripTrailingZeros().toPlainString();
  }
}

// End Rebuilder.java
