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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Folds the numeric factors of a chain of multiplications and divisions whose
 * other operands cannot be collected, for example {@code ((hp / max_hp) * 100)
 * / 10} to {@code (hp / max_hp) * 10}.
 *
 * <p>The chain is flattened into numerator and denominator terms. A division
 * whose right operand is not a constant number is kept whole, as one term.
 * Non-numeric terms are copied verbatim, in their original order, and the
 * folded coefficient is written last.
 */
public class ScalarCondenser {
  private final String source;
  private final int precision;

  public ScalarCondenser(String source, int precision) {
    this.source = requireNonNull(source);
    this.precision = precision;
  }

  /** Returns the condensed text of an expression, or null. */
  public @Nullable String condense(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    if (e.op != Op.TIMES && e.op != Op.DIVIDE) {
      return null;
    }
    final Chain chain = new Chain();
    chain.add(e, false);

    final List<String> terms = new ArrayList<>();
    double coefficient = 1;
    int numericCount = 0;
    int significantCount = 0;
    for (Ast.Exp term : chain.numerators) {
      final Double value = Evaluator.evaluateNumber(term);
      if (value == null) {
        terms.add(term.pos.text(source));
        continue;
      }
      coefficient *= value;
      ++numericCount;
      if (Math.abs(value) != 1) {
        ++significantCount;
      }
    }
    for (Ast.Exp term : chain.denominators) {
      final Double value = Evaluator.evaluateNumber(term);
      if (value == null || value == 0) {
        return null;
      }
      coefficient /= value;
      ++numericCount;
      if (Math.abs(value) != 1) {
        ++significantCount;
      }
    }
    if (terms.isEmpty() || numericCount == 0) {
      return null;
    }
    final boolean unit =
        Math.abs(Math.abs(coefficient) - 1) < Components.TOLERANCE;
    if (significantCount < 2 && !unit) {
      // "x * 2" is already as short as it gets
      return null;
    }
    final String product = String.join(" * ", terms);
    if (unit) {
      return coefficient > 0 ? product : "-" + product;
    }
    final String text = Rebuilder.format(coefficient, precision);
    if (text == null || text.equals("0")) {
      return null;
    }
    return product + " * " + text;
  }

  /** Numerator and denominator terms of a flattened chain. */
  private static class Chain {
    final List<Ast.Exp> numerators = new ArrayList<>();
    final List<Ast.Exp> denominators = new ArrayList<>();

    void add(Ast.Exp exp, boolean denominator) {
      final Ast.Exp e = exp.stripParens();
      if (Evaluator.evaluateNumber(e) == null
          && (e.op == Op.TIMES || e.op == Op.DIVIDE)) {
        final Ast.InfixCall call = (Ast.InfixCall) e;
        if (call.op == Op.DIVIDE
            && Evaluator.evaluateNumber(call.a1) == null) {
          push(exp, denominator);
          return;
        }
        add(call.a0, denominator);
        add(call.a1, call.op == Op.DIVIDE != denominator);
        return;
      }
      push(exp, denominator);
    }

    private void push(Ast.Exp exp, boolean denominator) {
      (denominator ? denominators : numerators).add(exp);
    }
  }
}

// End ScalarCondenser.java
