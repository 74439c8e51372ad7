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

import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import net.hydromatic.mathopt.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Breaks a multiplicative expression into {@link Components}.
 *
 * <p>Collection never guesses. A shape it does not understand, anywhere in the
 * expression, makes the whole collection fail.
 */
public class Collector {
  private final String source;

  public Collector(String source) {
    this.source = requireNonNull(source);
  }

  /**
   * Collects the coefficient and factors of an expression, or returns null.
   *
   * <ol>
   *   <li>A constant number is a coefficient with no factors;
   *   <li>an opaque factor (see {@link #isOpaque}) is coefficient 1 and
   *       itself, keyed by its source text without enclosing parentheses;
   *   <li>negation negates the coefficient of its operand;
   *   <li>{@code *} and {@code /} combine the components of their operands.
   * </ol>
   */
  public @Nullable Components collect(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    final Double value = Evaluator.evaluateNumber(e);
    if (value != null) {
      return Components.of(value);
    }
    if (isOpaque(e)) {
      final String text = e.pos.text(source);
      return Components.factor(Parsers.trimOuterParentheses(text));
    }
    switch (e.op) {
      case NEGATE:
        final Components c = collect(((Ast.PrefixCall) e).a);
        return c == null ? null : c.negate();

      case TIMES:
      case DIVIDE:
        final Ast.InfixCall call = (Ast.InfixCall) e;
        final Components c0 = collect(call.a0);
        if (c0 == null) {
          return null;
        }
        final Components c1 = collect(call.a1);
        if (c1 == null) {
          return null;
        }
        if (call.op == Op.DIVIDE && c1.coefficient == 0) {
          return null;
        }
        final Components result =
            call.op == Op.TIMES ? c0.times(c1) : c0.divide(c1);
        return Double.isFinite(result.coefficient) ? result : null;

      default:
        return null;
    }
  }

  /**
   * Returns whether an expression is a unit that the rebuilder can reproduce
   * verbatim: an identifier, member access, index access or call, the
   * negation of one of those, or the sum or difference of two of those.
   */
  public static boolean isOpaque(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    switch (e.op) {
      case ID:
      case DOT:
      case INDEX:
      case APPLY:
        return true;
      case NEGATE:
        return isOpaque(((Ast.PrefixCall) e).a);
      case PLUS:
      case MINUS:
        final Ast.InfixCall call = (Ast.InfixCall) e;
        return isOpaque(call.a0) && isOpaque(call.a1);
      default:
        return false;
    }
  }
}

// End Collector.java
