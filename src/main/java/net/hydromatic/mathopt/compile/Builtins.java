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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import net.hydromatic.mathopt.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recognizers that replace hand-written math with the equivalent GML
 * built-in function.
 *
 * <table>
 *   <caption>Conversions</caption>
 *   <tr><th>Before</th><th>After</th></tr>
 *   <tr><td>{@code x * x * x}</td><td>{@code power(x, 3)}</td></tr>
 *   <tr><td>{@code x * x}</td><td>{@code sqr(x)}</td></tr>
 *   <tr><td>{@code (a + b) / 2}, {@code (a + b) * 0.5}</td>
 *       <td>{@code mean(a, b)}</td></tr>
 *   <tr><td>{@code ln(x) / ln(2)}</td><td>{@code log2(x)}</td></tr>
 *   <tr><td>{@code ax * bx + ay * by}</td>
 *       <td>{@code dot_product(ax, ay, bx, by)}</td></tr>
 *   <tr><td>{@code power(x, 0.5)}, {@code power(x, 1 / 2)}</td>
 *       <td>{@code sqrt(x)}</td></tr>
 *   <tr><td>{@code power(2.718281828459045, x)}</td>
 *       <td>{@code exp(x)}</td></tr>
 * </table>
 *
 * <p>{@code x} in the first two rows must be a variable, member or array
 * element; a constant is left to the evaluator.
 */
public class Builtins {
  /** Distance from Euler's number within which a literal is taken as it. */
  private static final double EULER_TOLERANCE = 1e-9;

  private final String source;

  public Builtins(String source) {
    this.source = requireNonNull(source);
  }

  /** Returns the edit of the first conversion that matches, or null. */
  public @Nullable TextEdit match(Ast.Exp exp) {
    final String text;
    switch (exp.op) {
      case TIMES:
        text = firstNonNull(repeatedPower((Ast.InfixCall) exp),
            square((Ast.InfixCall) exp),
            mean((Ast.InfixCall) exp));
        break;
      case DIVIDE:
        text = firstNonNull(mean((Ast.InfixCall) exp),
            log2((Ast.InfixCall) exp));
        break;
      case PLUS:
        text = dotProduct((Ast.InfixCall) exp);
        break;
      case APPLY:
        text = firstNonNull(powerToSqrt((Ast.Apply) exp),
            powerToExp((Ast.Apply) exp));
        break;
      default:
        return null;
    }
    return text == null
        ? null
        : TextEdit.replace(exp.pos, text, TextEdit.Origin.BUILTIN);
  }

  private static @Nullable String firstNonNull(@Nullable String... texts) {
    for (String text : texts) {
      if (text != null) {
        return text;
      }
    }
    return null;
  }

  /** {@code x * x * x} to {@code power(x, 3)}; needs three or more factors. */
  @Nullable String repeatedPower(Ast.InfixCall call) {
    final List<Ast.Exp> factors = new ArrayList<>();
    flatten(call, Op.TIMES, factors);
    if (factors.size() <= 2 || !isSafeOperand(factors.get(0))) {
      return null;
    }
    final String base = text(factors.get(0));
    for (Ast.Exp factor : factors) {
      if (!text(factor).equals(base)) {
        return null;
      }
    }
    return "power(" + base + ", " + factors.size() + ")";
  }

  /** {@code x * x} to {@code sqr(x)}. */
  @Nullable String square(Ast.InfixCall call) {
    if (!isSafeOperand(call.a0) || !text(call.a0).equals(text(call.a1))) {
      return null;
    }
    return "sqr(" + text(call.a0) + ")";
  }

  /** Half of a sum of two terms to {@code mean(a, b)}. */
  @Nullable String mean(Ast.InfixCall call) {
    final Ast.Exp sum;
    if (call.op == Op.DIVIDE && isLiteral(call.a1, 2)) {
      sum = call.a0.stripParens();
    } else if (call.op == Op.TIMES && isLiteral(call.a1, 0.5)) {
      sum = call.a0.stripParens();
    } else if (call.op == Op.TIMES && isLiteral(call.a0, 0.5)) {
      sum = call.a1.stripParens();
    } else {
      return null;
    }
    if (sum.op != Op.PLUS) {
      return null;
    }
    final Ast.InfixCall plus = (Ast.InfixCall) sum;
    return "mean(" + text(plus.a0) + ", " + text(plus.a1) + ")";
  }

  /** {@code ln(x) / ln(2)} to {@code log2(x)}. */
  @Nullable String log2(Ast.InfixCall call) {
    final Ast.Exp numerator = call.a0.stripParens();
    final Ast.Exp denominator = call.a1.stripParens();
    if (!isCall(numerator, "ln", 1) || !isCall(denominator, "ln", 1)) {
      return null;
    }
    if (!isLiteral(((Ast.Apply) denominator).args.get(0), 2)) {
      return null;
    }
    return "log2(" + text(((Ast.Apply) numerator).args.get(0)) + ")";
  }

  /**
   * A sum of two or three products to {@code dot_product} or {@code
   * dot_product_3d}. The left operands of the products form the first vector,
   * the right operands the second.
   */
  @Nullable String dotProduct(Ast.InfixCall call) {
    final List<Ast.Exp> terms = new ArrayList<>();
    flatten(call, Op.PLUS, terms);
    if (terms.size() != 2 && terms.size() != 3) {
      return null;
    }
    final List<String> lefts = new ArrayList<>();
    final List<String> rights = new ArrayList<>();
    for (Ast.Exp term : terms) {
      if (term.op != Op.TIMES) {
        return null;
      }
      final Ast.InfixCall product = (Ast.InfixCall) term;
      lefts.add(text(product.a0));
      rights.add(text(product.a1));
    }
    final String name =
        terms.size() == 2 ? "dot_product" : "dot_product_3d";
    return name + "("
        + String.join(", ",
            ImmutableList.<String>builder().addAll(lefts).addAll(rights)
                .build())
        + ")";
  }

  /** {@code power(x, 0.5)} to {@code sqrt(x)}. */
  @Nullable String powerToSqrt(Ast.Apply apply) {
    if (!isCall(apply, "power", 2) || !isHalf(apply.args.get(1))) {
      return null;
    }
    return "sqrt(" + text(apply.args.get(0)) + ")";
  }

  /** {@code power(e, x)}, where e is Euler's number, to {@code exp(x)}. */
  @Nullable String powerToExp(Ast.Apply apply) {
    if (!isCall(apply, "power", 2)) {
      return null;
    }
    final Ast.Exp base = apply.args.get(0).stripParens();
    if (base.op != Op.REAL_LITERAL
        || Math.abs(((Ast.Literal) base).doubleValue() - Math.E)
            > EULER_TOLERANCE) {
      return null;
    }
    return "exp(" + text(apply.args.get(1)) + ")";
  }

  /** Returns the text of an operand without enclosing parentheses. */
  private String text(Ast.Exp exp) {
    return Parsers.trimOuterParentheses(exp.pos.text(source));
  }

  private static void flatten(Ast.Exp exp, Op op, List<Ast.Exp> operands) {
    final Ast.Exp e = exp.stripParens();
    if (e.op == op) {
      final Ast.InfixCall call = (Ast.InfixCall) e;
      flatten(call.a0, op, operands);
      flatten(call.a1, op, operands);
    } else {
      operands.add(e);
    }
  }

  private static boolean isCall(Ast.Exp exp, String name, int argCount) {
    return exp.op == Op.APPLY
        && ((Ast.Apply) exp).isCallTo(name)
        && ((Ast.Apply) exp).args.size() == argCount;
  }

  private static boolean isLiteral(Ast.Exp exp, double value) {
    final Ast.Exp e = exp.stripParens();
    return e.op == Op.REAL_LITERAL && ((Ast.Literal) e).doubleValue() == value;
  }

  /** Returns whether an expression is the literal 0.5 or {@code 1 / 2}. */
  private static boolean isHalf(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    if (isLiteral(e, 0.5)) {
      return true;
    }
    if (e.op != Op.DIVIDE) {
      return false;
    }
    final Ast.InfixCall call = (Ast.InfixCall) e;
    return isLiteral(call.a0, 1) && isLiteral(call.a1, 2);
  }

  /**
   * Returns whether an expression is a variable, member or array element
   * whose indices are themselves variables or literals, and therefore can be
   * evaluated twice without effect.
   */
  private static boolean isSafeOperand(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    switch (e.op) {
      case ID:
        return true;
      case DOT:
        return isSafeOperand(((Ast.Dot) e).exp);
      case INDEX:
        final Ast.Index index = (Ast.Index) e;
        if (!isSafeOperand(index.exp)) {
          return false;
        }
        for (Ast.Exp i : index.indices) {
          if (!isSafeOperand(i) && i.stripParens().op != Op.REAL_LITERAL) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }
}

// End Builtins.java
