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

import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates constant expressions.
 *
 * <p>The evaluator is total: an expression that is not constant, or whose
 * value is not a finite number or a boolean, evaluates to null. So does
 * division by zero.
 */
public abstract class Evaluator {
  private Evaluator() {}

  /** Returns the value of an expression, or null if it is not constant. */
  public static @Nullable Scalar evaluate(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    switch (e.op) {
      case REAL_LITERAL:
        return number(((Ast.Literal) e).doubleValue());

      case BOOL_LITERAL:
        return Scalar.of((Boolean) ((Ast.Literal) e).value);

      case NEGATE:
      case POSITIVE:
      case NOT:
      case BIT_NOT:
        return prefix((Ast.PrefixCall) e);

      case ANDALSO:
      case ORELSE:
      case XOR:
        return logical((Ast.InfixCall) e);

      case TIMES:
      case DIVIDE:
      case DIV:
      case MOD:
      case PLUS:
      case MINUS:
      case SHIFT_LEFT:
      case SHIFT_RIGHT:
      case BIT_AND:
      case BIT_XOR:
      case BIT_OR:
      case LT:
      case LE:
      case GT:
      case GE:
      case EQ:
      case NE:
        return binary((Ast.InfixCall) e);

      default:
        return null;
    }
  }

  /**
   * Returns the value of an expression if it is a constant number, otherwise
   * null.
   */
  public static @Nullable Double evaluateNumber(Ast.Exp exp) {
    final Scalar scalar = evaluate(exp);
    return scalar != null && scalar.isNumber() ? scalar.doubleValue() : null;
  }

  private static @Nullable Scalar prefix(Ast.PrefixCall call) {
    final Scalar a = evaluate(call.a);
    if (a == null) {
      return null;
    }
    switch (call.op) {
      case NOT:
        return Scalar.of(!a.isTruthy());
      case NEGATE:
        return a.isNumber() ? number(-a.doubleValue()) : null;
      case POSITIVE:
        return a.isNumber() ? a : null;
      case BIT_NOT:
        return a.isNumber() ? number(~(long) a.doubleValue()) : null;
      default:
        throw new AssertionError(call.op);
    }
  }

  /**
   * Evaluates "and", "or" and "xor". The first two short-circuit: if either
   * operand decides the result, the other need not be constant.
   */
  private static @Nullable Scalar logical(Ast.InfixCall call) {
    final Scalar a0 = evaluate(call.a0);
    final Scalar a1 = evaluate(call.a1);
    switch (call.op) {
      case ANDALSO:
        if (a0 != null && !a0.isTruthy() || a1 != null && !a1.isTruthy()) {
          return Scalar.FALSE;
        }
        return a0 != null && a1 != null ? Scalar.TRUE : null;
      case ORELSE:
        if (a0 != null && a0.isTruthy() || a1 != null && a1.isTruthy()) {
          return Scalar.TRUE;
        }
        return a0 != null && a1 != null ? Scalar.FALSE : null;
      case XOR:
        return a0 != null && a1 != null
            ? Scalar.of(a0.isTruthy() != a1.isTruthy())
            : null;
      default:
        throw new AssertionError(call.op);
    }
  }

  private static @Nullable Scalar binary(Ast.InfixCall call) {
    final Scalar a0 = evaluate(call.a0);
    if (a0 == null) {
      return null;
    }
    final Scalar a1 = evaluate(call.a1);
    if (a1 == null) {
      return null;
    }
    if (call.op == Op.EQ || call.op == Op.NE) {
      if (a0.isNumber() != a1.isNumber()) {
        return null;
      }
      final boolean equal =
          a0.isNumber()
              ? a0.doubleValue() == a1.doubleValue()
              : a0.equals(a1);
      return Scalar.of(equal == (call.op == Op.EQ));
    }
    if (!a0.isNumber() || !a1.isNumber()) {
      // no arithmetic on booleans
      return null;
    }
    final double x = a0.doubleValue();
    final double y = a1.doubleValue();
    switch (call.op) {
      case PLUS:
        return number(x + y);
      case MINUS:
        return number(x - y);
      case TIMES:
        return number(x * y);
      case DIVIDE:
        return y == 0 ? null : number(x / y);
      case DIV:
        return y == 0 ? null : number((long) (x / y));
      case MOD:
        return y == 0 ? null : number(x % y);
      case BIT_AND:
        return number((long) x & (long) y);
      case BIT_OR:
        return number((long) x | (long) y);
      case BIT_XOR:
        return number((long) x ^ (long) y);
      case SHIFT_LEFT:
        return number((long) x << (long) y);
      case SHIFT_RIGHT:
        return number((long) x >> (long) y);
      case LT:
        return Scalar.of(x < y);
      case LE:
        return Scalar.of(x <= y);
      case GT:
        return Scalar.of(x > y);
      case GE:
        return Scalar.of(x >= y);
      default:
        throw new AssertionError(call.op);
    }
  }

  private static @Nullable Scalar number(double value) {
    return Double.isFinite(value) ? Scalar.of(value) : null;
  }
}

// End Evaluator.java
