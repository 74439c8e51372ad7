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
import java.util.Map;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import net.hydromatic.mathopt.ast.Visitor;
import net.hydromatic.mathopt.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Catalogue of algebraic rewrites that recognize a particular shape.
 *
 * <p>Each recognizer returns at most one edit (the half-rotation fusion, which
 * spans two statements, returns a pair). A shape that does not match returns
 * nothing; recognizers never throw.
 */
public class Patterns {
  private final String source;
  private final Collector collector;
  private final Rebuilder rebuilder;
  private final String rotationFunction;
  private final String distanceFunction;
  private final String distance2dFunction;
  private final @Nullable Builtins builtins;

  public Patterns(String source, Map<Prop, Object> propMap) {
    this.source = requireNonNull(source);
    this.collector = new Collector(source);
    this.rebuilder = new Rebuilder(propMap);
    this.rotationFunction = Prop.ROTATION_FUNCTION.stringValue(propMap);
    this.distanceFunction = Prop.DISTANCE_FUNCTION.stringValue(propMap);
    this.distance2dFunction = Prop.DISTANCE2D_FUNCTION.stringValue(propMap);
    this.builtins =
        Prop.CONVERT_MANUAL_MATH_TO_BUILTINS.booleanValue(propMap)
            ? new Builtins(source)
            : null;
  }

  /** Returns the edit of the first expression recognizer that matches. */
  public @Nullable TextEdit match(Ast.Exp exp) {
    if (Parsers.hasComment(exp.pos.text(source))) {
      return null;
    }
    TextEdit edit = reciprocalFold(exp);
    if (edit == null) {
      edit = sumOfSquares(exp);
    }
    if (edit == null) {
      edit = additiveIdentity(exp);
    }
    if (edit == null && builtins != null) {
      edit = builtins.match(exp);
    }
    return edit;
  }

  /**
   * Folds division by a reciprocal: {@code a / (1 / k)} becomes {@code a *
   * k}, where {@code k} is a numeric literal other than 0 or an opaque
   * factor.
   */
  public @Nullable TextEdit reciprocalFold(Ast.Exp exp) {
    if (exp.op != Op.DIVIDE) {
      return null;
    }
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    final Ast.Exp reciprocal = call.a1.stripParens();
    if (reciprocal.op != Op.DIVIDE) {
      return null;
    }
    final Ast.InfixCall inner = (Ast.InfixCall) reciprocal;
    final Double one = Evaluator.evaluateNumber(inner.a0);
    if (one == null || one != 1) {
      return null;
    }
    final Ast.Exp k = inner.a1.stripParens();
    if (k.op == Op.REAL_LITERAL) {
      if (((Ast.Literal) k).doubleValue() == 0) {
        return null;
      }
    } else if (!Collector.isOpaque(k)) {
      return null;
    }
    return TextEdit.replace(
        call.pos,
        call.a0.pos.text(source) + " * " + operandText(k),
        TextEdit.Origin.RECIPROCAL);
  }

  /**
   * Replaces the square root of a sum of two or three squares by a distance
   * function: {@code sqrt(a*a + b*b + c*c)} becomes {@code
   * point_distance_3d(0, 0, 0, a, b, c)} and {@code sqrt(a*a + b*b)} becomes
   * {@code point_distance(0, 0, a, b)}.
   *
   * <p>Each addend must be the product of two operands with the same text.
   */
  public @Nullable TextEdit sumOfSquares(Ast.Exp exp) {
    if (exp.op != Op.APPLY) {
      return null;
    }
    final Ast.Apply apply = (Ast.Apply) exp;
    if (!apply.isCallTo("sqrt") || apply.args.size() != 1) {
      return null;
    }
    final List<Ast.Exp> addends = new ArrayList<>();
    flattenSum(apply.args.get(0), addends);
    if (addends.size() != 2 && addends.size() != 3) {
      return null;
    }
    final List<String> operands = new ArrayList<>();
    for (Ast.Exp addend : addends) {
      if (addend.op != Op.TIMES) {
        return null;
      }
      final Ast.InfixCall square = (Ast.InfixCall) addend;
      final String t0 =
          Parsers.trimOuterParentheses(square.a0.pos.text(source));
      final String t1 =
          Parsers.trimOuterParentheses(square.a1.pos.text(source));
      if (!t0.equals(t1)) {
        return null;
      }
      operands.add(square.a0.pos.text(source).trim());
    }
    final String args = String.join(", ", operands);
    final String text =
        addends.size() == 3
            ? distanceFunction + "(0, 0, 0, " + args + ")"
            : distance2dFunction + "(0, 0, " + args + ")";
    return TextEdit.replace(apply.pos, text, TextEdit.Origin.SUM_OF_SQUARES);
  }

  private static void flattenSum(Ast.Exp exp, List<Ast.Exp> addends) {
    final Ast.Exp e = exp.stripParens();
    if (e.op == Op.PLUS) {
      final Ast.InfixCall call = (Ast.InfixCall) e;
      flattenSum(call.a0, addends);
      flattenSum(call.a1, addends);
    } else {
      addends.add(e);
    }
  }

  /**
   * Removes addition or subtraction of zero: {@code x + 0}, {@code 0 + x} and
   * {@code x - 0} become {@code x}. Zero must be a literal.
   */
  public @Nullable TextEdit additiveIdentity(Ast.Exp exp) {
    if (exp.op != Op.PLUS && exp.op != Op.MINUS) {
      return null;
    }
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    final Ast.Exp kept;
    if (isZeroLiteral(call.a1)) {
      kept = call.a0;
    } else if (exp.op == Op.PLUS && isZeroLiteral(call.a0)) {
      kept = call.a1;
    } else {
      return null;
    }
    if (kept.stripParens().op == Op.STRING_LITERAL) {
      return null;
    }
    return TextEdit.replace(
        call.pos, kept.pos.text(source), TextEdit.Origin.ADDITIVE_IDENTITY);
  }

  private static boolean isZeroLiteral(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    return e.op == Op.REAL_LITERAL && ((Ast.Literal) e).doubleValue() == 0;
  }

  /**
   * Fuses a declaration with the half-rotation adjustment that follows it.
   *
   * <pre>{@code
   * var s = <init>;
   * s = s - s / 2 - lengthdir_x(s / 2, angle);
   * }</pre>
   *
   * <p>becomes
   *
   * <pre>{@code
   * var s = <init * 0.5> * (1 - lengthdir_x(1, angle));
   * }</pre>
   *
   * <p>where {@code <init * 0.5>} is the canonical form of half the
   * initializer. Returns the edit to the initializer and the deletion of the
   * second statement, which must be applied together, or an empty list if the
   * statements do not match or the initializer cannot be collected.
   */
  public List<TextEdit> halfRotation(Ast.Stmt first, Ast.Stmt second) {
    if (!(first instanceof Ast.VarDecl) || !(second instanceof Ast.ExpStmt)) {
      return ImmutableList.of();
    }
    final Ast.VarDecl varDecl = (Ast.VarDecl) first;
    if (varDecl.declarators.size() != 1) {
      return ImmutableList.of();
    }
    final Ast.Declarator declarator = varDecl.declarators.get(0);
    final Ast.Exp init = declarator.init;
    if (init == null) {
      return ImmutableList.of();
    }
    final String name = declarator.id.name;
    final Ast.Exp exp = ((Ast.ExpStmt) second).exp;
    if (exp.op != Op.ASSIGN) {
      return ImmutableList.of();
    }
    final Ast.Assign assign = (Ast.Assign) exp;
    if (!isVariable(assign.target, name)) {
      return ImmutableList.of();
    }
    if (Parsers.hasComment(init.pos.text(source))
        || Parsers.hasComment(assign.pos.text(source))) {
      return ImmutableList.of();
    }
    final Ast.Exp angle = matchHalfRotation(assign.exp, name);
    if (angle == null || references(angle, name)) {
      // The fused initializer would read the variable before it exists
      return ImmutableList.of();
    }
    final Components components = collector.collect(init);
    if (components == null) {
      return ImmutableList.of();
    }
    final String half = rebuilder.rebuild(components.scale(0.5));
    if (half == null) {
      return ImmutableList.of();
    }
    final String text =
        half + " * (1 - " + rotationFunction + "(1, "
            + angle.pos.text(source) + "))";
    return ImmutableList.of(
        TextEdit.replace(init.pos, text, TextEdit.Origin.HALF_ROTATION),
        TextEdit.deletion(source, second.pos, TextEdit.Origin.HALF_ROTATION));
  }

  /**
   * If {@code exp} is {@code s - s / 2 - lengthdir_x(s / 2, angle)}, returns
   * {@code angle}; otherwise null.
   */
  private Ast.@Nullable Exp matchHalfRotation(Ast.Exp exp, String name) {
    final Ast.Exp e = exp.stripParens();
    if (e.op != Op.MINUS) {
      return null;
    }
    final Ast.InfixCall outer = (Ast.InfixCall) e;
    final Ast.Exp left = outer.a0.stripParens();
    if (left.op != Op.MINUS) {
      return null;
    }
    final Ast.InfixCall difference = (Ast.InfixCall) left;
    if (!isVariable(difference.a0, name) || !isHalf(difference.a1, name)) {
      return null;
    }
    final Ast.Exp right = outer.a1.stripParens();
    if (right.op != Op.APPLY) {
      return null;
    }
    final Ast.Apply apply = (Ast.Apply) right;
    if (!apply.isCallTo(rotationFunction)
        || apply.args.size() != 2
        || !isHalf(apply.args.get(0), name)) {
      return null;
    }
    return apply.args.get(1);
  }

  /** Returns whether an expression is {@code name / 2}. */
  private static boolean isHalf(Ast.Exp exp, String name) {
    final Ast.Exp e = exp.stripParens();
    if (e.op != Op.DIVIDE) {
      return false;
    }
    final Ast.InfixCall call = (Ast.InfixCall) e;
    final Double divisor = Evaluator.evaluateNumber(call.a1);
    return isVariable(call.a0, name) && divisor != null && divisor == 2;
  }

  private static boolean isVariable(Ast.Exp exp, String name) {
    final Ast.Exp e = exp.stripParens();
    return e.op == Op.ID && ((Ast.Id) e).name.equals(name);
  }

  /** Returns whether an expression mentions a variable. */
  private static boolean references(Ast.Exp exp, String name) {
    final ReferenceFinder finder = new ReferenceFinder(name);
    exp.accept(finder);
    return finder.found;
  }

  /** Returns the text of an operand, parenthesized if it is a sum. */
  private String operandText(Ast.Exp exp) {
    final String text = Parsers.trimOuterParentheses(exp.pos.text(source));
    return Parsers.hasTopLevelAdditive(text) ? "(" + text + ")" : text;
  }

  /** Looks for an identifier with a given name. */
  private static class ReferenceFinder extends Visitor {
    private final String name;
    boolean found;

    ReferenceFinder(String name) {
      this.name = name;
    }

    @Override
    protected void visit(Ast.Id id) {
      if (id.name.equals(name)) {
        found = true;
      }
    }
  }
}

// End Patterns.java
