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

import java.util.Map;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import net.hydromatic.mathopt.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites an expression into canonical form.
 *
 * <p>First tries to collect the expression's {@link Components} and rebuild
 * them; if that fails, tries to condense the numeric factors of a chain of
 * multiplications and divisions. Returns no edit if neither succeeds, or if
 * the result is the same as the original text.
 *
 * <p>An expression that contains a comment is left alone, because rebuilding
 * it would drop the comment.
 */
public class Simplifier {
  private final String source;
  private final Collector collector;
  private final Rebuilder rebuilder;
  private final ScalarCondenser condenser;

  public Simplifier(String source, Map<Prop, Object> propMap) {
    this.source = requireNonNull(source);
    this.collector = new Collector(source);
    this.rebuilder = new Rebuilder(propMap);
    this.condenser =
        new ScalarCondenser(source,
            Prop.COEFFICIENT_PRECISION.intValue(propMap));
  }

  /** Returns an edit that simplifies an expression, or null. */
  public @Nullable TextEdit simplify(Ast.Exp exp) {
    if (isNumericLiteral(exp)) {
      return null;
    }
    final String original = exp.pos.text(source);
    if (Parsers.hasComment(original)) {
      return null;
    }
    final Components components = collector.collect(exp);
    if (components != null) {
      final String rebuilt = rebuilder.rebuild(components);
      if (rebuilt != null) {
        return Rebuilder.isNoOp(original, rebuilt)
            ? null
            : TextEdit.replace(exp.pos, rebuilt, TextEdit.Origin.SIMPLIFY);
      }
    }
    final String condensed = condenser.condense(exp);
    if (condensed == null || Rebuilder.isNoOp(original, condensed)) {
      return null;
    }
    return TextEdit.replace(exp.pos, condensed, TextEdit.Origin.CONDENSE);
  }

  /** Returns whether an expression is a number as written, such as "-0.5". */
  private static boolean isNumericLiteral(Ast.Exp exp) {
    final Ast.Exp e = exp.stripParens();
    switch (e.op) {
      case REAL_LITERAL:
        return true;
      case NEGATE:
      case POSITIVE:
        return ((Ast.PrefixCall) e).a.stripParens().op == Op.REAL_LITERAL;
      default:
        return false;
    }
  }
}

// End Simplifier.java
