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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import net.hydromatic.mathopt.ast.Visitor;
import net.hydromatic.mathopt.parse.Parsers;

/**
 * Runs the rewrite passes over a parsed program and composes the resulting
 * edits into new source text.
 *
 * <p>The order of passes is:
 *
 * <ol>
 *   <li>statement-list passes (half-rotation fusion, then dead updates) over
 *       every statement list, outermost first;
 *   <li>expression rewrites (patterns, then simplification) over every
 *       expression, outermost first;
 *   <li>composition of the edits;
 *   <li>text transformers over the composed text.
 * </ol>
 *
 * <p>An edit that overlaps one that was proposed earlier is dropped, so a
 * rewrite of an enclosing expression wins over rewrites of its operands.
 */
public class MathOptimizer {
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  public MathOptimizer(Map<Prop, Object> propMap, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Optimizes a program whose source text is {@code source}. */
  public Result optimize(String source, Ast.Program program) {
    final EditList edits = new EditList();
    final boolean halfRotations =
        Prop.FOLD_HALF_ROTATIONS.booleanValue(propMap);
    final boolean deadUpdates =
        Prop.ELIMINATE_DEAD_UPDATES.booleanValue(propMap);
    if (halfRotations || deadUpdates) {
      program.accept(
          new StatementListVisitor(source, edits, halfRotations, deadUpdates));
    }
    final boolean patterns = Prop.FOLD_PATTERNS.booleanValue(propMap);
    final boolean simplify = Prop.SIMPLIFY_EXPRESSIONS.booleanValue(propMap);
    if (patterns || simplify) {
      program.accept(new ExpressionVisitor(source, edits, patterns, simplify));
    }

    final EditComposer.Plan plan =
        EditComposer.plan(source.length(), edits.toList());
    plan.accepted.forEach(tracer::onEdit);
    plan.rejected.forEach(tracer::onConflict);
    String text = EditComposer.apply(source, plan.accepted);
    if (Prop.CANONICAL_TEXT_PASSES.booleanValue(propMap)) {
      text =
          TextTransformers.applyAll(
              TextTransformers.standard(propMap), text, tracer);
    }
    return new Result(source, text, plan.accepted, plan.rejected);
  }

  /** Visitor that runs the passes that work on lists of statements. */
  private class StatementListVisitor extends Visitor {
    private final EditList edits;
    private final Patterns patterns;
    private final DeadUpdates deadUpdates;
    private final boolean foldHalfRotations;
    private final boolean eliminateDeadUpdates;

    StatementListVisitor(String source, EditList edits,
        boolean foldHalfRotations, boolean eliminateDeadUpdates) {
      this.edits = edits;
      this.patterns = new Patterns(source, propMap);
      this.deadUpdates = new DeadUpdates(source);
      this.foldHalfRotations = foldHalfRotations;
      this.eliminateDeadUpdates = eliminateDeadUpdates;
    }

    @Override protected void visit(Ast.Program program) {
      process(program.statements);
      super.visit(program);
    }

    @Override protected void visit(Ast.Block block) {
      process(block.statements);
      super.visit(block);
    }

    @Override protected void visit(Ast.Case aCase) {
      process(aCase.statements);
      super.visit(aCase);
    }

    private void process(List<Ast.Stmt> statements) {
      if (foldHalfRotations) {
        for (int i = 0; i + 1 < statements.size(); i++) {
          final List<TextEdit> pair =
              patterns.halfRotation(statements.get(i), statements.get(i + 1));
          if (!pair.isEmpty()) {
            edits.tryAdd(pair.toArray(new TextEdit[0]));
          }
        }
      }
      if (eliminateDeadUpdates) {
        deadUpdates.analyze(statements, edits);
      }
    }
  }

  /** Visitor that rewrites expressions, outermost first. */
  private class ExpressionVisitor extends Visitor {
    private final String source;
    private final EditList edits;
    private final Patterns patterns;
    private final Simplifier simplifier;
    private final boolean foldPatterns;
    private final boolean simplify;

    ExpressionVisitor(String source, EditList edits, boolean foldPatterns,
        boolean simplify) {
      this.source = source;
      this.edits = edits;
      this.patterns = new Patterns(source, propMap);
      this.simplifier = new Simplifier(source, propMap);
      this.foldPatterns = foldPatterns;
      this.simplify = simplify;
    }

    @Override protected void visit(Ast.Declarator declarator) {
      if (declarator.init != null) {
        rewrite(declarator.init, false);
      }
      super.visit(declarator);
    }

    @Override protected void visit(Ast.Assign assign) {
      rewrite(assign.exp, false);
      super.visit(assign);
    }

    @Override protected void visit(Ast.If anIf) {
      rewrite(anIf.condition, true);
      super.visit(anIf);
    }

    @Override protected void visit(Ast.InfixCall infixCall) {
      rewrite(infixCall, false);
      super.visit(infixCall);
    }

    @Override protected void visit(Ast.Apply apply) {
      rewrite(apply, false);
      super.visit(apply);
    }

    /**
     * Proposes an edit for an expression. If the expression is the condition
     * of an {@code if} and was parenthesized, the replacement is too.
     */
    private void rewrite(Ast.Exp exp, boolean condition) {
      if (edits.overlaps(exp.pos.start, exp.pos.end)) {
        return;
      }
      if (foldPatterns) {
        final TextEdit edit = patterns.match(exp);
        if (edit != null && edits.tryAdd(separate(edit))) {
          return;
        }
      }
      if (simplify) {
        TextEdit edit = simplifier.simplify(exp);
        if (edit == null) {
          return;
        }
        if (condition
            && exp.op == Op.PAREN
            && !isParenthesized(edit.text)) {
          edit =
              TextEdit.of(edit.start, edit.end, "(" + edit.text + ")",
                  edit.origin);
        }
        edits.tryAdd(separate(edit));
      }
    }

    /**
     * Prefixes a space to an edit's text if the text would otherwise fuse
     * with the character before it into one token; for example, "-2 * b"
     * after "a-" must not become "a--2 * b".
     */
    private TextEdit separate(TextEdit edit) {
      if (edit.start == 0 || edit.text.isEmpty()) {
        return edit;
      }
      final char before = source.charAt(edit.start - 1);
      final char first = edit.text.charAt(0);
      if (isSign(before) && isSign(first)
          || isWordChar(before) && isWordChar(first)) {
        return TextEdit.of(edit.start, edit.end, " " + edit.text,
            edit.origin);
      }
      return edit;
    }
  }

  private static boolean isSign(char c) {
    return c == '+' || c == '-';
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }

  private static boolean isParenthesized(String text) {
    return !Parsers.trimOuterParentheses(text).equals(text);
  }

  /** Result of optimizing a program. */
  public static class Result {
    public final String source;
    public final String text;
    /** Edits that were applied, in offset order. */
    public final List<TextEdit> accepted;
    /** Edits that conflicted with an earlier edit, or were invalid. */
    public final List<TextEdit> rejected;

    Result(String source, String text, List<TextEdit> accepted,
        List<TextEdit> rejected) {
      this.source = requireNonNull(source);
      this.text = requireNonNull(text);
      this.accepted = ImmutableList.copyOf(accepted);
      this.rejected = ImmutableList.copyOf(rejected);
    }

    /** Returns whether the text differs from the source. */
    public boolean changed() {
      return !text.equals(source);
    }
  }
}

// End MathOptimizer.java
