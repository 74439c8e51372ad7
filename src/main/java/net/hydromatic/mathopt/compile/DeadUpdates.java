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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import net.hydromatic.mathopt.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds runs of updates to a variable that cancel out, such as
 * {@code x++; x--;} or {@code x += 2; x -= 2;}, and deletes them.
 *
 * <p>Works on one statement list at a time. A run for variable {@code v}
 * starts at the first update statement of {@code v}, accumulates the net
 * change of subsequent updates of {@code v}, and ends (is "flushed") when:
 *
 * <ul>
 *   <li>{@code v} is assigned with {@code =};
 *   <li>a plain assignment reads a variable that has a pending run, or calls
 *       a function;
 *   <li>any other kind of statement occurs;
 *   <li>the list ends.
 * </ul>
 *
 * <p>A flushed run whose net change is zero is deleted as a unit. Multiplying
 * or dividing by 1 is deleted on its own.
 */
public class DeadUpdates {
  private final String source;

  public DeadUpdates(String source) {
    this.source = requireNonNull(source);
  }

  /**
   * Analyzes a list of statements, adding deletions to {@code edits}, and
   * returns the runs that were found, in the order they ended.
   */
  public List<Run> analyze(List<? extends Ast.Stmt> statements,
      EditList edits) {
    final List<Run> runs = new ArrayList<>();
    final Map<String, Run> pending = new LinkedHashMap<>();
    for (int i = 0; i < statements.size(); i++) {
      final Ast.Stmt stmt = statements.get(i);
      final Ast.@Nullable Exp exp =
          stmt instanceof Ast.ExpStmt ? ((Ast.ExpStmt) stmt).exp : null;
      final @Nullable String name = exp == null ? null : updatedVariable(exp);
      final @Nullable Double delta = exp == null ? null : delta(exp);
      if (name != null && delta != null) {
        pending.computeIfAbsent(name, Run::new).add(i, delta);
        continue;
      }
      if (exp != null && name != null && isIdentityUpdate(exp)) {
        edits.tryAdd(
            TextEdit.deletion(source, stmt.pos,
                TextEdit.Origin.IDENTITY_UPDATE));
        continue;
      }
      if (exp != null && exp.op == Op.ASSIGN) {
        final Ast.Assign assign = (Ast.Assign) exp;
        final Ast.Exp target = assign.target.stripParens();
        final ReadFinder finder = new ReadFinder(pending.keySet());
        assign.exp.accept(finder);
        if (target.op != Op.ID) {
          // "a[i] = 0" reads "i"
          target.accept(finder);
        }
        if (!finder.found) {
          if (target.op == Op.ID) {
            final Run run = pending.remove(((Ast.Id) target).name);
            if (run != null) {
              flush(run, statements, edits, runs);
            }
          }
          continue;
        }
      }
      flushAll(pending, statements, edits, runs);
    }
    flushAll(pending, statements, edits, runs);
    return runs;
  }

  private void flushAll(Map<String, Run> pending,
      List<? extends Ast.Stmt> statements, EditList edits, List<Run> runs) {
    for (Run run : pending.values()) {
      flush(run, statements, edits, runs);
    }
    pending.clear();
  }

  private void flush(Run run, List<? extends Ast.Stmt> statements,
      EditList edits, List<Run> runs) {
    if (Math.abs(run.delta) < Components.TOLERANCE) {
      final List<TextEdit> deletions = new ArrayList<>();
      for (int index : run.statementIndices) {
        deletions.add(
            TextEdit.deletion(source, statements.get(index).pos,
                TextEdit.Origin.DEAD_UPDATE));
      }
      edits.tryAdd(deletions.toArray(new TextEdit[0]));
      run.state = State.FLUSHED;
    } else {
      run.state = State.DISCARDED;
    }
    runs.add(run);
  }

  /**
   * Returns the name of the variable that an expression statement updates,
   * or null if it is not an update of a plain variable.
   */
  private static @Nullable String updatedVariable(Ast.Exp exp) {
    final Ast.Exp target;
    if (exp.op.isUpdate()) {
      target = ((Ast.Update) exp).a.stripParens();
    } else if (exp instanceof Ast.Assign && exp.op != Op.ASSIGN) {
      target = ((Ast.Assign) exp).target.stripParens();
    } else {
      return null;
    }
    return target.op == Op.ID ? ((Ast.Id) target).name : null;
  }

  /**
   * Returns the change that an increment, decrement, {@code +=} or
   * {@code -=} makes to its variable, or null if it is not one of those or
   * the amount is not a constant.
   */
  private static @Nullable Double delta(Ast.Exp exp) {
    switch (exp.op) {
      case PRE_INCREMENT:
      case POST_INCREMENT:
        return 1d;
      case PRE_DECREMENT:
      case POST_DECREMENT:
        return -1d;
      case ASSIGN_PLUS:
      case ASSIGN_MINUS:
        final Double amount = Evaluator.evaluateNumber(((Ast.Assign) exp).exp);
        if (amount == null) {
          return null;
        }
        return exp.op == Op.ASSIGN_PLUS ? amount : -amount;
      default:
        return null;
    }
  }

  /** Returns whether an expression multiplies or divides by 1. */
  private static boolean isIdentityUpdate(Ast.Exp exp) {
    if (exp.op != Op.ASSIGN_TIMES && exp.op != Op.ASSIGN_DIVIDE) {
      return false;
    }
    final Double amount = Evaluator.evaluateNumber(((Ast.Assign) exp).exp);
    return amount != null && amount == 1;
  }

  /** State of a run of updates. */
  public enum State {
    /** Still collecting updates. */
    ACCUMULATING,
    /** Ended with net change zero; its statements are deleted. */
    FLUSHED,
    /** Ended with a net change; its statements are kept. */
    DISCARDED
  }

  /** Consecutive updates to one variable. */
  public static class Run {
    public final String variable;
    private final List<Integer> statementIndices = new ArrayList<>();
    private double delta;
    private State state = State.ACCUMULATING;

    Run(String variable) {
      this.variable = requireNonNull(variable);
    }

    void add(int index, double delta) {
      statementIndices.add(index);
      this.delta += delta;
    }

    /** Returns the net change. */
    public double delta() {
      return delta;
    }

    /** Returns the indices of the statements in the run. */
    public List<Integer> statementIndices() {
      return ImmutableList.copyOf(statementIndices);
    }

    public State state() {
      return state;
    }

    @Override
    public String toString() {
      return variable + statementIndices + " delta " + delta + " " + state;
    }
  }

  /**
   * Looks for reads of given variables, and for function calls, which might
   * read anything.
   */
  private static class ReadFinder extends Visitor {
    private final Set<String> names;
    boolean found;

    ReadFinder(Set<String> names) {
      this.names = names;
    }

    @Override
    protected void visit(Ast.Id id) {
      if (names.contains(id.name)) {
        found = true;
      }
    }

    @Override
    protected void visit(Ast.Apply apply) {
      found = true;
    }
  }
}

// End DeadUpdates.java
