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
package net.hydromatic.mathopt.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a numeric literal. */
  public Ast.Literal realLiteral(Pos pos, double value, String text) {
    return new Ast.Literal(pos, Op.REAL_LITERAL, value, text);
  }

  /** Creates a {@code bool} literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean b, String text) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, b, text);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value, String text) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value, text);
  }

  /** Creates an {@code undefined} literal. */
  public Ast.Literal undefinedLiteral(Pos pos, String text) {
    return new Ast.Literal(pos, Op.UNDEFINED_LITERAL, text, text);
  }

  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos.plus(a.pos), op, a);
  }

  public Ast.InfixCall infixCall(Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(a0.pos.plus(a1.pos), op, a0, a1);
  }

  public Ast.Update update(Pos pos, Op op, Ast.Exp a) {
    return new Ast.Update(pos.plus(a.pos), op, a);
  }

  public Ast.Assign assign(Op op, Ast.Exp target, Ast.Exp exp) {
    return new Ast.Assign(target.pos.plus(exp.pos), op, target, exp);
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, List<Ast.Exp> args) {
    return new Ast.Apply(fn.pos.plus(pos), fn, ImmutableList.copyOf(args));
  }

  public Ast.Dot dot(Pos pos, Ast.Exp exp, String name) {
    return new Ast.Dot(exp.pos.plus(pos), exp, name);
  }

  public Ast.Index index(
      Pos pos, Ast.Exp exp, String accessor, List<Ast.Exp> indices) {
    return new Ast.Index(
        exp.pos.plus(pos), exp, accessor, ImmutableList.copyOf(indices));
  }

  public Ast.Paren paren(Pos pos, Ast.Exp exp) {
    return new Ast.Paren(pos, exp);
  }

  public Ast.Conditional conditional(
      Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.Conditional(
        condition.pos.plus(ifFalse.pos), condition, ifTrue, ifFalse);
  }

  public Ast.ArrayLiteral arrayLiteral(Pos pos, List<Ast.Exp> elements) {
    return new Ast.ArrayLiteral(pos, ImmutableList.copyOf(elements));
  }

  public Ast.StructLiteral structLiteral(
      Pos pos, List<String> names, List<Ast.Exp> values) {
    return new Ast.StructLiteral(
        pos, ImmutableList.copyOf(names), ImmutableList.copyOf(values));
  }

  public Ast.Fn fn(
      Pos pos,
      @Nullable String name,
      List<Ast.Declarator> params,
      boolean constructor,
      Ast.Block body) {
    return new Ast.Fn(
        pos, name, ImmutableList.copyOf(params), constructor, body);
  }

  public Ast.Declarator declarator(Pos pos, Ast.Id id, Ast.@Nullable Exp init) {
    return new Ast.Declarator(pos, id, init);
  }

  public Ast.VarDecl varDecl(
      Pos pos, String keyword, List<Ast.Declarator> declarators) {
    return new Ast.VarDecl(pos, keyword, ImmutableList.copyOf(declarators));
  }

  public Ast.EnumDecl enumDecl(
      Pos pos, String name, List<Ast.Declarator> members) {
    return new Ast.EnumDecl(pos, name, ImmutableList.copyOf(members));
  }

  public Ast.ExpStmt expStmt(Pos pos, Ast.Exp exp) {
    return new Ast.ExpStmt(pos, exp);
  }

  public Ast.Block block(Pos pos, List<Ast.Stmt> statements) {
    return new Ast.Block(pos, ImmutableList.copyOf(statements));
  }

  public Ast.If ifStmt(
      Pos pos, Ast.Exp condition, Ast.Stmt ifTrue, Ast.@Nullable Stmt ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  /** Creates a "while", "repeat" or "with" statement. */
  public Ast.Loop loop(Pos pos, Op op, Ast.Exp exp, Ast.Stmt body) {
    return new Ast.Loop(pos, op, exp, body);
  }

  public Ast.DoUntil doUntil(Pos pos, Ast.Stmt body, Ast.Exp condition) {
    return new Ast.DoUntil(pos, body, condition);
  }

  public Ast.For forStmt(
      Pos pos,
      Ast.@Nullable Stmt init,
      Ast.@Nullable Exp condition,
      Ast.@Nullable Exp step,
      Ast.Stmt body) {
    return new Ast.For(pos, init, condition, step, body);
  }

  public Ast.Switch switchStmt(Pos pos, Ast.Exp exp, List<Ast.Case> cases) {
    return new Ast.Switch(pos, exp, ImmutableList.copyOf(cases));
  }

  public Ast.Case caseClause(
      Pos pos, Ast.@Nullable Exp test, List<Ast.Stmt> statements) {
    return new Ast.Case(pos, test, ImmutableList.copyOf(statements));
  }

  public Ast.Return returnStmt(Pos pos, Ast.@Nullable Exp exp) {
    return new Ast.Return(pos, exp);
  }

  public Ast.Throw throwStmt(Pos pos, Ast.Exp exp) {
    return new Ast.Throw(pos, exp);
  }

  public Ast.Try tryStmt(
      Pos pos,
      Ast.Block body,
      Ast.@Nullable Id catchId,
      Ast.@Nullable Block catchBody,
      Ast.@Nullable Block finallyBody) {
    return new Ast.Try(pos, body, catchId, catchBody, finallyBody);
  }

  /** Creates an "exit", "break" or "continue" statement. */
  public Ast.Jump jump(Pos pos, Op op) {
    return new Ast.Jump(pos, op);
  }

  public Ast.FunDecl funDecl(Pos pos, Ast.Fn fn) {
    return new Ast.FunDecl(pos, fn);
  }

  public Ast.Program program(Pos pos, List<Ast.Stmt> statements) {
    return new Ast.Program(pos, ImmutableList.copyOf(statements));
  }
}

// End AstBuilder.java
