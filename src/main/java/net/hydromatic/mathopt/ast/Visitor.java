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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  /** Visits a node if it is not null. */
  protected void acceptNullable(@Nullable AstNode node) {
    if (node != null) {
      node.accept(this);
    }
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.Paren paren) {
    paren.exp.accept(this);
  }

  protected void visit(Ast.Conditional conditional) {
    conditional.condition.accept(this);
    conditional.ifTrue.accept(this);
    conditional.ifFalse.accept(this);
  }

  protected void visit(Ast.ArrayLiteral arrayLiteral) {
    arrayLiteral.elements.forEach(this::accept);
  }

  protected void visit(Ast.StructLiteral structLiteral) {
    structLiteral.values.forEach(this::accept);
  }

  protected void visit(Ast.Fn fn) {
    fn.params.forEach(this::accept);
    fn.body.accept(this);
  }

  // calls

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  protected void visit(Ast.Update update) {
    update.a.accept(this);
  }

  protected void visit(Ast.Assign assign) {
    assign.target.accept(this);
    assign.exp.accept(this);
  }

  protected void visit(Ast.Apply apply) {
    apply.fn.accept(this);
    apply.args.forEach(this::accept);
  }

  protected void visit(Ast.Dot dot) {
    dot.exp.accept(this);
  }

  protected void visit(Ast.Index index) {
    index.exp.accept(this);
    index.indices.forEach(this::accept);
  }

  // statements

  protected void visit(Ast.Declarator declarator) {
    acceptNullable(declarator.init);
  }

  protected void visit(Ast.VarDecl varDecl) {
    varDecl.declarators.forEach(this::accept);
  }

  protected void visit(Ast.EnumDecl enumDecl) {
    enumDecl.members.forEach(this::accept);
  }

  protected void visit(Ast.ExpStmt expStmt) {
    expStmt.exp.accept(this);
  }

  protected void visit(Ast.Block block) {
    block.statements.forEach(this::accept);
  }

  protected void visit(Ast.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    acceptNullable(anIf.ifFalse);
  }

  protected void visit(Ast.Loop loop) {
    loop.exp.accept(this);
    loop.body.accept(this);
  }

  protected void visit(Ast.DoUntil doUntil) {
    doUntil.body.accept(this);
    doUntil.condition.accept(this);
  }

  protected void visit(Ast.For aFor) {
    acceptNullable(aFor.init);
    acceptNullable(aFor.condition);
    acceptNullable(aFor.step);
    aFor.body.accept(this);
  }

  protected void visit(Ast.Switch aSwitch) {
    aSwitch.exp.accept(this);
    aSwitch.cases.forEach(this::accept);
  }

  protected void visit(Ast.Case aCase) {
    acceptNullable(aCase.test);
    aCase.statements.forEach(this::accept);
  }

  protected void visit(Ast.Return aReturn) {
    acceptNullable(aReturn.exp);
  }

  protected void visit(Ast.Throw aThrow) {
    aThrow.exp.accept(this);
  }

  protected void visit(Ast.Try aTry) {
    aTry.body.accept(this);
    acceptNullable(aTry.catchBody);
    acceptNullable(aTry.finallyBody);
  }

  protected void visit(Ast.Jump jump) {}

  protected void visit(Ast.FunDecl funDecl) {
    funDecl.fn.accept(this);
  }

  protected void visit(Ast.Program program) {
    program.statements.forEach(this::accept);
  }
}

// End Visitor.java
