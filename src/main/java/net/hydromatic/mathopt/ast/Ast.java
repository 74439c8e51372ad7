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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /**
     * Returns the expression inside any number of enclosing parentheses; this
     * expression if it is not parenthesized.
     */
    public Exp stripParens() {
      return this;
    }
  }

  /** Base class for a statement. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Identifier, for example "x" or "global". */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /**
   * Literal: a number, string, boolean or {@code undefined}.
   *
   * <p>{@link #text} is the literal as it was spelled, for example "$FF";
   * {@link #value} is its value, for example 255.0. The value of a numeric
   * literal is a {@link Double}, of a boolean literal a {@link Boolean}, and of
   * string and undefined literals a {@link String}.
   */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;
    public final String text;

    Literal(Pos pos, Op op, Comparable value, String text) {
      super(pos, op);
      this.value = requireNonNull(value);
      this.text = requireNonNull(text);
      checkArgument(
          op == Op.REAL_LITERAL && value instanceof Double
              || op == Op.BOOL_LITERAL && value instanceof Boolean
              || op == Op.STRING_LITERAL && value instanceof String
              || op == Op.UNDEFINED_LITERAL);
    }

    /** Returns whether this is a numeric literal. */
    public boolean isNumber() {
      return op == Op.REAL_LITERAL;
    }

    /** Returns the value of a numeric literal. */
    public double doubleValue() {
      checkArgument(isNumber(), "not a number: %s", text);
      return (Double) value;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(text);
    }
  }

  /** Call to a prefix operator, for example "-x" or "!done". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /** Call to an infix operator, for example "a * b" or "x mod 2". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(Op.INFIX.contains(op) || op == Op.NULLISH);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Increment or decrement, for example "x++" or "--count". */
  public static class Update extends Exp {
    public final Exp a;

    Update(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
      checkArgument(op.isUpdate());
    }

    /** Returns whether the operator follows its operand. */
    public boolean isPostfix() {
      return op == Op.POST_INCREMENT || op == Op.POST_DECREMENT;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return isPostfix()
          ? w.postfix(left, a, op, right)
          : w.prefix(left, op, a, right);
    }
  }

  /** Assignment, for example "x = 1" or "total += delta". */
  public static class Assign extends Exp {
    public final Exp target;
    public final Exp exp;

    Assign(Pos pos, Op op, Exp target, Exp exp) {
      super(pos, op);
      this.target = requireNonNull(target);
      this.exp = requireNonNull(exp);
      checkArgument(Op.ASSIGNMENTS.contains(op));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, target, op, exp, right);
    }
  }

  /** Function call, for example "sqrt(x)". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Apply(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    /** Returns whether this calls a global function with the given name. */
    public boolean isCallTo(String name) {
      return fn instanceof Id && ((Id) fn).name.equals(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      fn.unparse(w, left, op.left);
      return w.appendAll(args, "(", ", ", ")");
    }
  }

  /** Member access, for example "other.x". */
  public static class Dot extends Exp {
    public final Exp exp;
    public final String name;

    Dot(Pos pos, Exp exp, String name) {
      super(pos, Op.DOT);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      exp.unparse(w, left, op.left);
      return w.append(".").append(name);
    }
  }

  /**
   * Index access, for example "a[i]", "grid[# x, y]" or "map[? key]".
   *
   * <p>{@link #accessor} is empty for plain array access, otherwise one of
   * "@", "?", "#", "|", "$".
   */
  public static class Index extends Exp {
    public final Exp exp;
    public final String accessor;
    public final List<Exp> indices;

    Index(Pos pos, Exp exp, String accessor, ImmutableList<Exp> indices) {
      super(pos, Op.INDEX);
      this.exp = requireNonNull(exp);
      this.accessor = requireNonNull(accessor);
      this.indices = requireNonNull(indices);
      checkArgument(!indices.isEmpty());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      exp.unparse(w, left, op.left);
      final String start = accessor.isEmpty() ? "[" : "[" + accessor + " ";
      return w.appendAll(indices, start, ", ", "]");
    }
  }

  /** Parenthesized expression, for example "(a + b)". */
  public static class Paren extends Exp {
    public final Exp exp;

    Paren(Pos pos, Exp exp) {
      super(pos, Op.PAREN);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp stripParens() {
      return exp.stripParens();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(exp, 0, 0).append(")");
    }
  }

  /** Conditional expression, for example "a > b ? a : b". */
  public static class Conditional extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Conditional(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.CONDITIONAL);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      condition.unparse(w, left, op.left);
      w.append(" ? ");
      ifTrue.unparse(w, 0, 0);
      w.append(" : ");
      return ifFalse.unparse(w, op.right, right);
    }
  }

  /** Array literal, for example "[1, 2, 3]". */
  public static class ArrayLiteral extends Exp {
    public final List<Exp> elements;

    ArrayLiteral(Pos pos, ImmutableList<Exp> elements) {
      super(pos, Op.ARRAY);
      this.elements = requireNonNull(elements);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(elements, "[", ", ", "]");
    }
  }

  /** Struct literal, for example "{x: 1, y: 2}". */
  public static class StructLiteral extends Exp {
    public final List<String> names;
    public final List<Exp> values;

    StructLiteral(
        Pos pos, ImmutableList<String> names, ImmutableList<Exp> values) {
      super(pos, Op.STRUCT);
      this.names = requireNonNull(names);
      this.values = requireNonNull(values);
      checkArgument(names.size() == values.size());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      for (int i = 0; i < names.size(); i++) {
        w.append(i > 0 ? ", " : "")
            .append(names.get(i))
            .append(": ")
            .append(values.get(i), 0, 0);
      }
      return w.append("}");
    }
  }

  /**
   * Function, named or anonymous, for example "function (a, b = 1) { ... }".
   * Parameters with a default value have a non-null {@link Declarator#init}.
   */
  public static class Fn extends Exp {
    public final @Nullable String name;
    public final List<Declarator> params;
    public final boolean constructor;
    public final Block body;

    Fn(
        Pos pos,
        @Nullable String name,
        ImmutableList<Declarator> params,
        boolean constructor,
        Block body) {
      super(pos, Op.FN);
      this.name = name;
      this.params = requireNonNull(params);
      this.constructor = constructor;
      this.body = requireNonNull(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("function");
      if (name != null) {
        w.append(" ").append(name);
      }
      w.appendAll(params, "(", ", ", ")");
      if (constructor) {
        w.append(" constructor");
      }
      return w.append(" ").append(body, 0, 0);
    }
  }

  /** Declaration of a variable, or a function parameter: "x" or "x = 1". */
  public static class Declarator extends AstNode {
    public final Id id;
    public final @Nullable Exp init;

    Declarator(Pos pos, Id id, @Nullable Exp init) {
      super(pos, Op.DECLARATOR);
      this.id = requireNonNull(id);
      this.init = init;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(id.name);
      if (init != null) {
        w.append(" = ").append(init, 0, 0);
      }
      return w;
    }
  }

  /** Variable declaration, for example "var x = 1, y;". */
  public static class VarDecl extends Stmt {
    /** "var", "static" or "globalvar". */
    public final String keyword;
    public final List<Declarator> declarators;

    VarDecl(Pos pos, String keyword, ImmutableList<Declarator> declarators) {
      super(pos, Op.VAR_DECL);
      this.keyword = requireNonNull(keyword);
      this.declarators = requireNonNull(declarators);
      checkArgument(!declarators.isEmpty());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(declarators, keyword + " ", ", ", ";");
    }
  }

  /** Enum declaration, for example "enum Color { RED, GREEN = 5 }". */
  public static class EnumDecl extends Stmt {
    public final String name;
    public final List<Declarator> members;

    EnumDecl(Pos pos, String name, ImmutableList<Declarator> members) {
      super(pos, Op.ENUM_DECL);
      this.name = requireNonNull(name);
      this.members = requireNonNull(members);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(members, "enum " + name + " {", ", ", "}");
    }
  }

  /** Statement that consists of an expression, for example "x += 1;". */
  public static class ExpStmt extends Stmt {
    public final Exp exp;

    ExpStmt(Pos pos, Exp exp) {
      super(pos, Op.EXP_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 0, 0).append(";");
    }
  }

  /** Block, for example "{ x = 1; y = 2; }". */
  public static class Block extends Stmt {
    public final List<Stmt> statements;

    Block(Pos pos, ImmutableList<Stmt> statements) {
      super(pos, Op.BLOCK);
      this.statements = requireNonNull(statements);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (statements.isEmpty()) {
        return w.append("{}");
      }
      return w.appendAll(statements, "{", " ", "}");
    }
  }

  /** "if" statement. */
  public static class If extends Stmt {
    public final Exp condition;
    public final Stmt ifTrue;
    public final @Nullable Stmt ifFalse;

    If(Pos pos, Exp condition, Stmt ifTrue, @Nullable Stmt ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if ").append(condition, 0, 0).append(" ").append(ifTrue, 0, 0);
      if (ifFalse != null) {
        w.append(" else ").append(ifFalse, 0, 0);
      }
      return w;
    }
  }

  /**
   * Loop with a condition and a body: "while", "repeat" or "with".
   *
   * <p>For "repeat" the expression is the number of iterations; for "with"
   * it is the instance or object.
   */
  public static class Loop extends Stmt {
    public final Exp exp;
    public final Stmt body;

    Loop(Pos pos, Op op, Exp exp, Stmt body) {
      super(pos, op);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
      checkArgument(op == Op.WHILE || op == Op.REPEAT || op == Op.WITH);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.symbol())
          .append(" ")
          .append(exp, 0, 0)
          .append(" ")
          .append(body, 0, 0);
    }
  }

  /** "do ... until" statement. */
  public static class DoUntil extends Stmt {
    public final Stmt body;
    public final Exp condition;

    DoUntil(Pos pos, Stmt body, Exp condition) {
      super(pos, Op.DO_UNTIL);
      this.body = requireNonNull(body);
      this.condition = requireNonNull(condition);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("do ")
          .append(body, 0, 0)
          .append(" until ")
          .append(condition, 0, 0)
          .append(";");
    }
  }

  /** "for" statement. */
  public static class For extends Stmt {
    public final @Nullable Stmt init;
    public final @Nullable Exp condition;
    public final @Nullable Exp step;
    public final Stmt body;

    For(
        Pos pos,
        @Nullable Stmt init,
        @Nullable Exp condition,
        @Nullable Exp step,
        Stmt body) {
      super(pos, Op.FOR);
      this.init = init;
      this.condition = condition;
      this.step = step;
      this.body = requireNonNull(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("for (");
      if (init != null) {
        w.append(init, 0, 0);
      } else {
        w.append(";");
      }
      if (condition != null) {
        w.append(" ").append(condition, 0, 0);
      }
      w.append(";");
      if (step != null) {
        w.append(" ").append(step, 0, 0);
      }
      return w.append(") ").append(body, 0, 0);
    }
  }

  /** "switch" statement. */
  public static class Switch extends Stmt {
    public final Exp exp;
    public final List<Case> cases;

    Switch(Pos pos, Exp exp, ImmutableList<Case> cases) {
      super(pos, Op.SWITCH);
      this.exp = requireNonNull(exp);
      this.cases = requireNonNull(cases);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("switch ").append(exp, 0, 0);
      return w.appendAll(cases, " {", " ", "}");
    }
  }

  /** Clause of a "switch"; the "default" clause has a null test. */
  public static class Case extends AstNode {
    public final @Nullable Exp test;
    public final List<Stmt> statements;

    Case(Pos pos, @Nullable Exp test, ImmutableList<Stmt> statements) {
      super(pos, Op.CASE);
      this.test = test;
      this.statements = requireNonNull(statements);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (test == null) {
        w.append("default:");
      } else {
        w.append("case ").append(test, 0, 0).append(":");
      }
      for (Stmt statement : statements) {
        w.append(" ").append(statement, 0, 0);
      }
      return w;
    }
  }

  /** "return" statement. */
  public static class Return extends Stmt {
    public final @Nullable Exp exp;

    Return(Pos pos, @Nullable Exp exp) {
      super(pos, Op.RETURN);
      this.exp = exp;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("return");
      if (exp != null) {
        w.append(" ").append(exp, 0, 0);
      }
      return w.append(";");
    }
  }

  /** "throw" statement. */
  public static class Throw extends Stmt {
    public final Exp exp;

    Throw(Pos pos, Exp exp) {
      super(pos, Op.THROW);
      this.exp = requireNonNull(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("throw ").append(exp, 0, 0).append(";");
    }
  }

  /** "try" statement, with optional "catch" and "finally" clauses. */
  public static class Try extends Stmt {
    public final Block body;
    public final @Nullable Id catchId;
    public final @Nullable Block catchBody;
    public final @Nullable Block finallyBody;

    Try(
        Pos pos,
        Block body,
        @Nullable Id catchId,
        @Nullable Block catchBody,
        @Nullable Block finallyBody) {
      super(pos, Op.TRY);
      this.body = requireNonNull(body);
      this.catchId = catchId;
      this.catchBody = catchBody;
      this.finallyBody = finallyBody;
      checkArgument((catchId == null) == (catchBody == null));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("try ").append(body, 0, 0);
      if (catchId != null && catchBody != null) {
        w.append(" catch (")
            .append(catchId.name)
            .append(") ")
            .append(catchBody, 0, 0);
      }
      if (finallyBody != null) {
        w.append(" finally ").append(finallyBody, 0, 0);
      }
      return w;
    }
  }

  /** "exit", "break" or "continue" statement. */
  public static class Jump extends Stmt {
    Jump(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op == Op.EXIT || op == Op.BREAK || op == Op.CONTINUE);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.symbol()).append(";");
    }
  }

  /** Named function declared as a statement. */
  public static class FunDecl extends Stmt {
    public final Fn fn;

    FunDecl(Pos pos, Fn fn) {
      super(pos, Op.FUN_DECL);
      this.fn = requireNonNull(fn);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn, 0, 0);
    }
  }

  /** A whole source file. */
  public static class Program extends AstNode {
    public final List<Stmt> statements;

    Program(Pos pos, ImmutableList<Stmt> statements) {
      super(pos, Op.PROGRAM);
      this.statements = requireNonNull(statements);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(statements, "", "\n", "");
    }
  }
}

// End Ast.java
