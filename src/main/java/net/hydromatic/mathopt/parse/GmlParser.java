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
package net.hydromatic.mathopt.parse;

import static net.hydromatic.mathopt.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.ast.Op;
import net.hydromatic.mathopt.ast.Pos;
import net.hydromatic.mathopt.parse.GmlLexer.Token;
import net.hydromatic.mathopt.parse.GmlLexer.TokenKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for GML.
 *
 * <p>Binary operators are parsed by precedence climbing, using the binding
 * strengths in {@link Op}. At statement level, {@code =} is assignment; inside
 * an expression it is equality. Semicolons are optional.
 */
public class GmlParser {
  /** Words that cannot be used as identifiers. */
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "and", "break", "case", "catch", "constructor", "continue",
          "default", "div", "do", "else", "enum", "exit", "false", "finally",
          "for", "function", "globalvar", "if", "mod", "new", "not", "or",
          "repeat", "return", "static", "switch", "then", "throw", "true",
          "try", "undefined", "until", "var", "while", "with", "xor");

  private final GmlLexer lexer;
  private final String source;
  private final List<Token> tokens;
  private int i = 0;
  private @Nullable Token last;

  public GmlParser(String source, String file) {
    this.source = source;
    this.lexer = new GmlLexer(source, file);
    this.tokens = lexer.tokenize();
  }

  public GmlParser(String source) {
    this(source, "");
  }

  /** Returns the position of the most recently consumed token. */
  public Pos pos() {
    if (last == null) {
      throw new IllegalStateException("no token consumed");
    }
    return last.pos;
  }

  /** Parses a whole source file. */
  public Ast.Program program() {
    final List<Ast.Stmt> statements = statements();
    if (peek().kind != TokenKind.EOF) {
      throw error("expected statement");
    }
    return ast.program(lexer.pos(0, source.length()), statements);
  }

  /** Parses a single expression that must make up the whole input. */
  public Ast.Exp expressionEof() {
    final Ast.Exp e = expression();
    if (peek().kind != TokenKind.EOF) {
      throw error("expected end of input");
    }
    return e;
  }

  // token handling

  private Token peek() {
    return tokens.get(i);
  }

  private Token peek(int k) {
    return tokens.get(Math.min(i + k, tokens.size() - 1));
  }

  private Token consume() {
    last = tokens.get(i);
    if (last.kind != TokenKind.EOF) {
      ++i;
    }
    return last;
  }

  private boolean at(String s) {
    return peek().is(s);
  }

  private boolean accept(String s) {
    if (at(s)) {
      consume();
      return true;
    }
    return false;
  }

  private Token expect(String s) {
    if (!at(s)) {
      throw error("expected '" + s + "'");
    }
    return consume();
  }

  private Ast.Id identifier() {
    final Token t = peek();
    if (t.kind != TokenKind.IDENTIFIER || RESERVED.contains(t.text)) {
      throw error("expected identifier");
    }
    consume();
    return ast.id(t.pos, t.text);
  }

  private MathParseException error(String message) {
    final Token t = peek();
    return new MathParseException(message + ", found " + t, t.pos);
  }

  // statements

  /** Parses statements until end of input, "}", "case" or "default". */
  private List<Ast.Stmt> statements() {
    final List<Ast.Stmt> list = new ArrayList<>();
    for (;;) {
      while (accept(";")) {
        // empty statement
      }
      if (peek().kind == TokenKind.EOF
          || at("}")
          || at("case")
          || at("default")) {
        return list;
      }
      list.add(statement());
    }
  }

  private Ast.Stmt statement() {
    final Token t = peek();
    if (t.kind == TokenKind.IDENTIFIER) {
      switch (t.text) {
        case "var":
        case "static":
        case "globalvar":
          return varDecl(true);
        case "enum":
          return enumDecl();
        case "if":
          return ifStmt();
        case "while":
        case "repeat":
        case "with":
          return loop();
        case "do":
          return doUntil();
        case "for":
          return forStmt();
        case "switch":
          return switchStmt();
        case "return":
          return returnStmt();
        case "throw":
          return throwStmt();
        case "try":
          return tryStmt();
        case "exit":
        case "break":
        case "continue":
          return jump();
        case "function":
          if (peek(1).kind == TokenKind.IDENTIFIER) {
            final Span s = Span.of(consume().pos);
            final String name = identifier().name;
            final Ast.Fn fn = fnRest(s, name);
            return ast.funDecl(fn.pos, fn);
          }
          break;
        default:
          break;
      }
    }
    if (t.is("{")) {
      return block();
    }
    if (t.is(";")) {
      consume();
      return ast.block(t.pos, ImmutableList.of());
    }
    return expStmt(true);
  }

  private Ast.VarDecl varDecl(boolean semicolon) {
    final Span s = Span.of(consume().pos);
    final String keyword = pos().text(source);
    final List<Ast.Declarator> declarators = new ArrayList<>();
    do {
      declarators.add(declarator());
    } while (accept(","));
    if (semicolon) {
      accept(";");
    }
    return ast.varDecl(s.end(this), keyword, declarators);
  }

  private Ast.Declarator declarator() {
    final Ast.Id id = identifier();
    Ast.Exp init = null;
    if (accept("=") || accept(":=")) {
      init = expression();
    }
    return ast.declarator(
        init == null ? id.pos : id.pos.plus(init.pos), id, init);
  }

  private Ast.EnumDecl enumDecl() {
    final Span s = Span.of(consume().pos);
    final String name = identifier().name;
    expect("{");
    final List<Ast.Declarator> members = new ArrayList<>();
    while (!at("}")) {
      members.add(declarator());
      if (!accept(",")) {
        break;
      }
    }
    expect("}");
    return ast.enumDecl(s.end(this), name, members);
  }

  private Ast.If ifStmt() {
    final Span s = Span.of(consume().pos);
    final Ast.Exp condition = expression();
    accept("then");
    final Ast.Stmt ifTrue = statement();
    s.add(ifTrue);
    Ast.Stmt ifFalse = null;
    if (accept("else")) {
      ifFalse = statement();
      s.add(ifFalse);
    }
    return ast.ifStmt(s.pos(), condition, ifTrue, ifFalse);
  }

  private Ast.Loop loop() {
    final Token t = consume();
    final Op op =
        t.text.equals("while")
            ? Op.WHILE
            : t.text.equals("repeat") ? Op.REPEAT : Op.WITH;
    final Ast.Exp exp = expression();
    final Ast.Stmt body = statement();
    return ast.loop(Span.of(t.pos).end(body), op, exp, body);
  }

  private Ast.DoUntil doUntil() {
    final Span s = Span.of(consume().pos);
    final Ast.Stmt body = statement();
    expect("until");
    final Ast.Exp condition = expression();
    accept(";");
    return ast.doUntil(s.end(this), body, condition);
  }

  private Ast.For forStmt() {
    final Span s = Span.of(consume().pos);
    expect("(");
    Ast.Stmt init = null;
    if (!at(";")) {
      init =
          at("var") || at("static") ? varDecl(false) : expStmt(false);
    }
    expect(";");
    final Ast.Exp condition = at(";") ? null : expression();
    expect(";");
    final Ast.Exp step = at(")") ? null : statementExpression();
    expect(")");
    final Ast.Stmt body = statement();
    return ast.forStmt(s.end(body), init, condition, step, body);
  }

  private Ast.Switch switchStmt() {
    final Span s = Span.of(consume().pos);
    final Ast.Exp exp = expression();
    expect("{");
    final List<Ast.Case> cases = new ArrayList<>();
    while (!at("}")) {
      final Span cs = Span.of(peek().pos);
      Ast.Exp test = null;
      if (accept("case")) {
        test = expression();
      } else {
        expect("default");
      }
      expect(":");
      cs.add(this);
      final List<Ast.Stmt> statements = statements();
      statements.forEach(cs::add);
      cases.add(ast.caseClause(cs.pos(), test, statements));
    }
    expect("}");
    return ast.switchStmt(s.end(this), exp, cases);
  }

  private Ast.Return returnStmt() {
    final Span s = Span.of(consume().pos);
    Ast.Exp exp = null;
    if (!at(";")
        && !at("}")
        && !at("case")
        && !at("default")
        && peek().kind != TokenKind.EOF) {
      exp = expression();
    }
    accept(";");
    return ast.returnStmt(s.end(this), exp);
  }

  private Ast.Throw throwStmt() {
    final Span s = Span.of(consume().pos);
    final Ast.Exp exp = expression();
    accept(";");
    return ast.throwStmt(s.end(this), exp);
  }

  private Ast.Try tryStmt() {
    final Span s = Span.of(consume().pos);
    final Ast.Block body = block();
    Ast.Id catchId = null;
    Ast.Block catchBody = null;
    Ast.Block finallyBody = null;
    if (accept("catch")) {
      expect("(");
      catchId = identifier();
      expect(")");
      catchBody = block();
    }
    if (accept("finally")) {
      finallyBody = block();
    }
    return ast.tryStmt(s.end(this), body, catchId, catchBody, finallyBody);
  }

  private Ast.Jump jump() {
    final Token t = consume();
    final Op op =
        t.text.equals("exit")
            ? Op.EXIT
            : t.text.equals("break") ? Op.BREAK : Op.CONTINUE;
    accept(";");
    return ast.jump(Span.of(t.pos).end(this), op);
  }

  private Ast.Block block() {
    final Span s = Span.of(expect("{").pos);
    final List<Ast.Stmt> statements = statements();
    expect("}");
    return ast.block(s.end(this), statements);
  }

  private Ast.ExpStmt expStmt(boolean semicolon) {
    final Ast.Exp exp = statementExpression();
    if (semicolon) {
      accept(";");
    }
    return ast.expStmt(Span.of(exp.pos).end(this), exp);
  }

  /** Parses the parameters and body of a function, after its name. */
  private Ast.Fn fnRest(Span s, @Nullable String name) {
    expect("(");
    final List<Ast.Declarator> params = new ArrayList<>();
    while (!at(")")) {
      params.add(declarator());
      if (!accept(",")) {
        break;
      }
    }
    expect(")");
    if (accept(":")) {
      // Parent constructor call, "function Child(a) : Parent(a) constructor"
      identifier();
      expect("(");
      arguments(")");
    }
    final boolean constructor = accept("constructor");
    final Ast.Block body = block();
    return ast.fn(s.end(body), name, params, constructor, body);
  }

  // expressions

  /**
   * Parses an expression at statement level, where {@code =} is assignment.
   */
  private Ast.Exp statementExpression() {
    final Ast.Exp target = unary();
    final Op op = assignOp(peek());
    if (op != null) {
      consume();
      final Ast.Exp exp = expression();
      return ast.assign(op, target, exp);
    }
    return conditionalRest(binaryRest(target, 0));
  }

  /** Parses an expression, where {@code =} is equality. */
  public Ast.Exp expression() {
    return conditionalRest(binary(0));
  }

  private Ast.Exp conditionalRest(Ast.Exp condition) {
    if (!accept("?")) {
      return condition;
    }
    final Ast.Exp ifTrue = expression();
    expect(":");
    final Ast.Exp ifFalse = expression();
    return ast.conditional(condition, ifTrue, ifFalse);
  }

  private Ast.Exp binary(int minPrecedence) {
    return binaryRest(unary(), minPrecedence);
  }

  private Ast.Exp binaryRest(Ast.Exp left, int minPrecedence) {
    for (;;) {
      final Op op = binaryOp(peek());
      if (op == null || op.precedence() < minPrecedence) {
        return left;
      }
      consume();
      final boolean rightAssociative = op.right < op.left;
      final Ast.Exp right =
          binary(rightAssociative ? op.precedence() : op.precedence() + 1);
      left = ast.infixCall(op, left, right);
    }
  }

  private Ast.Exp unary() {
    final Token t = peek();
    final Op op;
    if (t.kind == TokenKind.PUNCTUATOR) {
      switch (t.text) {
        case "-":
          op = Op.NEGATE;
          break;
        case "+":
          op = Op.POSITIVE;
          break;
        case "!":
          op = Op.NOT;
          break;
        case "~":
          op = Op.BIT_NOT;
          break;
        case "++":
          consume();
          return ast.update(t.pos, Op.PRE_INCREMENT, unary());
        case "--":
          consume();
          return ast.update(t.pos, Op.PRE_DECREMENT, unary());
        default:
          return postfix();
      }
    } else if (t.is("not")) {
      op = Op.NOT;
    } else if (t.is("new")) {
      consume();
      return ast.prefixCall(t.pos, Op.NEW, postfix());
    } else {
      return postfix();
    }
    consume();
    return ast.prefixCall(t.pos, op, unary());
  }

  private Ast.Exp postfix() {
    Ast.Exp e = primary();
    for (;;) {
      final Token t = peek();
      if (t.kind != TokenKind.PUNCTUATOR) {
        return e;
      }
      switch (t.text) {
        case "(":
          consume();
          final List<Ast.Exp> args = arguments(")");
          e = ast.apply(pos(), e, args);
          break;
        case ".":
          consume();
          final Token name = consume();
          if (name.kind != TokenKind.IDENTIFIER) {
            throw new MathParseException(
                "expected member name, found " + name, name.pos);
          }
          e = ast.dot(name.pos, e, name.text);
          break;
        case "[":
        case "[@":
        case "[?":
        case "[#":
        case "[|":
        case "[$":
          consume();
          final List<Ast.Exp> indices = arguments("]");
          if (indices.isEmpty()) {
            throw new MathParseException("expected index", pos());
          }
          e = ast.index(pos(), e, t.text.substring(1), indices);
          break;
        case "++":
          consume();
          e = ast.update(t.pos, Op.POST_INCREMENT, e);
          break;
        case "--":
          consume();
          e = ast.update(t.pos, Op.POST_DECREMENT, e);
          break;
        default:
          return e;
      }
    }
  }

  /** Parses a comma-separated list of expressions and its closing bracket. */
  private List<Ast.Exp> arguments(String close) {
    final List<Ast.Exp> list = new ArrayList<>();
    while (!at(close)) {
      list.add(expression());
      if (!accept(",")) {
        break;
      }
    }
    expect(close);
    return list;
  }

  private Ast.Exp primary() {
    final Token t = consume();
    switch (t.kind) {
      case NUMBER:
        final double value;
        try {
          value = Parsers.parseNumber(t.text);
        } catch (NumberFormatException e) {
          throw new MathParseException("invalid number " + t, t.pos);
        }
        return ast.realLiteral(t.pos, value, t.text);

      case STRING:
        return ast.stringLiteral(t.pos, Parsers.unquoteString(t.text), t.text);

      case IDENTIFIER:
        switch (t.text) {
          case "true":
          case "false":
            return ast.boolLiteral(t.pos, t.text.equals("true"), t.text);
          case "undefined":
            return ast.undefinedLiteral(t.pos, t.text);
          case "function":
            final String name = at("(") ? null : identifier().name;
            return fnRest(Span.of(t.pos), name);
          default:
            if (RESERVED.contains(t.text)) {
              break;
            }
            return ast.id(t.pos, t.text);
        }
        break;

      case PUNCTUATOR:
        final Span s = Span.of(t.pos);
        switch (t.text) {
          case "(":
            final Ast.Exp e = expression();
            expect(")");
            return ast.paren(s.end(this), e);
          case "[":
            final List<Ast.Exp> elements = arguments("]");
            return ast.arrayLiteral(s.end(this), elements);
          case "{":
            return structRest(s);
          default:
            break;
        }
        break;

      default:
        break;
    }
    throw new MathParseException("unexpected " + t, t.pos);
  }

  private Ast.StructLiteral structRest(Span s) {
    final List<String> names = new ArrayList<>();
    final List<Ast.Exp> values = new ArrayList<>();
    while (!at("}")) {
      final Token key = consume();
      if (key.kind == TokenKind.IDENTIFIER) {
        names.add(key.text);
      } else if (key.kind == TokenKind.STRING) {
        names.add(Parsers.unquoteString(key.text));
      } else {
        throw new MathParseException("expected field name, found " + key,
            key.pos);
      }
      expect(":");
      values.add(expression());
      if (!accept(",")) {
        break;
      }
    }
    expect("}");
    return ast.structLiteral(s.end(this), names, values);
  }

  private static @Nullable Op assignOp(Token t) {
    if (t.kind != TokenKind.PUNCTUATOR) {
      return null;
    }
    if (t.text.equals(":=")) {
      return Op.ASSIGN;
    }
    final Op op = Op.BY_SYMBOL.get(t.text);
    return op != null && Op.ASSIGNMENTS.contains(op) ? op : null;
  }

  private static @Nullable Op binaryOp(Token t) {
    switch (t.kind) {
      case IDENTIFIER:
        switch (t.text) {
          case "div":
            return Op.DIV;
          case "mod":
            return Op.MOD;
          case "and":
            return Op.ANDALSO;
          case "or":
            return Op.ORELSE;
          case "xor":
            return Op.XOR;
          default:
            return null;
        }
      case PUNCTUATOR:
        switch (t.text) {
          case "%":
            return Op.MOD;
          case "=":
            return Op.EQ;
          case "<>":
            return Op.NE;
          default:
            final Op op = Op.BY_SYMBOL.get(t.text);
            return op != null && !Op.ASSIGNMENTS.contains(op) ? op : null;
        }
      default:
        return null;
    }
  }
}

// End GmlParser.java
