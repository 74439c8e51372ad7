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

import com.google.common.collect.ImmutableMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  REAL_LITERAL(true),
  STRING_LITERAL(true),
  UNDEFINED_LITERAL(true),

  // value constructors
  ARRAY(true),
  STRUCT(true),
  FN(true),
  PAREN(true),

  // postfix
  APPLY("", 15),
  DOT(".", 15),
  INDEX("[", 15),
  POST_INCREMENT("++", 15),
  POST_DECREMENT("--", 15),

  // prefix
  PRE_INCREMENT("++", 14),
  PRE_DECREMENT("--", 14),
  NEGATE("-", 14),
  POSITIVE("+", 14),
  NOT("!", 14),
  BIT_NOT("~", 14),
  NEW("new ", 14),

  // infix
  TIMES(" * ", 13),
  DIVIDE(" / ", 13),
  DIV(" div ", 13),
  MOD(" mod ", 13),
  PLUS(" + ", 12),
  MINUS(" - ", 12),
  SHIFT_LEFT(" << ", 11),
  SHIFT_RIGHT(" >> ", 11),
  LT(" < ", 10),
  LE(" <= ", 10),
  GT(" > ", 10),
  GE(" >= ", 10),
  EQ(" == ", 9),
  NE(" != ", 9),
  BIT_AND(" & ", 8),
  BIT_XOR(" ^ ", 7),
  BIT_OR(" | ", 6),
  ANDALSO(" && ", 5),
  XOR(" ^^ ", 4),
  ORELSE(" || ", 3),
  NULLISH(" ?? ", 2, false),
  CONDITIONAL(" ? ", 1, false),

  // assignment
  ASSIGN(" = ", 0, false),
  ASSIGN_PLUS(" += ", 0, false),
  ASSIGN_MINUS(" -= ", 0, false),
  ASSIGN_TIMES(" *= ", 0, false),
  ASSIGN_DIVIDE(" /= ", 0, false),
  ASSIGN_MOD(" %= ", 0, false),
  ASSIGN_BIT_AND(" &= ", 0, false),
  ASSIGN_BIT_OR(" |= ", 0, false),
  ASSIGN_BIT_XOR(" ^= ", 0, false),
  ASSIGN_NULLISH(" ??= ", 0, false),

  // statements
  VAR_DECL,
  ENUM_DECL,
  DECLARATOR,
  EXP_STMT,
  BLOCK,
  IF,
  WHILE,
  DO_UNTIL,
  FOR,
  REPEAT,
  WITH,
  SWITCH,
  CASE,
  RETURN,
  THROW,
  TRY,
  EXIT,
  BREAK,
  CONTINUE,
  FUN_DECL,
  PROGRAM;

  /** Padded name, e.g. " * ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Infix operators, keyed by their canonical symbol, e.g. "*" or "div". */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  /** Operators that combine two operands. */
  public static final Set<Op> INFIX = EnumSet.range(TIMES, ORELSE);

  /** Compound and plain assignment operators. */
  public static final Set<Op> ASSIGNMENTS =
      EnumSet.range(ASSIGN, ASSIGN_NULLISH);

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : INFIX) {
      b.put(op.symbol(), op);
    }
    b.put(NULLISH.symbol(), NULLISH);
    for (Op op : ASSIGNMENTS) {
      b.put(op.symbol(), op);
    }
    BY_SYMBOL = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the operator symbol without padding, e.g. "*" for TIMES. */
  public String symbol() {
    return padded == null ? name().toLowerCase(Locale.ROOT) : padded.trim();
  }

  /** Returns the binding strength of an infix operator. */
  public int precedence() {
    return left / 2;
  }

  /** Returns whether this is an increment or decrement, prefix or postfix. */
  public boolean isUpdate() {
    return this == PRE_INCREMENT
        || this == PRE_DECREMENT
        || this == POST_INCREMENT
        || this == POST_DECREMENT;
  }

  /** Returns whether this is an increment, prefix or postfix. */
  public boolean isIncrement() {
    return this == PRE_INCREMENT || this == POST_INCREMENT;
  }
}

// End Op.java
