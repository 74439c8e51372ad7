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

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Returns the value of a numeric literal.
   *
   * <p>Handles decimal ({@code 12}, {@code 1.5}, {@code .5}, {@code 5.},
   * {@code 1e3}), hexadecimal ({@code 0xFF}, {@code $FF}), binary
   * ({@code 0b101}) and color ({@code #RRGGBB}, stored as BGR) literals, with
   * optional {@code _} digit separators.
   */
  public static double parseNumber(String s) {
    final String t = s.replace("_", "");
    checkArgument(!t.isEmpty(), "empty number");
    if (t.startsWith("0x") || t.startsWith("0X")) {
      return Long.parseLong(t.substring(2), 16);
    }
    if (t.startsWith("$")) {
      return Long.parseLong(t.substring(1), 16);
    }
    if (t.startsWith("0b") || t.startsWith("0B")) {
      return Long.parseLong(t.substring(2), 2);
    }
    if (t.startsWith("#")) {
      checkArgument(t.length() == 7, "bad color literal %s", s);
      final long rgb = Long.parseLong(t.substring(1), 16);
      final long r = (rgb >> 16) & 0xFF;
      final long g = (rgb >> 8) & 0xFF;
      final long b = rgb & 0xFF;
      return (b << 16) | (g << 8) | r;
    }
    return Double.parseDouble(t);
  }

  /**
   * Given a quoted string literal returns its value.
   *
   * <p>{@code "a\tb"} and {@code 'a\tb'} process escapes; {@code @"a\b"} is
   * verbatim; the value of a template string {@code $"x{y}"} is its raw body.
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    if (s.charAt(0) == '@' || s.charAt(0) == '$') {
      return s.substring(2, s.length() - 1);
    }
    final char quote = s.charAt(0);
    checkArgument(quote == '"' || quote == '\'');
    checkArgument(s.charAt(s.length() - 1) == quote);
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c != '\\' || i + 1 >= s.length()) {
        b.append(c);
        continue;
      }
      final char e = s.charAt(++i);
      switch (e) {
        case 'n':
          b.append('\n');
          break;
        case 'r':
          b.append('\r');
          break;
        case 't':
          b.append('\t');
          break;
        case 'b':
          b.append('\b');
          break;
        case 'f':
          b.append('\f');
          break;
        case 'v':
          b.append('\u000B');
          break;
        case 'a':
          b.append('\u0007');
          break;
        case 'u':
          if (i + 4 < s.length()) {
            b.append((char) Integer.parseInt(s.substring(i + 1, i + 5), 16));
            i += 4;
            break;
          }
          b.append(e);
          break;
        default:
          b.append(e);
      }
    }
    return b.toString();
  }

  /**
   * Returns the offset just after the string literal that starts at offset
   * {@code i}, or {@code i} if no string literal starts there.
   */
  static int skipString(String s, int i) {
    final char c = s.charAt(i);
    final boolean verbatim =
        (c == '@' || c == '$')
            && i + 1 < s.length()
            && (s.charAt(i + 1) == '"' || s.charAt(i + 1) == '\'');
    if (c != '"' && c != '\'' && !verbatim) {
      return i;
    }
    final int open = verbatim ? i + 1 : i;
    final char quote = s.charAt(open);
    final boolean escapes = c != '@';
    for (int j = open + 1; j < s.length(); j++) {
      final char d = s.charAt(j);
      if (d == '\\' && escapes) {
        ++j;
      } else if (d == quote) {
        return j + 1;
      }
    }
    return s.length();
  }

  /**
   * Returns a mask with one entry per character of a source string; an entry
   * is true if the character is code, false if it is part of a string literal
   * or a comment.
   */
  public static boolean[] codeMask(String s) {
    final boolean[] mask = new boolean[s.length()];
    int i = 0;
    while (i < s.length()) {
      final char c = s.charAt(i);
      int next;
      if (c == '/' && s.startsWith("//", i)) {
        next = s.indexOf('\n', i);
        next = next < 0 ? s.length() : next;
      } else if (c == '/' && s.startsWith("/*", i)) {
        next = s.indexOf("*/", i + 2);
        next = next < 0 ? s.length() : next + 2;
      } else {
        next = skipString(s, i);
      }
      if (next == i) {
        mask[i++] = true;
      } else {
        i = next;
      }
    }
    return mask;
  }

  /** Returns whether a string has a comment outside its string literals. */
  public static boolean hasComment(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.startsWith("//", i) || s.startsWith("/*", i)) {
        return true;
      }
      final int next = skipString(s, i);
      if (next != i) {
        i = next - 1;
      }
    }
    return false;
  }

  /**
   * Strips white space and any number of enclosing parentheses. For example,
   * {@code " ((a + b)) "} becomes {@code "a + b"}, but {@code "(a) + (b)"} is
   * unchanged.
   */
  public static String trimOuterParentheses(String s) {
    for (;;) {
      s = s.trim();
      if (s.length() < 2
          || s.charAt(0) != '('
          || matchingClose(s, 0) != s.length() - 1) {
        return s;
      }
      s = s.substring(1, s.length() - 1);
    }
  }

  /**
   * Returns whether an expression has a {@code +} or binary {@code -} outside
   * any brackets, and therefore needs parentheses if it becomes an operand of
   * a multiplication.
   */
  public static boolean hasTopLevelAdditive(String s) {
    int depth = 0;
    char prev = ' ';
    for (int i = 0; i < s.length(); i++) {
      final int next = skipString(s, i);
      if (next != i) {
        i = next - 1;
        prev = '"';
        continue;
      }
      final char c = s.charAt(i);
      switch (c) {
        case '(':
        case '[':
        case '{':
          ++depth;
          break;
        case ')':
        case ']':
        case '}':
          --depth;
          break;
        case '+':
        case '-':
          if (depth == 0
              && isOperandEnd(prev)
              && !s.startsWith("++", i)
              && !s.startsWith("--", i)) {
            return true;
          }
          if (s.startsWith("++", i) || s.startsWith("--", i)) {
            // "x++" ends an operand; "++x" does not begin a binary operator
            ++i;
            if (isOperandEnd(prev)) {
              prev = ')';
              continue;
            }
          }
          break;
        default:
          break;
      }
      if (!Character.isWhitespace(c)) {
        prev = c;
      }
    }
    return false;
  }

  private static boolean isOperandEnd(char c) {
    return Character.isLetterOrDigit(c)
        || c == '_'
        || c == ')'
        || c == ']'
        || c == '}'
        || c == '"'
        || c == '.';
  }

  /**
   * Returns the offset of the parenthesis that closes the one at offset
   * {@code open}, or -1.
   */
  private static int matchingClose(String s, int open) {
    int depth = 0;
    for (int i = open; i < s.length(); i++) {
      final int next = skipString(s, i);
      if (next != i) {
        i = next - 1;
        continue;
      }
      final char c = s.charAt(i);
      if (c == '(') {
        ++depth;
      } else if (c == ')' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }
}

// End Parsers.java
