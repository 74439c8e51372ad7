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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.mathopt.ast.Pos;

/**
 * Splits GML source text into tokens.
 *
 * <p>White space, comments and preprocessor lines ({@code #region},
 * {@code #endregion}, {@code #macro}) produce no tokens. Every token knows its
 * {@link Pos}, including the offsets of its first and last characters.
 */
public class GmlLexer {
  /** Punctuators, longest first, so that the first match is the longest. */
  private static final List<String> PUNCTUATORS =
      ImmutableList.of(
          "??=", "<<", ">>", "<=", ">=", "==", "!=", "<>", "&&", "||", "^^",
          "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "??",
          ":=", "[@", "[?", "[#", "[|", "[$", "+", "-", "*", "/", "%", "(",
          ")", "[", "]", "{", "}", ",", ";", ".", "?", ":", "!", "~", "&",
          "|", "^", "<", ">", "=");

  private final String source;
  private final String file;
  /** Offset of the first character of each line. */
  private final int[] lineStarts;
  private int i = 0;

  /** Kind of token. */
  public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    PUNCTUATOR,
    EOF
  }

  /** Token. */
  public static class Token {
    public final TokenKind kind;
    public final String text;
    public final Pos pos;

    Token(TokenKind kind, String text, Pos pos) {
      this.kind = requireNonNull(kind);
      this.text = requireNonNull(text);
      this.pos = requireNonNull(pos);
    }

    /** Returns whether this token is the given punctuator or identifier. */
    public boolean is(String s) {
      return (kind == TokenKind.PUNCTUATOR || kind == TokenKind.IDENTIFIER)
          && text.equals(s);
    }

    @Override
    public String toString() {
      return kind == TokenKind.EOF ? "end of input" : "'" + text + "'";
    }
  }

  public GmlLexer(String source, String file) {
    this.source = requireNonNull(source);
    this.file = requireNonNull(file);
    final List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int j = 0; j < source.length(); j++) {
      if (source.charAt(j) == '\n') {
        starts.add(j + 1);
      }
    }
    this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
  }

  /** Returns the position of a range of characters. */
  public Pos pos(int start, int end) {
    final int startLine = line(start);
    final int endLine = line(end);
    return new Pos(
        file,
        startLine + 1,
        start - lineStarts[startLine] + 1,
        endLine + 1,
        end - lineStarts[endLine] + 1,
        start,
        end);
  }

  private int line(int offset) {
    final int k = Arrays.binarySearch(lineStarts, offset);
    return k >= 0 ? k : -k - 2;
  }

  /** Reads all tokens; the last token is always {@link TokenKind#EOF}. */
  public List<Token> tokenize() {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (;;) {
      final Token token = next();
      tokens.add(token);
      if (token.kind == TokenKind.EOF) {
        return tokens.build();
      }
    }
  }

  private Token next() {
    skipWhitespaceAndComments();
    final int start = i;
    if (i >= source.length()) {
      return new Token(TokenKind.EOF, "", pos(start, start));
    }
    final char c = source.charAt(i);
    if (Character.isLetter(c) || c == '_') {
      while (i < source.length() && isIdentifierPart(source.charAt(i))) {
        ++i;
      }
      return token(TokenKind.IDENTIFIER, start);
    }
    if (isDigit(c) || c == '.' && isDigit(peek(1))) {
      return number(start);
    }
    if (c == '$' && isHexDigit(peek(1))) {
      ++i;
      while (i < source.length() && isHexDigit(source.charAt(i))) {
        ++i;
      }
      return token(TokenKind.NUMBER, start);
    }
    if (c == '#' && isColor(i + 1)) {
      i += 7;
      return token(TokenKind.NUMBER, start);
    }
    final int stringEnd = Parsers.skipString(source, i);
    if (stringEnd != i) {
      final char quote = source.charAt(c == '@' || c == '$' ? i + 1 : i);
      if (stringEnd == source.length()
          && (stringEnd - 1 <= i + (c == '@' || c == '$' ? 1 : 0)
              || source.charAt(stringEnd - 1) != quote)) {
        throw new MathParseException(
            "unterminated string", pos(start, source.length()));
      }
      i = stringEnd;
      return token(TokenKind.STRING, start);
    }
    for (String punctuator : PUNCTUATORS) {
      if (source.startsWith(punctuator, i)) {
        i += punctuator.length();
        return token(TokenKind.PUNCTUATOR, start);
      }
    }
    throw new MathParseException(
        "unexpected character '" + c + "'", pos(start, start + 1));
  }

  private Token token(TokenKind kind, int start) {
    return new Token(kind, source.substring(start, i), pos(start, i));
  }

  private Token number(int start) {
    if (source.charAt(i) == '0'
        && (peek(1) == 'x' || peek(1) == 'X')
        && isHexDigit(peek(2))) {
      i += 2;
      while (i < source.length() && isHexDigit(source.charAt(i))) {
        ++i;
      }
      return token(TokenKind.NUMBER, start);
    }
    if (source.charAt(i) == '0'
        && (peek(1) == 'b' || peek(1) == 'B')
        && (peek(2) == '0' || peek(2) == '1')) {
      i += 2;
      while (i < source.length()
          && (source.charAt(i) == '0'
              || source.charAt(i) == '1'
              || source.charAt(i) == '_')) {
        ++i;
      }
      return token(TokenKind.NUMBER, start);
    }
    digits();
    if (i < source.length() && source.charAt(i) == '.' && !isIdentStart(1)) {
      ++i;
      digits();
    }
    if (i < source.length()
        && (source.charAt(i) == 'e' || source.charAt(i) == 'E')
        && (isDigit(peek(1))
            || (peek(1) == '+' || peek(1) == '-') && isDigit(peek(2)))) {
      i += 2;
      digits();
    }
    return token(TokenKind.NUMBER, start);
  }

  private void digits() {
    while (i < source.length()
        && (isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
      ++i;
    }
  }

  private void skipWhitespaceAndComments() {
    while (i < source.length()) {
      final char c = source.charAt(i);
      if (Character.isWhitespace(c)) {
        ++i;
      } else if (source.startsWith("//", i)) {
        skipToEndOfLine();
      } else if (source.startsWith("/*", i)) {
        final int end = source.indexOf("*/", i + 2);
        if (end < 0) {
          throw new MathParseException(
              "unterminated comment", pos(i, source.length()));
        }
        i = end + 2;
      } else if (c == '#' && !isColor(i + 1) && atLineStart()) {
        // "#region", "#endregion", "#macro NAME value"; a macro body may be
        // continued onto the next line with a trailing backslash
        for (;;) {
          final int lineStart = i;
          skipToEndOfLine();
          if (source.substring(lineStart, i).trim().endsWith("\\")) {
            ++i;
          } else {
            break;
          }
        }
      } else {
        return;
      }
    }
  }

  private void skipToEndOfLine() {
    final int end = source.indexOf('\n', i);
    i = end < 0 ? source.length() : end;
  }

  private boolean atLineStart() {
    for (int j = i - 1; j >= 0; j--) {
      final char c = source.charAt(j);
      if (c == '\n') {
        return true;
      }
      if (c != ' ' && c != '\t' && c != '\r') {
        return false;
      }
    }
    return true;
  }

  private boolean isColor(int j) {
    if (j + 6 > source.length()) {
      return false;
    }
    for (int k = j; k < j + 6; k++) {
      if (!isHexDigit(source.charAt(k))) {
        return false;
      }
    }
    return j + 6 == source.length()
        || !isIdentifierPart(source.charAt(j + 6));
  }

  private char peek(int offset) {
    final int j = i + offset;
    return j < source.length() ? source.charAt(j) : '\0';
  }

  private boolean isIdentStart(int offset) {
    final char c = peek(offset);
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(char c) {
    return isDigit(c) || c >= 'a' && c <= 'f' || c >= 'A' && c <= 'F';
  }
}

// End GmlLexer.java
