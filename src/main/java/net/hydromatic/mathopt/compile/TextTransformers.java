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
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.mathopt.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link TextTransformer}. */
public abstract class TextTransformers {
  private TextTransformers() {}

  /** {@code x * 1}, with the "1" not part of a longer number or name. */
  private static final Pattern TIMES_ONE =
      Pattern.compile("\\s*\\*\\s*1(?![\\w.])");

  /** {@code 1 * x}, with the "1" not part of a longer number or name. */
  private static final Pattern ONE_TIMES =
      Pattern.compile("(?<![\\w.])1\\s*\\*\\s*");

  private static final Pattern UNDEFINED_GUARD =
      Pattern.compile("\\bif\\s*\\(\\s*!\\s*is_undefined\\(\\s*([A-Za-z0-9_.]+)"
          + "\\s*\\)\\s*\\)\\s*\\{\\s*([A-Za-z0-9_.]+)\\s*\\*=\\s*\\1\\s*;?"
          + "\\s*\\}");

  private static final Pattern ZERO_CHECK =
      Pattern.compile("\\bif\\s*\\(\\s*([A-Za-z_][A-Za-z0-9_.]*)"
          + "\\s*!=\\s*0(?![\\w.])\\s*\\)");

  /** Call to a function that suggests floating-point geometry. */
  private static final Pattern SENSITIVE_CALL =
      Pattern.compile("\\b(?:sqrt|sqr|\\w*distance\\w*|math_\\w+)\\s*\\(");

  private static final Pattern ELSE = Pattern.compile("\\s*else\\b");

  /**
   * Returns the transformers that the optimizer runs, in order:
   * multiplication by one, undefined guard, zero check.
   */
  public static List<TextTransformer> standard(Map<Prop, Object> propMap) {
    return ImmutableList.of(
        multiplicationByOne(),
        undefinedGuard(),
        zeroCheck(Prop.EPSILON_FUNCTION.stringValue(propMap)));
  }

  /**
   * Applies transformers in order, telling the tracer about each one that
   * changes the text.
   */
  public static String applyAll(
      List<TextTransformer> transformers, String text, Tracer tracer) {
    for (TextTransformer transformer : transformers) {
      final String transformed = transformer.apply(text);
      if (!transformed.equals(text)) {
        tracer.onTransform(transformer, text, transformed);
        text = transformed;
      }
    }
    return text;
  }

  /**
   * Returns a transformer that removes multiplication by the literal 1, as in
   * {@code x * 1} and {@code 1 * x}.
   *
   * <p>{@code 1 * x} is left alone after {@code /}, {@code %}, {@code mod}
   * and {@code div}, where removing it would change which operand divides,
   * and after {@code !}, {@code ~} and {@code not}, which apply to the 1
   * alone.
   */
  public static TextTransformer multiplicationByOne() {
    return new RegexTransformer("multiplication-by-one") {
      @Override
      public String apply(String text) {
        final String s = replaceAll(text, TIMES_ONE, (m, mask) -> "");
        return replaceAll(
            s,
            ONE_TIMES,
            (m, mask) ->
                isAfterDivision(s, m.start()) || isAfterNegation(s, m.start())
                    ? null
                    : "");
      }
    };
  }

  /**
   * Returns a transformer that folds an undefined guard around a scaling
   * into a nullish-coalescing scaling: {@code if (!is_undefined(m)) { x *= m;
   * }} becomes {@code x *= m ?? 1;}.
   *
   * <p>Applies only in numerically sensitive code (see {@link
   * #isNumericallySensitive}), and not if the "if" has an "else".
   */
  public static TextTransformer undefinedGuard() {
    return new RegexTransformer("undefined-guard") {
      @Override
      public String apply(String text) {
        return replaceAll(
            text,
            UNDEFINED_GUARD,
            (m, mask) -> {
              if (ELSE.matcher(text).region(m.end(), text.length())
                      .lookingAt()
                  || !isNumericallySensitive(text, mask, m.start())) {
                return null;
              }
              return m.group(2) + " *= " + m.group(1) + " ?? 1;";
            });
      }
    };
  }

  /**
   * Returns a transformer that replaces a comparison with zero by a
   * comparison with an epsilon: {@code if (v != 0)} becomes {@code if (abs(v)
   * > math_get_epsilon())}.
   *
   * <p>Applies only in numerically sensitive code (see {@link
   * #isNumericallySensitive}), so that checks such as {@code if (count != 0)}
   * in unrelated code are left alone.
   */
  public static TextTransformer zeroCheck(String epsilonFunction) {
    requireNonNull(epsilonFunction);
    return new RegexTransformer("zero-check") {
      @Override
      public String apply(String text) {
        return replaceAll(
            text,
            ZERO_CHECK,
            (m, mask) ->
                isNumericallySensitive(text, mask, m.start())
                    ? "if (abs(" + m.group(1) + ") > " + epsilonFunction + "())"
                    : null);
      }
    };
  }

  /**
   * Returns whether the code around an offset looks like floating-point
   * geometry: whether the innermost brace block that contains the offset (or
   * the whole text, if there is none) calls {@code sqrt}, {@code sqr}, a
   * function whose name contains "distance", or a {@code math_} function.
   */
  static boolean isNumericallySensitive(
      String text, boolean[] mask, int offset) {
    final int[] block = enclosingBlock(text, mask, offset);
    final Matcher m =
        SENSITIVE_CALL.matcher(text).region(block[0], block[1]);
    while (m.find()) {
      if (mask[m.start()]) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the range of the innermost brace block that contains an offset,
   * or of the whole text.
   */
  private static int[] enclosingBlock(String text, boolean[] mask, int offset) {
    int depth = 0;
    int open = -1;
    for (int i = offset - 1; i >= 0; i--) {
      if (!mask[i]) {
        continue;
      }
      final char c = text.charAt(i);
      if (c == '}') {
        ++depth;
      } else if (c == '{') {
        if (depth == 0) {
          open = i;
          break;
        }
        --depth;
      }
    }
    if (open < 0) {
      return new int[] {0, text.length()};
    }
    depth = 0;
    for (int i = open; i < text.length(); i++) {
      if (!mask[i]) {
        continue;
      }
      final char c = text.charAt(i);
      if (c == '{') {
        ++depth;
      } else if (c == '}' && --depth == 0) {
        return new int[] {open, i + 1};
      }
    }
    return new int[] {open, text.length()};
  }

  /**
   * Returns whether the token before an offset is a division or modulo
   * operator.
   */
  private static boolean isAfterDivision(String text, int offset) {
    int i = offset;
    while (i > 0 && Character.isWhitespace(text.charAt(i - 1))) {
      --i;
    }
    final String before = text.substring(0, i);
    return before.endsWith("/")
        || before.endsWith("%")
        || endsWithWord(before, "mod")
        || endsWithWord(before, "div");
  }

  /**
   * Returns whether the token before an offset is a logical or bitwise
   * negation.
   */
  private static boolean isAfterNegation(String text, int offset) {
    int i = offset;
    while (i > 0 && Character.isWhitespace(text.charAt(i - 1))) {
      --i;
    }
    final String before = text.substring(0, i);
    return before.endsWith("!")
        || before.endsWith("~")
        || endsWithWord(before, "not");
  }

  private static boolean endsWithWord(String s, String word) {
    if (!s.endsWith(word)) {
      return false;
    }
    final int i = s.length() - word.length();
    return i == 0
        || !Character.isLetterOrDigit(s.charAt(i - 1))
            && s.charAt(i - 1) != '_';
  }

  /** Computes the replacement for a match, or returns null to keep it. */
  @FunctionalInterface
  interface MatchRewriter {
    @Nullable String rewrite(Matcher m, boolean[] mask);
  }

  /** Transformer built from regular expressions. */
  private abstract static class RegexTransformer implements TextTransformer {
    private final String name;

    RegexTransformer(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }

    /**
     * Replaces each match of a pattern that lies entirely in code (not in a
     * string literal or comment) and for which the rewriter returns a
     * replacement.
     */
    static String replaceAll(
        String text, Pattern pattern, MatchRewriter rewriter) {
      final boolean[] mask = Parsers.codeMask(text);
      final Matcher m = pattern.matcher(text);
      final StringBuilder b = new StringBuilder();
      int cursor = 0;
      boolean changed = false;
      while (m.find()) {
        if (!isCode(mask, m.start(), m.end())) {
          continue;
        }
        final String replacement = rewriter.rewrite(m, mask);
        if (replacement == null) {
          continue;
        }
        b.append(text, cursor, m.start()).append(replacement);
        cursor = m.end();
        changed = true;
      }
      if (!changed) {
        return text;
      }
      return b.append(text, cursor, text.length()).toString();
    }

    private static boolean isCode(boolean[] mask, int start, int end) {
      for (int i = start; i < end; i++) {
        if (!mask[i]) {
          return false;
        }
      }
      return true;
    }
  }
}

// End TextTransformers.java
