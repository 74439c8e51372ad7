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

import java.util.Objects;
import net.hydromatic.mathopt.ast.Pos;

/**
 * Replacement of the characters {@code [start, end)} of a source string by
 * new text.
 *
 * <p>The {@link #origin} records which rewrite produced the edit. It is used
 * for tracing and tests, and never affects how edits are applied.
 */
public final class TextEdit {
  public final int start;
  public final int end;
  public final String text;
  public final Origin origin;

  private TextEdit(int start, int end, String text, Origin origin) {
    this.start = start;
    this.end = end;
    this.text = requireNonNull(text);
    this.origin = requireNonNull(origin);
  }

  /**
   * Creates an edit. The range is not validated here; {@link EditComposer}
   * rejects edits whose range does not fit the source.
   */
  public static TextEdit of(int start, int end, String text, Origin origin) {
    return new TextEdit(start, end, text, origin);
  }

  /** Creates an edit that replaces the text of a node. */
  public static TextEdit replace(Pos pos, String text, Origin origin) {
    return new TextEdit(pos.start, pos.end, text, origin);
  }

  /**
   * Creates an edit that deletes a statement.
   *
   * <p>The deletion extends over any semicolons, spaces, tabs and carriage
   * returns that follow the statement, and one newline. If the statement is
   * alone on its line, the indentation before it is deleted too, so that no
   * blank line is left behind.
   */
  public static TextEdit deletion(String source, Pos pos, Origin origin) {
    int end = pos.end;
    while (end < source.length()) {
      final char c = source.charAt(end);
      if (c != ';' && c != ' ' && c != '\t' && c != '\r') {
        break;
      }
      ++end;
    }
    final boolean lineEnd =
        end == source.length() || source.charAt(end) == '\n';
    if (end < source.length() && source.charAt(end) == '\n') {
      ++end;
    }
    int start = pos.start;
    if (lineEnd) {
      int k = start;
      while (k > 0
          && (source.charAt(k - 1) == ' ' || source.charAt(k - 1) == '\t')) {
        --k;
      }
      if (k == 0 || source.charAt(k - 1) == '\n') {
        start = k;
      }
    }
    return new TextEdit(start, end, "", origin);
  }

  /** Returns whether this edit's range lies within a string of a length. */
  public boolean isValid(int length) {
    return 0 <= start && start <= end && end <= length;
  }

  /** Returns whether this edit's range overlaps the range of another. */
  public boolean overlaps(TextEdit edit) {
    return overlaps(edit.start, edit.end);
  }

  /** Returns whether this edit's range overlaps {@code [start, end)}. */
  public boolean overlaps(int start, int end) {
    return this.start < end && start < this.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end, text, origin);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TextEdit
            && start == ((TextEdit) o).start
            && end == ((TextEdit) o).end
            && text.equals(((TextEdit) o).text)
            && origin == ((TextEdit) o).origin;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ") -> \"" + text + "\" (" + origin + ")";
  }

  /** Which rewrite produced an edit. */
  public enum Origin {
    /** Product rebuilt in canonical form. */
    SIMPLIFY,
    /** Numeric factors of a chain folded. */
    CONDENSE,
    /** {@code a / (1 / k)} folded to {@code a * k}. */
    RECIPROCAL,
    /** Square root of a sum of squares replaced by a distance function. */
    SUM_OF_SQUARES,
    /** Addition or subtraction of zero removed. */
    ADDITIVE_IDENTITY,
    /** Hand-written math replaced by a built-in function. */
    BUILTIN,
    /** Declaration and half-rotation adjustment fused. */
    HALF_ROTATION,
    /** Statement of a run of updates that cancel out removed. */
    DEAD_UPDATE,
    /** Multiplication or division of a variable by 1 removed. */
    IDENTITY_UPDATE,
    /** Edit created outside the optimizer, for example in a test. */
    MANUAL
  }
}

// End TextEdit.java
