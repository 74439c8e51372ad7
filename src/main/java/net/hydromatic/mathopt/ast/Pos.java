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

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Position of a parse-tree node.
 *
 * <p>Besides the 1-based line and column of each end, which are used for
 * messages, a position holds the half-open range {@code [start, end)} of
 * character offsets into the source string. Rewrites are expressed in terms of
 * offsets.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 1, 1, 1, 1, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;
  /** Offset of the first character. */
  public final int start;
  /** Offset one past the last character. */
  public final int end;

  /** Creates a Pos. */
  public Pos(
      String file,
      int startLine,
      int startColumn,
      int endLine,
      int endColumn,
      int start,
      int end) {
    checkArgument(
        0 <= start && start <= end, "invalid range [%s, %s)", start, end);
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.start = start;
    this.end = end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.start == ((Pos) o).start
            && this.end == ((Pos) o).end
            && this.file.equals(((Pos) o).file);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  /** Returns the number of characters covered. */
  public int length() {
    return end - start;
  }

  /** Returns the slice of the source string that this position covers. */
  public String text(String source) {
    return source.substring(start, end);
  }

  /** Returns whether this position overlaps the range {@code [start, end)}. */
  public boolean overlaps(int start, int end) {
    return this.start < end && start < this.end;
  }

  /**
   * Combines an iterable of parser positions to create a position which spans
   * from the beginning of the first to the end of the last.
   */
  public static Pos sum(Iterable<Pos> poses) {
    final List<Pos> list =
        poses instanceof List ? (List<Pos>) poses : Lists.newArrayList(poses);
    checkArgument(!list.isEmpty());
    Pos p = list.get(0);
    for (Pos pos : list.subList(1, list.size())) {
      p = p.plus(pos);
    }
    return p;
  }

  /** Returns a position that spans the positions of some elements. */
  public static <E> Pos sum(Iterable<E> elements, Function<E, Pos> fn) {
    return sum(Iterables.transform(elements, fn::apply));
  }

  public static Pos sum(List<? extends AstNode> nodes) {
    return sum(nodes, node -> node.pos);
  }

  /** Returns a position that spans this position and another. */
  public Pos plus(Pos pos) {
    if (pos.equals(ZERO)) {
      return this;
    }
    if (this.equals(ZERO)) {
      return pos;
    }
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    int start = this.start;
    if (pos.start < start) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
      start = pos.start;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    int end = pos.end;
    if (this.end > end) {
      endLine = this.endLine;
      endColumn = this.endColumn;
      end = this.end;
    }
    return new Pos(
        file, startLine, startColumn, endLine, endColumn, start, end);
  }
}

// End Pos.java
