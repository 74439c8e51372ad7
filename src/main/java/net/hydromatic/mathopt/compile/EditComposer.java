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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Applies a list of {@link TextEdit}s to a source string.
 *
 * <p>Composition has two phases. The first, {@link #plan}, sorts the edits by
 * start and end offset and accepts them one at a time, rejecting any edit
 * whose range is invalid or starts before the end of the last accepted edit,
 * or that makes the same change as the last accepted edit, so that two
 * identical insertions at one offset apply once. The sort is stable, so among
 * edits with the same range the one registered first wins. The second phase
 * splices the accepted edits into the source.
 *
 * <p>Because accepted edits never overlap, splicing them in increasing order
 * into a new buffer gives the same result as applying them in decreasing order
 * to the original string; the offsets of each edit are offsets into the
 * original source.
 */
public abstract class EditComposer {
  private static final Comparator<TextEdit> ORDER =
      Comparator.<TextEdit>comparingInt(e -> e.start)
          .thenComparingInt(e -> e.end);

  private EditComposer() {}

  /** Applies a list of edits to a source string. */
  public static String compose(String source, List<TextEdit> edits) {
    return apply(source, plan(source.length(), edits).accepted);
  }

  /** Decides which edits to apply to a string of a given length. */
  public static Plan plan(int length, List<TextEdit> edits) {
    final List<TextEdit> sorted = new ArrayList<>(edits);
    sorted.sort(ORDER);
    final ImmutableList.Builder<TextEdit> accepted = ImmutableList.builder();
    final ImmutableList.Builder<TextEdit> rejected = ImmutableList.builder();
    int end = 0;
    @Nullable TextEdit last = null;
    for (TextEdit edit : sorted) {
      if (!edit.isValid(length)
          || edit.start < end
          || last != null && sameChange(last, edit)) {
        rejected.add(edit);
      } else {
        accepted.add(edit);
        end = edit.end;
        last = edit;
      }
    }
    return new Plan(accepted.build(), rejected.build());
  }

  private static boolean sameChange(TextEdit e1, TextEdit e2) {
    return e1.start == e2.start
        && e1.end == e2.end
        && e1.text.equals(e2.text);
  }

  /**
   * Splices edits into a source string. The edits must be sorted, valid and
   * non-overlapping, as the accepted edits of a {@link Plan} are.
   */
  public static String apply(String source, List<TextEdit> accepted) {
    final StringBuilder b = new StringBuilder(source.length());
    int cursor = 0;
    for (TextEdit edit : accepted) {
      b.append(source, cursor, edit.start).append(edit.text);
      cursor = edit.end;
    }
    return b.append(source, cursor, source.length()).toString();
  }

  /** Result of {@link #plan}. */
  public static class Plan {
    /** Edits to apply, sorted by offset. */
    public final List<TextEdit> accepted;
    /** Edits that were invalid or overlapped an accepted edit. */
    public final List<TextEdit> rejected;

    Plan(List<TextEdit> accepted, List<TextEdit> rejected) {
      this.accepted = requireNonNull(accepted);
      this.rejected = requireNonNull(rejected);
    }
  }
}

// End EditComposer.java
