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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Edits registered by the rewrites of one optimization, in the order they were
 * registered.
 *
 * <p>A rewrite registers a group of edits only if none of them overlaps an
 * edit that is already registered. Since statements are analyzed before
 * expressions, and an expression before its operands, the larger rewrite
 * wins.
 */
public class EditList {
  private final List<TextEdit> edits = new ArrayList<>();

  /**
   * Registers a group of edits, all or none. Returns false, and registers
   * nothing, if any of them overlaps an edit already registered.
   */
  public boolean tryAdd(TextEdit... group) {
    for (TextEdit edit : group) {
      if (overlaps(edit.start, edit.end)) {
        return false;
      }
    }
    for (TextEdit edit : group) {
      edits.add(edit);
    }
    return true;
  }

  /** Returns whether {@code [start, end)} overlaps a registered edit. */
  public boolean overlaps(int start, int end) {
    for (TextEdit edit : edits) {
      if (edit.overlaps(start, end)) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmpty() {
    return edits.isEmpty();
  }

  /** Returns the registered edits, in registration order. */
  public List<TextEdit> toList() {
    return ImmutableList.copyOf(edits);
  }
}

// End EditList.java
