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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.mathopt.ast.AstNode;
import net.hydromatic.mathopt.ast.Pos;

/**
 * Accumulates the positions of the tokens and nodes that make up a statement
 * or expression while {@link GmlParser} reads it.
 *
 * <p>A production typically starts with {@code Span.of(consume().pos)} and
 * finishes with {@code s.end(this)}, which returns the position from the
 * first token to the last token consumed.
 */
public final class Span {
  private final List<Pos> posList = new ArrayList<>();

  private Span() {}

  /** Creates a Span that starts at a given position. */
  public static Span of(Pos p) {
    return new Span().add(p);
  }

  public Span add(Pos pos) {
    posList.add(pos);
    return this;
  }

  public Span add(AstNode n) {
    return add(n.pos);
  }

  /** Adds the position of the last token that the parser consumed. */
  public Span add(GmlParser parser) {
    return add(parser.pos());
  }

  /** Returns the position that covers everything added so far. */
  public Pos pos() {
    return posList.size() == 1 ? posList.get(0) : Pos.sum(posList);
  }

  /** Adds the last token consumed and returns the covering position. */
  public Pos end(GmlParser parser) {
    return add(parser).pos();
  }

  /** Adds a node and returns the covering position. */
  public Pos end(AstNode n) {
    return add(n).pos();
  }
}

// End Span.java
