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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.parse.GmlParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link DeadUpdates}. */
public class DeadUpdatesTest {
  /** Analyzes a program and returns its text after deletions. */
  private static String remove(String s) {
    final Ast.Program program = new GmlParser(s).program();
    final EditList edits = new EditList();
    new DeadUpdates(s).analyze(program.statements, edits);
    return EditComposer.compose(s, edits.toList());
  }

  private static List<DeadUpdates.Run> runs(String s) {
    final Ast.Program program = new GmlParser(s).program();
    return new DeadUpdates(s).analyze(program.statements, new EditList());
  }

  @Test void testCancellingUpdates() {
    assertThat(remove("x++;\nx--;\nx += 0;\n"), is(""));
    assertThat(remove("x += 2;\nx -= 1 + 1;\ny = 3;\n"), is("y = 3;\n"));
    assertThat(remove("a = 1;\n  x -= 0.5;\n  x += 0.5;\nb = 2;\n"),
        is("a = 1;\nb = 2;\n"));
  }

  @Test void testNetChange() {
    assertThat(remove("x++;\nx--;\nx += 1;\n"), is("x++;\nx--;\nx += 1;\n"));
    final List<DeadUpdates.Run> runs = runs("x++;\nx--;\nx += 1;\n");
    assertThat(runs.size(), is(1));
    assertThat(runs.get(0).variable, is("x"));
    assertThat(runs.get(0).delta(), is(1d));
    assertThat(runs.get(0).statementIndices(), is(ImmutableList.of(0, 1, 2)));
    assertThat(runs.get(0).state(), is(DeadUpdates.State.DISCARDED));
  }

  /** Runs of different variables are independent. */
  @Test void testInterleaved() {
    assertThat(remove("x++;\ny++;\nx--;\n"), is("y++;\n"));
    final List<DeadUpdates.Run> runs = runs("x++;\ny++;\nx--;\n");
    assertThat(runs.size(), is(2));
    assertThat(runs.get(0).state(), is(DeadUpdates.State.FLUSHED));
    assertThat(runs.get(1).state(), is(DeadUpdates.State.DISCARDED));
  }

  @Test void testFlush() {
    // a call might read x
    assertThat(remove("x++;\nshow(x);\nx--;\n"), is("x++;\nshow(x);\nx--;\n"));
    // an assignment that reads x
    assertThat(remove("x++;\ny = x;\nx--;\n"), is("x++;\ny = x;\nx--;\n"));
    // an index that reads x
    assertThat(remove("x++;\na[x] = 0;\nx--;\n"),
        is("x++;\na[x] = 0;\nx--;\n"));
    // assigning x ends its run
    assertThat(remove("x++;\nx = 5;\nx--;\n"), is("x++;\nx = 5;\nx--;\n"));
    // an assignment that does not read x does not end the run
    assertThat(remove("x++;\ny = 2;\nx--;\n"), is("y = 2;\n"));
    // nor a call-free assignment to another variable of a constant
    assertThat(remove("x++;\nb.c = 2;\nx--;\n"), is("b.c = 2;\n"));
  }

  @Test void testUpdateAmountNotConstant() {
    assertThat(remove("x += n;\nx -= n;\n"), is("x += n;\nx -= n;\n"));
  }

  @Test void testIdentityUpdate() {
    assertThat(remove("x *= 1;\ny /= 1.0;\nz *= 2;\n"), is("z *= 2;\n"));
  }

  /** A statement that shares a line with another keeps the line. */
  @Test void testSameLine() {
    assertThat(remove("x++; x--; y = 1;\n"), is("y = 1;\n"));
  }
}

// End DeadUpdatesTest.java
