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
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.mathopt.parse.GmlParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScalarCondenser}. */
public class ScalarCondenserTest {
  private static String condense(String s) {
    return new ScalarCondenser(s, 12)
        .condense(new GmlParser(s).expressionEof());
  }

  @Test void testCondense() {
    assertThat(condense("((hp / max_hp) * 100) / 10"),
        is("(hp / max_hp) * 10"));
    assertThat(condense("a / b * 2 * 3"), is("a / b * 6"));
    assertThat(condense("2 * (x + 1) * 0.25"), is("(x + 1) * 0.5"));
  }

  /** A coefficient of 1 or -1 is not written. */
  @Test void testUnit() {
    assertThat(condense("(x + 1) * 2 / 2"), is("(x + 1)"));
    assertThat(condense("(x + 1) * -4 / 4"), is("-(x + 1)"));
  }

  @Test void testNothingToCondense() {
    assertThat(condense("(x + 1) * 2"), nullValue());
    assertThat(condense("a + b"), nullValue());
    assertThat(condense("2 * 3"), nullValue());
    assertThat(condense("a / b"), nullValue());
    assertThat(condense("(x + 1) * 2 / 0"), nullValue());
    assertThat(condense("(x + 1) * 0 * 3"), nullValue());
  }
}

// End ScalarCondenserTest.java
