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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.mathopt.parse.GmlParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Collector} and {@link Components}. */
public class CollectorTest {
  private static Components collect(String s) {
    return new Collector(s).collect(new GmlParser(s).expressionEof());
  }

  @Test void testCollect() {
    assertThat(collect("foo * 2 * 3"),
        is(Components.of(6, ImmutableMap.of("foo", 1))));
    assertThat(collect("3 * a * b / a / a"),
        is(Components.of(3, ImmutableMap.of("a", -1, "b", 1))));
    assertThat(collect("-x * 4"),
        is(Components.of(4, ImmutableMap.of("-x", 1))));
    assertThat(collect("-(x * 4)"),
        is(Components.of(-4, ImmutableMap.of("x", 1))));
    assertThat(collect("(2 + 3) * y"),
        is(Components.of(5, ImmutableMap.of("y", 1))));
    assertThat(collect("x"), is(Components.factor("x")));
    assertThat(collect("1.5"), is(Components.of(1.5)));
  }

  /** Factors are keyed by their text, without enclosing parentheses. */
  @Test void testOpaqueFactors() {
    assertThat(collect("other.speed * lengthdir_x(1, dir) * 2"),
        is(Components.of(2,
            ImmutableMap.of("other.speed", 1, "lengthdir_x(1, dir)", 1))));
    assertThat(collect("(a - b) * (a - b)"),
        is(Components.of(1, ImmutableMap.of("a - b", 2))));
    assertThat(collect("grid[# i, j] / 4"),
        is(Components.of(0.25, ImmutableMap.of("grid[# i, j]", 1))));
  }

  @Test void testCannotCollect() {
    assertThat(collect("a + 1"), nullValue());
    assertThat(collect("x * (a + 1)"), nullValue());
    assertThat(collect("x / 0"), nullValue());
    assertThat(collect("x / (2 - 2)"), nullValue());
    assertThat(collect("\"s\" * 2"), nullValue());
    assertThat(collect("a mod 2"), nullValue());
  }

  @Test void testOpaque() {
    assertThat(Collector.isOpaque(new GmlParser("a.b[c]").expressionEof()),
        is(true));
    assertThat(Collector.isOpaque(new GmlParser("-f(x)").expressionEof()),
        is(true));
    assertThat(Collector.isOpaque(new GmlParser("a - b").expressionEof()),
        is(true));
    assertThat(Collector.isOpaque(new GmlParser("a - 1").expressionEof()),
        is(false));
    assertThat(Collector.isOpaque(new GmlParser("2").expressionEof()),
        is(false));
  }

  @Test void testComponents() {
    final Components a = Components.of(2, ImmutableMap.of("x", 1));
    final Components b = Components.of(4, ImmutableMap.of("x", 1, "y", 1));
    assertThat(a.divide(b), is(Components.of(0.5, ImmutableMap.of("y", -1))));
    assertThat(a.divide(b).hasNegativeExponent(), is(true));
    assertThat(a.times(b).toString(), is("{8.0, {x=2, y=1}}"));
    assertThat(a.scale(0.5).negate(), is(Components.of(-1,
        ImmutableMap.of("x", 1))));
    final Components c = Components.of(0.1 + 0.2, ImmutableMap.of("x", 1));
    assertThat(c.isEquivalentTo(Components.of(0.3, ImmutableMap.of("x", 1))),
        is(true));
    assertThat(c.equals(Components.of(0.3, ImmutableMap.of("x", 1))),
        is(false));
  }
}

// End CollectorTest.java
