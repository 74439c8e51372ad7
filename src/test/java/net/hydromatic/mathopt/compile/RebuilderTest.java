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
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Rebuilder}. */
public class RebuilderTest {
  private final Rebuilder rebuilder = new Rebuilder();

  private String rebuild(double coefficient, Map<String, Integer> factors) {
    return rebuilder.rebuild(Components.of(coefficient, factors));
  }

  @Test void testCoefficientPlacement() {
    assertThat(rebuild(0.5, ImmutableMap.of("x", 1)), is("x * 0.5"));
    assertThat(rebuild(6, ImmutableMap.of("foo", 1)), is("6 * foo"));
    assertThat(rebuild(-0.5, ImmutableMap.of("x", 1)), is("-0.5 * x"));
    assertThat(rebuild(1, ImmutableMap.of("x", 1)), is("x"));
    assertThat(rebuild(-1, ImmutableMap.of("x", 1)), is("-1 * x"));

    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.COEFFICIENT_PLACEMENT.set(map, Prop.CoefficientPlacement.PREFIX);
    assertThat(new Rebuilder(map)
            .rebuild(Components.of(0.5, ImmutableMap.of("x", 1))),
        is("0.5 * x"));
  }

  @Test void testFactors() {
    assertThat(rebuild(2, ImmutableMap.of("a", 2, "b", 1)),
        is("2 * a * a * b"));
    assertThat(rebuild(3, ImmutableMap.of("a - b", 1)), is("3 * (a - b)"));
    assertThat(rebuild(3, ImmutableMap.of("f(a - b)", 1)),
        is("3 * f(a - b)"));
    assertThat(rebuild(3, ImmutableMap.of("a", -1)), nullValue());
  }

  @Test void testConstants() {
    assertThat(rebuild(0, ImmutableMap.of("x", 1)), is("0"));
    assertThat(rebuild(1e-12, ImmutableMap.of("x", 1)), is("0"));
    assertThat(rebuild(0, ImmutableMap.of("a", -1)), is("0"));
    assertThat(rebuild(1, ImmutableMap.of()), is("1"));
    assertThat(rebuild(0.1 + 0.2, ImmutableMap.of()), is("0.3"));
  }

  @Test void testFormat() {
    assertThat(Rebuilder.format(0.052000000000000005, 12), is("0.052"));
    assertThat(Rebuilder.format(1.0 / 3, 12), is("0.3333333333333333"));
    assertThat(Rebuilder.format(0.1 * 3, 12), is("0.3"));
    assertThat(Rebuilder.format(1234567890124d, 12), is("1234567890124"));
    assertThat(Rebuilder.format(8641975230861d, 12), is("8641975230861"));
    assertThat(Rebuilder.format(2.5e-7, 12), is("0.00000025"));
    assertThat(Rebuilder.format(1e20, 12), is("100000000000000000000"));
    assertThat(Rebuilder.format(-2.50, 12), is("-2.5"));
    assertThat(Rebuilder.format(0, 12), is("0"));
    assertThat(Rebuilder.format(Double.NaN, 12), nullValue());
  }

  @Test void testNoOp() {
    assertThat(Rebuilder.isNoOp("x", "x"), is(true));
    assertThat(Rebuilder.isNoOp("(x * 2)", "x * 2"), is(true));
    assertThat(Rebuilder.isNoOp("2 * x", "x * 2"), is(false));
  }
}

// End RebuilderTest.java
