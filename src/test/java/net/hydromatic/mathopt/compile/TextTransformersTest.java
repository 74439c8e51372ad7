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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.mathopt.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests for {@link TextTransformers}. */
public class TextTransformersTest {
  @Test void testMultiplicationByOne() {
    final TextTransformer t = TextTransformers.multiplicationByOne();
    assertThat(t.apply("y = x * 1;"), is("y = x;"));
    assertThat(t.apply("y = 1 * x + z * 1 - w;"), is("y = x + z - w;"));
    assertThat(t.apply("y = -1 * x;"), is("y = -x;"));
    assertThat(t.apply("y = x * 10 + x * 1.5 + x * 1e3;"),
        is("y = x * 10 + x * 1.5 + x * 1e3;"));
    assertThat(t.apply("y = a / 1 * b;"), is("y = a / 1 * b;"));
    assertThat(t.apply("y = a mod 1 * b;"), is("y = a mod 1 * b;"));
    assertThat(t.apply("y = v1 * b;"), is("y = v1 * b;"));
    assertThat(t.apply("x *= 1;"), is("x *= 1;"));
    // negation applies to the 1 only
    assertThat(t.apply("y = !1 * x;"), is("y = !1 * x;"));
    assertThat(t.apply("y = ! 1 * x;"), is("y = ! 1 * x;"));
    assertThat(t.apply("y = ~1 * x;"), is("y = ~1 * x;"));
    assertThat(t.apply("y = not 1 * x;"), is("y = not 1 * x;"));
    assertThat(t.apply("y = a != 1 * x;"), is("y = a != x;"));
    final String s = "s = \"x * 1\"; // 1 * y\n";
    assertThat(t.apply(s), is(s));
  }

  @Test void testUndefinedGuard() {
    final TextTransformer t = TextTransformers.undefinedGuard();
    final String s = "if (!is_undefined(m)) { x *= m; }\n"
        + "d = sqrt(x);\n";
    assertThat(t.apply(s), is("x *= m ?? 1;\nd = sqrt(x);\n"));
    // not with "else"
    final String s2 = "if (!is_undefined(m)) { x *= m; } else { x = 0; }\n"
        + "d = sqrt(x);\n";
    assertThat(t.apply(s2), is(s2));
    // not outside numeric code
    final String s3 = "if (!is_undefined(m)) { x *= m; }\n";
    assertThat(t.apply(s3), is(s3));
  }

  @Test void testZeroCheck() {
    final TextTransformer t = TextTransformers.zeroCheck("eps");
    assertThat(t.apply("if (len != 0) { d = point_distance(0, 0, a, b); }"),
        is("if (abs(len) > eps()) { d = point_distance(0, 0, a, b); }"));
    assertThat(t.apply("if (len != 0.5) { d = sqrt(len); }"),
        is("if (len != 0.5) { d = sqrt(len); }"));
    assertThat(t.apply("if (count != 0) { show(count); }"),
        is("if (count != 0) { show(count); }"));
  }

  /** Sensitivity is decided by the innermost enclosing block. */
  @Test void testNumericallySensitive() {
    final String s = "{ a = sqrt(b); }\n{ if (c != 0) { e = 1; } }";
    final boolean[] mask = Parsers.codeMask(s);
    assertThat(
        TextTransformers.isNumericallySensitive(s, mask, s.indexOf("a =")),
        is(true));
    assertThat(
        TextTransformers.isNumericallySensitive(s, mask, s.indexOf("if")),
        is(false));
    final String s2 = "x = 1; // sqrt(y)\n";
    assertThat(
        TextTransformers.isNumericallySensitive(s2, Parsers.codeMask(s2), 0),
        is(false));
  }

  @Test void testApplyAll() {
    final List<String> names = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnTransform(Tracers.empty(), names::add);
    final String s = "if (d != 0) { r = sqrt(d * 1); }";
    final String result =
        TextTransformers.applyAll(TextTransformers.standard(ImmutableMap.of()),
            s, tracer);
    assertThat(result,
        is("if (abs(d) > math_get_epsilon()) { r = sqrt(d); }"));
    assertThat(names, is(ImmutableList.of("multiplication-by-one",
        "zero-check")));
  }
}

// End TextTransformersTest.java
