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
package net.hydromatic.mathopt;

import static net.hydromatic.mathopt.Gml.gml;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.mathopt.compile.Prop;
import net.hydromatic.mathopt.compile.TextEdit.Origin;
import net.hydromatic.mathopt.parse.MathParseException;
import org.junit.jupiter.api.Test;

/** Tests the whole pipeline, from source text to rewritten text. */
public class MathOptTest {
  @Test void testHalfRotation() {
    final String source =
        "var s = 1.3 * size * 0.12 / 1.5;\n"
            + "s = s - s / 2 - lengthdir_x(s / 2, angle);\n";
    final String expected =
        "var s = size * 0.052 * (1 - lengthdir_x(1, angle));\n";
    gml(source)
        .assertRewrite(expected)
        .assertOrigins(is(ImmutableList.of(Origin.HALF_ROTATION,
            Origin.HALF_ROTATION)))
        .assertIdempotent();
  }

  @Test void testHalfRotationDisabled() {
    final String source =
        "var s = 1.3 * size * 0.12 / 1.5;\n"
            + "s = s - s / 2 - lengthdir_x(s / 2, angle);\n";
    final String expected =
        "var s = size * 0.104;\n"
            + "s = s - s * 0.5 - lengthdir_x(s * 0.5, angle);\n";
    gml(source)
        .with(Prop.FOLD_HALF_ROTATIONS, false)
        .assertRewrite(expected);
  }

  /** The adjustment must assign the variable that was declared. */
  @Test void testHalfRotationOtherVariable() {
    final String source =
        "var s = 2 * size;\n"
            + "t = t - t / 2 - lengthdir_x(t / 2, angle);\n";
    final String expected =
        "var s = 2 * size;\n"
            + "t = t - t * 0.5 - lengthdir_x(t * 0.5, angle);\n";
    gml(source).assertRewrite(expected);
  }

  /** The angle must not read the variable, which does not exist yet. */
  @Test void testHalfRotationAngleReadsVariable() {
    final String source =
        "var s = 2 * size;\n"
            + "s = s - s / 2 - lengthdir_x(s / 2, s);\n";
    final String expected =
        "var s = 2 * size;\n"
            + "s = s - s * 0.5 - lengthdir_x(s * 0.5, s);\n";
    gml(source).assertRewrite(expected);
  }

  /** Rebuilding a product would lose a comment inside it. */
  @Test void testCommentInsideProduct() {
    gml("y = value /* keep */ * value;\n").assertUnchanged();
    gml("y = a /* two */ * 2 * 3;\n").assertUnchanged();
    gml("y = value / /* k */ (1 / denom);\n").assertUnchanged();
    gml("x = foo * 2 * 3; // six\n").assertRewrite("x = 6 * foo; // six\n");
  }

  /** A replacement that starts with a sign is kept apart from a sign. */
  @Test void testSignAfterSign() {
    gml("y = a-b*-2;\n")
        .assertRewrite("y = a- -2 * b;\n")
        .assertIdempotent();
    gml("y = a+b*-2;\n").assertRewrite("y = a+ -2 * b;\n");
    gml("y = a-b*2;\n").assertRewrite("y = a-2 * b;\n");
  }

  @Test void testNegatedOne() {
    gml("y = !1 * x;\n").assertUnchanged();
  }

  @Test void testCondense() {
    gml("var s7 = ((hp / max_hp) * 100) / 10;\n")
        .assertRewrite("var s7 = (hp / max_hp) * 10;\n")
        .assertOrigins(is(ImmutableList.of(Origin.CONDENSE)))
        .assertIdempotent();
  }

  @Test void testReciprocal() {
    gml("y = value / (1 / denom);\n")
        .assertRewrite("y = value * denom;\n")
        .assertOrigins(is(ImmutableList.of(Origin.RECIPROCAL)));
  }

  /** Without patterns, the simplifier reaches the same text. */
  @Test void testReciprocalWithoutPatterns() {
    gml("y = value / (1 / denom);\n")
        .with(Prop.FOLD_PATTERNS, false)
        .assertRewrite("y = value * denom;\n")
        .assertOrigins(is(ImmutableList.of(Origin.SIMPLIFY)));
  }

  @Test void testFoldConstants() {
    gml("x = foo * 2 * 3;\n")
        .assertRewrite("x = 6 * foo;\n")
        .assertIdempotent();
    gml("x = 0 * foo;\n").assertRewrite("x = 0;\n");
    gml("x = foo / 2;\n").assertRewrite("x = foo * 0.5;\n");
    gml("x = foo / 2;\n")
        .with(Prop.COEFFICIENT_PLACEMENT, Prop.CoefficientPlacement.PREFIX)
        .assertRewrite("x = 0.5 * foo;\n");
    gml("x = a*2*3;\n").assertRewrite("x = 6 * a;\n");
  }

  @Test void testFoldInsideLargerExpression() {
    gml("x = a + b * 2 * 3;\n").assertRewrite("x = a + 6 * b;\n");
    gml("x = c / (b * 2 * 3);\n").assertRewrite("x = c / (6 * b);\n");
    gml("x = max(a * 2 * 3, 1);\n").assertRewrite("x = max(6 * a, 1);\n");
  }

  @Test void testUnchanged() {
    gml("x = foo;\n").assertUnchanged();
    gml("x = 6 * foo;\n").assertUnchanged();
    gml("var x = 0.50;\n").assertUnchanged();
    gml("x = a + b;\n").assertUnchanged();
    gml("x = \"a\" + string(b);\n").assertUnchanged();
    gml("x = 0 - y;\n").assertUnchanged();
    gml("// x * 1\nvar t = \"a * 1\"; // keep\n").assertUnchanged();
  }

  @Test void testCondition() {
    gml("if (a * 2 * 3) {\n  b = 1;\n}\n")
        .assertRewrite("if (6 * a) {\n  b = 1;\n}\n");
    gml("if (a * 2 * 3 > 0) {\n  b = 1;\n}\n")
        .assertRewrite("if (6 * a > 0) {\n  b = 1;\n}\n");
  }

  @Test void testSumOfSquares() {
    gml("d = sqrt(dx * dx + dy * dy + dz * dz);\n")
        .assertRewrite("d = point_distance_3d(0, 0, 0, dx, dy, dz);\n")
        .assertIdempotent();
    gml("d = sqrt(a * a + b * b);\n")
        .assertRewrite("d = point_distance(0, 0, a, b);\n");
    gml("d = sqrt(a * b + c * c);\n").assertUnchanged();
  }

  @Test void testAdditiveIdentity() {
    gml("y = x + 0;\n").assertRewrite("y = x;\n");
    gml("y = 0 + x;\n").assertRewrite("y = x;\n");
    gml("y = x - 0;\n").assertRewrite("y = x;\n");
  }

  @Test void testDeadUpdates() {
    gml("x++;\nx--;\nx += 0;\n").assertRewrite("");
    gml("x++;\nx--;\nx += 1;\n").assertUnchanged();
    gml("x++;\nx--;\n")
        .with(Prop.ELIMINATE_DEAD_UPDATES, false)
        .assertUnchanged();
  }

  @Test void testDeadUpdatesInNestedBlocks() {
    gml("function f() {\n  x++;\n  x--;\n  return x;\n}\n")
        .assertRewrite("function f() {\n  return x;\n}\n");
    final String source = "switch (k) {\n"
        + "  case 1:\n"
        + "    x += 2;\n"
        + "    x -= 2;\n"
        + "    break;\n"
        + "}\n";
    final String expected = "switch (k) {\n"
        + "  case 1:\n"
        + "    break;\n"
        + "}\n";
    gml(source).assertRewrite(expected);
  }

  @Test void testMultiplicationByOne() {
    gml("y = x * 1 + z;\n")
        .with(Prop.SIMPLIFY_EXPRESSIONS, false)
        .assertRewrite("y = x + z;\n");
    gml("y = x * 1 + z;\n")
        .with(Prop.SIMPLIFY_EXPRESSIONS, false)
        .with(Prop.CANONICAL_TEXT_PASSES, false)
        .assertUnchanged();
  }

  @Test void testZeroCheck() {
    gml("if (d != 0) {\n  r = sqrt(d);\n}\n")
        .assertRewrite(
            "if (abs(d) > math_get_epsilon()) {\n  r = sqrt(d);\n}\n");
    gml("if (count != 0) {\n  show(count);\n}\n").assertUnchanged();
  }

  @Test void testUndefinedGuard() {
    gml("if (!is_undefined(m)) { x *= m; }\n"
            + "d = point_distance(0, 0, x, y);\n")
        .assertRewrite("x *= m ?? 1;\n"
            + "d = point_distance(0, 0, x, y);\n")
        .assertIdempotent();
  }

  @Test void testParseError() {
    final MathParseException e =
        assertThrows(MathParseException.class,
            () -> MathOpt.rewrite("x = (1 + ;\n"));
    assertThat(e.getMessage(), containsString("';'"));
  }

  @Test void testManualMathToBuiltins() {
    final String source = "var d2 = dx * dx;\n"
        + "var mid = (x1 + x2) / 2;\n"
        + "var bits = ln(n) / ln(2);\n"
        + "var dot = ax * bx + ay * by;\n"
        + "var r = power(area, 0.5);\n"
        + "var len = sqrt(dx * dx + dy * dy);\n";
    gml("var d2 = dx * dx;\nvar r = power(area, 0.5);\n").assertUnchanged();
    gml(source)
        .with(Prop.CONVERT_MANUAL_MATH_TO_BUILTINS, true)
        .assertRewrite("var d2 = sqr(dx);\n"
            + "var mid = mean(x1, x2);\n"
            + "var bits = log2(n);\n"
            + "var dot = dot_product(ax, ay, bx, by);\n"
            + "var r = sqrt(area);\n"
            + "var len = point_distance(0, 0, dx, dy);\n")
        .assertIdempotent();
  }

  @Test void testIdempotent() {
    final String source = "var a = b * 2 * 3;\n"
        + "var c = d / 4;\n"
        + "e = sqrt(f * f + g * g);\n"
        + "if (h * 2 * 2 > 1) {\n"
        + "  i = j / (1 / k);\n"
        + "}\n";
    gml(source).assertIdempotent();
  }
}

// End MathOptTest.java
