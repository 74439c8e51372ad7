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

/** Tests for {@link Evaluator}. */
public class EvaluatorTest {
  private static Scalar eval(String s) {
    return Evaluator.evaluate(new GmlParser(s).expressionEof());
  }

  @Test void testArithmetic() {
    assertThat(eval("1 + 2 * 3"), is(Scalar.of(7)));
    assertThat(eval("(1 + 2) * 3"), is(Scalar.of(9)));
    assertThat(eval("-(4 - 6)"), is(Scalar.of(2)));
    assertThat(eval("7 div 2"), is(Scalar.of(3)));
    assertThat(eval("-7 div 2"), is(Scalar.of(-3)));
    assertThat(eval("7 mod 4"), is(Scalar.of(3)));
    assertThat(eval("1 / 4"), is(Scalar.of(0.25)));
    assertThat(eval("6 & 3 | 8"), is(Scalar.of(10)));
    assertThat(eval("1 << 4"), is(Scalar.of(16)));
    assertThat(eval("~0"), is(Scalar.of(-1)));
    assertThat(eval("~4294967296"), is(Scalar.of(-4294967297d)));
    assertThat(eval("~2147483648 & 4294967295"), is(Scalar.of(2147483647)));
  }

  @Test void testComparisonAndLogic() {
    assertThat(eval("2 > 1"), is(Scalar.TRUE));
    assertThat(eval("2 <= 1"), is(Scalar.FALSE));
    assertThat(eval("1 == 1.0"), is(Scalar.TRUE));
    assertThat(eval("0 == -0"), is(Scalar.TRUE));
    assertThat(eval("true != false"), is(Scalar.TRUE));
    assertThat(eval("!true"), is(Scalar.FALSE));
    assertThat(eval("!0"), is(Scalar.TRUE));
    assertThat(eval("true ^^ true"), is(Scalar.FALSE));
  }

  /** "and" and "or" are decided by one known operand. */
  @Test void testShortCircuit() {
    assertThat(eval("false && x"), is(Scalar.FALSE));
    assertThat(eval("x && false"), is(Scalar.FALSE));
    assertThat(eval("true || x"), is(Scalar.TRUE));
    assertThat(eval("true && x"), nullValue());
    assertThat(eval("false || x"), nullValue());
    assertThat(eval("true ^^ x"), nullValue());
  }

  @Test void testNotConstant() {
    assertThat(eval("x"), nullValue());
    assertThat(eval("x + 1"), nullValue());
    assertThat(eval("f(1)"), nullValue());
    assertThat(eval("\"a\""), nullValue());
    assertThat(eval("undefined"), nullValue());
    assertThat(eval("true + 1"), nullValue());
    assertThat(eval("1 == true"), nullValue());
  }

  @Test void testDivisionByZero() {
    assertThat(eval("1 / 0"), nullValue());
    assertThat(eval("1 div 0"), nullValue());
    assertThat(eval("1 mod (2 - 2)"), nullValue());
    assertThat(Evaluator.evaluateNumber(new GmlParser("1 / 0").expressionEof()),
        nullValue());
  }

  @Test void testTruthiness() {
    assertThat(Scalar.of(0.6).isTruthy(), is(true));
    assertThat(Scalar.of(0.5).isTruthy(), is(false));
    assertThat(Scalar.of(-1).isTruthy(), is(false));
    assertThat(Scalar.TRUE.isTruthy(), is(true));
  }
}

// End EvaluatorTest.java
