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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.SIMPLIFY_EXPRESSIONS.booleanValue(map), is(true));
    assertThat(Prop.COEFFICIENT_PRECISION.intValue(map), is(12));
    assertThat(Prop.ROTATION_FUNCTION.stringValue(map), is("lengthdir_x"));
    assertThat(
        Prop.COEFFICIENT_PLACEMENT.enumValue(map,
            Prop.CoefficientPlacement.class),
        is(Prop.CoefficientPlacement.FRACTION_SUFFIX));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("foldPatterns"), is(Prop.FOLD_PATTERNS));
    assertThat(Prop.lookup("FOLD_PATTERNS"), is(Prop.FOLD_PATTERNS));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("noSuchProperty"));
    assertThat(e.getMessage(), is("property noSuchProperty not found"));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.FOLD_PATTERNS.setLenient(map, "false");
    assertThat(Prop.FOLD_PATTERNS.booleanValue(map), is(false));
    Prop.COEFFICIENT_PRECISION.setLenient(map, "6");
    assertThat(Prop.COEFFICIENT_PRECISION.intValue(map), is(6));
    Prop.COEFFICIENT_PLACEMENT.setLenient(map, "prefix");
    assertThat(
        Prop.COEFFICIENT_PLACEMENT.enumValue(map,
            Prop.CoefficientPlacement.class),
        is(Prop.CoefficientPlacement.PREFIX));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.FOLD_PATTERNS.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.COEFFICIENT_PRECISION.setLenient(map, "six"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.COEFFICIENT_PLACEMENT.setLenient(map, "middle"));
    assertThat(e.getMessage(),
        is("value must be one of: 'FRACTION_SUFFIX', 'PREFIX'"));
  }

  @Test void testWrongType() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThrows(IllegalArgumentException.class,
        () -> Prop.FOLD_PATTERNS.set(map, 3));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.FOLD_PATTERNS.intValue(map));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.FOLD_PATTERNS.set(map, null));
  }
}

// End PropTest.java
