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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls the optimizer.
 *
 * <p>Values live in a {@code Map<Prop, Object>} that the caller passes to
 * {@link MathOptimizer}; a property that is not in the map has its default
 * value.
 */
public enum Prop {
  /**
   * Boolean property "simplifyExpressions" controls whether products and
   * quotients are rewritten into canonical form, for example {@code foo * 2 *
   * 3} to {@code 6 * foo}. Default is true.
   */
  SIMPLIFY_EXPRESSIONS("simplifyExpressions", Boolean.class, true, true),

  /**
   * Boolean property "foldPatterns" controls whether the expression patterns
   * (reciprocal division, sum of squares, additive identity) are applied.
   * Default is true.
   */
  FOLD_PATTERNS("foldPatterns", Boolean.class, true, true),

  /**
   * Boolean property "foldHalfRotations" controls whether a variable
   * declaration followed by a half-lengthdir adjustment of the same variable
   * is fused into one declaration. Default is true.
   */
  FOLD_HALF_ROTATIONS("foldHalfRotations", Boolean.class, true, true),

  /**
   * Boolean property "convertManualMathToBuiltins" controls whether
   * hand-written math such as {@code x * x} or {@code (a + b) / 2} is
   * replaced by the built-in function that computes it ({@code sqr},
   * {@code mean}). Applies only when {@link #FOLD_PATTERNS} is set. Default
   * is false.
   */
  CONVERT_MANUAL_MATH_TO_BUILTINS("convertManualMathToBuiltins",
      Boolean.class, true, false),

  /**
   * Boolean property "eliminateDeadUpdates" controls whether runs of
   * increments, decrements and compound assignments that cancel out are
   * removed. Default is true.
   */
  ELIMINATE_DEAD_UPDATES("eliminateDeadUpdates", Boolean.class, true, true),

  /**
   * Boolean property "canonicalTextPasses" controls whether the text
   * transformers run after the tree-based edits have been applied. Default is
   * true.
   */
  CANONICAL_TEXT_PASSES("canonicalTextPasses", Boolean.class, true, true),

  /**
   * Enum property "coefficientPlacement" controls where a rebuilt product puts
   * its numeric coefficient. Default is {@link
   * CoefficientPlacement#FRACTION_SUFFIX}.
   */
  COEFFICIENT_PLACEMENT(
      "coefficientPlacement",
      CoefficientPlacement.class,
      true,
      CoefficientPlacement.FRACTION_SUFFIX),

  /**
   * Integer property "coefficientPrecision" is the number of significant
   * digits with which a folded coefficient is printed. Default is 12.
   */
  COEFFICIENT_PRECISION("coefficientPrecision", Integer.class, true, 12),

  /**
   * String property "rotationFunction" is the name of the function that the
   * half-rotation fusion recognizes and emits. Default is "lengthdir_x".
   */
  ROTATION_FUNCTION("rotationFunction", String.class, true, "lengthdir_x"),

  /**
   * String property "distanceFunction" is the name of the function that
   * replaces a three-term square root of squares. Default is
   * "point_distance_3d".
   */
  DISTANCE_FUNCTION("distanceFunction", String.class, true,
      "point_distance_3d"),

  /**
   * String property "distance2dFunction" is the name of the function that
   * replaces a two-term square root of squares. Default is "point_distance".
   */
  DISTANCE2D_FUNCTION("distance2dFunction", String.class, true,
      "point_distance"),

  /**
   * String property "epsilonFunction" is the name of the function whose value
   * replaces zero in comparisons against zero. Default is "math_get_epsilon".
   */
  EPSILON_FUNCTION("epsilonFunction", String.class, true, "math_get_epsilon");

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, allowing strings for boolean, integer and
   * enum types.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent(
                (Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException(
              "value must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Boolean.class) {
        checkArgument(
            s.equals("true") || s.equals("false"),
            "value for property %s must be 'true' or 'false'",
            camelName);
        set(map, Boolean.valueOf(s));
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be an integer", e);
        }
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #COEFFICIENT_PLACEMENT} property. */
  public enum CoefficientPlacement {
    /**
     * The coefficient leads, unless it is a positive fraction less than 1 and
     * there is at least one other factor, in which case it goes last. The
     * default.
     */
    FRACTION_SUFFIX,
    /** The coefficient always leads. */
    PREFIX
  }
}

// End Prop.java
