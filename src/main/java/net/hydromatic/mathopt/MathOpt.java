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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.mathopt.ast.Ast;
import net.hydromatic.mathopt.compile.MathOptimizer;
import net.hydromatic.mathopt.compile.Prop;
import net.hydromatic.mathopt.compile.Tracer;
import net.hydromatic.mathopt.compile.Tracers;
import net.hydromatic.mathopt.parse.GmlParser;

/** Entry points for rewriting GML source text. */
public abstract class MathOpt {
  private MathOpt() {}

  /**
   * Rewrites a source string with default properties.
   *
   * @throws net.hydromatic.mathopt.parse.MathParseException if the source
   *     cannot be parsed
   */
  public static String rewrite(String source) {
    return rewrite(source, "", ImmutableMap.of(), Tracers.empty()).text;
  }

  /** Parses and rewrites a source string. */
  public static MathOptimizer.Result rewrite(
      String source, String file, Map<Prop, Object> propMap, Tracer tracer) {
    final Ast.Program program = new GmlParser(source, file).program();
    return new MathOptimizer(propMap, tracer).optimize(source, program);
  }
}

// End MathOpt.java
