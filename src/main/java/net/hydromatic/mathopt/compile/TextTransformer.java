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

/**
 * Rewrite that operates on source text, not on the syntax tree.
 *
 * <p>Text transformers run after the tree-based edits have been composed, in a
 * fixed order. Each must leave text inside string literals and comments
 * alone.
 *
 * @see TextTransformers
 */
public interface TextTransformer {
  /** Returns the name of this transformer, for tracing. */
  String name();

  /** Transforms a source string. Returns the same string if nothing matches. */
  String apply(String text);
}

// End TextTransformer.java
