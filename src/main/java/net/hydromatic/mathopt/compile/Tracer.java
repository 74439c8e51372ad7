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

/** Called on various events during optimization. */
public interface Tracer {
  /** Called for each edit that is applied. */
  void onEdit(TextEdit edit);

  /**
   * Called for each edit that is not applied, because its range was invalid
   * or overlapped an edit that was applied.
   */
  void onConflict(TextEdit edit);

  /** Called when a text transformer changes the text. */
  void onTransform(TextTransformer transformer, String before, String after);
}

// End Tracer.java
