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

import java.io.PrintWriter;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each applied edit,
   * then calls the underlying tracer.
   */
  public static Tracer withOnEdit(Tracer tracer, Consumer<TextEdit> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onEdit(TextEdit edit) {
        consumer.accept(edit);
        super.onEdit(edit);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each rejected edit,
   * then calls the underlying tracer.
   */
  public static Tracer withOnConflict(
      Tracer tracer, Consumer<TextEdit> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onConflict(TextEdit edit) {
        consumer.accept(edit);
        super.onConflict(edit);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the name of each text
   * transformer that changes the text, then calls the underlying tracer.
   */
  public static Tracer withOnTransform(
      Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTransform(
          TextTransformer transformer, String before, String after) {
        consumer.accept(transformer.name());
        super.onTransform(transformer, before, after);
      }
    };
  }

  /** Returns a tracer that describes each event on a writer. */
  public static Tracer printing(PrintWriter w) {
    return new Tracer() {
      @Override
      public void onEdit(TextEdit edit) {
        w.println("edit " + edit);
      }

      @Override
      public void onConflict(TextEdit edit) {
        w.println("rejected " + edit);
      }

      @Override
      public void onTransform(
          TextTransformer transformer, String before, String after) {
        w.println("transform " + transformer.name());
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onEdit(TextEdit edit) {}

    @Override
    public void onConflict(TextEdit edit) {}

    @Override
    public void onTransform(
        TextTransformer transformer, String before, String after) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onEdit(TextEdit edit) {
      tracer.onEdit(edit);
    }

    @Override
    public void onConflict(TextEdit edit) {
      tracer.onConflict(edit);
    }

    @Override
    public void onTransform(
        TextTransformer transformer, String before, String after) {
      tracer.onTransform(transformer, before, after);
    }
  }
}

// End Tracers.java
