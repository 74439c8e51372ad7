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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.mathopt.compile.MathOptimizer;
import net.hydromatic.mathopt.compile.Prop;
import net.hydromatic.mathopt.compile.Tracer;
import net.hydromatic.mathopt.compile.Tracers;
import net.hydromatic.mathopt.util.MathOptException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line tool that rewrites GML files.
 *
 * <pre>
 * mathopt [--verbose] [--check] [--write] [--name=value ...] [file ...]
 * </pre>
 *
 * <p>With no files, reads standard input. By default prints the rewritten
 * text; {@code --write} rewrites files in place, and {@code --check} prints
 * the names of files that would change.
 */
public class Main {
  private final Reader in;
  private final PrintWriter out;
  private final PrintWriter err;
  private final List<String> args;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(
            ImmutableList.copyOf(args),
            new InputStreamReader(System.in, UTF_8),
            new OutputStreamWriter(System.out, UTF_8),
            new OutputStreamWriter(System.err, UTF_8),
            new LinkedHashMap<>());
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> args, Reader in, Writer out, Writer err,
      Map<Prop, Object> propMap) {
    this.args = ImmutableList.copyOf(args);
    this.in = in;
    this.out = buffer(out);
    this.err = buffer(err);
    this.propMap = new LinkedHashMap<>(propMap);
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  /**
   * Runs the command and returns its exit status: 0 for success, 1 if
   * {@code --check} found a file that would change, 2 if there was an error.
   */
  public int run() {
    try {
      return run2();
    } finally {
      out.flush();
      err.flush();
    }
  }

  private int run2() {
    boolean verbose = false;
    boolean check = false;
    boolean write = false;
    final List<String> files = new ArrayList<>();
    for (String arg : args) {
      if (arg.equals("--verbose")) {
        verbose = true;
      } else if (arg.equals("--check")) {
        check = true;
      } else if (arg.equals("--write")) {
        write = true;
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        try {
          Prop.lookup(arg.substring(2, i))
              .setLenient(propMap, arg.substring(i + 1));
        } catch (IllegalArgumentException e) {
          err.println("mathopt: " + arg + ": " + e.getMessage());
          return 2;
        }
      } else if (arg.startsWith("--")) {
        err.println("mathopt: unknown option " + arg);
        usage();
        return 2;
      } else {
        files.add(arg);
      }
    }
    if (write && files.isEmpty()) {
      err.println("mathopt: --write requires at least one file");
      return 2;
    }

    final Tracer tracer = verbose ? Tracers.printing(err) : Tracers.empty();
    if (files.isEmpty()) {
      final String source;
      try {
        source = CharStreams.toString(in);
      } catch (IOException e) {
        err.println("mathopt: " + e.getMessage());
        return 2;
      }
      final MathOptimizer.@Nullable Result result =
          rewrite(source, "<stdin>", tracer);
      if (result == null) {
        return 2;
      }
      if (check) {
        if (result.changed()) {
          out.println("<stdin>");
          return 1;
        }
        return 0;
      }
      out.print(result.text);
      return 0;
    }

    boolean failed = false;
    boolean changed = false;
    for (String fileName : files) {
      final File file = new File(fileName);
      try {
        final String source = Files.asCharSource(file, UTF_8).read();
        final MathOptimizer.@Nullable Result result =
            rewrite(source, fileName, tracer);
        if (result == null) {
          failed = true;
          continue;
        }
        if (check) {
          if (result.changed()) {
            out.println(fileName);
            changed = true;
          }
        } else if (write) {
          if (result.changed()) {
            Files.asCharSink(file, UTF_8).write(result.text);
          }
        } else {
          out.print(result.text);
        }
      } catch (IOException e) {
        err.println("mathopt: " + fileName + ": " + e.getMessage());
        failed = true;
      }
    }
    return failed ? 2 : changed ? 1 : 0;
  }

  /** Rewrites one source, reporting a parse error and returning null. */
  private MathOptimizer.@Nullable Result rewrite(String source, String file,
      Tracer tracer) {
    try {
      return MathOpt.rewrite(source, file, propMap, tracer);
    } catch (RuntimeException e) {
      if (!(e instanceof MathOptException)) {
        throw e;
      }
      final StringBuilder buf = new StringBuilder("mathopt: ");
      ((MathOptException) e).describeTo(buf);
      err.println(buf);
      return null;
    }
  }

  private void usage() {
    err.println("usage: mathopt [--verbose] [--check] [--write] "
        + "[--name=value ...] [file ...]");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      err.println("  --" + prop.camelName + "=" + prop.get(propMap));
    }
  }
}

// End Main.java
