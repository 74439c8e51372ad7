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
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests the command-line tool, {@link Main}. */
public class MainTest {
  /** Runs the tool and captures its output. */
  private static Run run(String stdin, String... args) {
    final StringWriter out = new StringWriter();
    final StringWriter err = new StringWriter();
    final Main main =
        new Main(ImmutableList.copyOf(args), new StringReader(stdin), out, err,
            ImmutableMap.of());
    final int status = main.run();
    return new Run(status, out.toString(), err.toString());
  }

  @Test void testStdin() {
    final Run r = run("x = foo * 2 * 3;\n");
    assertThat(r.status, is(0));
    assertThat(r.out, is("x = 6 * foo;\n"));
    assertThat(r.err, is(""));
  }

  @Test void testStdinUnchanged() {
    final Run r = run("x = a + b;\n");
    assertThat(r.status, is(0));
    assertThat(r.out, is("x = a + b;\n"));
  }

  @Test void testCheck() {
    final Run r = run("x = foo * 2 * 3;\n", "--check");
    assertThat(r.status, is(1));
    assertThat(r.out.trim(), is("<stdin>"));

    final Run r2 = run("x = 6 * foo;\n", "--check");
    assertThat(r2.status, is(0));
    assertThat(r2.out, is(""));
  }

  @Test void testProperty() {
    final Run r = run("x = foo / 2;\n", "--coefficientPlacement=prefix");
    assertThat(r.status, is(0));
    assertThat(r.out, is("x = 0.5 * foo;\n"));

    final Run r2 = run("x = foo / 2;\n", "--simplifyExpressions=false");
    assertThat(r2.out, is("x = foo / 2;\n"));
  }

  @Test void testBadProperty() {
    final Run r = run("", "--noSuchProperty=1");
    assertThat(r.status, is(2));
    assertThat(r.err,
        containsString("mathopt: --noSuchProperty=1: property noSuchProperty "
            + "not found"));

    final Run r2 = run("", "--foldPatterns=maybe");
    assertThat(r2.status, is(2));
    assertThat(r2.err, containsString("must be 'true' or 'false'"));
  }

  @Test void testUnknownOption() {
    final Run r = run("", "--frobnicate");
    assertThat(r.status, is(2));
    assertThat(r.err, containsString("mathopt: unknown option --frobnicate"));
    assertThat(r.err, containsString("usage: mathopt"));
    assertThat(r.err, containsString("--foldPatterns=true"));
  }

  @Test void testParseError() {
    final Run r = run("x = (1 + ;\n");
    assertThat(r.status, is(2));
    assertThat(r.out, is(""));
    assertThat(r.err, containsString("mathopt: <stdin>:1."));
    assertThat(r.err, containsString("';'"));
  }

  @Test void testVerbose() {
    final Run r = run("x = foo * 2 * 3;\n", "--verbose");
    assertThat(r.status, is(0));
    assertThat(r.out, is("x = 6 * foo;\n"));
    assertThat(r.err, containsString("edit ["));
  }

  @Test void testWriteRequiresFile() {
    final Run r = run("x = 1;\n", "--write");
    assertThat(r.status, is(2));
    assertThat(r.err,
        containsString("mathopt: --write requires at least one file"));
  }

  @Test void testFiles(@TempDir Path dir) throws IOException {
    final File a = dir.resolve("a.gml").toFile();
    final File b = dir.resolve("b.gml").toFile();
    Files.asCharSink(a, UTF_8).write("x = foo * 2 * 3;\n");
    Files.asCharSink(b, UTF_8).write("x = a + b;\n");

    final Run check = run("", "--check", a.getPath(), b.getPath());
    assertThat(check.status, is(1));
    assertThat(check.out.trim(), is(a.getPath()));

    final Run print = run("", a.getPath(), b.getPath());
    assertThat(print.status, is(0));
    assertThat(print.out, is("x = 6 * foo;\nx = a + b;\n"));

    final Run write = run("", "--write", a.getPath(), b.getPath());
    assertThat(write.status, is(0));
    assertThat(Files.asCharSource(a, UTF_8).read(), is("x = 6 * foo;\n"));
    assertThat(Files.asCharSource(b, UTF_8).read(), is("x = a + b;\n"));

    final Run recheck = run("", "--check", a.getPath(), b.getPath());
    assertThat(recheck.status, is(0));
  }

  @Test void testMissingFile(@TempDir Path dir) {
    final String missing = dir.resolve("missing.gml").toString();
    final Run r = run("", missing);
    assertThat(r.status, is(2));
    assertThat(r.err, containsString("mathopt: " + missing + ": "));
  }

  /** Result of running the tool. */
  private static class Run {
    final int status;
    final String out;
    final String err;

    Run(int status, String out, String err) {
      this.status = status;
      this.out = out;
      this.err = err;
    }
  }
}

// End MainTest.java
