/*
 * Copyright (c) Facebook, Inc. and its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.facebook.cartesian.cli;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;

import com.facebook.cartesian.util.ExitCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private Path root;

  @Before
  public void setUp() {
    root = tmp.getRoot().toPath();
  }

  private Path write(String name, String... lines) throws IOException {
    Path path = root.resolve(name);
    Files.write(path, (Joiner.on('\n').join(lines) + "\n").getBytes(StandardCharsets.UTF_8));
    return path;
  }

  private ExitCode run(String... args) {
    Main main = new Main(new PrintStream(out, true), new PrintStream(err, true), root);
    return main.run(args);
  }

  private String stdout() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private String stderr() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  private Path matrix() throws IOException {
    return write(
        "matrix.cfg",
        "greeting = hello",
        "variants:",
        "    - a:",
        "        who = 'a'",
        "    - b:",
        "        who = b",
        "variants:",
        "    - x:",
        "    - y:",
        "        no b",
        "message = ${greeting} ${who}");
  }

  @Test
  public void printsOneNamePerLine() throws IOException {
    Path file = matrix();

    assertEquals(ExitCode.SUCCESS, run(file.toString()));
    assertEquals(String.format("a.x%na.y%nb.x%n"), stdout());
  }

  @Test
  public void printsContents() throws IOException {
    Path file = matrix();

    assertEquals(ExitCode.SUCCESS, run("--contents", "--only", "a.x", file.toString()));
    assertEquals(
        String.format("a.x%n    greeting = hello%n    who = a%n    message = hello a%n"), stdout());
  }

  @Test
  public void printsJson() throws IOException {
    Path file = matrix();

    assertEquals(ExitCode.SUCCESS, run("--json", "--no", "a", file.toString()));
    JsonNode json = new ObjectMapper().readTree(stdout());
    assertEquals(1, json.size());
    assertEquals("b.x", json.get(0).get("name").asText());
    assertEquals("hello b", json.get(0).get("params").get("message").asText());
  }

  @Test
  public void relativeFileIsResolvedAgainstTheProjectRoot() throws IOException {
    matrix();

    assertEquals(ExitCode.SUCCESS, run("matrix.cfg"));
    assertEquals(String.format("a.x%na.y%nb.x%n"), stdout());
  }

  @Test
  public void unexpectedRuntimeFailuresAreFatal() throws IOException {
    Path file = write("nul.cfg", "include bad\u0000name.cfg");

    assertEquals(ExitCode.FATAL_GENERIC, run(file.toString()));
    assertThat(stderr(), containsString("Unexpected failure"));
  }

  @Test
  public void threadsDoNotChangeTheOutput() throws IOException {
    Path file = matrix();

    assertEquals(ExitCode.SUCCESS, run("--threads", "4", file.toString()));
    assertEquals(String.format("a.x%na.y%nb.x%n"), stdout());
  }

  @Test
  public void summaryGoesToStderr() throws IOException {
    Path file = matrix();

    assertEquals(ExitCode.SUCCESS, run("--summary", file.toString()));
    assertThat(
        stderr(),
        containsString(
            "3 configurations, 0 unresolved, 1 rejected by filters, 4 paths before filtering"));
  }

  @Test
  public void filteringEverythingIsNothingToDo() throws IOException {
    Path file = matrix();
    assertEquals(ExitCode.NOTHING_TO_DO, run("--only", "nowhere", file.toString()));
    assertEquals("", stdout());
  }

  private Path partial() throws IOException {
    return write("partial.cfg", "variants:", "    - a:", "        v = 1", "    - b:", "w = ${v}");
  }

  @Test
  public void unresolvedReferencesArePartialResults() throws IOException {
    Path file = partial();

    assertEquals(ExitCode.PARTIAL_RESULT, run(file.toString()));
    assertEquals(String.format("a%n"), stdout());
    assertThat(stderr(), containsString("Skipped b"));
  }

  @Test
  public void failPolicyComesFromTheProjectConfig() throws IOException {
    write(Main.CONFIG_FILE_NAME, "[expansion]", "  unresolved_reference = fail");
    Path file = partial();

    assertEquals(ExitCode.PARSE_ERROR, run(file.toString()));
    assertEquals("", stdout());
    assertThat(stderr(), containsString("cannot resolve ${v}"));
  }

  @Test
  public void commandLineOverridesBeatConfigFiles() throws IOException {
    write(Main.CONFIG_FILE_NAME, "[parser]", "  strip_quotes = false");
    Path file = write("quoted.cfg", "v = 'q'");

    assertEquals(ExitCode.SUCCESS, run("-c", file.toString()));
    assertThat(stdout(), containsString("v = 'q'"));

    out.reset();
    assertEquals(
        ExitCode.SUCCESS, run("--config", "parser.strip_quotes=true", "-c", file.toString()));
    assertThat(stdout(), containsString("v = q"));
  }

  @Test
  public void parseErrorsPointAtTheLine() throws IOException {
    Path file = write("bad.cfg", "a = 1", "- b:");

    assertEquals(ExitCode.PARSE_ERROR, run(file.toString()));
    assertThat(stderr(), containsString(file + ":2: case header '- b:' outside"));
  }

  @Test
  public void malformedFiltersAreParseErrors() throws IOException {
    Path file = matrix();
    assertEquals(ExitCode.PARSE_ERROR, run("--only", "a..", file.toString()));
    assertThat(stderr(), containsString("malformed filter expression 'a..'"));
  }

  @Test
  public void badCommandLines() throws IOException {
    assertEquals(ExitCode.COMMANDLINE_ERROR, run());
    assertEquals(ExitCode.COMMANDLINE_ERROR, run("--no-such-option", "f"));
    assertEquals(ExitCode.COMMANDLINE_ERROR, run(root.resolve("missing.cfg").toString()));
    Path file = matrix();
    assertEquals(ExitCode.COMMANDLINE_ERROR, run("--json", "--contents", file.toString()));
    assertEquals(ExitCode.COMMANDLINE_ERROR, run("--threads", "0", file.toString()));
    assertEquals(
        ExitCode.COMMANDLINE_ERROR, run("--config", "expansion.threads=x", file.toString()));
    assertEquals(
        ExitCode.COMMANDLINE_ERROR, run("--config-file", "nope.ini", file.toString()));
  }
}
