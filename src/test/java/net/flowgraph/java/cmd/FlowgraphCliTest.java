// Copyright 2026 The Flowgraph Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.flowgraph.java.cmd;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link FlowgraphCli}. */
@RunWith(JUnit4.class)
public class FlowgraphCliTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    return FlowgraphCli.run(
        args, new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
  }

  private String writeFile(String name, String... lines) throws IOException {
    File file = tmp.newFile(name);
    Files.write(file.toPath(), (String.join("\n", lines) + "\n").getBytes(UTF_8));
    return file.getPath();
  }

  private JsonArray output() {
    return JsonParser.parseString(out.toString(UTF_8)).getAsJsonArray();
  }

  @Test
  public void testBuildsEveryFunction() throws Exception {
    String path =
        writeFile(
            "a.py", "def f(x):", "  if x:", "    return 1", "  return 2", "def g():", "  pass");

    assertThat(run(path)).isEqualTo(FlowgraphCli.EXIT_OK);

    JsonArray result = output();
    assertThat(result).hasSize(1);
    JsonObject file = result.get(0).getAsJsonObject();
    assertThat(file.get("file").getAsString()).isEqualTo(path);
    JsonObject functions = file.getAsJsonObject("functions");
    assertThat(functions.keySet()).containsExactly("f", "g").inOrder();
    assertThat(functions.getAsJsonObject("f").get("function").getAsString()).isEqualTo("f");
    assertThat(err.toString(UTF_8)).isEmpty();
  }

  @Test
  public void testResultsFollowArgumentOrder() throws Exception {
    String[] paths = new String[6];
    for (int i = 0; i < paths.length; i++) {
      paths[i] = writeFile("m" + i + ".py", "x = " + i);
    }
    String[] args = new String[paths.length + 1];
    args[0] = "--jobs=3";
    System.arraycopy(paths, 0, args, 1, paths.length);

    assertThat(run(args)).isEqualTo(FlowgraphCli.EXIT_OK);

    JsonArray result = output();
    for (int i = 0; i < paths.length; i++) {
      assertThat(result.get(i).getAsJsonObject().get("file").getAsString()).isEqualTo(paths[i]);
    }
  }

  @Test
  public void testSyntaxErrorsAreReportedPerFile() throws Exception {
    String good = writeFile("good.py", "x = 1");
    String bad = writeFile("bad.py", "while x", "  pass");

    assertThat(run(good, bad)).isEqualTo(FlowgraphCli.EXIT_BUILD_FAILED);

    JsonArray result = output();
    assertThat(result.get(0).getAsJsonObject().has("functions")).isTrue();
    JsonObject failed = result.get(1).getAsJsonObject();
    assertThat(failed.has("functions")).isFalse();
    assertThat(failed.getAsJsonArray("errors").get(0).getAsString())
        .isEqualTo(bad + ":1:1: expected ':'");
  }

  @Test
  public void testMissingFile() {
    String missing = new File(tmp.getRoot(), "missing.py").getPath();

    assertThat(run(missing)).isEqualTo(FlowgraphCli.EXIT_BUILD_FAILED);

    JsonObject failed = output().get(0).getAsJsonObject();
    assertThat(failed.getAsJsonArray("errors").get(0).getAsString())
        .startsWith(missing + ": cannot read file");
  }

  @Test
  public void testOutputFile() throws Exception {
    String path = writeFile("a.py", "return 1");
    File output = new File(tmp.getRoot(), "graphs.json");

    assertThat(run("--output=" + output.getPath(), path)).isEqualTo(FlowgraphCli.EXIT_OK);

    assertThat(out.toString(UTF_8)).isEmpty();
    JsonArray result = JsonParser.parseString(Files.readString(output.toPath())).getAsJsonArray();
    assertThat(result.get(0).getAsJsonObject().getAsJsonObject("functions").keySet())
        .containsExactly("module");
  }

  @Test
  public void testNoInputFiles() {
    assertThat(run()).isEqualTo(FlowgraphCli.EXIT_USAGE);
    assertThat(err.toString(UTF_8)).contains("no input files");
    assertThat(err.toString(UTF_8)).contains("Usage: flowgraph");
  }

  @Test
  public void testInvalidJobs() throws Exception {
    String path = writeFile("a.py", "pass");
    assertThat(run("--jobs=0", path)).isEqualTo(FlowgraphCli.EXIT_USAGE);
    assertThat(err.toString(UTF_8)).contains("--jobs must be at least 1");
  }

  @Test
  public void testHelp() {
    assertThat(run("--help")).isEqualTo(FlowgraphCli.EXIT_OK);
    assertThat(out.toString(UTF_8)).contains("--output");
    assertThat(out.toString(UTF_8)).contains("--jobs");
  }
}
