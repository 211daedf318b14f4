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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.flowgraph.java.cfg.ControlFlowGraph;
import net.flowgraph.java.cfg.FunctionGraphs;
import net.flowgraph.java.cfg.GraphJson;
import net.flowgraph.java.syntax.ParserInput;
import net.flowgraph.java.syntax.SourceFile;
import net.flowgraph.java.syntax.SyntaxError;

/**
 * Command-line utility that builds the control-flow graphs of the functions of source files and
 * prints them as JSON.
 *
 * <pre>
 * flowgraph [--output=FILE] [--jobs=N] [--verbose] FILE...
 * </pre>
 *
 * <p>The output is a JSON array with one element per input file, in argument order: {@code
 * {"file": path, "functions": {name: graph, ...}}}, or {@code {"file": path, "errors": [...]}}
 * for a file that could not be read or parsed.
 */
public final class FlowgraphCli {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final int EXIT_OK = 0;
  static final int EXIT_BUILD_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private FlowgraphCli() {}

  public static void main(String... args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Runs the command and returns its exit code. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    FlowgraphOptions options;
    try {
      options = FlowgraphOptions.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(FlowgraphOptions.PROGRAM_NAME + ": " + e.getMessage());
      err.print(FlowgraphOptions.usage());
      return EXIT_USAGE;
    }
    if (options.help()) {
      out.print(FlowgraphOptions.usage());
      return EXIT_OK;
    }
    if (options.verbose()) {
      setVerbose();
    }

    List<FileResult> results;
    try {
      results = buildFiles(options.files(), options.jobs());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atSevere().log("interrupted while building graphs");
      return EXIT_BUILD_FAILED;
    }

    JsonArray json = new JsonArray();
    boolean ok = true;
    for (FileResult result : results) {
      json.add(result.json);
      ok &= result.ok;
    }
    String text = GraphJson.toJson(json);

    if (options.output() == null) {
      out.println(text);
    } else {
      try {
        Files.write(Paths.get(options.output()), (text + "\n").getBytes(UTF_8));
      } catch (IOException e) {
        logger.atSevere().withCause(e).log("cannot write %s", options.output());
        err.println(FlowgraphOptions.PROGRAM_NAME + ": cannot write " + options.output());
        return EXIT_BUILD_FAILED;
      }
    }
    return ok ? EXIT_OK : EXIT_BUILD_FAILED;
  }

  // Builds the files on a pool of the given size. Results are in the order of the files.
  static ImmutableList<FileResult> buildFiles(List<String> files, int jobs)
      throws InterruptedException {
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(jobs));
    try {
      ImmutableList.Builder<ListenableFuture<FileResult>> futures = ImmutableList.builder();
      for (String file : files) {
        futures.add(executor.submit(() -> buildFile(file)));
      }
      return ImmutableList.copyOf(Futures.allAsList(futures.build()).get());
    } catch (ExecutionException e) {
      // buildFile reports every expected failure in its result.
      throw new IllegalStateException("unexpected failure building graphs", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  static FileResult buildFile(String path) {
    logger.atFine().log("building %s", path);
    JsonObject json = new JsonObject();
    json.addProperty("file", path);

    SourceFile file;
    try {
      file = SourceFile.parse(ParserInput.readFile(path));
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("cannot read %s", path);
      JsonArray errors = new JsonArray();
      errors.add(path + ": cannot read file: " + e.getMessage());
      json.add("errors", errors);
      return new FileResult(json, false);
    }

    ImmutableMap<String, ControlFlowGraph> graphs;
    try {
      graphs = FunctionGraphs.buildAll(file);
    } catch (SyntaxError.Exception e) {
      logger.atInfo().log("%s: %d syntax error(s)", path, e.errors().size());
      JsonArray errors = new JsonArray();
      for (SyntaxError error : e.errors()) {
        errors.add(error.toString());
      }
      json.add("errors", errors);
      return new FileResult(json, false);
    }
    json.add("functions", GraphJson.toJsonTree(graphs));
    return new FileResult(json, true);
  }

  // Routes fine-grained log records of the system backend to the console.
  private static void setVerbose() {
    Logger root = Logger.getLogger("");
    root.setLevel(Level.FINE);
    for (Handler handler : root.getHandlers()) {
      handler.setLevel(Level.FINE);
    }
  }

  /** The JSON result of one input file. */
  static final class FileResult {
    final JsonObject json;
    final boolean ok;

    FileResult(JsonObject json, boolean ok) {
      this.json = json;
      this.ok = ok;
    }
  }
}
