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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Command-line options of {@link FlowgraphCli}. */
@Parameters(separators = "= ")
final class FlowgraphOptions {
  static final String PROGRAM_NAME = "flowgraph";
  private static final int DEFAULT_JOBS = Math.min(4, Runtime.getRuntime().availableProcessors());

  @Parameter(description = "FILE...")
  private List<String> files = new ArrayList<>();

  @Nullable
  @Parameter(
      names = "--output",
      description = "Write the JSON graphs to this file instead of standard output.")
  private String output;

  @Parameter(names = "--jobs", description = "Number of files to build concurrently.")
  private int jobs = DEFAULT_JOBS;

  @Parameter(names = "--verbose", description = "Log progress and unresolved jumps.")
  private boolean verbose;

  @Parameter(names = "--help", help = true, description = "Print this message.")
  private boolean help;

  ImmutableList<String> files() {
    return ImmutableList.copyOf(files);
  }

  /** Returns the output file, or null for standard output. */
  @Nullable
  String output() {
    return output;
  }

  int jobs() {
    return jobs;
  }

  boolean verbose() {
    return verbose;
  }

  boolean help() {
    return help;
  }

  /**
   * Parses the command line.
   *
   * @throws IllegalArgumentException if the arguments are malformed or name no input file
   */
  static FlowgraphOptions parse(String... args) {
    FlowgraphOptions options = new FlowgraphOptions();
    try {
      newCommander(options).parse(args);
    } catch (ParameterException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
    if (options.help) {
      return options;
    }
    if (options.files.isEmpty()) {
      throw new IllegalArgumentException("no input files");
    }
    if (options.jobs < 1) {
      throw new IllegalArgumentException("--jobs must be at least 1, got " + options.jobs);
    }
    return options;
  }

  /** Returns the usage message. */
  static String usage() {
    StringBuilder usage = new StringBuilder();
    newCommander(new FlowgraphOptions()).getUsageFormatter().usage(usage);
    return usage.toString();
  }

  private static JCommander newCommander(FlowgraphOptions options) {
    return JCommander.newBuilder().addObject(options).programName(PROGRAM_NAME).build();
  }
}
