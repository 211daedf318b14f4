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
package net.flowgraph.java.syntax;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** The apparent name and contents of a source file, for consumption by the parser. */
public final class ParserInput {

  private final char[] content;
  private final String file;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = Preconditions.checkNotNull(file);
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the apparent file name of the input source. */
  public String getFile() {
    return file;
  }

  /** Returns an input source that uses the content of a string. */
  public static ParserInput fromString(String content, String file) {
    return fromCharArray(content.toCharArray(), file);
  }

  /** Returns an input source that uses the content of a character array. */
  public static ParserInput fromCharArray(char[] content, String file) {
    return new ParserInput(content, file);
  }

  /** Returns an unnamed input source that reads from the given lines, joined by newlines. */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on('\n').join(lines), "");
  }

  /**
   * Returns an input source that reads from a UTF-8 encoded file. The file name is the given path
   * string, as supplied.
   */
  public static ParserInput readFile(String file) throws IOException {
    Path path = Paths.get(file);
    return fromString(new String(Files.readAllBytes(path), UTF_8), file);
  }
}
