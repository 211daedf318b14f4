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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** A test case for {@link ParserInput}. */
@RunWith(JUnit4.class)
public class ParserInputTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testFromString() {
    String content = "Content provided as a string.";
    String pathName = "/the/name/of/the/content.py";
    ParserInput input = ParserInput.fromString(content, pathName);
    assertThat(new String(input.getContent())).isEqualTo(content);
    assertThat(input.getFile()).isEqualTo(pathName);
  }

  @Test
  public void testFromCharArray() {
    String content = "Content provided as a string.";
    ParserInput input = ParserInput.fromCharArray(content.toCharArray(), "content.py");
    assertThat(new String(input.getContent())).isEqualTo(content);
  }

  @Test
  public void testFromLines() {
    ParserInput input = ParserInput.fromLines("if x:", "  y");
    assertThat(new String(input.getContent())).isEqualTo("if x:\n  y");
    assertThat(input.getFile()).isEmpty();
  }

  @Test
  public void testReadFileDecodesUtf8() throws IOException {
    File file = tmp.newFile("cafe.py");
    Files.write(file.toPath(), "s = 'café ☕'\n".getBytes(UTF_8));
    ParserInput input = ParserInput.readFile(file.getPath());
    assertThat(new String(input.getContent())).isEqualTo("s = 'café ☕'\n");
    assertThat(input.getFile()).isEqualTo(file.getPath());
  }

  @Test
  public void testReadMissingFile() {
    String missing = new File(tmp.getRoot(), "missing.py").getPath();
    assertThrows(IOException.class, () -> ParserInput.readFile(missing));
  }
}
