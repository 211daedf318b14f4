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
package net.flowgraph.java.cfg;

/**
 * The label of an edge, describing the outcome that selects it. Unconditional fallthrough edges
 * carry {@link #NONE}, which renders as the empty string.
 */
public enum EdgeLabel {
  NONE(""),
  TRUE("true"),
  FALSE("false"),
  LOOP("loop"),
  EXIT("exit"),
  EXCEPTION("exception"),
  BREAK("break"),
  CONTINUE("continue");

  private final String text;

  EdgeLabel(String text) {
    this.text = text;
  }

  @Override
  public String toString() {
    return text;
  }
}
