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

import com.google.common.base.Ascii;

/** The kinds of node in a {@link ControlFlowGraph}. */
public enum NodeKind {
  ENTRY,
  EXIT,
  STATEMENT,
  CONDITION,
  LOOP;

  /** Returns the lower-case name used in serialized graphs, e.g. {@code "condition"}. */
  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}
