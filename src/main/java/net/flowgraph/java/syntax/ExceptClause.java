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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** One {@code except [type [as name]]:} clause of a {@link TryStatement}. */
public final class ExceptClause {

  private final Location location;
  @Nullable private final String exceptionType;
  @Nullable private final String name;
  private final ImmutableList<Statement> body;

  ExceptClause(
      Location location,
      @Nullable String exceptionType,
      @Nullable String name,
      ImmutableList<Statement> body) {
    this.location = Preconditions.checkNotNull(location);
    this.exceptionType = exceptionType;
    this.name = name;
    this.body = body;
  }

  public Location getLocation() {
    return location;
  }

  /** Returns the source text of the caught type expression, or null for a bare {@code except}. */
  @Nullable
  public String getExceptionType() {
    return exceptionType;
  }

  /** Returns the name the exception is bound to, or null. */
  @Nullable
  public String getName() {
    return name;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    if (exceptionType == null) {
      return "except: ...";
    }
    return "except " + exceptionType + (name == null ? "" : " as " + name) + ": ...";
  }
}
