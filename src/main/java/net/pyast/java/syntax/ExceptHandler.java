// Copyright 2026 The Bazel Authors. All rights reserved.
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

package net.pyast.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for one {@code except} clause of a try statement: {@code except:}, {@code except
 * T:}, or {@code except T as name:}, followed by its body.
 */
public final class ExceptHandler extends Node {

  @Nullable private final Expression type;
  @Nullable private final Identifier name;
  private final ImmutableList<Statement> body; // non-empty

  ExceptHandler(
      Span span,
      @Nullable Expression type,
      @Nullable Identifier name,
      ImmutableList<Statement> body) {
    super(span);
    Preconditions.checkArgument(type != null || name == null, "'as' without exception type");
    Preconditions.checkArgument(!body.isEmpty(), "except clause without body");
    this.type = type;
    this.name = name;
    this.body = body;
  }

  /** Returns the exception type matched by this handler, or null for a bare {@code except:}. */
  @Nullable
  public Expression getType() {
    return type;
  }

  /** Returns the name the exception is bound to by {@code as name}, if any. */
  @Nullable
  public Identifier getName() {
    return name;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    if (type == null) {
      return "except: ...\n";
    }
    return "except " + type + (name != null ? " as " + name : "") + ": ...\n";
  }
}
