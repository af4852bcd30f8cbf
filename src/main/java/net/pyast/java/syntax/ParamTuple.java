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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Syntax node for the pattern of a legacy tuple-unpacking parameter: either a single name, or a
 * parenthesized list of nested patterns.
 *
 * <p>As in older grammars of the language, {@code (a)} and {@code (a,)} are not distinguished.
 */
public abstract class ParamTuple extends Node {

  private ParamTuple(Span span) {
    super(span);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** A pattern consisting of a single name. */
  public static final class Name extends ParamTuple {
    private final Identifier id;

    Name(Span span, Identifier id) {
      super(span);
      this.id = Preconditions.checkNotNull(id);
    }

    public Identifier getIdentifier() {
      return id;
    }

    @Override
    public String toString() {
      return id.getName();
    }
  }

  /** A parenthesized pattern of nested patterns. */
  public static final class Tuple extends ParamTuple {
    private final ImmutableList<ParamTuple> elements;

    Tuple(Span span, ImmutableList<ParamTuple> elements) {
      super(span);
      this.elements = elements;
    }

    public ImmutableList<ParamTuple> getElements() {
      return elements;
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(", ").join(elements) + ")";
    }
  }
}
