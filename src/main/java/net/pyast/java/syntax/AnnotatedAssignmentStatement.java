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
import javax.annotation.Nullable;

/** Syntax node for an annotated assignment, {@code target: T} or {@code target: T = value}. */
public final class AnnotatedAssignmentStatement extends Statement {

  private final Expression target;
  private final Expression annotation;
  @Nullable private final Expression value;

  AnnotatedAssignmentStatement(
      Span span, Expression target, Expression annotation, @Nullable Expression value) {
    super(span, Kind.ANNOTATED_ASSIGNMENT);
    this.target = Preconditions.checkNotNull(target);
    this.annotation = Preconditions.checkNotNull(annotation);
    this.value = value;
  }

  public Expression getTarget() {
    return target;
  }

  public Expression getAnnotation() {
    return annotation;
  }

  /** Returns the assigned value, or null for a bare declaration {@code target: T}. */
  @Nullable
  public Expression getValue() {
    return value;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return target + ": " + annotation + (value != null ? " = " + value : "") + "\n";
  }
}
