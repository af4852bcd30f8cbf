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

/**
 * An index expression ({@code obj[key]}). A subscript of several comma-separated keys, as in
 * {@code m[i, j]}, has a tuple as its key.
 */
public final class IndexExpression extends Expression {

  private final Expression object;
  private final Expression key;

  IndexExpression(Span span, Expression object, Expression key) {
    super(span);
    this.object = Preconditions.checkNotNull(object);
    this.key = Preconditions.checkNotNull(key);
  }

  public Expression getObject() {
    return object;
  }

  public Expression getKey() {
    return key;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.INDEX;
  }

  @Override
  public String toString() {
    return object + "[" + key + "]";
  }
}
