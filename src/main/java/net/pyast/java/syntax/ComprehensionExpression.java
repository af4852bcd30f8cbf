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
 * Syntax node for a bracketed comprehension: a list comprehension {@code [e for x in y]}, set
 * comprehension {@code {e for x in y}}, dict comprehension {@code {k: v for x in y}}, or generator
 * expression {@code (e for x in y)}.
 */
public final class ComprehensionExpression extends Expression {

  /** Form identifies the brackets around a comprehension, and hence the kind of its value. */
  public enum Form {
    LIST,
    SET,
    DICT,
    GENERATOR;
  }

  private final Form form;
  private final Comprehension comprehension;

  ComprehensionExpression(Span span, Form form, Comprehension comprehension) {
    super(span);
    Preconditions.checkArgument(
        (form == Form.DICT) == (comprehension.getBody() instanceof DictExpression.Entry),
        "%s comprehension with body %s",
        form,
        comprehension.getBody());
    this.form = form;
    this.comprehension = comprehension;
  }

  public Form getForm() {
    return form;
  }

  public Comprehension getComprehension() {
    return comprehension;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.COMPREHENSION;
  }

  @Override
  public String toString() {
    switch (form) {
      case LIST:
        return "[" + comprehension + "]";
      case GENERATOR:
        return "(" + comprehension + ")";
      default:
        return "{" + comprehension + "}";
    }
  }
}
