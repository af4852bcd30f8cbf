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

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>Typical usage is for a subclass to override just the {@code visit()} overloads for the nodes
 * that are relevant to its business logic, and to rely on the default implementations in this
 * class for traversal over the remaining node types. Overriding implementations should remember to
 * traverse children using either {@code super.visit()} on the current node, or explicit calls to
 * {@link #visit(Node)}, {@link #visitAll}, or {@link #visitBlock} on child fields.
 */
public class NodeVisitor {

  // visit() overloads in this class are ordered by node type, first by category (misc / statement /
  // expression), then alphabetically within category.

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  /**
   * Handles all four Argument node types uniformly. Subclasses should not add an overload for a
   * concrete Argument subclass; it won't be called.
   */
  public void visit(Argument node) {
    if (node instanceof Argument.Keyword keyword) {
      visit(keyword.getIdentifier());
    }
    visit(node.getValue());
  }

  public void visit(Decorator node) {
    visitAll(node.getName());
    if (node.isCall()) {
      visitAll(node.getArguments());
    }
  }

  public void visit(ExceptHandler node) {
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getName() != null) {
      visit(node.getName());
    }
    visitBlock(node.getBody());
  }

  /**
   * Handles all five Parameter node types uniformly. Subclasses should not add an overload for a
   * concrete Parameter subclass; it won't be called.
   */
  public void visit(Parameter node) {
    if (node instanceof Parameter.UnpackTuple unpack) {
      visit(unpack.getPattern());
    } else if (node.getIdentifier() != null) {
      visit(node.getIdentifier());
    }
    if (node.getAnnotation() != null) {
      visit(node.getAnnotation());
    }
    if (node.getDefaultValue() != null) {
      visit(node.getDefaultValue());
    }
  }

  public void visit(ParamTuple node) {
    if (node instanceof ParamTuple.Name name) {
      visit(name.getIdentifier());
    } else {
      visitAll(((ParamTuple.Tuple) node).getElements());
    }
  }

  public void visit(SourceFile node) {
    visitBlock(node.getStatements());
  }

  // ==== Statement nodes ====

  public void visit(AnnotatedAssignmentStatement node) {
    visit(node.getTarget());
    visit(node.getAnnotation());
    if (node.getValue() != null) {
      visit(node.getValue());
    }
  }

  public void visit(AssignmentStatement node) {
    visitAll(node.getTargets());
    visit(node.getValue());
  }

  public void visit(DecoratedStatement node) {
    visitAll(node.getDecorators());
    visit(node.getDefinition());
  }

  public void visit(DefStatement node) {
    visit(node.getIdentifier());
    visitAll(node.getParameters());
    if (node.getReturnAnnotation() != null) {
      visit(node.getReturnAnnotation());
    }
    visitBlock(node.getBody());
  }

  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  public void visit(FlowStatement node) {}

  public void visit(ReturnStatement node) {
    if (node.getResult() != null) {
      visit(node.getResult());
    }
  }

  public void visit(TryStatement node) {
    visitBlock(node.getBody());
    visitAll(node.getHandlers());
    visitBlock(node.getElseBody());
    visitBlock(node.getFinallyBody());
  }

  // ==== Expression nodes ====

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(Comprehension node) {
    visit(node.getBody());
    for (Comprehension.Clause clause : node.getClauses()) {
      if (clause instanceof Comprehension.For) {
        visit((Comprehension.For) clause);
      } else {
        visit((Comprehension.If) clause);
      }
    }
  }

  public void visit(Comprehension.For node) {
    visit(node.getVars());
    visit(node.getIterable());
  }

  public void visit(Comprehension.If node) {
    visit(node.getCondition());
  }

  public void visit(ComprehensionExpression node) {
    visit(node.getComprehension());
  }

  public void visit(ConditionalExpression node) {
    visit(node.getThenCase());
    visit(node.getCondition());
    visit(node.getElseCase());
  }

  public void visit(DictExpression node) {
    visitAll(node.getEntries());
  }

  /**
   * Handles both DictExpression.Entry node types uniformly, whether they appear in a dict display
   * or as the body of a dict comprehension.
   */
  public void visit(DictExpression.Entry node) {
    if (node instanceof DictExpression.Pair pair) {
      visit(pair.getKey());
      visit(pair.getValue());
    } else {
      visit(((DictExpression.Unpacking) node).getExpression());
    }
  }

  public void visit(DotExpression node) {
    visit(node.getObject());
    visit(node.getField());
  }

  public void visit(@SuppressWarnings("unused") FloatLiteral node) {}

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(ListExpression node) {
    visitAll(node.getElements());
  }

  public void visit(ParenExpression node) {
    visit(node.getX());
  }

  public void visit(SetExpression node) {
    visitAll(node.getElements());
  }

  /** Handles the three Slice component types uniformly. */
  public void visit(Slice node) {
    if (node instanceof Slice.Index index) {
      visit(index.getExpression());
    } else if (node instanceof Slice.Proper proper) {
      if (proper.getLower() != null) {
        visit(proper.getLower());
      }
      if (proper.getUpper() != null) {
        visit(proper.getUpper());
      }
      if (proper.getStride() != null) {
        visit(proper.getStride());
      }
    }
  }

  public void visit(SliceExpression node) {
    visit(node.getObject());
    visitAll(node.getSlices());
  }

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  // ==== Traversal helpers ====

  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  public final void visitBlock(List<Statement> statements) {
    visitAll(statements);
  }
}
