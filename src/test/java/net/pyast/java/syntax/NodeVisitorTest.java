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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.List;
import net.pyast.java.syntax.TestUtils.Source;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@code NodeVisitor} */
@RunWith(JUnit4.class)
public final class NodeVisitorTest {

  private final AstBuilder builder = AstBuilder.create();
  private Source src;
  private final Multiset<String> seen = HashMultiset.create();

  private void setSource(String text) {
    src = new Source(text);
    seen.clear();
  }

  private Token next(String text) {
    seen.add(text);
    return src.tok(text, seen.count(text));
  }

  private Identifier ident(String name) {
    return builder.makeIdent(next(name));
  }

  /** Records all identifiers in the order they were seen, including duplicates. */
  private static class IdentGatherer extends NodeVisitor {
    final List<String> idents = new ArrayList<>();

    @Override
    public void visit(Identifier node) {
      idents.add(node.getName());
    }
  }

  /**
   * Asserts that the traversed identifiers (in order, including duplicates) of the given node match
   * the expected identifiers, which are supplied as a space-delimited string.
   */
  private static void assertIdentsAre(Node node, String expectedIdents) {
    IdentGatherer visitor = new IdentGatherer();
    visitor.visit(node);
    assertThat(visitor.idents).containsExactlyElementsIn(expectedIdents.split(" ")).inOrder();
  }

  @Test
  public void simpleStatements() throws Exception {
    setSource("a, b[c] = d.e + f(g, h=i, *j, **k)");
    Expression target =
        builder.makeTupleOrExpr(
            ImmutableList.of(
                ident("a"),
                builder.addTrailer(
                    ident("b"),
                    ImmutableList.of(
                        builder.makeSubscriptTrailer(
                            next("["),
                            ImmutableList.of(builder.makeSubscriptIndex(ident("c"))),
                            next("]"))))),
            null);
    Expression left =
        builder.addTrailer(
            ident("d"), ImmutableList.of(builder.makeDotTrailer(next("."), ident("e"))));
    Identifier f = ident("f");
    Token lparen = next("(");
    ImmutableList<Argument> args =
        ImmutableList.of(
            builder.makePositional(ident("g")),
            builder.makeKeyword(ident("h"), ident("i")),
            builder.makeStarArg(next("*"), ident("j")),
            builder.makeStarStarArg(next("**"), ident("k")));
    Expression right =
        builder.addTrailer(f, ImmutableList.of(builder.makeCallTrailer(lparen, args, next(")"))));
    Expression value =
        builder.makeBinOp(
            left, ImmutableList.of(AstBuilder.OperatorAndOperand.of(next("+"), right)));
    Statement stmt = builder.makeNormalAssignment(target, ImmutableList.of(value));

    assertIdentsAre(stmt, "a b c d e f g h i j k");
  }

  @Test
  public void comprehensions() throws Exception {
    setSource("[a for b in {c: d for e in f} if g]");
    Token lbracket = next("[");
    Identifier a = ident("a");
    Token forToken = next("for");
    Identifier b = ident("b");
    Token lbrace = next("{");
    Comprehension inner =
        builder.makeComprehension(
            builder.makeDictPair(ident("c"), ident("d")),
            ImmutableList.of(builder.makeCompFor(next("for"), ident("e"), ident("f"))));
    Expression dict = builder.makeDictionary(lbrace, inner, next("}"));
    Comprehension outer =
        builder.makeComprehension(
            a,
            ImmutableList.of(
                builder.makeCompFor(forToken, b, dict),
                builder.makeCompIf(next("if"), ident("g"))));
    Expression list = builder.makeListForm(lbracket, outer, next("]"));

    assertIdentsAre(list, "a b c d e f g");
  }

  @Test
  public void definitions() throws Exception {
    setSource("@a(b) def c(d: e, (f, g)=h, *, i, **j) -> k: try: return l except m as n: pass");
    Token at = next("@");
    ImmutableList<Identifier> decoratorName = ImmutableList.of(ident("a"));
    next("(");
    Decorator decorator =
        builder.makeDecorator(
            at, decoratorName, ImmutableList.of(builder.makePositional(ident("b"))), next(")"));

    Token def = next("def");
    Identifier c = ident("c");
    next("(");
    Parameter d = builder.makeParam(ident("d"), ident("e"), null);
    Token tupleParen = next("(");
    ParamTuple pattern =
        builder.makeParamTuple(
            tupleParen,
            ImmutableList.of(
                builder.makeParamTupleName(ident("f")), builder.makeParamTupleName(ident("g"))),
            next(")"));
    Parameter unpack = builder.makeTupleParam(pattern, ident("h"));
    Parameter star = builder.makeStarParam(next("*"), null, null);
    Parameter i = builder.makeParam(ident("i"), null, null);
    Parameter j = builder.makeStarStarParam(next("**"), ident("j"), null);
    next(")");
    Identifier k = ident("k");

    Token tryToken = next("try");
    Statement ret = builder.makeReturn(next("return"), ident("l"));
    ExceptHandler handler =
        builder.makeHandler(
            next("except"),
            ident("m"),
            ident("n"),
            ImmutableList.of(builder.makeFlow(next("pass"))));
    Statement tryStmt =
        builder.makeTry(
            tryToken,
            ImmutableList.of(ret),
            ImmutableList.of(handler),
            ImmutableList.of(),
            ImmutableList.of());
    DefStatement fun =
        builder.makeFun(
            def, c, ImmutableList.of(d, unpack, star, i, j), k, ImmutableList.of(tryStmt));
    SourceFile file =
        builder.makeModule(
            ImmutableList.of(builder.makeDecorated(ImmutableList.of(decorator), fun)), src.eof());

    assertIdentsAre(file, "a b c d e f g h i j k l m n");
  }

  @Test
  public void slices() throws Exception {
    setSource("a[b:c:d, e]");
    Identifier a = ident("a");
    Token lbracket = next("[");
    SubscriptElement slice =
        builder.makeSubscriptSlice(ident("b"), next(":"), ident("c"), next(":"), ident("d"));
    SubscriptElement index = builder.makeSubscriptIndex(ident("e"));
    Expression e =
        builder.addTrailer(
            a,
            ImmutableList.of(
                builder.makeSubscriptTrailer(
                    lbracket, ImmutableList.of(slice, index), next("]"))));

    assertIdentsAre(e, "a b c d e");
  }
}
