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
import com.google.common.flogger.GoogleLogger;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nullable;

/**
 * AstBuilder assembles the syntax tree of a file from the reductions of a grammar driver.
 *
 * <p>The driver calls one {@code make...} method per grammar rule as the rule is reduced, passing
 * the tokens and already-built subtrees of the rule in source order; the result becomes a subtree
 * of a later reduction. Each method computes the span of the node it returns from the spans of its
 * inputs (see {@link Spans}), resolves the ambiguities the grammar leaves open, and, for argument
 * and parameter lists, enforces the orderings the grammar cannot express.
 *
 * <p>The first error is fatal: it is thrown as a {@link SyntaxError.Exception}, and the driver is
 * expected to abandon the parse. An AstBuilder holds only its immutable {@link FileOptions}, so one
 * instance may serve any number of parses.
 */
public final class AstBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final EnumSet<TokenKind> BINARY_OPERATORS =
      EnumSet.of(
          TokenKind.AMPERSAND,
          TokenKind.AND,
          TokenKind.CARET,
          TokenKind.EQUALS_EQUALS,
          TokenKind.GREATER,
          TokenKind.GREATER_EQUALS,
          TokenKind.GREATER_GREATER,
          TokenKind.IN,
          TokenKind.IS,
          TokenKind.IS_NOT,
          TokenKind.LESS,
          TokenKind.LESS_EQUALS,
          TokenKind.LESS_LESS,
          TokenKind.MINUS,
          TokenKind.NOT_EQUALS,
          TokenKind.NOT_IN,
          TokenKind.OR,
          TokenKind.PERCENT,
          TokenKind.PIPE,
          TokenKind.PLUS,
          TokenKind.SLASH,
          TokenKind.SLASH_SLASH,
          TokenKind.STAR,
          TokenKind.DOUBLE_STAR);

  private static final EnumSet<TokenKind> UNARY_OPERATORS =
      EnumSet.of(TokenKind.MINUS, TokenKind.NOT, TokenKind.PLUS, TokenKind.TILDE);

  private static final EnumSet<TokenKind> FLOW_KEYWORDS =
      EnumSet.of(TokenKind.BREAK, TokenKind.CONTINUE, TokenKind.PASS);

  /** An operator token and its right operand: one link {@code op y} of a chain {@code x op y}. */
  public static final class OperatorAndOperand {
    private final Token op;
    private final Expression y;

    private OperatorAndOperand(Token op, Expression y) {
      this.op = Preconditions.checkNotNull(op);
      this.y = Preconditions.checkNotNull(y);
    }

    public static OperatorAndOperand of(Token op, Expression y) {
      return new OperatorAndOperand(op, y);
    }

    public Token getOperator() {
      return op;
    }

    public Expression getOperand() {
      return y;
    }
  }

  private final FileOptions options;

  public AstBuilder(FileOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  /** Returns a builder with the default options. */
  public static AstBuilder create() {
    return new AstBuilder(FileOptions.DEFAULT);
  }

  // ==== Errors ====

  /**
   * Returns the error for a token that no grammar rule can reduce. The driver throws it when it
   * meets such a token.
   */
  public static SyntaxError.Exception parseError(Token token) {
    return spanError(
        SyntaxError.Kind.UNEXPECTED_TOKEN,
        token,
        "syntax error at '" + token + "': unexpected token");
  }

  /** Returns a fatal error of the given kind, located at the span of {@code x}. */
  public static SyntaxError.Exception spanError(
      SyntaxError.Kind kind, Spanned x, String message) {
    SyntaxError error = new SyntaxError(kind, x.getSpan(), message);
    logger.atFine().log("fatal syntax error: %s", error);
    return new SyntaxError.Exception(error);
  }

  // ==== Leaves ====

  /** Returns the identifier denoted by an IDENTIFIER token. */
  public Identifier makeIdent(Token token) {
    checkKind(token, TokenKind.IDENTIFIER);
    return new Identifier(token.getSpan(), (String) token.getValue());
  }

  /** Returns the literal denoted by an INT token, whose value is an Integer, Long or BigInteger. */
  public IntLiteral makeInt(Token token) {
    checkKind(token, TokenKind.INT);
    return new IntLiteral(token.getSpan(), (Number) token.getValue());
  }

  public FloatLiteral makeFloat(Token token) {
    checkKind(token, TokenKind.FLOAT);
    return new FloatLiteral(token.getSpan(), ((Number) token.getValue()).doubleValue());
  }

  public StringLiteral makeString(Token token) {
    checkKind(token, TokenKind.STRING);
    return new StringLiteral(token.getSpan(), (String) token.getValue());
  }

  private static void checkKind(Token token, TokenKind kind) {
    Preconditions.checkArgument(
        token.getKind() == kind, "got %s token, want %s", token.getKind(), kind);
    Preconditions.checkArgument(token.getValue() != null, "%s token without value", kind);
  }

  // ==== Operators ====

  /**
   * Returns {@code e} if the conditional part is absent (both {@code condition} and {@code
   * elseCase} are null), or the conditional expression {@code e if condition else elseCase}.
   */
  public Expression makeConditionalExpr(
      Expression e, @Nullable Expression condition, @Nullable Expression elseCase) {
    Preconditions.checkArgument(
        (condition == null) == (elseCase == null), "conditional without both condition and else");
    if (condition == null) {
      return e;
    }
    return new ConditionalExpression(Spans.union(e, elseCase), e, condition, elseCase);
  }

  /**
   * Folds a chain {@code x op1 y1 op2 y2 ...} into left-associative binary operations, {@code ((x
   * op1 y1) op2 y2) ...}. The grammar has already resolved precedence, so all operators in the
   * chain have the same precedence.
   */
  public Expression makeBinOp(Expression x, List<OperatorAndOperand> tail) {
    Expression result = x;
    for (OperatorAndOperand link : tail) {
      TokenKind op = link.getOperator().getKind();
      Preconditions.checkArgument(BINARY_OPERATORS.contains(op), "not a binary operator: %s", op);
      Expression y = link.getOperand();
      result =
          new BinaryOperatorExpression(
              Spans.union(result, y), result, op, link.getOperator().getSpan(), y);
    }
    return result;
  }

  public UnaryOperatorExpression makeUnaryOp(Token op, Expression x) {
    Preconditions.checkArgument(
        UNARY_OPERATORS.contains(op.getKind()), "not a unary operator: %s", op.getKind());
    return new UnaryOperatorExpression(Spans.union(op, x), op.getKind(), x);
  }

  // ==== Postfix trailers ====

  /** Returns the trailer {@code (args)}, after checking the order of the arguments. */
  public Trailer.Call makeCallTrailer(Token lparen, ImmutableList<Argument> args, Token rparen)
      throws SyntaxError.Exception {
    OrderingChecker.checkArguments(args);
    return new Trailer.Call(Spans.union(lparen, rparen), args);
  }

  public Trailer.Subscript makeSubscriptTrailer(
      Token lbracket, ImmutableList<SubscriptElement> elements, Token rbracket) {
    return new Trailer.Subscript(Spans.union(lbracket, rbracket), elements);
  }

  public Trailer.Dot makeDotTrailer(Token dot, Identifier name) {
    return new Trailer.Dot(Spans.union(dot, name), dot.getSpan(), name);
  }

  public SubscriptElement.Index makeSubscriptIndex(Expression expr) {
    return new SubscriptElement.Index(expr);
  }

  /**
   * Returns the proper slice {@code lower:upper} or {@code lower:upper:stride}. Any bound may be
   * absent; {@code strideColon} is the second colon, if present.
   */
  public SubscriptElement.ProperSlice makeSubscriptSlice(
      @Nullable Expression lower,
      Token colon,
      @Nullable Expression upper,
      @Nullable Token strideColon,
      @Nullable Expression stride) {
    Preconditions.checkArgument(strideColon != null || stride == null, "stride without colon");
    return new SubscriptElement.ProperSlice(
        Spans.union(lower, colon, upper, strideColon, stride),
        lower,
        upper,
        strideColon != null,
        stride);
  }

  public SubscriptElement.Ellipsis makeSubscriptEllipsis(Token ellipsis) {
    checkKindNoValue(ellipsis, TokenKind.ELLIPSIS);
    return new SubscriptElement.Ellipsis(ellipsis.getSpan());
  }

  /**
   * Applies a chain of trailers to a primary expression, from left to right. Each step yields a
   * node spanning the accumulated expression through the trailer, so {@code f(x)[y]} spans from
   * {@code f} through {@code ]}.
   */
  public Expression addTrailer(Expression primary, List<? extends Trailer> trailers) {
    Expression e = primary;
    for (Trailer trailer : trailers) {
      e = applyTrailer(e, trailer);
    }
    return e;
  }

  private static Expression applyTrailer(Expression e, Trailer trailer) {
    Span span = Spans.union(e, trailer);
    if (trailer instanceof Trailer.Call call) {
      return new CallExpression(span, e, call.getArguments());
    } else if (trailer instanceof Trailer.Subscript subscript) {
      if (subscript.hasProperSlice()) {
        ImmutableList.Builder<Slice> slices = ImmutableList.builder();
        for (SubscriptElement element : subscript.getElements()) {
          slices.add(element.toSlice());
        }
        return new SliceExpression(span, e, slices.build());
      }
      return new IndexExpression(span, e, subscriptsToExpr(subscript.getElements()));
    } else {
      Trailer.Dot dot = (Trailer.Dot) trailer;
      return new DotExpression(span, e, dot.getName());
    }
  }

  // Converts a subscript of plain indices to the key of an index expression.
  private static Expression subscriptsToExpr(ImmutableList<SubscriptElement> elements) {
    if (elements.size() == 1) {
      return ((SubscriptElement.Index) elements.get(0)).getExpression();
    }
    ImmutableList.Builder<Expression> keys = ImmutableList.builder();
    for (SubscriptElement element : elements) {
      keys.add(((SubscriptElement.Index) element).getExpression());
    }
    return new ListExpression(Spans.of(elements), /* isTuple= */ true, keys.build());
  }

  // ==== Tuples, lists, sets, dicts and comprehensions ====

  /**
   * Returns the sole element of {@code elements} if there is exactly one and no trailing comma;
   * otherwise, returns the unparenthesized tuple of the elements, whose span includes the trailing
   * comma if present.
   */
  public Expression makeTupleOrExpr(List<Expression> elements, @Nullable Token trailingComma) {
    Preconditions.checkArgument(!elements.isEmpty(), "empty expression list");
    if (elements.size() == 1 && trailingComma == null) {
      return elements.get(0);
    }
    return new ListExpression(
        Spans.union(elements, trailingComma), /* isTuple= */ true, ImmutableList.copyOf(elements));
  }

  /** Returns the empty tuple, {@code ()}. */
  public ListExpression makeEmptyTuple(Token lparen, Token rparen) {
    return new ListExpression(
        Spans.union(lparen, rparen), /* isTuple= */ true, ImmutableList.of());
  }

  /**
   * Returns the list display {@code [body]}. The grammar parses the elements of a list as one
   * expression, so an unparenthesized tuple body is taken apart into the elements of the list; any
   * other body, including the empty tuple {@code ()}, is the sole element. A null body denotes the
   * empty list.
   */
  public ListExpression makeListForm(Token lbracket, @Nullable Expression body, Token rbracket) {
    Span span = Spans.union(lbracket, rbracket);
    if (body == null) {
      return new ListExpression(span, /* isTuple= */ false, ImmutableList.of());
    }
    // () is always parenthesized, so [()] has one element.
    if (body instanceof ListExpression tuple && tuple.isTuple() && !tuple.getElements().isEmpty()) {
      return new ListExpression(span, /* isTuple= */ false, tuple.getElements());
    }
    return new ListExpression(span, /* isTuple= */ false, ImmutableList.of(body));
  }

  /** Returns the list comprehension {@code [comprehension]}. */
  public ComprehensionExpression makeListForm(
      Token lbracket, Comprehension comprehension, Token rbracket) {
    return new ComprehensionExpression(
        Spans.union(lbracket, rbracket), ComprehensionExpression.Form.LIST, comprehension);
  }

  /** Returns the set display {@code {e1, e2, ...}}. Its elements are kept as they are. */
  public SetExpression makeSet(Token lbrace, ImmutableList<Expression> elements, Token rbrace) {
    return new SetExpression(Spans.union(lbrace, rbrace), elements);
  }

  /** Returns the set comprehension {@code {comprehension}}. */
  public ComprehensionExpression makeSet(Token lbrace, Comprehension comprehension, Token rbrace) {
    return new ComprehensionExpression(
        Spans.union(lbrace, rbrace), ComprehensionExpression.Form.SET, comprehension);
  }

  /** Returns the dict display {@code {entries...}}, which may be empty. */
  public DictExpression makeDictionary(
      Token lbrace, ImmutableList<DictExpression.Entry> entries, Token rbrace) {
    return new DictExpression(Spans.union(lbrace, rbrace), entries);
  }

  /**
   * Returns the dict comprehension {@code {comprehension}}, whose body is a dict entry.
   *
   * <p>The grammar also admits an unpacking {@code **d} as the body, which the language forbids.
   * It is accepted if {@link FileOptions#allowDictUnpackingInComprehension} holds, leaving the
   * error to a later stage, and reported here otherwise.
   */
  public ComprehensionExpression makeDictionary(
      Token lbrace, Comprehension comprehension, Token rbrace) throws SyntaxError.Exception {
    Node body = comprehension.getBody();
    Preconditions.checkArgument(
        body instanceof DictExpression.Entry, "dict comprehension with body %s", body);
    if (body instanceof DictExpression.Unpacking) {
      if (!options.allowDictUnpackingInComprehension()) {
        throw spanError(
            SyntaxError.Kind.DISALLOWED_SYNTAX,
            body,
            "dict unpacking cannot be used in dict comprehension");
      }
      logger.atFine().log("deferring rejection of dict unpacking at %s", body.getSpan());
    }
    return new ComprehensionExpression(
        Spans.union(lbrace, rbrace), ComprehensionExpression.Form.DICT, comprehension);
  }

  /** Returns the dict entry {@code key: value}. */
  public DictExpression.Pair makeDictPair(Expression key, Expression value) {
    return new DictExpression.Pair(Spans.union(key, value), key, value);
  }

  /** Returns the dict entry {@code **expr}. */
  public DictExpression.Unpacking makeDictUnpacking(Token starStar, Expression expr) {
    checkKindNoValue(starStar, TokenKind.DOUBLE_STAR);
    return new DictExpression.Unpacking(Spans.union(starStar, expr), expr);
  }

  /** Returns the parenthesized expression {@code (x)}. */
  public ParenExpression makeParenOrGenerator(Token lparen, Expression x, Token rparen) {
    return new ParenExpression(Spans.union(lparen, rparen), x);
  }

  /** Returns the generator expression {@code (comprehension)}. */
  public ComprehensionExpression makeParenOrGenerator(
      Token lparen, Comprehension comprehension, Token rparen) {
    return new ComprehensionExpression(
        Spans.union(lparen, rparen), ComprehensionExpression.Form.GENERATOR, comprehension);
  }

  /**
   * Returns the comprehension of {@code body} under {@code clauses}. The body is an expression, or
   * a dict entry for a dict comprehension; the first clause is a for clause.
   */
  public Comprehension makeComprehension(Node body, ImmutableList<Comprehension.Clause> clauses) {
    return new Comprehension(Spans.union(body, clauses), body, clauses);
  }

  /** Returns the comprehension clause {@code for vars in iterable}. */
  public Comprehension.For makeCompFor(Token forToken, Expression vars, Expression iterable) {
    checkKindNoValue(forToken, TokenKind.FOR);
    return new Comprehension.For(Spans.union(forToken, iterable), vars, iterable);
  }

  /** Returns the comprehension clause {@code if condition}. */
  public Comprehension.If makeCompIf(Token ifToken, Expression condition) {
    checkKindNoValue(ifToken, TokenKind.IF);
    return new Comprehension.If(Spans.union(ifToken, condition), condition);
  }

  // ==== Arguments ====

  public Argument.Positional makePositional(Expression value) {
    return new Argument.Positional(value.getSpan(), value);
  }

  public Argument.Keyword makeKeyword(Identifier name, Expression value) {
    return new Argument.Keyword(Spans.union(name, value), name, value);
  }

  public Argument.Star makeStarArg(Token star, Expression value) {
    checkKindNoValue(star, TokenKind.STAR);
    return new Argument.Star(Spans.union(star, value), value);
  }

  public Argument.StarStar makeStarStarArg(Token starStar, Expression value) {
    checkKindNoValue(starStar, TokenKind.DOUBLE_STAR);
    return new Argument.StarStar(Spans.union(starStar, value), value);
  }

  // ==== Parameters ====

  /** Returns the named parameter {@code name[: annotation][=default]}. */
  public Parameter.Named makeParam(
      Identifier name, @Nullable Expression annotation, @Nullable Expression defaultValue) {
    return new Parameter.Named(
        Spans.union(name, annotation, defaultValue), name, annotation, defaultValue);
  }

  /**
   * Returns the parameter {@code *name[: annotation]}, or the bare end-of-positional marker
   * {@code *} if {@code name} is null.
   */
  public Parameter makeStarParam(
      Token star, @Nullable Identifier name, @Nullable Expression annotation) {
    checkKindNoValue(star, TokenKind.STAR);
    if (name == null) {
      Preconditions.checkArgument(annotation == null, "annotation on bare *");
      return new Parameter.EndPositional(star.getSpan());
    }
    return new Parameter.Star(Spans.union(star, name, annotation), name, annotation);
  }

  /** Returns the parameter {@code **name[: annotation]}. */
  public Parameter.StarStar makeStarStarParam(
      Token starStar, Identifier name, @Nullable Expression annotation) {
    checkKindNoValue(starStar, TokenKind.DOUBLE_STAR);
    return new Parameter.StarStar(Spans.union(starStar, name, annotation), name, annotation);
  }

  /**
   * Returns the parameter for a pattern of the legacy tuple-parameter grammar, with an optional
   * default. A pattern that is just a name is an ordinary named parameter; a parenthesized pattern
   * is a tuple-unpacking parameter, permitted only if {@link FileOptions#allowTupleParameters}.
   */
  public Parameter makeTupleParam(ParamTuple pattern, @Nullable Expression defaultValue)
      throws SyntaxError.Exception {
    Span span = Spans.union(pattern, defaultValue);
    if (pattern instanceof ParamTuple.Name name) {
      return new Parameter.Named(span, name.getIdentifier(), null, defaultValue);
    }
    if (!options.allowTupleParameters()) {
      throw spanError(
          SyntaxError.Kind.DISALLOWED_SYNTAX, pattern, "tuple parameters are not supported");
    }
    return new Parameter.UnpackTuple(span, pattern, defaultValue);
  }

  public ParamTuple.Name makeParamTupleName(Identifier name) {
    return new ParamTuple.Name(name.getSpan(), name);
  }

  /** Returns the parenthesized pattern {@code (p1, p2, ...)}. */
  public ParamTuple.Tuple makeParamTuple(
      Token lparen, ImmutableList<ParamTuple> elements, Token rparen) {
    return new ParamTuple.Tuple(Spans.union(lparen, rparen), elements);
  }

  // ==== Statements ====

  /**
   * Returns the statement {@code first = rest[0] = ... = rest[n-1]}: an expression statement if
   * {@code rest} is empty, and otherwise an assignment of the last expression to all the others,
   * in left-to-right order.
   */
  public Statement makeNormalAssignment(Expression first, List<Expression> rest) {
    if (rest.isEmpty()) {
      return new ExpressionStatement(first.getSpan(), first);
    }
    ImmutableList<Expression> targets =
        ImmutableList.<Expression>builder()
            .add(first)
            .addAll(rest.subList(0, rest.size() - 1))
            .build();
    Expression value = rest.get(rest.size() - 1);
    return new AssignmentStatement(Spans.union(first, value), targets, value);
  }

  /** Returns the annotated assignment {@code target: annotation [= value]}. */
  public AnnotatedAssignmentStatement makeAnnAssignment(
      Expression target, Expression annotation, @Nullable Expression value) {
    return new AnnotatedAssignmentStatement(
        Spans.union(target, annotation, value), target, annotation, value);
  }

  /**
   * Returns the function definition {@code def name(params) [-> returnAnnotation]: body}, after
   * checking the order of the parameters. It spans from {@code def} through the body.
   */
  public DefStatement makeFun(
      Token def,
      Identifier name,
      ImmutableList<Parameter> params,
      @Nullable Expression returnAnnotation,
      ImmutableList<Statement> body)
      throws SyntaxError.Exception {
    checkKindNoValue(def, TokenKind.DEF);
    OrderingChecker.checkParameters(params);
    return new DefStatement(Spans.union(def, body), name, params, returnAnnotation, body);
  }

  public ReturnStatement makeReturn(Token returnToken, @Nullable Expression result) {
    checkKindNoValue(returnToken, TokenKind.RETURN);
    return new ReturnStatement(Spans.union(returnToken, result), result);
  }

  /** Returns the statement {@code pass}, {@code break} or {@code continue}. */
  public FlowStatement makeFlow(Token token) {
    Preconditions.checkArgument(
        FLOW_KEYWORDS.contains(token.getKind()), "not a flow keyword: %s", token.getKind());
    return new FlowStatement(token.getSpan(), token.getKind());
  }

  /**
   * Returns the try statement. The else and finally blocks are empty lists when absent; the
   * statement spans from {@code try} through the last block present.
   */
  public TryStatement makeTry(
      Token tryToken,
      ImmutableList<Statement> body,
      ImmutableList<ExceptHandler> handlers,
      ImmutableList<Statement> elseBody,
      ImmutableList<Statement> finallyBody) {
    checkKindNoValue(tryToken, TokenKind.TRY);
    return new TryStatement(
        Spans.union(tryToken, body, handlers, elseBody, finallyBody),
        body,
        handlers,
        elseBody,
        finallyBody);
  }

  /** Returns the except clause {@code except [type [as name]]: body}. */
  public ExceptHandler makeHandler(
      Token exceptToken,
      @Nullable Expression type,
      @Nullable Identifier name,
      ImmutableList<Statement> body) {
    checkKindNoValue(exceptToken, TokenKind.EXCEPT);
    return new ExceptHandler(Spans.union(exceptToken, type, name, body), type, name, body);
  }

  /**
   * Returns the decorator {@code @dotted.name} or, if {@code args} is non-null, {@code
   * @dotted.name(args)}, whose closing parenthesis is {@code rparen}. The arguments are checked
   * like those of a call.
   */
  public Decorator makeDecorator(
      Token at,
      ImmutableList<Identifier> dottedName,
      @Nullable ImmutableList<Argument> args,
      @Nullable Token rparen)
      throws SyntaxError.Exception {
    checkKindNoValue(at, TokenKind.AT);
    Preconditions.checkArgument(
        (args == null) == (rparen == null), "decorator arguments without parentheses");
    if (args != null) {
      OrderingChecker.checkArguments(args);
    }
    return new Decorator(Spans.union(at, dottedName, rparen), dottedName, args);
  }

  /**
   * Returns the definition preceded by its decorators, spanning from the first decorator through
   * the definition. The grammar guarantees at least one decorator.
   */
  public DecoratedStatement makeDecorated(
      ImmutableList<Decorator> decorators, Statement definition) {
    Preconditions.checkArgument(!decorators.isEmpty(), "no decorators");
    return new DecoratedStatement(
        Spans.union(decorators.get(0), definition), decorators, definition);
  }

  /** Returns the syntax tree of a whole file, given its statements and end-of-file token. */
  public SourceFile makeModule(ImmutableList<Statement> statements, Token eof) {
    checkKindNoValue(eof, TokenKind.EOF);
    return new SourceFile(Spans.union(statements, eof), statements);
  }

  private static void checkKindNoValue(Token token, TokenKind kind) {
    Preconditions.checkArgument(
        token.getKind() == kind, "got %s token, want %s", token.getKind(), kind);
  }
}
