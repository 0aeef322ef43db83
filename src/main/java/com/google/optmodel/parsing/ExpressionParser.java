// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.optmodel.parsing;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.expr.BinaryExpression;
import com.google.optmodel.expr.ComparisonExpression;
import com.google.optmodel.expr.CompositeKeyExpression;
import com.google.optmodel.expr.ConditionalExpression;
import com.google.optmodel.expr.ConstantExpression;
import com.google.optmodel.expr.DecisionExpressionReference;
import com.google.optmodel.expr.DynamicTupleFieldAccessExpression;
import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.Expressions;
import com.google.optmodel.expr.FilteredSummationExpression;
import com.google.optmodel.expr.IndexedParameterExpression;
import com.google.optmodel.expr.IndexedVariableExpression;
import com.google.optmodel.expr.ItemFieldAccessExpression;
import com.google.optmodel.expr.ItemFunctionExpression;
import com.google.optmodel.expr.IteratorSpec;
import com.google.optmodel.expr.IteratorTupleFieldAccessExpression;
import com.google.optmodel.expr.LogicalExpression;
import com.google.optmodel.expr.ParameterExpression;
import com.google.optmodel.expr.StringConstantExpression;
import com.google.optmodel.expr.TupleFieldAccessExpression;
import com.google.optmodel.expr.TupleKeyExpression;
import com.google.optmodel.expr.UnaryExpression;
import com.google.optmodel.expr.VariableExpression;
import com.google.optmodel.model.DecisionExpression;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import com.google.optmodel.parsing.ExpressionLexer.Kind;
import com.google.optmodel.parsing.ExpressionLexer.Token;
import com.google.optmodel.parsing.tokenization.TokenManager;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Recursive descent parser building {@link Expression} trees from tokenized text.
 *
 * <p>Precedence, lowest first: {@code ?:}, {@code ||}, {@code &&}, one comparison, {@code + -},
 * {@code * /}, unary {@code - !}. A summation body binds at the multiplicative level, so in
 * {@code sum(i in I) c[i] * x[i] + 1} the constant lies outside the sum.
 *
 * <p>Names are resolved while parsing. In the default mode an identifier must be an iterator in
 * scope or a declared symbol. The lenient mode, used for keys inside {@code item()} calls, reads
 * unknown identifiers as iterators to be bound at evaluation time.
 */
public final class ExpressionParser {
  /** The iterators of a {@code forall} or {@code sum} header and its optional filter. */
  @AutoValue
  public abstract static class Header {
    public abstract ImmutableList<IteratorSpec> iterators();

    public abstract Optional<Expression> filter();

    static Header create(List<IteratorSpec> iterators, Optional<Expression> filter) {
      return new AutoValue_ExpressionParser_Header(ImmutableList.copyOf(iterators), filter);
    }

    /** Names of the iterators, outer first. */
    public ImmutableList<String> variables() {
      ImmutableList.Builder<String> names = ImmutableList.builder();
      for (IteratorSpec spec : iterators()) {
        names.add(spec.variable());
      }
      return names.build();
    }
  }

  private final ModelManager manager;
  private final TokenManager tokens;
  private final boolean lenient;

  private ExpressionParser(ModelManager manager, TokenManager tokens, boolean lenient) {
    this.manager = manager;
    this.tokens = tokens;
    this.lenient = lenient;
  }

  public ExpressionParser(ModelManager manager, TokenManager tokens) {
    this(manager, tokens, false);
  }

  /** Returns a parser reading unknown identifiers as iterators. */
  public static ExpressionParser lenient(ModelManager manager, TokenManager tokens) {
    return new ExpressionParser(manager, tokens, true);
  }

  public Expression parse(String text) {
    return parse(text, ImmutableList.of());
  }

  /**
   * Parses a whole expression.
   *
   * @param scope iterators bound around the expression
   */
  public Expression parse(String text, Collection<String> scope) {
    Run run = new Run(text, scope);
    Expression expression = run.expression();
    run.expectEnd();
    return expression;
  }

  /** Parses {@code i in I, j in 1..n : filter}, the text between the parentheses of a header. */
  public Header parseHeader(String text, Collection<String> scope) {
    Run run = new Run(text, scope);
    ImmutableList<IteratorSpec> iterators = run.iterators();
    Optional<Expression> filter = Optional.empty();
    if (run.accept(Kind.COLON)) {
      filter = Optional.of(run.expression());
    }
    run.expectEnd();
    return Header.create(iterators, filter);
  }

  /** State of one parse. */
  private final class Run {
    private final String text;
    private final ImmutableList<Token> input;
    private final List<String> scope;
    private int pos;

    Run(String text, Collection<String> scope) {
      this.text = text;
      this.input = ExpressionLexer.tokenize(text);
      this.scope = new ArrayList<>(scope);
    }

    // Token helpers.

    Token peek() {
      return peek(0);
    }

    Token peek(int ahead) {
      return input.get(Math.min(pos + ahead, input.size() - 1));
    }

    Token advance() {
      Token token = peek();
      if (!token.is(Kind.EOF)) {
        pos++;
      }
      return token;
    }

    boolean accept(Kind kind) {
      if (peek().is(kind)) {
        pos++;
        return true;
      }
      return false;
    }

    boolean acceptWord(String word) {
      if (peek().isWord(word)) {
        pos++;
        return true;
      }
      return false;
    }

    Token expect(Kind kind, String what) {
      if (!peek().is(kind)) {
        throw error("expected " + what + " but found " + peek());
      }
      return advance();
    }

    String expectIdent(String what) {
      return expect(Kind.IDENT, what).text();
    }

    void expectEnd() {
      if (peek().is(Kind.ASSIGN)) {
        throw equalityError();
      }
      if (!peek().is(Kind.EOF)) {
        throw error("unexpected " + peek());
      }
    }

    ModelException error(String message) {
      return new ModelException.MalformedExpression("parse", message + " in \"" + text + "\"");
    }

    ModelException equalityError() {
      return new ModelException.MalformedExpression(
          "parse", "Use '==' for equality in \"" + text + "\"");
    }

    // Grammar.

    Expression expression() {
      Expression condition = or();
      if (accept(Kind.QUESTION)) {
        Expression whenTrue = expression();
        expect(Kind.COLON, "':'");
        Expression whenFalse = expression();
        return new ConditionalExpression(condition, whenTrue, whenFalse);
      }
      return condition;
    }

    Expression or() {
      Expression left = and();
      while (accept(Kind.OR) || acceptWord("or")) {
        left = new LogicalExpression(LogicalExpression.Operator.OR, left, and());
      }
      return left;
    }

    Expression and() {
      Expression left = comparison();
      while (accept(Kind.AND) || acceptWord("and")) {
        left = new LogicalExpression(LogicalExpression.Operator.AND, left, comparison());
      }
      return left;
    }

    Expression comparison() {
      Expression left = additive();
      if (peek().is(Kind.ASSIGN)) {
        throw equalityError();
      }
      ComparisonExpression.Operator op = comparisonOperator(peek());
      if (op == null) {
        return left;
      }
      advance();
      Expression right = additive();
      if (comparisonOperator(peek()) != null) {
        throw error("chained comparison");
      }
      return new ComparisonExpression(op, left, right);
    }

    Expression additive() {
      Expression left = multiplicative();
      while (true) {
        if (accept(Kind.PLUS)) {
          left = BinaryExpression.add(left, multiplicative());
        } else if (accept(Kind.MINUS)) {
          left = BinaryExpression.subtract(left, multiplicative());
        } else {
          return left;
        }
      }
    }

    Expression multiplicative() {
      Expression left = unary();
      while (true) {
        if (accept(Kind.STAR)) {
          left = BinaryExpression.multiply(left, unary());
        } else if (accept(Kind.SLASH)) {
          left = BinaryExpression.divide(left, unary());
        } else {
          return left;
        }
      }
    }

    Expression unary() {
      if (accept(Kind.MINUS)) {
        return UnaryExpression.negate(unary());
      }
      if (accept(Kind.PLUS)) {
        return unary();
      }
      if (accept(Kind.NOT) || acceptWord("not")) {
        return new UnaryExpression(UnaryExpression.Operator.NOT, unary());
      }
      return primary();
    }

    Expression primary() {
      Token token = advance();
      switch (token.kind()) {
        case NUMBER:
          return new ConstantExpression(Double.parseDouble(token.text()));
        case STRING:
          return new StringConstantExpression(token.text());
        case PLACEHOLDER:
          return tokens.get(token.text());
        case LPAREN:
          {
            Expression inner = expression();
            expect(Kind.RPAREN, "')'");
            return inner;
          }
        case LT:
          return key();
        case IDENT:
          return identifier(token.text());
        default:
          throw error("unexpected " + token);
      }
    }

    /** {@code <a>} or {@code <a, b, ...>}; the opening bracket is consumed. */
    Expression key() {
      List<Expression> parts = new ArrayList<>();
      parts.add(additive());
      while (accept(Kind.COMMA)) {
        parts.add(additive());
      }
      expect(Kind.GT, "'>' closing a key");
      return parts.size() == 1
          ? new TupleKeyExpression(parts.get(0))
          : new CompositeKeyExpression(parts);
    }

    Expression identifier(String name) {
      boolean call = peek().is(Kind.LPAREN);
      if (call && name.equals("sum")) {
        return summation();
      }
      if (call && name.equals("if")) {
        return ifElse();
      }
      if (call && name.equals("item")) {
        return item();
      }
      if (peek().is(Kind.LBRACKET)) {
        return indexed(name);
      }
      if (accept(Kind.DOT)) {
        return fieldAccess(name, expectIdent("field name"));
      }
      if (!inScope(name) && !manager.isDeclared(name)) {
        if (name.equals("true")) {
          return ConstantExpression.ONE;
        }
        if (name.equals("false")) {
          return ConstantExpression.ZERO;
        }
      }
      return bare(name);
    }

    Expression summation() {
      expect(Kind.LPAREN, "'('");
      int depth = scope.size();
      ImmutableList<IteratorSpec> iterators = iterators();
      Expression filter = null;
      if (accept(Kind.COLON)) {
        filter = expression();
      }
      expect(Kind.RPAREN, "')' closing the summation header");
      Expression body = multiplicative();
      while (scope.size() > depth) {
        scope.remove(scope.size() - 1);
      }
      return new FilteredSummationExpression(iterators, filter, body);
    }

    Expression ifElse() {
      expect(Kind.LPAREN, "'('");
      Expression condition = expression();
      expect(Kind.RPAREN, "')'");
      expect(Kind.LBRACE, "'{'");
      Expression whenTrue = expression();
      expect(Kind.RBRACE, "'}'");
      if (!acceptWord("else")) {
        throw error("expected 'else' but found " + peek());
      }
      expect(Kind.LBRACE, "'{'");
      Expression whenFalse = expression();
      expect(Kind.RBRACE, "'}'");
      return new ConditionalExpression(condition, whenTrue, whenFalse);
    }

    Expression item() {
      expect(Kind.LPAREN, "'('");
      String setName = expectIdent("tuple set name");
      TupleSchema schema = schemaOf(setName);
      expect(Kind.COMMA, "','");
      Expression key = expression();
      expect(Kind.RPAREN, "')' closing item()");
      ItemFunctionExpression item = new ItemFunctionExpression(setName, key);
      if (!accept(Kind.DOT)) {
        return item;
      }
      String field = expectIdent("field name");
      checkField(schema, field);
      return new ItemFieldAccessExpression(item, field);
    }

    /**
     * Parses the iterators of a header and brings them in scope. The caller removes them from
     * scope once their body is parsed.
     */
    ImmutableList<IteratorSpec> iterators() {
      ImmutableList.Builder<IteratorSpec> iterators = ImmutableList.builder();
      do {
        List<String> names = new ArrayList<>();
        names.add(iteratorName(advance()));
        while (peek().is(Kind.COMMA)
            && (peek(1).is(Kind.IDENT) || peek(1).is(Kind.PLACEHOLDER))
            && (peek(2).is(Kind.COMMA) || peek(2).isWord("in"))) {
          advance();
          names.add(iteratorName(advance()));
        }
        if (!acceptWord("in")) {
          throw error("expected 'in' but found " + peek());
        }
        if (peek().is(Kind.IDENT) && !peek(1).is(Kind.DOTDOT)) {
          String setName = advance().text();
          if (!lenient && !manager.isSet(setName)) {
            throw new ModelException.NotFound("parse", "Set", setName);
          }
          for (String name : names) {
            iterators.add(IteratorSpec.overSet(name, setName));
          }
        } else {
          Expression lower = additive();
          expect(Kind.DOTDOT, "'..'");
          Expression upper = additive();
          for (String name : names) {
            iterators.add(IteratorSpec.overRange(name, lower, upper));
          }
        }
        scope.addAll(names);
      } while (accept(Kind.COMMA));
      return iterators.build();
    }

    /**
     * An iterator name. A scalar parameter of the same name was already replaced by its
     * placeholder; the iterator shadows it.
     */
    String iteratorName(Token token) {
      if (token.is(Kind.IDENT)) {
        return token.text();
      }
      if (token.is(Kind.PLACEHOLDER)) {
        Expression replaced = tokens.get(token.text());
        if (replaced instanceof ParameterExpression) {
          return ((ParameterExpression) replaced).getName();
        }
      }
      throw error("expected iterator name but found " + token);
    }

    /** {@code name[a]}, {@code name[a, b]} or {@code name[a][b]}. */
    Expression indexed(String name) {
      List<Expression> indices = new ArrayList<>();
      while (accept(Kind.LBRACKET)) {
        indices.add(expression());
        while (accept(Kind.COMMA)) {
          indices.add(expression());
        }
        expect(Kind.RBRACKET, "']'");
      }
      if (manager.getTupleSet(name) != null) {
        return tupleAccess(name, indices);
      }
      IndexedVariable variable = manager.getVariable(name);
      if (variable != null) {
        checkDimension(name, variable.getDimension(), indices.size());
        return new IndexedVariableExpression(name, indices);
      }
      Parameter parameter = manager.getParameter(name);
      if (parameter != null) {
        if (parameter.isTuple()) {
          throw error("tuple parameter '" + name + "' cannot be indexed");
        }
        checkDimension(name, parameter.getDimension(), indices.size());
        return new IndexedParameterExpression(name, indices);
      }
      DecisionExpression dexpr = manager.getDecisionExpression(name);
      if (dexpr != null) {
        checkDimension(name, dexpr.isIndexed() ? 1 : 0, indices.size());
        return new DecisionExpressionReference(name, indices.get(0));
      }
      throw new ModelException.NotFound("parse", "Symbol", name);
    }

    Expression tupleAccess(String setName, List<Expression> indices) {
      if (indices.size() != 1) {
        throw error("tuple set '" + setName + "' takes a single index");
      }
      if (!accept(Kind.DOT)) {
        throw error("expected a field after " + setName + "[...]");
      }
      String field = expectIdent("field name");
      checkField(schemaOf(setName), field);
      Expression index = indices.get(0);
      OptionalDouble literal = Expressions.literalValue(index);
      if (literal.isPresent()) {
        return new TupleFieldAccessExpression(setName, (int) literal.getAsDouble(), field);
      }
      if (index instanceof ParameterExpression) {
        return new IteratorTupleFieldAccessExpression(
            setName, ((ParameterExpression) index).getName(), field);
      }
      throw error("index of tuple set '" + setName + "' must be a literal or an iterator");
    }

    Expression fieldAccess(String name, String field) {
      if (inScope(name) || lenient) {
        return new DynamicTupleFieldAccessExpression(name, field);
      }
      Parameter parameter = manager.getParameter(name);
      if (parameter != null && parameter.isTuple()) {
        TupleSchema schema = manager.getTupleSchema(parameter.getSchemaName());
        if (schema == null) {
          throw new ModelException.SchemaNotFound("parse", parameter.getSchemaName());
        }
        checkField(schema, field);
        return new DynamicTupleFieldAccessExpression(name, field);
      }
      if (manager.getTupleSet(name) != null) {
        throw error("tuple set '" + name + "' needs an index, as in " + name + "[1]." + field);
      }
      throw new ModelException.NotFound("parse", "Symbol", name);
    }

    Expression bare(String name) {
      if (inScope(name)) {
        return new ParameterExpression(name);
      }
      if (tokens.isFlattenedVariable(name)) {
        return new VariableExpression(name);
      }
      IndexedVariable variable = manager.getVariable(name);
      if (variable != null) {
        checkDimension(name, variable.getDimension(), 0);
        return new VariableExpression(name);
      }
      DecisionExpression dexpr = manager.getDecisionExpression(name);
      if (dexpr != null) {
        checkDimension(name, dexpr.isIndexed() ? 1 : 0, 0);
        return new DecisionExpressionReference(name, null);
      }
      Parameter parameter = manager.getParameter(name);
      if (parameter != null) {
        if (parameter.isTuple()) {
          throw error("tuple parameter '" + name + "' is used without a field");
        }
        checkDimension(name, parameter.getDimension(), 0);
        return new ParameterExpression(name);
      }
      if (lenient) {
        return new ParameterExpression(name);
      }
      throw new ModelException.NotFound("parse", "Symbol", name);
    }

    boolean inScope(String name) {
      return scope.contains(name);
    }

    TupleSchema schemaOf(String setName) {
      TupleSet tupleSet = manager.getTupleSet(setName);
      if (tupleSet == null) {
        throw new ModelException.TupleSetNotFound("parse", setName);
      }
      TupleSchema schema = manager.getTupleSchema(tupleSet.getSchemaName());
      if (schema == null) {
        throw new ModelException.SchemaNotFound("parse", tupleSet.getSchemaName());
      }
      return schema;
    }

    void checkField(TupleSchema schema, String field) {
      if (!schema.hasField(field)) {
        throw new ModelException.NotFound("parse", "Field", schema.getName() + "." + field);
      }
    }

    void checkDimension(String name, int expected, int actual) {
      if (expected != actual) {
        throw error("'" + name + "' takes " + expected + " index(es), got " + actual);
      }
    }
  }

  private static ComparisonExpression.Operator comparisonOperator(Token token) {
    switch (token.kind()) {
      case EQ:
        return ComparisonExpression.Operator.EQUAL;
      case NE:
        return ComparisonExpression.Operator.NOT_EQUAL;
      case LT:
        return ComparisonExpression.Operator.LESS_THAN;
      case LE:
        return ComparisonExpression.Operator.LESS_OR_EQUAL;
      case GT:
        return ComparisonExpression.Operator.GREATER_THAN;
      case GE:
        return ComparisonExpression.Operator.GREATER_OR_EQUAL;
      default:
        return null;
    }
  }
}
