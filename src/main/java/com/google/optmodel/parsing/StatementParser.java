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

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.expr.Binding;
import com.google.optmodel.expr.ComparisonExpression;
import com.google.optmodel.expr.DomainResolver;
import com.google.optmodel.expr.EvaluationContext;
import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.IteratorSpec;
import com.google.optmodel.model.DecisionExpression;
import com.google.optmodel.model.IndexSet;
import com.google.optmodel.model.IndexedEquationTemplate;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.ObjectiveSense;
import com.google.optmodel.model.ObjectiveTemplate;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.PrimitiveSet;
import com.google.optmodel.model.RelationalOperator;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.Statement;
import com.google.optmodel.model.TupleInstance;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import com.google.optmodel.model.ValueType;
import com.google.optmodel.parsing.tokenization.TokenManager;
import com.google.optmodel.parsing.tokenization.TokenizationOrchestrator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registers one model statement with a {@link ModelManager}.
 *
 * <p>Declarations (ranges, sets, tuple schemas and sets, parameters, variables, decision
 * expressions) take effect immediately. Constraints and objectives go through the tokenization
 * pipeline, are parsed, and are registered as templates for later expansion. Data assignments
 * {@code name = literal} fill external parameters and sets.
 */
public final class StatementParser {
  private static final Logger logger = Logger.getLogger(StatementParser.class.getName());

  private static final Pattern KEYWORD = Pattern.compile("^([A-Za-z]\\w*\\+?)");
  private static final Pattern TUPLE_SCHEMA =
      Pattern.compile("tuple\\s+([A-Za-z]\\w*)\\s*\\{(.*)\\}", Pattern.DOTALL);
  private static final Pattern FIELD =
      Pattern.compile("(key\\s+)?([A-Za-z]+\\+?)\\s+([A-Za-z]\\w*)");
  private static final Pattern RANGE =
      Pattern.compile("range\\s+([A-Za-z]\\w*)\\s*=\\s*(.+?)\\s*\\.\\.\\s*(.+)", Pattern.DOTALL);
  private static final Pattern SET =
      Pattern.compile(
          "\\{\\s*([A-Za-z]\\w*)\\s*\\}\\s*([A-Za-z]\\w*)\\s*(?:\\[\\s*([A-Za-z]\\w*)\\s*\\])?"
              + "\\s*(?:=\\s*(.*))?",
          Pattern.DOTALL);
  private static final Pattern PARAMETER =
      Pattern.compile(
          "([A-Za-z]\\w*\\+?)\\s+([A-Za-z]\\w*)\\s*((?:\\[[^\\]]*\\]\\s*)*)(?:=\\s*(.*))?",
          Pattern.DOTALL);
  private static final Pattern VARIABLE =
      Pattern.compile(
          "(?:dvar|var)\\s+([A-Za-z]+\\+?)\\s+([A-Za-z]\\w*)\\s*((?:\\[[^\\]]*\\]\\s*)*)"
              + "(?:in\\s+(.+?)\\s*\\.\\.\\s*(.+))?",
          Pattern.DOTALL);
  private static final Pattern DEXPR =
      Pattern.compile(
          "dexpr\\s+([A-Za-z]+\\+?)\\s+([A-Za-z]\\w*)\\s*(?:\\[([^\\]]*)\\])?\\s*=\\s*(.+)",
          Pattern.DOTALL);
  private static final Pattern OBJECTIVE =
      Pattern.compile(
          "(minimize|maximize)\\s+(?:([A-Za-z]\\w*)\\s*:(?![:=]))?\\s*(.+)", Pattern.DOTALL);
  private static final Pattern INDEXED_LABEL =
      Pattern.compile(
          "([A-Za-z]\\w*)\\s*\\[([^\\]]*\\bin\\b[^\\]]*)\\]\\s*:(.+)", Pattern.DOTALL);
  private static final Pattern LABEL =
      Pattern.compile("([A-Za-z]\\w*)\\s*:(?!=)(.+)", Pattern.DOTALL);
  private static final Pattern ASSIGNMENT =
      Pattern.compile("([A-Za-z]\\w*)\\s*=(?!=)\\s*(.+)", Pattern.DOTALL);

  private static final String EXTERNAL = "...";
  private static final ExpressionParser.Header NO_ITERATORS =
      ExpressionParser.Header.create(ImmutableList.of(), Optional.empty());

  private final ModelManager manager;
  private final TokenManager tokens;
  private final TokenizationOrchestrator orchestrator;
  private final ExpressionParser parser;

  public StatementParser(
      ModelManager manager, TokenManager tokens, TokenizationOrchestrator orchestrator) {
    this.manager = manager;
    this.tokens = tokens;
    this.orchestrator = orchestrator;
    this.parser = new ExpressionParser(manager, tokens);
  }

  public StatementParser(ModelManager manager, TokenManager tokens) {
    this(manager, tokens, TokenizationOrchestrator.createDefault());
  }

  /**
   * Registers {@code statement}.
   *
   * @throws ModelException if the statement is invalid; nothing is registered then
   */
  public void parse(Statement statement) {
    try {
      register(statement);
    } catch (IllegalArgumentException | IllegalStateException e) {
      // Declarations validate their arguments with preconditions.
      throw new ModelException.MalformedExpression("parse", e.getMessage(), e);
    }
  }

  private void register(Statement statement) {
    String text = statement.text().trim();
    while (text.endsWith(";")) {
      text = text.substring(0, text.length() - 1).trim();
    }
    if (text.isEmpty()) {
      return;
    }
    Matcher keyword = KEYWORD.matcher(text);
    String first = keyword.find() ? keyword.group(1) : "";
    switch (first) {
      case "tuple":
        parseTupleSchema(text);
        return;
      case "range":
        parseRange(text);
        return;
      case "dvar":
      case "var":
        parseVariable(text);
        return;
      case "dexpr":
        parseDecisionExpression(text);
        return;
      case "minimize":
      case "maximize":
        parseObjective(text, statement.lineNumber());
        return;
      case "forall":
        parseForall(text, statement.lineNumber());
        return;
      default:
        break;
    }
    if (text.startsWith("{")) {
      parseSet(text);
      return;
    }
    Matcher matcher = PARAMETER.matcher(text);
    if (ValueType.fromKeyword(first) != null && matcher.matches()) {
      parseParameter(matcher);
      return;
    }
    if (manager.getTupleSchema(first) != null && matcher.matches()) {
      parseTupleParameter(matcher);
      return;
    }
    matcher = INDEXED_LABEL.matcher(text);
    if (matcher.matches()) {
      String tokenized = tokenize(matcher.group(2));
      ExpressionParser.Header header = parser.parseHeader(tokenized, ImmutableList.of());
      addTemplate(matcher.group(1), header, matcher.group(3), statement.lineNumber());
      return;
    }
    matcher = ASSIGNMENT.matcher(text);
    if (matcher.matches() && isDataTarget(matcher.group(1))) {
      assignData(matcher.group(1), matcher.group(2).trim());
      return;
    }
    parseConstraint(text, statement.lineNumber());
  }

  // Declarations.

  private void parseTupleSchema(String text) {
    Matcher matcher = TUPLE_SCHEMA.matcher(text);
    if (!matcher.matches()) {
      throw malformed("tuple declaration", text);
    }
    TupleSchema schema = new TupleSchema(matcher.group(1));
    for (String field : matcher.group(2).split(";")) {
      if (field.trim().isEmpty()) {
        continue;
      }
      Matcher fieldMatcher = FIELD.matcher(field.trim());
      if (!fieldMatcher.matches()) {
        throw malformed("tuple field", field.trim());
      }
      ValueType type = ValueType.fromKeyword(fieldMatcher.group(2));
      if (type == null) {
        throw malformed("field type", fieldMatcher.group(2));
      }
      schema.addField(fieldMatcher.group(3), type, fieldMatcher.group(1) != null);
    }
    manager.addTupleSchema(schema);
    logger.fine("Declared " + schema);
  }

  private void parseRange(String text) {
    Matcher matcher = RANGE.matcher(text);
    if (!matcher.matches()) {
      throw malformed("range declaration", text);
    }
    int start = parseExpression(matcher.group(2)).evaluateIndex(EvaluationContext.of(manager));
    int end = parseExpression(matcher.group(3)).evaluateIndex(EvaluationContext.of(manager));
    manager.addIndexSet(new IndexSet(matcher.group(1), start, end));
  }

  private void parseSet(String text) {
    Matcher matcher = SET.matcher(text);
    if (!matcher.matches()) {
      throw malformed("set declaration", text);
    }
    String typeName = matcher.group(1);
    String name = matcher.group(2);
    String indexSetName = matcher.group(3);
    String value = matcher.group(4) != null ? matcher.group(4).trim() : null;
    boolean external = EXTERNAL.equals(value);
    ValueType elementType = ValueType.fromKeyword(typeName);
    if (elementType != null) {
      if (indexSetName != null) {
        throw malformed("set declaration", text);
      }
      PrimitiveSet set = new PrimitiveSet(name, elementType, external);
      if (value != null && !external) {
        addElements(set, value);
      }
      manager.addPrimitiveSet(set);
      return;
    }
    TupleSchema schema = manager.getTupleSchema(typeName);
    if (schema == null) {
      throw new ModelException.SchemaNotFound("declare", typeName);
    }
    if (indexSetName != null && manager.getIndexSet(indexSetName) == null) {
      throw new ModelException.NotFound("declare", "Index set", indexSetName);
    }
    TupleSet set = new TupleSet(name, typeName, indexSetName, external);
    if (value != null && !external) {
      addTuples(set, schema, value);
    }
    manager.addTupleSet(set);
  }

  private void parseParameter(Matcher matcher) {
    ValueType type = ValueType.fromKeyword(matcher.group(1));
    String name = matcher.group(2);
    List<String> setNames = indexSetNames(matcher.group(3));
    String value = matcher.group(4) != null ? matcher.group(4).trim() : null;
    boolean external = EXTERNAL.equals(value);
    Parameter parameter =
        setNames.isEmpty()
            ? Parameter.scalar(name, type, external)
            : Parameter.indexed(name, type, setNames, external);
    if (value != null && !external) {
      assignParameter(parameter, value);
    }
    manager.addParameter(parameter);
  }

  private void parseTupleParameter(Matcher matcher) {
    String name = matcher.group(2);
    if (!matcher.group(3).isEmpty()) {
      throw malformed("tuple parameter", name + matcher.group(3));
    }
    String value = matcher.group(4) != null ? matcher.group(4).trim() : null;
    boolean external = EXTERNAL.equals(value);
    Parameter parameter = Parameter.tuple(name, matcher.group(1), external);
    if (value != null && !external) {
      assignParameter(parameter, value);
    }
    manager.addParameter(parameter);
  }

  private void parseVariable(String text) {
    Matcher matcher = VARIABLE.matcher(text);
    if (!matcher.matches()) {
      throw malformed("variable declaration", text);
    }
    String typeName = matcher.group(1);
    ValueType type = ValueType.fromKeyword(typeName);
    if (type == null || type == ValueType.STRING) {
      throw malformed("variable type", typeName);
    }
    Double lower = typeName.endsWith("+") ? 0.0 : null;
    Double upper = null;
    if (matcher.group(4) != null) {
      lower = parseExpression(matcher.group(4)).evaluate(manager);
      upper = parseExpression(matcher.group(5)).evaluate(manager);
    }
    manager.addVariable(
        new IndexedVariable(
            matcher.group(2), type, indexSetNames(matcher.group(3)), lower, upper));
  }

  private void parseDecisionExpression(String text) {
    Matcher matcher = DEXPR.matcher(text);
    if (!matcher.matches()) {
      throw malformed("dexpr declaration", text);
    }
    ValueType type = ValueType.fromKeyword(matcher.group(1));
    if (type == null || !type.isNumeric()) {
      throw malformed("dexpr type", matcher.group(1));
    }
    IteratorSpec index = null;
    List<String> scope = ImmutableList.of();
    if (matcher.group(3) != null) {
      ExpressionParser.Header header =
          parser.parseHeader(tokenize(matcher.group(3)), ImmutableList.of());
      if (header.iterators().size() != 1 || header.filter().isPresent()) {
        throw malformed("dexpr index", matcher.group(3));
      }
      index = header.iterators().get(0);
      scope = header.variables();
    }
    Expression body = parser.parse(tokenize(matcher.group(4)), scope);
    manager.addDecisionExpression(new DecisionExpression(matcher.group(2), type, index, body));
  }

  private void parseObjective(String text, int lineNumber) {
    Matcher matcher = OBJECTIVE.matcher(text);
    if (!matcher.matches()) {
      throw malformed("objective", text);
    }
    ObjectiveSense sense =
        matcher.group(1).equals("minimize") ? ObjectiveSense.MINIMIZE : ObjectiveSense.MAXIMIZE;
    String name = matcher.group(2) != null ? matcher.group(2) : "obj";
    Expression expression = parser.parse(tokenize(matcher.group(3)));
    manager.setObjectiveTemplate(new ObjectiveTemplate(name, sense, expression, lineNumber));
  }

  // Constraints.

  private void parseForall(String text, int lineNumber) {
    String tokenized = tokenize(text);
    int open = tokenized.indexOf('(');
    int close = matchingParenthesis(tokenized, open);
    if (open < 0 || close < 0) {
      throw malformed("forall header", text);
    }
    ExpressionParser.Header header =
        parser.parseHeader(tokenized.substring(open + 1, close), ImmutableList.of());
    String rest = tokenized.substring(close + 1).trim();
    String label = null;
    Matcher matcher = LABEL.matcher(rest);
    if (matcher.matches()) {
      label = matcher.group(1);
      rest = matcher.group(2);
    }
    addTemplate(label, header, rest, lineNumber);
  }

  private void parseConstraint(String text, int lineNumber) {
    String label = null;
    String body = text;
    Matcher matcher = LABEL.matcher(text);
    if (matcher.matches()) {
      label = matcher.group(1);
      body = matcher.group(2);
    }
    addTemplate(label, NO_ITERATORS, body, lineNumber);
  }

  private void addTemplate(
      String label, ExpressionParser.Header header, String body, int lineNumber) {
    if (header.iterators().size() > 2) {
      throw new ModelException.MalformedExpression(
          "parse", "at most two iterators are supported, got " + header.iterators().size());
    }
    Expression constraint = parser.parse(tokenize(body), header.variables());
    if (!(constraint instanceof ComparisonExpression)) {
      throw new ModelException.MalformedExpression(
          "parse", "constraint needs a relational operator: " + body.trim());
    }
    ComparisonExpression comparison = (ComparisonExpression) constraint;
    if (comparison.getOperator() == ComparisonExpression.Operator.NOT_EQUAL) {
      throw new ModelException.MalformedExpression(
          "parse", "'!=' is not allowed in a linear constraint: " + body.trim());
    }
    RelationalOperator op = comparison.getOperator().toRelationalOperator();
    IndexedEquationTemplate template =
        new IndexedEquationTemplate(
            label,
            header.iterators(),
            header.filter().orElse(null),
            op,
            comparison.getLeft(),
            comparison.getRight(),
            lineNumber);
    manager.addTemplate(template);
    logger.fine("Registered " + template);
  }

  // Data.

  private boolean isDataTarget(String name) {
    return manager.getParameter(name) != null
        || manager.getPrimitiveSet(name) != null
        || manager.getTupleSet(name) != null;
  }

  private void assignData(String name, String value) {
    Parameter parameter = manager.getParameter(name);
    if (parameter != null) {
      assignParameter(parameter, value);
      return;
    }
    PrimitiveSet primitiveSet = manager.getPrimitiveSet(name);
    if (primitiveSet != null) {
      addElements(primitiveSet, value);
      return;
    }
    TupleSet tupleSet = manager.getTupleSet(name);
    addTuples(tupleSet, manager.getTupleSchema(tupleSet.getSchemaName()), value);
  }

  private void assignParameter(Parameter parameter, String value) {
    if (parameter.isTuple()) {
      TupleSchema schema = manager.getTupleSchema(parameter.getSchemaName());
      parameter.setTupleValue(TupleInstance.of(schema, LiteralParser.tuple(value)));
      return;
    }
    switch (parameter.getDimension()) {
      case 0:
        {
          Optional<ScalarValue> literal = LiteralParser.tryScalar(value);
          parameter.setValue(
              literal.isPresent()
                  ? literal.get()
                  : parseExpression(value).evaluateScalar(EvaluationContext.of(manager)));
          return;
        }
      case 1:
        {
          ImmutableList<ScalarValue> values = LiteralParser.list(value);
          ImmutableList<Integer> keys = indexValues(parameter.getIndexSetNames().get(0));
          checkSize(parameter.getName(), keys.size(), values.size());
          for (int i = 0; i < keys.size(); i++) {
            parameter.setIndexedValue(ImmutableList.of(keys.get(i)), values.get(i));
          }
          return;
        }
      default:
        {
          ImmutableList<ImmutableList<ScalarValue>> rows = LiteralParser.matrix(value);
          ImmutableList<Integer> rowKeys = indexValues(parameter.getIndexSetNames().get(0));
          ImmutableList<Integer> columnKeys = indexValues(parameter.getIndexSetNames().get(1));
          checkSize(parameter.getName(), rowKeys.size(), rows.size());
          for (int i = 0; i < rowKeys.size(); i++) {
            checkSize(
                parameter.getName() + " row " + rowKeys.get(i),
                columnKeys.size(),
                rows.get(i).size());
            for (int j = 0; j < columnKeys.size(); j++) {
              parameter.setIndexedValue(
                  ImmutableList.of(rowKeys.get(i), columnKeys.get(j)), rows.get(i).get(j));
            }
          }
        }
    }
  }

  private static void addElements(PrimitiveSet set, String value) {
    for (ScalarValue element : LiteralParser.list(value)) {
      if (!set.add(element)) {
        logger.warning("Duplicate element " + element + " ignored in set " + set.getName());
      }
    }
  }

  private static void addTuples(TupleSet set, TupleSchema schema, String value) {
    for (List<ScalarValue> fields : LiteralParser.tuples(value)) {
      set.addInstance(TupleInstance.of(schema, fields));
    }
  }

  // Helpers.

  /** Index values of a declared set, in declaration order. */
  private ImmutableList<Integer> indexValues(String setName) {
    ImmutableList.Builder<Integer> values = ImmutableList.builder();
    for (Binding binding : DomainResolver.resolveSet(setName, manager)) {
      values.add(binding.getIndex());
    }
    return values.build();
  }

  /** Reads {@code [I][J]} or {@code [I, J]}; every name must be a declared set. */
  private List<String> indexSetNames(String dimensions) {
    List<String> names = new ArrayList<>();
    for (String part : dimensions.replace("[", ",").replace("]", ",").split(",")) {
      String name = part.trim();
      if (name.isEmpty()) {
        continue;
      }
      if (!manager.isSet(name)) {
        throw new ModelException.NotFound("declare", "Set", name);
      }
      names.add(name);
    }
    if (names.size() > 2) {
      throw new ModelException.MalformedExpression(
          "declare", "at most two dimensions are supported, got " + dimensions.trim());
    }
    return names;
  }

  private String tokenize(String text) {
    return orchestrator.tokenize(text, tokens, manager);
  }

  private Expression parseExpression(String text) {
    return parser.parse(tokenize(text));
  }

  private static void checkSize(String name, int expected, int actual) {
    if (expected != actual) {
      throw new ModelException.MalformedExpression(
          "assign", "'" + name + "' expects " + expected + " value(s), got " + actual);
    }
  }

  private static ModelException malformed(String what, String text) {
    return new ModelException.MalformedExpression("declare", "invalid " + what + ": " + text);
  }

  /** Index of the parenthesis closing the one at {@code open}, or -1. */
  private static int matchingParenthesis(String text, int open) {
    if (open < 0) {
      return -1;
    }
    int depth = 0;
    boolean inString = false;
    for (int i = open; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"') {
        inString = !inString;
      } else if (!inString && c == '(') {
        depth++;
      } else if (!inString && c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }
}
