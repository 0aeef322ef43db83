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

package com.google.optmodel;

import static com.google.common.base.Preconditions.checkState;

import com.google.optmodel.expansion.EquationExpander;
import com.google.optmodel.expansion.ExpansionParameters;
import com.google.optmodel.model.IndexedEquationTemplate;
import com.google.optmodel.model.Statement;
import com.google.optmodel.parsing.StatementParser;
import com.google.optmodel.parsing.tokenization.TokenManager;
import com.google.optmodel.parsing.tokenization.TokenizationOrchestrator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point of the engine: parses statements into a {@link ModelManager}, expands the equation
 * templates once the data is loaded, and builds the {@link LinearModel} handed to an exporter.
 *
 * <p>Typical use:
 *
 * <pre>
 * ModelParsingService service = new ModelParsingService();
 * ParseSessionResult result = service.parse(statements);
 * // load external data into service.getManager()
 * service.expandAllTemplates();
 * LinearModel model = service.buildModel();
 * </pre>
 */
public final class ModelParsingService {
  private static final Logger logger = Logger.getLogger(ModelParsingService.class.getName());

  private final ModelManager manager;
  private final TokenManager tokens = new TokenManager();
  private final StatementParser statementParser;
  private final EquationExpander expander;
  private final ParseSessionResult result = new ParseSessionResult();

  public ModelParsingService(ModelManager manager, ExpansionParameters parameters) {
    this.manager = manager;
    this.statementParser =
        new StatementParser(manager, tokens, TokenizationOrchestrator.createDefault());
    this.expander = new EquationExpander(manager, parameters);
  }

  /** Creates a service over an empty model, with the parameters of {@code optmodel.properties}. */
  public ModelParsingService() {
    this(new ModelManager(), ExpansionParameters.load());
  }

  public ModelManager getManager() {
    return manager;
  }

  public TokenManager getTokenManager() {
    return tokens;
  }

  /** Errors, warnings and success count accumulated since creation or {@link #clear()}. */
  public ParseSessionResult getResult() {
    return result;
  }

  /**
   * Parses the statements in order. A failing statement is recorded as an error with its line
   * number and the following statements are still parsed.
   */
  public ParseSessionResult parse(List<Statement> statements) {
    for (Statement statement : statements) {
      try {
        statementParser.parse(statement);
        result.incrementSuccess();
      } catch (ModelException e) {
        result.addError(statement.lineNumber(), e.getMessage());
        logger.warning("Line " + statement.lineNumber() + ": " + e.getMessage());
      }
    }
    logger.info("Parsed " + statements.size() + " statement(s): " + result);
    return result;
  }

  /**
   * Expands every template not expanded yet, then the objective.
   *
   * @throws IllegalStateException if an external parameter or set still has no value
   */
  public ParseSessionResult expandAllTemplates() {
    expander.expandAll(result);
    return result;
  }

  /**
   * Returns the flattened model.
   *
   * @throws IllegalStateException if a template is not expanded or no objective was declared
   */
  public LinearModel buildModel() {
    for (IndexedEquationTemplate template : manager.getTemplates()) {
      checkState(
          template.getState() != IndexedEquationTemplate.State.UNEXPANDED,
          "template at line %s is not expanded",
          template.getLineNumber());
    }
    checkState(manager.getObjective() != null, "the model has no objective");
    return new LinearModel(manager);
  }

  /** Returns the session summary followed by the model report. */
  public String generateReport() {
    StringBuilder sb = new StringBuilder();
    sb.append(result).append('\n');
    for (ParseSessionResult.Entry error : result.getErrors()) {
      sb.append("ERROR ").append(error).append('\n');
    }
    for (ParseSessionResult.Entry warning : result.getWarnings()) {
      sb.append("WARNING ").append(warning).append('\n');
    }
    sb.append(manager.generateReport());
    return sb.toString();
  }

  /** Forgets every declaration, placeholder and recorded message. */
  public void clear() {
    manager.clear();
    tokens.clear();
    result.clear();
  }
}
