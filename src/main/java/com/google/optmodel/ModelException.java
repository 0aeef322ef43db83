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

/**
 * Root of the exceptions raised while building, evaluating and expanding a model.
 *
 * <p>Errors fall in three families. {@link Structural} errors (undeclared names, key arity,
 * malformed input) are fatal to the statement or template that raised them. {@link
 * ValueResolution} errors (no matching tuple, missing value, index out of range) are fatal only to
 * the expansion combination that raised them. {@link NumericType} errors signal that a
 * non-numeric node was evaluated as a number and are never skipped.
 */
public class ModelException extends RuntimeException {
  public ModelException(String methodName, String msg) {
    // Call constructor of parent Exception
    super(methodName + ": " + msg);
  }

  public ModelException(String methodName, String msg, Throwable cause) {
    super(methodName + ": " + msg, cause);
  }

  /** Undeclared names, key-arity mismatches and malformed expressions. */
  public static class Structural extends ModelException {
    public Structural(String methodName, String msg) {
      super(methodName, msg);
    }

    public Structural(String methodName, String msg, Throwable cause) {
      super(methodName, msg, cause);
    }
  }

  /** Missing or unmatched data for one particular binding of the iterators. */
  public static class ValueResolution extends ModelException {
    public ValueResolution(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  /** A tuple-valued, string-valued or decision-valued node was used as a number. */
  public static class NumericType extends ModelException {
    public NumericType(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  /** Exception thrown when a name does not resolve to a declaration. */
  public static class NotFound extends Structural {
    public NotFound(String methodName, String kind, String name) {
      super(methodName, kind + " '" + name + "' not found");
    }
  }

  /** Exception thrown when {@code item()} or a tuple access names an unknown tuple set. */
  public static class TupleSetNotFound extends NotFound {
    public TupleSetNotFound(String methodName, String name) {
      super(methodName, "Tuple set", name);
    }
  }

  /** Exception thrown when a tuple set refers to an undeclared schema. */
  public static class SchemaNotFound extends NotFound {
    public SchemaNotFound(String methodName, String name) {
      super(methodName, "Tuple schema", name);
    }
  }

  /** Exception thrown when a name is declared twice. */
  public static class DuplicateDeclaration extends Structural {
    public DuplicateDeclaration(String methodName, String kind, String name) {
      super(methodName, kind + " '" + name + "' is already declared");
    }
  }

  /** Exception thrown when a composite key does not have one part per key field. */
  public static class KeyArityMismatch extends Structural {
    public KeyArityMismatch(
        String methodName, String tupleSet, int supplied, Iterable<String> keyFields) {
      super(
          methodName,
          "key for tuple set '"
              + tupleSet
              + "' has "
              + supplied
              + " part(s) but the schema declares key fields ("
              + String.join(", ", keyFields)
              + ")");
    }
  }

  /** Exception thrown when an expression or statement cannot be understood. */
  public static class MalformedExpression extends Structural {
    public MalformedExpression(String methodName, String msg) {
      super(methodName, msg);
    }

    public MalformedExpression(String methodName, String msg, Throwable cause) {
      super(methodName, msg, cause);
    }
  }

  /** Exception thrown when linearization meets a product or quotient of decision variables. */
  public static class NonLinearTerm extends Structural {
    public NonLinearTerm(String methodName, String term) {
      super(methodName, "non-linear term '" + term + "'");
    }
  }

  /** Exception thrown when no tuple of a set matches the supplied key. */
  public static class NoMatch extends ValueResolution {
    public NoMatch(String methodName, String tupleSet, String key) {
      super(methodName, "no tuple in '" + tupleSet + "' matches key " + key);
    }
  }

  /** Exception thrown when a declared parameter or set has no value yet. */
  public static class MissingValue extends ValueResolution {
    public MissingValue(String methodName, String name) {
      super(methodName, "'" + name + "' has no value");
    }
  }

  /** Exception thrown when an index lies outside the set that indexes a symbol. */
  public static class OutOfRange extends ValueResolution {
    public OutOfRange(String methodName, String name, String index, String domain) {
      super(methodName, "index " + index + " of '" + name + "' is out of range " + domain);
    }
  }

  /** Exception thrown when a tuple-valued or decision-valued node is evaluated as a number. */
  public static class NotNumeric extends NumericType {
    public NotNumeric(String methodName, String what) {
      super(methodName, what + " is not numeric");
    }
  }

  /** Exception thrown when a value has the wrong scalar type. */
  public static class TypeMismatch extends NumericType {
    public TypeMismatch(String methodName, String msg) {
      super(methodName, msg);
    }
  }
}
