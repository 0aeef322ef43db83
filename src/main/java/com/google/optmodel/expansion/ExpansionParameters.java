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

package com.google.optmodel.expansion;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Options of the expansion engine.
 *
 * <p>Defaults can be overridden by an {@code optmodel.properties} resource on the class path:
 *
 * <pre>
 * optmodel.expansion.zeroTolerance=1e-10
 * optmodel.expansion.dropZeroCoefficients=true
 * </pre>
 */
@AutoValue
public abstract class ExpansionParameters {
  public static final String RESOURCE_NAME = "/optmodel.properties";
  public static final String ZERO_TOLERANCE_KEY = "optmodel.expansion.zeroTolerance";
  public static final String DROP_ZERO_COEFFICIENTS_KEY =
      "optmodel.expansion.dropZeroCoefficients";

  public static final double DEFAULT_ZERO_TOLERANCE = 1e-10;

  /** Coefficients folding to an absolute value below this are zero. */
  public abstract double zeroTolerance();

  /** Whether zero coefficients are left out of the expanded equations. */
  public abstract boolean dropZeroCoefficients();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_ExpansionParameters.Builder()
        .setZeroTolerance(DEFAULT_ZERO_TOLERANCE)
        .setDropZeroCoefficients(true);
  }

  public static ExpansionParameters getDefault() {
    return builder().build();
  }

  /** Reads the options present in {@code properties}; others keep their default. */
  public static ExpansionParameters fromProperties(Properties properties) {
    Builder builder = builder();
    String tolerance = properties.getProperty(ZERO_TOLERANCE_KEY);
    if (tolerance != null) {
      builder.setZeroTolerance(Double.parseDouble(tolerance.trim()));
    }
    String drop = properties.getProperty(DROP_ZERO_COEFFICIENTS_KEY);
    if (drop != null) {
      builder.setDropZeroCoefficients(Boolean.parseBoolean(drop.trim()));
    }
    return builder.build();
  }

  /** Loads {@value #RESOURCE_NAME} from the class path, or returns the defaults without it. */
  public static ExpansionParameters load() {
    try (InputStream in = ExpansionParameters.class.getResourceAsStream(RESOURCE_NAME)) {
      if (in == null) {
        return getDefault();
      }
      Properties properties = new Properties();
      properties.load(in);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + RESOURCE_NAME, e);
    }
  }

  /** Builder for {@link ExpansionParameters}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setZeroTolerance(double value);

    public abstract Builder setDropZeroCoefficients(boolean value);

    abstract ExpansionParameters autoBuild();

    public ExpansionParameters build() {
      ExpansionParameters parameters = autoBuild();
      checkArgument(
          parameters.zeroTolerance() >= 0,
          "negative zero tolerance %s",
          parameters.zeroTolerance());
      return parameters;
    }
  }
}
