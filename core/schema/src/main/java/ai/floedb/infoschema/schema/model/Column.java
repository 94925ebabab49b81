/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.infoschema.schema.model;

import ai.floedb.infoschema.types.ColumnType;
import ai.floedb.infoschema.types.ColumnTypeFormat;
import ai.floedb.infoschema.types.Limits;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Table column.
 *
 * <p>A column is generated when it has a generation expression; {@code dependentColumns} then
 * lists the columns the expression reads. Generated columns never carry a default expression.
 */
public record Column(
    String name,
    ColumnType type,
    boolean nullable,
    Optional<Long> declaredMaxLength,
    Optional<String> generationExpression,
    boolean stored,
    List<String> dependentColumns,
    Optional<String> defaultExpression,
    boolean allowsCommitTimestamp) {

  public Column {
    name = Objects.requireNonNull(name, "name");
    type = Objects.requireNonNull(type, "type");
    declaredMaxLength = declaredMaxLength == null ? Optional.empty() : declaredMaxLength;
    generationExpression = generationExpression == null ? Optional.empty() : generationExpression;
    dependentColumns = List.copyOf(dependentColumns == null ? List.of() : dependentColumns);
    defaultExpression = defaultExpression == null ? Optional.empty() : defaultExpression;
    if (generationExpression.isPresent() && defaultExpression.isPresent()) {
      throw new IllegalArgumentException(
          "Column " + name + " cannot have both a default and a generation expression");
    }
    if (declaredMaxLength.isPresent()) {
      long length = declaredMaxLength.get();
      long max;
      try {
        max = Limits.maxDeclaredLength(type);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Column " + name + ": " + e.getMessage(), e);
      }
      if (length < 1 || length > max) {
        throw new IllegalArgumentException(
            "Column " + name + " length " + length + " is outside 1.." + max);
      }
    }
    if (generationExpression.isEmpty() && (stored || !dependentColumns.isEmpty())) {
      throw new IllegalArgumentException(
          "Column " + name + " is not generated but declares generated-column attributes");
    }
  }

  public boolean isGenerated() {
    return generationExpression.isPresent();
  }

  public static Builder builder(String name, ColumnType type) {
    return new Builder(name, type);
  }

  /** Builder from a DDL type spelling such as {@code STRING(64)}. */
  public static Builder builder(String name, String ddlType) {
    ColumnTypeFormat.Parsed parsed = ColumnTypeFormat.parse(ddlType);
    Builder b = new Builder(name, parsed.type());
    if (parsed.declaredMaxLength() != null) {
      b.maxLength(parsed.declaredMaxLength());
    }
    return b;
  }

  public static final class Builder {
    private final String name;
    private final ColumnType type;
    private boolean nullable = true;
    private Long declaredMaxLength;
    private String generationExpression;
    private boolean stored;
    private final List<String> dependentColumns = new ArrayList<>();
    private String defaultExpression;
    private boolean allowsCommitTimestamp;

    private Builder(String name, ColumnType type) {
      this.name = name;
      this.type = type;
    }

    public Builder notNull() {
      this.nullable = false;
      return this;
    }

    public Builder nullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public Builder maxLength(long length) {
      this.declaredMaxLength = length;
      return this;
    }

    public Builder generatedAs(String expression, boolean stored, List<String> dependsOn) {
      this.generationExpression = expression;
      this.stored = stored;
      this.dependentColumns.clear();
      this.dependentColumns.addAll(dependsOn);
      return this;
    }

    public Builder defaultValue(String expression) {
      this.defaultExpression = expression;
      return this;
    }

    public Builder allowCommitTimestamp() {
      this.allowsCommitTimestamp = true;
      return this;
    }

    public Column build() {
      return new Column(
          name,
          type,
          nullable,
          Optional.ofNullable(declaredMaxLength),
          Optional.ofNullable(generationExpression),
          stored,
          dependentColumns,
          Optional.ofNullable(defaultExpression),
          allowsCommitTimestamp);
    }
  }
}
