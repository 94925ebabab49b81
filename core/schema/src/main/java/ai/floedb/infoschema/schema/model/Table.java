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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * User table with its columns in declaration order and every entity attached to it.
 *
 * <p>{@code onDeleteAction} is only meaningful for interleaved tables.
 */
public record Table(
    String name,
    List<Column> columns,
    List<KeyColumn> primaryKey,
    List<Index> indexes,
    List<ForeignKey> foreignKeys,
    List<CheckConstraint> checkConstraints,
    Optional<String> parentTableName,
    OnDeleteAction onDeleteAction,
    Optional<RowDeletionPolicy> rowDeletionPolicy) {

  public Table {
    name = Objects.requireNonNull(name, "name");
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    primaryKey = List.copyOf(Objects.requireNonNull(primaryKey, "primaryKey"));
    indexes = List.copyOf(indexes == null ? List.of() : indexes);
    foreignKeys = List.copyOf(foreignKeys == null ? List.of() : foreignKeys);
    checkConstraints = List.copyOf(checkConstraints == null ? List.of() : checkConstraints);
    parentTableName = parentTableName == null ? Optional.empty() : parentTableName;
    onDeleteAction = onDeleteAction == null ? OnDeleteAction.NO_ACTION : onDeleteAction;
    rowDeletionPolicy = rowDeletionPolicy == null ? Optional.empty() : rowDeletionPolicy;
  }

  public Optional<Column> column(String columnName) {
    return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
  }

  public Optional<Index> index(String indexName) {
    return indexes.stream().filter(i -> i.name().equals(indexName)).findFirst();
  }

  public boolean isInterleaved() {
    return parentTableName.isPresent();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private final List<Column> columns = new ArrayList<>();
    private final List<KeyColumn> primaryKey = new ArrayList<>();
    private final List<Index> indexes = new ArrayList<>();
    private final List<ForeignKey> foreignKeys = new ArrayList<>();
    private final List<CheckConstraint> checkConstraints = new ArrayList<>();
    private String parentTableName;
    private OnDeleteAction onDeleteAction = OnDeleteAction.NO_ACTION;
    private RowDeletionPolicy rowDeletionPolicy;

    private Builder(String name) {
      this.name = name;
    }

    public Builder column(Column column) {
      columns.add(column);
      return this;
    }

    public Builder column(Column.Builder column) {
      return column(column.build());
    }

    public Builder primaryKey(KeyColumn... keyColumns) {
      primaryKey.addAll(List.of(keyColumns));
      return this;
    }

    public Builder primaryKey(String... columnNames) {
      for (String columnName : columnNames) {
        primaryKey.add(KeyColumn.asc(columnName));
      }
      return this;
    }

    public Builder index(Index index) {
      indexes.add(index);
      return this;
    }

    public Builder foreignKey(ForeignKey foreignKey) {
      foreignKeys.add(foreignKey);
      return this;
    }

    public Builder check(String constraintName, String expression, String... dependsOn) {
      checkConstraints.add(new CheckConstraint(constraintName, expression, List.of(dependsOn)));
      return this;
    }

    public Builder interleaveIn(String parentTableName, OnDeleteAction onDeleteAction) {
      this.parentTableName = parentTableName;
      this.onDeleteAction = onDeleteAction;
      return this;
    }

    public Builder rowDeletionPolicy(RowDeletionPolicy policy) {
      this.rowDeletionPolicy = policy;
      return this;
    }

    public Table build() {
      return new Table(
          name,
          columns,
          primaryKey,
          indexes,
          foreignKeys,
          checkConstraints,
          Optional.ofNullable(parentTableName),
          onDeleteAction,
          Optional.ofNullable(rowDeletionPolicy));
    }
  }
}
