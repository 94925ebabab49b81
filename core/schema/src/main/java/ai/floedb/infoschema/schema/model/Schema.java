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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one schema version.
 *
 * <p>Tables and views keep the order they were added in; every consumer walking a snapshot sees
 * the same order. The constructor resolves every cross-entity reference (key columns, foreign-key
 * targets, backing indexes, interleave parents) and rejects dangling ones, so consumers may assume
 * a valid graph.
 */
public final class Schema {

  /** Version of a snapshot that was never assigned one. Such snapshots are not comparable. */
  public static final long UNVERSIONED = 0L;

  /** Prefix of the primary-key constraint synthesized for every table. */
  public static final String PRIMARY_KEY_CONSTRAINT_PREFIX = "PK_";

  /** Prefix of the check constraint synthesized for every NOT NULL column. */
  public static final String NOT_NULL_CONSTRAINT_PREFIX = "CK_IS_NOT_NULL_";

  private final long version;
  private final DatabaseDialect dialect;
  private final List<Table> tables;
  private final List<View> views;
  private final Map<String, Table> tablesByName;
  private final Map<String, View> viewsByName;

  public Schema(long version, DatabaseDialect dialect, List<Table> tables, List<View> views) {
    require(version >= UNVERSIONED, "negative version: " + version);
    this.version = version;
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = List.copyOf(Objects.requireNonNull(tables, "tables"));
    this.views = List.copyOf(Objects.requireNonNull(views, "views"));

    Map<String, Table> byTable = new LinkedHashMap<>();
    for (Table table : this.tables) {
      require(byTable.put(table.name(), table) == null, "duplicate table: " + table.name());
    }
    Map<String, View> byView = new LinkedHashMap<>();
    for (View view : this.views) {
      require(!byTable.containsKey(view.name()), "view name clashes with table: " + view.name());
      require(byView.put(view.name(), view) == null, "duplicate view: " + view.name());
    }
    this.tablesByName = Map.copyOf(byTable);
    this.viewsByName = Map.copyOf(byView);

    validate();
  }

  public static Schema empty(DatabaseDialect dialect) {
    return new Schema(UNVERSIONED, dialect, List.of(), List.of());
  }

  public long version() {
    return version;
  }

  /**
   * True when the snapshot carries a version. Versioned snapshots with equal versions describe
   * the same schema.
   */
  public boolean isVersioned() {
    return version != UNVERSIONED;
  }

  public DatabaseDialect dialect() {
    return dialect;
  }

  /** Tables in declaration order. */
  public List<Table> tables() {
    return tables;
  }

  /** Views in declaration order. */
  public List<View> views() {
    return views;
  }

  public Optional<Table> table(String name) {
    return Optional.ofNullable(tablesByName.get(name));
  }

  public Optional<View> view(String name) {
    return Optional.ofNullable(viewsByName.get(name));
  }

  /**
   * Resolves a table that a validated reference points at.
   *
   * @throws IllegalArgumentException if no such table exists
   */
  public Table requireTable(String name) {
    Table table = tablesByName.get(name);
    if (table == null) {
      throw new IllegalArgumentException("Unknown table: " + name);
    }
    return table;
  }

  private void validate() {
    Set<String> indexNames = new HashSet<>();
    Set<String> constraintNames = new HashSet<>();
    for (Table table : tables) {
      Set<String> columns = new HashSet<>();
      for (Column column : table.columns()) {
        require(
            columns.add(column.name()),
            "duplicate column: " + table.name() + "." + column.name());
      }
      for (Column column : table.columns()) {
        for (String dep : column.dependentColumns()) {
          requireColumn(table, dep, "generated column " + column.name());
        }
      }
      for (KeyColumn key : table.primaryKey()) {
        requireColumn(table, key.columnName(), "primary key");
      }
      for (Index index : table.indexes()) {
        require(indexNames.add(index.name()), "duplicate index: " + index.name());
        requireUnreservedName(index.name(), "index");
        for (KeyColumn key : index.keyColumns()) {
          requireColumn(table, key.columnName(), "index " + index.name());
        }
        for (String stored : index.storedColumns()) {
          requireColumn(table, stored, "index " + index.name());
        }
        index
            .parentTableName()
            .ifPresent(
                p -> require(tablesByName.containsKey(p), "unknown index parent table: " + p));
      }
      for (CheckConstraint check : table.checkConstraints()) {
        requireUnreservedName(check.name(), "check constraint");
        require(constraintNames.add(check.name()), "duplicate constraint: " + check.name());
        for (String dep : check.dependentColumns()) {
          requireColumn(table, dep, "check constraint " + check.name());
        }
      }
      table
          .parentTableName()
          .ifPresent(p -> require(tablesByName.containsKey(p), "unknown parent table: " + p));
      table
          .rowDeletionPolicy()
          .ifPresent(p -> requireColumn(table, p.columnName(), "row deletion policy"));
      for (ForeignKey fk : table.foreignKeys()) {
        requireUnreservedName(fk.name(), "foreign key");
        require(constraintNames.add(fk.name()), "duplicate constraint: " + fk.name());
        validateForeignKey(table, fk);
      }
    }
  }

  private void validateForeignKey(Table table, ForeignKey fk) {
    for (String column : fk.referencingColumns()) {
      requireColumn(table, column, "foreign key " + fk.name());
    }
    Table referenced = tablesByName.get(fk.referencedTable());
    require(
        referenced != null,
        "foreign key " + fk.name() + " references unknown table " + fk.referencedTable());
    for (String column : fk.referencedColumns()) {
      requireColumn(referenced, column, "foreign key " + fk.name());
    }
    fk.referencedIndex()
        .ifPresent(
            indexName -> {
              Optional<Index> index = referenced.index(indexName);
              require(
                  index.isPresent(),
                  "foreign key "
                      + fk.name()
                      + " references unknown index "
                      + referenced.name()
                      + "."
                      + indexName);
              require(
                  index.get().keyColumns().size() == fk.referencedColumns().size(),
                  "foreign key " + fk.name() + " does not cover the key of index " + indexName);
            });
  }

  // Synthesized constraint names must stay unique, so user names may not take their shape.
  private void requireUnreservedName(String name, String owner) {
    require(
        !name.startsWith(NOT_NULL_CONSTRAINT_PREFIX),
        owner + " " + name + " uses reserved prefix " + NOT_NULL_CONSTRAINT_PREFIX);
    require(
        !(name.startsWith(PRIMARY_KEY_CONSTRAINT_PREFIX)
            && tablesByName.containsKey(name.substring(PRIMARY_KEY_CONSTRAINT_PREFIX.length()))),
        owner + " " + name + " clashes with a primary key constraint");
  }

  private static void requireColumn(Table table, String column, String owner) {
    require(
        table.column(column).isPresent(),
        owner + " references unknown column " + table.name() + "." + column);
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new IllegalArgumentException("Invalid schema: " + message);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private long version = UNVERSIONED;
    private DatabaseDialect dialect = DatabaseDialect.GOOGLE_STANDARD_SQL;
    private final List<Table> tables = new ArrayList<>();
    private final List<View> views = new ArrayList<>();

    private Builder() {}

    public Builder version(long version) {
      this.version = version;
      return this;
    }

    public Builder dialect(DatabaseDialect dialect) {
      this.dialect = dialect;
      return this;
    }

    public Builder table(Table table) {
      tables.add(table);
      return this;
    }

    public Builder table(Table.Builder table) {
      return table(table.build());
    }

    public Builder view(View view) {
      views.add(view);
      return this;
    }

    public Schema build() {
      return new Schema(version, dialect, tables, views);
    }
  }
}
