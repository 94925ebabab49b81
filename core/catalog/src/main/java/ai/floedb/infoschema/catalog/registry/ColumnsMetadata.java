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

package ai.floedb.infoschema.catalog.registry;

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.*;

import ai.floedb.infoschema.catalog.InformationSchemaInvariantException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide registry describing the columns of every introspection table.
 *
 * <p>The registry is the source of truth for two things: the shape of the tables built directly
 * from metadata, and the column facts (type, nullability, key membership) that COLUMNS,
 * INDEX_COLUMNS and the constraint tables report about the introspection tables themselves. The
 * catalog code and this registry must agree; any lookup miss is an {@link
 * InformationSchemaInvariantException}.
 *
 * <p>All names are canonical upper case. Entries are immutable and built once on class load.
 */
public final class ColumnsMetadata {

  private static final String STRING = "STRING(MAX)";
  private static final String INT64 = "INT64";
  private static final String BOOL = "BOOL";

  /** Tables whose shape is taken from the registry, in registry order. */
  private static final List<String> REGISTRY_TABLES =
      List.of(
          SCHEMATA,
          DATABASE_OPTIONS,
          SPANNER_STATISTICS,
          TABLES,
          COLUMNS,
          COLUMN_COLUMN_USAGE,
          VIEWS);

  private static final List<ColumnMetadataEntry> COLUMN_ENTRIES;
  private static final List<KeyColumnMetadataEntry> KEY_COLUMN_ENTRIES;
  private static final Map<String, List<ColumnMetadataEntry>> COLUMNS_BY_TABLE;
  private static final Map<String, List<KeyColumnMetadataEntry>> KEYS_BY_TABLE;

  static {
    List<ColumnMetadataEntry> c = new ArrayList<>();

    // SCHEMATA
    c.add(col(SCHEMATA, CATALOG_NAME, STRING, false));
    c.add(col(SCHEMATA, SCHEMA_NAME, STRING, false));
    c.add(col(SCHEMATA, EFFECTIVE_TIMESTAMP, INT64, true));

    // DATABASE_OPTIONS
    c.add(col(DATABASE_OPTIONS, CATALOG_NAME, STRING, false));
    c.add(col(DATABASE_OPTIONS, SCHEMA_NAME, STRING, false));
    c.add(col(DATABASE_OPTIONS, OPTION_NAME, STRING, false));
    c.add(col(DATABASE_OPTIONS, OPTION_TYPE, STRING, false));
    c.add(col(DATABASE_OPTIONS, OPTION_VALUE, STRING, false));

    // SPANNER_STATISTICS
    c.add(col(SPANNER_STATISTICS, CATALOG_NAME, STRING, false));
    c.add(col(SPANNER_STATISTICS, SCHEMA_NAME, STRING, false));
    c.add(col(SPANNER_STATISTICS, PACKAGE_NAME, STRING, false));
    c.add(col(SPANNER_STATISTICS, ALLOW_GC, BOOL, false));

    // TABLES
    c.add(col(TABLES, TABLE_CATALOG, STRING, false));
    c.add(col(TABLES, TABLE_SCHEMA, STRING, false));
    c.add(col(TABLES, TABLE_NAME, STRING, false));
    c.add(col(TABLES, TABLE_TYPE, STRING, true));
    c.add(col(TABLES, PARENT_TABLE_NAME, STRING, true));
    c.add(col(TABLES, ON_DELETE_ACTION, STRING, true));
    c.add(col(TABLES, SPANNER_STATE, STRING, true));
    c.add(col(TABLES, INTERLEAVE_TYPE, STRING, true));
    c.add(col(TABLES, ROW_DELETION_POLICY_EXPRESSION, STRING, true));

    // COLUMNS
    c.add(col(COLUMNS, TABLE_CATALOG, STRING, false));
    c.add(col(COLUMNS, TABLE_SCHEMA, STRING, false));
    c.add(col(COLUMNS, TABLE_NAME, STRING, false));
    c.add(col(COLUMNS, COLUMN_NAME, STRING, false));
    c.add(col(COLUMNS, ORDINAL_POSITION, INT64, false));
    c.add(col(COLUMNS, COLUMN_DEFAULT, STRING, true));
    c.add(col(COLUMNS, DATA_TYPE, STRING, true));
    c.add(col(COLUMNS, IS_NULLABLE, STRING, true));
    c.add(col(COLUMNS, SPANNER_TYPE, STRING, true));
    c.add(col(COLUMNS, IS_GENERATED, STRING, false));
    c.add(col(COLUMNS, GENERATION_EXPRESSION, STRING, true));
    c.add(col(COLUMNS, IS_STORED, STRING, true));
    c.add(col(COLUMNS, SPANNER_STATE, STRING, true));
    c.add(col(COLUMNS, CHARACTER_MAXIMUM_LENGTH, INT64, true));
    c.add(col(COLUMNS, NUMERIC_PRECISION, INT64, true));
    c.add(col(COLUMNS, NUMERIC_PRECISION_RADIX, INT64, true));
    c.add(col(COLUMNS, NUMERIC_SCALE, INT64, true));

    // COLUMN_COLUMN_USAGE
    c.add(col(COLUMN_COLUMN_USAGE, TABLE_CATALOG, STRING, false));
    c.add(col(COLUMN_COLUMN_USAGE, TABLE_SCHEMA, STRING, false));
    c.add(col(COLUMN_COLUMN_USAGE, TABLE_NAME, STRING, false));
    c.add(col(COLUMN_COLUMN_USAGE, COLUMN_NAME, STRING, false));
    c.add(col(COLUMN_COLUMN_USAGE, DEPENDENT_COLUMN, STRING, false));

    // VIEWS
    c.add(col(VIEWS, TABLE_CATALOG, STRING, false));
    c.add(col(VIEWS, TABLE_SCHEMA, STRING, false));
    c.add(col(VIEWS, TABLE_NAME, STRING, false));
    c.add(col(VIEWS, VIEW_DEFINITION, STRING, false));
    c.add(col(VIEWS, SECURITY_TYPE, STRING, true));

    // INDEXES
    c.add(col(INDEXES, TABLE_CATALOG, STRING, false));
    c.add(col(INDEXES, TABLE_SCHEMA, STRING, false));
    c.add(col(INDEXES, TABLE_NAME, STRING, false));
    c.add(col(INDEXES, INDEX_NAME, STRING, false));
    c.add(col(INDEXES, INDEX_TYPE, STRING, false));
    c.add(col(INDEXES, PARENT_TABLE_NAME, STRING, true));
    c.add(col(INDEXES, IS_UNIQUE, BOOL, true));
    c.add(col(INDEXES, IS_NULL_FILTERED, BOOL, true));
    c.add(col(INDEXES, INDEX_STATE, STRING, true));
    c.add(col(INDEXES, SPANNER_IS_MANAGED, BOOL, false));

    // INDEX_COLUMNS
    c.add(col(INDEX_COLUMNS, TABLE_CATALOG, STRING, false));
    c.add(col(INDEX_COLUMNS, TABLE_SCHEMA, STRING, false));
    c.add(col(INDEX_COLUMNS, TABLE_NAME, STRING, false));
    c.add(col(INDEX_COLUMNS, INDEX_NAME, STRING, false));
    c.add(col(INDEX_COLUMNS, INDEX_TYPE, STRING, false));
    c.add(col(INDEX_COLUMNS, COLUMN_NAME, STRING, false));
    c.add(col(INDEX_COLUMNS, ORDINAL_POSITION, INT64, true));
    c.add(col(INDEX_COLUMNS, COLUMN_ORDERING, STRING, true));
    c.add(col(INDEX_COLUMNS, IS_NULLABLE, STRING, true));
    c.add(col(INDEX_COLUMNS, SPANNER_TYPE, STRING, true));

    // COLUMN_OPTIONS
    c.add(col(COLUMN_OPTIONS, TABLE_CATALOG, STRING, false));
    c.add(col(COLUMN_OPTIONS, TABLE_SCHEMA, STRING, false));
    c.add(col(COLUMN_OPTIONS, TABLE_NAME, STRING, false));
    c.add(col(COLUMN_OPTIONS, COLUMN_NAME, STRING, false));
    c.add(col(COLUMN_OPTIONS, OPTION_NAME, STRING, false));
    c.add(col(COLUMN_OPTIONS, OPTION_TYPE, STRING, false));
    c.add(col(COLUMN_OPTIONS, OPTION_VALUE, STRING, false));

    // CHECK_CONSTRAINTS
    c.add(col(CHECK_CONSTRAINTS, CONSTRAINT_CATALOG, STRING, false));
    c.add(col(CHECK_CONSTRAINTS, CONSTRAINT_SCHEMA, STRING, false));
    c.add(col(CHECK_CONSTRAINTS, CONSTRAINT_NAME, STRING, false));
    c.add(col(CHECK_CONSTRAINTS, CHECK_CLAUSE, STRING, false));
    c.add(col(CHECK_CONSTRAINTS, SPANNER_STATE, STRING, false));

    // TABLE_CONSTRAINTS
    c.add(col(TABLE_CONSTRAINTS, CONSTRAINT_CATALOG, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, CONSTRAINT_SCHEMA, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, CONSTRAINT_NAME, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, TABLE_CATALOG, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, TABLE_SCHEMA, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, TABLE_NAME, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, CONSTRAINT_TYPE, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, IS_DEFERRABLE, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, INITIALLY_DEFERRED, STRING, false));
    c.add(col(TABLE_CONSTRAINTS, ENFORCED, STRING, false));

    // CONSTRAINT_TABLE_USAGE
    c.add(col(CONSTRAINT_TABLE_USAGE, TABLE_CATALOG, STRING, false));
    c.add(col(CONSTRAINT_TABLE_USAGE, TABLE_SCHEMA, STRING, false));
    c.add(col(CONSTRAINT_TABLE_USAGE, TABLE_NAME, STRING, false));
    c.add(col(CONSTRAINT_TABLE_USAGE, CONSTRAINT_CATALOG, STRING, false));
    c.add(col(CONSTRAINT_TABLE_USAGE, CONSTRAINT_SCHEMA, STRING, false));
    c.add(col(CONSTRAINT_TABLE_USAGE, CONSTRAINT_NAME, STRING, false));

    // REFERENTIAL_CONSTRAINTS
    c.add(col(REFERENTIAL_CONSTRAINTS, CONSTRAINT_CATALOG, STRING, false));
    c.add(col(REFERENTIAL_CONSTRAINTS, CONSTRAINT_SCHEMA, STRING, false));
    c.add(col(REFERENTIAL_CONSTRAINTS, CONSTRAINT_NAME, STRING, false));
    c.add(col(REFERENTIAL_CONSTRAINTS, UNIQUE_CONSTRAINT_CATALOG, STRING, true));
    c.add(col(REFERENTIAL_CONSTRAINTS, UNIQUE_CONSTRAINT_SCHEMA, STRING, true));
    c.add(col(REFERENTIAL_CONSTRAINTS, UNIQUE_CONSTRAINT_NAME, STRING, true));
    c.add(col(REFERENTIAL_CONSTRAINTS, MATCH_OPTION, STRING, false));
    c.add(col(REFERENTIAL_CONSTRAINTS, UPDATE_RULE, STRING, false));
    c.add(col(REFERENTIAL_CONSTRAINTS, DELETE_RULE, STRING, false));
    c.add(col(REFERENTIAL_CONSTRAINTS, SPANNER_STATE, STRING, false));

    // KEY_COLUMN_USAGE
    c.add(col(KEY_COLUMN_USAGE, CONSTRAINT_CATALOG, STRING, false));
    c.add(col(KEY_COLUMN_USAGE, CONSTRAINT_SCHEMA, STRING, false));
    c.add(col(KEY_COLUMN_USAGE, CONSTRAINT_NAME, STRING, false));
    c.add(col(KEY_COLUMN_USAGE, TABLE_CATALOG, STRING, false));
    c.add(col(KEY_COLUMN_USAGE, TABLE_SCHEMA, STRING, false));
    c.add(col(KEY_COLUMN_USAGE, TABLE_NAME, STRING, false));
    c.add(col(KEY_COLUMN_USAGE, COLUMN_NAME, STRING, false));
    c.add(col(KEY_COLUMN_USAGE, ORDINAL_POSITION, INT64, false));
    c.add(col(KEY_COLUMN_USAGE, POSITION_IN_UNIQUE_CONSTRAINT, INT64, true));

    // CONSTRAINT_COLUMN_USAGE
    c.add(col(CONSTRAINT_COLUMN_USAGE, TABLE_CATALOG, STRING, false));
    c.add(col(CONSTRAINT_COLUMN_USAGE, TABLE_SCHEMA, STRING, false));
    c.add(col(CONSTRAINT_COLUMN_USAGE, TABLE_NAME, STRING, false));
    c.add(col(CONSTRAINT_COLUMN_USAGE, COLUMN_NAME, STRING, false));
    c.add(col(CONSTRAINT_COLUMN_USAGE, CONSTRAINT_CATALOG, STRING, false));
    c.add(col(CONSTRAINT_COLUMN_USAGE, CONSTRAINT_SCHEMA, STRING, false));
    c.add(col(CONSTRAINT_COLUMN_USAGE, CONSTRAINT_NAME, STRING, false));

    COLUMN_ENTRIES = List.copyOf(c);

    List<KeyColumnMetadataEntry> k = new ArrayList<>();
    keys(k, SCHEMATA, CATALOG_NAME, SCHEMA_NAME);
    keys(k, DATABASE_OPTIONS, CATALOG_NAME, SCHEMA_NAME, OPTION_NAME);
    keys(k, SPANNER_STATISTICS, CATALOG_NAME, SCHEMA_NAME, PACKAGE_NAME);
    keys(k, TABLES, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME);
    keys(k, COLUMNS, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, COLUMN_NAME);
    keys(k, COLUMN_COLUMN_USAGE, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, COLUMN_NAME,
        DEPENDENT_COLUMN);
    keys(k, VIEWS, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME);
    keys(k, INDEXES, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, INDEX_NAME, INDEX_TYPE);
    keys(k, INDEX_COLUMNS, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, INDEX_NAME, INDEX_TYPE,
        COLUMN_NAME);
    keys(k, COLUMN_OPTIONS, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, COLUMN_NAME, OPTION_NAME);
    keys(k, CHECK_CONSTRAINTS, CONSTRAINT_CATALOG, CONSTRAINT_SCHEMA, CONSTRAINT_NAME);
    keys(k, TABLE_CONSTRAINTS, CONSTRAINT_CATALOG, CONSTRAINT_SCHEMA, CONSTRAINT_NAME);
    keys(k, CONSTRAINT_TABLE_USAGE, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, CONSTRAINT_CATALOG,
        CONSTRAINT_SCHEMA, CONSTRAINT_NAME);
    keys(k, REFERENTIAL_CONSTRAINTS, CONSTRAINT_CATALOG, CONSTRAINT_SCHEMA, CONSTRAINT_NAME);
    keys(k, KEY_COLUMN_USAGE, CONSTRAINT_CATALOG, CONSTRAINT_SCHEMA, CONSTRAINT_NAME, COLUMN_NAME);
    keys(k, CONSTRAINT_COLUMN_USAGE, TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, COLUMN_NAME,
        CONSTRAINT_CATALOG, CONSTRAINT_SCHEMA, CONSTRAINT_NAME);
    KEY_COLUMN_ENTRIES = List.copyOf(k);

    COLUMNS_BY_TABLE = groupColumns(COLUMN_ENTRIES);
    KEYS_BY_TABLE = groupKeys(KEY_COLUMN_ENTRIES);
  }

  private ColumnsMetadata() {}

  /** Every column entry, grouped by table in registry order. */
  public static List<ColumnMetadataEntry> entries() {
    return COLUMN_ENTRIES;
  }

  /** Every key column entry. */
  public static List<KeyColumnMetadataEntry> keyEntries() {
    return KEY_COLUMN_ENTRIES;
  }

  /** Tables whose shape is declared straight from the registry. */
  public static List<String> registryTables() {
    return REGISTRY_TABLES;
  }

  /** Whether the catalog takes {@code tableName}'s shape from the registry. */
  public static boolean isRegistryTable(String tableName) {
    return REGISTRY_TABLES.contains(tableName);
  }

  /** Every table the registry describes, in registry order. */
  public static List<String> describedTables() {
    return List.copyOf(COLUMNS_BY_TABLE.keySet());
  }

  /**
   * Column entries of one table, in registry order.
   *
   * @throws InformationSchemaInvariantException if the registry does not describe the table
   */
  public static List<ColumnMetadataEntry> columnsOf(String tableName) {
    List<ColumnMetadataEntry> entries = COLUMNS_BY_TABLE.get(tableName);
    if (entries == null) {
      throw new InformationSchemaInvariantException(
          "Missing metadata for table", tableName, null);
    }
    return entries;
  }

  /**
   * Metadata of one introspection column.
   *
   * @throws InformationSchemaInvariantException if the registry does not describe the column
   */
  public static ColumnMetadataEntry columnMetadata(String tableName, String columnName) {
    return findColumnMetadata(tableName, columnName)
        .orElseThrow(
            () ->
                new InformationSchemaInvariantException(
                    "Missing metadata for column", tableName, columnName));
  }

  public static Optional<ColumnMetadataEntry> findColumnMetadata(
      String tableName, String columnName) {
    for (ColumnMetadataEntry entry : COLUMNS_BY_TABLE.getOrDefault(tableName, List.of())) {
      if (entry.columnName().equals(columnName)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  /** Key metadata of a column, or empty when the column is not part of the table's key. */
  public static Optional<KeyColumnMetadataEntry> findKeyColumnMetadata(
      String tableName, String columnName) {
    for (KeyColumnMetadataEntry entry : KEYS_BY_TABLE.getOrDefault(tableName, List.of())) {
      if (entry.columnName().equals(columnName)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  /** Key column entries of one table, in registry order. */
  public static List<KeyColumnMetadataEntry> keyColumnsOf(String tableName) {
    return KEYS_BY_TABLE.getOrDefault(tableName, List.of());
  }

  private static ColumnMetadataEntry col(
      String table, String column, String spannerType, boolean nullable) {
    return new ColumnMetadataEntry(table, column, spannerType, nullable);
  }

  private static void keys(List<KeyColumnMetadataEntry> out, String table, String... columns) {
    for (int i = 0; i < columns.length; i++) {
      out.add(keyEntry(table, columns[i], i + 1));
    }
  }

  // Key facts repeat the column facts; a key column absent from the column list fails here.
  private static KeyColumnMetadataEntry keyEntry(String table, String column, int ordinal) {
    ColumnMetadataEntry meta = null;
    for (ColumnMetadataEntry entry : COLUMN_ENTRIES) {
      if (entry.tableName().equals(table) && entry.columnName().equals(column)) {
        meta = entry;
        break;
      }
    }
    if (meta == null) {
      throw new InformationSchemaInvariantException(
          "Key column is not a registry column", table, column);
    }
    return new KeyColumnMetadataEntry(
        table, column, meta.nullable(), ASC, meta.spannerType(), ordinal);
  }

  private static Map<String, List<ColumnMetadataEntry>> groupColumns(
      List<ColumnMetadataEntry> entries) {
    Map<String, List<ColumnMetadataEntry>> grouped = new LinkedHashMap<>();
    for (ColumnMetadataEntry entry : entries) {
      grouped.computeIfAbsent(entry.tableName(), t -> new ArrayList<>()).add(entry);
    }
    Map<String, List<ColumnMetadataEntry>> frozen = new LinkedHashMap<>();
    grouped.forEach((table, list) -> frozen.put(table, List.copyOf(list)));
    return Collections.unmodifiableMap(frozen);
  }

  private static Map<String, List<KeyColumnMetadataEntry>> groupKeys(
      List<KeyColumnMetadataEntry> entries) {
    Map<String, List<KeyColumnMetadataEntry>> grouped = new LinkedHashMap<>();
    for (KeyColumnMetadataEntry entry : entries) {
      grouped.computeIfAbsent(entry.tableName(), t -> new ArrayList<>()).add(entry);
    }
    Map<String, List<KeyColumnMetadataEntry>> frozen = new LinkedHashMap<>();
    grouped.forEach((table, list) -> frozen.put(table, List.copyOf(list)));
    return Collections.unmodifiableMap(frozen);
  }
}
