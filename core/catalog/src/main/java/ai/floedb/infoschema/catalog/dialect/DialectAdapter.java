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

package ai.floedb.infoschema.catalog.dialect;

import ai.floedb.infoschema.catalog.registry.InformationSchemaNames;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.DatabaseDialect;
import ai.floedb.infoschema.schema.model.Table;
import ai.floedb.infoschema.types.ColumnType;
import java.util.Objects;

/**
 * Every dialect-dependent name and value the catalog emits.
 *
 * <p>Scanners never branch on {@link DatabaseDialect} themselves; they ask the adapter. Methods
 * returning a boxed value return {@code null} for SQL NULL.
 */
public interface DialectAdapter {

  DatabaseDialect dialect();

  /**
   * Spelling of an introspection identifier (table, column, constraint or schema name) in this
   * dialect. Idempotent; {@code ""} maps to {@code ""}.
   */
  String nameForDialect(String identifier);

  /** Name of the schema holding user tables and views. */
  String defaultSchemaName();

  default String informationSchemaName() {
    return nameForDialect(InformationSchemaNames.INFORMATION_SCHEMA);
  }

  Long numericPrecision(ColumnType type);

  Long numericPrecisionRadix(ColumnType type);

  Long numericScale(ColumnType type);

  /** Declared length of a scalar user column; array columns and undeclared lengths report null. */
  default Long characterMaximumLength(Column column) {
    if (column.type().isArray()) {
      return null;
    }
    return column.declaredMaxLength().orElse(null);
  }

  /** COLUMNS.DATA_TYPE of a user column. */
  String columnDataType(Column column);

  /** COLUMNS.SPANNER_TYPE of a user column. */
  String columnSpannerType(Column column);

  /** COLUMNS.SPANNER_TYPE of a view output column. */
  String viewColumnSpannerType(ColumnType type);

  /** COLUMNS.SPANNER_TYPE of an introspection column, given its registry spelling. */
  String informationSchemaColumnSpannerType(String registrySpannerType);

  String columnDefault(Column column);

  String generationExpression(Column column);

  String rowDeletionPolicyExpression(Table table);

  /** TABLES.SPANNER_STATE of a view. */
  String viewSpannerState();

  /** DATABASE_OPTIONS.OPTION_TYPE of string-valued options. */
  String stringOptionType();

  /** DATABASE_OPTIONS value of the {@code database_dialect} option. */
  default String dialectOptionValue() {
    return dialect().name();
  }

  static DialectAdapter forDialect(DatabaseDialect dialect) {
    Objects.requireNonNull(dialect, "dialect");
    return switch (dialect) {
      case GOOGLE_STANDARD_SQL -> GoogleStandardSqlDialectAdapter.INSTANCE;
      case POSTGRESQL -> PostgresDialectAdapter.INSTANCE;
    };
  }
}
