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

import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.DatabaseDialect;
import ai.floedb.infoschema.schema.model.Table;
import ai.floedb.infoschema.types.ColumnType;
import java.util.Locale;
import java.util.Objects;

/**
 * Postgres-compatible dialect.
 *
 * <p>Introspection identifiers are lower case and user objects live in {@code public}. Column
 * types are reported through the numeric precision columns rather than as DDL text; the only
 * type spelled out is {@code spanner.commit_timestamp}.
 */
final class PostgresDialectAdapter implements DialectAdapter {

  static final PostgresDialectAdapter INSTANCE = new PostgresDialectAdapter();

  static final String PUBLIC_SCHEMA = "public";
  static final String COMMIT_TIMESTAMP_TYPE = "spanner.commit_timestamp";
  static final String CHARACTER_VARYING = "character varying";

  private static final long DOUBLE_NUMERIC_PRECISION = 53L;
  private static final long BIGINT_NUMERIC_PRECISION = 64L;
  private static final long NUMERIC_PRECISION_RADIX = 2L;

  private PostgresDialectAdapter() {}

  @Override
  public DatabaseDialect dialect() {
    return DatabaseDialect.POSTGRESQL;
  }

  @Override
  public String nameForDialect(String identifier) {
    return Objects.requireNonNull(identifier, "identifier").toLowerCase(Locale.ROOT);
  }

  @Override
  public String defaultSchemaName() {
    return PUBLIC_SCHEMA;
  }

  @Override
  public Long numericPrecision(ColumnType type) {
    if (type.isDouble()) {
      return DOUBLE_NUMERIC_PRECISION;
    }
    if (type.isInt64()) {
      return BIGINT_NUMERIC_PRECISION;
    }
    return null;
  }

  @Override
  public Long numericPrecisionRadix(ColumnType type) {
    return type.isDouble() || type.isInt64() ? NUMERIC_PRECISION_RADIX : null;
  }

  @Override
  public Long numericScale(ColumnType type) {
    return type.isInt64() ? 0L : null;
  }

  @Override
  public String columnDataType(Column column) {
    return column.allowsCommitTimestamp() ? COMMIT_TIMESTAMP_TYPE : null;
  }

  @Override
  public String columnSpannerType(Column column) {
    return column.allowsCommitTimestamp() ? COMMIT_TIMESTAMP_TYPE : null;
  }

  @Override
  public String viewColumnSpannerType(ColumnType type) {
    return null;
  }

  @Override
  public String informationSchemaColumnSpannerType(String registrySpannerType) {
    return null;
  }

  @Override
  public String columnDefault(Column column) {
    return null;
  }

  @Override
  public String generationExpression(Column column) {
    return null;
  }

  @Override
  public String rowDeletionPolicyExpression(Table table) {
    return null;
  }

  @Override
  public String viewSpannerState() {
    return null;
  }

  @Override
  public String stringOptionType() {
    return CHARACTER_VARYING;
  }
}
