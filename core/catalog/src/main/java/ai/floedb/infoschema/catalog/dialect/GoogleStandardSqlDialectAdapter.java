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
import ai.floedb.infoschema.schema.model.RowDeletionPolicy;
import ai.floedb.infoschema.schema.model.Table;
import ai.floedb.infoschema.types.ColumnType;
import ai.floedb.infoschema.types.ColumnTypeFormat;
import java.util.Objects;

/** Native dialect: canonical upper-case identifiers, unnamed default schema, DDL type text. */
final class GoogleStandardSqlDialectAdapter implements DialectAdapter {

  static final GoogleStandardSqlDialectAdapter INSTANCE = new GoogleStandardSqlDialectAdapter();

  private GoogleStandardSqlDialectAdapter() {}

  @Override
  public DatabaseDialect dialect() {
    return DatabaseDialect.GOOGLE_STANDARD_SQL;
  }

  @Override
  public String nameForDialect(String identifier) {
    return Objects.requireNonNull(identifier, "identifier");
  }

  @Override
  public String defaultSchemaName() {
    return "";
  }

  @Override
  public Long numericPrecision(ColumnType type) {
    return null;
  }

  @Override
  public Long numericPrecisionRadix(ColumnType type) {
    return null;
  }

  @Override
  public Long numericScale(ColumnType type) {
    return null;
  }

  @Override
  public String columnDataType(Column column) {
    return null;
  }

  @Override
  public String columnSpannerType(Column column) {
    return ColumnTypeFormat.format(column.type(), column.declaredMaxLength().orElse(null));
  }

  @Override
  public String viewColumnSpannerType(ColumnType type) {
    return ColumnTypeFormat.format(type, null);
  }

  @Override
  public String informationSchemaColumnSpannerType(String registrySpannerType) {
    return registrySpannerType;
  }

  @Override
  public String columnDefault(Column column) {
    return column.defaultExpression().orElse(null);
  }

  @Override
  public String generationExpression(Column column) {
    return column.generationExpression().map(GoogleStandardSqlDialectAdapter::unwrap).orElse(null);
  }

  @Override
  public String rowDeletionPolicyExpression(Table table) {
    return table.rowDeletionPolicy().map(RowDeletionPolicy::toDdl).orElse(null);
  }

  @Override
  public String viewSpannerState() {
    return InformationSchemaNames.COMMITTED;
  }

  @Override
  public String stringOptionType() {
    return "STRING";
  }

  // Generation expressions are stored with their enclosing parentheses; drop one pair of them.
  static String unwrap(String expression) {
    String e = expression;
    if (e.startsWith("(")) {
      e = e.substring(1);
    }
    if (e.endsWith(")")) {
      e = e.substring(0, e.length() - 1);
    }
    return e;
  }
}
