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

package ai.floedb.infoschema.catalog.informationschema;

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CHECK_CLAUSE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CHECK_CONSTRAINTS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COMMITTED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SPANNER_STATE;

import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.ColumnDef;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.schema.model.CheckConstraint;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * information_schema.check_constraints: the NOT NULL checks and declared checks of each user
 * table, then the NOT NULL checks of the introspection tables.
 */
public final class CheckConstraintsScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(CONSTRAINT_CATALOG),
          ColumnDecl.string(CONSTRAINT_SCHEMA),
          ColumnDecl.string(CONSTRAINT_NAME),
          ColumnDecl.string(CHECK_CLAUSE),
          ColumnDecl.string(SPANNER_STATE));

  @Override
  public String tableName() {
    return CHECK_CONSTRAINTS;
  }

  @Override
  public Optional<List<ColumnDecl>> declaredColumns() {
    return Optional.of(SCHEMA);
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    List<InformationSchemaRow> rows = new ArrayList<>();

    for (Table table : ctx.schema().tables()) {
      for (Column column : table.columns()) {
        if (column.nullable()) {
          continue;
        }
        rows.add(
            row(
                ctx,
                ctx.userSchemaName(),
                ConstraintNames.notNull(table.name(), column.name()),
                ConstraintNames.notNullClause(column.name())));
      }
      for (CheckConstraint check : table.checkConstraints()) {
        rows.add(row(ctx, ctx.userSchemaName(), check.name(), check.expression()));
      }
    }

    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      for (ColumnDef column : SelfDescription.notNullColumns(table)) {
        rows.add(
            row(
                ctx,
                ctx.informationSchemaName(),
                ConstraintNames.notNull(table.name(), column.name()),
                ConstraintNames.notNullClause(column.name())));
      }
    }

    return rows.stream();
  }

  private static InformationSchemaRow row(
      ScanContext ctx, String schemaName, String constraintName, String clause) {
    return ctx.row(CHECK_CONSTRAINTS)
        .set(CONSTRAINT_CATALOG, ctx.catalogName())
        .set(CONSTRAINT_SCHEMA, schemaName)
        .set(CONSTRAINT_NAME, constraintName)
        .set(CHECK_CLAUSE, clause)
        .set(SPANNER_STATE, COMMITTED)
        .buildComplete();
  }
}
