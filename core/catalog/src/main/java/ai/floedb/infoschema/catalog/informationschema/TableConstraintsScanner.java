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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CHECK;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ENFORCED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.FOREIGN_KEY;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INITIALLY_DEFERRED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IS_DEFERRABLE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NO;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.PRIMARY_KEY;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CONSTRAINTS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.UNIQUE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.YES;

import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.ColumnDef;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.schema.model.CheckConstraint;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.ForeignKey;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * information_schema.table_constraints.
 *
 * <p>Per user table: its primary key, NOT NULL checks, declared checks and foreign keys. A foreign
 * key backed by a named unique index also reports that index as a UNIQUE constraint of the
 * referenced table, once per index. Introspection tables follow with their primary keys and NOT
 * NULL checks.
 */
public final class TableConstraintsScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(CONSTRAINT_CATALOG),
          ColumnDecl.string(CONSTRAINT_SCHEMA),
          ColumnDecl.string(CONSTRAINT_NAME),
          ColumnDecl.string(TABLE_CATALOG),
          ColumnDecl.string(TABLE_SCHEMA),
          ColumnDecl.string(TABLE_NAME),
          ColumnDecl.string(CONSTRAINT_TYPE),
          ColumnDecl.string(IS_DEFERRABLE),
          ColumnDecl.string(INITIALLY_DEFERRED),
          ColumnDecl.string(ENFORCED));

  @Override
  public String tableName() {
    return TABLE_CONSTRAINTS;
  }

  @Override
  public Optional<List<ColumnDecl>> declaredColumns() {
    return Optional.of(SCHEMA);
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    List<InformationSchemaRow> rows = new ArrayList<>();
    String schema = ctx.userSchemaName();
    BackingIndexTracker backing = new BackingIndexTracker();

    for (Table table : ctx.schema().tables()) {
      rows.add(
          row(ctx, schema, ConstraintNames.primaryKey(table.name()), table.name(), PRIMARY_KEY));
      for (Column column : table.columns()) {
        if (!column.nullable()) {
          rows.add(
              row(
                  ctx,
                  schema,
                  ConstraintNames.notNull(table.name(), column.name()),
                  table.name(),
                  CHECK));
        }
      }
      for (CheckConstraint check : table.checkConstraints()) {
        rows.add(row(ctx, schema, check.name(), table.name(), CHECK));
      }
      for (ForeignKey foreignKey : table.foreignKeys()) {
        rows.add(row(ctx, schema, foreignKey.name(), table.name(), FOREIGN_KEY));
        if (backing.emitsBackingConstraint(foreignKey)) {
          rows.add(
              row(
                  ctx,
                  schema,
                  foreignKey.referencedIndex().orElseThrow(),
                  foreignKey.referencedTable(),
                  UNIQUE));
        }
      }
    }

    String infoSchema = ctx.informationSchemaName();
    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      rows.add(
          row(
              ctx,
              infoSchema,
              ConstraintNames.primaryKey(table.name()),
              table.name(),
              PRIMARY_KEY));
      for (ColumnDef column : SelfDescription.notNullColumns(table)) {
        rows.add(
            row(
                ctx,
                infoSchema,
                ConstraintNames.notNull(table.name(), column.name()),
                table.name(),
                CHECK));
      }
    }

    return rows.stream();
  }

  private static InformationSchemaRow row(
      ScanContext ctx,
      String schemaName,
      String constraintName,
      String tableName,
      String constraintType) {
    return ctx.row(TABLE_CONSTRAINTS)
        .set(CONSTRAINT_CATALOG, ctx.catalogName())
        .set(CONSTRAINT_SCHEMA, schemaName)
        .set(CONSTRAINT_NAME, constraintName)
        .set(TABLE_CATALOG, ctx.catalogName())
        .set(TABLE_SCHEMA, schemaName)
        .set(TABLE_NAME, tableName)
        .set(CONSTRAINT_TYPE, constraintType)
        .set(IS_DEFERRABLE, NO)
        .set(INITIALLY_DEFERRED, NO)
        .set(ENFORCED, YES)
        .buildComplete();
  }
}
