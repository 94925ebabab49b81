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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_TABLE_USAGE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;

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
 * information_schema.constraint_table_usage: the table each constraint is about.
 *
 * <p>Foreign keys and their backing unique constraints name the referenced table; every other
 * constraint names its own table.
 */
public final class ConstraintTableUsageScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(TABLE_CATALOG),
          ColumnDecl.string(TABLE_SCHEMA),
          ColumnDecl.string(TABLE_NAME),
          ColumnDecl.string(CONSTRAINT_CATALOG),
          ColumnDecl.string(CONSTRAINT_SCHEMA),
          ColumnDecl.string(CONSTRAINT_NAME));

  @Override
  public String tableName() {
    return CONSTRAINT_TABLE_USAGE;
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
      rows.add(row(ctx, schema, table.name(), ConstraintNames.primaryKey(table.name())));
      for (Column column : table.columns()) {
        if (!column.nullable()) {
          rows.add(
              row(
                  ctx,
                  schema,
                  table.name(),
                  ConstraintNames.notNull(table.name(), column.name())));
        }
      }
      for (CheckConstraint check : table.checkConstraints()) {
        rows.add(row(ctx, schema, table.name(), check.name()));
      }
      for (ForeignKey foreignKey : table.foreignKeys()) {
        rows.add(row(ctx, schema, foreignKey.referencedTable(), foreignKey.name()));
        if (backing.emitsBackingConstraint(foreignKey)) {
          rows.add(
              row(
                  ctx,
                  schema,
                  foreignKey.referencedTable(),
                  foreignKey.referencedIndex().orElseThrow()));
        }
      }
    }

    String infoSchema = ctx.informationSchemaName();
    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      rows.add(
          row(
              ctx,
              infoSchema,
              table.name(),
              ConstraintNames.primaryKey(table.name())));
      for (ColumnDef column : SelfDescription.notNullColumns(table)) {
        rows.add(
            row(
                ctx,
                infoSchema,
                table.name(),
                ConstraintNames.notNull(table.name(), column.name())));
      }
    }

    return rows.stream();
  }

  private static InformationSchemaRow row(
      ScanContext ctx, String schemaName, String tableName, String constraintName) {
    return ctx.row(CONSTRAINT_TABLE_USAGE)
        .set(TABLE_CATALOG, ctx.catalogName())
        .set(TABLE_SCHEMA, schemaName)
        .set(TABLE_NAME, tableName)
        .set(CONSTRAINT_CATALOG, ctx.catalogName())
        .set(CONSTRAINT_SCHEMA, schemaName)
        .set(CONSTRAINT_NAME, constraintName)
        .buildComplete();
  }
}
