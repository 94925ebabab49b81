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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_COLUMN_USAGE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;

import ai.floedb.infoschema.catalog.informationschema.SelfDescription.KeyPart;
import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.ColumnDef;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.schema.model.CheckConstraint;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.ForeignKey;
import ai.floedb.infoschema.schema.model.Index;
import ai.floedb.infoschema.schema.model.KeyColumn;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * information_schema.constraint_column_usage: every column a constraint covers.
 *
 * <p>Foreign keys report their referenced columns, on the referenced table. Introspection
 * primary keys are listed for all tables before introspection NOT NULL checks.
 */
public final class ConstraintColumnUsageScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(TABLE_CATALOG),
          ColumnDecl.string(TABLE_SCHEMA),
          ColumnDecl.string(TABLE_NAME),
          ColumnDecl.string(COLUMN_NAME),
          ColumnDecl.string(CONSTRAINT_CATALOG),
          ColumnDecl.string(CONSTRAINT_SCHEMA),
          ColumnDecl.string(CONSTRAINT_NAME));

  @Override
  public String tableName() {
    return CONSTRAINT_COLUMN_USAGE;
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
      String primaryKey = ConstraintNames.primaryKey(table.name());
      for (KeyColumn key : table.primaryKey()) {
        rows.add(row(ctx, schema, table.name(), key.columnName(), primaryKey));
      }
      for (Column column : table.columns()) {
        if (!column.nullable()) {
          rows.add(
              row(
                  ctx,
                  schema,
                  table.name(),
                  column.name(),
                  ConstraintNames.notNull(table.name(), column.name())));
        }
      }
      for (CheckConstraint check : table.checkConstraints()) {
        for (String column : check.dependentColumns()) {
          rows.add(row(ctx, schema, table.name(), column, check.name()));
        }
      }
      for (ForeignKey foreignKey : table.foreignKeys()) {
        for (String column : foreignKey.referencedColumns()) {
          rows.add(row(ctx, schema, foreignKey.referencedTable(), column, foreignKey.name()));
        }
        if (backing.emitsBackingConstraint(foreignKey)) {
          Index index = KeyColumnUsageScanner.backingIndex(ctx, foreignKey);
          for (KeyColumn key : index.keyColumns()) {
            rows.add(
                row(ctx, schema, foreignKey.referencedTable(), key.columnName(), index.name()));
          }
        }
      }
    }

    String infoSchema = ctx.informationSchemaName();
    List<InformationSchemaTable> tables = ctx.informationSchemaTables();
    for (InformationSchemaTable table : tables) {
      String primaryKey = ConstraintNames.primaryKey(table.name());
      for (KeyPart part : SelfDescription.primaryKey(table)) {
        rows.add(row(ctx, infoSchema, table.name(), part.column().name(), primaryKey));
      }
    }
    for (InformationSchemaTable table : tables) {
      for (ColumnDef column : SelfDescription.notNullColumns(table)) {
        rows.add(
            row(
                ctx,
                infoSchema,
                table.name(),
                column.name(),
                ConstraintNames.notNull(table.name(), column.name())));
      }
    }

    return rows.stream();
  }

  private static InformationSchemaRow row(
      ScanContext ctx,
      String schemaName,
      String tableName,
      String columnName,
      String constraintName) {
    return ctx.row(CONSTRAINT_COLUMN_USAGE)
        .set(TABLE_CATALOG, ctx.catalogName())
        .set(TABLE_SCHEMA, schemaName)
        .set(TABLE_NAME, tableName)
        .set(COLUMN_NAME, columnName)
        .set(CONSTRAINT_CATALOG, ctx.catalogName())
        .set(CONSTRAINT_SCHEMA, schemaName)
        .set(CONSTRAINT_NAME, constraintName)
        .buildComplete();
  }
}
