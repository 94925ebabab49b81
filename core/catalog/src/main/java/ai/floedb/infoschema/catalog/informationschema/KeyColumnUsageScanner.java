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
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.KEY_COLUMN_USAGE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ORDINAL_POSITION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.POSITION_IN_UNIQUE_CONSTRAINT;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;

import ai.floedb.infoschema.catalog.informationschema.SelfDescription.KeyPart;
import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.schema.model.ForeignKey;
import ai.floedb.infoschema.schema.model.Index;
import ai.floedb.infoschema.schema.model.KeyColumn;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * information_schema.key_column_usage.
 *
 * <ul>
 *   <li>Primary-key columns: positions 1..n in key order, no unique-constraint position.
 *   <li>Foreign-key referencing columns: position i pairs with position i of the referenced
 *       columns, in declaration order.
 *   <li>Backing-index key columns, reported once per index on the referenced table.
 *   <li>Primary-key columns of the introspection tables.
 * </ul>
 */
public final class KeyColumnUsageScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(CONSTRAINT_CATALOG),
          ColumnDecl.string(CONSTRAINT_SCHEMA),
          ColumnDecl.string(CONSTRAINT_NAME),
          ColumnDecl.string(TABLE_CATALOG),
          ColumnDecl.string(TABLE_SCHEMA),
          ColumnDecl.string(TABLE_NAME),
          ColumnDecl.string(COLUMN_NAME),
          ColumnDecl.int64(ORDINAL_POSITION),
          ColumnDecl.int64(POSITION_IN_UNIQUE_CONSTRAINT));

  @Override
  public String tableName() {
    return KEY_COLUMN_USAGE;
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
      long ordinal = 1;
      for (KeyColumn key : table.primaryKey()) {
        rows.add(row(ctx, schema, primaryKey, table.name(), key.columnName(), ordinal++, null));
      }

      for (ForeignKey foreignKey : table.foreignKeys()) {
        long position = 1;
        for (String column : foreignKey.referencingColumns()) {
          rows.add(
              row(ctx, schema, foreignKey.name(), table.name(), column, position, position));
          position++;
        }
        if (backing.emitsBackingConstraint(foreignKey)) {
          Index index = backingIndex(ctx, foreignKey);
          long indexOrdinal = 1;
          for (KeyColumn key : index.keyColumns()) {
            rows.add(
                row(
                    ctx,
                    schema,
                    index.name(),
                    foreignKey.referencedTable(),
                    key.columnName(),
                    indexOrdinal++,
                    null));
          }
        }
      }
    }

    String infoSchema = ctx.informationSchemaName();
    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      String primaryKey = ConstraintNames.primaryKey(table.name());
      for (KeyPart part : SelfDescription.primaryKey(table)) {
        rows.add(
            row(
                ctx,
                infoSchema,
                primaryKey,
                table.name(),
                part.column().name(),
                part.ordinal(),
                null));
      }
    }

    return rows.stream();
  }

  static Index backingIndex(ScanContext ctx, ForeignKey foreignKey) {
    return ctx.schema()
        .requireTable(foreignKey.referencedTable())
        .index(foreignKey.referencedIndex().orElseThrow())
        .orElseThrow();
  }

  private static InformationSchemaRow row(
      ScanContext ctx,
      String schemaName,
      String constraintName,
      String tableName,
      String columnName,
      long ordinal,
      Long positionInUniqueConstraint) {
    return ctx.row(KEY_COLUMN_USAGE)
        .set(CONSTRAINT_CATALOG, ctx.catalogName())
        .set(CONSTRAINT_SCHEMA, schemaName)
        .set(CONSTRAINT_NAME, constraintName)
        .set(TABLE_CATALOG, ctx.catalogName())
        .set(TABLE_SCHEMA, schemaName)
        .set(TABLE_NAME, tableName)
        .set(COLUMN_NAME, columnName)
        .set(ORDINAL_POSITION, ordinal)
        .set(POSITION_IN_UNIQUE_CONSTRAINT, positionInUniqueConstraint)
        .buildComplete();
  }
}
