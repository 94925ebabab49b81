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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ASC;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_ORDERING;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.DESC;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX_COLUMNS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IS_NULLABLE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NO;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ORDINAL_POSITION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.PRIMARY_KEY_INDEX;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SPANNER_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.YES;

import ai.floedb.infoschema.catalog.informationschema.SelfDescription.KeyPart;
import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.catalog.table.RowBuilder;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.Index;
import ai.floedb.infoschema.schema.model.KeyColumn;
import ai.floedb.infoschema.schema.model.Table;
import ai.floedb.infoschema.types.ColumnTypeFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * information_schema.index_columns.
 *
 * <p>Key columns of an index carry their 1-based position and ordering; stored columns carry
 * neither. A key column is reported nullable only when the index does not filter nulls.
 */
public final class IndexColumnsScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(TABLE_CATALOG),
          ColumnDecl.string(TABLE_SCHEMA),
          ColumnDecl.string(TABLE_NAME),
          ColumnDecl.string(INDEX_NAME),
          ColumnDecl.string(INDEX_TYPE),
          ColumnDecl.string(COLUMN_NAME),
          ColumnDecl.int64(ORDINAL_POSITION),
          ColumnDecl.string(COLUMN_ORDERING),
          ColumnDecl.string(IS_NULLABLE),
          ColumnDecl.string(SPANNER_TYPE));

  @Override
  public String tableName() {
    return INDEX_COLUMNS;
  }

  @Override
  public Optional<List<ColumnDecl>> declaredColumns() {
    return Optional.of(SCHEMA);
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    List<InformationSchemaRow> rows = new ArrayList<>();

    for (Table table : ctx.schema().tables()) {
      for (Index index : table.indexes()) {
        long ordinal = 1;
        for (KeyColumn key : index.keyColumns()) {
          Column column = column(table, key.columnName());
          rows.add(
              start(ctx, ctx.userSchemaName(), table.name(), index.name(), INDEX)
                  .set(COLUMN_NAME, column.name())
                  .set(ORDINAL_POSITION, ordinal++)
                  .set(COLUMN_ORDERING, key.descending() ? DESC : ASC)
                  .set(IS_NULLABLE, column.nullable() && !index.nullFiltered() ? YES : NO)
                  .set(SPANNER_TYPE, ddlType(column))
                  .buildComplete());
        }
        for (String stored : index.storedColumns()) {
          Column column = column(table, stored);
          rows.add(
              start(ctx, ctx.userSchemaName(), table.name(), index.name(), INDEX)
                  .set(COLUMN_NAME, column.name())
                  .set(ORDINAL_POSITION, null)
                  .set(COLUMN_ORDERING, null)
                  .set(IS_NULLABLE, column.nullable() ? YES : NO)
                  .set(SPANNER_TYPE, ddlType(column))
                  .buildComplete());
        }
      }

      long ordinal = 1;
      for (KeyColumn key : table.primaryKey()) {
        Column column = column(table, key.columnName());
        rows.add(
            start(ctx, ctx.userSchemaName(), table.name(), PRIMARY_KEY_INDEX, PRIMARY_KEY_INDEX)
                .set(COLUMN_NAME, column.name())
                .set(ORDINAL_POSITION, ordinal++)
                .set(COLUMN_ORDERING, key.descending() ? DESC : ASC)
                .set(IS_NULLABLE, column.nullable() ? YES : NO)
                .set(SPANNER_TYPE, ddlType(column))
                .buildComplete());
      }
    }

    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      for (KeyPart part : SelfDescription.primaryKey(table)) {
        rows.add(
            start(
                    ctx,
                    ctx.informationSchemaName(),
                    table.name(),
                    PRIMARY_KEY_INDEX,
                    PRIMARY_KEY_INDEX)
                .set(COLUMN_NAME, part.column().name())
                .set(ORDINAL_POSITION, part.ordinal())
                .set(COLUMN_ORDERING, part.metadata().columnOrdering())
                .set(IS_NULLABLE, part.metadata().isNullable())
                .set(SPANNER_TYPE, part.metadata().spannerType())
                .buildComplete());
      }
    }

    return rows.stream();
  }

  private static RowBuilder start(
      ScanContext ctx, String schemaName, String tableName, String indexName, String indexType) {
    return ctx.row(INDEX_COLUMNS)
        .set(TABLE_CATALOG, ctx.catalogName())
        .set(TABLE_SCHEMA, schemaName)
        .set(TABLE_NAME, tableName)
        .set(INDEX_NAME, indexName)
        .set(INDEX_TYPE, indexType);
  }

  // Schema snapshots are validated on construction, so key and stored columns always resolve.
  private static Column column(Table table, String columnName) {
    return table.column(columnName).orElseThrow();
  }

  private static String ddlType(Column column) {
    return ColumnTypeFormat.format(column.type(), column.declaredMaxLength().orElse(null));
  }
}
