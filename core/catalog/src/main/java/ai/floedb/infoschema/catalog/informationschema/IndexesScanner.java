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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEXES;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX_STATE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INDEX_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IS_NULL_FILTERED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IS_UNIQUE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.PARENT_TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.PRIMARY_KEY_INDEX;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.READ_WRITE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SPANNER_IS_MANAGED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;

import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.schema.model.Index;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * information_schema.indexes: each secondary index of a user table followed by the table's
 * primary key, then the primary key of every introspection table.
 */
public final class IndexesScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(TABLE_CATALOG),
          ColumnDecl.string(TABLE_SCHEMA),
          ColumnDecl.string(TABLE_NAME),
          ColumnDecl.string(INDEX_NAME),
          ColumnDecl.string(INDEX_TYPE),
          ColumnDecl.string(PARENT_TABLE_NAME),
          ColumnDecl.bool(IS_UNIQUE),
          ColumnDecl.bool(IS_NULL_FILTERED),
          ColumnDecl.string(INDEX_STATE),
          ColumnDecl.bool(SPANNER_IS_MANAGED));

  @Override
  public String tableName() {
    return INDEXES;
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
        rows.add(
            ctx.row(INDEXES)
                .set(TABLE_CATALOG, ctx.catalogName())
                .set(TABLE_SCHEMA, ctx.userSchemaName())
                .set(TABLE_NAME, table.name())
                .set(INDEX_NAME, index.name())
                .set(INDEX_TYPE, INDEX)
                .set(PARENT_TABLE_NAME, index.parentTableName().orElse(""))
                .set(IS_UNIQUE, index.unique())
                .set(IS_NULL_FILTERED, index.nullFiltered())
                .set(INDEX_STATE, READ_WRITE)
                .set(SPANNER_IS_MANAGED, index.managed())
                .buildComplete());
      }
      rows.add(primaryKeyRow(ctx, ctx.userSchemaName(), table.name()));
    }

    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      rows.add(primaryKeyRow(ctx, ctx.informationSchemaName(), table.name()));
    }

    return rows.stream();
  }

  private static InformationSchemaRow primaryKeyRow(
      ScanContext ctx, String schemaName, String tableName) {
    return ctx.row(INDEXES)
        .set(TABLE_CATALOG, ctx.catalogName())
        .set(TABLE_SCHEMA, schemaName)
        .set(TABLE_NAME, tableName)
        .set(INDEX_NAME, PRIMARY_KEY_INDEX)
        .set(INDEX_TYPE, PRIMARY_KEY_INDEX)
        .set(PARENT_TABLE_NAME, "")
        .set(IS_UNIQUE, true)
        .set(IS_NULL_FILTERED, false)
        .set(INDEX_STATE, null)
        .set(SPANNER_IS_MANAGED, false)
        .buildComplete();
  }
}
