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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.BASE_TABLE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COMMITTED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INTERLEAVE_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IN_PARENT;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ON_DELETE_ACTION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.PARENT_TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ROW_DELETION_POLICY_EXPRESSION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SPANNER_STATE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLES;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.VIEW;

import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.schema.model.Table;
import ai.floedb.infoschema.schema.model.View;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** information_schema.tables: user tables, views, then the introspection tables. */
public final class TablesScanner implements InformationSchemaScanner {

  @Override
  public String tableName() {
    return TABLES;
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    List<InformationSchemaRow> rows = new ArrayList<>();

    for (Table table : ctx.schema().tables()) {
      boolean interleaved = table.isInterleaved();
      rows.add(
          ctx.row(TABLES)
              .set(TABLE_CATALOG, ctx.catalogName())
              .set(TABLE_SCHEMA, ctx.userSchemaName())
              .set(TABLE_NAME, table.name())
              .set(TABLE_TYPE, BASE_TABLE)
              .set(PARENT_TABLE_NAME, table.parentTableName().orElse(null))
              .set(ON_DELETE_ACTION, interleaved ? table.onDeleteAction().ddl() : null)
              .set(SPANNER_STATE, COMMITTED)
              .set(INTERLEAVE_TYPE, interleaved ? IN_PARENT : null)
              .set(ROW_DELETION_POLICY_EXPRESSION, ctx.dialect().rowDeletionPolicyExpression(table))
              .build());
    }

    for (View view : ctx.schema().views()) {
      rows.add(
          ctx.row(TABLES)
              .set(TABLE_CATALOG, ctx.catalogName())
              .set(TABLE_SCHEMA, ctx.userSchemaName())
              .set(TABLE_NAME, view.name())
              .set(TABLE_TYPE, VIEW)
              .set(PARENT_TABLE_NAME, null)
              .set(ON_DELETE_ACTION, null)
              .set(SPANNER_STATE, ctx.dialect().viewSpannerState())
              .set(INTERLEAVE_TYPE, null)
              .set(ROW_DELETION_POLICY_EXPRESSION, null)
              .build());
    }

    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      rows.add(
          ctx.row(TABLES)
              .set(TABLE_CATALOG, ctx.catalogName())
              .set(TABLE_SCHEMA, ctx.informationSchemaName())
              .set(TABLE_NAME, table.name())
              .set(TABLE_TYPE, VIEW)
              .set(PARENT_TABLE_NAME, null)
              .set(ON_DELETE_ACTION, null)
              .set(SPANNER_STATE, null)
              .set(INTERLEAVE_TYPE, null)
              .set(ROW_DELETION_POLICY_EXPRESSION, null)
              .build());
    }

    return rows.stream();
  }
}
