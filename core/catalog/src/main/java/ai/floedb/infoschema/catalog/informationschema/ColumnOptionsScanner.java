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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ALLOW_COMMIT_TIMESTAMP_OPTION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.BOOL_OPTION_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_OPTIONS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.OPTION_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.OPTION_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.OPTION_VALUE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TRUE;

import ai.floedb.infoschema.catalog.BuildPhase;
import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/** information_schema.column_options: one row per column allowing commit timestamps. */
public final class ColumnOptionsScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(TABLE_CATALOG),
          ColumnDecl.string(TABLE_SCHEMA),
          ColumnDecl.string(TABLE_NAME),
          ColumnDecl.string(COLUMN_NAME),
          ColumnDecl.string(OPTION_NAME),
          ColumnDecl.string(OPTION_TYPE),
          ColumnDecl.string(OPTION_VALUE));

  @Override
  public String tableName() {
    return COLUMN_OPTIONS;
  }

  @Override
  public Optional<List<ColumnDecl>> declaredColumns() {
    return Optional.of(SCHEMA);
  }

  @Override
  public BuildPhase populatePhase() {
    return BuildPhase.POPULATE_SCHEMA_TABLES;
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    List<InformationSchemaRow> rows = new ArrayList<>();
    for (Table table : ctx.schema().tables()) {
      for (Column column : table.columns()) {
        if (!column.allowsCommitTimestamp()) {
          continue;
        }
        rows.add(
            ctx.row(COLUMN_OPTIONS)
                .set(TABLE_CATALOG, ctx.catalogName())
                .set(TABLE_SCHEMA, ctx.userSchemaName())
                .set(TABLE_NAME, table.name())
                .set(COLUMN_NAME, column.name())
                .set(OPTION_NAME, ALLOW_COMMIT_TIMESTAMP_OPTION)
                .set(OPTION_TYPE, BOOL_OPTION_TYPE)
                .set(OPTION_VALUE, TRUE)
                .buildComplete());
      }
    }
    return rows.stream();
  }
}
