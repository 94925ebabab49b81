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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_COLUMN_USAGE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.DEPENDENT_COLUMN;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;

import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * information_schema.column_column_usage: one row per generated column and column its expression
 * reads. COLUMN_NAME is the column read, DEPENDENT_COLUMN the generated one.
 */
public final class ColumnColumnUsageScanner implements InformationSchemaScanner {

  @Override
  public String tableName() {
    return COLUMN_COLUMN_USAGE;
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    List<InformationSchemaRow> rows = new ArrayList<>();
    for (Table table : ctx.schema().tables()) {
      for (Column column : table.columns()) {
        if (!column.isGenerated()) {
          continue;
        }
        for (String used : column.dependentColumns()) {
          rows.add(
              ctx.row(COLUMN_COLUMN_USAGE)
                  .set(TABLE_CATALOG, ctx.catalogName())
                  .set(TABLE_SCHEMA, ctx.userSchemaName())
                  .set(TABLE_NAME, table.name())
                  .set(COLUMN_NAME, used)
                  .set(DEPENDENT_COLUMN, column.name())
                  .buildComplete());
        }
      }
    }
    return rows.stream();
  }
}
