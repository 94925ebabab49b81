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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ALWAYS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CHARACTER_MAXIMUM_LENGTH;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMNS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_DEFAULT;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COLUMN_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COMMITTED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.DATA_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.GENERATION_EXPRESSION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IS_GENERATED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IS_NULLABLE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.IS_STORED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NEVER;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NO;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NUMERIC_PRECISION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NUMERIC_PRECISION_RADIX;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NUMERIC_SCALE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.ORDINAL_POSITION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SPANNER_STATE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SPANNER_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.YES;

import ai.floedb.infoschema.catalog.dialect.DialectAdapter;
import ai.floedb.infoschema.catalog.registry.ColumnMetadataEntry;
import ai.floedb.infoschema.catalog.table.ColumnDef;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.catalog.table.RowBuilder;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.Table;
import ai.floedb.infoschema.schema.model.View;
import ai.floedb.infoschema.schema.model.ViewColumn;
import ai.floedb.infoschema.types.ColumnType;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * information_schema.columns: every column of every user table, view and introspection table,
 * with 1-based ordinal positions per table.
 */
public final class ColumnsScanner implements InformationSchemaScanner {

  @Override
  public String tableName() {
    return COLUMNS;
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    DialectAdapter dialect = ctx.dialect();
    List<InformationSchemaRow> rows = new ArrayList<>();

    for (Table table : ctx.schema().tables()) {
      long ordinal = 1;
      for (Column column : table.columns()) {
        RowBuilder row =
            start(ctx, ctx.userSchemaName(), table.name(), column.name(), ordinal++)
                .set(COLUMN_DEFAULT, dialect.columnDefault(column))
                .set(DATA_TYPE, dialect.columnDataType(column))
                .set(IS_NULLABLE, column.nullable() ? YES : NO)
                .set(SPANNER_TYPE, dialect.columnSpannerType(column))
                .set(IS_GENERATED, column.isGenerated() ? ALWAYS : NEVER)
                .set(GENERATION_EXPRESSION, dialect.generationExpression(column))
                .set(IS_STORED, column.isGenerated() ? (column.stored() ? YES : NO) : null)
                .set(SPANNER_STATE, COMMITTED)
                .set(CHARACTER_MAXIMUM_LENGTH, dialect.characterMaximumLength(column));
        rows.add(numeric(row, dialect, column.type()).build());
      }
    }

    for (View view : ctx.schema().views()) {
      long ordinal = 1;
      for (ViewColumn column : view.columns()) {
        RowBuilder row =
            start(ctx, ctx.userSchemaName(), view.name(), column.name(), ordinal++)
                .set(COLUMN_DEFAULT, null)
                .set(DATA_TYPE, null)
                .set(IS_NULLABLE, YES)
                .set(SPANNER_TYPE, dialect.viewColumnSpannerType(column.type()))
                .set(IS_GENERATED, NEVER)
                .set(GENERATION_EXPRESSION, null)
                .set(IS_STORED, null)
                .set(SPANNER_STATE, COMMITTED)
                .set(CHARACTER_MAXIMUM_LENGTH, null);
        rows.add(numeric(row, dialect, column.type()).build());
      }
    }

    for (InformationSchemaTable table : ctx.informationSchemaTables()) {
      long ordinal = 1;
      for (ColumnDef column : table.columns()) {
        ColumnMetadataEntry metadata = SelfDescription.metadata(table, column);
        RowBuilder row =
            start(ctx, ctx.informationSchemaName(), table.name(), column.name(), ordinal++)
                .set(COLUMN_DEFAULT, null)
                .set(DATA_TYPE, null)
                .set(IS_NULLABLE, metadata.isNullable())
                .set(
                    SPANNER_TYPE,
                    dialect.informationSchemaColumnSpannerType(metadata.spannerType()))
                .set(IS_GENERATED, NEVER)
                .set(GENERATION_EXPRESSION, null)
                .set(IS_STORED, null)
                .set(SPANNER_STATE, null)
                .set(CHARACTER_MAXIMUM_LENGTH, null);
        rows.add(numeric(row, dialect, column.type().columnType()).build());
      }
    }

    return rows.stream();
  }

  private static RowBuilder start(
      ScanContext ctx, String schemaName, String tableName, String columnName, long ordinal) {
    return ctx.row(COLUMNS)
        .set(TABLE_CATALOG, ctx.catalogName())
        .set(TABLE_SCHEMA, schemaName)
        .set(TABLE_NAME, tableName)
        .set(COLUMN_NAME, columnName)
        .set(ORDINAL_POSITION, ordinal);
  }

  private static RowBuilder numeric(RowBuilder row, DialectAdapter dialect, ColumnType type) {
    return row.set(NUMERIC_PRECISION, dialect.numericPrecision(type))
        .set(NUMERIC_PRECISION_RADIX, dialect.numericPrecisionRadix(type))
        .set(NUMERIC_SCALE, dialect.numericScale(type));
  }
}
