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

import ai.floedb.infoschema.catalog.registry.ColumnMetadataEntry;
import ai.floedb.infoschema.catalog.registry.ColumnsMetadata;
import ai.floedb.infoschema.catalog.registry.KeyColumnMetadataEntry;
import ai.floedb.infoschema.catalog.table.ColumnDef;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Registry facts about the introspection tables, in the tables' column order. */
final class SelfDescription {

  /** A primary-key column of an introspection table with its resolved 1-based position. */
  record KeyPart(ColumnDef column, KeyColumnMetadataEntry metadata, long ordinal) {}

  private SelfDescription() {}

  /**
   * Primary-key columns of {@code table}. Registry ordinals win; entries without one take the
   * next position in column order.
   */
  static List<KeyPart> primaryKey(InformationSchemaTable table) {
    List<KeyPart> parts = new ArrayList<>();
    long next = 1;
    for (ColumnDef column : table.columns()) {
      Optional<KeyColumnMetadataEntry> key =
          ColumnsMetadata.findKeyColumnMetadata(table.canonicalName(), column.canonicalName());
      if (key.isEmpty()) {
        continue;
      }
      KeyColumnMetadataEntry metadata = key.get();
      long ordinal = metadata.primaryKeyOrdinal() > 0 ? metadata.primaryKeyOrdinal() : next++;
      parts.add(new KeyPart(column, metadata, ordinal));
    }
    return parts;
  }

  /** Columns of {@code table} the registry marks as not nullable. */
  static List<ColumnDef> notNullColumns(InformationSchemaTable table) {
    List<ColumnDef> columns = new ArrayList<>();
    for (ColumnDef column : table.columns()) {
      ColumnMetadataEntry metadata = metadata(table, column);
      if (!metadata.nullable()) {
        columns.add(column);
      }
    }
    return columns;
  }

  static ColumnMetadataEntry metadata(InformationSchemaTable table, ColumnDef column) {
    return ColumnsMetadata.columnMetadata(table.canonicalName(), column.canonicalName());
  }
}
