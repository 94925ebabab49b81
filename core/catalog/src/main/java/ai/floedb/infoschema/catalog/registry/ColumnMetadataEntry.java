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

package ai.floedb.infoschema.catalog.registry;

import java.util.Objects;

/** Static description of one column of one introspection table. */
public record ColumnMetadataEntry(
    String tableName, String columnName, String spannerType, boolean nullable) {

  public ColumnMetadataEntry {
    tableName = Objects.requireNonNull(tableName, "tableName");
    columnName = Objects.requireNonNull(columnName, "columnName");
    spannerType = Objects.requireNonNull(spannerType, "spannerType");
  }

  /** {@code YES} or {@code NO}, as reported by COLUMNS.IS_NULLABLE. */
  public String isNullable() {
    return nullable ? InformationSchemaNames.YES : InformationSchemaNames.NO;
  }
}
