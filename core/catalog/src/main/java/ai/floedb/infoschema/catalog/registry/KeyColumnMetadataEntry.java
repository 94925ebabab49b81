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

/**
 * Static description of one primary-key column of an introspection table.
 *
 * <p>A {@code primaryKeyOrdinal} of zero means the column takes the next position in declaration
 * order.
 */
public record KeyColumnMetadataEntry(
    String tableName,
    String columnName,
    boolean nullable,
    String columnOrdering,
    String spannerType,
    int primaryKeyOrdinal) {

  public KeyColumnMetadataEntry {
    tableName = Objects.requireNonNull(tableName, "tableName");
    columnName = Objects.requireNonNull(columnName, "columnName");
    columnOrdering = Objects.requireNonNull(columnOrdering, "columnOrdering");
    spannerType = Objects.requireNonNull(spannerType, "spannerType");
    if (primaryKeyOrdinal < 0) {
      throw new IllegalArgumentException("primaryKeyOrdinal must be >= 0: " + primaryKeyOrdinal);
    }
  }

  public String isNullable() {
    return nullable ? InformationSchemaNames.YES : InformationSchemaNames.NO;
  }
}
