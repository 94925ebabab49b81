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

package ai.floedb.infoschema.schema.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Foreign key declared on the referencing table.
 *
 * <p>{@code referencedIndex} names the unique index that backs the referenced columns. When it is
 * empty the referenced table's primary key backs the foreign key.
 */
public record ForeignKey(
    String name,
    List<String> referencingColumns,
    String referencedTable,
    List<String> referencedColumns,
    Optional<String> referencedIndex) {

  public ForeignKey {
    name = Objects.requireNonNull(name, "name");
    referencingColumns = List.copyOf(Objects.requireNonNull(referencingColumns, "referencing"));
    referencedTable = Objects.requireNonNull(referencedTable, "referencedTable");
    referencedColumns = List.copyOf(Objects.requireNonNull(referencedColumns, "referenced"));
    referencedIndex = referencedIndex == null ? Optional.empty() : referencedIndex;
    if (referencingColumns.isEmpty()) {
      throw new IllegalArgumentException("Foreign key " + name + " has no columns");
    }
    if (referencingColumns.size() != referencedColumns.size()) {
      throw new IllegalArgumentException(
          "Foreign key "
              + name
              + " pairs "
              + referencingColumns.size()
              + " referencing columns with "
              + referencedColumns.size()
              + " referenced columns");
    }
  }

  /** Foreign key backed by the referenced table's primary key. */
  public static ForeignKey onPrimaryKey(
      String name,
      List<String> referencingColumns,
      String referencedTable,
      List<String> referencedColumns) {
    return new ForeignKey(
        name, referencingColumns, referencedTable, referencedColumns, Optional.empty());
  }

  /** Foreign key backed by a named unique index on the referenced table. */
  public static ForeignKey onIndex(
      String name,
      List<String> referencingColumns,
      String referencedTable,
      List<String> referencedColumns,
      String referencedIndex) {
    return new ForeignKey(
        name,
        referencingColumns,
        referencedTable,
        referencedColumns,
        Optional.of(referencedIndex));
  }
}
