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

import ai.floedb.infoschema.schema.model.ForeignKey;
import ai.floedb.infoschema.schema.model.Schema;

/**
 * Names and clauses of the constraints the catalog synthesizes.
 *
 * <p>The {@code PK_} and {@code CK_IS_NOT_NULL_} prefixes are upper case in every dialect. Table
 * and column parts are taken as given, so callers pass names already spelled for the dialect
 * ({@code PK_schemata} under PostgreSQL).
 */
public final class ConstraintNames {

  static final String PRIMARY_KEY_PREFIX = Schema.PRIMARY_KEY_CONSTRAINT_PREFIX;
  static final String NOT_NULL_PREFIX = Schema.NOT_NULL_CONSTRAINT_PREFIX;

  private ConstraintNames() {}

  public static String primaryKey(String tableName) {
    return PRIMARY_KEY_PREFIX + tableName;
  }

  public static String notNull(String tableName, String columnName) {
    return NOT_NULL_PREFIX + tableName + "_" + columnName;
  }

  public static String notNullClause(String columnName) {
    return columnName + " IS NOT NULL";
  }

  /**
   * Unique constraint backing a foreign key: its referenced index, or the referenced table's
   * primary key when it names none.
   */
  public static String referencedUniqueConstraint(ForeignKey foreignKey) {
    return foreignKey.referencedIndex().orElseGet(() -> primaryKey(foreignKey.referencedTable()));
  }
}
