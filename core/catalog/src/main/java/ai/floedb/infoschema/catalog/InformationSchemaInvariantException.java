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

package ai.floedb.infoschema.catalog;

import java.util.Optional;

/**
 * Raised when the information schema registry and the code synthesizing the catalog disagree.
 *
 * <p>This is never caused by user input: the schema handed to the catalog is already validated.
 * It signals a defect (a registry entry missing for a declared column, a non-canonical override
 * key, a row of the wrong shape) and aborts catalog construction. Callers must not catch it to
 * fall back to a partial catalog.
 */
public final class InformationSchemaInvariantException extends IllegalStateException {

  private final String tableName;
  private final String columnName;

  public InformationSchemaInvariantException(String message) {
    this(message, null, null);
  }

  public InformationSchemaInvariantException(String message, String tableName, String columnName) {
    super(format(message, tableName, columnName));
    this.tableName = tableName;
    this.columnName = columnName;
  }

  public Optional<String> tableName() {
    return Optional.ofNullable(tableName);
  }

  public Optional<String> columnName() {
    return Optional.ofNullable(columnName);
  }

  private static String format(String message, String tableName, String columnName) {
    if (tableName == null) {
      return message;
    }
    return message + ": " + tableName + (columnName == null ? "" : "." + columnName);
  }
}
