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

import java.util.Objects;

/** A column reference inside a primary key or index key, with its sort direction. */
public record KeyColumn(String columnName, boolean descending) {

  public KeyColumn {
    columnName = Objects.requireNonNull(columnName, "columnName");
  }

  public static KeyColumn asc(String columnName) {
    return new KeyColumn(columnName, false);
  }

  public static KeyColumn desc(String columnName) {
    return new KeyColumn(columnName, true);
  }
}
