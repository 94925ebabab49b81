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

package ai.floedb.infoschema.catalog.table;

import java.util.Objects;

/**
 * Declared column of an introspection table.
 *
 * @param name column name as queried in the active dialect
 * @param canonicalName upper-case name used as the row builder key
 */
public record ColumnDef(
    String name, String canonicalName, InformationSchemaType type, boolean nullable) {

  public ColumnDef {
    name = Objects.requireNonNull(name, "name");
    canonicalName = Objects.requireNonNull(canonicalName, "canonicalName");
    type = Objects.requireNonNull(type, "type");
  }
}
