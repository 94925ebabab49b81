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

import ai.floedb.infoschema.types.ColumnType;
import java.util.Objects;

/** Output column of a view. Views do not record declared lengths. */
public record ViewColumn(String name, ColumnType type) {

  public ViewColumn {
    name = Objects.requireNonNull(name, "name");
    type = Objects.requireNonNull(type, "type");
  }
}
