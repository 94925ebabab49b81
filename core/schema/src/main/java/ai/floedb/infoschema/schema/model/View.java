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

/** A named query with its SQL body and output columns in select-list order. */
public record View(String name, String body, List<ViewColumn> columns) {

  public View {
    name = Objects.requireNonNull(name, "name");
    body = Objects.requireNonNull(body, "body");
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
  }
}
