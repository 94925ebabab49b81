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

/** Hand-written column declaration of an introspection table, by canonical name. */
public record ColumnDecl(String canonicalName, InformationSchemaType type) {

  public ColumnDecl {
    canonicalName = Objects.requireNonNull(canonicalName, "canonicalName");
    type = Objects.requireNonNull(type, "type");
  }

  public static ColumnDecl string(String canonicalName) {
    return new ColumnDecl(canonicalName, InformationSchemaType.STRING);
  }

  public static ColumnDecl int64(String canonicalName) {
    return new ColumnDecl(canonicalName, InformationSchemaType.INT64);
  }

  public static ColumnDecl bool(String canonicalName) {
    return new ColumnDecl(canonicalName, InformationSchemaType.BOOL);
  }
}
