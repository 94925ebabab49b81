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

package ai.floedb.infoschema.types;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Column type kinds understood by the schema model.
 *
 * <p>Only the kind is captured here. Length limits live on the owning column and array element
 * types are carried by {@link ColumnType}.
 */
public enum TypeKind {
  BOOL,
  INT64,
  FLOAT32,
  FLOAT64,
  NUMERIC,
  STRING,
  BYTES,
  DATE,
  TIMESTAMP,
  JSON,
  ARRAY;

  private static final Map<String, TypeKind> ALIASES;

  static {
    Map<String, TypeKind> m = new HashMap<>();

    m.put("BOOLEAN", BOOL);
    m.put("BIGINT", INT64);
    m.put("INT8", INT64);
    m.put("INTEGER", INT64);
    m.put("REAL", FLOAT32);
    m.put("FLOAT4", FLOAT32);
    m.put("DOUBLE", FLOAT64);
    m.put("FLOAT8", FLOAT64);
    m.put("DOUBLE PRECISION", FLOAT64);
    m.put("DECIMAL", NUMERIC);
    m.put("VARCHAR", STRING);
    m.put("CHARACTER VARYING", STRING);
    m.put("TEXT", STRING);
    m.put("BYTEA", BYTES);
    m.put("TIMESTAMPTZ", TIMESTAMP);
    m.put("TIMESTAMP WITH TIME ZONE", TIMESTAMP);
    m.put("JSONB", JSON);

    ALIASES = Map.copyOf(m);
  }

  /**
   * Resolves a type name (canonical or aliased) to a {@link TypeKind}.
   *
   * <p>The lookup is case-insensitive and collapses internal whitespace.
   *
   * @throws IllegalArgumentException if {@code candidate} is null, blank, or not recognised
   */
  public static TypeKind fromName(String candidate) {
    if (candidate == null) {
      throw new IllegalArgumentException("Type kind must not be null");
    }
    String normalized = candidate.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("Type kind must not be blank");
    }

    try {
      return TypeKind.valueOf(normalized);
    } catch (IllegalArgumentException ignore) {
      // fall through
    }

    TypeKind alias = ALIASES.get(normalized);
    if (alias != null) {
      return alias;
    }
    throw new IllegalArgumentException("Unknown type kind: " + candidate);
  }

  /** True for kinds whose DDL spelling carries a length, e.g. {@code STRING(MAX)}. */
  public boolean hasLength() {
    return this == STRING || this == BYTES;
  }
}
