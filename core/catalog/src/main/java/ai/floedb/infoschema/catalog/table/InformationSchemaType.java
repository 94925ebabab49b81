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

import ai.floedb.infoschema.catalog.InformationSchemaInvariantException;
import ai.floedb.infoschema.types.ColumnType;
import java.time.Instant;

/**
 * Value types used by introspection table columns.
 *
 * <p>Each type fixes the Java class its row values must have and the default a row builder falls
 * back to when a column is not set explicitly.
 */
public enum InformationSchemaType {
  STRING("STRING(MAX)", String.class, "", ColumnType.string()),
  INT64("INT64", Long.class, 0L, ColumnType.int64()),
  BOOL("BOOL", Boolean.class, Boolean.FALSE, ColumnType.bool()),
  TIMESTAMP("TIMESTAMP", Instant.class, Instant.EPOCH, ColumnType.timestamp());

  private final String spannerType;
  private final Class<?> javaType;
  private final Object defaultValue;
  private final ColumnType columnType;

  InformationSchemaType(
      String spannerType, Class<?> javaType, Object defaultValue, ColumnType columnType) {
    this.spannerType = spannerType;
    this.javaType = javaType;
    this.defaultValue = defaultValue;
    this.columnType = columnType;
  }

  /** Registry spelling, e.g. {@code STRING(MAX)}. */
  public String spannerType() {
    return spannerType;
  }

  public Class<?> javaType() {
    return javaType;
  }

  public Object defaultValue() {
    return defaultValue;
  }

  /** The equivalent schema-model type, used for numeric precision reporting. */
  public ColumnType columnType() {
    return columnType;
  }

  /** True when {@code value} may be stored in a column of this type. {@code null} always fits. */
  public boolean accepts(Object value) {
    return value == null || javaType.isInstance(value);
  }

  /**
   * Maps a registry type spelling to its value type.
   *
   * @throws InformationSchemaInvariantException for spellings the registry must never contain
   */
  public static InformationSchemaType fromSpannerType(String spannerType) {
    for (InformationSchemaType type : values()) {
      if (type.spannerType.equals(spannerType)) {
        return type;
      }
    }
    throw new InformationSchemaInvariantException(
        "Unsupported information schema column type " + spannerType);
  }
}
