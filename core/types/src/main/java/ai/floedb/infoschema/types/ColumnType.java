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

import java.util.Objects;

/** A scalar column type, or an array of a scalar element type. */
public final class ColumnType {

  private static final ColumnType BOOL = new ColumnType(TypeKind.BOOL, null);
  private static final ColumnType INT64 = new ColumnType(TypeKind.INT64, null);
  private static final ColumnType FLOAT32 = new ColumnType(TypeKind.FLOAT32, null);
  private static final ColumnType FLOAT64 = new ColumnType(TypeKind.FLOAT64, null);
  private static final ColumnType NUMERIC = new ColumnType(TypeKind.NUMERIC, null);
  private static final ColumnType STRING = new ColumnType(TypeKind.STRING, null);
  private static final ColumnType BYTES = new ColumnType(TypeKind.BYTES, null);
  private static final ColumnType DATE = new ColumnType(TypeKind.DATE, null);
  private static final ColumnType TIMESTAMP = new ColumnType(TypeKind.TIMESTAMP, null);
  private static final ColumnType JSON = new ColumnType(TypeKind.JSON, null);

  private final TypeKind kind;
  private final ColumnType elementType;

  private ColumnType(TypeKind kind, ColumnType elementType) {
    this.kind = kind;
    this.elementType = elementType;
  }

  public static ColumnType of(TypeKind kind) {
    Objects.requireNonNull(kind, "kind");
    return switch (kind) {
      case BOOL -> BOOL;
      case INT64 -> INT64;
      case FLOAT32 -> FLOAT32;
      case FLOAT64 -> FLOAT64;
      case NUMERIC -> NUMERIC;
      case STRING -> STRING;
      case BYTES -> BYTES;
      case DATE -> DATE;
      case TIMESTAMP -> TIMESTAMP;
      case JSON -> JSON;
      case ARRAY -> throw new IllegalArgumentException("ARRAY requires an element type");
    };
  }

  public static ColumnType arrayOf(ColumnType elementType) {
    Objects.requireNonNull(elementType, "elementType");
    if (elementType.isArray()) {
      throw new IllegalArgumentException("Nested arrays are not supported");
    }
    return new ColumnType(TypeKind.ARRAY, elementType);
  }

  public static ColumnType bool() {
    return BOOL;
  }

  public static ColumnType int64() {
    return INT64;
  }

  public static ColumnType float64() {
    return FLOAT64;
  }

  public static ColumnType string() {
    return STRING;
  }

  public static ColumnType bytes() {
    return BYTES;
  }

  public static ColumnType timestamp() {
    return TIMESTAMP;
  }

  public TypeKind kind() {
    return kind;
  }

  /** Element type of an array, or {@code null} for scalar types. */
  public ColumnType elementType() {
    return elementType;
  }

  public boolean isArray() {
    return kind == TypeKind.ARRAY;
  }

  public boolean isInt64() {
    return kind == TypeKind.INT64;
  }

  public boolean isDouble() {
    return kind == TypeKind.FLOAT64;
  }

  public boolean isString() {
    return kind == TypeKind.STRING;
  }

  public boolean isBytes() {
    return kind == TypeKind.BYTES;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnType other)) {
      return false;
    }
    return kind == other.kind && Objects.equals(elementType, other.elementType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, elementType);
  }

  @Override
  public String toString() {
    return ColumnTypeFormat.format(this, null);
  }
}
