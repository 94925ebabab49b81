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

/** Storage limits applied to variable-length column types. */
public final class Limits {

  /** Maximum length, in characters, of a {@code STRING(MAX)} column. */
  public static final long MAX_STRING_COLUMN_LENGTH = 2_621_440L;

  /** Maximum length, in bytes, of a {@code BYTES(MAX)} column. */
  public static final long MAX_BYTES_COLUMN_LENGTH = 10_485_760L;

  private Limits() {}

  /**
   * Largest length a column of {@code type} may declare. Arrays take the limit of their element
   * type.
   *
   * @throws IllegalArgumentException if the type takes no length
   */
  public static long maxDeclaredLength(ColumnType type) {
    ColumnType scalar = type.isArray() ? type.elementType() : type;
    if (scalar.isString()) {
      return MAX_STRING_COLUMN_LENGTH;
    }
    if (scalar.isBytes()) {
      return MAX_BYTES_COLUMN_LENGTH;
    }
    throw new IllegalArgumentException(type + " does not accept a length");
  }
}
