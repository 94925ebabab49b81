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
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds a single row of an introspection table.
 *
 * <p>A builder is used for exactly one row: take a new one from {@link #forTable} for every row
 * so nothing set for one row can reach the next. Keys are canonical upper-case column names.
 *
 * <pre>{@code
 * InformationSchemaRow row =
 *     RowBuilder.forTable(tables)
 *         .set(TABLE_NAME, "Users")
 *         .set(TABLE_TYPE, BASE_TABLE)
 *         .build();
 * }</pre>
 */
public final class RowBuilder {

  private static final Object UNSET = new Object();

  private final InformationSchemaTable table;
  private final Object[] values;

  private RowBuilder(InformationSchemaTable table) {
    this.table = table;
    this.values = new Object[table.columns().size()];
    Arrays.fill(values, UNSET);
  }

  public static RowBuilder forTable(InformationSchemaTable table) {
    return new RowBuilder(Objects.requireNonNull(table, "table"));
  }

  /**
   * Sets a column. {@code null} stores SQL NULL.
   *
   * @throws InformationSchemaInvariantException if the key is not canonical, names no column of
   *     the table, was already set, or the value does not fit the column type
   */
  public RowBuilder set(String canonicalColumn, Object value) {
    Objects.requireNonNull(canonicalColumn, "canonicalColumn");
    if (!canonicalColumn.equals(canonicalColumn.toUpperCase(Locale.ROOT))) {
      throw new InformationSchemaInvariantException(
          "Column key is not canonical", table.canonicalName(), canonicalColumn);
    }
    int index = table.canonicalColumnIndex(canonicalColumn);
    if (values[index] != UNSET) {
      throw new InformationSchemaInvariantException(
          "Column set twice", table.canonicalName(), canonicalColumn);
    }
    ColumnDef column = table.columns().get(index);
    Object normalized = value instanceof Integer i ? Long.valueOf(i) : value;
    if (!column.type().accepts(normalized)) {
      throw new InformationSchemaInvariantException(
          "Value of type "
              + normalized.getClass().getSimpleName()
              + " does not fit "
              + column.type(),
          table.canonicalName(),
          canonicalColumn);
    }
    values[index] = normalized;
    return this;
  }

  /** The row, with every column left unset holding its type default. */
  public InformationSchemaRow build() {
    List<ColumnDef> columns = table.columns();
    Object[] row = new Object[values.length];
    for (int i = 0; i < values.length; i++) {
      row[i] = values[i] == UNSET ? columns.get(i).type().defaultValue() : values[i];
    }
    return new InformationSchemaRow(row);
  }

  /**
   * The row, requiring every column to have been set.
   *
   * @throws InformationSchemaInvariantException naming the first column left unset
   */
  public InformationSchemaRow buildComplete() {
    for (int i = 0; i < values.length; i++) {
      if (values[i] == UNSET) {
        throw new InformationSchemaInvariantException(
            "Column not set", table.canonicalName(), table.columns().get(i).canonicalName());
      }
    }
    return new InformationSchemaRow(values);
  }
}
