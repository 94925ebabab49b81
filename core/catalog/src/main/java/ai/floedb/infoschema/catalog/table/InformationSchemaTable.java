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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.Stream;

/**
 * Read-only introspection table.
 *
 * <p>The shape is fixed at construction. Rows are installed once, as a whole, through {@link
 * #setContents}; every later access sees the same immutable list.
 */
public final class InformationSchemaTable {

  private final String name;
  private final String canonicalName;
  private final List<ColumnDef> columns;
  private final Map<String, Integer> indexByName;
  private final Map<String, Integer> indexByCanonicalName;
  private volatile List<InformationSchemaRow> rows;

  InformationSchemaTable(String name, String canonicalName, List<ColumnDef> columns) {
    this.name = Objects.requireNonNull(name, "name");
    this.canonicalName = Objects.requireNonNull(canonicalName, "canonicalName");
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    Map<String, Integer> byName = new HashMap<>();
    Map<String, Integer> byCanonical = new HashMap<>();
    for (int i = 0; i < this.columns.size(); i++) {
      ColumnDef column = this.columns.get(i);
      if (byCanonical.put(column.canonicalName(), i) != null) {
        throw new InformationSchemaInvariantException(
            "Duplicate column", canonicalName, column.canonicalName());
      }
      byName.put(column.name(), i);
    }
    this.indexByName = Map.copyOf(byName);
    this.indexByCanonicalName = Map.copyOf(byCanonical);
  }

  /** Table name in the active dialect's casing. */
  public String name() {
    return name;
  }

  public String canonicalName() {
    return canonicalName;
  }

  public List<ColumnDef> columns() {
    return columns;
  }

  /** Position of a column, looked up by its dialect name. */
  public OptionalInt columnIndex(String columnName) {
    Integer index = indexByName.get(columnName);
    return index == null ? OptionalInt.empty() : OptionalInt.of(index);
  }

  /**
   * Position of a column, looked up by its canonical name.
   *
   * @throws InformationSchemaInvariantException if the table has no such column
   */
  public int canonicalColumnIndex(String canonicalColumn) {
    Integer index = indexByCanonicalName.get(canonicalColumn);
    if (index == null) {
      throw new InformationSchemaInvariantException(
          "Unknown column", canonicalName, canonicalColumn);
    }
    return index;
  }

  /** Value of a canonical column in one of this table's rows. */
  public Object value(InformationSchemaRow row, String canonicalColumn) {
    return row.get(canonicalColumnIndex(canonicalColumn));
  }

  public boolean hasContents() {
    return rows != null;
  }

  /** Installed rows; empty until {@link #setContents} runs. */
  public List<InformationSchemaRow> rows() {
    List<InformationSchemaRow> current = rows;
    return current == null ? List.of() : current;
  }

  public Stream<InformationSchemaRow> scan() {
    return rows().stream();
  }

  /**
   * Installs the table's rows. Each row must match the declared arity and value types.
   *
   * @throws InformationSchemaInvariantException on a second call or a malformed row
   */
  public void setContents(List<InformationSchemaRow> contents) {
    Objects.requireNonNull(contents, "contents");
    if (rows != null) {
      throw new InformationSchemaInvariantException("Contents already set", canonicalName, null);
    }
    List<InformationSchemaRow> checked = new ArrayList<>(contents.size());
    for (InformationSchemaRow row : contents) {
      checkRow(row);
      checked.add(row);
    }
    rows = Collections.unmodifiableList(checked);
  }

  private void checkRow(InformationSchemaRow row) {
    if (row.size() != columns.size()) {
      throw new InformationSchemaInvariantException(
          "Row has " + row.size() + " values, expected " + columns.size(), canonicalName, null);
    }
    for (int i = 0; i < columns.size(); i++) {
      ColumnDef column = columns.get(i);
      if (!column.type().accepts(row.get(i))) {
        throw new InformationSchemaInvariantException(
            "Value of type "
                + row.get(i).getClass().getSimpleName()
                + " does not fit "
                + column.type(),
            canonicalName,
            column.canonicalName());
      }
    }
  }

  @Override
  public String toString() {
    return "InformationSchemaTable{"
        + name
        + ", "
        + columns.size()
        + " columns, "
        + rows().size()
        + " rows}";
  }
}
