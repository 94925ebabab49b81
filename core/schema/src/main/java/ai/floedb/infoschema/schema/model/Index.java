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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Secondary index on a table.
 *
 * <p>Managed indexes are created by the database itself, for example to back a foreign key.
 */
public record Index(
    String name,
    List<KeyColumn> keyColumns,
    List<String> storedColumns,
    boolean unique,
    boolean nullFiltered,
    boolean managed,
    Optional<String> parentTableName) {

  public Index {
    name = Objects.requireNonNull(name, "name");
    keyColumns = List.copyOf(Objects.requireNonNull(keyColumns, "keyColumns"));
    storedColumns = List.copyOf(storedColumns == null ? List.of() : storedColumns);
    parentTableName = parentTableName == null ? Optional.empty() : parentTableName;
    if (keyColumns.isEmpty()) {
      throw new IllegalArgumentException("Index " + name + " has no key columns");
    }
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private final List<KeyColumn> keyColumns = new ArrayList<>();
    private final List<String> storedColumns = new ArrayList<>();
    private boolean unique;
    private boolean nullFiltered;
    private boolean managed;
    private String parentTableName;

    private Builder(String name) {
      this.name = name;
    }

    public Builder key(KeyColumn column) {
      keyColumns.add(column);
      return this;
    }

    public Builder key(String columnName) {
      return key(KeyColumn.asc(columnName));
    }

    public Builder store(String columnName) {
      storedColumns.add(columnName);
      return this;
    }

    public Builder unique() {
      this.unique = true;
      return this;
    }

    public Builder nullFiltered() {
      this.nullFiltered = true;
      return this;
    }

    public Builder managed() {
      this.managed = true;
      return this;
    }

    public Builder interleaveIn(String parentTableName) {
      this.parentTableName = parentTableName;
      return this;
    }

    public Index build() {
      return new Index(
          name,
          keyColumns,
          storedColumns,
          unique,
          nullFiltered,
          managed,
          Optional.ofNullable(parentTableName));
    }
  }
}
