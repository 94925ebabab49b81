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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One row of an introspection table. Values follow the table's column order; {@code null} is SQL
 * NULL.
 */
public final class InformationSchemaRow {

  private final List<Object> values;

  InformationSchemaRow(Object[] values) {
    this.values = Collections.unmodifiableList(Arrays.asList(values.clone()));
  }

  public static InformationSchemaRow of(Object... values) {
    return new InformationSchemaRow(values);
  }

  public List<Object> values() {
    return values;
  }

  public Object get(int index) {
    return values.get(index);
  }

  public int size() {
    return values.size();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof InformationSchemaRow other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
