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

package ai.floedb.infoschema.catalog.informationschema;

import java.util.List;

/** Every introspection table scanner, in table declaration order. */
public final class InformationSchemaScanners {

  private InformationSchemaScanners() {}

  public static List<InformationSchemaScanner> all() {
    return List.of(
        new SchemataScanner(),
        new DatabaseOptionsScanner(),
        new SpannerStatisticsScanner(),
        new TablesScanner(),
        new ColumnsScanner(),
        new ColumnColumnUsageScanner(),
        new ViewsScanner(),
        new IndexesScanner(),
        new IndexColumnsScanner(),
        new ColumnOptionsScanner(),
        new CheckConstraintsScanner(),
        new TableConstraintsScanner(),
        new ConstraintTableUsageScanner(),
        new ReferentialConstraintsScanner(),
        new KeyColumnUsageScanner(),
        new ConstraintColumnUsageScanner());
  }
}
