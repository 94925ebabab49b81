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

import ai.floedb.infoschema.catalog.BuildPhase;
import ai.floedb.infoschema.catalog.InformationSchemaInvariantException;
import ai.floedb.infoschema.catalog.dialect.DialectAdapter;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.catalog.table.RowBuilder;
import ai.floedb.infoschema.schema.model.Schema;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * What a scanner sees while the catalog is being built: the user schema, the dialect, and the
 * introspection tables declared so far.
 */
public final class ScanContext {

  private final String catalogName;
  private final Schema schema;
  private final DialectAdapter dialect;
  private final Map<String, InformationSchemaTable> declaredTables;
  private final Supplier<BuildPhase> phase;

  /**
   * @param declaredTables tables by canonical name, in declaration order; read live so the
   *     context sees tables declared after it was created
   * @param phase current build phase of the owning catalog
   */
  public ScanContext(
      String catalogName,
      Schema schema,
      DialectAdapter dialect,
      Map<String, InformationSchemaTable> declaredTables,
      Supplier<BuildPhase> phase) {
    this.catalogName = Objects.requireNonNull(catalogName, "catalogName");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.declaredTables = Objects.requireNonNull(declaredTables, "declaredTables");
    this.phase = Objects.requireNonNull(phase, "phase");
  }

  public String catalogName() {
    return catalogName;
  }

  public Schema schema() {
    return schema;
  }

  public DialectAdapter dialect() {
    return dialect;
  }

  public BuildPhase phase() {
    return phase.get();
  }

  /** Schema name reported for user tables and views. */
  public String userSchemaName() {
    return dialect.defaultSchemaName();
  }

  /** Schema name reported for introspection tables. */
  public String informationSchemaName() {
    return dialect.informationSchemaName();
  }

  /** Dialect spelling of a canonical introspection identifier. */
  public String name(String canonicalIdentifier) {
    return dialect.nameForDialect(canonicalIdentifier);
  }

  /**
   * A declared table, by canonical name.
   *
   * @throws InformationSchemaInvariantException if the table has not been declared
   */
  public InformationSchemaTable table(String canonicalName) {
    InformationSchemaTable table = declaredTables.get(canonicalName);
    if (table == null) {
      throw new InformationSchemaInvariantException("Table not declared", canonicalName, null);
    }
    return table;
  }

  /** New builder for one row of a declared table. */
  public RowBuilder row(String canonicalName) {
    return RowBuilder.forTable(table(canonicalName));
  }

  /**
   * Every introspection table, in declaration order.
   *
   * @throws InformationSchemaInvariantException outside {@link
   *     BuildPhase#POPULATE_SELF_DESCRIBING}, when the table list may still be incomplete
   */
  public List<InformationSchemaTable> informationSchemaTables() {
    BuildPhase current = phase.get();
    if (current != BuildPhase.POPULATE_SELF_DESCRIBING) {
      throw new InformationSchemaInvariantException(
          "Introspection tables listed during " + current);
    }
    return List.copyOf(declaredTables.values());
  }
}
