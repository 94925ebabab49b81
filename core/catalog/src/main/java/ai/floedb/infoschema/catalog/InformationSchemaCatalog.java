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

package ai.floedb.infoschema.catalog;

import ai.floedb.infoschema.catalog.dialect.DialectAdapter;
import ai.floedb.infoschema.catalog.informationschema.InformationSchemaScanner;
import ai.floedb.infoschema.catalog.informationschema.InformationSchemaScanners;
import ai.floedb.infoschema.catalog.informationschema.ScanContext;
import ai.floedb.infoschema.catalog.registry.ColumnsMetadata;
import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.catalog.table.InformationSchemaTable;
import ai.floedb.infoschema.catalog.table.InformationSchemaTableFactory;
import ai.floedb.infoschema.schema.model.DatabaseDialect;
import ai.floedb.infoschema.schema.model.Schema;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * The information schema of one schema version, under one dialect.
 *
 * <p>Construction runs every {@link BuildPhase} in order: all tables are declared, the tables that
 * only describe the user schema are filled, then the tables that also describe the introspection
 * tables. Afterwards the catalog and its tables never change and may be read from any thread. A
 * new schema version needs a new catalog.
 */
public final class InformationSchemaCatalog {

  private static final Logger LOG = Logger.getLogger(InformationSchemaCatalog.class);

  private final DialectAdapter dialect;
  private final long schemaVersion;
  private final String catalogName;
  private final List<InformationSchemaTable> tables;
  private final Map<String, InformationSchemaTable> tablesByName;

  private volatile BuildPhase phase;

  /** Catalog named {@code ""}. */
  public InformationSchemaCatalog(DatabaseDialect dialect, Schema schema) {
    this(dialect, schema, "");
  }

  public InformationSchemaCatalog(DatabaseDialect dialect, Schema schema, String catalogName) {
    this(dialect, schema, catalogName, InformationSchemaScanners.all());
  }

  InformationSchemaCatalog(
      DatabaseDialect dialect,
      Schema schema,
      String catalogName,
      List<InformationSchemaScanner> scanners) {
    Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(schema, "schema");
    this.dialect = DialectAdapter.forDialect(dialect);
    this.schemaVersion = schema.version();
    this.catalogName = Objects.requireNonNull(catalogName, "catalogName");

    long start = System.nanoTime();
    Map<String, InformationSchemaTable> declared = new LinkedHashMap<>();
    ScanContext ctx = new ScanContext(catalogName, schema, this.dialect, declared, () -> phase);

    phase = BuildPhase.DECLARE;
    declare(scanners, declared);
    populate(BuildPhase.POPULATE_SCHEMA_TABLES, scanners, ctx);
    populate(BuildPhase.POPULATE_SELF_DESCRIBING, scanners, ctx);
    phase = BuildPhase.SEALED;

    for (InformationSchemaTable table : declared.values()) {
      if (!table.hasContents()) {
        throw new InformationSchemaInvariantException(
            "Table was never populated", table.canonicalName(), null);
      }
    }

    this.tables = List.copyOf(declared.values());
    Map<String, InformationSchemaTable> byName = new HashMap<>();
    for (InformationSchemaTable table : tables) {
      byName.put(table.name(), table);
    }
    this.tablesByName = Map.copyOf(byName);

    if (LOG.isDebugEnabled()) {
      long rows = tables.stream().mapToLong(t -> t.rows().size()).sum();
      LOG.debugf(
          "Built information schema catalog dialect=%s version=%d tables=%d rows=%d in %d ms",
          dialect,
          schemaVersion,
          tables.size(),
          rows,
          (System.nanoTime() - start) / 1_000_000L);
    }
  }

  /** Catalog for the schema's own dialect. */
  public static InformationSchemaCatalog of(Schema schema) {
    return new InformationSchemaCatalog(schema.dialect(), schema);
  }

  private void declare(
      List<InformationSchemaScanner> scanners, Map<String, InformationSchemaTable> declared) {
    InformationSchemaTableFactory factory = new InformationSchemaTableFactory(dialect);
    for (InformationSchemaScanner scanner : scanners) {
      String name = scanner.tableName();
      Optional<List<ColumnDecl>> columns = scanner.declaredColumns();
      boolean registryShaped = ColumnsMetadata.isRegistryTable(name);
      if (registryShaped && columns.isPresent()) {
        throw new InformationSchemaInvariantException(
            "Registry-shaped table cannot declare its own columns", name, null);
      }
      if (!registryShaped && columns.isEmpty()) {
        throw new InformationSchemaInvariantException(
            "Table is not registry-shaped and declares no columns", name, null);
      }
      InformationSchemaTable table =
          registryShaped ? factory.fromRegistry(name) : factory.declared(name, columns.get());
      if (declared.putIfAbsent(name, table) != null) {
        throw new InformationSchemaInvariantException("Table declared twice", name, null);
      }
    }
  }

  private void populate(
      BuildPhase target, List<InformationSchemaScanner> scanners, ScanContext ctx) {
    phase = target;
    for (InformationSchemaScanner scanner : scanners) {
      BuildPhase scannerPhase = scanner.populatePhase();
      if (scannerPhase != BuildPhase.POPULATE_SCHEMA_TABLES
          && scannerPhase != BuildPhase.POPULATE_SELF_DESCRIBING) {
        throw new InformationSchemaInvariantException(
            "Scanner cannot populate during " + scannerPhase, scanner.tableName(), null);
      }
      if (scannerPhase != target) {
        continue;
      }
      List<InformationSchemaRow> rows = scanner.scan(ctx).toList();
      ctx.table(scanner.tableName()).setContents(rows);
      LOG.tracef("Populated %s with %d rows", scanner.tableName(), rows.size());
    }
  }

  /** Every table, in declaration order. */
  public List<InformationSchemaTable> tables() {
    return tables;
  }

  /**
   * Table by its name in the catalog's dialect.
   *
   * @throws NoSuchElementException if there is no such table
   */
  public InformationSchemaTable table(String name) {
    return findTable(name)
        .orElseThrow(() -> new NoSuchElementException("No information schema table " + name));
  }

  public Optional<InformationSchemaTable> findTable(String name) {
    return Optional.ofNullable(tablesByName.get(name));
  }

  /** Resolves {@code schemaName.tableName}; only the information schema's own name matches. */
  public Optional<InformationSchemaTable> findTable(String schemaName, String tableName) {
    if (!dialect.informationSchemaName().equals(schemaName)) {
      return Optional.empty();
    }
    return findTable(tableName);
  }

  public DatabaseDialect dialect() {
    return dialect.dialect();
  }

  public long schemaVersion() {
    return schemaVersion;
  }

  public String catalogName() {
    return catalogName;
  }

  /** Current build phase; {@link BuildPhase#SEALED} once the constructor has returned. */
  public BuildPhase phase() {
    return phase;
  }
}
