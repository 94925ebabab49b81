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
import ai.floedb.infoschema.catalog.dialect.DialectAdapter;
import ai.floedb.infoschema.catalog.registry.ColumnMetadataEntry;
import ai.floedb.infoschema.catalog.registry.ColumnsMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declares empty introspection tables, named for one dialect.
 *
 * <p>Registry-driven tables take their columns straight from {@link ColumnsMetadata}.
 * Hand-declared tables list their columns explicitly; each declaration is still checked against
 * the registry because COLUMNS reports those tables from the registry too.
 */
public final class InformationSchemaTableFactory {

  private final DialectAdapter dialect;

  public InformationSchemaTableFactory(DialectAdapter dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /** Table whose columns are the registry entries of {@code canonicalName}, in registry order. */
  public InformationSchemaTable fromRegistry(String canonicalName) {
    List<ColumnDef> columns = new ArrayList<>();
    for (ColumnMetadataEntry entry : ColumnsMetadata.columnsOf(canonicalName)) {
      columns.add(
          new ColumnDef(
              dialect.nameForDialect(entry.columnName()),
              entry.columnName(),
              InformationSchemaType.fromSpannerType(entry.spannerType()),
              entry.nullable()));
    }
    return new InformationSchemaTable(
        dialect.nameForDialect(canonicalName), canonicalName, columns);
  }

  /**
   * Table with explicitly declared columns.
   *
   * @throws InformationSchemaInvariantException if a declared column is missing from the registry
   *     or declared with a different type
   */
  public InformationSchemaTable declared(String canonicalName, List<ColumnDecl> declarations) {
    Objects.requireNonNull(declarations, "declarations");
    List<ColumnDef> columns = new ArrayList<>(declarations.size());
    for (ColumnDecl decl : declarations) {
      ColumnMetadataEntry entry =
          ColumnsMetadata.columnMetadata(canonicalName, decl.canonicalName());
      InformationSchemaType registered = InformationSchemaType.fromSpannerType(entry.spannerType());
      if (registered != decl.type()) {
        throw new InformationSchemaInvariantException(
            "Declared type " + decl.type() + " differs from registry type " + registered,
            canonicalName,
            decl.canonicalName());
      }
      columns.add(
          new ColumnDef(
              dialect.nameForDialect(decl.canonicalName()),
              decl.canonicalName(),
              decl.type(),
              entry.nullable()));
    }
    return new InformationSchemaTable(
        dialect.nameForDialect(canonicalName), canonicalName, columns);
  }
}
