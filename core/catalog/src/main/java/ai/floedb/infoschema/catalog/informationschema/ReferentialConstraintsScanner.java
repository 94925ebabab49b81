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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.COMMITTED;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CONSTRAINT_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.DELETE_RULE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.MATCH_OPTION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.NO_ACTION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.REFERENTIAL_CONSTRAINTS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SIMPLE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SPANNER_STATE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.UNIQUE_CONSTRAINT_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.UNIQUE_CONSTRAINT_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.UNIQUE_CONSTRAINT_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.UPDATE_RULE;

import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import ai.floedb.infoschema.schema.model.ForeignKey;
import ai.floedb.infoschema.schema.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * information_schema.referential_constraints: links each foreign key to the unique constraint
 * backing it, the referenced index or the referenced table's primary key.
 */
public final class ReferentialConstraintsScanner implements InformationSchemaScanner {

  public static final List<ColumnDecl> SCHEMA =
      List.of(
          ColumnDecl.string(CONSTRAINT_CATALOG),
          ColumnDecl.string(CONSTRAINT_SCHEMA),
          ColumnDecl.string(CONSTRAINT_NAME),
          ColumnDecl.string(UNIQUE_CONSTRAINT_CATALOG),
          ColumnDecl.string(UNIQUE_CONSTRAINT_SCHEMA),
          ColumnDecl.string(UNIQUE_CONSTRAINT_NAME),
          ColumnDecl.string(MATCH_OPTION),
          ColumnDecl.string(UPDATE_RULE),
          ColumnDecl.string(DELETE_RULE),
          ColumnDecl.string(SPANNER_STATE));

  @Override
  public String tableName() {
    return REFERENTIAL_CONSTRAINTS;
  }

  @Override
  public Optional<List<ColumnDecl>> declaredColumns() {
    return Optional.of(SCHEMA);
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    List<InformationSchemaRow> rows = new ArrayList<>();
    String schema = ctx.userSchemaName();
    for (Table table : ctx.schema().tables()) {
      for (ForeignKey foreignKey : table.foreignKeys()) {
        rows.add(
            ctx.row(REFERENTIAL_CONSTRAINTS)
                .set(CONSTRAINT_CATALOG, ctx.catalogName())
                .set(CONSTRAINT_SCHEMA, schema)
                .set(CONSTRAINT_NAME, foreignKey.name())
                .set(UNIQUE_CONSTRAINT_CATALOG, ctx.catalogName())
                .set(UNIQUE_CONSTRAINT_SCHEMA, schema)
                .set(UNIQUE_CONSTRAINT_NAME, ConstraintNames.referencedUniqueConstraint(foreignKey))
                .set(MATCH_OPTION, SIMPLE)
                .set(UPDATE_RULE, NO_ACTION)
                .set(DELETE_RULE, NO_ACTION)
                .set(SPANNER_STATE, COMMITTED)
                .buildComplete());
      }
    }
    return rows.stream();
  }
}
