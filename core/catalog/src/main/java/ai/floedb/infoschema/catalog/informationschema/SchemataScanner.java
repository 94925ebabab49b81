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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.CATALOG_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SCHEMATA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SCHEMA_NAME;

import ai.floedb.infoschema.catalog.BuildPhase;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import java.util.stream.Stream;

/** information_schema.schemata: the user schema, then the information schema itself. */
public final class SchemataScanner implements InformationSchemaScanner {

  @Override
  public String tableName() {
    return SCHEMATA;
  }

  @Override
  public BuildPhase populatePhase() {
    return BuildPhase.POPULATE_SCHEMA_TABLES;
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    return Stream.of(
        ctx.row(SCHEMATA)
            .set(CATALOG_NAME, ctx.catalogName())
            .set(SCHEMA_NAME, ctx.userSchemaName())
            .build(),
        ctx.row(SCHEMATA)
            .set(CATALOG_NAME, ctx.catalogName())
            .set(SCHEMA_NAME, ctx.informationSchemaName())
            .build());
  }
}
