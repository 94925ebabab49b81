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
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.DATABASE_DIALECT_OPTION;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.DATABASE_OPTIONS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.OPTION_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.OPTION_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.OPTION_VALUE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SCHEMA_NAME;

import ai.floedb.infoschema.catalog.BuildPhase;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import java.util.stream.Stream;

/** information_schema.database_options: reports the database dialect. */
public final class DatabaseOptionsScanner implements InformationSchemaScanner {

  @Override
  public String tableName() {
    return DATABASE_OPTIONS;
  }

  @Override
  public BuildPhase populatePhase() {
    return BuildPhase.POPULATE_SCHEMA_TABLES;
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    return Stream.of(
        ctx.row(DATABASE_OPTIONS)
            .set(CATALOG_NAME, ctx.catalogName())
            .set(SCHEMA_NAME, ctx.userSchemaName())
            .set(OPTION_NAME, DATABASE_DIALECT_OPTION)
            .set(OPTION_TYPE, ctx.dialect().stringOptionType())
            .set(OPTION_VALUE, ctx.dialect().dialectOptionValue())
            .build());
  }
}
