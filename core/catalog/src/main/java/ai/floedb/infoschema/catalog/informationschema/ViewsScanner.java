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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.INVOKER;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.SECURITY_TYPE;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_CATALOG;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_SCHEMA;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.VIEWS;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.VIEW_DEFINITION;

import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import java.util.stream.Stream;

/** information_schema.views */
public final class ViewsScanner implements InformationSchemaScanner {

  @Override
  public String tableName() {
    return VIEWS;
  }

  @Override
  public Stream<InformationSchemaRow> scan(ScanContext ctx) {
    return ctx.schema().views().stream()
        .map(
            view ->
                ctx.row(VIEWS)
                    .set(TABLE_CATALOG, ctx.catalogName())
                    .set(TABLE_SCHEMA, ctx.userSchemaName())
                    .set(TABLE_NAME, view.name())
                    .set(VIEW_DEFINITION, view.body())
                    .set(SECURITY_TYPE, INVOKER)
                    .build());
  }
}
