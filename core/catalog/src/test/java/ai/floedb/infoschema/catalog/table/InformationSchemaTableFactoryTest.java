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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.infoschema.catalog.InformationSchemaInvariantException;
import ai.floedb.infoschema.catalog.dialect.DialectAdapter;
import ai.floedb.infoschema.schema.model.DatabaseDialect;
import java.util.List;
import org.junit.jupiter.api.Test;

class InformationSchemaTableFactoryTest {

  private static final InformationSchemaTableFactory NATIVE =
      new InformationSchemaTableFactory(
          DialectAdapter.forDialect(DatabaseDialect.GOOGLE_STANDARD_SQL));
  private static final InformationSchemaTableFactory POSTGRES =
      new InformationSchemaTableFactory(DialectAdapter.forDialect(DatabaseDialect.POSTGRESQL));

  @Test
  void fromRegistry_takesColumnsInRegistryOrder() {
    InformationSchemaTable table = NATIVE.fromRegistry(SCHEMATA);

    assertThat(table.name()).isEqualTo(SCHEMATA);
    assertThat(table.columns())
        .containsExactly(
            new ColumnDef(CATALOG_NAME, CATALOG_NAME, InformationSchemaType.STRING, false),
            new ColumnDef(SCHEMA_NAME, SCHEMA_NAME, InformationSchemaType.STRING, false),
            new ColumnDef(
                EFFECTIVE_TIMESTAMP, EFFECTIVE_TIMESTAMP, InformationSchemaType.INT64, true));
  }

  @Test
  void fromRegistry_lowerCasesNamesForPostgres() {
    InformationSchemaTable table = POSTGRES.fromRegistry(TABLES);

    assertThat(table.name()).isEqualTo("tables");
    assertThat(table.canonicalName()).isEqualTo(TABLES);
    assertThat(table.columns().get(0).name()).isEqualTo("table_catalog");
    assertThat(table.columns().get(0).canonicalName()).isEqualTo(TABLE_CATALOG);
  }

  @Test
  void declared_takesNullabilityFromRegistry() {
    InformationSchemaTable table =
        NATIVE.declared(
            INDEXES, List.of(ColumnDecl.string(INDEX_NAME), ColumnDecl.bool(IS_UNIQUE)));

    assertThat(table.columns())
        .extracting(ColumnDef::nullable)
        .containsExactly(false, true);
  }

  @Test
  void declared_rejectsColumnMissingFromRegistry() {
    assertThatThrownBy(() -> NATIVE.declared(INDEXES, List.of(ColumnDecl.string("NOT_THERE"))))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessage("Missing metadata for column: INDEXES.NOT_THERE");
  }

  @Test
  void declared_rejectsTypeDisagreeingWithRegistry() {
    assertThatThrownBy(() -> NATIVE.declared(INDEXES, List.of(ColumnDecl.string(IS_UNIQUE))))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessage("Declared type STRING differs from registry type BOOL: INDEXES.IS_UNIQUE");
  }

  @Test
  void fromSpannerType_rejectsUnsupportedSpelling() {
    assertThat(InformationSchemaType.fromSpannerType("STRING(MAX)"))
        .isEqualTo(InformationSchemaType.STRING);
    assertThatThrownBy(() -> InformationSchemaType.fromSpannerType("FLOAT64"))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessageContaining("FLOAT64");
  }
}
