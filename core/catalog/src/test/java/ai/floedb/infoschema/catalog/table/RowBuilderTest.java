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
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class RowBuilderTest {

  private static InformationSchemaTable table() {
    return new InformationSchemaTable(
        "T",
        "T",
        List.of(
            new ColumnDef("NAME", "NAME", InformationSchemaType.STRING, false),
            new ColumnDef("COUNT", "COUNT", InformationSchemaType.INT64, true),
            new ColumnDef("FLAG", "FLAG", InformationSchemaType.BOOL, true),
            new ColumnDef("AT", "AT", InformationSchemaType.TIMESTAMP, true)));
  }

  @Test
  void build_fillsUnsetColumnsWithTypeDefaults() {
    InformationSchemaRow row = RowBuilder.forTable(table()).build();

    assertThat(row.values()).containsExactly("", 0L, false, Instant.EPOCH);
  }

  @Test
  void build_keepsOverridesAndExplicitNulls() {
    InformationSchemaRow row =
        RowBuilder.forTable(table()).set("NAME", "x").set("COUNT", null).build();

    assertThat(row.values()).containsExactly("x", null, false, Instant.EPOCH);
  }

  @Test
  void set_widensIntegerToLong() {
    InformationSchemaRow row = RowBuilder.forTable(table()).set("COUNT", 7).build();

    assertThat(row.get(1)).isEqualTo(7L).isInstanceOf(Long.class);
  }

  @Test
  void freshBuilders_leakNothingBetweenRows() {
    InformationSchemaTable table = table();

    InformationSchemaRow first =
        RowBuilder.forTable(table)
            .set("NAME", "first")
            .set("COUNT", 42L)
            .set("FLAG", true)
            .set("AT", Instant.ofEpochSecond(10))
            .build();
    InformationSchemaRow second = RowBuilder.forTable(table).set("NAME", "second").build();

    assertThat(first.values()).containsExactly("first", 42L, true, Instant.ofEpochSecond(10));
    assertThat(second.values()).containsExactly("second", 0L, false, Instant.EPOCH);
  }

  @Test
  void set_rejectsNonCanonicalKey() {
    assertThatThrownBy(() -> RowBuilder.forTable(table()).set("name", "x"))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessageContaining("not canonical")
        .hasMessageContaining("T.name");
  }

  @Test
  void set_rejectsUnknownColumn() {
    assertThatThrownBy(() -> RowBuilder.forTable(table()).set("MISSING", "x"))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessage("Unknown column: T.MISSING");
  }

  @Test
  void set_rejectsMismatchedValueType() {
    assertThatThrownBy(() -> RowBuilder.forTable(table()).set("FLAG", "yes"))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessageContaining("String does not fit BOOL");
  }

  @Test
  void set_rejectsSecondAssignment() {
    RowBuilder builder = RowBuilder.forTable(table()).set("NAME", "x");

    assertThatThrownBy(() -> builder.set("NAME", "y"))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessage("Column set twice: T.NAME");
  }

  @Test
  void buildComplete_requiresEveryColumn() {
    RowBuilder builder = RowBuilder.forTable(table()).set("NAME", "x").set("COUNT", null);

    assertThatThrownBy(builder::buildComplete)
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessage("Column not set: T.FLAG");
  }

  @Test
  void buildComplete_acceptsExplicitNulls() {
    InformationSchemaRow row =
        RowBuilder.forTable(table())
            .set("NAME", "x")
            .set("COUNT", null)
            .set("FLAG", null)
            .set("AT", null)
            .buildComplete();

    assertThat(row.values()).containsExactly("x", null, null, null);
  }

  @Test
  void canonicalConstants_areAcceptedAsKeys() {
    InformationSchemaTable tables =
        new InformationSchemaTableFactory(DialectAdapter.forDialect(DatabaseDialect.POSTGRESQL))
            .fromRegistry(TABLES);

    InformationSchemaRow row =
        RowBuilder.forTable(tables).set(TABLE_NAME, "users").set(TABLE_TYPE, BASE_TABLE).build();

    assertThat(tables.value(row, TABLE_NAME)).isEqualTo("users");
    assertThat(tables.value(row, TABLE_TYPE)).isEqualTo(BASE_TABLE);
  }
}
