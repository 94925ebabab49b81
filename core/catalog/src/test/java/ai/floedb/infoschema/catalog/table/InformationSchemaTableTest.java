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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.infoschema.catalog.InformationSchemaInvariantException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class InformationSchemaTableTest {

  private static InformationSchemaTable table() {
    return new InformationSchemaTable(
        "indexes",
        "INDEXES",
        List.of(
            new ColumnDef("index_name", "INDEX_NAME", InformationSchemaType.STRING, false),
            new ColumnDef("is_unique", "IS_UNIQUE", InformationSchemaType.BOOL, true)));
  }

  @Test
  void rows_emptyUntilContentsAreSet() {
    InformationSchemaTable table = table();

    assertThat(table.hasContents()).isFalse();
    assertThat(table.rows()).isEmpty();
  }

  @Test
  void setContents_installsRowsOnce() {
    InformationSchemaTable table = table();
    List<InformationSchemaRow> rows = new ArrayList<>();
    rows.add(InformationSchemaRow.of("PRIMARY_KEY", true));

    table.setContents(rows);
    rows.add(InformationSchemaRow.of("late", false));

    assertThat(table.hasContents()).isTrue();
    assertThat(table.rows()).containsExactly(InformationSchemaRow.of("PRIMARY_KEY", true));
    assertThat(table.scan()).hasSize(1);
    assertThatThrownBy(() -> table.rows().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void setContents_secondCallThrows() {
    InformationSchemaTable table = table();
    table.setContents(List.of());

    assertThatThrownBy(() -> table.setContents(List.of()))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessage("Contents already set: INDEXES");
  }

  @Test
  void setContents_rejectsWrongArity() {
    assertThatThrownBy(() -> table().setContents(List.of(InformationSchemaRow.of("x"))))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessageContaining("Row has 1 values, expected 2");
  }

  @Test
  void setContents_rejectsWrongValueType() {
    assertThatThrownBy(() -> table().setContents(List.of(InformationSchemaRow.of("x", "YES"))))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessageContaining("INDEXES.IS_UNIQUE");
  }

  @Test
  void columnIndex_looksUpDialectNames() {
    InformationSchemaTable table = table();

    assertThat(table.columnIndex("is_unique")).hasValue(1);
    assertThat(table.columnIndex("IS_UNIQUE")).isEmpty();
    assertThat(table.canonicalColumnIndex("IS_UNIQUE")).isEqualTo(1);
  }

  @Test
  void value_readsByCanonicalColumn() {
    InformationSchemaRow row = InformationSchemaRow.of("SingersByName", null);

    assertThat(table().value(row, "INDEX_NAME")).isEqualTo("SingersByName");
    assertThat(table().value(row, "IS_UNIQUE")).isNull();
  }

  @Test
  void constructor_rejectsDuplicateCanonicalColumns() {
    assertThatThrownBy(
            () ->
                new InformationSchemaTable(
                    "t",
                    "T",
                    List.of(
                        new ColumnDef("a", "A", InformationSchemaType.STRING, true),
                        new ColumnDef("a2", "A", InformationSchemaType.STRING, true))))
        .isInstanceOf(InformationSchemaInvariantException.class)
        .hasMessage("Duplicate column: T.A");
  }

  @Test
  void row_copiesItsValues() {
    Object[] values = {"a", 1L};
    InformationSchemaRow row = InformationSchemaRow.of(values);
    values[0] = "b";

    assertThat(row.values()).containsExactly("a", 1L);
    assertThat(row).isEqualTo(InformationSchemaRow.of("a", 1L));
    assertThatThrownBy(() -> row.values().set(0, "c"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
