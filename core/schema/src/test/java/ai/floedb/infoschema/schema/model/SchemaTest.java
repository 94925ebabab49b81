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

package ai.floedb.infoschema.schema.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.infoschema.types.ColumnType;
import ai.floedb.infoschema.types.Limits;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchemaTest {

  private static Table.Builder singers() {
    return Table.builder("Singers")
        .column(Column.builder("SingerId", "INT64").notNull())
        .column(Column.builder("Name", "STRING(100)"))
        .primaryKey("SingerId");
  }

  @Test
  void builder_keepsDeclarationOrder() {
    Schema schema =
        Schema.builder()
            .version(3)
            .table(singers())
            .table(
                Table.builder("Albums")
                    .column(Column.builder("SingerId", "INT64").notNull())
                    .column(Column.builder("AlbumId", "INT64").notNull())
                    .primaryKey("SingerId", "AlbumId")
                    .interleaveIn("Singers", OnDeleteAction.CASCADE))
            .view(
                new View(
                    "SingerNames",
                    "SELECT Name FROM Singers",
                    List.of(new ViewColumn("Name", ColumnType.string()))))
            .build();

    assertThat(schema.version()).isEqualTo(3);
    assertThat(schema.dialect()).isEqualTo(DatabaseDialect.GOOGLE_STANDARD_SQL);
    assertThat(schema.tables()).extracting(Table::name).containsExactly("Singers", "Albums");
    assertThat(schema.views()).extracting(View::name).containsExactly("SingerNames");
    assertThat(schema.requireTable("Albums").isInterleaved()).isTrue();
  }

  @Test
  void column_builderParsesDdlLength() {
    Column name = Column.builder("Name", "STRING(100)").build();

    assertThat(name.declaredMaxLength()).contains(100L);
    assertThat(name.nullable()).isTrue();
    assertThat(Column.builder("Blob", "BYTES(MAX)").build().declaredMaxLength()).isEmpty();
  }

  @Test
  void column_acceptsLengthsUpToTheLimit() {
    Column widest =
        Column.builder("Doc", ColumnType.string())
            .maxLength(Limits.MAX_STRING_COLUMN_LENGTH)
            .build();
    Column blobs = Column.builder("Blobs", "ARRAY<BYTES(16)>").build();

    assertThat(widest.declaredMaxLength()).contains(Limits.MAX_STRING_COLUMN_LENGTH);
    assertThat(blobs.declaredMaxLength()).contains(16L);
  }

  @Test
  void column_rejectsLengthOutsideLimits() {
    assertThatThrownBy(
            () ->
                Column.builder("Doc", ColumnType.string())
                    .maxLength(Limits.MAX_STRING_COLUMN_LENGTH + 1)
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Column Doc length 2621441 is outside 1..2621440");
    assertThatThrownBy(() -> Column.builder("Blob", "BYTES(0)").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("outside 1..10485760");
  }

  @Test
  void column_rejectsLengthOnTypeWithoutOne() {
    assertThatThrownBy(() -> Column.builder("Id", ColumnType.int64()).maxLength(8).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Column Id: INT64 does not accept a length");
  }

  @Test
  void column_rejectsDefaultOnGeneratedColumn() {
    assertThatThrownBy(
            () ->
                Column.builder("Full", "STRING(MAX)")
                    .generatedAs("(First || Last)", true, List.of("First", "Last"))
                    .defaultValue("'x'")
                    .build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsDuplicateTables() {
    assertThatThrownBy(() -> Schema.builder().table(singers()).table(singers()).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("duplicate table: Singers");
  }

  @Test
  void rejectsUnknownPrimaryKeyColumn() {
    Table.Builder broken =
        Table.builder("T").column(Column.builder("a", "INT64")).primaryKey("missing");

    assertThatThrownBy(() -> Schema.builder().table(broken).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("T.missing");
  }

  @Test
  void rejectsForeignKeyToUnknownIndex() {
    Table.Builder albums =
        Table.builder("Albums")
            .column(Column.builder("AlbumId", "INT64"))
            .column(Column.builder("SingerId", "INT64"))
            .primaryKey("AlbumId")
            .foreignKey(
                ForeignKey.onIndex(
                    "FK_AlbumSinger", List.of("SingerId"), "Singers", List.of("SingerId"), "Nope"));

    assertThatThrownBy(() -> Schema.builder().table(singers()).table(albums).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unknown index Singers.Nope");
  }

  @Test
  void rejectsForeignKeyToUnknownTable() {
    Table.Builder albums =
        Table.builder("Albums")
            .column(Column.builder("SingerId", "INT64"))
            .primaryKey("SingerId")
            .foreignKey(
                ForeignKey.onPrimaryKey(
                    "FK_AlbumSinger", List.of("SingerId"), "Nobody", List.of("SingerId")));

    assertThatThrownBy(() -> Schema.builder().table(albums).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unknown table Nobody");
  }

  @Test
  void foreignKey_rejectsMismatchedColumnCounts() {
    assertThatThrownBy(
            () -> ForeignKey.onPrimaryKey("FK", List.of("a", "b"), "T", List.of("a")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsViewNamedLikeTable() {
    View clash = new View("Singers", "SELECT 1", List.of());

    assertThatThrownBy(() -> Schema.builder().table(singers()).view(clash).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("clashes");
  }

  @Test
  void version_defaultsToUnversioned() {
    Schema unversioned = Schema.builder().table(singers()).build();

    assertThat(unversioned.version()).isEqualTo(Schema.UNVERSIONED);
    assertThat(unversioned.isVersioned()).isFalse();
    assertThat(Schema.empty(DatabaseDialect.POSTGRESQL).isVersioned()).isFalse();
    assertThat(Schema.builder().version(4).build().isVersioned()).isTrue();
  }

  @Test
  void rejectsNegativeVersion() {
    assertThatThrownBy(() -> Schema.builder().version(-1).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative version: -1");
  }

  @Test
  void rejectsCheckNamedLikeNotNullConstraint() {
    Table.Builder singers =
        singers().check("CK_IS_NOT_NULL_Singers_Name", "Name IS NOT NULL", "Name");

    assertThatThrownBy(() -> Schema.builder().table(singers).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("reserved prefix CK_IS_NOT_NULL_");
  }

  @Test
  void rejectsConstraintNamedLikePrimaryKey() {
    Table.Builder albums =
        Table.builder("Albums")
            .column(Column.builder("AlbumId", "INT64"))
            .column(Column.builder("SingerId", "INT64"))
            .primaryKey("AlbumId")
            .foreignKey(
                ForeignKey.onPrimaryKey(
                    "PK_Singers", List.of("SingerId"), "Singers", List.of("SingerId")));

    assertThatThrownBy(() -> Schema.builder().table(singers()).table(albums).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("foreign key PK_Singers clashes with a primary key constraint");
  }

  @Test
  void acceptsPrimaryKeyPrefixWithoutMatchingTable() {
    Table.Builder singers = singers().check("PK_Positive", "SingerId > 0", "SingerId");

    assertThat(Schema.builder().table(singers).build().requireTable("Singers").checkConstraints())
        .extracting(CheckConstraint::name)
        .containsExactly("PK_Positive");
  }

  @Test
  void rejectsDuplicateConstraintNames() {
    Table.Builder singers =
        singers().check("Positive", "SingerId > 0", "SingerId").check("Positive", "1 = 1");

    assertThatThrownBy(() -> Schema.builder().table(singers).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("duplicate constraint: Positive");
  }

  @Test
  void rowDeletionPolicy_rendersDdl() {
    assertThat(new RowDeletionPolicy("CreatedAt", 7).toDdl())
        .isEqualTo("OLDER_THAN(CreatedAt, INTERVAL 7 DAY)");
  }
}
