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

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.*;
import static ai.floedb.infoschema.catalog.testsupport.CatalogRows.rows;
import static ai.floedb.infoschema.catalog.testsupport.CatalogRows.rowsWhere;
import static ai.floedb.infoschema.catalog.testsupport.CatalogRows.select;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.floedb.infoschema.catalog.InformationSchemaCatalog;
import ai.floedb.infoschema.catalog.testsupport.TestSchemas;
import ai.floedb.infoschema.schema.model.DatabaseDialect;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Constraint tables over the music schema.
 *
 * <p>Concerts and Tickets both reference Singers through the unique index SingersByName; Concerts
 * also references the Singers primary key.
 */
class ConstraintScannersTest {

  private static final InformationSchemaCatalog GSQL =
      InformationSchemaCatalog.of(TestSchemas.music(DatabaseDialect.GOOGLE_STANDARD_SQL));
  private static final InformationSchemaCatalog PG =
      InformationSchemaCatalog.of(TestSchemas.music(DatabaseDialect.POSTGRESQL));

  private static List<Map<String, Object>> userRows(
      InformationSchemaCatalog catalog, String table, String schemaColumn) {
    return rowsWhere(catalog, table, schemaColumn, "");
  }

  @Test
  void checkConstraints_listNotNullThenDeclaredChecksPerTable() {
    assertThat(
            select(
                userRows(GSQL, CHECK_CONSTRAINTS, CONSTRAINT_SCHEMA),
                CONSTRAINT_NAME,
                CHECK_CLAUSE,
                SPANNER_STATE))
        .containsExactly(
            tuple("CK_IS_NOT_NULL_Singers_SingerId", "SingerId IS NOT NULL", COMMITTED),
            tuple("CK_IS_NOT_NULL_Singers_LastName", "LastName IS NOT NULL", COMMITTED),
            tuple("ScoreNotNegative", "Score >= 0", COMMITTED),
            tuple("CK_IS_NOT_NULL_Albums_SingerId", "SingerId IS NOT NULL", COMMITTED),
            tuple("CK_IS_NOT_NULL_Albums_AlbumId", "AlbumId IS NOT NULL", COMMITTED),
            tuple("CK_IS_NOT_NULL_Concerts_ConcertId", "ConcertId IS NOT NULL", COMMITTED),
            tuple("CK_IS_NOT_NULL_Tickets_TicketId", "TicketId IS NOT NULL", COMMITTED));
  }

  @Test
  void checkConstraints_describeIntrospectionNotNullColumns() {
    assertThat(
            select(
                rowsWhere(
                    GSQL, CHECK_CONSTRAINTS, CONSTRAINT_NAME, "CK_IS_NOT_NULL_TABLES_TABLE_NAME"),
                CONSTRAINT_SCHEMA,
                CHECK_CLAUSE))
        .containsExactly(tuple("INFORMATION_SCHEMA", "TABLE_NAME IS NOT NULL"));
    assertThat(
            select(
                rowsWhere(
                    PG, CHECK_CONSTRAINTS, CONSTRAINT_NAME, "CK_IS_NOT_NULL_tables_table_name"),
                CONSTRAINT_SCHEMA,
                CHECK_CLAUSE))
        .containsExactly(tuple("information_schema", "table_name IS NOT NULL"));
  }

  @Test
  void tableConstraints_listUserConstraintsInDeclarationOrder() {
    assertThat(
            select(
                userRows(GSQL, TABLE_CONSTRAINTS, CONSTRAINT_SCHEMA),
                TABLE_NAME,
                CONSTRAINT_NAME,
                CONSTRAINT_TYPE))
        .containsExactly(
            tuple("Singers", "PK_Singers", PRIMARY_KEY),
            tuple("Singers", "CK_IS_NOT_NULL_Singers_SingerId", CHECK),
            tuple("Singers", "CK_IS_NOT_NULL_Singers_LastName", CHECK),
            tuple("Singers", "ScoreNotNegative", CHECK),
            tuple("Albums", "PK_Albums", PRIMARY_KEY),
            tuple("Albums", "CK_IS_NOT_NULL_Albums_SingerId", CHECK),
            tuple("Albums", "CK_IS_NOT_NULL_Albums_AlbumId", CHECK),
            tuple("Concerts", "PK_Concerts", PRIMARY_KEY),
            tuple("Concerts", "CK_IS_NOT_NULL_Concerts_ConcertId", CHECK),
            tuple("Concerts", "FK_ConcertSinger", FOREIGN_KEY),
            tuple("Concerts", "FK_ConcertSingerName", FOREIGN_KEY),
            tuple("Singers", "SingersByName", UNIQUE),
            tuple("Tickets", "PK_Tickets", PRIMARY_KEY),
            tuple("Tickets", "CK_IS_NOT_NULL_Tickets_TicketId", CHECK),
            tuple("Tickets", "FK_TicketSingerName", FOREIGN_KEY),
            tuple("Logs", "PK_Logs", PRIMARY_KEY));
  }

  @Test
  void tableConstraints_areNotDeferrableAndEnforced() {
    assertThat(
            select(rows(PG, TABLE_CONSTRAINTS), IS_DEFERRABLE, INITIALLY_DEFERRED, ENFORCED))
        .containsOnly(tuple(NO, NO, YES));
  }

  @Test
  void tableConstraints_describeIntrospectionTables() {
    assertThat(
            select(
                rowsWhere(PG, TABLE_CONSTRAINTS, TABLE_NAME, "schemata"),
                CONSTRAINT_SCHEMA,
                CONSTRAINT_NAME,
                CONSTRAINT_TYPE))
        .containsExactly(
            tuple("information_schema", "PK_schemata", PRIMARY_KEY),
            tuple("information_schema", "CK_IS_NOT_NULL_schemata_catalog_name", CHECK),
            tuple("information_schema", "CK_IS_NOT_NULL_schemata_schema_name", CHECK));
  }

  @Test
  void constraintTableUsage_pointsForeignKeysAtReferencedTable() {
    List<Map<String, Object>> rows = userRows(GSQL, CONSTRAINT_TABLE_USAGE, TABLE_SCHEMA);

    assertThat(
            select(
                rowsWhere(GSQL, CONSTRAINT_TABLE_USAGE, TABLE_NAME, "Concerts"), CONSTRAINT_NAME))
        .containsExactly(tuple("PK_Concerts"), tuple("CK_IS_NOT_NULL_Concerts_ConcertId"));
    assertThat(select(rows, TABLE_NAME, CONSTRAINT_NAME))
        .contains(
            tuple("Singers", "FK_ConcertSinger"),
            tuple("Singers", "FK_ConcertSingerName"),
            tuple("Singers", "SingersByName"),
            tuple("Singers", "FK_TicketSingerName"))
        .doesNotHaveDuplicates();
  }

  @Test
  void referentialConstraints_resolveBackingUniqueConstraint() {
    assertThat(
            select(
                rows(GSQL, REFERENTIAL_CONSTRAINTS),
                CONSTRAINT_NAME,
                UNIQUE_CONSTRAINT_SCHEMA,
                UNIQUE_CONSTRAINT_NAME,
                MATCH_OPTION,
                UPDATE_RULE,
                DELETE_RULE,
                SPANNER_STATE))
        .containsExactly(
            tuple("FK_ConcertSinger", "", "PK_Singers", SIMPLE, NO_ACTION, NO_ACTION, COMMITTED),
            tuple(
                "FK_ConcertSingerName",
                "",
                "SingersByName",
                SIMPLE,
                NO_ACTION,
                NO_ACTION,
                COMMITTED),
            tuple(
                "FK_TicketSingerName",
                "",
                "SingersByName",
                SIMPLE,
                NO_ACTION,
                NO_ACTION,
                COMMITTED));
  }

  @Test
  void keyColumnUsage_pairsForeignKeyPositions() {
    assertThat(
            select(
                userRows(GSQL, KEY_COLUMN_USAGE, CONSTRAINT_SCHEMA),
                CONSTRAINT_NAME,
                TABLE_NAME,
                COLUMN_NAME,
                ORDINAL_POSITION,
                POSITION_IN_UNIQUE_CONSTRAINT))
        .containsExactly(
            tuple("PK_Singers", "Singers", "SingerId", 1L, null),
            tuple("PK_Albums", "Albums", "SingerId", 1L, null),
            tuple("PK_Albums", "Albums", "AlbumId", 2L, null),
            tuple("PK_Concerts", "Concerts", "ConcertId", 1L, null),
            tuple("FK_ConcertSinger", "Concerts", "SingerId", 1L, 1L),
            tuple("FK_ConcertSingerName", "Concerts", "First", 1L, 1L),
            tuple("FK_ConcertSingerName", "Concerts", "Last", 2L, 2L),
            tuple("SingersByName", "Singers", "FirstName", 1L, null),
            tuple("SingersByName", "Singers", "LastName", 2L, null),
            tuple("PK_Tickets", "Tickets", "TicketId", 1L, null),
            tuple("FK_TicketSingerName", "Tickets", "First", 1L, 1L),
            tuple("FK_TicketSingerName", "Tickets", "Last", 2L, 2L));
  }

  @Test
  void keyColumnUsage_describesIntrospectionPrimaryKeys() {
    assertThat(
            select(
                rowsWhere(PG, KEY_COLUMN_USAGE, CONSTRAINT_NAME, "PK_views"),
                CONSTRAINT_SCHEMA,
                TABLE_NAME,
                COLUMN_NAME,
                ORDINAL_POSITION,
                POSITION_IN_UNIQUE_CONSTRAINT))
        .containsExactly(
            tuple("information_schema", "views", "table_catalog", 1L, null),
            tuple("information_schema", "views", "table_schema", 2L, null),
            tuple("information_schema", "views", "table_name", 3L, null));
  }

  @Test
  void constraintColumnUsage_reportsReferencedAndBackingColumns() {
    assertThat(
            select(
                userRows(GSQL, CONSTRAINT_COLUMN_USAGE, TABLE_SCHEMA),
                TABLE_NAME,
                COLUMN_NAME,
                CONSTRAINT_NAME))
        .containsExactly(
            tuple("Singers", "SingerId", "PK_Singers"),
            tuple("Singers", "SingerId", "CK_IS_NOT_NULL_Singers_SingerId"),
            tuple("Singers", "LastName", "CK_IS_NOT_NULL_Singers_LastName"),
            tuple("Singers", "Score", "ScoreNotNegative"),
            tuple("Albums", "SingerId", "PK_Albums"),
            tuple("Albums", "AlbumId", "PK_Albums"),
            tuple("Albums", "SingerId", "CK_IS_NOT_NULL_Albums_SingerId"),
            tuple("Albums", "AlbumId", "CK_IS_NOT_NULL_Albums_AlbumId"),
            tuple("Concerts", "ConcertId", "PK_Concerts"),
            tuple("Concerts", "ConcertId", "CK_IS_NOT_NULL_Concerts_ConcertId"),
            tuple("Singers", "SingerId", "FK_ConcertSinger"),
            tuple("Singers", "FirstName", "FK_ConcertSingerName"),
            tuple("Singers", "LastName", "FK_ConcertSingerName"),
            tuple("Singers", "FirstName", "SingersByName"),
            tuple("Singers", "LastName", "SingersByName"),
            tuple("Tickets", "TicketId", "PK_Tickets"),
            tuple("Tickets", "TicketId", "CK_IS_NOT_NULL_Tickets_TicketId"),
            tuple("Singers", "FirstName", "FK_TicketSingerName"),
            tuple("Singers", "LastName", "FK_TicketSingerName"));
  }

  @Test
  void constraintColumnUsage_listsIntrospectionPrimaryKeysBeforeNotNullChecks() {
    List<Object> names =
        rowsWhere(GSQL, CONSTRAINT_COLUMN_USAGE, TABLE_SCHEMA, "INFORMATION_SCHEMA").stream()
            .map(r -> r.get(CONSTRAINT_NAME))
            .toList();
    int lastPrimaryKey = 0;
    int firstNotNull = Integer.MAX_VALUE;
    for (int i = 0; i < names.size(); i++) {
      String name = (String) names.get(i);
      if (name.startsWith("PK_")) {
        lastPrimaryKey = i;
      } else {
        firstNotNull = Math.min(firstNotNull, i);
      }
    }

    assertThat(names).first().isEqualTo("PK_SCHEMATA");
    assertThat(lastPrimaryKey).isLessThan(firstNotNull);
  }
}
