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

package ai.floedb.infoschema.catalog.cache;

import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLES;
import static ai.floedb.infoschema.catalog.registry.InformationSchemaNames.TABLE_NAME;
import static ai.floedb.infoschema.catalog.testsupport.CatalogRows.rowsWhere;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.infoschema.catalog.InformationSchemaCatalog;
import ai.floedb.infoschema.catalog.config.InformationSchemaConfigLoader;
import ai.floedb.infoschema.catalog.testsupport.TestSchemas;
import ai.floedb.infoschema.schema.model.DatabaseDialect;
import ai.floedb.infoschema.schema.model.Column;
import ai.floedb.infoschema.schema.model.Schema;
import ai.floedb.infoschema.schema.model.Table;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InformationSchemaCatalogCacheTest {

  private static InformationSchemaCatalogCache enabled() {
    return new InformationSchemaCatalogCache(true, 8, Duration.ofMinutes(15), "");
  }

  @Test
  void get_sameVersionAndDialect_returnsCachedCatalog() {
    InformationSchemaCatalogCache cache = enabled();
    Schema schema = TestSchemas.music();

    InformationSchemaCatalog first = cache.get(schema);
    InformationSchemaCatalog second = cache.get(TestSchemas.music());

    assertThat(second).isSameAs(first);
    assertThat(cache.estimatedSize()).isEqualTo(1L);
  }

  @Test
  void get_otherVersionOrDialect_buildsNewCatalog() {
    InformationSchemaCatalogCache cache = enabled();

    InformationSchemaCatalog music = cache.get(TestSchemas.music());
    InformationSchemaCatalog users = cache.get(TestSchemas.users());
    InformationSchemaCatalog musicPg =
        cache.get(TestSchemas.music(), DatabaseDialect.POSTGRESQL);

    assertThat(users).isNotSameAs(music);
    assertThat(musicPg).isNotSameAs(music);
    assertThat(musicPg.dialect()).isEqualTo(DatabaseDialect.POSTGRESQL);
    assertThat(music.schemaVersion()).isEqualTo(7L);
    assertThat(users.schemaVersion()).isEqualTo(1L);
    assertThat(cache.estimatedSize()).isEqualTo(3L);
  }

  @Test
  void get_unversionedSchemas_areNeverShared() {
    InformationSchemaCatalogCache cache = enabled();
    Schema a = unversioned("A");
    Schema b = unversioned("B");

    InformationSchemaCatalog forA = cache.get(a);
    InformationSchemaCatalog forB = cache.get(b);

    assertThat(forB).isNotSameAs(forA);
    assertThat(cache.get(a)).isNotSameAs(forA);
    assertThat(cache.estimatedSize()).isZero();
    assertThat(rowsWhere(forA, TABLES, TABLE_NAME, "A")).hasSize(1);
    assertThat(rowsWhere(forB, TABLES, TABLE_NAME, "A")).isEmpty();
    assertThat(rowsWhere(forB, TABLES, TABLE_NAME, "B")).hasSize(1);
  }

  private static Schema unversioned(String tableName) {
    return Schema.builder()
        .table(
            Table.builder(tableName)
                .column(Column.builder("Id", "INT64").notNull())
                .primaryKey("Id"))
        .build();
  }

  @Test
  void get_disabled_buildsEveryTime() {
    InformationSchemaCatalogCache cache =
        new InformationSchemaCatalogCache(false, 8, Duration.ofMinutes(15), "");

    InformationSchemaCatalog first = cache.get(TestSchemas.users());
    InformationSchemaCatalog second = cache.get(TestSchemas.users());

    assertThat(cache.isEnabled()).isFalse();
    assertThat(second).isNotSameAs(first);
    assertThat(cache.estimatedSize()).isZero();
  }

  @Test
  void invalidateAll_dropsEntries() {
    InformationSchemaCatalogCache cache = enabled();
    InformationSchemaCatalog first = cache.get(TestSchemas.users());

    cache.invalidateAll();

    assertThat(cache.estimatedSize()).isZero();
    assertThat(cache.get(TestSchemas.users())).isNotSameAs(first);
  }

  @Test
  void fromConfig_usesConfiguredCatalogName() {
    InformationSchemaCatalogCache cache =
        new InformationSchemaCatalogCache(
            InformationSchemaConfigLoader.load(Map.of("infoschema.catalog-name", "prod")));

    assertThat(cache.isEnabled()).isTrue();
    assertThat(cache.get(TestSchemas.users()).catalogName()).isEqualTo("prod");
  }

  @Test
  void get_failedBuildIsNotCached() {
    AtomicInteger builds = new AtomicInteger();
    InformationSchemaCatalogCache cache =
        new InformationSchemaCatalogCache(true, 8, Duration.ofMinutes(15), "") {
          @Override
          InformationSchemaCatalog build(Schema schema, DatabaseDialect dialect) {
            if (builds.incrementAndGet() == 1) {
              throw new IllegalStateException("boom");
            }
            return super.build(schema, dialect);
          }
        };

    assertThatThrownBy(() -> cache.get(TestSchemas.users()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");
    assertThat(cache.estimatedSize()).isZero();

    InformationSchemaCatalog catalog = cache.get(TestSchemas.users());

    assertThat(catalog.tables()).isNotEmpty();
    assertThat(builds).hasValue(2);
    assertThat(cache.get(TestSchemas.users())).isSameAs(catalog);
  }

  @Test
  void get_rejectsNulls() {
    InformationSchemaCatalogCache cache = enabled();

    assertThatThrownBy(() -> cache.get(null)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> cache.get(TestSchemas.users(), null))
        .isInstanceOf(NullPointerException.class);
  }
}
