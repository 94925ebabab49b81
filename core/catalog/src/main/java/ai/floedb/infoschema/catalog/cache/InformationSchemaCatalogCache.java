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

import ai.floedb.infoschema.catalog.InformationSchemaCatalog;
import ai.floedb.infoschema.catalog.config.InformationSchemaConfig;
import ai.floedb.infoschema.schema.model.DatabaseDialect;
import ai.floedb.infoschema.schema.model.Schema;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Keeps built catalogs per schema version and dialect.
 *
 * <p>Catalogs are immutable, so a cached one is handed out as is. A new schema version always
 * builds a new catalog; older versions age out by size and idle time. A build that fails is not
 * cached. Unversioned schemas cannot be told apart by key and are built on every call, as are all
 * schemas when caching is disabled.
 */
public class InformationSchemaCatalogCache {

  private static final Logger LOG = Logger.getLogger(InformationSchemaCatalogCache.class);

  record Key(long schemaVersion, DatabaseDialect dialect) {}

  private final boolean cacheEnabled;
  private final String catalogName;
  private final Cache<Key, InformationSchemaCatalog> cache;

  public InformationSchemaCatalogCache(InformationSchemaConfig config) {
    this(
        config.cache().enabled(),
        config.cache().maxEntries(),
        config.cache().expireAfterAccess(),
        config.catalogName().orElse(""));
  }

  public InformationSchemaCatalogCache(
      boolean cacheEnabled, long maxEntries, Duration expireAfterAccess, String catalogName) {
    this.cacheEnabled = cacheEnabled;
    this.catalogName = Objects.requireNonNull(catalogName, "catalogName");
    Objects.requireNonNull(expireAfterAccess, "expireAfterAccess");
    this.cache =
        cacheEnabled
            ? Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterAccess(expireAfterAccess)
                .build()
            : null;
    LOG.infof(
        "Information schema catalog cache enabled=%s maxEntries=%d expireAfterAccess=%s",
        cacheEnabled, maxEntries, expireAfterAccess);
  }

  /** Catalog for the schema's own dialect. */
  public InformationSchemaCatalog get(Schema schema) {
    return get(schema, schema.dialect());
  }

  /**
   * Cached catalog for {@code (schema.version(), dialect)}, built on a miss.
   *
   * <p>Callers must bump the schema version whenever the schema changes; entries are keyed by
   * version only. A schema without a version is built and never cached.
   */
  public InformationSchemaCatalog get(Schema schema, DatabaseDialect dialect) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(dialect, "dialect");
    if (!cacheEnabled) {
      return build(schema, dialect);
    }
    if (!schema.isVersioned()) {
      LOG.debugf("Schema has no version, bypassing catalog cache dialect=%s", dialect);
      return build(schema, dialect);
    }
    return cache.get(new Key(schema.version(), dialect), key -> build(schema, dialect));
  }

  /** Drops every cached catalog. */
  public void invalidateAll() {
    if (cacheEnabled) {
      cache.invalidateAll();
    }
  }

  /** Approximate number of cached catalogs; zero when caching is disabled. */
  public long estimatedSize() {
    if (!cacheEnabled) {
      return 0L;
    }
    cache.cleanUp();
    return cache.estimatedSize();
  }

  public boolean isEnabled() {
    return cacheEnabled;
  }

  InformationSchemaCatalog build(Schema schema, DatabaseDialect dialect) {
    LOG.debugf(
        "Building information schema catalog version=%d dialect=%s", schema.version(), dialect);
    return new InformationSchemaCatalog(dialect, schema, catalogName);
  }
}
