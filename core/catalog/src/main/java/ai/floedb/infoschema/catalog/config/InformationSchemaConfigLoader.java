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

package ai.floedb.infoschema.catalog.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Builds {@link InformationSchemaConfig} outside a container.
 *
 * <p>Sources are the SmallRye defaults (system properties, environment, {@code
 * META-INF/microprofile-config.properties}) plus optional overrides that take precedence over all
 * of them.
 */
public final class InformationSchemaConfigLoader {

  private static final Logger LOG = Logger.getLogger(InformationSchemaConfigLoader.class);

  static final String OVERRIDES_SOURCE = "infoschema-overrides";
  static final int OVERRIDES_ORDINAL = 1000;

  private InformationSchemaConfigLoader() {}

  public static InformationSchemaConfig load() {
    return load(Map.of());
  }

  public static InformationSchemaConfig load(Map<String, String> overrides) {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withSources(new PropertiesConfigSource(overrides, OVERRIDES_SOURCE, OVERRIDES_ORDINAL))
            .withMapping(InformationSchemaConfig.class)
            .build();
    InformationSchemaConfig mapping = config.getConfigMapping(InformationSchemaConfig.class);
    LOG.debugf(
        "Information schema config catalogName='%s' cache.enabled=%s cache.maxEntries=%d"
            + " cache.expireAfterAccess=%s",
        mapping.catalogName().orElse(""),
        mapping.cache().enabled(),
        mapping.cache().maxEntries(),
        mapping.cache().expireAfterAccess());
    return mapping;
  }
}
