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

import ai.floedb.infoschema.schema.model.ForeignKey;
import java.util.HashSet;
import java.util.Set;

/**
 * Decides which foreign key emits the UNIQUE constraint of a backing index.
 *
 * <p>Several foreign keys may share one backing index; its constraint is reported once, for the
 * first of them in schema order. Foreign keys backed by a primary key never emit one. A tracker
 * is used for a single scan.
 */
final class BackingIndexTracker {

  private final Set<String> seen = new HashSet<>();

  /** True when {@code foreignKey} is the first to use its backing index in this scan. */
  boolean emitsBackingConstraint(ForeignKey foreignKey) {
    return foreignKey
        .referencedIndex()
        .map(index -> seen.add(foreignKey.referencedTable() + "\u0000" + index))
        .orElse(false);
  }
}
