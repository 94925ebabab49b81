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

import java.util.Objects;

/** Time-to-live policy deleting rows whose timestamp column is older than a number of days. */
public record RowDeletionPolicy(String columnName, long olderThanDays) {

  public RowDeletionPolicy {
    columnName = Objects.requireNonNull(columnName, "columnName");
    if (olderThanDays < 0) {
      throw new IllegalArgumentException("olderThanDays must be >= 0: " + olderThanDays);
    }
  }

  /** DDL spelling, e.g. {@code OLDER_THAN(CreatedAt, INTERVAL 7 DAY)}. */
  public String toDdl() {
    return "OLDER_THAN(" + columnName + ", INTERVAL " + olderThanDays + " DAY)";
  }
}
