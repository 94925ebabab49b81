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

package ai.floedb.infoschema.catalog;

/**
 * Stages of an information schema catalog build, in the order they run.
 *
 * <p>Tables that describe the introspection tables themselves can only be filled once every
 * table has been declared; {@link #POPULATE_SELF_DESCRIBING} is the only stage allowed to list
 * them.
 */
public enum BuildPhase {
  /** Every introspection table is created, empty, in declaration order. */
  DECLARE,
  /** Tables whose rows only describe the user schema are filled. */
  POPULATE_SCHEMA_TABLES,
  /** Tables that also describe the introspection tables are filled. */
  POPULATE_SELF_DESCRIBING,
  /** The catalog is complete and read-only. */
  SEALED
}
