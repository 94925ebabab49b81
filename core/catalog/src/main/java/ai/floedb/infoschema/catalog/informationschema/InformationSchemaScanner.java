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

import ai.floedb.infoschema.catalog.BuildPhase;
import ai.floedb.infoschema.catalog.table.ColumnDecl;
import ai.floedb.infoschema.catalog.table.InformationSchemaRow;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/** Produces the rows of one introspection table. */
public interface InformationSchemaScanner {

  /** Canonical name of the table this scanner fills. */
  String tableName();

  /**
   * Hand-written column list of the table. Must be empty exactly when {@link
   * ai.floedb.infoschema.catalog.registry.ColumnsMetadata#isRegistryTable} holds for the table,
   * whose shape then comes from the registry.
   */
  default Optional<List<ColumnDecl>> declaredColumns() {
    return Optional.empty();
  }

  /**
   * Phase in which the table is filled. Scanners whose rows describe introspection tables must
   * run in {@link BuildPhase#POPULATE_SELF_DESCRIBING}, the default.
   */
  default BuildPhase populatePhase() {
    return BuildPhase.POPULATE_SELF_DESCRIBING;
  }

  /** Rows of the table, in output order. */
  Stream<InformationSchemaRow> scan(ScanContext ctx);
}
