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

package ai.floedb.infoschema.catalog.registry;

/**
 * Canonical (upper-case) names of the information schema, its tables and their columns.
 *
 * <p>Every identifier the catalog emits for an introspection object starts from one of these
 * constants and is then passed through the dialect adapter. Row builders only accept these
 * canonical spellings as column keys.
 */
public final class InformationSchemaNames {

  private InformationSchemaNames() {}

  public static final String INFORMATION_SCHEMA = "INFORMATION_SCHEMA";

  // Tables
  public static final String SCHEMATA = "SCHEMATA";
  public static final String DATABASE_OPTIONS = "DATABASE_OPTIONS";
  public static final String SPANNER_STATISTICS = "SPANNER_STATISTICS";
  public static final String TABLES = "TABLES";
  public static final String COLUMNS = "COLUMNS";
  public static final String COLUMN_COLUMN_USAGE = "COLUMN_COLUMN_USAGE";
  public static final String VIEWS = "VIEWS";
  public static final String INDEXES = "INDEXES";
  public static final String INDEX_COLUMNS = "INDEX_COLUMNS";
  public static final String COLUMN_OPTIONS = "COLUMN_OPTIONS";
  public static final String CHECK_CONSTRAINTS = "CHECK_CONSTRAINTS";
  public static final String TABLE_CONSTRAINTS = "TABLE_CONSTRAINTS";
  public static final String CONSTRAINT_TABLE_USAGE = "CONSTRAINT_TABLE_USAGE";
  public static final String REFERENTIAL_CONSTRAINTS = "REFERENTIAL_CONSTRAINTS";
  public static final String KEY_COLUMN_USAGE = "KEY_COLUMN_USAGE";
  public static final String CONSTRAINT_COLUMN_USAGE = "CONSTRAINT_COLUMN_USAGE";

  // Columns
  public static final String CATALOG_NAME = "CATALOG_NAME";
  public static final String SCHEMA_NAME = "SCHEMA_NAME";
  public static final String EFFECTIVE_TIMESTAMP = "EFFECTIVE_TIMESTAMP";
  public static final String OPTION_NAME = "OPTION_NAME";
  public static final String OPTION_TYPE = "OPTION_TYPE";
  public static final String OPTION_VALUE = "OPTION_VALUE";
  public static final String PACKAGE_NAME = "PACKAGE_NAME";
  public static final String ALLOW_GC = "ALLOW_GC";
  public static final String TABLE_CATALOG = "TABLE_CATALOG";
  public static final String TABLE_SCHEMA = "TABLE_SCHEMA";
  public static final String TABLE_NAME = "TABLE_NAME";
  public static final String TABLE_TYPE = "TABLE_TYPE";
  public static final String PARENT_TABLE_NAME = "PARENT_TABLE_NAME";
  public static final String ON_DELETE_ACTION = "ON_DELETE_ACTION";
  public static final String SPANNER_STATE = "SPANNER_STATE";
  public static final String INTERLEAVE_TYPE = "INTERLEAVE_TYPE";
  public static final String ROW_DELETION_POLICY_EXPRESSION = "ROW_DELETION_POLICY_EXPRESSION";
  public static final String COLUMN_NAME = "COLUMN_NAME";
  public static final String ORDINAL_POSITION = "ORDINAL_POSITION";
  public static final String COLUMN_DEFAULT = "COLUMN_DEFAULT";
  public static final String DATA_TYPE = "DATA_TYPE";
  public static final String IS_NULLABLE = "IS_NULLABLE";
  public static final String SPANNER_TYPE = "SPANNER_TYPE";
  public static final String IS_GENERATED = "IS_GENERATED";
  public static final String GENERATION_EXPRESSION = "GENERATION_EXPRESSION";
  public static final String IS_STORED = "IS_STORED";
  public static final String CHARACTER_MAXIMUM_LENGTH = "CHARACTER_MAXIMUM_LENGTH";
  public static final String NUMERIC_PRECISION = "NUMERIC_PRECISION";
  public static final String NUMERIC_PRECISION_RADIX = "NUMERIC_PRECISION_RADIX";
  public static final String NUMERIC_SCALE = "NUMERIC_SCALE";
  public static final String DEPENDENT_COLUMN = "DEPENDENT_COLUMN";
  public static final String VIEW_DEFINITION = "VIEW_DEFINITION";
  public static final String SECURITY_TYPE = "SECURITY_TYPE";
  public static final String INDEX_NAME = "INDEX_NAME";
  public static final String INDEX_TYPE = "INDEX_TYPE";
  public static final String IS_UNIQUE = "IS_UNIQUE";
  public static final String IS_NULL_FILTERED = "IS_NULL_FILTERED";
  public static final String INDEX_STATE = "INDEX_STATE";
  public static final String SPANNER_IS_MANAGED = "SPANNER_IS_MANAGED";
  public static final String COLUMN_ORDERING = "COLUMN_ORDERING";
  public static final String CONSTRAINT_CATALOG = "CONSTRAINT_CATALOG";
  public static final String CONSTRAINT_SCHEMA = "CONSTRAINT_SCHEMA";
  public static final String CONSTRAINT_NAME = "CONSTRAINT_NAME";
  public static final String CONSTRAINT_TYPE = "CONSTRAINT_TYPE";
  public static final String IS_DEFERRABLE = "IS_DEFERRABLE";
  public static final String INITIALLY_DEFERRED = "INITIALLY_DEFERRED";
  public static final String ENFORCED = "ENFORCED";
  public static final String CHECK_CLAUSE = "CHECK_CLAUSE";
  public static final String UNIQUE_CONSTRAINT_CATALOG = "UNIQUE_CONSTRAINT_CATALOG";
  public static final String UNIQUE_CONSTRAINT_SCHEMA = "UNIQUE_CONSTRAINT_SCHEMA";
  public static final String UNIQUE_CONSTRAINT_NAME = "UNIQUE_CONSTRAINT_NAME";
  public static final String MATCH_OPTION = "MATCH_OPTION";
  public static final String UPDATE_RULE = "UPDATE_RULE";
  public static final String DELETE_RULE = "DELETE_RULE";
  public static final String POSITION_IN_UNIQUE_CONSTRAINT = "POSITION_IN_UNIQUE_CONSTRAINT";

  // Values
  public static final String YES = "YES";
  public static final String NO = "NO";
  public static final String ALWAYS = "ALWAYS";
  public static final String NEVER = "NEVER";
  public static final String BASE_TABLE = "BASE TABLE";
  public static final String VIEW = "VIEW";
  public static final String COMMITTED = "COMMITTED";
  public static final String IN_PARENT = "IN PARENT";
  public static final String INDEX = "INDEX";
  public static final String PRIMARY_KEY_INDEX = "PRIMARY_KEY";
  public static final String READ_WRITE = "READ_WRITE";
  public static final String ASC = "ASC";
  public static final String DESC = "DESC";
  public static final String PRIMARY_KEY = "PRIMARY KEY";
  public static final String CHECK = "CHECK";
  public static final String UNIQUE = "UNIQUE";
  public static final String FOREIGN_KEY = "FOREIGN KEY";
  public static final String SIMPLE = "SIMPLE";
  public static final String NO_ACTION = "NO ACTION";
  public static final String INVOKER = "INVOKER";
  public static final String DATABASE_DIALECT_OPTION = "database_dialect";
  public static final String ALLOW_COMMIT_TIMESTAMP_OPTION = "allow_commit_timestamp";
  public static final String BOOL_OPTION_TYPE = "BOOL";
  public static final String TRUE = "TRUE";
}
