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

package ai.floedb.infoschema.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class LimitsTest {

  @Test
  void maxDeclaredLength_followsScalarOrElementType() {
    assertThat(Limits.maxDeclaredLength(ColumnType.string()))
        .isEqualTo(Limits.MAX_STRING_COLUMN_LENGTH);
    assertThat(Limits.maxDeclaredLength(ColumnType.bytes()))
        .isEqualTo(Limits.MAX_BYTES_COLUMN_LENGTH);
    assertThat(Limits.maxDeclaredLength(ColumnType.arrayOf(ColumnType.bytes())))
        .isEqualTo(Limits.MAX_BYTES_COLUMN_LENGTH);
  }

  @Test
  void maxDeclaredLength_rejectsTypesWithoutLength() {
    assertThatThrownBy(() -> Limits.maxDeclaredLength(ColumnType.int64()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("INT64 does not accept a length");
    assertThatThrownBy(() -> Limits.maxDeclaredLength(ColumnType.arrayOf(ColumnType.bool())))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
