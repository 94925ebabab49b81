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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TypeKindTest {

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "INT64, INT64",
    "int64, INT64",
    "BIGINT, INT64",
    "Boolean, BOOL",
    "float8, FLOAT64",
    "character   varying, STRING",
    "jsonb, JSON",
    "timestamp with time zone, TIMESTAMP"
  })
  void fromName_resolvesCanonicalNamesAndAliases(String input, TypeKind expected) {
    assertThat(TypeKind.fromName(input)).isEqualTo(expected);
  }

  @Test
  void fromName_rejectsNullBlankAndUnknown() {
    assertThatThrownBy(() -> TypeKind.fromName(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TypeKind.fromName(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TypeKind.fromName("GEOGRAPHY"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("GEOGRAPHY");
  }

  @Test
  void hasLength_onlyForStringAndBytes() {
    assertThat(TypeKind.STRING.hasLength()).isTrue();
    assertThat(TypeKind.BYTES.hasLength()).isTrue();
    assertThat(TypeKind.INT64.hasLength()).isFalse();
    assertThat(TypeKind.ARRAY.hasLength()).isFalse();
  }
}
