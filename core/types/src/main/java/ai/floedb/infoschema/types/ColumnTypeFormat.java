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

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DDL spelling of {@link ColumnType} values.
 *
 * <ul>
 *   <li>{@link #format(ColumnType, Long)} renders the type the way column definitions print it,
 *       e.g. {@code INT64}, {@code STRING(MAX)}, {@code BYTES(16)} or {@code ARRAY<STRING(64)>}.
 *       A declared length applies to the element type of an array.
 *   <li>{@link #parse(String)} reads the same spellings back, returning the type and the declared
 *       length ({@code null} for {@code MAX} or for types without a length).
 * </ul>
 */
public final class ColumnTypeFormat {

  private static final String MAX = "MAX";

  private static final Pattern ARRAY_RE = Pattern.compile("^ARRAY\\s*<\\s*(.+?)\\s*>$");
  private static final Pattern LENGTH_RE =
      Pattern.compile("^([A-Z0-9_ ]+?)\\s*\\(\\s*(\\d+|MAX)\\s*\\)$");

  private ColumnTypeFormat() {}

  /** A parsed DDL type together with its declared length. */
  public record Parsed(ColumnType type, Long declaredMaxLength) {
    public Parsed {
      Objects.requireNonNull(type, "type");
    }
  }

  public static String format(ColumnType type, Long declaredMaxLength) {
    Objects.requireNonNull(type, "ColumnType");
    if (type.isArray()) {
      return "ARRAY<" + format(type.elementType(), declaredMaxLength) + ">";
    }
    if (type.kind().hasLength()) {
      return type.kind().name()
          + "("
          + (declaredMaxLength == null ? MAX : Long.toString(declaredMaxLength))
          + ")";
    }
    return type.kind().name();
  }

  public static Parsed parse(String s) {
    Objects.requireNonNull(s, "column type string");
    String normalized = s.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("Unrecognized column type: \"\"");
    }

    Matcher array = ARRAY_RE.matcher(normalized);
    if (array.matches()) {
      Parsed element = parseScalar(s, array.group(1));
      return new Parsed(ColumnType.arrayOf(element.type()), element.declaredMaxLength());
    }
    return parseScalar(s, normalized);
  }

  private static Parsed parseScalar(String raw, String normalized) {
    Matcher withLength = LENGTH_RE.matcher(normalized);
    if (withLength.matches()) {
      TypeKind kind = resolve(raw, withLength.group(1));
      if (!kind.hasLength()) {
        throw new IllegalArgumentException(
            "Unrecognized column type: \"" + raw + "\" (type does not accept a length)");
      }
      String length = withLength.group(2);
      return new Parsed(ColumnType.of(kind), MAX.equals(length) ? null : Long.parseLong(length));
    }
    if (normalized.indexOf('(') >= 0 || normalized.indexOf('<') >= 0) {
      throw new IllegalArgumentException("Unrecognized column type: \"" + raw + "\"");
    }
    TypeKind kind = resolve(raw, normalized);
    if (kind == TypeKind.ARRAY) {
      throw new IllegalArgumentException(
          "Unrecognized column type: \"" + raw + "\" (ARRAY requires an element type)");
    }
    return new Parsed(ColumnType.of(kind), null);
  }

  private static TypeKind resolve(String raw, String name) {
    try {
      return TypeKind.fromName(name);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unrecognized column type: \"" + raw + "\"", e);
    }
  }
}
