/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.cdc.pg;

import io.vertx.core.json.Json;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Renders {@link CanonicalValue}s back into the server's text literal grammar. Reading the output
 * with {@link TupleConverter} for the same type yields an equal value.
 */
public final class PgTextEncoder {

  private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4,}-\\d{2}-\\d{2}T.*");
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private final TypeRegistry types;

  public PgTextEncoder(TypeRegistry types) {
    this.types = Objects.requireNonNull(types, "types");
  }

  /**
   * @return the literal, or {@code null} for SQL NULL
   */
  public String encode(CanonicalValue value, TypeInfo type) {
    switch (value.kind()) {
      case NULL:
        return null;
      case BOOL:
        return value.asBoolean() ? "t" : "f";
      case INTEGER:
        return Long.toString(value.asLong());
      case FLOAT:
        return Double.toString(value.asDouble());
      case BYTES:
        return hex(value.asBytes());
      case JSON:
        return Json.encode(value.asJson());
      case TEMPORAL: {
        String text = value.asText();
        return ISO_DATE_TIME.matcher(text).matches() ? text.replaceFirst("T", " ") : text;
      }
      case ARRAY:
        return encodeArray(value.asArray(), type.category() == TypeInfo.Category.ARRAY ? types.elementOf(type) : type);
      case COMPOSITE:
        return encodeComposite(value.asComposite(), type);
      default:
        return value.asText();
    }
  }

  private String encodeArray(List<CanonicalValue> elements, TypeInfo elementType) {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        sb.append(elementType.delimiter());
      }
      CanonicalValue element = elements.get(i);
      if (element.isNull()) {
        sb.append("NULL");
      } else if (element.kind() == CanonicalValue.Kind.ARRAY) {
        sb.append(encodeArray(element.asArray(), elementType));
      } else {
        appendArrayElement(sb, encode(element, elementType), elementType.delimiter());
      }
    }
    return sb.append('}').toString();
  }

  private String encodeComposite(Map<String, CanonicalValue> fields, TypeInfo type) {
    CompositeLayout layout = type.layout();
    StringBuilder sb = new StringBuilder("(");
    int index = 0;
    for (Map.Entry<String, CanonicalValue> entry : fields.entrySet()) {
      if (index > 0) {
        sb.append(',');
      }
      TypeInfo fieldType = fieldType(layout, index, type);
      String text = encode(entry.getValue(), fieldType);
      if (text != null) {
        appendRecordField(sb, text);
      }
      index++;
    }
    return sb.append(')').toString();
  }

  private TypeInfo fieldType(CompositeLayout layout, int index, TypeInfo fallback) {
    if (layout == null || index >= layout.fields().size()) {
      return fallback;
    }
    CompositeLayout.Field field = layout.fields().get(index);
    return field.typeName() != null ? types.resolve(field.typeName()) : types.resolve(field.typeOid());
  }

  private static void appendArrayElement(StringBuilder sb, String text, char delimiter) {
    boolean quote = text.isEmpty() || "NULL".equalsIgnoreCase(text);
    for (int i = 0; i < text.length() && !quote; i++) {
      char c = text.charAt(i);
      quote = c == delimiter || c == '"' || c == '\\' || c == '{' || c == '}' || Character.isWhitespace(c);
    }
    if (!quote) {
      sb.append(text);
      return;
    }
    sb.append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"' || c == '\\') {
        sb.append('\\');
      }
      sb.append(c);
    }
    sb.append('"');
  }

  private static void appendRecordField(StringBuilder sb, String text) {
    boolean quote = text.isEmpty();
    for (int i = 0; i < text.length() && !quote; i++) {
      char c = text.charAt(i);
      quote = c == ',' || c == '(' || c == ')' || c == '"' || c == '\\' || Character.isWhitespace(c);
    }
    if (!quote) {
      sb.append(text);
      return;
    }
    sb.append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"' || c == '\\') {
        sb.append(c);
      }
      sb.append(c);
    }
    sb.append('"');
  }

  private static String hex(byte[] bytes) {
    char[] out = new char[2 + bytes.length * 2];
    out[0] = '\\';
    out[1] = 'x';
    for (int i = 0; i < bytes.length; i++) {
      out[2 + i * 2] = HEX[(bytes[i] >> 4) & 0x0f];
      out[3 + i * 2] = HEX[bytes[i] & 0x0f];
    }
    return new String(out);
  }
}
