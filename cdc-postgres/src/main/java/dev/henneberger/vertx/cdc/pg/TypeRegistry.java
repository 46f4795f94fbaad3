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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps type OIDs to conversion strategies.
 * <p>
 * Built-in types are known statically. User-defined types are learned from {@code Type} messages,
 * which bind an OID to a qualified name for the current connection; the name then selects a
 * registered composite layout, an array of another type ({@code _name}), or plain text. Unknown
 * OIDs always fall back to text.
 */
public final class TypeRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(TypeRegistry.class);

  private static final Map<Integer, TypeInfo> BUILTINS;
  private static final Map<String, TypeInfo> BUILTINS_BY_NAME;

  static {
    Map<Integer, TypeInfo> types = new HashMap<>();
    scalar(types, PgTypeOids.BOOL, "bool", TypeInfo.Category.BOOL);
    scalar(types, PgTypeOids.BYTEA, "bytea", TypeInfo.Category.BYTES);
    scalar(types, PgTypeOids.CHAR, "char", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.NAME, "name", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.INT8, "int8", TypeInfo.Category.INTEGER);
    scalar(types, PgTypeOids.INT2, "int2", TypeInfo.Category.INTEGER);
    scalar(types, PgTypeOids.INT4, "int4", TypeInfo.Category.INTEGER);
    scalar(types, PgTypeOids.TEXT, "text", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.OID, "oid", TypeInfo.Category.INTEGER);
    scalar(types, PgTypeOids.XID, "xid", TypeInfo.Category.INTEGER);
    scalar(types, PgTypeOids.JSON, "json", TypeInfo.Category.JSON);
    scalar(types, PgTypeOids.XML, "xml", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.POINT, "point", TypeInfo.Category.TEXT);
    types.put(PgTypeOids.BOX, TypeInfo.scalar(PgTypeOids.BOX, "box", TypeInfo.Category.TEXT, ';'));
    scalar(types, PgTypeOids.CIDR, "cidr", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.FLOAT4, "float4", TypeInfo.Category.FLOAT);
    scalar(types, PgTypeOids.FLOAT8, "float8", TypeInfo.Category.FLOAT);
    scalar(types, PgTypeOids.MONEY, "money", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.MACADDR, "macaddr", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.INET, "inet", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.BPCHAR, "bpchar", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.VARCHAR, "varchar", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.DATE, "date", TypeInfo.Category.DATE);
    scalar(types, PgTypeOids.TIME, "time", TypeInfo.Category.TIME);
    scalar(types, PgTypeOids.TIMESTAMP, "timestamp", TypeInfo.Category.TIMESTAMP);
    scalar(types, PgTypeOids.TIMESTAMPTZ, "timestamptz", TypeInfo.Category.TIMESTAMPTZ);
    scalar(types, PgTypeOids.INTERVAL, "interval", TypeInfo.Category.INTERVAL);
    scalar(types, PgTypeOids.TIMETZ, "timetz", TypeInfo.Category.TIMETZ);
    scalar(types, PgTypeOids.BIT, "bit", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.VARBIT, "varbit", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.NUMERIC, "numeric", TypeInfo.Category.DECIMAL);
    scalar(types, PgTypeOids.UUID, "uuid", TypeInfo.Category.TEXT);
    scalar(types, PgTypeOids.JSONB, "jsonb", TypeInfo.Category.JSON);

    array(types, PgTypeOids.BOOL_ARRAY, PgTypeOids.BOOL);
    array(types, PgTypeOids.BYTEA_ARRAY, PgTypeOids.BYTEA);
    array(types, PgTypeOids.CHAR_ARRAY, PgTypeOids.CHAR);
    array(types, PgTypeOids.NAME_ARRAY, PgTypeOids.NAME);
    array(types, PgTypeOids.INT2_ARRAY, PgTypeOids.INT2);
    array(types, PgTypeOids.INT4_ARRAY, PgTypeOids.INT4);
    array(types, PgTypeOids.TEXT_ARRAY, PgTypeOids.TEXT);
    array(types, PgTypeOids.BPCHAR_ARRAY, PgTypeOids.BPCHAR);
    array(types, PgTypeOids.VARCHAR_ARRAY, PgTypeOids.VARCHAR);
    array(types, PgTypeOids.INT8_ARRAY, PgTypeOids.INT8);
    array(types, PgTypeOids.BOX_ARRAY, PgTypeOids.BOX);
    array(types, PgTypeOids.FLOAT4_ARRAY, PgTypeOids.FLOAT4);
    array(types, PgTypeOids.FLOAT8_ARRAY, PgTypeOids.FLOAT8);
    array(types, PgTypeOids.OID_ARRAY, PgTypeOids.OID);
    array(types, PgTypeOids.INET_ARRAY, PgTypeOids.INET);
    array(types, PgTypeOids.TIMESTAMP_ARRAY, PgTypeOids.TIMESTAMP);
    array(types, PgTypeOids.DATE_ARRAY, PgTypeOids.DATE);
    array(types, PgTypeOids.TIME_ARRAY, PgTypeOids.TIME);
    array(types, PgTypeOids.TIMESTAMPTZ_ARRAY, PgTypeOids.TIMESTAMPTZ);
    array(types, PgTypeOids.INTERVAL_ARRAY, PgTypeOids.INTERVAL);
    array(types, PgTypeOids.NUMERIC_ARRAY, PgTypeOids.NUMERIC);
    array(types, PgTypeOids.TIMETZ_ARRAY, PgTypeOids.TIMETZ);
    array(types, PgTypeOids.JSON_ARRAY, PgTypeOids.JSON);
    array(types, PgTypeOids.UUID_ARRAY, PgTypeOids.UUID);
    array(types, PgTypeOids.JSONB_ARRAY, PgTypeOids.JSONB);

    BUILTINS = Collections.unmodifiableMap(types);
    Map<String, TypeInfo> byName = new HashMap<>();
    for (TypeInfo info : types.values()) {
      byName.put("pg_catalog." + info.name(), info);
    }
    BUILTINS_BY_NAME = Collections.unmodifiableMap(byName);
  }

  private final Map<Integer, String> sessionBindings = new ConcurrentHashMap<>();
  private final Map<String, CompositeLayout> composites = new ConcurrentHashMap<>();

  /**
   * Strategy for an OID; never {@code null}.
   */
  public TypeInfo resolve(int oid) {
    TypeInfo builtin = BUILTINS.get(oid);
    if (builtin != null) {
      return builtin;
    }
    String boundName = sessionBindings.get(oid);
    if (boundName != null) {
      return fromName(oid, boundName);
    }
    return TypeInfo.text(oid, Integer.toUnsignedString(oid));
  }

  /**
   * Strategy for a qualified type name such as {@code public.address} or {@code pg_catalog.int4}.
   */
  public TypeInfo resolve(String qualifiedName) {
    Objects.requireNonNull(qualifiedName, "qualifiedName");
    TypeInfo builtin = BUILTINS_BY_NAME.get(qualifiedName);
    if (builtin != null) {
      return builtin;
    }
    return fromName(0, qualifiedName);
  }

  public TypeInfo elementOf(TypeInfo arrayType) {
    if (arrayType.category() != TypeInfo.Category.ARRAY) {
      throw new IllegalArgumentException(arrayType + " is not an array type");
    }
    return arrayType.elementName() != null ? resolve(arrayType.elementName()) : resolve(arrayType.elementOid());
  }

  /**
   * Records a {@code Type} message for the current connection.
   */
  public void bind(int oid, String namespace, String name) {
    String qualified = (namespace.isEmpty() ? "pg_catalog" : namespace) + '.' + name;
    String previous = sessionBindings.put(oid, qualified);
    if (previous == null || !previous.equals(qualified)) {
      LOG.debug("Bound type oid {} to {}", Integer.toUnsignedString(oid), qualified);
    }
  }

  public TypeRegistry registerComposite(String qualifiedName, List<CompositeLayout.Field> fields) {
    CompositeLayout layout = new CompositeLayout(qualifiedName, fields);
    composites.put(qualifiedName, layout);
    return this;
  }

  /**
   * Forgets bindings learned from {@code Type} messages; registered composite layouts are kept.
   */
  public void clearSessionBindings() {
    sessionBindings.clear();
  }

  public boolean isBound(int oid) {
    return sessionBindings.containsKey(oid);
  }

  private TypeInfo fromName(int oid, String qualifiedName) {
    CompositeLayout layout = composites.get(qualifiedName);
    if (layout != null) {
      return TypeInfo.composite(oid, layout);
    }
    int dot = qualifiedName.indexOf('.');
    String namespace = dot < 0 ? "" : qualifiedName.substring(0, dot + 1);
    String simpleName = dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    if (simpleName.length() > 1 && simpleName.charAt(0) == '_') {
      return TypeInfo.arrayOf(oid, qualifiedName, namespace + simpleName.substring(1));
    }
    return TypeInfo.text(oid, qualifiedName);
  }

  private static void scalar(Map<Integer, TypeInfo> types, int oid, String name, TypeInfo.Category category) {
    types.put(oid, TypeInfo.scalar(oid, name, category));
  }

  private static void array(Map<Integer, TypeInfo> types, int oid, int elementOid) {
    types.put(oid, TypeInfo.arrayOf(oid, "_" + types.get(elementOid).name(), elementOid));
  }
}
