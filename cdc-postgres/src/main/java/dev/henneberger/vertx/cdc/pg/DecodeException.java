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

/**
 * A column value whose text could not be read as its declared type.
 */
public class DecodeException extends ReplicationException {

  private final String schema;
  private final String table;
  private final String column;
  private final int typeOid;
  private final String rawValue;

  public DecodeException(String schema, String table, String column, int typeOid, String rawValue, Throwable cause) {
    super("Cannot decode " + schema + '.' + table + '.' + column + " (type oid " + typeOid + "): "
      + (cause == null ? "invalid literal" : cause.getMessage()), cause);
    this.schema = schema;
    this.table = table;
    this.column = column;
    this.typeOid = typeOid;
    this.rawValue = rawValue;
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public String column() {
    return column;
  }

  public int typeOid() {
    return typeOid;
  }

  public String rawValue() {
    return rawValue;
  }
}
