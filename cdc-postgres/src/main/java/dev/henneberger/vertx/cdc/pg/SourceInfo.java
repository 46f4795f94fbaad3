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

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Objects;

/**
 * Where a change event came from, rendered as the {@code source} block of the event JSON.
 */
public final class SourceInfo {

  public static final String VERSION = "0.1.0";
  public static final String CONNECTOR = "postgresql";

  private final String name;
  private final String database;
  private final String schema;
  private final String table;
  private final long txId;
  private final long lsn;
  private final Instant commitTimestamp;

  public SourceInfo(String name,
                    String database,
                    String schema,
                    String table,
                    long txId,
                    long lsn,
                    Instant commitTimestamp) {
    this.name = Objects.requireNonNull(name, "name");
    this.database = database;
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
    this.txId = txId;
    this.lsn = lsn;
    this.commitTimestamp = Objects.requireNonNull(commitTimestamp, "commitTimestamp");
  }

  public String getName() {
    return name;
  }

  public String getDatabase() {
    return database;
  }

  public String getSchema() {
    return schema;
  }

  public String getTable() {
    return table;
  }

  public long getTxId() {
    return txId;
  }

  /**
   * Commit LSN of the transaction that produced the row.
   */
  public long getLsn() {
    return lsn;
  }

  public String getLsnText() {
    return Lsns.format(lsn);
  }

  public Instant getCommitTimestamp() {
    return commitTimestamp;
  }

  public boolean isSnapshot() {
    return false;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("version", VERSION)
      .put("connector", CONNECTOR)
      .put("name", name)
      .put("ts_ms", commitTimestamp.toEpochMilli())
      .put("snapshot", "false")
      .put("db", database)
      .put("schema", schema)
      .put("table", table)
      .put("txId", txId)
      .put("lsn", lsn);
  }

  @Override
  public String toString() {
    return schema + '.' + table + "@" + getLsnText() + " tx " + txId;
  }
}
