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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.LsnStore;
import dev.henneberger.vertx.cdc.core.ScopedLsnStore;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReplicationAppConfigTest {

  @Test
  void usesDefaultsForMissingVariables() {
    ReplicationAppConfig config = ReplicationAppConfig.fromMap(Map.of(), "orders_slot", "orders_pub");

    assertEquals("localhost", config.pgHost());
    assertEquals(5432, config.pgPort());
    assertEquals("postgres", config.pgDatabase());
    assertEquals("postgres", config.pgUser());
    assertEquals("PGPASSWORD", config.pgPasswordEnv());
    assertFalse(config.ssl());
    assertNull(config.startLsn());
    assertEquals(AcknowledgeMode.AUTO, config.acknowledgeMode());
    assertNull(config.lsnFile());
  }

  @Test
  void readsConnectionAndStreamSettings() {
    ReplicationAppConfig config = ReplicationAppConfig.fromMap(Map.of(
      "PGHOST", "db.internal",
      "PGPORT", "15432",
      "PGDATABASE", "app",
      "PGUSER", "replicator",
      "PG_PASSWORD_ENV", "APP_DB_PASSWORD",
      "PGSSL", "yes",
      "PG_START_LSN", "0/16B3748",
      "CDC_ACK_MODE", "manual"), "orders_slot", "orders_pub");

    PgOutputReplicationOptions options = config.toReplicationOptions();

    assertEquals("db.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("app", options.getDatabase());
    assertEquals("replicator", options.getUser());
    assertEquals("APP_DB_PASSWORD", options.getPasswordEnv());
    assertTrue(options.getSsl());
    assertEquals("orders_slot", options.getSlotName());
    assertEquals(List.of("orders_pub"), options.getPublicationNames());
    assertEquals("0/16B3748", options.getStartLsn());
    assertEquals(AcknowledgeMode.MANUAL, options.getAcknowledgeMode());
    assertFalse(options.getLsnStore() instanceof ScopedLsnStore);
  }

  @Test
  void malformedPortFallsBackToDefault() {
    ReplicationAppConfig config = ReplicationAppConfig.fromMap(Map.of("PGPORT", "five"), "s", "p");
    assertEquals(5432, config.pgPort());
  }

  @Test
  void unknownAcknowledgeModeIsRejected() {
    assertThrows(IllegalArgumentException.class,
      () -> ReplicationAppConfig.fromMap(Map.of("CDC_ACK_MODE", "sometimes"), "s", "p"));
  }

  @Test
  void lsnFileBecomesADatabaseScopedStore(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("positions.properties");
    ReplicationAppConfig config = ReplicationAppConfig.fromMap(Map.of(
      "PGDATABASE", "app",
      "CDC_LSN_FILE", file.toString()), "orders_slot", "orders_pub");

    LsnStore store = config.toReplicationOptions().getLsnStore();
    assertTrue(store instanceof ScopedLsnStore);

    store.save("orders_slot", "0/200");
    assertEquals(Optional.of("0/200"), store.load("orders_slot"));
    assertEquals(file.toString(), config.lsnFile());
  }
}
