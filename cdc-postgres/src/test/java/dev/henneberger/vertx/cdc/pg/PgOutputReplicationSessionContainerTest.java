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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.InMemoryLsnStore;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import dev.henneberger.vertx.cdc.core.SubscriptionRegistration;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class PgOutputReplicationSessionContainerTest {

  private static final String PUBLICATION_NAME = "cdc_pub";
  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";

  @Test
  void streamsInsertUpdateDelete() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      execute(postgres,
        "CREATE TABLE customers (id TEXT PRIMARY KEY, name TEXT NOT NULL, credit_limit NUMERIC(12,2), "
          + "tags TEXT[], meta JSONB)",
        "CREATE PUBLICATION " + PUBLICATION_NAME + " FOR TABLE customers");

      Vertx vertx = Vertx.vertx();
      PgOutputReplicationSession session = new PgOutputReplicationSession(vertx, options(postgres, "cdc_slot")
        .setLsnStore(new InMemoryLsnStore()));

      BlockingQueue<ChangeEvent> events = new LinkedBlockingQueue<>();
      SubscriptionRegistration registration = session.startAndSubscribe(
        ChangeEventFilter.tables("public.customers"),
        event -> {
          events.offer(event);
          return Future.succeededFuture();
        },
        err -> {
          throw new RuntimeException(err);
        });

      try {
        registration.started().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        waitForSlotCreation(postgres, "cdc_slot");
        execute(postgres,
          "INSERT INTO customers VALUES ('CUST001', 'Alice', 5000.00, '{gold,\"early adopter\"}', "
            + "'{\"tier\":1}')",
          "UPDATE customers SET name = 'Alice B' WHERE id = 'CUST001'",
          "DELETE FROM customers WHERE id = 'CUST001'");

        ChangeEvent insert = poll(events, "insert");
        ChangeEvent update = poll(events, "update");
        ChangeEvent delete = poll(events, "delete");

        assertEquals(ChangeEvent.Operation.CREATE, insert.getOperation());
        assertEquals("public.customers", insert.getTable());
        JsonObject after = insert.afterJson();
        assertEquals("Alice", after.getString("name"));
        assertEquals("5000.00", after.getString("credit_limit"));
        assertEquals("early adopter", after.getJsonArray("tags").getString(1));
        assertEquals(1, after.getJsonObject("meta").getInteger("tier"));
        assertEquals("cdc_slot", insert.getSource().getName());
        assertEquals(DB_NAME, insert.getSource().getDatabase());

        assertEquals(ChangeEvent.Operation.UPDATE, update.getOperation());
        assertEquals("CUST001", update.getBefore().get("id").asText());
        assertEquals("Alice B", update.string("name"));

        assertEquals(ChangeEvent.Operation.DELETE, delete.getOperation());
        assertNull(delete.getAfter());
        assertEquals("CUST001", delete.stringFromBefore("id"));

        assertTrue(insert.ackLsn() < update.ackLsn() && update.ackLsn() < delete.ackLsn());
        waitForConfirmed(session, delete.ackLsn());
      } finally {
        registration.subscription().cancel();
        session.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  @Test
  void preflightReportsMissingPublication() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      Vertx vertx = Vertx.vertx();
      PgOutputReplicationSession session = new PgOutputReplicationSession(vertx, options(postgres, "preflight_slot")
        .setPreflightEnabled(true));
      try {
        PreflightReport report = session.preflight()
          .toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        assertTrue(report.hasIssue("PUBLICATION_MISSING"), report.describe());
      } finally {
        session.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  private static PgOutputReplicationOptions options(GenericContainer<?> postgres, String slotName) {
    return new PgOutputReplicationOptions()
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD)
      .setSlotName(slotName)
      .setCreateSlot(true)
      .addPublicationName(PUBLICATION_NAME)
      .setStatusInterval(Duration.ofMillis(200));
  }

  private static ChangeEvent poll(BlockingQueue<ChangeEvent> events, String label) throws Exception {
    ChangeEvent event = events.poll(30, TimeUnit.SECONDS);
    if (event == null) {
      throw new IllegalStateException("Timed out waiting for " + label + " event");
    }
    return event;
  }

  private static void waitForConfirmed(PgOutputReplicationSession session, long lsn) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
    while (System.nanoTime() < deadline) {
      if (Lsns.compare(session.confirmedLsn(), lsn) >= 0) {
        return;
      }
      Thread.sleep(50);
    }
    throw new IllegalStateException("Position " + Lsns.format(lsn) + " was never confirmed");
  }

  private static void waitForSlotCreation(GenericContainer<?> postgres, String slotName) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
    while (System.nanoTime() < deadline) {
      try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
           Statement statement = conn.createStatement();
           ResultSet rs = statement.executeQuery(
             "SELECT slot_name FROM pg_replication_slots WHERE slot_name='" + slotName + "'")) {
        if (rs.next()) {
          return;
        }
      }
      Thread.sleep(200);
    }
    throw new IllegalStateException("Replication slot was not created: " + slotName);
  }

  private static void execute(GenericContainer<?> postgres, String... statements) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
         Statement statement = conn.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    }
  }

  private static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(10))
      .withCommand("postgres",
        "-c", "wal_level=logical",
        "-c", "max_replication_slots=10",
        "-c", "max_wal_senders=10");
  }

  private static String jdbcUrl(GenericContainer<?> postgres) {
    return "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME;
  }
}
