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
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.SessionContractKit;
import dev.henneberger.vertx.cdc.core.Subscription;
import io.vertx.core.Vertx;
import java.lang.reflect.Proxy;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

class ReplicationLoggingTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private Vertx vertx;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
  }

  @AfterEach
  void tearDown() {
    vertx.close();
  }

  @Test
  void logsLifecycleUntilCancelled() {
    List<String> lines = new CopyOnWriteArrayList<>();
    ReplicationTransport.Factory refusing = options -> {
      throw new ReplicationConnectionException("connection refused", null);
    };
    PgOutputReplicationSession session = new PgOutputReplicationSession(vertx, new PgOutputReplicationOptions()
      .setDatabase("appdb")
      .setUser("replicator")
      .setSlotName("orders_slot")
      .addPublicationName("orders_pub")
      .setReconnectPolicy(PgOutputReplicationOptions.defaultReconnectPolicy()
        .setInitialDelay(Duration.ofMillis(1))
        .setMaxDelay(Duration.ofMillis(2))
        .setMaxAttempts(1)), refusing, Clock.systemUTC());

    Subscription subscription = ReplicationLogging.attachDefaultLogging(session, recordingLogger(lines), "orders");
    try {
      SessionContractKit.assertExhaustedReconnectsFailSession(session, TIMEOUT);

      assertTrue(lines.stream().anyMatch(line -> line.startsWith("INFO session=orders") && line.contains("-> CONNECTING")),
        lines.toString());
      assertTrue(lines.stream().anyMatch(line -> line.startsWith("WARN session=orders")
        && line.contains("-> DISCONNECTED") && line.contains("connection refused")), lines.toString());
      assertTrue(lines.stream().anyMatch(line -> line.startsWith("ERROR session=orders failed after")),
        lines.toString());

      int logged = lines.size();
      subscription.cancel();
      session.close();
      assertEquals(logged, lines.size());
    } finally {
      session.close();
    }
  }

  @Test
  void blankNameFallsBackToDefault() {
    List<String> lines = new CopyOnWriteArrayList<>();
    PgOutputReplicationSession session = new PgOutputReplicationSession(vertx, new PgOutputReplicationOptions()
      .setDatabase("appdb")
      .setUser("replicator")
      .setSlotName("orders_slot")
      .addPublicationName("orders_pub")
      .setAutoStart(false));

    ReplicationLogging.attachDefaultLogging(session, recordingLogger(lines), " ");
    session.close();

    assertTrue(lines.stream().anyMatch(line -> line.startsWith("INFO session=pgoutput") && line.contains("-> CLOSED")),
      lines.toString());
  }

  private static Logger recordingLogger(List<String> lines) {
    return (Logger) Proxy.newProxyInstance(Logger.class.getClassLoader(), new Class<?>[] {Logger.class},
      (proxy, method, args) -> {
        switch (method.getName()) {
          case "hashCode":
            return System.identityHashCode(proxy);
          case "equals":
            return proxy == args[0];
          case "toString":
          case "getName":
            return "recording";
          default:
            break;
        }
        if (method.getReturnType() == boolean.class) {
          return true;
        }
        if (method.getReturnType() != void.class || args == null || !(args[0] instanceof String)) {
          return null;
        }
        Object[] params = args.length == 2 && args[1] instanceof Object[]
          ? (Object[]) args[1]
          : Arrays.copyOfRange(args, 1, args.length);
        lines.add(method.getName().toUpperCase(Locale.ROOT) + ' '
          + MessageFormatter.arrayFormat((String) args[0], params).getMessage());
        return null;
      });
  }
}
