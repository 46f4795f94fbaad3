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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class PgJdbcReplicationTransportTest {

  @Test
  void buildsStartReplicationCommand() {
    assertEquals("START_REPLICATION SLOT \"orders_slot\" LOGICAL 0/16B3748 "
        + "(\"proto_version\" '1', \"publication_names\" '\"orders_pub\",\"customers_pub\"')",
      PgJdbcReplicationTransport.startReplicationCommand("orders_slot", List.of("orders_pub", "customers_pub"), 1,
        0x16B3748L));
  }

  @Test
  void quotesIdentifiersAndLiterals() {
    assertEquals("\"my\"\"slot\"", PgJdbcReplicationTransport.quoteIdentifier("my\"slot"));
    assertEquals("'it''s'", PgJdbcReplicationTransport.quoteLiteral("it's"));
    assertEquals("START_REPLICATION SLOT \"s\" LOGICAL 0/0 (\"proto_version\" '1', \"publication_names\" "
        + "'\"o''brien\"')",
      PgJdbcReplicationTransport.startReplicationCommand("s", List.of("o'brien"), 1, 0L));
  }

  @Test
  void explicitPasswordWinsOverEnvironment() {
    PgOutputReplicationOptions options = new PgOutputReplicationOptions()
      .setPassword("secret")
      .setPasswordEnv("PATH");
    assertEquals("secret", PgJdbcReplicationTransport.resolvePassword(options));

    options.setPassword(null).setPasswordEnv("CDC_TEST_SURELY_UNSET_VARIABLE");
    assertNull(PgJdbcReplicationTransport.resolvePassword(options));
  }

  @Test
  void unreachableServerIsAConnectionFailure() {
    PgOutputReplicationOptions options = new PgOutputReplicationOptions()
      .setHost("127.0.0.1")
      .setPort(1)
      .setDatabase("app")
      .setUser("replicator")
      .setSlotName("s")
      .addPublicationName("p");

    assertThrows(ReplicationConnectionException.class, () -> PgJdbcReplicationTransport.connect(options));
  }
}
