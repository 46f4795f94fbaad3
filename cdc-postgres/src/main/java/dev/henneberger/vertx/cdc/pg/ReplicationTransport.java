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

import java.util.List;

/**
 * The COPY BOTH channel of one replication connection. Only the read loop thread uses it.
 */
public interface ReplicationTransport extends AutoCloseable {

  /**
   * Issues {@code START_REPLICATION} for the logical slot.
   */
  void startReplication(String slotName, List<String> publicationNames, int protocolVersion, long startLsn);

  /**
   * Returns the next CopyData payload, or {@code null} when none is pending. Never blocks.
   *
   * @throws ReplicationConnectionException when the connection is lost or the stream ended
   */
  byte[] read();

  void sendStatus(StatusUpdate update);

  @Override
  void close();

  /**
   * Opens transports for successive connection attempts of a session.
   */
  interface Factory {
    ReplicationTransport open(PgOutputReplicationOptions options);
  }
}
