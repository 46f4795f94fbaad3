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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.copy.CopyDual;
import org.postgresql.copy.CopyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReplicationTransport} over a pgjdbc connection in {@code replication=database} mode. The
 * driver only frames CopyData; the replication messages inside are handled by
 * {@link PgOutputCodec}.
 */
public final class PgJdbcReplicationTransport implements ReplicationTransport {

  private static final Logger LOG = LoggerFactory.getLogger(PgJdbcReplicationTransport.class);

  public static final Factory FACTORY = PgJdbcReplicationTransport::connect;

  private final Connection connection;
  private volatile CopyDual copy;

  private PgJdbcReplicationTransport(Connection connection) {
    this.connection = connection;
  }

  public static PgJdbcReplicationTransport connect(PgOutputReplicationOptions options) {
    Properties props = connectionProperties(options);
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
    try {
      return new PgJdbcReplicationTransport(DriverManager.getConnection(jdbcUrl(options), props));
    } catch (SQLException e) {
      throw new ReplicationConnectionException("Could not open replication connection to "
        + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase(), e);
    }
  }

  /**
   * A regular (non replication) connection for catalog queries.
   */
  public static Connection openStandardConnection(PgOutputReplicationOptions options) throws SQLException {
    return DriverManager.getConnection(jdbcUrl(options), connectionProperties(options));
  }

  @Override
  public void startReplication(String slotName, List<String> publicationNames, int protocolVersion, long startLsn) {
    String command = startReplicationCommand(slotName, publicationNames, protocolVersion, startLsn);
    LOG.debug("Issuing {}", command);
    try {
      CopyManager copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
      copy = copyManager.copyDual(command);
    } catch (SQLException e) {
      throw new ReplicationConnectionException("START_REPLICATION failed for slot " + slotName, e);
    }
  }

  @Override
  public byte[] read() {
    CopyDual current = requireStarted();
    try {
      byte[] data = current.readFromCopy(false);
      if (data == null && !current.isActive()) {
        throw new ReplicationConnectionException("Replication stream ended by server", null);
      }
      return data;
    } catch (SQLException e) {
      throw new ReplicationConnectionException("Reading replication stream failed", e);
    }
  }

  @Override
  public void sendStatus(StatusUpdate update) {
    CopyDual current = requireStarted();
    byte[] payload = update.encode();
    try {
      current.writeToCopy(payload, 0, payload.length);
      current.flushCopy();
    } catch (SQLException e) {
      throw new ReplicationConnectionException("Sending status update failed", e);
    }
  }

  @Override
  public void close() {
    CopyDual current = copy;
    copy = null;
    if (current != null && current.isActive()) {
      try {
        current.cancelCopy();
      } catch (SQLException e) {
        LOG.debug("Cancelling replication copy failed", e);
      }
    }
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.debug("Closing replication connection failed", e);
    }
  }

  /**
   * Builds the {@code START_REPLICATION} command. Identifiers and literals are quoted.
   */
  static String startReplicationCommand(String slotName,
                                        List<String> publicationNames,
                                        int protocolVersion,
                                        long startLsn) {
    StringBuilder publications = new StringBuilder();
    for (String name : publicationNames) {
      if (publications.length() > 0) {
        publications.append(',');
      }
      publications.append(quoteIdentifier(name));
    }
    return "START_REPLICATION SLOT " + quoteIdentifier(slotName)
      + " LOGICAL " + Lsns.format(startLsn)
      + " (\"proto_version\" " + quoteLiteral(Integer.toString(protocolVersion))
      + ", \"publication_names\" " + quoteLiteral(publications.toString()) + ")";
  }

  static String quoteIdentifier(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  static String quoteLiteral(String literal) {
    return '\'' + literal.replace("'", "''") + '\'';
  }

  private CopyDual requireStarted() {
    CopyDual current = copy;
    if (current == null) {
      throw new ReplicationConnectionException("Replication stream is not started", null);
    }
    return current;
  }

  private static Properties connectionProperties(PgOutputReplicationOptions options) {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());
    String password = resolvePassword(options);
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }
    if (Boolean.TRUE.equals(options.getSsl())) {
      PGProperty.SSL.set(props, "true");
    }
    return props;
  }

  private static String jdbcUrl(PgOutputReplicationOptions options) {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase();
  }

  static String resolvePassword(PgOutputReplicationOptions options) {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }
}
