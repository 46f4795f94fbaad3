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

import dev.henneberger.vertx.cdc.core.FileLsnStore;
import dev.henneberger.vertx.cdc.core.ScopedLsnStore;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Session settings taken from the conventional {@code PG*} environment variables.
 */
public final class ReplicationAppConfig {

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String startLsn;
  private final AcknowledgeMode acknowledgeMode;
  private final String lsnFile;
  private final String slotName;
  private final String publicationName;

  private ReplicationAppConfig(String pgHost,
                               int pgPort,
                               String pgDatabase,
                               String pgUser,
                               String pgPasswordEnv,
                               boolean ssl,
                               String startLsn,
                               AcknowledgeMode acknowledgeMode,
                               String lsnFile,
                               String slotName,
                               String publicationName) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgDatabase = pgDatabase;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.startLsn = startLsn;
    this.acknowledgeMode = acknowledgeMode;
    this.lsnFile = lsnFile;
    this.slotName = slotName;
    this.publicationName = publicationName;
  }

  public static ReplicationAppConfig fromEnv(String slotName, String publicationName) {
    return fromMap(System.getenv(), slotName, publicationName);
  }

  static ReplicationAppConfig fromMap(Map<String, String> env, String slotName, String publicationName) {
    Objects.requireNonNull(env, "env");
    Objects.requireNonNull(slotName, "slotName");
    Objects.requireNonNull(publicationName, "publicationName");

    String host = envOrDefault(env, "PGHOST", PgOutputReplicationOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", PgOutputReplicationOptions.DEFAULT_PORT);
    String database = envOrDefault(env, "PGDATABASE", "postgres");
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    String startLsn = envOrDefault(env, "PG_START_LSN", null);
    AcknowledgeMode ackMode = ackModeOrDefault(env, "CDC_ACK_MODE", AcknowledgeMode.AUTO);
    String lsnFile = envOrDefault(env, "CDC_LSN_FILE", null);

    return new ReplicationAppConfig(host, port, database, user, passwordEnv, ssl, startLsn, ackMode, lsnFile,
      slotName, publicationName);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String startLsn() {
    return startLsn;
  }

  public AcknowledgeMode acknowledgeMode() {
    return acknowledgeMode;
  }

  public String lsnFile() {
    return lsnFile;
  }

  public PgOutputReplicationOptions toReplicationOptions() {
    PgOutputReplicationOptions options = new PgOutputReplicationOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setSlotName(slotName)
      .setPublicationNames(List.of(publicationName))
      .setStartLsn(startLsn)
      .setAcknowledgeMode(acknowledgeMode);
    if (lsnFile != null) {
      options.setLsnStore(new ScopedLsnStore(new FileLsnStore(Paths.get(lsnFile)), pgDatabase));
    }
    return options;
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }

  private static AcknowledgeMode ackModeOrDefault(Map<String, String> env, String key, AcknowledgeMode defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return AcknowledgeMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
