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

import dev.henneberger.vertx.cdc.core.AbstractReplicationSession;
import dev.henneberger.vertx.cdc.core.EventChannel;
import dev.henneberger.vertx.cdc.core.LsnStore;
import dev.henneberger.vertx.cdc.core.PreflightFailedException;
import dev.henneberger.vertx.cdc.core.PreflightIssue;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import dev.henneberger.vertx.cdc.core.ReconnectPolicy;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logical replication session speaking the {@code pgoutput} protocol.
 * <p>
 * One thread owns the replication connection: it reads frames, feeds them through the codec and
 * the {@link TransactionAssembler}, pushes events into {@link #events()} (blocking while the
 * channel is full) and is the only writer of status updates. Consumers acknowledge from any
 * thread; acknowledgements only move the {@link PositionTracker} and the read loop reports them
 * upstream. A lost connection is re-established from the confirmed position, so everything after
 * it is delivered again.
 */
public class PgOutputReplicationSession extends AbstractReplicationSession<ChangeEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(PgOutputReplicationSession.class);
  private static final long SLOT_LAG_WARNING_BYTES = 128L * 1024L * 1024L;
  private static final String PLUGIN = "pgoutput";

  private final PgOutputReplicationOptions options;
  private final ReplicationTransport.Factory transportFactory;
  private final Clock clock;
  private final PositionTracker positions = new PositionTracker();
  private final TypeRegistry types = new TypeRegistry();
  private final RelationCache relations = new RelationCache();
  private final TransactionAssembler assembler;
  private final AtomicBoolean statusRequested = new AtomicBoolean();

  private volatile long lastHandedOff = -1L;
  private boolean positionsInitialized;
  private long nextStatusAtMillis;

  public PgOutputReplicationSession(Vertx vertx, PgOutputReplicationOptions options) {
    this(vertx, options, PgJdbcReplicationTransport.FACTORY, Clock.systemUTC());
  }

  PgOutputReplicationSession(Vertx vertx,
                             PgOutputReplicationOptions options,
                             ReplicationTransport.Factory transportFactory,
                             Clock clock) {
    super(vertx, validated(options).getChannelCapacity());
    this.options = new PgOutputReplicationOptions(options);
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.assembler = new TransactionAssembler(relations, new TupleConverter(types), this.options.getSlotName(),
      this.options.getDatabaseName(), this.options.getDecodeErrorPolicy(), this.options.getDecimalHandling(),
      this.options.getMaxDeferredRows(), clock);
    events().setHandOffListener(this::handedOff);
  }

  /**
   * Marks everything up to {@code lsn} as processed. The position is reported to the server with
   * the next status update. While rows wait for their relation, the confirmed position stays below
   * their transaction so they are replayed after a reconnect.
   *
   * @throws InvariantViolationException when {@code lsn} is beyond the received position or behind
   *   the confirmed one
   */
  public void acknowledge(long lsn) {
    positions.confirm(lsn, assembler.heldBackLsn());
    statusRequested.set(true);
  }

  public void acknowledge(ChangeEvent event) {
    acknowledge(event.ackLsn());
  }

  /**
   * Acknowledges the last event handed out by {@link #events()}; does nothing when none was.
   */
  public void acknowledge() {
    long lsn = lastHandedOff;
    if (lsn >= 0L) {
      acknowledge(lsn);
    }
  }

  public long receivedLsn() {
    return positions.received();
  }

  public long confirmedLsn() {
    return positions.confirmed();
  }

  /**
   * Type strategies of this session; register composite layouts here before starting.
   */
  public TypeRegistry types() {
    return types;
  }

  public PgOutputReplicationOptions options() {
    return new PgOutputReplicationOptions(options);
  }

  @Override
  protected String sessionName() {
    return "pgoutput-" + options.getSlotName();
  }

  @Override
  protected boolean preflightEnabled() {
    return options.isPreflightEnabled();
  }

  @Override
  protected boolean autoStart() {
    return options.isAutoStart();
  }

  @Override
  protected ReconnectPolicy reconnectPolicy() {
    return options.getReconnectPolicy();
  }

  @Override
  protected LsnStore lsnStore() {
    return options.getLsnStore();
  }

  @Override
  protected boolean isRetryable(Throwable error) {
    return !(error instanceof InvariantViolationException) && !(error instanceof PreflightFailedException);
  }

  @Override
  protected void runConnection(long attempt) throws Exception {
    long startLsn = startPosition();
    resetConnectionState();
    if (options.isCreateSlot()) {
      ensureReplicationSlot();
    }

    ReplicationTransport transport = transportFactory.open(options);
    try {
      transport.startReplication(options.getSlotName(), options.getPublicationNames(), options.getProtocolVersion(),
        startLsn);
      LOG.info("Replication started for slot {} publications {} from {} (attempt {})",
        options.getSlotName(), options.getPublicationNames(), Lsns.format(startLsn), attempt);
      sessionConnected(attempt);
      readLoop(transport);
    } finally {
      transport.close();
    }
  }

  @Override
  protected void logSessionFailure(Throwable error, long attempt) {
    LOG.error("Replication session for slot {} failed (attempt {})", options.getSlotName(), attempt, error);
  }

  @Override
  protected void logReconnectScheduled(long attempt, long delayMillis) {
    LOG.info("Reconnecting slot {} in {} ms (attempt {}), resuming at {}",
      options.getSlotName(), delayMillis, attempt + 1, Lsns.format(positions.confirmed()));
  }

  @Override
  protected void logDispatchFailure(Throwable error) {
    LOG.warn("Change consumer for slot {} failed", options.getSlotName(), error);
  }

  @Override
  protected void onCloseResources() {
    LOG.info("Replication session for slot {} stopped at confirmed {}", options.getSlotName(),
      Lsns.format(positions.confirmed()));
  }

  private void readLoop(ReplicationTransport transport) throws Exception {
    long pollMillis = options.getPollInterval().toMillis();
    TransactionAssembler.Sink sink = new ChannelSink(transport);
    nextStatusAtMillis = clock.millis() + options.getStatusInterval().toMillis();
    while (shouldRun()) {
      byte[] data = transport.read();
      if (data == null) {
        maybeSendStatus(transport);
        sleepInterruptibly(pollMillis);
        continue;
      }
      ReplicationFrame frame = PgOutputCodec.decodeFrame(data);
      if (frame instanceof ReplicationFrame.Keepalive) {
        keepalive(transport, (ReplicationFrame.Keepalive) frame);
      } else {
        PgOutputMessage message = PgOutputCodec.decodeMessage(((ReplicationFrame.XLogData) frame).payload());
        apply(message, sink);
      }
      maybeSendStatus(transport);
    }
  }

  private void apply(PgOutputMessage message, TransactionAssembler.Sink sink) throws InterruptedException {
    if (message.kind() == PgOutputMessage.Kind.BEGIN) {
      positions.observe(((PgOutputMessage.Begin) message).finalLsn());
    }
    assembler.accept(message, sink);
    if (message.kind() == PgOutputMessage.Kind.COMMIT) {
      positions.observe(((PgOutputMessage.Commit) message).endLsn());
    }
  }

  private void keepalive(ReplicationTransport transport, ReplicationFrame.Keepalive keepalive) throws Exception {
    positions.observeIfAhead(keepalive.walEnd());
    if (options.getAcknowledgeMode() == AcknowledgeMode.AUTO
      && assembler.isIdle()
      && assembler.deferredCount() == 0
      && events().size() == 0) {
      positions.tryConfirm(positions.received());
    }
    if (keepalive.replyRequested()) {
      LOG.debug("Server requested a reply at {}", Lsns.format(keepalive.walEnd()));
      sendStatus(transport);
    }
  }

  private void maybeSendStatus(ReplicationTransport transport) throws Exception {
    if (statusRequested.get() || clock.millis() >= nextStatusAtMillis) {
      sendStatus(transport);
    }
  }

  private void sendStatus(ReplicationTransport transport) throws Exception {
    statusRequested.set(false);
    StatusUpdate update = positions.statusUpdate(clock.instant(), false);
    transport.sendStatus(update);
    nextStatusAtMillis = clock.millis() + options.getStatusInterval().toMillis();
    LOG.debug("Sent {}", update);

    long confirmed = positions.takeConfirmedChange();
    if (confirmed > 0L) {
      String text = Lsns.format(confirmed);
      saveCheckpoint(options.getSlotName(), text);
      emitLsnConfirmed(options.getSlotName(), text);
    }
  }

  private long startPosition() throws Exception {
    if (positionsInitialized) {
      return positions.rewind();
    }
    long start = 0L;
    String configured = options.getStartLsn();
    if (configured != null && !configured.isBlank()) {
      start = Lsns.parse(configured);
    } else {
      String stored = loadCheckpoint(options.getSlotName());
      if (!stored.isEmpty()) {
        try {
          start = Lsns.parse(stored);
        } catch (IllegalArgumentException e) {
          LOG.warn("Stored LSN '{}' for slot {} is invalid, resuming at the slot position", stored,
            options.getSlotName());
        }
      }
    }
    positions.reset(start);
    positionsInitialized = true;
    return start;
  }

  private void resetConnectionState() {
    relations.clear();
    types.clearSessionBindings();
    assembler.reset();
    statusRequested.set(false);
    int dropped = events().clear();
    if (dropped > 0) {
      LOG.info("Dropped {} undelivered event(s) of slot {}; they are replayed from {}", dropped,
        options.getSlotName(), Lsns.format(positions.confirmed()));
    }
  }

  private void handedOff(ChangeEvent event) {
    long lsn = event.ackLsn();
    lastHandedOff = lsn;
    if (options.getAcknowledgeMode() == AcknowledgeMode.AUTO && !positions.tryConfirm(lsn, assembler.heldBackLsn())) {
      LOG.debug("Skipping acknowledgement of {} outside [{}, {}]", Lsns.format(lsn),
        Lsns.format(positions.confirmed()), Lsns.format(positions.received()));
    }
  }

  private void ensureReplicationSlot() throws SQLException {
    try (Connection conn = PgJdbcReplicationTransport.openStandardConnection(options);
         PreparedStatement statement = conn.prepareStatement("SELECT pg_create_logical_replication_slot(?, ?)")) {
      statement.setString(1, options.getSlotName());
      statement.setString(2, PLUGIN);
      try {
        statement.execute();
        LOG.info("Created replication slot {}", options.getSlotName());
      } catch (SQLException createError) {
        if (!isSlotAlreadyExists(createError)) {
          throw createError;
        }
      }
    }
  }

  private static boolean isSlotAlreadyExists(SQLException error) {
    return "42710".equals(error.getSQLState());
  }

  private static PgOutputReplicationOptions validated(PgOutputReplicationOptions options) {
    Objects.requireNonNull(options, "options").validate();
    return options;
  }

  @Override
  protected PreflightReport runPreflightChecks() {
    List<PreflightIssue> issues = new ArrayList<>();
    try (Connection conn = PgJdbcReplicationTransport.openStandardConnection(options)) {
      checkWalLevel(conn, issues);
      checkRolePrivileges(conn, issues);
      checkPositiveSetting(conn, "max_replication_slots", "MAX_REPLICATION_SLOTS_INVALID", issues);
      checkPositiveSetting(conn, "max_wal_senders", "MAX_WAL_SENDERS_INVALID", issues);
      checkSlot(conn, issues);
      checkPublications(conn, issues);
    } catch (Exception e) {
      issues.add(PreflightIssue.error("CONNECTION_FAILED",
        "Could not connect to PostgreSQL: " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."));
    }
    return new PreflightReport(issues);
  }

  private void checkWalLevel(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      String walLevel = rs.next() ? rs.getString(1) : null;
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(PreflightIssue.error("WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."));
      }
    }
  }

  private void checkRolePrivileges(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(PreflightIssue.error("ROLE_NOT_REPLICATION",
          "Current user does not have the REPLICATION attribute",
          "ALTER ROLE <user> WITH REPLICATION, or connect as a superuser."));
      }
    }
  }

  private void checkPositiveSetting(Connection conn,
                                    String setting,
                                    String code,
                                    List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && rs.getLong(1) < 1) {
        issues.add(PreflightIssue.error(code,
          setting + " is set to " + rs.getString(1),
          "Set " + setting + " to at least 1 and restart PostgreSQL."));
      }
    }
  }

  private void checkSlot(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT plugin, slot_type, active, pg_wal_lsn_diff(pg_current_wal_lsn(), restart_lsn) "
        + "FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          if (options.isCreateSlot()) {
            issues.add(PreflightIssue.warning("SLOT_MISSING",
              "Replication slot '" + options.getSlotName() + "' does not exist yet",
              "It is created on connect."));
          } else {
            issues.add(PreflightIssue.error("SLOT_MISSING",
              "Replication slot '" + options.getSlotName() + "' does not exist",
              "SELECT pg_create_logical_replication_slot('" + options.getSlotName() + "', 'pgoutput'), "
                + "or enable createSlot."));
          }
          return;
        }
        String plugin = rs.getString(1);
        if (!"logical".equalsIgnoreCase(rs.getString(2)) || !PLUGIN.equalsIgnoreCase(plugin)) {
          issues.add(PreflightIssue.error("SLOT_PLUGIN_MISMATCH",
            "Replication slot '" + options.getSlotName() + "' uses plugin '" + plugin + "'",
            "Use a logical slot created with the pgoutput plugin."));
        }
        if (rs.getBoolean(3)) {
          issues.add(PreflightIssue.warning("SLOT_ACTIVE",
            "Replication slot '" + options.getSlotName() + "' is in use by another connection",
            "Stop the other consumer; starting replication fails while the slot is active."));
        }
        long lagBytes = rs.getLong(4);
        if (!rs.wasNull() && lagBytes > SLOT_LAG_WARNING_BYTES) {
          issues.add(PreflightIssue.warning("SLOT_LAG_HIGH",
            "Replication slot lag is " + lagBytes + " bytes",
            "Ensure consumers are keeping up or recreate the slot if appropriate."));
        }
      }
    }
  }

  private void checkPublications(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SELECT 1 FROM pg_publication WHERE pubname = ?")) {
      for (String publication : options.getPublicationNames()) {
        statement.setString(1, publication);
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next()) {
            issues.add(PreflightIssue.error("PUBLICATION_MISSING",
              "Publication '" + publication + "' does not exist",
              "CREATE PUBLICATION " + PgJdbcReplicationTransport.quoteIdentifier(publication) + " FOR ..."));
          }
        }
      }
    }
  }

  /**
   * Hands assembled output to the event channel. Waiting for capacity keeps the status updates
   * flowing so the server does not time the connection out.
   */
  private final class ChannelSink implements TransactionAssembler.Sink {
    private final ReplicationTransport transport;

    private ChannelSink(ReplicationTransport transport) {
      this.transport = transport;
    }

    @Override
    public void event(ChangeEvent event) throws InterruptedException {
      EventChannel<ChangeEvent> channel = events();
      long pollMillis = options.getPollInterval().toMillis();
      while (!channel.offer(event, pollMillis, TimeUnit.MILLISECONDS)) {
        awaitingCapacity();
      }
      emitEventMetric(event);
    }

    @Override
    public void decodeFailure(DecodeException failure) throws InterruptedException {
      emitDecodeFailure(failure);
      EventChannel<ChangeEvent> channel = events();
      long pollMillis = options.getPollInterval().toMillis();
      while (!channel.offerFailure(failure, pollMillis, TimeUnit.MILLISECONDS)) {
        awaitingCapacity();
      }
    }

    private void awaitingCapacity() throws InterruptedException {
      if (!shouldRun()) {
        throw new InterruptedException("session closed while waiting for channel capacity");
      }
      try {
        maybeSendStatus(transport);
      } catch (InterruptedException | RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new ReplicationConnectionException("Status update failed while waiting for channel capacity", e);
      }
    }
  }
}
