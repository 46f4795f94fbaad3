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

import dev.henneberger.vertx.cdc.core.ReplicationSession;
import dev.henneberger.vertx.cdc.core.SessionMetricsListener;
import dev.henneberger.vertx.cdc.core.SessionState;
import dev.henneberger.vertx.cdc.core.SessionStateChange;
import dev.henneberger.vertx.cdc.core.Subscription;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Log lines for the lifecycle of a session, for applications that do not wire their own
 * {@link SessionMetricsListener}.
 * <p>
 * A terminal failure is logged at ERROR, any other change carrying a cause at WARN, the remaining
 * state changes at INFO. Confirmed positions and decode failures are logged at DEBUG and WARN.
 */
public final class ReplicationLogging {

  private ReplicationLogging() {
  }

  public static <E> Subscription attachDefaultLogging(ReplicationSession<E> session, Logger logger, String sessionName) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(logger, "logger");
    String name = sessionName == null || sessionName.isBlank() ? "pgoutput" : sessionName;
    return session.addMetricsListener(new SessionMetricsListener<E>() {
      @Override
      public void onStateChange(SessionStateChange change) {
        Throwable cause = change.cause();
        if (change.state() == SessionState.FAILED) {
          logger.error("session={} failed after {} attempt(s), was {}", name, change.attempt(),
            change.previousState(), cause);
        } else if (cause != null) {
          logger.warn("session={} {} -> {} attempt={} cause={}", name, change.previousState(), change.state(),
            change.attempt(), cause.toString());
        } else {
          logger.info("session={} {} -> {} attempt={}", name, change.previousState(), change.state(),
            change.attempt());
        }
      }

      @Override
      public void onLsnConfirmed(String slotName, String lsn) {
        logger.debug("session={} slot={} confirmed {}", name, slotName, lsn);
      }

      @Override
      public void onDecodeFailure(Throwable error) {
        logger.warn("session={} could not decode a row: {}", name, error.getMessage());
      }
    });
  }
}
