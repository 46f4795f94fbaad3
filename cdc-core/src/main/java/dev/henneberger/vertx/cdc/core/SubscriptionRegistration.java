package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import java.util.Objects;

public final class SubscriptionRegistration {
  private final Subscription subscription;
  private final Future<Void> started;

  public SubscriptionRegistration(Subscription subscription, Future<Void> started) {
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.started = Objects.requireNonNull(started, "started");
  }

  public Subscription subscription() {
    return subscription;
  }

  /**
   * Completes once the session reached {@link SessionState#CONNECTED} for the first time.
   */
  public Future<Void> started() {
    return started;
  }
}
