package dev.henneberger.vertx.cdc.core;

@FunctionalInterface
public interface Subscription {
  void cancel();
}
