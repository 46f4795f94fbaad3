package dev.henneberger.vertx.cdc.core;

@FunctionalInterface
public interface ChangeFilter<E> {
  boolean test(E event);

  static <E> ChangeFilter<E> all() {
    return event -> true;
  }
}
