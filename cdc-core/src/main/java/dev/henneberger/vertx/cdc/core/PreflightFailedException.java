package dev.henneberger.vertx.cdc.core;

import java.util.Objects;

public final class PreflightFailedException extends IllegalStateException {

  private final PreflightReport report;

  public PreflightFailedException(PreflightReport report) {
    super(Objects.requireNonNull(report, "report").describe());
    this.report = report;
  }

  public PreflightReport report() {
    return report;
  }
}
