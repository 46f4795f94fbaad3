package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PreflightReportTest {

  @Test
  void formatsDetailedFailureMessage() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error(
        "WAL_LEVEL",
        "wal_level is 'replica'",
        "Set wal_level=logical and restart the server.")));

    assertFalse(report.ok());
    assertEquals(
      "Preflight failed: [WAL_LEVEL] wal_level is 'replica' Remediation: Set wal_level=logical and restart the server.",
      report.describe());
  }

  @Test
  void warningsDoNotFailTheReport() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.warning("SLOT_MISSING", "slot 'cdc' does not exist yet", null)));

    assertTrue(report.ok());
    assertTrue(report.hasIssue("SLOT_MISSING"));
    assertEquals("Preflight passed", report.describe());
  }

  @Test
  void exceptionCarriesReport() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error("CONNECTION_FAILED", "Cannot reach source database", "Check network and credentials.")));
    PreflightFailedException error = new PreflightFailedException(report);

    assertSame(report, error.report());
    assertTrue(error.getMessage().contains("CONNECTION_FAILED"));
  }
}
