package dev.henneberger.vertx.cdc.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReport {
  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    Objects.requireNonNull(issues, "issues");
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public boolean ok() {
    return issues.stream().noneMatch(PreflightIssue::isError);
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  public boolean hasIssue(String code) {
    return issues.stream().anyMatch(issue -> issue.code().equals(code));
  }

  public String describe() {
    if (ok()) {
      return "Preflight passed";
    }
    return "Preflight failed: " + issues.stream()
      .map(PreflightIssue::toString)
      .collect(Collectors.joining("; "));
  }
}
