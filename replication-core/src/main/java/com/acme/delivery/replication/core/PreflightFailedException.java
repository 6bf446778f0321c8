package com.acme.delivery.replication.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The source database is missing something a session needs. Signals misconfiguration, so it
 * is never retried.
 */
public final class PreflightFailedException extends IllegalStateException {

  private final List<SourcePrerequisite> unmet;

  public PreflightFailedException(List<SourcePrerequisite> unmet) {
    super(describe(unmet));
    this.unmet = Collections.unmodifiableList(new ArrayList<>(unmet));
  }

  public List<SourcePrerequisite> unmet() {
    return unmet;
  }

  public boolean hasIssue(String code) {
    return unmet.stream().anyMatch(prerequisite -> prerequisite.code().equals(code));
  }

  private static String describe(List<SourcePrerequisite> unmet) {
    if (unmet.isEmpty()) {
      throw new IllegalArgumentException("at least one unmet prerequisite is required");
    }
    return "Source prerequisites not met: " + unmet.stream()
      .map(SourcePrerequisite::toString)
      .collect(Collectors.joining("; "));
  }
}
