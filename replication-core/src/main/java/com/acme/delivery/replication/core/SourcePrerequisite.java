package com.acme.delivery.replication.core;

import java.util.Objects;

/**
 * A condition the source database must satisfy before a change stream can be opened, as
 * found unmet by a session.
 */
public final class SourcePrerequisite {

  private final String code;
  private final String problem;
  private final String remediation;

  public SourcePrerequisite(String code, String problem, String remediation) {
    this.code = Objects.requireNonNull(code, "code");
    this.problem = Objects.requireNonNull(problem, "problem");
    this.remediation = remediation;
  }

  /** Stable identifier, e.g. {@code PUBLICATION_MISSING}. */
  public String code() {
    return code;
  }

  public String problem() {
    return problem;
  }

  public String remediation() {
    return remediation;
  }

  @Override
  public String toString() {
    if (remediation == null || remediation.isBlank()) {
      return "[" + code + "] " + problem;
    }
    return "[" + code + "] " + problem + " Remediation: " + remediation;
  }
}
