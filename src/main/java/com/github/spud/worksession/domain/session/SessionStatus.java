package com.github.spud.worksession.domain.session;

import java.util.Arrays;

/**
 * Session lifecycle status.
 * <pre>
 * ACTIVE --(END | TIMEOUT)--> INACTIVE
 * ACTIVE --(DISCONNECT)-----> DISCONNECTED
 * </pre>
 * INACTIVE and DISCONNECTED are terminal: a session never returns to ACTIVE.
 */
public enum SessionStatus {
  ACTIVE("active"),
  INACTIVE("inactive"),
  DISCONNECTED("disconnected");

  private final String dbValue;

  SessionStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  /**
   * Value stored in the sessions.status column
   */
  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return this != ACTIVE;
  }

  public static SessionStatus fromDbValue(String value) {
    return Arrays.stream(values())
      .filter(s -> s.dbValue.equalsIgnoreCase(value))
      .findFirst()
      .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + value));
  }
}
