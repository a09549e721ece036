package com.github.spud.worksession.domain.session;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * Lifecycle event appended to the audit log
 */
@Value
@Builder
public class SessionAuditEvent {

  public enum Type {
    SESSION_START,
    SESSION_END,
    SESSION_TIMEOUT,
    SESSION_DISCONNECT
  }

  Type type;

  UUID sessionId;

  UUID projectId;

  OffsetDateTime occurredAt;

  /**
   * Null for start events
   */
  Long durationMs;

  Map<String, Object> details;
}
