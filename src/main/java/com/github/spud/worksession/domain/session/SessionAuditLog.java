package com.github.spud.worksession.domain.session;

/**
 * Append-only sink for lifecycle events. Fire-and-forget: implementations must not throw.
 */
public interface SessionAuditLog {

  void append(SessionAuditEvent event);
}
