package com.github.spud.worksession.domain.session;

import java.util.UUID;
import lombok.Getter;

/**
 * No open durable row exists for the session id. Callers typically recover by starting a new
 * session.
 */
@Getter
public class SessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public SessionNotFoundException(UUID sessionId) {
    super("Session not found or no longer open: " + sessionId);
    this.sessionId = sessionId;
  }
}
