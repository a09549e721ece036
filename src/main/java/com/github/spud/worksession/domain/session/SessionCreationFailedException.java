package com.github.spud.worksession.domain.session;

/**
 * The only creation failure callers see. The cause carries the underlying store error and is
 * never rendered to clients.
 */
public class SessionCreationFailedException extends RuntimeException {

  public SessionCreationFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
