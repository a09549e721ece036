package com.github.spud.worksession.domain.state;

/**
 * Session state machine events
 */
public enum SessionTransition {
  /**
   * Explicit end by the caller
   */
  END,

  /**
   * Idle past the timeout threshold
   */
  TIMEOUT,

  /**
   * Abnormal termination reported from outside the tracker
   */
  DISCONNECT
}
