package com.github.spud.worksession.domain.state;

import com.github.spud.worksession.domain.session.SessionStatus;
import lombok.Getter;

@Getter
public class InvalidSessionTransitionException extends RuntimeException {

  private final SessionStatus from;
  private final SessionTransition transition;

  public InvalidSessionTransitionException(SessionStatus from, SessionTransition transition) {
    super("Transition " + transition + " is not allowed from " + from);
    this.from = from;
    this.transition = transition;
  }
}
