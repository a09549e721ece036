package com.github.spud.worksession.domain.state;

import com.github.spud.worksession.domain.session.SessionStatus;
import java.util.EnumSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Session lifecycle state machine
 * <pre>
 *   ACTIVE --(END)--------> INACTIVE
 *   ACTIVE --(TIMEOUT)----> INACTIVE
 *   ACTIVE --(DISCONNECT)-> DISCONNECTED
 * </pre>
 * INACTIVE and DISCONNECTED are end states. The durable row is the source of truth, so a
 * short-lived machine is built from the row's current status for every decision.
 */
@Slf4j
@Component
public class SessionLifecycleStateMachine {

  /**
   * Target status of {@code transition} from {@code current}.
   *
   * @throws InvalidSessionTransitionException when the machine rejects the event
   */
  public SessionStatus next(SessionStatus current, SessionTransition transition) {
    StateMachine<SessionStatus, SessionTransition> sm = build(current);
    sm.startReactively().block();
    try {
      StateMachineEventResult<SessionStatus, SessionTransition> result = sm
        .sendEvent(Mono.just(MessageBuilder.withPayload(transition).build()))
        .blockFirst();

      boolean accepted = result != null
        && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
      if (!accepted) {
        log.debug("Transition {} rejected in state {}", transition, current);
        throw new InvalidSessionTransitionException(current, transition);
      }
      return sm.getState().getId();
    } finally {
      sm.stopReactively().block();
    }
  }

  public boolean canTransition(SessionStatus current, SessionTransition transition) {
    try {
      next(current, transition);
      return true;
    } catch (InvalidSessionTransitionException e) {
      return false;
    }
  }

  private StateMachine<SessionStatus, SessionTransition> build(SessionStatus initial) {
    try {
      StateMachineBuilder.Builder<SessionStatus, SessionTransition> builder =
        StateMachineBuilder.builder();

      builder.configureConfiguration()
        .withConfiguration()
        .autoStartup(false);

      builder.configureStates()
        .withStates()
        .initial(initial)
        .states(EnumSet.allOf(SessionStatus.class))
        .end(SessionStatus.INACTIVE)
        .end(SessionStatus.DISCONNECTED);

      builder.configureTransitions()
        .withExternal()
        .source(SessionStatus.ACTIVE).target(SessionStatus.INACTIVE)
        .event(SessionTransition.END)
        .and()
        .withExternal()
        .source(SessionStatus.ACTIVE).target(SessionStatus.INACTIVE)
        .event(SessionTransition.TIMEOUT)
        .and()
        .withExternal()
        .source(SessionStatus.ACTIVE).target(SessionStatus.DISCONNECTED)
        .event(SessionTransition.DISCONNECT);

      return builder.build();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build session state machine", e);
    }
  }
}
