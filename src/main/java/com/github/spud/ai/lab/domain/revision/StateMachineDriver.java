package com.github.spud.ai.lab.domain.revision;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Blocking adapter between the revision loop and its reactive state machine.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMachineDriver {

  private final RevisionStateMachineFactory stateMachineFactory;

  public StateMachine<RevisionState, RevisionEvent> create(String machineId) {
    StateMachine<RevisionState, RevisionEvent> sm = stateMachineFactory.getStateMachine(machineId);
    sm.startReactively().block();
    return sm;
  }

  public RevisionState getCurrentState(StateMachine<RevisionState, RevisionEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * Sends an event and waits for the transition.
   *
   * @throws IllegalStateException when the current state has no transition for the event
   */
  public RevisionState sendEvent(StateMachine<RevisionState, RevisionEvent> sm,
    RevisionEvent event) {
    RevisionState from = getCurrentState(sm);
    log.debug("Sending event {} to state machine {}, current state: {}", event, sm.getId(), from);

    StateMachineEventResult<RevisionState, RevisionEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    boolean accepted = result != null &&
      result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
    if (!accepted) {
      throw new IllegalStateException("Event " + event + " rejected in state " + from);
    }

    RevisionState to = getCurrentState(sm);
    log.debug("Event {} accepted, new state: {}", event, to);
    return to;
  }

  public void stop(StateMachine<RevisionState, RevisionEvent> sm) {
    sm.stopReactively().block();
  }

  public boolean isInFinalState(StateMachine<RevisionState, RevisionEvent> sm) {
    return RevisionState.isFinal(getCurrentState(sm));
  }
}
