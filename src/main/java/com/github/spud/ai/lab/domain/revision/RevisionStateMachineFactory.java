package com.github.spud.ai.lab.domain.revision;

import java.util.EnumSet;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;

/**
 * Builds one state machine per revision cycle.
 * <pre>
 *   IMPLEMENTING       --(ENGINEER_DONE)-------------> AWAITING_REVIEW
 *   IMPLEMENTING       --(ENGINEER_BUDGET_EXHAUSTED)-> ABORTED
 *   AWAITING_REVIEW    --(CRITIC_APPROVE)------------> APPROVED
 *   AWAITING_REVIEW    --(CRITIC_REVISE)-------------> REVISION_REQUESTED
 *   REVISION_REQUESTED --(RESUME_IMPLEMENTATION)-----> IMPLEMENTING
 *   REVISION_REQUESTED --(REVISION_BUDGET_EXHAUSTED)-> ABORTED
 * </pre>
 */
@Component
public class RevisionStateMachineFactory {

  public StateMachine<RevisionState, RevisionEvent> getStateMachine(String machineId) {
    try {
      return build(machineId);
    } catch (Exception e) {
      throw new IllegalStateException("Cannot build revision state machine " + machineId, e);
    }
  }

  private StateMachine<RevisionState, RevisionEvent> build(String machineId) throws Exception {
    StateMachineBuilder.Builder<RevisionState, RevisionEvent> builder = StateMachineBuilder.builder();

    builder.configureConfiguration()
      .withConfiguration()
      .machineId(machineId)
      .autoStartup(false);

    builder.configureStates()
      .withStates()
      .initial(RevisionState.IMPLEMENTING)
      .states(EnumSet.allOf(RevisionState.class))
      .end(RevisionState.APPROVED)
      .end(RevisionState.ABORTED);

    builder.configureTransitions()
      .withExternal()
      .source(RevisionState.IMPLEMENTING).target(RevisionState.AWAITING_REVIEW)
      .event(RevisionEvent.ENGINEER_DONE)
      .and()
      .withExternal()
      .source(RevisionState.IMPLEMENTING).target(RevisionState.ABORTED)
      .event(RevisionEvent.ENGINEER_BUDGET_EXHAUSTED)
      .and()
      .withExternal()
      .source(RevisionState.AWAITING_REVIEW).target(RevisionState.APPROVED)
      .event(RevisionEvent.CRITIC_APPROVE)
      .and()
      .withExternal()
      .source(RevisionState.AWAITING_REVIEW).target(RevisionState.REVISION_REQUESTED)
      .event(RevisionEvent.CRITIC_REVISE)
      .and()
      .withExternal()
      .source(RevisionState.REVISION_REQUESTED).target(RevisionState.IMPLEMENTING)
      .event(RevisionEvent.RESUME_IMPLEMENTATION)
      .and()
      .withExternal()
      .source(RevisionState.REVISION_REQUESTED).target(RevisionState.ABORTED)
      .event(RevisionEvent.REVISION_BUDGET_EXHAUSTED);

    return builder.build();
  }
}
