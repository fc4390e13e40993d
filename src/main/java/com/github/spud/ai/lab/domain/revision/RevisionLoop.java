package com.github.spud.ai.lab.domain.revision;

import com.github.spud.ai.lab.domain.agent.Agent;
import com.github.spud.ai.lab.domain.message.Turn;
import com.github.spud.ai.lab.domain.protocol.ProtocolSignal;
import com.github.spud.ai.lab.domain.protocol.TokenGrammar;
import com.github.spud.ai.lab.domain.protocol.TokenMatch;
import com.github.spud.ai.lab.domain.protocol.VerdictExtractor;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;

/**
 * Implement, review, then approve or revise, driven by a {@link RevisionState} machine.
 * <p>
 * With {@code maxRevisions = N} the engineer is scheduled at most N+1 times. A cycle is only
 * APPROVED after the critic's turn carried an approve token and no revise token.
 */
@Slf4j
@Getter
public class RevisionLoop {

  static final String NO_VERDICT_RATIONALE = "no explicit verdict";

  static final String DIRECTORY_INSTRUCTION = """
    IMPORTANT FILE PATH INSTRUCTIONS:
    ALL output files (scripts, plots, data, models) MUST be saved in this directory:
    %s
    Do not save files anywhere else.""";

  static final String NOTEBOOK_REMINDER = """
    When you are done, use write_notebook to record important data insights, significant \
    implementation decisions and key metrics. The planning team reads the notebook to decide \
    the next step.""";

  static final String ACKNOWLEDGE_FEEDBACK = """
    CRITICAL REQUIREMENT: before changing anything, explicitly acknowledge each point of the \
    critic's feedback. Begin your answer with "I acknowledge the following feedback points from \
    the critic:" followed by a numbered restatement of every point and your plan for each.""";

  static final String REVIEW_INSTRUCTION = """
    Review the engineer's latest work against the plan above. Use your tools to inspect output \
    files in %s and the lab notebook where useful. In follow-up reviews focus on whether your \
    previous feedback was addressed.""";

  private final Agent engineer;
  private final Agent critic;
  private final int maxRevisions;
  private final int reportMessageLimit;
  private final String outputDir;
  private final VerdictExtractor verdictExtractor;
  private final StateMachineDriver stateMachineDriver;
  private final TokenGrammar completionGrammar;
  private final TokenGrammar criticGrammar;

  @Builder
  public RevisionLoop(Agent engineer, Agent critic, int maxRevisions, int reportMessageLimit,
    String outputDir, VerdictExtractor verdictExtractor, StateMachineDriver stateMachineDriver) {
    if (engineer == null || critic == null) {
      throw new IllegalArgumentException("A revision loop needs an engineer and a critic");
    }
    if (maxRevisions < 0) {
      throw new IllegalArgumentException("maxRevisions must not be negative, got " + maxRevisions);
    }
    this.engineer = engineer;
    this.critic = critic;
    this.maxRevisions = maxRevisions;
    this.reportMessageLimit = reportMessageLimit > 0 ? reportMessageLimit : 25;
    this.outputDir = outputDir != null ? outputDir : "output";
    this.verdictExtractor = verdictExtractor;
    this.stateMachineDriver = stateMachineDriver;
    this.completionGrammar = verdictExtractor.completionGrammar(engineer.getRole());
    this.criticGrammar = verdictExtractor.criticGrammar(critic.getRole());
  }

  /**
   * Runs one cycle on the given plan.
   *
   * @throws com.github.spud.ai.lab.domain.agent.FatalAgentException from an agent turn
   */
  public RevisionResult run(String plan) {
    RevisionCycle cycle = RevisionCycle.builder()
      .cycleId("revision-" + UUID.randomUUID().toString().substring(0, 8))
      .task(plan)
      .maxRevisions(maxRevisions)
      .build();
    log.info("[{}] starting revision cycle (maxRevisions={})", cycle.getCycleId(), maxRevisions);

    StateMachine<RevisionState, RevisionEvent> sm = stateMachineDriver.create(cycle.getCycleId());
    try {
      while (!stateMachineDriver.isInFinalState(sm)) {
        RevisionState state = stateMachineDriver.getCurrentState(sm);
        switch (state) {
          case IMPLEMENTING:
            implement(cycle, sm);
            break;
          case AWAITING_REVIEW:
            review(cycle, sm);
            break;
          case REVISION_REQUESTED:
            decideRevision(cycle, sm);
            break;
          default:
            throw new IllegalStateException("Unexpected revision state " + state);
        }
      }
      return toResult(cycle, stateMachineDriver.getCurrentState(sm));
    } finally {
      stateMachineDriver.stop(sm);
    }
  }

  private void implement(RevisionCycle cycle, StateMachine<RevisionState, RevisionEvent> sm) {
    cycle.setImplementingVisits(cycle.getImplementingVisits() + 1);
    log.info("[{}] engineer turn (visit {}, revision {})", cycle.getCycleId(),
      cycle.getImplementingVisits(), cycle.getRevisionCount());

    Turn turn = engineer.takeTurn(cycle.getTranscript(), engineerContext(cycle))
      .withSurfacedToolFailures();
    cycle.record(turn);

    TokenMatch match = verdictExtractor.extract(turn.getContent(), completionGrammar);
    if (match.signal() == ProtocolSignal.DONE) {
      transition(cycle, sm, RevisionEvent.ENGINEER_DONE, RevisionVerdict.PENDING,
        "engineer reported completion");
    } else {
      cycle.setAbortReason("engineer step budget exhausted without a completion token");
      transition(cycle, sm, RevisionEvent.ENGINEER_BUDGET_EXHAUSTED, cycle.getLastVerdict(),
        cycle.getAbortReason());
    }
  }

  private void review(RevisionCycle cycle, StateMachine<RevisionState, RevisionEvent> sm) {
    log.info("[{}] critic review (revision {})", cycle.getCycleId(), cycle.getRevisionCount());

    Turn turn = critic.takeTurn(cycle.getTranscript(), criticContext(cycle))
      .withSurfacedToolFailures();
    cycle.record(turn);
    cycle.setLastCriticTurn(turn);

    TokenMatch match = verdictExtractor.extract(turn.getContent(), criticGrammar);
    String rationale;
    if (match.isExplicit()) {
      rationale = excerpt(stripTokens(turn.getContent()), 500);
    } else {
      log.warn("[{}] critic turn carried no verdict token, treating it as REVISE",
        cycle.getCycleId());
      rationale = NO_VERDICT_RATIONALE;
    }

    if (match.signal() == ProtocolSignal.APPROVE) {
      transition(cycle, sm, RevisionEvent.CRITIC_APPROVE, RevisionVerdict.APPROVED, rationale);
    } else {
      transition(cycle, sm, RevisionEvent.CRITIC_REVISE, RevisionVerdict.REVISE, rationale);
    }
  }

  private void decideRevision(RevisionCycle cycle,
    StateMachine<RevisionState, RevisionEvent> sm) {
    if (cycle.getRevisionCount() >= cycle.getMaxRevisions()) {
      cycle.setAbortReason("revision budget of " + cycle.getMaxRevisions() + " exhausted");
      log.warn("[{}] {}", cycle.getCycleId(), cycle.getAbortReason());
      transition(cycle, sm, RevisionEvent.REVISION_BUDGET_EXHAUSTED, cycle.getLastVerdict(),
        cycle.getAbortReason());
      return;
    }
    cycle.setRevisionCount(cycle.getRevisionCount() + 1);
    transition(cycle, sm, RevisionEvent.RESUME_IMPLEMENTATION, cycle.getLastVerdict(),
      "revision " + cycle.getRevisionCount() + " of " + cycle.getMaxRevisions());
  }

  private void transition(RevisionCycle cycle, StateMachine<RevisionState, RevisionEvent> sm,
    RevisionEvent event, RevisionVerdict verdict, String rationale) {
    RevisionState from = stateMachineDriver.getCurrentState(sm);
    RevisionState to = stateMachineDriver.sendEvent(sm, event);
    cycle.setLastVerdict(verdict);
    cycle.getSummaries().add(RevisionSummary.builder()
      .cycleId(cycle.getCycleId())
      .task(excerpt(cycle.getTask(), 200))
      .from(from)
      .to(to)
      .event(event)
      .verdict(verdict)
      .rationale(rationale)
      .revision(cycle.getRevisionCount())
      .build());
    log.info("[{}] {} -> {} on {} (verdict={})", cycle.getCycleId(), from, to, event, verdict);
  }

  String engineerContext(RevisionCycle cycle) {
    StringBuilder sb = new StringBuilder();
    sb.append("# PLAN FROM THE PLANNING TEAM\n").append(cycle.getTask()).append("\n\n");
    sb.append(String.format(DIRECTORY_INSTRUCTION, outputDir)).append("\n\n");
    sb.append(NOTEBOOK_REMINDER);
    Turn lastCritic = cycle.getLastCriticTurn();
    if (lastCritic != null) {
      sb.append("\n\n# CRITIC FEEDBACK (revision ").append(cycle.getRevisionCount())
        .append(" of ").append(cycle.getMaxRevisions()).append(")\n")
        .append(stripTokens(lastCritic.getContent())).append("\n\n")
        .append(ACKNOWLEDGE_FEEDBACK);
    }
    return sb.toString();
  }

  String criticContext(RevisionCycle cycle) {
    return "# PLAN FROM THE PLANNING TEAM\n" + cycle.getTask() + "\n\n"
      + String.format(REVIEW_INSTRUCTION, outputDir);
  }

  private RevisionResult toResult(RevisionCycle cycle, RevisionState finalState) {
    List<Turn> turns = cycle.getTranscript().turns();
    String report = ImplementationReportFormatter.format(turns, reportMessageLimit,
      protocolTokens(), verdictExtractor);
    Turn lastCritic = cycle.getLastCriticTurn();
    log.info("[{}] cycle finished in {} after {} revision(s), {} engineer visit(s)",
      cycle.getCycleId(), finalState, cycle.getRevisionCount(), cycle.getImplementingVisits());
    return RevisionResult.builder()
      .cycleId(cycle.getCycleId())
      .finalState(finalState)
      .revisionCount(cycle.getRevisionCount())
      .implementingVisits(cycle.getImplementingVisits())
      .lastVerdict(cycle.getLastVerdict())
      .transcript(cycle.getTranscript())
      .summaries(List.copyOf(cycle.getSummaries()))
      .report(report)
      .criticSummary(lastCritic == null ? null : stripTokens(lastCritic.getContent()))
      .abortReason(finalState == RevisionState.ABORTED ? cycle.getAbortReason() : null)
      .build();
  }

  private List<String> protocolTokens() {
    return Stream.concat(engineer.getRole().allTokens().stream(),
      critic.getRole().allTokens().stream()).toList();
  }

  private String stripTokens(String content) {
    return verdictExtractor.strip(content, protocolTokens());
  }

  private static String excerpt(String text, int maxLen) {
    if (text == null) {
      return "";
    }
    String trimmed = text.strip();
    return trimmed.length() > maxLen ? trimmed.substring(0, maxLen) + "..." : trimmed;
  }
}
