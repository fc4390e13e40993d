package com.github.spud.ai.lab.domain.orchestrator;

import com.github.spud.ai.lab.domain.agent.FatalAgentException;
import com.github.spud.ai.lab.domain.chat.RoundRobinSubChat;
import com.github.spud.ai.lab.domain.chat.SubChatResult;
import com.github.spud.ai.lab.domain.notebook.AuthorTeam;
import com.github.spud.ai.lab.domain.notebook.EntryType;
import com.github.spud.ai.lab.domain.notebook.NotebookEntry;
import com.github.spud.ai.lab.domain.notebook.NotebookFormatter;
import com.github.spud.ai.lab.domain.notebook.NotebookStore;
import com.github.spud.ai.lab.domain.notebook.NotebookStoreException;
import com.github.spud.ai.lab.domain.revision.RevisionLoop;
import com.github.spud.ai.lab.domain.revision.RevisionResult;
import com.github.spud.ai.lab.domain.revision.RevisionSummary;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Alternates the planning discussion and the implementation cycle over a bounded number of outer
 * iterations, writing every plan and outcome to the notebook.
 * <pre>
 * planning FINAL              -> PLAN + COMPLETION, run SUCCESS
 * planning ROUND_CAP_EXCEEDED -> NOTE, run ABORTED
 * planning HANDOFF            -> PLAN, revision cycle, OUTPUT
 * budget used up              -> run INCOMPLETE
 * store or model failure      -> run FAILED
 * </pre>
 */
@Slf4j
@Getter
public class LabOrchestrator {

  static final String SYSTEM_SOURCE = "system";
  static final String SUMMARY_SOURCE = "implementation_summary";
  static final String TRANSITION_SOURCE = "revision_loop";

  private final RoundRobinSubChat planningChat;
  private final RevisionLoop revisionLoop;
  private final NotebookStore notebookStore;
  private final PlanningPromptFormatter promptFormatter;
  private final int maxOuterIterations;
  private final int notebookCharLimit;
  private final boolean persistTransitions;

  @Builder
  public LabOrchestrator(RoundRobinSubChat planningChat, RevisionLoop revisionLoop,
    NotebookStore notebookStore, PlanningPromptFormatter promptFormatter, int maxOuterIterations,
    int notebookCharLimit, boolean persistTransitions) {
    if (maxOuterIterations < 1) {
      throw new IllegalArgumentException(
        "maxOuterIterations must be at least 1, got " + maxOuterIterations);
    }
    this.planningChat = planningChat;
    this.revisionLoop = revisionLoop;
    this.notebookStore = notebookStore;
    this.promptFormatter = promptFormatter;
    this.maxOuterIterations = maxOuterIterations;
    this.notebookCharLimit = notebookCharLimit > 0 ? notebookCharLimit : 100_000;
    this.persistTransitions = persistTransitions;
  }

  public RunResult run() {
    String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
    Instant startTime = Instant.now();
    OrchestratorState state = OrchestratorState.builder()
      .maxIterations(maxOuterIterations)
      .build();
    log.info("[{}] starting research run (maxOuterIterations={})", runId, maxOuterIterations);

    try {
      RunResult resumed = prepareNotebook(runId, state, startTime);
      if (resumed != null) {
        return resumed;
      }

      while (state.budgetLeft()) {
        state.setIteration(state.getIteration() + 1);
        RunResult finished = runIteration(runId, state, startTime);
        if (finished != null) {
          return finished;
        }
      }

      String reason = "outer iteration budget of " + maxOuterIterations + " exhausted";
      log.warn("[{}] {}", runId, reason);
      return RunResult.fromState(runId, state, RunStatus.INCOMPLETE, reason, startTime);

    } catch (NotebookStoreException | FatalAgentException e) {
      log.error("[{}] run failed in iteration {}: {}", runId, state.getIteration(),
        e.getMessage(), e);
      state.setTerminal(true);
      return RunResult.error(runId, state, e, startTime);
    }
  }

  /**
   * Seeds an empty notebook or resumes from an existing one. Returns a result when the notebook
   * already records completion.
   */
  private RunResult prepareNotebook(String runId, OrchestratorState state, Instant startTime) {
    List<NotebookEntry> existing = notebookStore.read();
    if (existing.isEmpty()) {
      notebookStore.append(NotebookEntry.of(AuthorTeam.SYSTEM, SYSTEM_SOURCE, EntryType.NOTE,
        "Lab notebook created.\n\n" + promptFormatter.getProjectBrief()));
      return null;
    }

    if (existing.stream().anyMatch(e -> e.getType() == EntryType.COMPLETION)) {
      log.info("[{}] notebook already records project completion, nothing to do", runId);
      state.setTerminal(true);
      return RunResult.fromState(runId, state, RunStatus.SUCCESS,
        "notebook already records completion", startTime);
    }

    for (int i = existing.size() - 1; i >= 0; i--) {
      NotebookEntry entry = existing.get(i);
      if (entry.getType() == EntryType.OUTPUT && SUMMARY_SOURCE.equals(entry.getSource())) {
        state.setLastReport(entry.getBody());
        log.info("[{}] resuming from notebook entry #{}", runId, entry.getSequence());
        break;
      }
    }
    return null;
  }

  private RunResult runIteration(String runId, OrchestratorState state, Instant startTime) {
    long iterationStart = System.currentTimeMillis();
    int iteration = state.getIteration();
    String closerId = planningChat.getCloser().getId();
    log.info("[{}] iteration {}/{}: planning", runId, iteration, maxOuterIterations);

    String notebook = NotebookFormatter.render(notebookStore.read(), notebookCharLimit);
    SubChatResult planning = planningChat.run(
      promptFormatter.format(notebook, state.getLastReport()));
    state.setLastPlan(planning.getOutput());

    IterationRecord.IterationRecordBuilder record = IterationRecord.builder()
      .iteration(iteration)
      .planningOutcome(planning.getOutcome())
      .planningTurns(planning.getTurnCount());

    switch (planning.getOutcome()) {
      case FINAL:
        notebookStore.append(NotebookEntry.of(AuthorTeam.PLANNING, closerId, EntryType.PLAN,
          planning.getOutput()));
        notebookStore.append(NotebookEntry.of(AuthorTeam.PLANNING, closerId,
          EntryType.COMPLETION, "PROJECT COMPLETED: " + closerId
            + " verified that all requirements are satisfied."));
        finishIteration(state, record, iterationStart);
        state.setTerminal(true);
        log.info("[{}] project completed in iteration {}", runId, iteration);
        return RunResult.fromState(runId, state, RunStatus.SUCCESS,
          "project completed in iteration " + iteration, startTime);

      case ROUND_CAP_EXCEEDED:
        String reason = "planning discussion reached its cap of " + planningChat.getMaxTurns()
          + " turns without a handoff";
        notebookStore.append(NotebookEntry.of(AuthorTeam.SYSTEM, SYSTEM_SOURCE, EntryType.NOTE,
          "Iteration " + iteration + ": " + reason + "."));
        finishIteration(state, record, iterationStart);
        state.setTerminal(true);
        log.warn("[{}] {}", runId, reason);
        return RunResult.fromState(runId, state, RunStatus.ABORTED, reason, startTime);

      case HANDOFF:
      default:
        notebookStore.append(NotebookEntry.of(AuthorTeam.PLANNING, closerId, EntryType.PLAN,
          planning.getOutput()));
        break;
    }

    log.info("[{}] iteration {}/{}: implementation", runId, iteration, maxOuterIterations);
    RevisionResult revision = revisionLoop.run(planning.getOutput());
    state.setLastReport(revision.getReport());
    record.revisionOutcome(revision.getFinalState())
      .revisionCount(revision.getRevisionCount());

    if (persistTransitions) {
      for (RevisionSummary summary : revision.getSummaries()) {
        notebookStore.append(NotebookEntry.of(AuthorTeam.IMPLEMENTATION, TRANSITION_SOURCE,
          EntryType.NOTE, summary.toNotebookBody()));
      }
    }
    notebookStore.append(NotebookEntry.of(AuthorTeam.IMPLEMENTATION, SUMMARY_SOURCE,
      EntryType.OUTPUT, iterationSummary(iteration, revision)));

    finishIteration(state, record, iterationStart);
    return null;
  }

  private void finishIteration(OrchestratorState state,
    IterationRecord.IterationRecordBuilder record, long iterationStart) {
    state.getRecords().add(record.durationMs(System.currentTimeMillis() - iterationStart).build());
  }

  static String iterationSummary(int iteration, RevisionResult revision) {
    StringBuilder sb = new StringBuilder();
    sb.append("Completed iteration ").append(iteration).append(". Revision cycle ended ")
      .append(revision.getFinalState()).append(" after ").append(revision.getRevisionCount())
      .append(" revision(s)");
    if (revision.getAbortReason() != null) {
      sb.append(" (").append(revision.getAbortReason()).append(')');
    }
    sb.append(".\n\n");
    if (revision.getCriticSummary() != null) {
      sb.append("Critic summary:\n\n").append(revision.getCriticSummary());
    } else {
      sb.append("The critic did not review this cycle.");
    }
    return sb.toString();
  }
}
