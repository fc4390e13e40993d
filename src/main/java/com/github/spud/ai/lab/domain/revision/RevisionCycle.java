package com.github.spud.ai.lab.domain.revision;

import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Mutable bookkeeping of one cycle. Owned by {@link RevisionLoop#run} and never shared.
 */
@Data
@Builder
public class RevisionCycle {

  private String cycleId;

  private String task;

  private int maxRevisions;

  private int revisionCount;

  private int implementingVisits;

  @Builder.Default
  private RevisionVerdict lastVerdict = RevisionVerdict.PENDING;

  @Builder.Default
  private Transcript transcript = Transcript.empty();

  @Builder.Default
  private List<RevisionSummary> summaries = new ArrayList<>();

  private Turn lastCriticTurn;

  private String abortReason;

  public void record(Turn turn) {
    transcript = transcript.append(turn);
  }
}
