package com.github.spud.ai.lab.domain.revision;

import com.github.spud.ai.lab.domain.message.Transcript;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RevisionResult {

  String cycleId;

  RevisionState finalState;

  int revisionCount;

  int implementingVisits;

  RevisionVerdict lastVerdict;

  Transcript transcript;

  List<RevisionSummary> summaries;

  /**
   * Formatted tail of the cycle handed back to the planning team
   */
  String report;

  /**
   * Critic's last turn without protocol tokens, null when the critic never spoke
   */
  String criticSummary;

  /**
   * Why the cycle ended ABORTED, null otherwise
   */
  String abortReason;

  public boolean isApproved() {
    return finalState == RevisionState.APPROVED;
  }
}
