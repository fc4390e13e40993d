package com.github.spud.ai.lab.domain.chat;

import com.github.spud.ai.lab.domain.agent.Agent;
import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;
import com.github.spud.ai.lab.domain.protocol.ProtocolSignal;
import com.github.spud.ai.lab.domain.protocol.TokenGrammar;
import com.github.spud.ai.lab.domain.protocol.TokenMatch;
import com.github.spud.ai.lab.domain.protocol.VerdictExtractor;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-order rotation among participants until the closer stops it or the turn cap is reached.
 * <p>
 * Only the closer's turns are checked against the stop grammar. Stop tokens from anyone else are
 * logged and ignored. A failed tool call is written into its turn before the next participant
 * speaks.
 */
@Slf4j
@Getter
public class RoundRobinSubChat {

  private final String name;
  private final List<Agent> participants;
  private final Agent closer;
  private final int maxTurns;
  private final VerdictExtractor verdictExtractor;
  private final TokenGrammar closerGrammar;

  @Builder
  public RoundRobinSubChat(String name, List<Agent> participants, Agent closer, int maxTurns,
    VerdictExtractor verdictExtractor) {
    if (participants == null || participants.isEmpty()) {
      throw new IllegalArgumentException("A sub-chat needs at least one participant");
    }
    if (closer == null || !participants.contains(closer)) {
      throw new IllegalArgumentException("The closer must be one of the participants");
    }
    if (maxTurns < 1) {
      throw new IllegalArgumentException("maxTurns must be at least 1, got " + maxTurns);
    }
    this.name = name != null ? name : "sub-chat";
    this.participants = List.copyOf(participants);
    this.closer = closer;
    this.maxTurns = maxTurns;
    this.verdictExtractor = verdictExtractor;
    this.closerGrammar = verdictExtractor.closerGrammar(closer.getRole());
  }

  public SubChatResult run(String taskContext) {
    return run(taskContext, Transcript.empty());
  }

  /**
   * Runs the rotation starting from the first participant.
   *
   * @throws com.github.spud.ai.lab.domain.agent.FatalAgentException from a participant's turn
   */
  public SubChatResult run(String taskContext, Transcript initial) {
    log.info("[{}] starting: participants={}, closer={}, maxTurns={}", name,
      participants.stream().map(Agent::getId).collect(Collectors.joining(",")), closer.getId(),
      maxTurns);

    Transcript transcript = initial;
    int cursor = 0;
    for (int turnNo = 1; turnNo <= maxTurns; turnNo++) {
      Agent speaker = participants.get(cursor);
      Turn turn = speaker.takeTurn(transcript, taskContext).withSurfacedToolFailures();
      transcript = transcript.append(turn);
      cursor = (cursor + 1) % participants.size();

      if (speaker == closer) {
        TokenMatch match = verdictExtractor.extract(turn.getContent(), closerGrammar);
        if (match.signal() == ProtocolSignal.FINAL || match.signal() == ProtocolSignal.HANDOFF) {
          SubChatOutcome outcome = match.signal() == ProtocolSignal.FINAL
            ? SubChatOutcome.FINAL : SubChatOutcome.HANDOFF;
          log.info("[{}] {} by {} after {} turn(s) (token {})", name, outcome, speaker.getId(),
            turnNo, match.token());
          return result(outcome, transcript, match.token());
        }
      } else if (verdictExtractor.containsAny(turn.getContent(), closer.getRole().allTokens())) {
        log.warn("[{}] ignoring stop token from non-closer {} on turn {}", name, speaker.getId(),
          turnNo);
      }
    }

    log.warn("[{}] turn cap of {} reached without a stop from {}", name, maxTurns,
      closer.getId());
    return result(SubChatOutcome.ROUND_CAP_EXCEEDED, transcript, null);
  }

  private SubChatResult result(SubChatOutcome outcome, Transcript transcript, String token) {
    Turn last = transcript.lastBy(closer.getId()).orElse(null);
    String output = last == null ? ""
      : verdictExtractor.strip(last.getContent(), closer.getRole().allTokens());
    return SubChatResult.builder()
      .chatName(name)
      .outcome(outcome)
      .transcript(transcript)
      .output(output)
      .stopToken(token)
      .build();
  }
}
