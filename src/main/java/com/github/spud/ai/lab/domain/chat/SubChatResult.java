package com.github.spud.ai.lab.domain.chat;

import com.github.spud.ai.lab.domain.message.Transcript;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubChatResult {

  String chatName;

  SubChatOutcome outcome;

  Transcript transcript;

  /**
   * The closer's last turn with protocol tokens removed; empty when the closer never spoke
   */
  String output;

  /**
   * Token that ended the chat, null on ROUND_CAP_EXCEEDED
   */
  String stopToken;

  public int getTurnCount() {
    return transcript.size();
  }
}
