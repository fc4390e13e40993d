package com.github.spud.ai.lab.domain.agent;

import lombok.experimental.SuperBuilder;

/**
 * Planning members and the critic. Any final answer ends the turn; protocol tokens in it are
 * interpreted by the chat that scheduled the turn. A blank answer never gets here:
 * {@link com.github.spud.ai.lab.domain.protocol.react.ReactJsonAction#validate} rejects it as a
 * parse error.
 */
@SuperBuilder
public class DiscussionAgent extends ReActTurnAgent {

  @Override
  protected String validateFinalAnswer(String answer) {
    return null;
  }
}
