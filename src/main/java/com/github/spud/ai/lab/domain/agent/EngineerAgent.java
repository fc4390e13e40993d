package com.github.spud.ai.lab.domain.agent;

import lombok.experimental.SuperBuilder;

/**
 * Implementation engineer. A final answer is accepted only when it carries one of the role's
 * completion tokens, so a returned turn either completed its work or ran out of steps.
 */
@SuperBuilder
public class EngineerAgent extends ReActTurnAgent {

  static final String MISSING_TOKEN_PROMPT = """
    [hint] Your final answer does not contain %s. If the assigned tasks are not finished yet,
    keep working with tools. If they are finished, repeat your final answer ending with %s.""";

  @Override
  protected String validateFinalAnswer(String answer) {
    if (role.getStopTokens().isEmpty() || verdictExtractor.containsAny(answer, role.getStopTokens())) {
      return null;
    }
    String tokens = String.join(" or ", role.getStopTokens());
    return String.format(MISSING_TOKEN_PROMPT, tokens, tokens);
  }
}
