package com.github.spud.ai.lab.domain.protocol;

import com.github.spud.ai.lab.domain.agent.RoleConfig;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Single place where protocol tokens are recognized in agent output.
 * <p>
 * A token matches only as a whole word: it may not be directly preceded or followed by a letter,
 * digit or underscore, so {@code TERMINATE} does not fire inside {@code TERMINATE_CRITIC}.
 * <pre>
 * closer grammar : FINAL tokens -> FINAL, stop tokens -> HANDOFF, otherwise NONE
 * critic grammar : revise tokens -> REVISE, approve tokens -> APPROVE, otherwise REVISE
 * </pre>
 */
@Component
public class VerdictExtractor {

  private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

  public TokenMatch extract(String content, TokenGrammar grammar) {
    if (content != null) {
      for (TokenGrammar.Rule rule : grammar.rules()) {
        if (contains(content, rule.token())) {
          return new TokenMatch(rule.signal(), rule.token());
        }
      }
    }
    return new TokenMatch(grammar.defaultSignal(), null);
  }

  public TokenGrammar closerGrammar(RoleConfig closer) {
    return TokenGrammar.defaultingTo(ProtocolSignal.NONE)
      .rule(closer.getFinalTokens(), ProtocolSignal.FINAL)
      .rule(closer.getStopTokens(), ProtocolSignal.HANDOFF)
      .build();
  }

  public TokenGrammar criticGrammar(RoleConfig critic) {
    return TokenGrammar.defaultingTo(ProtocolSignal.REVISE)
      .rule(critic.getReviseTokens(), ProtocolSignal.REVISE)
      .rule(critic.getApproveTokens(), ProtocolSignal.APPROVE)
      .build();
  }

  public TokenGrammar completionGrammar(RoleConfig engineer) {
    return TokenGrammar.defaultingTo(ProtocolSignal.NONE)
      .rule(engineer.getStopTokens(), ProtocolSignal.DONE)
      .build();
  }

  public boolean contains(String content, String token) {
    if (content == null || token == null || token.isBlank()) {
      return false;
    }
    return pattern(token).matcher(content).find();
  }

  public boolean containsAny(String content, Collection<String> tokens) {
    return tokens.stream().anyMatch(token -> contains(content, token));
  }

  /**
   * Removes every occurrence of the given tokens and trims the result.
   */
  public String strip(String content, Collection<String> tokens) {
    if (content == null) {
      return "";
    }
    String stripped = content;
    for (String token : tokens) {
      if (token != null && !token.isBlank()) {
        stripped = pattern(token).matcher(stripped).replaceAll("");
      }
    }
    return stripped.trim();
  }

  private Pattern pattern(String token) {
    return patterns.computeIfAbsent(token.trim(),
      t -> Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(t) + "(?![A-Za-z0-9_])"));
  }
}
