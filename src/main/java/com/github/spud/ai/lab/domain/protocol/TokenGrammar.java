package com.github.spud.ai.lab.domain.protocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered token rules plus a default signal. Rules are tried in declaration order and the first
 * token present in the text wins.
 */
public final class TokenGrammar {

  private final List<Rule> rules;
  private final ProtocolSignal defaultSignal;

  private TokenGrammar(List<Rule> rules, ProtocolSignal defaultSignal) {
    this.rules = List.copyOf(rules);
    this.defaultSignal = defaultSignal;
  }

  public static Builder defaultingTo(ProtocolSignal defaultSignal) {
    return new Builder(defaultSignal);
  }

  public List<Rule> rules() {
    return rules;
  }

  public ProtocolSignal defaultSignal() {
    return defaultSignal;
  }

  public record Rule(String token, ProtocolSignal signal) {

  }

  public static final class Builder {

    private final List<Rule> rules = new ArrayList<>();
    private final ProtocolSignal defaultSignal;

    private Builder(ProtocolSignal defaultSignal) {
      this.defaultSignal = defaultSignal;
    }

    public Builder rule(Collection<String> tokens, ProtocolSignal signal) {
      for (String token : tokens) {
        if (token != null && !token.isBlank()) {
          rules.add(new Rule(token.trim(), signal));
        }
      }
      return this;
    }

    public TokenGrammar build() {
      return new TokenGrammar(rules, defaultSignal);
    }
  }
}
