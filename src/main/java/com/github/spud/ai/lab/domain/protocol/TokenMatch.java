package com.github.spud.ai.lab.domain.protocol;

/**
 * Outcome of applying a {@link TokenGrammar}. {@code token} is null when the grammar default was
 * used.
 */
public record TokenMatch(ProtocolSignal signal, String token) {

  public boolean isExplicit() {
    return token != null;
  }
}
