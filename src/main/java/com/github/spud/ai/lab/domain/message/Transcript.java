package com.github.spud.ai.lab.domain.message;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, append-only sequence of turns. {@link #append(Turn)} returns a new transcript and
 * never touches the receiver.
 */
public final class Transcript {

  private static final Transcript EMPTY = new Transcript(List.of());

  private final List<Turn> turns;

  private Transcript(List<Turn> turns) {
    this.turns = turns;
  }

  public static Transcript empty() {
    return EMPTY;
  }

  public static Transcript of(List<Turn> turns) {
    return new Transcript(List.copyOf(turns));
  }

  public Transcript append(Turn turn) {
    if (turn == null) {
      throw new IllegalArgumentException("Turn must not be null");
    }
    List<Turn> next = new ArrayList<>(turns.size() + 1);
    next.addAll(turns);
    next.add(turn);
    return new Transcript(List.copyOf(next));
  }

  public List<Turn> turns() {
    return turns;
  }

  public int size() {
    return turns.size();
  }

  public boolean isEmpty() {
    return turns.isEmpty();
  }

  public Optional<Turn> last() {
    return turns.isEmpty() ? Optional.empty() : Optional.of(turns.get(turns.size() - 1));
  }

  public Optional<Turn> lastBy(String author) {
    for (int i = turns.size() - 1; i >= 0; i--) {
      if (turns.get(i).getAuthor().equals(author)) {
        return Optional.of(turns.get(i));
      }
    }
    return Optional.empty();
  }

  /**
   * The newest {@code n} turns, oldest first.
   */
  public List<Turn> tail(int n) {
    if (n <= 0) {
      return List.of();
    }
    return turns.subList(Math.max(0, turns.size() - n), turns.size());
  }

  @Override
  public String toString() {
    return "Transcript{turns=" + turns.size() + "}";
  }
}
