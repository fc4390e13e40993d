package com.github.spud.ai.lab.domain.revision;

import com.github.spud.ai.lab.domain.message.Turn;
import com.github.spud.ai.lab.domain.protocol.VerdictExtractor;
import java.util.Collection;
import java.util.List;

/**
 * Renders the last messages of a revision cycle as the report read by the planning team.
 */
public class ImplementationReportFormatter {

  static final String HEADER = "# IMPLEMENTATION REPORT\n\n";
  static final String SEPARATOR = "=".repeat(80);

  private ImplementationReportFormatter() {
  }

  public static String format(List<Turn> turns, int messageLimit, Collection<String> tokens,
    VerdictExtractor verdictExtractor) {
    List<Turn> tail = turns.size() > messageLimit
      ? turns.subList(turns.size() - messageLimit, turns.size())
      : turns;
    StringBuilder sb = new StringBuilder(HEADER);
    for (int i = 0; i < tail.size(); i++) {
      Turn turn = tail.get(i);
      sb.append("\n## Message ").append(i + 1).append(" from ").append(turn.getAuthor()).append('\n');
      sb.append(verdictExtractor.strip(turn.getContent(), tokens)).append('\n');
      sb.append(SEPARATOR).append('\n');
    }
    return sb.toString();
  }
}
