package com.github.spud.ai.lab.domain.notebook;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders notebook entries as markdown for prompts and the {@code read_notebook} tool.
 */
public class NotebookFormatter {

  static final String OMITTED_MARKER = "(earlier entries omitted)\n";

  private static final DateTimeFormatter TIMESTAMP =
    DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

  private NotebookFormatter() {
  }

  public static String render(NotebookEntry entry) {
    StringBuilder sb = new StringBuilder();
    sb.append("\n### [").append(entry.getTimestamp() == null ? "-" : TIMESTAMP.format(entry.getTimestamp()))
      .append("] ").append(entry.getSource())
      .append(" - ").append(entry.getType());
    if (entry.getSupersedes() != null) {
      sb.append(" (supersedes #").append(entry.getSupersedes()).append(')');
    }
    sb.append("\n\n").append(entry.getBody() == null ? "" : entry.getBody().strip()).append('\n');
    return sb.toString();
  }

  public static String render(List<NotebookEntry> entries) {
    return render(entries, Integer.MAX_VALUE);
  }

  /**
   * Newest entries that fit in {@code charLimit}, oldest first. Whole entries only; when anything
   * is dropped the output starts with an omission marker. The newest entry is always kept, cut
   * from the front if it alone exceeds the limit.
   */
  public static String render(List<NotebookEntry> entries, int charLimit) {
    if (entries.isEmpty()) {
      return "(notebook is empty)";
    }
    Deque<String> kept = new ArrayDeque<>();
    int size = 0;
    for (int i = entries.size() - 1; i >= 0; i--) {
      String rendered = render(entries.get(i));
      if (size + rendered.length() > charLimit) {
        if (kept.isEmpty()) {
          kept.addFirst(rendered.substring(rendered.length() - Math.max(0, charLimit)));
        }
        return OMITTED_MARKER + String.join("", kept);
      }
      kept.addFirst(rendered);
      size += rendered.length();
    }
    return String.join("", kept);
  }
}
