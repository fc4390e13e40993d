package com.github.spud.ai.lab.domain.notebook;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class NotebookFormatterTest {

  private static NotebookEntry entry(long sequence, String body) {
    return NotebookEntry.of(AuthorTeam.PLANNING, "principal_scientist", EntryType.PLAN, body)
      .toBuilder()
      .sequence(sequence)
      .timestamp(Instant.parse("2025-03-01T12:00:00Z"))
      .build();
  }

  @Test
  void rendersHeaderAndBody() {
    String rendered = NotebookFormatter.render(entry(1, "  Explore the data.  "));

    assertThat(rendered)
      .startsWith("\n### [")
      .contains("] principal_scientist - PLAN\n\nExplore the data.\n")
      .doesNotContain("supersedes");
  }

  @Test
  void rendersSupersedesReference() {
    NotebookEntry correction = entry(4, "Use the v2 split.").toBuilder().supersedes(2L).build();

    assertThat(NotebookFormatter.render(correction)).contains("PLAN (supersedes #2)");
  }

  @Test
  void emptyNotebookHasPlaceholder() {
    assertThat(NotebookFormatter.render(List.of())).isEqualTo("(notebook is empty)");
  }

  @Test
  void charLimitKeepsNewestWholeEntries() {
    NotebookEntry first = entry(1, "first entry " + "x".repeat(200));
    NotebookEntry second = entry(2, "second entry");
    NotebookEntry third = entry(3, "third entry");
    int limit = NotebookFormatter.render(second).length() + NotebookFormatter.render(third).length();

    String rendered = NotebookFormatter.render(List.of(first, second, third), limit);

    assertThat(rendered)
      .startsWith(NotebookFormatter.OMITTED_MARKER)
      .doesNotContain("first entry")
      .contains("second entry")
      .contains("third entry");
    assertThat(rendered.indexOf("second entry")).isLessThan(rendered.indexOf("third entry"));
  }

  @Test
  void everythingFitsWithoutMarker() {
    String rendered = NotebookFormatter.render(List.of(entry(1, "a"), entry(2, "b")), 100_000);

    assertThat(rendered).doesNotContain(NotebookFormatter.OMITTED_MARKER.strip());
  }

  @Test
  void oversizedNewestEntryIsCutFromTheFront() {
    NotebookEntry huge = entry(1, "head " + "y".repeat(500) + " tail");

    String rendered = NotebookFormatter.render(List.of(huge), 50);

    assertThat(rendered).startsWith(NotebookFormatter.OMITTED_MARKER);
    assertThat(rendered.substring(NotebookFormatter.OMITTED_MARKER.length())).hasSize(50);
    assertThat(rendered).contains("tail").doesNotContain("head");
  }
}
