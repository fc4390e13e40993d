package com.github.spud.ai.lab.domain.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TurnTest {

  @Test
  void surfacesFailedToolCallsInContent() {
    Turn turn = Turn.builder()
      .author("engineer")
      .content("Tried to load the data.")
      .toolCall(ToolInvocation.success("search_directory", "{}", "Found 1 file(s)", 3))
      .toolCall(ToolInvocation.failure("read_text_file", "{}", "File not found: betas.csv", 1))
      .build();

    Turn surfaced = turn.withSurfacedToolFailures();

    assertThat(surfaced.getContent())
      .startsWith("Tried to load the data.")
      .contains("[tool error] read_text_file: File not found: betas.csv")
      .doesNotContain("search_directory");
    assertThat(surfaced.getToolCalls()).hasSize(2);
    assertThat(surfaced.getTimestamp()).isEqualTo(turn.getTimestamp());
  }

  @Test
  void leavesAlreadyQuotedFailuresAlone() {
    Turn turn = Turn.builder()
      .author("engineer")
      .content("read_text_file said: File not found: betas.csv")
      .toolCall(ToolInvocation.failure("read_text_file", "{}", "File not found: betas.csv", 1))
      .build();

    assertThat(turn.withSurfacedToolFailures()).isSameAs(turn);
  }

  @Test
  void timeoutCountsAsFailure() {
    ToolInvocation timeout = ToolInvocation.timeout("execute_code", "{}", 500);

    assertThat(timeout.isSuccess()).isFalse();
    assertThat(timeout.isTimedOut()).isTrue();
    assertThat(timeout.getError()).contains("timed out after 500ms");
  }

  @Test
  void transcriptAppendDoesNotModifyReceiver() {
    Transcript empty = Transcript.empty();
    Turn first = Turn.builder().author("lead").content("one").build();
    Turn second = Turn.builder().author("expert").content("two").build();

    Transcript one = empty.append(first);
    Transcript two = one.append(second);

    assertThat(empty.isEmpty()).isTrue();
    assertThat(one.size()).isEqualTo(1);
    assertThat(two.turns()).containsExactly(first, second);
    assertThat(two.last()).contains(second);
    assertThat(two.lastBy("lead")).contains(first);
    assertThat(two.lastBy("critic")).isEmpty();
    assertThat(two.tail(1)).containsExactly(second);
    assertThat(two.tail(5)).containsExactly(first, second);
    assertThat(two.tail(0)).isEmpty();
    assertThatThrownBy(() -> two.turns().add(first))
      .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void transcriptRejectsNullTurn() {
    assertThatThrownBy(() -> Transcript.empty().append(null))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
