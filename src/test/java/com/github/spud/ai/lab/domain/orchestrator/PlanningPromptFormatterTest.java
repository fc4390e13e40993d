package com.github.spud.ai.lab.domain.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PlanningPromptFormatterTest {

  private final PlanningPromptFormatter formatter =
    new PlanningPromptFormatter("  name: clock\ngoal: MAE < 5  ");

  @Test
  void includesAllSectionsInOrder() {
    String prompt = formatter.format("### entry one", "# IMPLEMENTATION REPORT\nMAE 4.9");

    assertThat(prompt).startsWith("TASK CONFIG:\nname: clock\ngoal: MAE < 5\n\n");
    int notebook = prompt.indexOf("# LAB NOTEBOOK CONTENT\n### entry one");
    int report = prompt.indexOf("# LATEST IMPLEMENTATION REPORT\n# IMPLEMENTATION REPORT");
    int task = prompt.indexOf("# YOUR CURRENT TASK");
    assertThat(notebook).isPositive();
    assertThat(report).isGreaterThan(notebook);
    assertThat(task).isGreaterThan(report);
  }

  @Test
  void omitsMissingSections() {
    String prompt = formatter.format(" ", null);

    assertThat(prompt)
      .doesNotContain("# LAB NOTEBOOK CONTENT")
      .doesNotContain("# LATEST IMPLEMENTATION REPORT")
      .endsWith(PlanningPromptFormatter.CURRENT_TASK);
  }

  @Test
  void nullBriefBecomesEmpty() {
    assertThat(new PlanningPromptFormatter(null).getProjectBrief()).isEmpty();
  }
}
