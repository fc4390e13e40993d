package com.github.spud.ai.lab.domain.orchestrator;

/**
 * Builds the task context the planning team starts each iteration with.
 */
public class PlanningPromptFormatter {

  static final String CURRENT_TASK = """
    # YOUR CURRENT TASK
    Review the lab notebook and the latest implementation (if any). Based on the overall goal and current progress:
    1. Discuss the current state of the project.
    2. Identify the next logical step to advance the project.
    3. Create a detailed specification for the implementation team to carry out this next step.
    4. The lead should summarize the discussion and provide the final specification.""";

  private final String projectBrief;

  public PlanningPromptFormatter(String projectBrief) {
    this.projectBrief = projectBrief == null ? "" : projectBrief.strip();
  }

  public String format(String notebookContent, String lastReport) {
    StringBuilder sb = new StringBuilder();
    sb.append("TASK CONFIG:\n").append(projectBrief).append("\n\n");
    if (notebookContent != null && !notebookContent.isBlank()) {
      sb.append("# LAB NOTEBOOK CONTENT\n").append(notebookContent.strip()).append("\n\n");
    }
    if (lastReport != null && !lastReport.isBlank()) {
      sb.append("# LATEST IMPLEMENTATION REPORT\n").append(lastReport.strip()).append("\n\n");
    }
    sb.append(CURRENT_TASK);
    return sb.toString();
  }

  public String getProjectBrief() {
    return projectBrief;
  }
}
