package com.github.spud.ai.lab.application.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Project brief shown to the planning team every iteration.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lab.task")
public class LabTaskProperties {

  private String name = "research_project";

  private String description = "";

  private String goal = "";

  private String context = "";

  private List<DataFile> availableData = new ArrayList<>();

  /**
   * Free-form notes appended to the brief
   */
  private String notes = "";

  @Data
  public static class DataFile {

    private String name;

    private String description;
  }

  public String toBrief() {
    StringBuilder sb = new StringBuilder();
    sb.append("name: ").append(name).append('\n');
    appendBlock(sb, "description", description);
    appendBlock(sb, "goal", goal);
    appendBlock(sb, "context", context);
    if (!availableData.isEmpty()) {
      sb.append("available_data:\n");
      for (DataFile file : availableData) {
        sb.append("  - ").append(file.getName());
        if (file.getDescription() != null && !file.getDescription().isBlank()) {
          sb.append(": ").append(file.getDescription().strip());
        }
        sb.append('\n');
      }
    }
    appendBlock(sb, "notes", notes);
    return sb.toString().strip();
  }

  private static void appendBlock(StringBuilder sb, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    sb.append(key).append(":\n");
    value.strip().lines().forEach(line -> sb.append("  ").append(line).append('\n'));
  }
}
