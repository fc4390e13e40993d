package com.github.spud.ai.lab.application.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Which roles sit on which team. Planning order is lead first, then the experts in list order.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lab.teams")
public class LabTeamProperties {

  private String planningLead = "principal_scientist";

  private List<String> planningExperts =
    new ArrayList<>(List.of("bioinformatics_expert", "ml_expert"));

  private String engineer = "implementation_engineer";

  private String critic = "data_science_critic";

  public List<String> planningOrder() {
    List<String> order = new ArrayList<>();
    order.add(planningLead);
    order.addAll(planningExperts);
    return order;
  }
}
