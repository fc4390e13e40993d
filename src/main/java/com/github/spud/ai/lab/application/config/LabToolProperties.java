package com.github.spud.ai.lab.application.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Tool gateway limits and adapter settings.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "lab.tools")
public class LabToolProperties {

  /**
   * Hard ceiling for a tool call made through the gateway
   */
  private Duration timeout = Duration.ofMinutes(15);

  /**
   * Ceiling for one script execution; the process is destroyed afterwards
   */
  private Duration codeTimeout = Duration.ofMinutes(10);

  /**
   * Command used to run a script. {@code {env}} and {@code {script}} are substituted.
   */
  private List<String> codeCommand =
    new ArrayList<>(List.of("conda", "run", "-n", "{env}", "python", "{script}"));

  private String defaultEnvironment = "base";

  /**
   * Characters returned by read_text_file
   */
  private int readLimit = 10_000;

  /**
   * Characters of process output and fetched pages handed back to the model
   */
  private int outputLimit = 20_000;

  private Search search = new Search();

  /**
   * A script must be stopped by its own timeout before the gateway gives up on the call.
   */
  @AssertTrue(message = "lab.tools.code-timeout must be shorter than lab.tools.timeout")
  public boolean isCodeTimeoutWithinToolTimeout() {
    return timeout == null || codeTimeout == null || codeTimeout.compareTo(timeout) < 0;
  }

  @Data
  public static class Search {

    private String endpoint = "https://api.perplexity.ai/chat/completions";

    private String apiKey;

    private String model = "sonar";
  }
}
