package com.github.spud.ai.lab.infrastructure.tools;

import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.requireText;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.ai.lab.domain.tools.ToolRegistry;
import com.github.spud.ai.lab.util.JsonUtils;
import jakarta.annotation.PostConstruct;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

/**
 * analyze_plot: asks a multimodal model to describe and assess a saved figure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlotAnalysisTool {

  static final String DEFAULT_PROMPT = """
    Describe this plot: its type, axes, labels and what the data shows. Point out problems such \
    as missing labels, unreadable scales, misleading presentation or signs of data issues.""";

  private final ToolRegistry toolRegistry;
  private final ChatClient chatClient;

  @PostConstruct
  public void register() {
    toolRegistry.register(JsonToolCallback.of("analyze_plot",
      "Inspect an image file (PNG or JPEG) with a vision model and return its assessment.",
      """
        {
            "type": "object",
            "properties": {
                "path": {"type": "string", "description": "Image file to analyze"},
                "prompt": {"type": "string", "description": "Optional question about the plot"}
            },
            "required": ["path"]
        }
        """,
      this::analyze));
  }

  String analyze(JsonNode args) {
    Path path = Path.of(requireText(args, "path"));
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Image not found: " + path);
    }
    MimeType mimeType = mimeTypeOf(path);
    String prompt = JsonUtils.text(args, "prompt", DEFAULT_PROMPT);
    log.debug("Analyzing plot {} ({})", path, mimeType);

    String answer = chatClient.prompt()
      .user(u -> u.text(prompt).media(mimeType, new FileSystemResource(path)))
      .call()
      .content();
    if (answer == null || answer.isBlank()) {
      throw new IllegalStateException("Vision model returned no analysis for " + path);
    }
    return answer;
  }

  static MimeType mimeTypeOf(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".png")) {
      return MimeTypeUtils.IMAGE_PNG;
    }
    if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
      return MimeTypeUtils.IMAGE_JPEG;
    }
    throw new IllegalArgumentException("Unsupported image type: " + path.getFileName());
  }
}
