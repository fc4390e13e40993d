package com.github.spud.ai.lab.infrastructure.tools;

import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.requireText;
import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.truncate;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.ai.lab.application.config.LabToolProperties;
import com.github.spud.ai.lab.domain.tools.ToolRegistry;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * search (OpenAI-compatible search chat endpoint) and fetch_page.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebResearchTools {

  private static final Pattern SCRIPT_OR_STYLE =
    Pattern.compile("(?is)<(script|style|noscript)[^>]*>.*?</\\1>");
  private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
  private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");
  private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]+");

  private final ToolRegistry toolRegistry;
  private final LabToolProperties toolProperties;
  private final WebClient.Builder webClientBuilder;

  @PostConstruct
  public void register() {
    toolRegistry.register(JsonToolCallback.of("search",
      "Search the web and the scientific literature. Returns a summarized answer with citations.",
      """
        {
            "type": "object",
            "properties": {
                "query": {"type": "string", "description": "Question or search query"}
            },
            "required": ["query"]
        }
        """,
      this::search));

    toolRegistry.register(JsonToolCallback.of("fetch_page",
      "Download a web page and return its readable text.",
      """
        {
            "type": "object",
            "properties": {
                "url": {"type": "string", "description": "http(s) URL of the page"}
            },
            "required": ["url"]
        }
        """,
      this::fetchPage));
  }

  String search(JsonNode args) {
    String query = requireText(args, "query");
    LabToolProperties.Search config = toolProperties.getSearch();
    if (config.getApiKey() == null || config.getApiKey().isBlank()) {
      throw new IllegalStateException("Search is not configured: lab.tools.search.api-key is empty");
    }

    Map<String, Object> body = Map.of(
      "model", config.getModel(),
      "messages", List.of(
        Map.of("role", "system", "content", "Be precise and concise. Cite your sources."),
        Map.of("role", "user", "content", query)));

    log.debug("Search query: {}", query);
    JsonNode response = webClientBuilder.build().post()
      .uri(config.getEndpoint())
      .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .retrieve()
      .bodyToMono(JsonNode.class)
      .block(toolProperties.getTimeout());
    return formatSearchResponse(response);
  }

  static String formatSearchResponse(JsonNode response) {
    if (response == null) {
      throw new IllegalStateException("Search endpoint returned no body");
    }
    String answer = response.path("choices").path(0).path("message").path("content").asText("");
    if (answer.isBlank()) {
      throw new IllegalStateException("Search endpoint returned no answer");
    }
    StringBuilder sb = new StringBuilder(answer.strip());
    JsonNode citations = response.path("citations");
    if (citations.isArray() && !citations.isEmpty()) {
      sb.append("\n\nSources:\n");
      for (int i = 0; i < citations.size(); i++) {
        sb.append('[').append(i + 1).append("] ").append(citations.get(i).asText()).append('\n');
      }
    }
    return sb.toString();
  }

  String fetchPage(JsonNode args) {
    String url = requireText(args, "url");
    if (!url.startsWith("http://") && !url.startsWith("https://")) {
      throw new IllegalArgumentException("Only http(s) URLs are supported: " + url);
    }
    String html = webClientBuilder.build().get()
      .uri(url)
      .accept(MediaType.TEXT_HTML, MediaType.TEXT_PLAIN)
      .retrieve()
      .bodyToMono(String.class)
      .block(toolProperties.getTimeout());
    if (html == null || html.isBlank()) {
      throw new IllegalStateException("Empty response from " + url);
    }
    return truncate(htmlToText(html), toolProperties.getOutputLimit());
  }

  static String htmlToText(String html) {
    String text = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
    text = text.replaceAll("(?i)<br\\s*/?>|</(p|div|li|h[1-6]|tr)>", "\n");
    text = TAG.matcher(text).replaceAll(" ");
    text = text.replace("&nbsp;", " ")
      .replace("&lt;", "<")
      .replace("&gt;", ">")
      .replace("&quot;", "\"")
      .replace("&#39;", "'")
      .replace("&amp;", "&");
    text = SPACES.matcher(text).replaceAll(" ");
    text = BLANK_LINES.matcher(text).replaceAll("\n\n");
    return text.lines().map(String::strip).reduce((a, b) -> a + "\n" + b).orElse("").strip();
  }
}
