package com.github.spud.ai.lab.domain.protocol.react;

import com.github.spud.ai.lab.util.JsonUtils;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads a {@link ReactJsonStep} out of raw model text.
 * <p>
 * Accepts bare JSON, JSON wrapped in a markdown code fence, or JSON embedded in prose. Engineer
 * answers routinely contain code with braces and quotes, so the first object is located by
 * balancing braces outside string literals rather than by a regular expression.
 */
@Slf4j
@Component
public class ReactJsonParser {

  private static final Pattern CODE_BLOCK_PATTERN =
    Pattern.compile("^```(?:json)?\\s*([\\s\\S]*?)```\\s*$", Pattern.CASE_INSENSITIVE);

  public ReactJsonStep parse(String modelText) throws ReactJsonParseException {
    if (modelText == null || modelText.isBlank()) {
      throw new ReactJsonParseException("Model output is empty or null", modelText);
    }

    String cleaned = removeCodeBlockWrapper(modelText.trim());
    log.debug("Parsing model text (length={}): {}", cleaned.length(), truncate(cleaned, 200));

    String jsonText = extractFirstJsonObject(cleaned);
    if (jsonText == null) {
      throw new ReactJsonParseException("No valid JSON object found in model output", modelText);
    }

    try {
      ReactJsonStep step = JsonUtils.fromJson(jsonText, ReactJsonStep.class);
      step.validate();
      log.debug("Parsed ReactJsonStep: type={}, thought length={}",
        step.getAction().normalizedType(),
        step.getThought() != null ? step.getThought().length() : 0);
      return step;
    } catch (IllegalArgumentException e) {
      // JsonParseException from JsonUtils is an IllegalArgumentException as well
      throw new ReactJsonParseException(
        "JSON structure validation failed: " + e.getMessage(), jsonText, e);
    }
  }

  private String removeCodeBlockWrapper(String text) {
    Matcher matcher = CODE_BLOCK_PATTERN.matcher(text);
    if (matcher.find()) {
      return matcher.group(1).trim();
    }
    return text;
  }

  /**
   * First balanced {@code {...}} that parses as JSON, or null.
   */
  String extractFirstJsonObject(String text) {
    int from = text.indexOf('{');
    while (from >= 0) {
      int end = findClosingBrace(text, from);
      if (end < 0) {
        return null;
      }
      String candidate = text.substring(from, end + 1);
      try {
        JsonUtils.readTree(candidate);
        return candidate;
      } catch (IllegalArgumentException e) {
        log.debug("Candidate at {} is not valid JSON: {}", from, e.getMessage());
      }
      from = text.indexOf('{', from + 1);
    }
    return null;
  }

  private int findClosingBrace(String text, int start) {
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static String truncate(String text, int maxLen) {
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
