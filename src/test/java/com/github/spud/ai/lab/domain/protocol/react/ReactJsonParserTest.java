package com.github.spud.ai.lab.domain.protocol.react;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReactJsonParserTest {

  private ReactJsonParser parser;

  @BeforeEach
  void setUp() {
    parser = new ReactJsonParser();
  }

  @Test
  void shouldParsePureJson() throws Exception {
    String json = """
      {
        "thought": "I need to look at the data first",
        "action": {
          "type": "tool",
          "name": "read_text_file",
          "args": {"path": "output/summary.txt"}
        }
      }
      """;

    ReactJsonStep step = parser.parse(json);

    assertThat(step.getThought()).isEqualTo("I need to look at the data first");
    assertThat(step.getAction().getType()).isEqualTo("tool");
    assertThat(step.getAction().getName()).isEqualTo("read_text_file");
    assertThat(step.getAction().getArgs().get("path").asText()).isEqualTo("output/summary.txt");
  }

  @Test
  void shouldParseJsonWithCodeBlock() throws Exception {
    String text = """
      ```json
      {
        "thought": "Plan is ready",
        "action": {
          "type": "final",
          "answer": "Run the EDA script. TERMINATE"
        }
      }
      ```
      """;

    ReactJsonStep step = parser.parse(text);

    assertThat(step.getAction().normalizedType()).isEqualTo(ReactJsonAction.FINAL);
    assertThat(step.getAction().getAnswer()).isEqualTo("Run the EDA script. TERMINATE");
  }

  @Test
  void shouldParseJsonFromMixedText() throws Exception {
    String text = """
      Here is my response:
      {
        "thought": "No action needed",
        "action": {"type": "none"}
      }
      End of response
      """;

    ReactJsonStep step = parser.parse(text);

    assertThat(step.getAction().normalizedType()).isEqualTo(ReactJsonAction.NONE);
  }

  @Test
  void shouldKeepBracesInsideStringValues() throws Exception {
    String text = """
      Sure, writing the script now.
      {"thought": "write it", "action": {"type": "tool", "name": "execute_code",
       "args": {"script": "d = {'a': 1}\\nprint(f\\"{d}\\")\\nif x: }", "filename": "a.py"}}}
      """;

    ReactJsonStep step = parser.parse(text);

    assertThat(step.getAction().getName()).isEqualTo("execute_code");
    assertThat(step.getAction().getArgs().get("script").asText())
      .contains("d = {'a': 1}")
      .contains("print(f\"{d}\")")
      .endsWith("if x: }");
  }

  @Test
  void shouldSkipBraceFragmentsThatAreNotJson() {
    String text = "Using {placeholder} syntax. {\"thought\":\"t\",\"action\":{\"type\":\"none\"}}";

    assertThat(parser.extractFirstJsonObject(text))
      .isEqualTo("{\"thought\":\"t\",\"action\":{\"type\":\"none\"}}");
  }

  @Test
  void shouldNormalizeActionTypeCase() throws Exception {
    ReactJsonStep step = parser.parse("{\"thought\":\"x\",\"action\":{\"type\":\" FINAL \",\"answer\":\"ok\"}}");

    assertThat(step.getAction().normalizedType()).isEqualTo(ReactJsonAction.FINAL);
  }

  @Test
  void shouldThrowExceptionOnEmptyText() {
    assertThatThrownBy(() -> parser.parse(""))
      .isInstanceOf(ReactJsonParseException.class)
      .hasMessageContaining("empty or null");
  }

  @Test
  void shouldThrowExceptionOnInvalidJson() {
    assertThatThrownBy(() -> parser.parse("This is not JSON at all"))
      .isInstanceOf(ReactJsonParseException.class)
      .hasMessageContaining("No valid JSON object found");
  }

  @Test
  void shouldThrowExceptionOnMissingAction() {
    assertThatThrownBy(() -> parser.parse("{\"thought\": \"Missing action field\"}"))
      .isInstanceOf(ReactJsonParseException.class)
      .hasMessageContaining("Action is required");
  }

  @Test
  void shouldThrowExceptionOnInvalidActionType() {
    assertThatThrownBy(() -> parser.parse("{\"thought\":\"x\",\"action\":{\"type\":\"dance\"}}"))
      .isInstanceOf(ReactJsonParseException.class)
      .hasMessageContaining("Unknown action type");
  }

  @Test
  void shouldThrowExceptionOnToolWithoutName() {
    assertThatThrownBy(() -> parser.parse("{\"thought\":\"x\",\"action\":{\"type\":\"tool\",\"args\":{}}}"))
      .isInstanceOf(ReactJsonParseException.class)
      .hasMessageContaining("Tool name is required");
  }

  @Test
  void shouldThrowExceptionOnToolArgsThatAreNotAnObject() {
    assertThatThrownBy(() -> parser.parse(
      "{\"thought\":\"x\",\"action\":{\"type\":\"tool\",\"name\":\"search\",\"args\":\"q\"}}"))
      .isInstanceOf(ReactJsonParseException.class)
      .hasMessageContaining("must be a JSON object");
  }

  @Test
  void shouldThrowExceptionOnFinalWithoutAnswer() {
    assertThatThrownBy(() -> parser.parse("{\"thought\":\"x\",\"action\":{\"type\":\"final\"}}"))
      .isInstanceOf(ReactJsonParseException.class)
      .hasMessageContaining("Answer is required")
      .satisfies(e -> assertThat(((ReactJsonParseException) e).getOriginalText())
        .contains("\"final\""));
  }
}
