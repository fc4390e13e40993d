package com.github.spud.ai.lab.infrastructure.tools;

import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.requireText;
import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.truncate;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.ai.lab.application.config.LabToolProperties;
import com.github.spud.ai.lab.domain.tools.ToolRegistry;
import com.github.spud.ai.lab.util.JsonUtils;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * read_text_file, write_text_file and search_directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileTools {

  static final int MAX_LISTED_FILES = 500;

  private final ToolRegistry toolRegistry;
  private final LabToolProperties toolProperties;

  @PostConstruct
  public void register() {
    toolRegistry.register(JsonToolCallback.of("read_text_file",
      "Read a UTF-8 text file. Long files are truncated.",
      """
        {
            "type": "object",
            "properties": {
                "path": {"type": "string", "description": "File to read"}
            },
            "required": ["path"]
        }
        """,
      this::readTextFile));

    toolRegistry.register(JsonToolCallback.of("write_text_file",
      "Write text to a file, creating parent directories and replacing existing content.",
      """
        {
            "type": "object",
            "properties": {
                "path": {"type": "string", "description": "File to write"},
                "content": {"type": "string", "description": "Text to write"}
            },
            "required": ["path", "content"]
        }
        """,
      this::writeTextFile));

    toolRegistry.register(JsonToolCallback.of("search_directory",
      "List files in a directory whose names match a glob pattern such as *.png.",
      """
        {
            "type": "object",
            "properties": {
                "path": {"type": "string", "description": "Directory to search"},
                "pattern": {"type": "string", "description": "Glob for file names, default *"},
                "recursive": {"type": "boolean", "description": "Search subdirectories, default false"}
            },
            "required": ["path"]
        }
        """,
      this::searchDirectory));
  }

  String readTextFile(JsonNode args) throws IOException {
    Path path = Path.of(requireText(args, "path"));
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("File not found: " + path);
    }
    String content = Files.readString(path, StandardCharsets.UTF_8);
    return truncate(content, toolProperties.getReadLimit());
  }

  String writeTextFile(JsonNode args) throws IOException {
    Path path = Path.of(requireText(args, "path"));
    String content = JsonUtils.text(args, "content", null);
    if (content == null) {
      throw new IllegalArgumentException("Missing required argument 'content'");
    }
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, content, StandardCharsets.UTF_8);
    log.debug("Wrote {} characters to {}", content.length(), path);
    return "Wrote " + content.length() + " characters to " + path;
  }

  String searchDirectory(JsonNode args) throws IOException {
    Path dir = Path.of(requireText(args, "path"));
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("Directory not found: " + dir);
    }
    String pattern = JsonUtils.text(args, "pattern", "*");
    boolean recursive = args.path("recursive").asBoolean(false);
    PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);

    List<String> matches;
    try (Stream<Path> files = recursive ? Files.walk(dir) : Files.list(dir)) {
      matches = files
        .filter(Files::isRegularFile)
        .filter(p -> matcher.matches(p.getFileName()))
        .map(Path::toString)
        .sorted()
        .collect(Collectors.toList());
    }
    if (matches.isEmpty()) {
      return "No files matching '" + pattern + "' in " + dir;
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Found ").append(matches.size()).append(" file(s):\n");
    matches.stream().limit(MAX_LISTED_FILES).forEach(m -> sb.append(m).append('\n'));
    if (matches.size() > MAX_LISTED_FILES) {
      sb.append("... ").append(matches.size() - MAX_LISTED_FILES).append(" more\n");
    }
    return sb.toString();
  }
}
