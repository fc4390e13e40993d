package com.github.spud.ai.lab.infrastructure.tools;

import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.requireText;
import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.truncate;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.ai.lab.application.config.LabRunProperties;
import com.github.spud.ai.lab.application.config.LabToolProperties;
import com.github.spud.ai.lab.domain.tools.ToolRegistry;
import com.github.spud.ai.lab.util.JsonUtils;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * execute_code: saves a script in the output directory and runs it through the configured
 * command template. The process and its children are destroyed when they outlive
 * {@code lab.tools.code-timeout} or when the calling thread is interrupted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeExecutionTool {

  private static final Pattern SAFE_FILENAME = Pattern.compile("[A-Za-z0-9._-]+");

  private final ToolRegistry toolRegistry;
  private final LabToolProperties toolProperties;
  private final LabRunProperties runProperties;

  @PostConstruct
  public void register() {
    toolRegistry.register(JsonToolCallback.of("execute_code",
      "Save a script in the output directory and run it. Returns the exit code and the combined "
        + "stdout/stderr.",
      """
        {
            "type": "object",
            "properties": {
                "script": {"type": "string", "description": "Full source of the script"},
                "filename": {"type": "string", "description": "Script file name, e.g. 01_eda.py"},
                "environment_name": {"type": "string", "description": "Runtime environment to use"}
            },
            "required": ["script"]
        }
        """,
      this::execute));
  }

  String execute(JsonNode args) throws IOException, InterruptedException, TimeoutException {
    String script = requireText(args, "script");
    String filename = JsonUtils.text(args, "filename", "script_" + System.currentTimeMillis() + ".py");
    if (!SAFE_FILENAME.matcher(filename).matches()) {
      throw new IllegalArgumentException("Invalid script filename: " + filename);
    }
    String environment = JsonUtils.text(args, "environment_name",
      toolProperties.getDefaultEnvironment());

    Path workDir = Path.of(runProperties.getOutputDir()).toAbsolutePath();
    Files.createDirectories(workDir);
    Path scriptFile = workDir.resolve(filename);
    Files.writeString(scriptFile, script, StandardCharsets.UTF_8);

    List<String> command = toolProperties.getCodeCommand().stream()
      .map(part -> part.replace("{env}", environment).replace("{script}", scriptFile.toString()))
      .toList();
    Path logFile = Files.createTempFile(workDir, "exec-", ".log");
    Duration timeout = toolProperties.getCodeTimeout();
    log.info("Running {} (timeout {}s)", command, timeout.toSeconds());

    Process process = null;
    try {
      process = new ProcessBuilder(command)
        .directory(workDir.toFile())
        .redirectErrorStream(true)
        .redirectOutput(logFile.toFile())
        .start();

      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new TimeoutException("Script " + filename + " did not finish within "
          + timeout.toSeconds() + "s and was terminated");
      }

      String output = Files.readString(logFile, StandardCharsets.UTF_8);
      int exitCode = process.exitValue();
      log.debug("Script {} exited with {}", filename, exitCode);
      return "Exit code: " + exitCode + "\nScript: " + scriptFile + "\n\n"
        + truncate(output, toolProperties.getOutputLimit());
    } catch (InterruptedException e) {
      log.warn("Script {} was interrupted, terminating it", filename);
      Thread.currentThread().interrupt();
      throw e;
    } finally {
      if (process != null && process.isAlive()) {
        destroyTree(process);
      }
      Files.deleteIfExists(logFile);
    }
  }

  /**
   * Kills the script and everything it started; children of {@code sh} or {@code conda run}
   * survive a plain destroy of the parent.
   */
  private static void destroyTree(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }
}
