package com.github.spud.ai.lab.infrastructure.notebook;

import com.github.spud.ai.lab.domain.notebook.NotebookEntry;
import com.github.spud.ai.lab.domain.notebook.NotebookStore;
import com.github.spud.ai.lab.domain.notebook.NotebookStoreException;
import com.github.spud.ai.lab.util.JsonUtils;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable notebook: one JSON record per line, forced to disk before {@link #append} returns.
 * <p>
 * The file is the source of truth; every read goes back to it so that entries written by an
 * earlier process are visible. Sequence numbers continue from the last record found on open.
 * A final line without its newline is the remains of an interrupted append: on open it is dropped,
 * or terminated when it still holds a whole record.
 */
@Slf4j
public class JsonLinesNotebookStore implements NotebookStore {

  private final Path path;
  private final Clock clock;
  private long lastSequence;

  public JsonLinesNotebookStore(Path path, Clock clock) {
    this.path = path;
    this.clock = clock;
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      throw new NotebookStoreException("Cannot create notebook directory for " + path, e);
    }
    recoverTornTail();
    List<NotebookEntry> existing = read();
    this.lastSequence = existing.isEmpty() ? 0 : existing.get(existing.size() - 1).getSequence();
    log.info("Opened notebook {} ({} entries)", path, existing.size());
  }

  @Override
  public synchronized NotebookEntry append(NotebookEntry entry) {
    NotebookEntry stored = entry.toBuilder()
      .sequence(lastSequence + 1)
      .timestamp(clock.instant())
      .build();

    String line;
    try {
      line = JsonUtils.toJson(stored) + "\n";
    } catch (IllegalArgumentException e) {
      throw new NotebookStoreException("Cannot serialize notebook entry", e);
    }

    try (FileChannel channel = FileChannel.open(path,
      StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
      ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    } catch (IOException e) {
      throw new NotebookStoreException("Failed to append to notebook " + path, e);
    }

    lastSequence = stored.getSequence();
    log.debug("Appended notebook entry #{} {} from {}", stored.getSequence(), stored.getType(),
      stored.getSource());
    return stored;
  }

  @Override
  public synchronized List<NotebookEntry> read() {
    if (!Files.exists(path)) {
      return List.of();
    }
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new NotebookStoreException("Failed to read notebook " + path, e);
    }
    List<NotebookEntry> entries = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (line.isBlank()) {
        continue;
      }
      try {
        entries.add(JsonUtils.fromJson(line, NotebookEntry.class));
      } catch (IllegalArgumentException e) {
        throw new NotebookStoreException(
          "Corrupt notebook record at " + path + ":" + (i + 1), e);
      }
    }
    return entries;
  }

  private void recoverTornTail() {
    if (!Files.exists(path)) {
      return;
    }
    try {
      byte[] bytes = Files.readAllBytes(path);
      if (bytes.length == 0 || bytes[bytes.length - 1] == '\n') {
        return;
      }
      int tailStart = bytes.length;
      while (tailStart > 0 && bytes[tailStart - 1] != '\n') {
        tailStart--;
      }
      String tail = new String(bytes, tailStart, bytes.length - tailStart, StandardCharsets.UTF_8);
      try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
        if (isRecord(tail)) {
          channel.write(ByteBuffer.wrap(new byte[]{'\n'}), bytes.length);
          log.warn("Notebook {} ended without a newline after its last record, terminated it",
            path);
        } else {
          channel.truncate(tailStart);
          log.warn("Discarded {} bytes of an incomplete record at the end of notebook {}",
            bytes.length - tailStart, path);
        }
        channel.force(true);
      }
    } catch (IOException e) {
      throw new NotebookStoreException("Failed to recover notebook " + path, e);
    }
  }

  private static boolean isRecord(String line) {
    if (line.isBlank()) {
      return false;
    }
    try {
      JsonUtils.fromJson(line, NotebookEntry.class);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  @Override
  public List<NotebookEntry> readSince(long sequence) {
    return read().stream().filter(e -> e.getSequence() > sequence).toList();
  }

  public Path getPath() {
    return path;
  }
}
