package dev.ragbench.improvement;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ragbench.ledger.JsonDocuments;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the backlog document {@code {revision, improvements: [...]}}.
 *
 * <p>A missing file is an empty backlog. Saves are atomic and rejected when the file on disk is
 * not at the revision the backlog was loaded from.
 */
@Component
public class BacklogStore {

  private static final Logger log = LoggerFactory.getLogger(BacklogStore.class);

  private final ObjectMapper objectMapper;
  private final Path path;

  @Autowired
  public BacklogStore(ObjectMapper objectMapper, BacklogProperties properties) {
    this(objectMapper, Path.of(properties.path()));
  }

  public BacklogStore(ObjectMapper objectMapper, Path path) {
    this.objectMapper = JsonDocuments.lenientCopy(objectMapper);
    this.path = path;
  }

  public Path path() {
    return path;
  }

  /**
   * Loads the backlog.
   *
   * @throws BacklogStorageException if the file exists but cannot be read or parsed
   */
  public Backlog load() {
    if (!Files.exists(path)) {
      log.info("No backlog at {}, starting empty", path);
      return Backlog.empty();
    }
    try {
      Backlog backlog = objectMapper.readValue(path.toFile(), Backlog.class);
      log.debug(
          "Loaded backlog {} (revision {}, {} items)",
          path,
          backlog.revision(),
          backlog.improvements().size());
      return backlog;
    } catch (IOException e) {
      log.error("Cannot read backlog {}", path, e);
      throw new BacklogStorageException("Cannot read backlog " + path, e);
    }
  }

  /**
   * Saves {@code backlog} atomically as revision {@code backlog.revision() + 1}.
   *
   * @return the backlog as written
   * @throws BacklogStorageException if the file cannot be written or was saved by someone else
   *     since {@code backlog} was loaded
   */
  public synchronized Backlog save(Backlog backlog) {
    long onDisk = Files.exists(path) ? load().revision() : 0;
    if (onDisk != backlog.revision()) {
      throw new BacklogStorageException(
          "Backlog "
              + path
              + " changed on disk: expected revision "
              + backlog.revision()
              + " but found "
              + onDisk);
    }
    Backlog stamped = backlog.withRevision(backlog.revision() + 1);
    try {
      JsonDocuments.writeAtomically(objectMapper, path, stamped);
    } catch (IOException e) {
      log.error("Cannot write backlog {}", path, e);
      throw new BacklogStorageException("Cannot write backlog " + path, e);
    }
    return stamped;
  }
}
