package dev.ragbench.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the ledger document.
 *
 * <p>A missing file is an empty ledger. Older documents are accepted: snake-case field names,
 * registry entries without runs (dropped), a missing registry (rebuilt from the iterations) and a
 * missing run state (derived from the registry). Saves are atomic and guarded by the revision
 * counter: a save fails with {@link ConcurrentLedgerModificationException} when the file on disk
 * is not at the revision the snapshot was taken from.
 */
@Component
public class LedgerStore {

  private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

  private final ObjectMapper objectMapper;
  private final Path path;
  private final Clock clock;
  private final Object saveLock = new Object();

  public LedgerStore(ObjectMapper objectMapper, LedgerProperties properties, Clock clock) {
    this(objectMapper, Path.of(properties.path()), clock);
  }

  public LedgerStore(ObjectMapper objectMapper, Path path, Clock clock) {
    this.objectMapper = JsonDocuments.lenientCopy(objectMapper);
    this.path = path;
    this.clock = clock;
  }

  public Path path() {
    return path;
  }

  /**
   * Loads the ledger, migrating older documents in memory.
   *
   * @throws LedgerStorageException if the file exists but cannot be read or parsed
   */
  public LedgerSnapshot load() {
    if (!Files.exists(path)) {
      log.info("No ledger at {}, starting empty", path);
      return LedgerSnapshot.empty();
    }
    LedgerSnapshot raw;
    try {
      JsonNode root = objectMapper.readTree(path.toFile());
      if (root == null || !root.isObject()) {
        throw new LedgerStorageException("Ledger " + path + " is not a JSON object");
      }
      dropEntriesWithoutRuns((ObjectNode) root);
      raw = objectMapper.treeToValue(root, LedgerSnapshot.class);
    } catch (IOException e) {
      log.error("Cannot read ledger {}", path, e);
      throw new LedgerStorageException("Cannot read ledger " + path, e);
    }
    LedgerSnapshot migrated = migrate(raw);
    log.info(
        "Loaded ledger {} (revision {}, {} iterations, {} questions)",
        path,
        migrated.revision(),
        migrated.iterations().size(),
        migrated.questionRegistry().size());
    return migrated;
  }

  /**
   * Saves {@code snapshot} atomically as revision {@code snapshot.revision() + 1}.
   *
   * @return the snapshot as written, with its new revision and save time
   * @throws ConcurrentLedgerModificationException if the file on disk is at another revision
   * @throws LedgerStorageException if the file cannot be written
   */
  public LedgerSnapshot save(LedgerSnapshot snapshot) {
    synchronized (saveLock) {
      long onDisk = readRevision();
      if (onDisk != snapshot.revision()) {
        throw new ConcurrentLedgerModificationException(path, snapshot.revision(), onDisk);
      }
      LedgerSnapshot stamped = snapshot.withRevision(snapshot.revision() + 1, clock.instant());
      try {
        JsonDocuments.writeAtomically(objectMapper, path, stamped);
      } catch (IOException e) {
        log.error("Cannot write ledger {}", path, e);
        throw new LedgerStorageException("Cannot write ledger " + path, e);
      }
      log.debug("Saved ledger {} at revision {}", path, stamped.revision());
      return stamped;
    }
  }

  private long readRevision() {
    if (!Files.exists(path)) {
      return 0;
    }
    try {
      return objectMapper.readTree(path.toFile()).path("revision").asLong(0);
    } catch (IOException e) {
      throw new LedgerStorageException("Cannot read ledger revision from " + path, e);
    }
  }

  private static void dropEntriesWithoutRuns(ObjectNode root) {
    for (String field : new String[] {"questionRegistry", "question_registry"}) {
      JsonNode registry = root.get(field);
      if (registry == null || !registry.isObject()) {
        continue;
      }
      Iterator<Map.Entry<String, JsonNode>> entries = registry.fields();
      while (entries.hasNext()) {
        Map.Entry<String, JsonNode> entry = entries.next();
        JsonNode runs = entry.getValue().path("runs");
        if (!runs.isArray() || runs.isEmpty()) {
          log.warn("Dropping registry entry {} without runs", entry.getKey());
          entries.remove();
        }
      }
    }
  }

  /** Rebuilds what older documents lack: the registry from iterations, the run state. */
  static LedgerSnapshot migrate(LedgerSnapshot raw) {
    Map<String, QuestionRegistryEntry> registry = raw.questionRegistry();
    if (registry.isEmpty() && !raw.iterations().isEmpty()) {
      registry = rebuildRegistry(raw);
      if (!registry.isEmpty()) {
        log.info("Rebuilt question registry from iterations: {} questions", registry.size());
      }
    }
    if (raw.schemaVersion() < LedgerSnapshot.CURRENT_SCHEMA_VERSION) {
      log.info(
          "Migrating ledger from schema {} to {}",
          raw.schemaVersion(),
          LedgerSnapshot.CURRENT_SCHEMA_VERSION);
    }
    RunState runState =
        raw.runState() == null ? RunState.fromRegistry(registry.values()) : raw.runState();
    return new LedgerSnapshot(
        LedgerSnapshot.CURRENT_SCHEMA_VERSION,
        raw.revision(),
        raw.iterations(),
        registry,
        runState,
        raw.updatedAt());
  }

  private static Map<String, QuestionRegistryEntry> rebuildRegistry(LedgerSnapshot raw) {
    Map<String, QuestionRegistryEntry> rebuilt = new LinkedHashMap<>();
    for (Iteration iteration : raw.iterations()) {
      for (Attempt attempt : iteration.attempts()) {
        if (attempt.questionId() == null) {
          continue;
        }
        rebuilt.merge(
            attempt.questionId(),
            QuestionRegistryEntry.first(attempt.questionId(), attempt.pipeline(), "", "", attempt),
            (existing, single) -> existing.withRun(attempt));
      }
    }
    return rebuilt;
  }
}
