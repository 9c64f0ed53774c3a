package dev.ragbench.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.ragbench.fixture.AttemptBuilder;
import dev.ragbench.fixture.LedgerFixtures;
import dev.ragbench.fixture.TestJson;
import dev.ragbench.matching.MatchMethod;
import dev.ragbench.pipeline.ErrorType;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LedgerStoreTest {

  private static final Instant NOW = Instant.parse("2026-02-01T12:00:00Z");

  @TempDir Path tempDir;

  private Path file;
  private LedgerStore store;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("data").resolve("ledger.json");
    store = new LedgerStore(TestJson.objectMapper(), file, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void missingFileLoadsAsEmptyLedger() {
    LedgerSnapshot snapshot = store.load();

    assertThat(snapshot.iterations()).isEmpty();
    assertThat(snapshot.questionRegistry()).isEmpty();
    assertThat(snapshot.revision()).isZero();
    assertThat(snapshot.nextSequenceNumber()).isEqualTo(1);
  }

  @Test
  void saveIncrementsRevisionAndPersistsEverything() {
    LedgerSnapshot snapshot =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(
                1,
                new AttemptBuilder().questionId("q1").pipeline("graph").correct().build(),
                new AttemptBuilder()
                    .questionId("q2")
                    .pipeline("graph")
                    .error(ErrorType.TIMEOUT, "Read timed out")
                    .build()));

    LedgerSnapshot saved = store.save(snapshot);
    LedgerSnapshot loaded = store.load();

    assertThat(Files.exists(file)).isTrue();
    assertThat(Files.exists(file.resolveSibling("ledger.json.tmp"))).isFalse();
    assertThat(saved.revision()).isEqualTo(1);
    assertThat(loaded.revision()).isEqualTo(1);
    assertThat(loaded.updatedAt()).isEqualTo(NOW);
    assertThat(loaded.iterations()).hasSize(1);
    assertThat(loaded.iterations().get(0).summaryFor("graph").orElseThrow().accuracyPct())
        .isEqualTo(50.0);
    assertThat(loaded.questionRegistry().get("q2").currentStatus())
        .isEqualTo(QuestionStatus.ERROR);
    assertThat(loaded.questionRegistry().get("q2").latestRun().errorType())
        .isEqualTo(ErrorType.TIMEOUT);
    assertThat(loaded.effectiveRunState().testedFor("graph"))
        .containsExactlyInAnyOrder("q1", "q2");
  }

  @Test
  void staleRevisionIsRejected() {
    LedgerSnapshot first = store.save(LedgerSnapshot.empty());
    store.save(first);

    assertThatThrownBy(() -> store.save(first))
        .isInstanceOf(ConcurrentLedgerModificationException.class);
    assertThat(store.load().revision()).isEqualTo(2);
  }

  @Test
  void legacyDocumentIsMigrated() throws Exception {
    String legacy =
        """
        {
          "iterations": [
            {
              "id": "iter-001",
              "number": 1,
              "timestamp_start": "2026-01-01T10:00:00Z",
              "timestamp_end": "2026-01-01T11:00:00Z",
              "label": "baseline",
              "questions": [
                {"id": "q1", "rag_type": "graph", "answer": "Paris", "correct": true,
                 "f1": 0.8, "match_type": "f1_match", "latency_ms": 1200},
                {"id": "q2", "rag_type": "graph", "answer": "", "correct": false,
                 "f1": 0.0, "latency_ms": 900, "error": "HTTP 500",
                 "error_type": "server_error", "legacy_field": 7}
              ]
            }
          ],
          "question_registry": {
            "q3": {"id": "q3", "rag_type": "graph", "runs": []}
          }
        }
        """;
    Files.createDirectories(file.getParent());
    Files.writeString(file, legacy, StandardCharsets.UTF_8);

    LedgerSnapshot snapshot = store.load();

    assertThat(snapshot.schemaVersion()).isEqualTo(LedgerSnapshot.CURRENT_SCHEMA_VERSION);
    assertThat(snapshot.iterations()).hasSize(1);
    Iteration iteration = snapshot.iterations().get(0);
    assertThat(iteration.sequenceNumber()).isEqualTo(1);
    assertThat(iteration.attempts().get(0).matchMethod()).isEqualTo(MatchMethod.F1_MATCH);
    assertThat(iteration.summaryFor("graph").orElseThrow().errors()).isEqualTo(1);
    assertThat(snapshot.questionRegistry()).containsOnlyKeys("q1", "q2");
    assertThat(snapshot.questionRegistry().get("q2").latestRun().errorType())
        .isEqualTo(ErrorType.SERVER_ERROR);
    assertThat(snapshot.effectiveRunState().testedFor("graph"))
        .containsExactlyInAnyOrder("q1", "q2");
  }

  @Test
  void storedSummaryIsKeptWhenAttemptsWereNotPreserved() throws Exception {
    String legacy =
        """
        {"iterations": [{"id": "iter-001", "number": 1, "questions": [],
          "results_summary": {"graph": {"tested": 10, "correct": 7, "errors": 1,
            "accuracy_pct": 70.0, "p95_latency_ms": 4000}}}]}
        """;
    Files.createDirectories(file.getParent());
    Files.writeString(file, legacy, StandardCharsets.UTF_8);

    PipelineSummary summary = store.load().latestSummaryFor("graph").orElseThrow();

    assertThat(summary.accuracyPct()).isEqualTo(70.0);
    assertThat(summary.p95LatencyMs()).isEqualTo(4000);
  }

  @Test
  void unreadableFileIsAStorageFailure() throws Exception {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

    assertThatThrownBy(() -> store.load()).isInstanceOf(LedgerStorageException.class);
  }
}
