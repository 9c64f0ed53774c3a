package dev.ragbench.improvement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.ragbench.fixture.TestJson;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BacklogStoreTest {

  @TempDir Path tempDir;

  private Path file;
  private BacklogStore store;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("backlog.json");
    store = new BacklogStore(TestJson.objectMapper(), file);
  }

  @Test
  void missingFileIsAnEmptyBacklog() {
    assertThat(store.load()).isEqualTo(Backlog.empty());
  }

  @Test
  void savedTransitionsSurviveAReload() {
    Backlog initial =
        new Backlog(0, List.of(Improvement.pending("imp-1", "graph", Priority.P0, 5.0)));
    Backlog saved =
        store.save(initial.markApplied("imp-1", Instant.parse("2026-03-01T10:00:00Z"), 48.0));

    Backlog loaded = store.load();

    assertThat(saved.revision()).isEqualTo(1);
    assertThat(loaded).isEqualTo(saved);
    assertThat(loaded.find("imp-1").orElseThrow().status()).isEqualTo(ImprovementStatus.APPLIED);
  }

  @Test
  void handWrittenDocumentWithSnakeCaseIsAccepted() throws Exception {
    Files.writeString(
        file,
        """
        {
          "improvements": [
            {"id": "imp-1", "title": "Rerank graph hits", "pipeline": "graph",
             "priority": "p0", "expected_impact_pp": 6.5, "owner": "search-team"},
            {"id": "imp-2", "pipeline": "standard", "status": "verified",
             "actual_impact_pp": 2.0}
          ]
        }
        """,
        StandardCharsets.UTF_8);

    Backlog backlog = store.load();

    Improvement first = backlog.find("imp-1").orElseThrow();
    assertThat(first.priority()).isEqualTo(Priority.P0);
    assertThat(first.expectedImpactPp()).isEqualTo(6.5);
    assertThat(first.status()).isEqualTo(ImprovementStatus.PENDING);
    Improvement second = backlog.find("imp-2").orElseThrow();
    assertThat(second.priority()).isEqualTo(Priority.P3);
    assertThat(second.status()).isEqualTo(ImprovementStatus.VERIFIED);
    assertThat(backlog.pending()).extracting(Improvement::id).containsExactly("imp-1");
  }

  @Test
  void staleBacklogIsNotSaved() {
    Backlog loaded = store.load();
    store.save(loaded);

    assertThatThrownBy(() -> store.save(loaded))
        .isInstanceOf(BacklogStorageException.class)
        .hasMessageContaining("expected revision 0 but found 1");
  }

  @Test
  void unparseableDocumentIsAStorageFailure() throws Exception {
    Files.writeString(file, "[", StandardCharsets.UTF_8);

    assertThatThrownBy(() -> store.load()).isInstanceOf(BacklogStorageException.class);
  }
}
