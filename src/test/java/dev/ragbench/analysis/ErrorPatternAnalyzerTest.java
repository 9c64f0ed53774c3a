package dev.ragbench.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ragbench.fixture.AttemptBuilder;
import dev.ragbench.fixture.LedgerFixtures;
import dev.ragbench.ledger.Attempt;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.pipeline.ErrorType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ErrorPatternAnalyzerTest {

  private final ErrorPatternAnalyzer analyzer = new ErrorPatternAnalyzer();

  @Test
  void emptyLedgerHasNoPatterns() {
    assertThat(analyzer.analyze(LedgerSnapshot.empty())).isEmpty();
  }

  @Test
  void groupsLatestIterationErrorsByTypeMostFrequentFirst() {
    List<Attempt> attempts = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      attempts.add(
          new AttemptBuilder()
              .questionId("t" + i)
              .pipeline(i < 3 ? "graph" : "orchestrator")
              .error(ErrorType.TIMEOUT, "Read timed out after " + (i % 2) + "s")
              .build());
    }
    attempts.add(
        new AttemptBuilder()
            .questionId("s1")
            .pipeline("graph")
            .error(ErrorType.SERVER_ERROR, "HTTP 500")
            .build());
    attempts.add(new AttemptBuilder().questionId("ok").pipeline("graph").correct().build());

    List<ErrorPattern> patterns =
        analyzer.analyze(
            LedgerFixtures.snapshot(
                LedgerFixtures.iteration(1, attempts.toArray(new Attempt[0]))));

    assertThat(patterns)
        .extracting(ErrorPattern::errorType)
        .containsExactly(ErrorType.TIMEOUT, ErrorType.SERVER_ERROR);
    ErrorPattern timeouts = patterns.get(0);
    assertThat(timeouts.count()).isEqualTo(5);
    assertThat(timeouts.severity()).isEqualTo(Severity.HIGH);
    assertThat(timeouts.pipelines()).containsExactlyInAnyOrder("graph", "orchestrator");
    assertThat(timeouts.questionIds()).containsExactly("t0", "t1", "t2", "t3", "t4");
    assertThat(timeouts.sampleErrors())
        .containsExactly("Read timed out after 0s", "Read timed out after 1s");
    assertThat(patterns.get(1).severity()).isEqualTo(Severity.LOW);
  }

  @Test
  void errorWithoutTypeCountsAsUnknown() {
    Attempt untyped =
        new Attempt("q1", "graph", "iter-001", "", false, 0.0, null, 10, "boom", null, null);

    List<ErrorPattern> patterns =
        analyzer.analyze(LedgerFixtures.snapshot(LedgerFixtures.iteration(1, untyped)));

    assertThat(patterns)
        .singleElement()
        .extracting(ErrorPattern::errorType)
        .isEqualTo(ErrorType.UNKNOWN);
  }

  @Test
  void olderIterationsAreIgnored() {
    LedgerSnapshot snapshot =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(
                1, new AttemptBuilder().error(ErrorType.NETWORK, "Connection refused").build()),
            LedgerFixtures.iteration(2, new AttemptBuilder().correct().build()));

    assertThat(analyzer.analyze(snapshot)).isEmpty();
  }
}
