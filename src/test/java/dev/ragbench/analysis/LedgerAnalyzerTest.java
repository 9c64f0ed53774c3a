package dev.ragbench.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ragbench.fixture.AttemptBuilder;
import dev.ragbench.fixture.LedgerFixtures;
import dev.ragbench.ledger.Attempt;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.pipeline.PipelineProperties;
import dev.ragbench.pipeline.PipelineTarget;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LedgerAnalyzerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

  private final AnalysisProperties properties = AnalysisProperties.defaults();
  private final LedgerAnalyzer analyzer =
      new LedgerAnalyzer(
          new RegressionAnalyzer(),
          new ErrorPatternAnalyzer(),
          new GapAnalyzer(properties),
          new SuggestionGenerator(properties),
          new PipelineProperties(
              "benchmark",
              1000,
              2000,
              new PipelineProperties.Retry(3, 10, 2.0, 100),
              Map.of(
                  "graph",
                  new PipelineProperties.Endpoint(
                      "http://localhost/webhook/graph", 5000, 70.0, null, null))),
          Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void emptyLedgerStillReportsTheGapToTarget() {
    AnalysisReport report = analyzer.analyze(LedgerSnapshot.empty());

    assertThat(report.generatedAt()).isEqualTo(NOW);
    assertThat(report.regressions().hasData()).isFalse();
    assertThat(report.errorPatterns()).isEmpty();
    assertThat(report.flakyQuestions()).isEmpty();
    assertThat(report.gaps()).singleElement().extracting(PipelineGap::gapPp).isEqualTo(70.0);
    assertThat(report.suggestions()).extracting(Suggestion::area).containsExactly("graph");
  }

  @Test
  void combinesEveryAnalysisOverOneSnapshot() {
    LedgerSnapshot snapshot =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(1, flipping(true)),
            LedgerFixtures.iteration(2, flipping(false)),
            LedgerFixtures.iteration(3, flipping(true)));

    AnalysisReport report =
        analyzer.analyze(snapshot, Map.of("graph", PipelineTarget.accuracy(70.0)));

    assertThat(report.ledgerRevision()).isEqualTo(snapshot.revision());
    assertThat(report.regressions().fixes()).hasSize(3);
    assertThat(report.flakyQuestions())
        .extracting(FlakyQuestion::questionId)
        .containsExactly("g0", "g1", "g2");
    assertThat(report.flakyQuestions().get(0).passRate()).isEqualTo(0.667);
    assertThat(report.gaps().get(0).onTarget()).isTrue();
    assertThat(report.suggestions()).extracting(Suggestion::area).containsExactly("stability");
  }

  private static Attempt[] flipping(boolean correct) {
    Attempt[] attempts = new Attempt[3];
    for (int i = 0; i < attempts.length; i++) {
      attempts[i] =
          new AttemptBuilder().questionId("g" + i).pipeline("graph").correct(correct).build();
    }
    return attempts;
  }
}
