package dev.ragbench.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ragbench.fixture.AttemptBuilder;
import dev.ragbench.fixture.LedgerFixtures;
import dev.ragbench.ledger.Attempt;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.pipeline.ErrorType;
import dev.ragbench.pipeline.PipelineTarget;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GapAnalyzerTest {

  private final GapAnalyzer analyzer = new GapAnalyzer(AnalysisProperties.defaults());

  @Test
  void gapIsTargetMinusCurrentAccuracyLargestFirst() {
    LedgerSnapshot snapshot =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(
                1,
                concat(
                    LedgerFixtures.attempts("standard", 20, 15),
                    LedgerFixtures.attempts("graph", 10, 5))));
    Map<String, PipelineTarget> targets = new LinkedHashMap<>();
    targets.put("standard", PipelineTarget.accuracy(80.0));
    targets.put("graph", PipelineTarget.accuracy(70.0));

    List<PipelineGap> gaps = analyzer.analyze(snapshot, targets);

    assertThat(gaps).extracting(PipelineGap::pipeline).containsExactly("graph", "standard");
    PipelineGap graph = gaps.get(0);
    assertThat(graph.currentAccuracyPct()).isEqualTo(50.0);
    assertThat(graph.gapPp()).isEqualTo(20.0);
    assertThat(graph.isFailing()).isTrue();
    assertThat(graph.tested()).isEqualTo(10);
    assertThat(gaps.get(1).gapPp()).isEqualTo(5.0);
  }

  @Test
  void pipelineAboveTargetIsOnTargetWithNegativeGap() {
    LedgerSnapshot snapshot =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(
                1, LedgerFixtures.attempts("standard", 10, 9).toArray(new Attempt[0])));

    PipelineGap gap =
        analyzer.analyze(snapshot, Map.of("standard", PipelineTarget.accuracy(85.0))).get(0);

    assertThat(gap.gapPp()).isEqualTo(-5.0);
    assertThat(gap.onTarget()).isTrue();
    assertThat(gap.isFailing()).isFalse();
  }

  @Test
  void untestedPipelineHasTheFullTargetAsGap() {
    PipelineGap gap =
        analyzer
            .analyze(LedgerSnapshot.empty(), Map.of("graph", PipelineTarget.accuracy(70.0)))
            .get(0);

    assertThat(gap.tested()).isZero();
    assertThat(gap.currentAccuracyPct()).isZero();
    assertThat(gap.gapPp()).isEqualTo(70.0);
    assertThat(gap.plateaued()).isFalse();
  }

  @Test
  void eachQuestionCountsOnceByItsLatestRun() {
    LedgerSnapshot snapshot =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(
                1,
                new AttemptBuilder().questionId("g1").pipeline("graph").correct(false).build(),
                new AttemptBuilder().questionId("g2").pipeline("graph").correct(false).build()),
            LedgerFixtures.iteration(
                2,
                new AttemptBuilder().questionId("g1").pipeline("graph").correct().build(),
                new AttemptBuilder()
                    .questionId("g2")
                    .pipeline("graph")
                    .error(ErrorType.TIMEOUT, "Read timed out")
                    .build()));

    PipelineGap gap =
        analyzer.analyze(snapshot, Map.of("graph", PipelineTarget.accuracy(70.0))).get(0);

    assertThat(gap.tested()).isEqualTo(2);
    assertThat(gap.currentAccuracyPct()).isEqualTo(50.0);
    assertThat(gap.errors()).isEqualTo(1);
    assertThat(gap.errorRatePct()).isEqualTo(50.0);
  }

  @Test
  void nearlyUnchangedAccuracyIsAPlateau() {
    LedgerSnapshot plateau =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(1, graphAttempts("a", 10, 5)),
            LedgerFixtures.iteration(2, graphAttempts("b", 10, 5)));
    LedgerSnapshot improving =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(1, graphAttempts("a", 10, 5)),
            LedgerFixtures.iteration(2, graphAttempts("b", 10, 7)));
    Map<String, PipelineTarget> targets = Map.of("graph", PipelineTarget.accuracy(90.0));

    assertThat(analyzer.analyze(plateau, targets).get(0).plateaued()).isTrue();
    assertThat(analyzer.analyze(improving, targets).get(0).plateaued()).isFalse();
  }

  private static Attempt[] graphAttempts(String prefix, int total, int correct) {
    Attempt[] attempts = new Attempt[total];
    for (int i = 0; i < total; i++) {
      attempts[i] =
          new AttemptBuilder()
              .questionId(prefix + i)
              .pipeline("graph")
              .correct(i < correct)
              .build();
    }
    return attempts;
  }

  private static Attempt[] concat(List<Attempt> first, List<Attempt> second) {
    List<Attempt> all = new ArrayList<>(first);
    all.addAll(second);
    return all.toArray(new Attempt[0]);
  }
}
