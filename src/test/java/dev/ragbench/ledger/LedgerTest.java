package dev.ragbench.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.ragbench.fixture.AttemptBuilder;
import dev.ragbench.fixture.LedgerFixtures;
import dev.ragbench.question.Question;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class LedgerTest {

  private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

  @Test
  void inProgressIterationAppearsWithoutEndTime() {
    Ledger ledger = Ledger.open(LedgerSnapshot.empty());
    ledger.beginIteration("iter-001-20260301T090000", "smoke", T0);
    ledger.record(
        Question.of("q1", "Capital of France?", "Paris", "standard"),
        new AttemptBuilder().questionId("q1").correct().build());

    LedgerSnapshot snapshot = ledger.snapshot();

    assertThat(snapshot.iterations()).hasSize(1);
    Iteration iteration = snapshot.iterations().get(0);
    assertThat(iteration.endedAt()).isNull();
    assertThat(iteration.isComplete()).isFalse();
    assertThat(iteration.attempts()).hasSize(1);
    assertThat(snapshot.questionRegistry()).containsOnlyKeys("q1");
    assertThat(snapshot.effectiveRunState().isTested("standard", "q1")).isTrue();
  }

  @Test
  void finishedIterationTakesTheNextSequenceNumber() {
    LedgerSnapshot existing =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(1, new AttemptBuilder().questionId("q1").build()));
    Ledger ledger = Ledger.open(existing);

    ledger.beginIteration("iter-002", null, T0);
    ledger.record(
        Question.of("q2", "Capital of Spain?", "Madrid", "standard"),
        new AttemptBuilder().questionId("q2").iterationId("iter-002").build());
    Iteration finished = ledger.finishIteration(T0.plusSeconds(30));

    assertThat(finished.sequenceNumber()).isEqualTo(2);
    assertThat(finished.endedAt()).isEqualTo(T0.plusSeconds(30));
    assertThat(ledger.snapshot().iterations())
        .extracting(Iteration::id)
        .containsExactly("iter-001", "iter-002");
  }

  @Test
  void iterationWithoutAttemptsIsNotKept() {
    LedgerSnapshot existing =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(1, new AttemptBuilder().questionId("q1").build()));
    Ledger ledger = Ledger.open(existing);

    ledger.beginIteration("iter-002", null, T0);
    assertThat(ledger.snapshot().iterations())
        .extracting(Iteration::id)
        .containsExactly("iter-001");

    Iteration finished = ledger.finishIteration(T0.plusSeconds(5));

    assertThat(finished.attempts()).isEmpty();
    assertThat(finished.hasResults()).isFalse();
    LedgerSnapshot snapshot = ledger.snapshot();
    assertThat(snapshot.iterations()).extracting(Iteration::id).containsExactly("iter-001");
    assertThat(snapshot.nextSequenceNumber()).isEqualTo(2);
    assertThat(snapshot.effectiveRunState().isTested("standard", "q1")).isTrue();
  }

  @Test
  void onlyOneIterationCanBeInProgress() {
    Ledger ledger = Ledger.open(LedgerSnapshot.empty());
    ledger.beginIteration("iter-001", null, T0);

    assertThatThrownBy(() -> ledger.beginIteration("iter-002", null, T0))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void recordingWithoutAnIterationFails() {
    Ledger ledger = Ledger.open(LedgerSnapshot.empty());

    assertThatThrownBy(
            () ->
                ledger.record(
                    Question.of("q1", "?", "a", "standard"), new AttemptBuilder().build()))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void explicitRunStateOverridesTheSnapshot() {
    LedgerSnapshot existing =
        LedgerFixtures.snapshot(
            LedgerFixtures.iteration(1, new AttemptBuilder().questionId("q1").build()));

    Ledger ledger = Ledger.open(existing, RunState.empty());

    assertThat(ledger.runState().totalTested()).isZero();
    assertThat(ledger.registry().snapshot()).containsKey("q1");
  }
}
