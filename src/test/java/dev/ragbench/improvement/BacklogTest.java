package dev.ragbench.improvement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class BacklogTest {

  private static final Instant APPLIED_AT = Instant.parse("2026-03-01T10:00:00Z");
  private static final Instant VERIFIED_AT = Instant.parse("2026-03-02T10:00:00Z");

  private final Backlog backlog =
      new Backlog(
          3,
          List.of(
              Improvement.pending("imp-1", "graph", Priority.P0, 5.0),
              Improvement.pending("imp-2", "standard", Priority.P1, 2.0)));

  @Test
  void applyThenVerifyRecordsTimesAndImpact() {
    Backlog verified =
        backlog.markApplied("imp-1", APPLIED_AT, 52.5).markVerified("imp-1", VERIFIED_AT, 4.0);

    Improvement item = verified.find("imp-1").orElseThrow();
    assertThat(item.status()).isEqualTo(ImprovementStatus.VERIFIED);
    assertThat(item.appliedAt()).isEqualTo(APPLIED_AT);
    assertThat(item.verifiedAt()).isEqualTo(VERIFIED_AT);
    assertThat(item.baselineAccuracyPct()).isEqualTo(52.5);
    assertThat(item.actualImpactPp()).isEqualTo(4.0);
    assertThat(verified.revision()).isEqualTo(3);
    assertThat(verified.improvements())
        .extracting(Improvement::id)
        .containsExactly("imp-1", "imp-2");
  }

  @Test
  void failedItemKeepsItsReasonAndLeavesThePendingList() {
    Backlog failed =
        backlog
            .markApplied("imp-1", APPLIED_AT, 60.0)
            .markFailed("imp-1", VERIFIED_AT, -3.0, "accuracy dropped 3.0pp");

    assertThat(failed.find("imp-1").orElseThrow().failureReason())
        .isEqualTo("accuracy dropped 3.0pp");
    assertThat(failed.pending()).extracting(Improvement::id).containsExactly("imp-2");
  }

  @Test
  void transitionsFromTheWrongStatusAreRejected() {
    assertThatThrownBy(() -> backlog.markVerified("imp-1", VERIFIED_AT, 1.0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Improvement imp-1 is PENDING, expected APPLIED");
    Backlog applied = backlog.markApplied("imp-1", APPLIED_AT, null);
    assertThatThrownBy(() -> applied.markApplied("imp-1", APPLIED_AT, null))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void unknownIdIsRejected() {
    assertThatThrownBy(() -> backlog.markApplied("imp-9", APPLIED_AT, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown improvement: imp-9");
  }

  @Test
  void duplicateIdsAreRejected() {
    Improvement item = Improvement.pending("imp-1", "graph", Priority.P0, 5.0);

    assertThatThrownBy(() -> new Backlog(0, List.of(item, item)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("imp-1");
  }

  @Test
  void missingPriorityAndStatusDefaultToP3AndPending() {
    Improvement item =
        new Improvement(
            "imp-3", null, "graph", null, 0.0, null, null, null, null, null, null, null);

    assertThat(item.priority()).isEqualTo(Priority.P3);
    assertThat(item.status()).isEqualTo(ImprovementStatus.PENDING);
  }
}
