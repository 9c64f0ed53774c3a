package dev.ragbench.improvement;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * One backlog item.
 *
 * <p>Items are never deleted; they only move through {@link ImprovementStatus} via {@link
 * Backlog}. A missing status or priority in the document reads as PENDING and P3.
 *
 * @param id unique id
 * @param title short title
 * @param pipeline pipeline the change targets
 * @param priority urgency tier
 * @param expectedImpactPp accuracy gain expected, in percentage points
 * @param description what the change does
 * @param status lifecycle state
 * @param appliedAt when the applier reported success
 * @param verifiedAt when the item was verified or failed
 * @param baselineAccuracyPct pipeline accuracy when the item was applied
 * @param actualImpactPp measured accuracy change at verification
 * @param failureReason why verification failed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Improvement(
    String id,
    @Nullable String title,
    String pipeline,
    Priority priority,
    @JsonAlias("expected_impact_pp") double expectedImpactPp,
    @Nullable String description,
    ImprovementStatus status,
    @JsonAlias("applied_at") @Nullable Instant appliedAt,
    @JsonAlias("verified_at") @Nullable Instant verifiedAt,
    @JsonAlias("baseline_accuracy_pct") @Nullable Double baselineAccuracyPct,
    @JsonAlias("actual_impact_pp") @Nullable Double actualImpactPp,
    @JsonAlias("failure_reason") @Nullable String failureReason) {

  public Improvement {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("improvement id must not be blank");
    }
    if (pipeline == null || pipeline.isBlank()) {
      throw new IllegalArgumentException("improvement " + id + " has no pipeline");
    }
    priority = priority == null ? Priority.P3 : priority;
    status = status == null ? ImprovementStatus.PENDING : status;
  }

  /** A new pending item. */
  public static Improvement pending(
      String id, String pipeline, Priority priority, double expectedImpactPp) {
    return new Improvement(
        id,
        null,
        pipeline,
        priority,
        expectedImpactPp,
        null,
        ImprovementStatus.PENDING,
        null,
        null,
        null,
        null,
        null);
  }

  Improvement applied(Instant at, @Nullable Double baseline) {
    return new Improvement(
        id,
        title,
        pipeline,
        priority,
        expectedImpactPp,
        description,
        ImprovementStatus.APPLIED,
        at,
        null,
        baseline,
        null,
        null);
  }

  Improvement verified(Instant at, double actualImpact) {
    return new Improvement(
        id,
        title,
        pipeline,
        priority,
        expectedImpactPp,
        description,
        ImprovementStatus.VERIFIED,
        appliedAt,
        at,
        baselineAccuracyPct,
        actualImpact,
        null);
  }

  Improvement failed(Instant at, @Nullable Double actualImpact, String reason) {
    return new Improvement(
        id,
        title,
        pipeline,
        priority,
        expectedImpactPp,
        description,
        ImprovementStatus.FAILED,
        appliedAt,
        at,
        baselineAccuracyPct,
        actualImpact,
        reason);
  }
}
