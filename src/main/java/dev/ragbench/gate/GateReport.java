package dev.ragbench.gate;

import java.util.List;

/**
 * Verdict of one phase.
 *
 * @param phase phase number
 * @param phaseName display name
 * @param passed true when every criterion passed, the prerequisite included
 * @param criteria every criterion evaluated, prerequisite first
 */
public record GateReport(
    int phase, String phaseName, boolean passed, List<GateCriterion> criteria) {

  public GateReport {
    criteria = List.copyOf(criteria);
  }

  /** Messages of the failed criteria, in evaluation order. */
  public List<String> blockers() {
    return criteria.stream().filter(c -> !c.passed()).map(GateCriterion::message).toList();
  }
}
