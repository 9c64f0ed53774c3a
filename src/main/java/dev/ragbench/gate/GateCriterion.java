package dev.ragbench.gate;

import java.util.Locale;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Evaluation output for a single criterion of a phase.
 *
 * @param name stable identifier, e.g. {@code accuracy:graph}
 * @param kind what is measured
 * @param pipeline pipeline the criterion applies to, null for phase-wide criteria
 * @param measured measured value
 * @param threshold value the measurement is compared against
 * @param operator comparison applied to {@code measured} and {@code threshold}
 * @param passed whether the comparison held
 * @param message human-readable description, used as the blocker text when failed
 */
public record GateCriterion(
    String name,
    CriterionKind kind,
    @Nullable String pipeline,
    double measured,
    double threshold,
    GateOperator operator,
    boolean passed,
    String message) {

  public GateCriterion {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(message, "message");
    if (!Double.isFinite(measured) || !Double.isFinite(threshold)) {
      throw new IllegalArgumentException(name + ": measured and threshold must be finite");
    }
  }

  static GateCriterion evaluate(
      String name,
      CriterionKind kind,
      @Nullable String pipeline,
      double measured,
      double threshold,
      GateOperator operator,
      String subject,
      String unit) {
    boolean passed = operator.test(measured, threshold);
    String message =
        String.format(
            Locale.ROOT,
            "%s: %s%s %s %s%s",
            subject,
            format(measured),
            unit,
            passed ? operator.symbol() : negate(operator),
            format(threshold),
            unit);
    return new GateCriterion(
        name, kind, pipeline, measured, threshold, operator, passed, message);
  }

  private static String negate(GateOperator operator) {
    return operator == GateOperator.GREATER_OR_EQUAL ? "<" : ">";
  }

  private static String format(double value) {
    return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
  }
}
