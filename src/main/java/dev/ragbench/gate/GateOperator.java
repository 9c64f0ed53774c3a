package dev.ragbench.gate;

/** Numeric comparison used by a gate criterion. */
public enum GateOperator {
  GREATER_OR_EQUAL(">=") {
    @Override
    boolean test(double measured, double threshold) {
      return measured >= threshold;
    }
  },
  LESS_OR_EQUAL("<=") {
    @Override
    boolean test(double measured, double threshold) {
      return measured <= threshold;
    }
  };

  private final String symbol;

  GateOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  abstract boolean test(double measured, double threshold);
}
