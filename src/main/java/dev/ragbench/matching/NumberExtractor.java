package dev.ragbench.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts numeric literals from free text and picks the "primary" number of a string.
 *
 * <p>Currency symbols and thousands separators are ignored. A literal directly followed by a
 * scale word ({@code thousand}, {@code million}, {@code billion}, {@code trillion}) is multiplied
 * accordingly, so {@code "$56.7 million"} yields {@code 56700000}.
 */
public final class NumberExtractor {

  private static final Pattern THOUSANDS_SEPARATOR = Pattern.compile("(?<=\\d),(?=\\d{3})");
  private static final Pattern CURRENCY = Pattern.compile("[$€£¥]");
  private static final Pattern NUMBER =
      Pattern.compile(
          "(?<![\\p{L}\\d.])-?\\d+(?:\\.\\d+)?(?:\\s*(thousand|million|billion|trillion)\\b)?");

  private static final Map<String, Double> SCALE =
      Map.of("thousand", 1e3, "million", 1e6, "billion", 1e9, "trillion", 1e12);

  private final double yearLowerBound;
  private final double yearUpperBound;

  public NumberExtractor(int yearLowerBound, int yearUpperBound) {
    if (yearLowerBound > yearUpperBound) {
      throw new IllegalArgumentException(
          "year range is empty: [" + yearLowerBound + ", " + yearUpperBound + "]");
    }
    this.yearLowerBound = yearLowerBound;
    this.yearUpperBound = yearUpperBound;
  }

  /** Returns every numeric literal in the text, in order of appearance. */
  public static List<Double> extractAll(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String cleaned = text.toLowerCase(Locale.ROOT);
    cleaned = CURRENCY.matcher(cleaned).replaceAll("");
    cleaned = THOUSANDS_SEPARATOR.matcher(cleaned).replaceAll("");

    List<Double> values = new ArrayList<>();
    Matcher matcher = NUMBER.matcher(cleaned);
    while (matcher.find()) {
      String literal = matcher.group();
      String scaleWord = matcher.group(1);
      String digits =
          scaleWord == null ? literal : literal.substring(0, literal.indexOf(scaleWord));
      double value = Double.parseDouble(digits.trim());
      if (scaleWord != null) {
        value *= SCALE.get(scaleWord);
      }
      values.add(value);
    }
    return values;
  }

  /**
   * Picks the primary number of a string. With more than one literal, plausible years are
   * discarded and the largest remaining magnitude wins; if every literal looked like a year the
   * first literal is used.
   */
  public OptionalDouble primary(String text) {
    List<Double> values = extractAll(text);
    if (values.isEmpty()) {
      return OptionalDouble.empty();
    }
    if (values.size() == 1) {
      return OptionalDouble.of(values.get(0));
    }
    OptionalDouble largest =
        values.stream()
            .filter(v -> !isPlausibleYear(v))
            .mapToDouble(Double::doubleValue)
            .reduce((a, b) -> Math.abs(b) > Math.abs(a) ? b : a);
    return largest.isPresent() ? largest : OptionalDouble.of(values.get(0));
  }

  private boolean isPlausibleYear(double value) {
    return value >= yearLowerBound && value <= yearUpperBound;
  }
}
