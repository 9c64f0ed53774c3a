package dev.ragbench.matching;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes free text for token comparison.
 *
 * <p>Lowercases, drops thousands separators between digits, keeps dots only between digits
 * (decimals) and turns all other punctuation into whitespace. Pure functions only.
 */
public final class TextNormalizer {

  private static final Pattern THOUSANDS_SEPARATOR = Pattern.compile("(?<=\\d),(?=\\d)");
  private static final Pattern NON_DECIMAL_DOT = Pattern.compile("(?<!\\d)\\.|\\.(?!\\d)");
  private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{Nd}\\s.]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextNormalizer() {}

  /** Returns the normalized text with tokens separated by single spaces. */
  public static String normalize(String text) {
    if (text == null || text.isBlank()) {
      return "";
    }
    String lowered = text.toLowerCase(Locale.ROOT);
    String noSeparators = THOUSANDS_SEPARATOR.matcher(lowered).replaceAll("");
    String noPunctuation = PUNCTUATION.matcher(noSeparators).replaceAll(" ");
    String decimalsOnly = NON_DECIMAL_DOT.matcher(noPunctuation).replaceAll(" ");
    return WHITESPACE.matcher(decimalsOnly).replaceAll(" ").trim();
  }

  /** Returns the set of normalized tokens, in first-seen order. */
  public static Set<String> tokens(String text) {
    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      return Set.of();
    }
    return new LinkedHashSet<>(Arrays.asList(normalized.split(" ")));
  }

  /**
   * Token-overlap F1 between two strings. Returns 0.0 when either side has no tokens or nothing
   * overlaps.
   */
  public static double f1(String produced, String expected) {
    Set<String> producedTokens = tokens(produced);
    Set<String> expectedTokens = tokens(expected);
    if (producedTokens.isEmpty() || expectedTokens.isEmpty()) {
      return 0.0;
    }
    long common = producedTokens.stream().filter(expectedTokens::contains).count();
    if (common == 0) {
      return 0.0;
    }
    double precision = (double) common / producedTokens.size();
    double recall = (double) common / expectedTokens.size();
    return Math.min(1.0, 2 * precision * recall / (precision + recall));
  }
}
