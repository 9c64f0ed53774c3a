package dev.ragbench.analysis;

/**
 * A data-driven improvement hint.
 *
 * @param severity urgency
 * @param area pipeline name, comma-separated pipelines, or {@code stability}
 * @param text what to do
 * @param evidence the numbers behind it
 */
public record Suggestion(Severity severity, String area, String text, String evidence) {}
