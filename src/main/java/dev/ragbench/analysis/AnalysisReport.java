package dev.ragbench.analysis;

import java.time.Instant;
import java.util.List;

/**
 * Everything the analyzer derives from one ledger snapshot.
 *
 * @param generatedAt when the report was produced
 * @param ledgerRevision revision of the analysed snapshot
 * @param regressions verdict changes between the two latest iterations
 * @param errorPatterns errors of the latest iteration by type
 * @param flakyQuestions flaky questions, lowest pass rate first
 * @param gaps gap per pipeline, largest first
 * @param suggestions suggestions, most urgent first
 */
public record AnalysisReport(
    Instant generatedAt,
    long ledgerRevision,
    RegressionReport regressions,
    List<ErrorPattern> errorPatterns,
    List<FlakyQuestion> flakyQuestions,
    List<PipelineGap> gaps,
    List<Suggestion> suggestions) {

  public AnalysisReport {
    errorPatterns = List.copyOf(errorPatterns);
    flakyQuestions = List.copyOf(flakyQuestions);
    gaps = List.copyOf(gaps);
    suggestions = List.copyOf(suggestions);
  }
}
