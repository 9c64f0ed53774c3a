package dev.ragbench.analysis;

import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.pipeline.PipelineProperties;
import dev.ragbench.pipeline.PipelineTarget;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Runs every analysis over a ledger snapshot and assembles an {@link AnalysisReport}. */
@Service
public class LedgerAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(LedgerAnalyzer.class);

  private final RegressionAnalyzer regressionAnalyzer;
  private final ErrorPatternAnalyzer errorPatternAnalyzer;
  private final GapAnalyzer gapAnalyzer;
  private final SuggestionGenerator suggestionGenerator;
  private final PipelineProperties pipelineProperties;
  private final Clock clock;

  public LedgerAnalyzer(
      RegressionAnalyzer regressionAnalyzer,
      ErrorPatternAnalyzer errorPatternAnalyzer,
      GapAnalyzer gapAnalyzer,
      SuggestionGenerator suggestionGenerator,
      PipelineProperties pipelineProperties,
      Clock clock) {
    this.regressionAnalyzer = regressionAnalyzer;
    this.errorPatternAnalyzer = errorPatternAnalyzer;
    this.gapAnalyzer = gapAnalyzer;
    this.suggestionGenerator = suggestionGenerator;
    this.pipelineProperties = pipelineProperties;
    this.clock = clock;
  }

  /** Analyses {@code snapshot} against the configured pipeline targets. */
  public AnalysisReport analyze(LedgerSnapshot snapshot) {
    return analyze(snapshot, pipelineProperties.targets());
  }

  /** Analyses {@code snapshot} against explicit targets. */
  public AnalysisReport analyze(LedgerSnapshot snapshot, Map<String, PipelineTarget> targets) {
    RegressionReport regressions = regressionAnalyzer.analyze(snapshot);
    List<ErrorPattern> errorPatterns = errorPatternAnalyzer.analyze(snapshot);
    List<FlakyQuestion> flaky = FlakyQuestion.findAll(snapshot);
    List<PipelineGap> gaps = gapAnalyzer.analyze(snapshot, targets);
    List<Suggestion> suggestions =
        suggestionGenerator.generate(regressions, errorPatterns, flaky, gaps);
    log.info(
        "Analysis: {} regressions, {} fixes, {} error types, {} flaky, {} suggestions",
        regressions.regressions().size(),
        regressions.fixes().size(),
        errorPatterns.size(),
        flaky.size(),
        suggestions.size());
    return new AnalysisReport(
        clock.instant(),
        snapshot.revision(),
        regressions,
        errorPatterns,
        flaky,
        gaps,
        suggestions);
  }
}
