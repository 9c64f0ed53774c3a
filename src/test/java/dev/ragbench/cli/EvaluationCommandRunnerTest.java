package dev.ragbench.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.ragbench.analysis.LedgerAnalyzer;
import dev.ragbench.config.EvaluationConfigurationException;
import dev.ragbench.fixture.LedgerFixtures;
import dev.ragbench.gate.CriterionKind;
import dev.ragbench.gate.GateCriterion;
import dev.ragbench.gate.GateOperator;
import dev.ragbench.gate.GateReport;
import dev.ragbench.gate.PhaseGate;
import dev.ragbench.improvement.Improvement;
import dev.ragbench.improvement.ImprovementService;
import dev.ragbench.improvement.ImprovementStatus;
import dev.ragbench.improvement.Priority;
import dev.ragbench.improvement.Selection;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.LedgerStorageException;
import dev.ragbench.ledger.LedgerStore;
import dev.ragbench.ledger.RunState;
import dev.ragbench.run.EvaluationRunService;
import dev.ragbench.run.RunOptions;
import dev.ragbench.run.RunAbortedException;
import dev.ragbench.run.RunOutcome;
import dev.ragbench.run.StageResult;
import dev.ragbench.run.StageVerdict;
import dev.ragbench.run.StagedRunOutcome;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class EvaluationCommandRunnerTest {

  @Mock EvaluationRunService runService;
  @Mock LedgerStore ledgerStore;
  @Mock LedgerAnalyzer ledgerAnalyzer;
  @Mock PhaseGate phaseGate;
  @Mock ImprovementService improvementService;

  @Captor ArgumentCaptor<RunOptions> optionsCaptor;

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private EvaluationCommandRunner runner;

  @BeforeEach
  void setUp() {
    runner =
        new EvaluationCommandRunner(
            runService,
            ledgerStore,
            ledgerAnalyzer,
            phaseGate,
            improvementService,
            new ReportFormatter(),
            new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  @Test
  void runIsTheDefaultCommandAndParsesItsOptions() {
    when(runService.run(optionsCaptor.capture())).thenReturn(outcome());

    run("--max=5", "--pipelines=graph, standard", "--reset", "--label=nightly");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_OK);
    RunOptions options = optionsCaptor.getValue();
    assertThat(options.maxPerPipeline()).isEqualTo(5);
    assertThat(options.pipelines()).containsExactly("graph", "standard");
    assertThat(options.reset()).isTrue();
    assertThat(options.label()).isEqualTo("nightly");
    assertThat(options.datasets()).isEmpty();
    assertThat(printed()).contains("Iteration iter-001");
  }

  @Test
  void stageOptionStartsAStagedRun() {
    StageVerdict blocked =
        new StageVerdict("graph", 5, 40.0, 0.0, 60.0, 40.0, false, "accuracy 40.0% < 60.0%");
    StagedRunOutcome staged =
        new StagedRunOutcome(
            List.of(new StageResult(2, "Quick", outcome(), Map.of("graph", blocked))));
    when(runService.runStaged(optionsCaptor.capture())).thenReturn(staged);

    run("run", "--stage=2", "--no-gate", "--only-failing");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_OK);
    RunOptions options = optionsCaptor.getValue();
    assertThat(options.startStage()).isEqualTo(2);
    assertThat(options.ignoreStageGate()).isTrue();
    assertThat(options.onlyFailing()).isTrue();
    verify(runService, never()).run(any());
    assertThat(printed())
        .contains("Stage 2: Quick")
        .contains("BLOCKED")
        .contains(": accuracy 40.0% < 60.0%");
  }

  @Test
  void abortedRunIsFatal() {
    when(runService.run(any()))
        .thenThrow(
            new RunAbortedException(
                "Iteration iter-001 aborted: boom", new IllegalStateException("boom")));

    run("run");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_FATAL);
  }

  @Test
  void configurationErrorExitsWithTwo() {
    when(runService.run(any()))
        .thenThrow(new EvaluationConfigurationException("Unknown pipeline 'hybrid'"));

    run("run", "--pipelines=hybrid");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_CONFIGURATION);
  }

  @Test
  void malformedNumberIsAUsageError() {
    run("run", "--max=lots");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_CONFIGURATION);
    verifyNoInteractions(runService);
  }

  @Test
  void storageFailureIsFatal() {
    when(ledgerStore.load()).thenThrow(new LedgerStorageException("Cannot read ledger"));

    run("analyze");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_FATAL);
  }

  @Test
  void unmetGateExitsWithThreeOnlyWhenStrict() {
    LedgerSnapshot snapshot = LedgerSnapshot.empty();
    when(ledgerStore.load()).thenReturn(snapshot);
    when(phaseGate.check(2, snapshot)).thenReturn(unmetGate());

    run("gate", "--phase=2");
    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_OK);

    run("gate", "--phase=2", "--strict");
    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_GATE_NOT_MET);
    assertThat(printed())
        .contains("Phase 2: Expansion")
        .contains("Status: NOT MET")
        .contains("  - graph accuracy: 50% < 70%");
  }

  @Test
  void improveWithApplyRunsTheApplier() {
    Selection exhausted =
        new Selection(null, Selection.Outcome.EXHAUSTED, "No pending improvements for graph");
    when(improvementService.applyNext("graph"))
        .thenReturn(new ImprovementService.ApplyOutcome(exhausted, null, null));

    run("improve", "--pipeline=graph", "--apply");

    verify(improvementService).applyNext("graph");
    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_OK);
    assertThat(printed()).isEqualTo("EXHAUSTED: No pending improvements for graph\n");
  }

  @Test
  void verifyNeedsAnId() {
    run("verify");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_CONFIGURATION);
    verifyNoInteractions(improvementService);
  }

  @Test
  void verifyOfAPendingItemIsReportedAsUsageError() {
    when(improvementService.verify("imp-1"))
        .thenThrow(new IllegalStateException("Improvement imp-1 is PENDING, expected APPLIED"));

    run("verify", "--id=imp-1");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_CONFIGURATION);
  }

  @Test
  void verifiedItemIsPrinted() {
    Improvement verified =
        new Improvement(
            "imp-1",
            "Rerank graph hits",
            "graph",
            Priority.P0,
            5.0,
            null,
            ImprovementStatus.VERIFIED,
            null,
            null,
            50.0,
            6.0,
            null);
    when(improvementService.verify("imp-1")).thenReturn(verified);

    run("verify", "--id=imp-1");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_OK);
    assertThat(printed()).contains("imp-1").contains("Rerank graph hits");
  }

  @Test
  void unknownCommandIsAUsageError() {
    run("deploy");

    assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_CONFIGURATION);
  }

  private void run(String... args) {
    runner.run(new DefaultApplicationArguments(args));
  }

  private String printed() {
    return output.toString(StandardCharsets.UTF_8);
  }

  private static RunOutcome outcome() {
    return new RunOutcome(
        LedgerFixtures.iteration(1), RunState.empty(), Map.of(), false, 1, LedgerSnapshot.empty());
  }

  private static GateReport unmetGate() {
    GateCriterion accuracy =
        new GateCriterion(
            "accuracy:graph",
            CriterionKind.PIPELINE_ACCURACY,
            "graph",
            50.0,
            70.0,
            GateOperator.GREATER_OR_EQUAL,
            false,
            "graph accuracy: 50% < 70%");
    return new GateReport(2, "Expansion", false, List.of(accuracy));
  }
}
