package dev.ragbench.cli;

import dev.ragbench.analysis.LedgerAnalyzer;
import dev.ragbench.config.EvaluationConfigurationException;
import dev.ragbench.gate.GateReport;
import dev.ragbench.gate.PhaseGate;
import dev.ragbench.improvement.ImprovementService;
import dev.ragbench.ledger.LedgerStore;
import dev.ragbench.run.EvaluationRunService;
import dev.ragbench.run.RunOptions;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point.
 *
 * <p>Commands: {@code run} (default) with {@code --max}, {@code --pipelines}, {@code --reset},
 * {@code --label}, {@code --datasets}, {@code --only-failing} and, for a staged run, {@code
 * --stage=N [--no-gate]}; {@code analyze}; {@code gate --phase=N [--strict]}; {@code improve
 * [--pipeline=X] [--apply]}; {@code verify --id=X}.
 *
 * <p>Exit codes:
 *
 * <ul>
 *   <li>0 on success;
 *   <li>1 on storage errors, an aborted run ({@link dev.ragbench.run.RunAbortedException}) or any
 *       other unexpected error;
 *   <li>2 on configuration or usage errors, and on an {@link IllegalStateException} such as an
 *       illegal backlog transition ({@code verify} on an item that was never applied);
 *   <li>3 when {@code gate --strict} finds the phase not met.
 * </ul>
 *
 * <p>Failed questions never change the exit code.
 */
@Component
public class EvaluationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(EvaluationCommandRunner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FATAL = 1;
  static final int EXIT_CONFIGURATION = 2;
  static final int EXIT_GATE_NOT_MET = 3;

  private final EvaluationRunService runService;
  private final LedgerStore ledgerStore;
  private final LedgerAnalyzer ledgerAnalyzer;
  private final PhaseGate phaseGate;
  private final ImprovementService improvementService;
  private final ReportFormatter formatter;
  private final PrintStream out;
  private volatile int exitCode = EXIT_OK;

  @Autowired
  public EvaluationCommandRunner(
      EvaluationRunService runService,
      LedgerStore ledgerStore,
      LedgerAnalyzer ledgerAnalyzer,
      PhaseGate phaseGate,
      ImprovementService improvementService,
      ReportFormatter formatter) {
    this(
        runService,
        ledgerStore,
        ledgerAnalyzer,
        phaseGate,
        improvementService,
        formatter,
        System.out);
  }

  EvaluationCommandRunner(
      EvaluationRunService runService,
      LedgerStore ledgerStore,
      LedgerAnalyzer ledgerAnalyzer,
      PhaseGate phaseGate,
      ImprovementService improvementService,
      ReportFormatter formatter,
      PrintStream out) {
    this.runService = runService;
    this.ledgerStore = ledgerStore;
    this.ledgerAnalyzer = ledgerAnalyzer;
    this.phaseGate = phaseGate;
    this.improvementService = improvementService;
    this.formatter = formatter;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> commands = args.getNonOptionArgs();
    String command = commands.isEmpty() ? "run" : commands.get(0);
    try {
      exitCode = dispatch(command, args);
    } catch (EvaluationConfigurationException | IllegalArgumentException e) {
      log.error("{}: {}", command, e.getMessage());
      exitCode = EXIT_CONFIGURATION;
    } catch (IllegalStateException e) {
      log.warn("{}: {}", command, e.getMessage());
      exitCode = EXIT_CONFIGURATION;
    } catch (RuntimeException e) {
      log.error("{} failed", command, e);
      exitCode = EXIT_FATAL;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private int dispatch(String command, ApplicationArguments args) {
    switch (command) {
      case "run":
        return runEvaluation(args);
      case "analyze":
        out.print(formatter.format(ledgerAnalyzer.analyze(ledgerStore.load())));
        return EXIT_OK;
      case "gate":
        return checkGate(args);
      case "improve":
        return improve(args);
      case "verify":
        String id = option(args, "id");
        if (id == null) {
          throw new IllegalArgumentException("verify requires --id=<improvement id>");
        }
        out.print(formatter.format(improvementService.verify(id)));
        return EXIT_OK;
      default:
        throw new IllegalArgumentException(
            "Unknown command '" + command + "', expected run, analyze, gate, improve or verify");
    }
  }

  private int runEvaluation(ApplicationArguments args) {
    String max = option(args, "max");
    String stage = option(args, "stage");
    RunOptions options =
        new RunOptions(
            max == null ? null : parseInt("max", max),
            list(option(args, "pipelines")),
            args.containsOption("reset"),
            option(args, "label"),
            list(option(args, "datasets")),
            args.containsOption("only-failing"),
            stage == null ? null : parseInt("stage", stage),
            args.containsOption("no-gate"));
    if (options.staged()) {
      out.print(formatter.format(runService.runStaged(options)));
    } else {
      out.print(formatter.format(runService.run(options)));
    }
    return EXIT_OK;
  }

  private int checkGate(ApplicationArguments args) {
    String phase = option(args, "phase");
    GateReport report =
        phaseGate.check(phase == null ? 1 : parseInt("phase", phase), ledgerStore.load());
    out.print(formatter.format(report));
    if (!report.passed() && args.containsOption("strict")) {
      return EXIT_GATE_NOT_MET;
    }
    return EXIT_OK;
  }

  private int improve(ApplicationArguments args) {
    String pipeline = option(args, "pipeline");
    if (args.containsOption("apply")) {
      out.print(formatter.format(improvementService.applyNext(pipeline)));
    } else {
      out.print(formatter.format(improvementService.selectNext(pipeline)));
    }
    return EXIT_OK;
  }

  private static @Nullable String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    String value = values.get(values.size() - 1);
    return value.isBlank() ? null : value.strip();
  }

  private static List<String> list(@Nullable String value) {
    if (value == null) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList();
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " must be an integer, got: " + value, e);
    }
  }
}
