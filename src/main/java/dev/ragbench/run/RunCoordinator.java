package dev.ragbench.run;

import dev.ragbench.ledger.Attempt;
import dev.ragbench.ledger.Iteration;
import dev.ragbench.ledger.Ledger;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.LedgerStorageException;
import dev.ragbench.ledger.LedgerStore;
import dev.ragbench.matching.AnswerMatcher;
import dev.ragbench.matching.MatchMethod;
import dev.ragbench.matching.MatchResult;
import dev.ragbench.pipeline.ErrorType;
import dev.ragbench.pipeline.PipelineCallResult;
import dev.ragbench.pipeline.PipelineClient;
import dev.ragbench.question.Question;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs questions against their pipelines concurrently and records every attempt in the ledger.
 *
 * <p>Each pipeline gets its own single-thread worker, so a pipeline never has more than one call
 * in flight and its questions are answered in submission order, while different pipelines run in
 * parallel. Questions already in the request's {@link dev.ragbench.ledger.RunState} are skipped.
 *
 * <p>The ledger is flushed every {@code checkpointInterval} attempts and whenever a worker
 * finishes; flushes are serialized. Transient, malformed and matcher failures become errored
 * attempts. A storage failure cancels the remaining workers and is rethrown once they have
 * stopped; any other worker failure cancels them too and surfaces as a {@link
 * RunAbortedException} after the recorded attempts are saved. The iteration is closed only after
 * every worker has joined, even when the calling thread is interrupted.
 */
@Service
public class RunCoordinator {

  private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

  private static final DateTimeFormatter ITERATION_ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

  private final PipelineClient pipelineClient;
  private final AnswerMatcher answerMatcher;
  private final LedgerStore ledgerStore;
  private final RunProperties properties;
  private final Clock clock;

  public RunCoordinator(
      PipelineClient pipelineClient,
      AnswerMatcher answerMatcher,
      LedgerStore ledgerStore,
      RunProperties properties,
      Clock clock) {
    this.pipelineClient = pipelineClient;
    this.answerMatcher = answerMatcher;
    this.ledgerStore = ledgerStore;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Runs every untested question of the request and persists the resulting iteration. A run
   * that records no attempt still saves the run state but adds nothing to the history.
   *
   * @param request questions, run state and baseline ledger
   * @param listener progress callback, may stop the run
   * @return the finished iteration, the updated run state and final progress
   * @throws LedgerStorageException if a checkpoint cannot be written
   * @throws RunAbortedException if a worker failed unexpectedly
   */
  public RunOutcome run(RunRequest request, RunProgressListener listener) {
    Instant startedAt = clock.instant();
    LedgerSnapshot baseline = request.baseline();
    String iterationId =
        String.format(
            "iter-%03d-%s",
            baseline.nextSequenceNumber(), ITERATION_ID_FORMAT.format(startedAt));
    RunContext context =
        new RunContext(
            Ledger.open(baseline, request.runState()),
            new RunProgressTracker(clock),
            iterationId,
            listener);
    context.ledger.beginIteration(iterationId, request.label(), startedAt);

    Map<String, List<Question>> pending = new LinkedHashMap<>();
    request
        .questionsByPipeline()
        .forEach(
            (pipeline, questions) -> {
              List<Question> untested =
                  questions.stream()
                      .filter(q -> !request.runState().isTested(pipeline, q.id()))
                      .toList();
              context.tracker.start(pipeline, questions.size(), questions.size() - untested.size());
              pending.put(pipeline, untested);
              log.info(
                  "Pipeline {}: {} to run, {} already tested",
                  pipeline,
                  untested.size(),
                  questions.size() - untested.size());
            });

    log.info("Starting iteration {} across {} pipeline(s)", iterationId, pending.size());
    try {
      RuntimeException workerFailure = awaitWorkers(context, pending);

      Iteration finished = context.ledger.finishIteration(clock.instant());
      LedgerSnapshot saved = flush(context);
      if (workerFailure != null) {
        throw new RunAbortedException(
            "Iteration " + iterationId + " aborted: " + workerFailure.getMessage(), workerFailure);
      }
      log.info(
          "Iteration {} finished: {} attempts, {} checkpoints, cancelled={}",
          iterationId,
          finished.attempts().size(),
          context.checkpoints.get(),
          context.cancelled.get());
      return new RunOutcome(
          finished,
          context.ledger.runState(),
          context.tracker.snapshot(),
          context.cancelled.get(),
          context.checkpoints.get(),
          saved);
    } finally {
      // restored only now: an interrupted thread cannot write the final checkpoint
      if (context.interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Waits for every worker to finish, interrupts included, so nothing records into a closed
   * iteration.
   *
   * @return the first unexpected worker failure, or null
   * @throws LedgerStorageException if a worker could not write a checkpoint
   */
  private @Nullable RuntimeException awaitWorkers(
      RunContext context, Map<String, List<Question>> pending) {
    List<ExecutorService> executors = new ArrayList<>(pending.size());
    Map<String, Future<?>> futures = new LinkedHashMap<>();
    pending.forEach(
        (pipeline, questions) -> {
          ExecutorService executor =
              Executors.newSingleThreadExecutor(
                  runnable -> {
                    Thread thread = new Thread(runnable, "eval-" + pipeline);
                    thread.setDaemon(true);
                    return thread;
                  });
          executors.add(executor);
          futures.put(pipeline, executor.submit(() -> runPipeline(context, pipeline, questions)));
        });

    LedgerStorageException storageFailure = null;
    RuntimeException workerFailure = null;
    try {
      for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
        boolean joined = false;
        while (!joined) {
          try {
            entry.getValue().get();
            joined = true;
          } catch (InterruptedException e) {
            context.interrupted = true;
            if (context.cancelled.compareAndSet(false, true)) {
              log.warn("Interrupted while waiting for workers, cancelling run");
            }
          } catch (ExecutionException e) {
            joined = true;
            Throwable cause = e.getCause();
            if (cause instanceof LedgerStorageException storage) {
              if (storageFailure == null) {
                storageFailure = storage;
              }
            } else {
              log.error("Worker for pipeline {} failed", entry.getKey(), cause);
              if (workerFailure == null) {
                workerFailure =
                    cause instanceof RuntimeException runtime
                        ? runtime
                        : new IllegalStateException(String.valueOf(cause), cause);
              }
            }
          }
        }
      }
    } finally {
      executors.forEach(ExecutorService::shutdown);
    }
    if (storageFailure != null) {
      throw storageFailure;
    }
    return workerFailure;
  }

  private void runPipeline(RunContext context, String pipeline, List<Question> questions) {
    try {
      for (Question question : questions) {
        if (context.cancelled.get()) {
          context.tracker.cancel(pipeline);
          log.info("Pipeline {} cancelled", pipeline);
          flush(context);
          return;
        }
        Attempt attempt = attempt(question, context.iterationId);
        context.ledger.record(question, attempt);
        context.tracker.recordAttempt(pipeline, attempt.correct(), attempt.hasError());
        log.debug(
            "{} {} correct={} method={} latency={}ms",
            pipeline,
            question.id(),
            attempt.correct(),
            attempt.matchMethod(),
            attempt.latencyMs());

        int count = context.attempts.incrementAndGet();
        if (count % properties.checkpointInterval() == 0) {
          flush(context);
        }
        if (count % properties.progressInterval() == 0) {
          notifyProgress(context, count);
        }
      }
      context.tracker.complete(pipeline);
      PipelineProgress progress = context.tracker.getProgress(pipeline).orElseThrow();
      log.info(
          "Pipeline {} done: {} attempted, {} correct, {} errors",
          pipeline,
          progress.attempted(),
          progress.correct(),
          progress.errors());
      flush(context);
    } catch (LedgerStorageException e) {
      context.cancelled.set(true);
      context.tracker.fail(pipeline);
      throw e;
    } catch (RuntimeException e) {
      context.cancelled.set(true);
      context.tracker.fail(pipeline);
      throw e;
    }
  }

  private void notifyProgress(RunContext context, int count) {
    ProgressDecision decision = context.listener.onProgress(count, context.tracker.snapshot());
    if (decision == ProgressDecision.STOP && context.cancelled.compareAndSet(false, true)) {
      log.warn("Run stopped by progress listener after {} attempts", count);
    }
  }

  /** Calls the pipeline and judges the answer; never throws. */
  Attempt attempt(Question question, String iterationId) {
    String pipeline = question.targetPipeline();
    PipelineCallResult call;
    try {
      call = pipelineClient.call(pipeline, question.text());
    } catch (RuntimeException e) {
      log.warn("Call for {} on {} failed: {}", question.id(), pipeline, e.toString());
      return new Attempt(
          question.id(),
          pipeline,
          iterationId,
          "",
          false,
          0.0,
          MatchMethod.NO_ANSWER,
          0,
          String.valueOf(e.getMessage()),
          ErrorType.UNKNOWN,
          clock.instant());
    }

    String error = call.error();
    ErrorType errorType = call.errorType();
    MatchResult match;
    try {
      match = answerMatcher.evaluate(call.answer(), question.expectedAnswer());
    } catch (RuntimeException e) {
      log.warn("Matcher fault on {}: {}", question.id(), e.toString());
      match = MatchResult.noAnswer();
      if (error == null) {
        error = "Matcher fault: " + e.getMessage();
        errorType = ErrorType.MATCHER_FAULT;
      }
    }
    boolean correct = match.correct();
    MatchMethod method = match.method();
    if (call.isError() && correct) {
      correct = false;
      method = call.answer().isBlank() ? MatchMethod.NO_ANSWER : MatchMethod.PARTIAL;
    }
    return new Attempt(
        question.id(),
        pipeline,
        iterationId,
        call.answer(),
        correct,
        match.score(),
        method,
        call.latencyMs(),
        error,
        errorType,
        clock.instant());
  }

  private LedgerSnapshot flush(RunContext context) {
    context.flushLock.lock();
    try {
      LedgerSnapshot saved = ledgerStore.save(context.ledger.snapshot());
      context.ledger.markSaved(saved);
      int checkpoints = context.checkpoints.incrementAndGet();
      log.debug("Checkpoint {} written at revision {}", checkpoints, saved.revision());
      return saved;
    } finally {
      context.flushLock.unlock();
    }
  }

  private static final class RunContext {
    private final Ledger ledger;
    private final RunProgressTracker tracker;
    private final String iterationId;
    private final RunProgressListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger checkpoints = new AtomicInteger();
    private final ReentrantLock flushLock = new ReentrantLock();
    private boolean interrupted;

    private RunContext(
        Ledger ledger,
        RunProgressTracker tracker,
        String iterationId,
        RunProgressListener listener) {
      this.ledger = ledger;
      this.tracker = tracker;
      this.iterationId = iterationId;
      this.listener = listener;
    }
  }
}
