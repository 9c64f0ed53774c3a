package dev.ragbench.ledger;

import dev.ragbench.question.Question;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jspecify.annotations.Nullable;

/**
 * Mutable ledger for the duration of one run.
 *
 * <p>Workers call {@link #record} concurrently under the shared lock; {@link #snapshot()} takes
 * the exclusive lock, so a checkpoint never observes an attempt that is in the iteration but not
 * yet in the registry, or the reverse.
 */
public class Ledger {

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<Iteration> history;
  private final QuestionRegistry registry;
  private final ConcurrentHashMap<String, Set<String>> testedIds = new ConcurrentHashMap<>();
  private volatile long revision;
  private volatile @Nullable InProgress current;

  private Ledger(LedgerSnapshot snapshot, RunState runState) {
    this.history = new ArrayList<>(snapshot.iterations());
    this.registry = new QuestionRegistry(snapshot.questionRegistry());
    this.revision = snapshot.revision();
    runState
        .testedIds()
        .forEach(
            (pipeline, ids) -> {
              Set<String> set = ConcurrentHashMap.newKeySet();
              set.addAll(ids);
              testedIds.put(pipeline, set);
            });
  }

  /** Opens a ledger with the snapshot's own run state. */
  public static Ledger open(LedgerSnapshot snapshot) {
    return new Ledger(snapshot, snapshot.effectiveRunState());
  }

  /** Opens a ledger with an explicit run state, for example an empty one to ignore resume. */
  public static Ledger open(LedgerSnapshot snapshot, RunState runState) {
    return new Ledger(snapshot, runState);
  }

  /**
   * Starts a new in-progress iteration.
   *
   * @return the iteration id
   * @throws IllegalStateException if an iteration is already in progress
   */
  public String beginIteration(String id, @Nullable String label, Instant startedAt) {
    lock.writeLock().lock();
    try {
      if (current != null) {
        throw new IllegalStateException("Iteration " + current.id + " is still in progress");
      }
      int sequence =
          history.isEmpty() ? 1 : history.get(history.size() - 1).sequenceNumber() + 1;
      current = new InProgress(id, sequence, startedAt, label);
      return id;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Records one attempt in the in-progress iteration and the question's registry entry, and
   * marks the question tested.
   *
   * @throws IllegalStateException if no iteration is in progress
   */
  public void record(Question question, Attempt attempt) {
    lock.readLock().lock();
    try {
      InProgress iteration = current;
      if (iteration == null) {
        throw new IllegalStateException("No iteration in progress");
      }
      iteration.attempts.add(attempt);
      registry.record(question, attempt);
      testedIds
          .computeIfAbsent(question.targetPipeline(), k -> ConcurrentHashMap.newKeySet())
          .add(question.id());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Closes the in-progress iteration. It joins the history only if it recorded an attempt; an
   * empty iteration is returned but not kept.
   */
  public Iteration finishIteration(Instant endedAt) {
    lock.writeLock().lock();
    try {
      InProgress iteration = current;
      if (iteration == null) {
        throw new IllegalStateException("No iteration in progress");
      }
      Iteration finished = iteration.toIteration(endedAt);
      if (finished.hasResults()) {
        history.add(finished);
      }
      current = null;
      return finished;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Returns a consistent snapshot; an in-progress iteration with attempts appears with a null
   * {@code endedAt}.
   */
  public LedgerSnapshot snapshot() {
    lock.writeLock().lock();
    try {
      List<Iteration> iterations = new ArrayList<>(history);
      InProgress iteration = current;
      if (iteration != null && !iteration.attempts.isEmpty()) {
        iterations.add(iteration.toIteration(null));
      }
      return new LedgerSnapshot(
          LedgerSnapshot.CURRENT_SCHEMA_VERSION,
          revision,
          iterations,
          registry.snapshot(),
          runState(),
          null);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public RunState runState() {
    return new RunState(Map.copyOf(testedIds));
  }

  public QuestionRegistry registry() {
    return registry;
  }

  /** Records the revision a store assigned to the last saved snapshot. */
  public void markSaved(LedgerSnapshot saved) {
    this.revision = saved.revision();
  }

  public long revision() {
    return revision;
  }

  private static final class InProgress {
    private final String id;
    private final int sequenceNumber;
    private final Instant startedAt;
    private final @Nullable String label;
    private final ConcurrentLinkedQueue<Attempt> attempts = new ConcurrentLinkedQueue<>();

    private InProgress(String id, int sequenceNumber, Instant startedAt, @Nullable String label) {
      this.id = id;
      this.sequenceNumber = sequenceNumber;
      this.startedAt = startedAt;
      this.label = label;
    }

    private Iteration toIteration(@Nullable Instant endedAt) {
      return new Iteration(
          id, sequenceNumber, startedAt, endedAt, label, new ArrayList<>(attempts), null);
    }
  }
}
