package org.houseofmourning.traversal.traversal;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import io.reactivex.rxjava3.schedulers.Schedulers;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.houseofmourning.traversal.cluster.ClusterInvariantViolation;
import org.houseofmourning.traversal.cluster.ClusterMetrics;
import org.houseofmourning.traversal.cluster.ClusterSelector;
import org.houseofmourning.traversal.config.ExecutorConfig;
import org.houseofmourning.traversal.config.TraversalProperties;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.model.MessageBatch;
import org.houseofmourning.traversal.model.MessageCluster;
import org.houseofmourning.traversal.model.PoolStats;
import org.houseofmourning.traversal.model.TraversalStats;
import org.houseofmourning.traversal.model.WorkingSetChange;
import org.houseofmourning.traversal.pool.MessagePoolManager;
import org.houseofmourning.traversal.store.StoreUnavailableException;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Owns the working set and drives the traversal.
 *
 * <p>Every mutation runs under {@code engineLock}. The cycle and poll timers run on one scheduler
 * and each has its own in-flight guard, so a slow store read drops the redundant tick instead of
 * stacking it. Read-only views ({@link #getCurrentCluster()}, {@link #getStats()}) come from
 * volatile snapshots and never wait for the lock.
 */
@Component
@ApplicationLayer
public class TraversalCoordinator {
  private static final Logger log = LoggerFactory.getLogger(TraversalCoordinator.class);

  private final TraversalProperties props;
  private final MessagePoolManager pool;
  private final ClusterSelector selector;
  private final Scheduler scheduler;
  private final Clock clock;

  private final Object engineLock = new Object();
  private final WorkingSet workingSet;
  private final Set<Long> priorityMembers = new HashSet<>();

  private final FlowableProcessor<TraversalEvent> events =
      PublishProcessor.<TraversalEvent>create().toSerialized();
  private final CompositeDisposable timers = new CompositeDisposable();
  private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
  private final AtomicBoolean pollInFlight = new AtomicBoolean(false);

  private volatile TraversalState state = TraversalState.UNINITIALIZED;
  private volatile MessageCluster currentCluster;
  private volatile long clustersShown;
  private volatile int workingSetSnapshot;
  private volatile int priorityMemberSnapshot;
  private volatile PoolStats poolSnapshot;

  // Selection hint; null after resetTraversal() until the next cluster is chosen.
  private MessageCluster continuityHint;

  @Autowired
  public TraversalCoordinator(
      TraversalProperties props,
      MessagePoolManager pool,
      ClusterSelector selector,
      @Qualifier(ExecutorConfig.TRAVERSAL_ENGINE_SCHEDULER) ScheduledExecutorService engineExec) {
    this(props, pool, selector, Schedulers.from(engineExec), Clock.systemUTC());
  }

  public TraversalCoordinator(
      TraversalProperties props,
      MessagePoolManager pool,
      ClusterSelector selector,
      Scheduler scheduler,
      Clock clock) {
    this.props = Objects.requireNonNull(props, "props");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.workingSet = new WorkingSet(props.workingSetSize());
    this.poolSnapshot = pool.stats();
  }

  /** Cluster and working-set events. Completes on {@link #stop()}. */
  public Flowable<TraversalEvent> events() {
    return events.onBackpressureBuffer();
  }

  /**
   * Builds the working set, publishes the first cluster and starts the timers.
   *
   * <p>An unreachable or empty store still yields {@code RUNNING}: the engine shows a placeholder
   * and recovers on a later tick.
   */
  public void initialize() {
    synchronized (engineLock) {
      if (state != TraversalState.UNINITIALIZED) {
        log.debug("[traversal] initialize() ignored in state {}", state);
        return;
      }
      state = TraversalState.INITIALIZING;
      log.info(
          "[traversal] Initializing (workingSetSize={}, clusterSize={}, clusterDurationMs={}, pollingIntervalMs={})",
          props.workingSetSize(),
          props.clusterSize(),
          props.clusterDurationMs(),
          props.pollingIntervalMs());

      List<Message> added = ensurePoolInitialized() ? replenish() : List.of();
      publish(new TraversalEvent.WorkingSetChanged(
          now(), new WorkingSetChange(List.of(), added, WorkingSetChange.Reason.INITIALIZATION)));
      selectAndPublish();

      state = TraversalState.RUNNING;
      refreshSnapshots();
      if (workingSet.size() == 0) {
        log.warn("[traversal] No displayable messages yet; showing placeholder until some arrive");
      } else {
        log.info(
            "[traversal] Running with {} message(s), first focus {}",
            workingSet.size(),
            currentCluster == null ? null : currentCluster.focusId());
      }
    }
    startTimers();
  }

  /**
   * Runs one evict-replenish-select step.
   *
   * <p>Callable directly (for example while paused); the cycle timer calls it only while running.
   *
   * @return the current cluster after the step
   */
  public MessageCluster cycle() {
    synchronized (engineLock) {
      if (!state.isActive()) {
        log.debug("[traversal] cycle() ignored in state {}", state);
        return currentCluster;
      }
      MessageCluster current = currentCluster;
      List<Long> outgoing = outgoingIds(current);
      workingSet.removeAll(outgoing);

      List<Message> added = ensurePoolInitialized() ? replenish() : List.of();
      if (state == TraversalState.STOPPED) {
        log.debug("[traversal] Stopped mid-cycle; discarding {} fetched message(s)", added.size());
        return currentCluster;
      }

      WorkingSetChange change = new WorkingSetChange(outgoing, added, WorkingSetChange.Reason.CYCLE);
      if (!change.isEmpty()) {
        publish(new TraversalEvent.WorkingSetChanged(now(), change));
      }
      selectAndPublish();
      refreshSnapshots();
      return currentCluster;
    }
  }

  /**
   * Folds messages above the watermark into the priority queue.
   *
   * @return number of new messages found; 0 when the store is unavailable
   */
  public int pollOnce() {
    synchronized (engineLock) {
      if (state == TraversalState.STOPPED) return 0;
      if (!ensurePoolInitialized()) return 0;
      try {
        return pool.pollAboveWatermark();
      } catch (StoreUnavailableException e) {
        log.warn("[traversal] Poll skipped: store unavailable after {} attempt(s)", e.attempts(), e);
        return 0;
      } finally {
        refreshSnapshots();
      }
    }
  }

  /**
   * Hands a freshly stored message to the priority path.
   *
   * @return true if the message was queued for priority display
   */
  public boolean submit(Message message) {
    Objects.requireNonNull(message, "message");
    synchronized (engineLock) {
      if (state == TraversalState.STOPPED) {
        log.debug("[traversal] Submission {} ignored: engine stopped", message.id());
        return false;
      }
      boolean queued = pool.markNewSubmission(message);
      refreshSnapshots();
      return queued;
    }
  }

  public void pause() {
    synchronized (engineLock) {
      if (state != TraversalState.RUNNING) return;
      state = TraversalState.PAUSED;
      log.info("[traversal] Paused");
    }
  }

  public void resume() {
    synchronized (engineLock) {
      if (state != TraversalState.PAUSED) return;
      state = TraversalState.RUNNING;
      log.info("[traversal] Resumed");
    }
  }

  /**
   * Forgets the continuity hint and restarts the shown counter. The working set and pool cursors
   * are kept.
   */
  public void resetTraversal() {
    synchronized (engineLock) {
      continuityHint = null;
      clustersShown = 0;
      log.info("[traversal] Traversal reset");
    }
  }

  /** Halts both timers and completes the event stream. Safe from any state and idempotent. */
  @PreDestroy
  public void stop() {
    TraversalState prev = state;
    if (prev == TraversalState.STOPPED) return;
    state = TraversalState.STOPPED;
    timers.dispose();
    events.onComplete();
    log.info("[traversal] Stopped (was {}, clustersShown={})", prev, clustersShown);
    synchronized (engineLock) {
      pool.clear();
      refreshSnapshots();
    }
  }

  public MessageCluster getCurrentCluster() {
    return currentCluster;
  }

  public TraversalState getState() {
    return state;
  }

  public TraversalStats getStats() {
    MessageCluster c = currentCluster;
    PoolStats ps = poolSnapshot;
    return new TraversalStats(
        state.name(),
        clustersShown,
        c == null ? null : c.focusId(),
        c == null ? null : c.nextId(),
        workingSetSnapshot,
        priorityMemberSnapshot,
        estimatedQueueWaitMs(ps.queueDepth()),
        ps);
  }

  /** Rough time for the last queued message to be admitted, at one reservation per cycle. */
  long estimatedQueueWaitMs(int queueDepth) {
    if (queueDepth <= 0) return 0;
    int perCycle = Math.max(1, props.clusterSize() - 2);
    long cycles = (queueDepth + perCycle - 1) / perCycle;
    return cycles * props.clusterDurationMs();
  }

  private void startTimers() {
    if (state == TraversalState.STOPPED) return;
    long pollMs = props.pollingIntervalMs();
    long cycleMs = props.clusterDurationMs();

    timers.add(Flowable
        .interval(pollMs, pollMs, TimeUnit.MILLISECONDS, scheduler)
        .subscribe(
            tick -> pollSafely(),
            err -> log.error("[traversal] Poll ticker terminated", err)));

    timers.add(Flowable
        .interval(cycleMs, cycleMs, TimeUnit.MILLISECONDS, scheduler)
        .subscribe(
            tick -> cycleSafely(),
            err -> log.error("[traversal] Cycle ticker terminated", err)));
  }

  private void cycleSafely() {
    if (state != TraversalState.RUNNING) return;
    if (!cycleInFlight.compareAndSet(false, true)) {
      log.debug("[traversal] Previous cycle still running; dropping tick");
      return;
    }
    try {
      cycle();
    } catch (Throwable t) {
      log.error("[traversal] Cycle failed; next tick will retry", t);
    } finally {
      cycleInFlight.set(false);
    }
  }

  private void pollSafely() {
    if (!state.isActive()) return;
    if (!pollInFlight.compareAndSet(false, true)) {
      log.debug("[traversal] Previous poll still running; dropping tick");
      return;
    }
    try {
      pollOnce();
    } catch (Throwable t) {
      log.error("[traversal] Poll failed; next tick will retry", t);
    } finally {
      pollInFlight.set(false);
    }
  }

  // Related minus next. Unfeatured priority members stay so they still get their turn.
  private List<Long> outgoingIds(MessageCluster current) {
    if (current == null || current.isPlaceholder()) return List.of();
    Long nextId = current.nextId();
    List<Long> outgoing = new ArrayList<>(current.related().size());
    for (Long id : current.relatedIds()) {
      if (id.equals(nextId) || priorityMembers.contains(id)) continue;
      outgoing.add(id);
    }
    return outgoing;
  }

  private boolean ensurePoolInitialized() {
    if (pool.isInitialized()) return true;
    try {
      pool.initialize();
      return true;
    } catch (StoreUnavailableException e) {
      log.warn(
          "[traversal] Pool initialization failed after {} attempt(s); will retry on the next tick",
          e.attempts(),
          e);
      return false;
    }
  }

  /**
   * Tops the working set up to capacity. The pool skips ids already held, so one batch fills the
   * whole deficit unless the store has no further distinct messages.
   */
  private List<Message> replenish() {
    int deficit = workingSet.deficit();
    if (deficit <= 0) return List.of();

    MessageBatch batch = pool.nextBatch(deficit, workingSet::contains);
    List<Message> added = new ArrayList<>(batch.size());
    for (Message m : batch.messages()) {
      if (!workingSet.add(m)) continue;
      added.add(m);
      if (batch.priorityIds().contains(m.id())) priorityMembers.add(m.id());
    }
    if (workingSet.deficit() > 0 && !added.isEmpty()) {
      log.debug(
          "[traversal] Working set short by {} after replenishing {} message(s)",
          workingSet.deficit(),
          added.size());
    }
    return added;
  }

  private void selectAndPublish() {
    List<Message> members = workingSet.snapshot();
    long shown = clustersShown + 1;
    MessageCluster selected = selectSafely(members, continuityHint, shown);
    if (selected == null) return;

    if (selected.isPlaceholder()) {
      selected = selected.withTotalShown(clustersShown);
    } else {
      clustersShown = shown;
      priorityMembers.remove(selected.focusId());
      if (selected.nextId() != null) priorityMembers.remove(selected.nextId());
    }

    MessageCluster previous = currentCluster;
    currentCluster = selected;
    continuityHint = selected;

    if (selected.isPlaceholder() && previous != null && previous.isPlaceholder()) return;
    publish(new TraversalEvent.ClusterChanged(now(), selected));
    if (log.isDebugEnabled() && !selected.isPlaceholder()) {
      log.debug(
          "[traversal] Cluster #{} focus={} next={} related={} {}",
          selected.totalShown(),
          selected.focusId(),
          selected.nextId(),
          selected.related().size(),
          ClusterMetrics.summarize(selected));
    }
  }

  private MessageCluster selectSafely(List<Message> members, MessageCluster hint, long shown) {
    Set<Long> priority = Set.copyOf(priorityMembers);
    try {
      return selector.select(members, priority, hint, shown);
    } catch (ClusterInvariantViolation e) {
      log.error(
          "[traversal] Cluster invariant violated (members={}, priority={}, previousFocus={}, previousNext={}); retrying without continuity",
          members.stream().map(Message::id).toList(),
          priority,
          hint == null ? null : hint.focusId(),
          hint == null ? null : hint.nextId(),
          e);
    }
    try {
      return selector.select(members, priority, null, shown);
    } catch (ClusterInvariantViolation e) {
      log.error("[traversal] Re-selection failed as well; keeping the current cluster", e);
      return null;
    }
  }

  private void publish(TraversalEvent event) {
    if (state == TraversalState.STOPPED) return;
    events.onNext(event);
  }

  private void refreshSnapshots() {
    workingSetSnapshot = workingSet.size();
    priorityMemberSnapshot = priorityMembers.size();
    poolSnapshot = pool.stats();
  }

  private Instant now() {
    return clock.instant();
  }
}
