package org.houseofmourning.traversal.traversal;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.houseofmourning.traversal.config.ExecutorConfig;
import org.houseofmourning.traversal.config.TraversalProperties;
import org.houseofmourning.traversal.model.PoolStats;
import org.houseofmourning.traversal.model.TraversalStats;
import org.houseofmourning.traversal.store.MessageStore;
import org.houseofmourning.traversal.store.StoreUnavailableException;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Periodically logs engine stats and the number of displayable messages.
 *
 * <p>Disabled when {@code traversal.stats-log-interval-ms} is 0.
 */
@Component
@ApplicationLayer
public class TraversalStatsReporter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TraversalStatsReporter.class);

  private final TraversalCoordinator coordinator;
  private final MessageStore store;
  private final ScheduledFuture<?> recurringTask;

  public TraversalStatsReporter(
      TraversalCoordinator coordinator,
      MessageStore store,
      TraversalProperties props,
      @Qualifier(ExecutorConfig.TRAVERSAL_STATS_SCHEDULER) ScheduledExecutorService exec) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.store = Objects.requireNonNull(store, "store");

    long every = props.statsLogIntervalMs();
    this.recurringTask =
        every > 0
            ? exec.scheduleWithFixedDelay(this::reportSafely, every, every, TimeUnit.MILLISECONDS)
            : null;
    if (recurringTask == null) {
      log.debug("[traversal] Periodic stats logging disabled");
    }
  }

  private void reportSafely() {
    try {
      reportOnce();
    } catch (Throwable t) {
      log.warn("[traversal] Stats report failed", t);
    }
  }

  /** Logs one stats line and returns it. */
  String reportOnce() {
    TraversalStats s = coordinator.getStats();
    if (!TraversalState.valueOf(s.state()).isActive()) return null;

    String visible;
    try {
      visible = Long.toString(store.countVisible());
    } catch (StoreUnavailableException e) {
      log.debug("[traversal] Visible count unavailable for stats", e);
      visible = "?";
    }

    PoolStats p = s.pool();
    String line =
        String.format(
            "state=%s shown=%d focus=%s next=%s workingSet=%d priority=%d queue=%d/%d"
                + " dropped=%d recycles=%d watermark=%d cursor=%s visible=%s queueWaitMs=%d",
            s.state(),
            s.totalClustersShown(),
            s.currentFocusId(),
            s.nextFocusId(),
            s.workingSetSize(),
            s.priorityMemberCount(),
            p.queueDepth(),
            p.queueCapacity(),
            p.droppedOnOverflow(),
            p.recycleCount(),
            p.watermark(),
            p.historicalCursor(),
            visible,
            s.estimatedQueueWaitMs());
    log.info("[traversal] Stats: {}", line);
    return line;
  }

  @Override
  public void close() {
    if (recurringTask != null) recurringTask.cancel(false);
  }
}
