package org.houseofmourning.traversal.traversal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import io.reactivex.rxjava3.schedulers.TestScheduler;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.houseofmourning.traversal.cluster.ClusterInvariantViolation;
import org.houseofmourning.traversal.cluster.ClusterSelector;
import org.houseofmourning.traversal.config.StoreProperties;
import org.houseofmourning.traversal.config.TraversalProperties;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.model.MessageCluster;
import org.houseofmourning.traversal.model.RelatedMessage;
import org.houseofmourning.traversal.model.WorkingSetChange;
import org.houseofmourning.traversal.pool.MessagePoolManager;
import org.houseofmourning.traversal.store.InMemoryMessageStore;
import org.houseofmourning.traversal.store.RetryingMessageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class TraversalCoordinatorTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

  private final InMemoryMessageStore store = new InMemoryMessageStore();
  private final TestScheduler scheduler = new TestScheduler();
  private MessagePoolManager pool;
  private TraversalCoordinator coordinator;

  @AfterEach
  void tearDown() {
    if (coordinator != null) coordinator.stop();
  }

  @Test
  void emptyStoreShowsOnePlaceholderAndRecoversWhenMessagesArrive() {
    coordinator = newCoordinator(props(10, 4));
    TestSubscriber<TraversalEvent> events = coordinator.events().test();

    coordinator.initialize();

    assertEquals(TraversalState.RUNNING, coordinator.getState());
    assertTrue(coordinator.getCurrentCluster().isPlaceholder());
    events.assertValueCount(2);
    WorkingSetChange init = workingSetChange(events.values().get(0));
    assertEquals(WorkingSetChange.Reason.INITIALIZATION, init.reason());
    assertTrue(init.isEmpty());
    assertTrue(cluster(events.values().get(1)).isPlaceholder());

    coordinator.cycle();
    events.assertValueCount(2);

    store.addMany(5);
    assertEquals(5, coordinator.pollOnce());
    MessageCluster c = coordinator.cycle();

    assertFalse(c.isPlaceholder());
    assertEquals(3, c.related().size());
    assertEquals(1, c.totalShown());
    assertEquals(5, coordinator.getStats().workingSetSize());
    events.assertValueCount(4);
  }

  @Test
  void singleMessageStoreLoopsOnItself() {
    Message only = store.add("the only one");
    coordinator = newCoordinator(props(10, 4));

    coordinator.initialize();
    MessageCluster first = coordinator.getCurrentCluster();
    MessageCluster second = coordinator.cycle();

    assertEquals(only.id(), first.focusId());
    assertEquals(only.id(), first.nextId());
    assertTrue(first.related().isEmpty());
    assertEquals(only.id(), second.focusId());
    assertEquals(1, coordinator.getStats().workingSetSize());
  }

  @Test
  void steadyStateHoldsWorkingSetAndClusterInvariants() {
    store.addMany(1000);
    coordinator = newCoordinator(props(400, 20));
    TestSubscriber<TraversalEvent> events = coordinator.events().test();

    coordinator.initialize();

    // Mirror the working set from events the way a renderer would.
    Map<Long, Message> mirror = new HashMap<>();
    int consumed = 0;
    MessageCluster previous = null;
    for (int cycle = 0; cycle <= 200; cycle++) {
      if (cycle > 0) coordinator.cycle();
      List<TraversalEvent> values = events.values();
      for (; consumed < values.size(); consumed++) {
        TraversalEvent e = values.get(consumed);
        if (e instanceof TraversalEvent.WorkingSetChanged w) {
          for (Long id : w.change().removedIds()) assertNotNull(mirror.remove(id), "removed " + id);
          for (Message m : w.change().added()) assertTrue(mirror.put(m.id(), m) == null, "dup " + m.id());
        }
      }

      MessageCluster c = coordinator.getCurrentCluster();
      assertEquals(400, mirror.size(), "cycle " + cycle);
      assertEquals(mirror.size(), coordinator.getStats().workingSetSize());

      assertEquals(19, c.related().size());
      Set<Long> ids = new HashSet<>();
      assertTrue(ids.add(c.focusId()));
      for (RelatedMessage r : c.related()) assertTrue(ids.add(r.id()), "duplicate " + r.id());
      assertTrue(mirror.keySet().containsAll(ids));
      assertTrue(mirror.containsKey(c.nextId()));

      if (previous != null) {
        assertEquals(previous.nextId(), c.focusId());
        assertTrue(c.relatedContains(previous.focusId()));
      }
      previous = c;
    }
    assertTrue(pool.stats().recycleCount() >= 2, "history should have wrapped");
    assertEquals(201, coordinator.getStats().totalClustersShown());
  }

  @Test
  void submissionsReachWorkingSetAsPriorityAndAreFeaturedPromptly() {
    store.addMany(1000);
    coordinator = newCoordinator(props(400, 20));
    coordinator.initialize();
    for (int i = 0; i < 3; i++) coordinator.cycle();

    List<Long> submitted = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      Message m = store.add("new grief " + i);
      assertTrue(coordinator.submit(m));
      submitted.add(m.id());
    }
    assertEquals(3, coordinator.getStats().pool().queueDepth());

    TestSubscriber<TraversalEvent> events = coordinator.events().test();
    coordinator.cycle();

    WorkingSetChange change = workingSetChange(events.values().get(0));
    assertTrue(change.added().stream().map(Message::id).toList().containsAll(submitted));
    assertEquals(0, coordinator.getStats().pool().queueDepth());

    Set<Long> featured = new HashSet<>();
    MessageCluster c = coordinator.getCurrentCluster();
    featured.add(c.focusId());
    featured.add(c.nextId());
    for (int i = 0; i < 19 && !featured.containsAll(submitted); i++) {
      c = coordinator.cycle();
      featured.add(c.focusId());
      featured.add(c.nextId());
    }
    assertTrue(featured.containsAll(submitted), "featured " + featured);
    assertEquals(0, coordinator.getStats().priorityMemberCount());
  }

  @Test
  void seededTrickleOfSubmissionsMeetsLatencyBound() {
    store.addMany(1000);
    TraversalProperties props = props(400, 20);
    coordinator = newCoordinator(props);
    coordinator.initialize();

    int bound = (props.workingSetSize() + props.clusterSize() - 1) / props.clusterSize();
    Random rnd = new Random(20240601L);
    Map<Long, Integer> pending = new HashMap<>();

    for (int cycle = 1; cycle <= 300; cycle++) {
      if (rnd.nextInt(10) < 3) {
        Message m = store.add("arrival " + cycle);
        coordinator.submit(m);
        pending.put(m.id(), cycle);
      }
      MessageCluster c = coordinator.cycle();
      pending.remove(c.focusId());
      pending.remove(c.nextId());
      for (Map.Entry<Long, Integer> e : pending.entrySet()) {
        assertTrue(
            cycle - e.getValue() < bound,
            "message " + e.getKey() + " waiting since cycle " + e.getValue() + " at cycle " + cycle);
      }
    }
  }

  @Test
  void timersDriveCyclesAndPollsAndPauseStopsOnlyCycles() {
    store.addMany(50);
    coordinator = newCoordinator(new TraversalProperties(20, 5, 1_000L, 500L, null, null, null));
    coordinator.initialize();
    assertEquals(1, coordinator.getStats().totalClustersShown());

    scheduler.advanceTimeBy(3_000, TimeUnit.MILLISECONDS);
    assertEquals(4, coordinator.getStats().totalClustersShown());

    coordinator.pause();
    assertEquals(TraversalState.PAUSED, coordinator.getState());
    store.add("while paused");
    scheduler.advanceTimeBy(3_000, TimeUnit.MILLISECONDS);
    assertEquals(4, coordinator.getStats().totalClustersShown());
    assertEquals(1, coordinator.getStats().pool().queueDepth());

    coordinator.resume();
    scheduler.advanceTimeBy(1_000, TimeUnit.MILLISECONDS);
    assertEquals(5, coordinator.getStats().totalClustersShown());
    assertEquals(0, coordinator.getStats().pool().queueDepth());
  }

  @Test
  void storeOutageAtStartupDegradesToPlaceholderAndSelfHeals() {
    store.addMany(30);
    store.failWith(new DataAccessResourceFailureException("db down"));
    coordinator =
        newCoordinator(
            props(10, 4),
            new MessagePoolManager(
                new RetryingMessageStore(store, StoreProperties.Retry.defaults(), ms -> {}),
                props(10, 4)));

    coordinator.initialize();
    assertEquals(TraversalState.RUNNING, coordinator.getState());
    assertTrue(coordinator.getCurrentCluster().isPlaceholder());
    assertEquals(0, coordinator.pollOnce());

    store.heal();
    MessageCluster c = coordinator.cycle();

    assertFalse(c.isPlaceholder());
    assertEquals(10, coordinator.getStats().workingSetSize());
    assertEquals(30L, coordinator.getStats().pool().watermark());
  }

  @Test
  void invariantViolationRetriesWithoutContinuityHint() {
    store.addMany(40);
    TraversalProperties props = props(10, 4);
    ClusterSelector selector = spy(new ClusterSelector(props));
    pool = new MessagePoolManager(store, props);
    coordinator = new TraversalCoordinator(props, pool, selector, scheduler, CLOCK);
    coordinator.initialize();
    MessageCluster before = coordinator.getCurrentCluster();

    doThrow(new ClusterInvariantViolation("boom"))
        .when(selector)
        .select(anyCollection(), anySet(), notNull(), anyLong());
    MessageCluster after = coordinator.cycle();

    assertFalse(after.isPlaceholder());
    assertEquals(2, after.totalShown());
    verify(selector, atLeast(2)).select(anyCollection(), anySet(), isNull(), anyLong());
    assertFalse(before == after);
  }

  @Test
  void repeatedViolationKeepsCurrentClusterAndEmitsNothing() {
    store.addMany(40);
    TraversalProperties props = props(10, 4);
    ClusterSelector selector = spy(new ClusterSelector(props));
    pool = new MessagePoolManager(store, props);
    coordinator = new TraversalCoordinator(props, pool, selector, scheduler, CLOCK);
    coordinator.initialize();
    MessageCluster before = coordinator.getCurrentCluster();
    TestSubscriber<TraversalEvent> events = coordinator.events().test();

    doThrow(new ClusterInvariantViolation("boom"))
        .when(selector)
        .select(anyCollection(), anySet(), org.mockito.ArgumentMatchers.any(), anyLong());

    assertSame(before, coordinator.cycle());
    assertTrue(events.values().stream().noneMatch(e -> e instanceof TraversalEvent.ClusterChanged));
  }

  @Test
  void resetTraversalRestartsCounter() {
    store.addMany(100);
    coordinator = newCoordinator(props(20, 5));
    coordinator.initialize();
    coordinator.cycle();
    coordinator.cycle();
    assertEquals(3, coordinator.getStats().totalClustersShown());

    coordinator.resetTraversal();
    assertEquals(0, coordinator.getStats().totalClustersShown());

    assertEquals(1, coordinator.cycle().totalShown());
  }

  @Test
  void stopIsIdempotentAndCompletesEvents() {
    store.addMany(20);
    coordinator = newCoordinator(props(10, 4));
    TestSubscriber<TraversalEvent> events = coordinator.events().test();
    coordinator.initialize();
    MessageCluster last = coordinator.getCurrentCluster();

    coordinator.stop();
    coordinator.stop();

    assertEquals(TraversalState.STOPPED, coordinator.getState());
    events.assertComplete();
    assertSame(last, coordinator.cycle());
    assertFalse(coordinator.submit(store.add("late")));
    assertEquals(0, coordinator.pollOnce());

    int before = events.values().size();
    scheduler.advanceTimeBy(60, TimeUnit.SECONDS);
    assertEquals(before, events.values().size());
  }

  @Test
  void initializeRunsOnce() {
    store.addMany(20);
    coordinator = newCoordinator(props(10, 4));
    TestSubscriber<TraversalEvent> events = coordinator.events().test();

    coordinator.initialize();
    coordinator.initialize();

    events.assertValueCount(2);
  }

  @Test
  void queueWaitEstimateUsesReservationRate() {
    coordinator = newCoordinator(props(400, 20));

    assertEquals(0, coordinator.estimatedQueueWaitMs(0));
    assertEquals(8_000, coordinator.estimatedQueueWaitMs(18));
    assertEquals(24_000, coordinator.estimatedQueueWaitMs(37));
  }

  private TraversalCoordinator newCoordinator(TraversalProperties props) {
    return newCoordinator(props, new MessagePoolManager(store, props));
  }

  private TraversalCoordinator newCoordinator(TraversalProperties props, MessagePoolManager pool) {
    this.pool = pool;
    return new TraversalCoordinator(props, pool, new ClusterSelector(props), scheduler, CLOCK);
  }

  // Long timer periods keep the TestScheduler from firing unless a test advances it.
  private static TraversalProperties props(int workingSetSize, int clusterSize) {
    return new TraversalProperties(workingSetSize, clusterSize, 8_000L, 5_000L, 200, 0L, null);
  }

  private static WorkingSetChange workingSetChange(TraversalEvent e) {
    return assertInstanceOf(TraversalEvent.WorkingSetChanged.class, e).change();
  }

  private static MessageCluster cluster(TraversalEvent e) {
    return assertInstanceOf(TraversalEvent.ClusterChanged.class, e).cluster();
  }
}
