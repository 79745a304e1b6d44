package org.houseofmourning.traversal.pool;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongPredicate;
import org.houseofmourning.traversal.config.TraversalProperties;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.model.MessageBatch;
import org.houseofmourning.traversal.model.PoolStats;
import org.houseofmourning.traversal.store.MessageStore;
import org.houseofmourning.traversal.store.StoreUnavailableException;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dual-cursor message pool.
 *
 * <p>Two independent cursors decouple showing old messages from showing new ones:
 *
 * <ul>
 *   <li>the historical cursor walks backwards from the newest known id and recycles to the top
 *       once it runs past the oldest row
 *   <li>the watermark is the highest id ever observed; anything above it is new and goes through
 *       the priority path
 * </ul>
 *
 * <p>Batches drain the priority path completely before any historical filler is read. Not
 * thread-safe: every call must come from the traversal coordinator under its engine lock.
 */
@Component
@ApplicationLayer
public class MessagePoolManager {
  private static final Logger log = LoggerFactory.getLogger(MessagePoolManager.class);

  private final MessageStore store;
  private final PriorityMessageQueue queue;

  private Long historicalCursor;
  private long watermark;
  private long recycleCount;
  private boolean initialized;

  public MessagePoolManager(MessageStore store, TraversalProperties props) {
    this.store = Objects.requireNonNull(store, "store");
    TraversalProperties p = Objects.requireNonNullElseGet(props, TraversalProperties::defaults);
    this.queue = new PriorityMessageQueue(p.priorityQueueMaxSize());
  }

  /**
   * Points both cursors at the newest qualifying id.
   *
   * @throws StoreUnavailableException if the store cannot be read
   */
  public void initialize() {
    long maxId = store.maxId();
    watermark = maxId;
    historicalCursor = maxId > 0 ? maxId : null;
    initialized = true;
    if (maxId == 0) {
      log.info("[traversal] Pool initialized against an empty store");
    } else {
      log.info("[traversal] Pool initialized (historicalCursor={}, watermark={})", maxId, maxId);
    }
  }

  public boolean isInitialized() {
    return initialized;
  }

  /**
   * Produces up to {@code count} messages.
   *
   * <p>Fill order, each stage only running while a deficit remains:
   *
   * <ol>
   *   <li>drain the priority queue, lowest id first
   *   <li>read above the watermark; consume what fits, queue the remainder, advance the watermark
   *       to the highest id seen
   *   <li>read historical filler below the watermark, recycling the cursor at most once
   * </ol>
   *
   * <p>Returns fewer than {@code count} only when the store cannot supply more distinct messages.
   * A store outage during stage 2 or 3 shortens the batch instead of failing it.
   */
  public MessageBatch nextBatch(int count) {
    return nextBatch(count, id -> false);
  }

  /**
   * Like {@link #nextBatch(int)}, skipping every id {@code held} accepts.
   *
   * <p>Held messages do not count towards {@code count}; the historical stage keeps paging past
   * them for at most one full pass over the store.
   */
  public MessageBatch nextBatch(int count, LongPredicate held) {
    if (count <= 0) return MessageBatch.empty();
    Objects.requireNonNull(held, "held");

    LinkedHashSet<Long> seen = new LinkedHashSet<>();
    List<Message> out = new ArrayList<>(count);
    Set<Long> priorityIds = new HashSet<>();

    // Stage 1: queued priority messages.
    for (Message m : queue.drain(count)) {
      if (held.test(m.id())) continue;
      if (seen.add(m.id())) {
        out.add(m);
        priorityIds.add(m.id());
      }
    }

    // Stage 2: anything that arrived since the last poll.
    if (out.size() < count) {
      try {
        List<Message> fresh = store.above(watermark);
        List<Message> remainder = new ArrayList<>();
        for (Message m : fresh) {
          if (m.id() > watermark) watermark = m.id();
          if (held.test(m.id())) continue;
          if (out.size() < count && seen.add(m.id())) {
            out.add(m);
            priorityIds.add(m.id());
          } else if (!seen.contains(m.id())) {
            remainder.add(m);
          }
        }
        logDropped(queue.pushAll(remainder));
        if (!fresh.isEmpty()) {
          log.debug(
              "[traversal] Found {} new message(s) while filling (watermark={})",
              fresh.size(),
              watermark);
        }
      } catch (StoreUnavailableException e) {
        log.warn("[traversal] New-message read failed; continuing with historical filler", e);
      }
    }

    // Stage 3: historical filler.
    if (out.size() < count) {
      try {
        fillHistorical(count, out, seen, held);
      } catch (StoreUnavailableException e) {
        log.warn(
            "[traversal] Historical read failed; returning a short batch ({}/{})",
            out.size(),
            count,
            e);
      }
    }

    log.debug(
        "[traversal] Batch of {}/{} ({} priority, queue={}, cursor={}, watermark={})",
        out.size(),
        count,
        priorityIds.size(),
        queue.size(),
        historicalCursor,
        watermark);
    return new MessageBatch(out, priorityIds);
  }

  /**
   * Fast path for a message the intake just wrote.
   *
   * <p>Messages at or below the watermark are already covered by the historical scan and are
   * ignored.
   *
   * @return true if the message was queued
   */
  public boolean markNewSubmission(Message message) {
    if (message == null) return false;
    if (message.id() <= watermark) {
      log.debug(
          "[traversal] Submission {} is at or below watermark {}; leaving it to the historical scan",
          message.id(),
          watermark);
      return false;
    }
    logDropped(queue.push(message));
    watermark = message.id();
    log.debug("[traversal] Queued submission {} (queue={})", message.id(), queue.size());
    return true;
  }

  /**
   * Folds messages above the watermark into the priority queue without producing a batch.
   *
   * @return number of new messages discovered
   * @throws StoreUnavailableException if the store cannot be read
   */
  public int pollAboveWatermark() {
    List<Message> fresh = store.above(watermark);
    if (fresh.isEmpty()) return 0;

    for (Message m : fresh) {
      if (m.id() > watermark) watermark = m.id();
    }
    logDropped(queue.pushAll(fresh));
    log.info(
        "[traversal] Poll found {} new message(s) (watermark={}, queue={})",
        fresh.size(),
        watermark,
        queue.size());
    return fresh.size();
  }

  public PoolStats stats() {
    return new PoolStats(
        historicalCursor, watermark, queue.size(), queue.maxSize(), queue.droppedTotal(), recycleCount);
  }

  public int queueDepth() {
    return queue.size();
  }

  /** Releases queued messages. Cursors are kept so a later restart resumes where it left off. */
  public void clear() {
    queue.clear();
  }

  private void fillHistorical(int count, List<Message> out, Set<Long> seen, LongPredicate held) {
    boolean recycled = false;
    if (historicalCursor == null) {
      if (!recycle()) return;
      recycled = true;
    }
    // After a wrap only rows above the starting cursor are still unvisited in this pass.
    long passEnd = recycled ? 0 : historicalCursor;

    while (out.size() < count) {
      int deficit = count - out.size();
      List<Message> page = store.rangeBackward(historicalCursor, deficit, watermark);

      for (Message m : page) {
        if (recycled && m.id() <= passEnd) return;
        if (!held.test(m.id()) && seen.add(m.id())) out.add(m);
        historicalCursor = m.id() - 1;
      }

      // A full page means older rows may remain below the cursor.
      if (page.size() >= deficit) continue;

      // Ran past the oldest row: wrap around at most once per batch.
      if (recycled) return;
      if (!recycle()) return;
      recycled = true;
    }
  }

  private boolean recycle() {
    long maxId = store.maxId();
    if (maxId == 0) {
      historicalCursor = null;
      log.debug("[traversal] Historical scan has nothing to read (store empty)");
      return false;
    }
    historicalCursor = maxId;
    recycleCount++;
    log.info("[traversal] Historical cursor exhausted; recycling from {}", historicalCursor);
    return true;
  }

  private void logDropped(List<Message> dropped) {
    if (dropped.isEmpty()) return;
    log.warn(
        "[traversal] Priority queue overflow: dropped {} oldest message(s) (ids {}..{})",
        dropped.size(),
        dropped.get(0).id(),
        dropped.get(dropped.size() - 1).id());
  }
}
