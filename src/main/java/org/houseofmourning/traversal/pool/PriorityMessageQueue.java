package org.houseofmourning.traversal.pool;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.houseofmourning.traversal.model.Message;

/**
 * Bounded, ascending-by-id queue of newly discovered messages.
 *
 * <p>Duplicate ids are ignored. When the bound is exceeded the lowest ids are dropped first. Not
 * thread-safe; owned by {@link MessagePoolManager}.
 */
public final class PriorityMessageQueue {

  private final int maxSize;
  private final TreeMap<Long, Message> byId = new TreeMap<>();
  private long droppedTotal;

  public PriorityMessageQueue(int maxSize) {
    if (maxSize < 1) throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    this.maxSize = maxSize;
  }

  /**
   * Adds a message and trims the queue back to its bound.
   *
   * @return the messages dropped to make room, lowest id first
   */
  public List<Message> push(Message message) {
    if (message == null) return List.of();
    byId.putIfAbsent(message.id(), message);
    return trim();
  }

  /** Adds all messages, then trims once. */
  public List<Message> pushAll(List<Message> messages) {
    if (messages == null || messages.isEmpty()) return List.of();
    for (Message m : messages) {
      if (m != null) byId.putIfAbsent(m.id(), m);
    }
    return trim();
  }

  /** Removes and returns up to {@code count} messages, lowest id first. */
  public List<Message> drain(int count) {
    if (count <= 0 || byId.isEmpty()) return List.of();
    List<Message> out = new ArrayList<>(Math.min(count, byId.size()));
    while (out.size() < count) {
      Map.Entry<Long, Message> e = byId.pollFirstEntry();
      if (e == null) break;
      out.add(e.getValue());
    }
    return out;
  }

  public int size() {
    return byId.size();
  }

  public boolean isEmpty() {
    return byId.isEmpty();
  }

  public int maxSize() {
    return maxSize;
  }

  public long droppedTotal() {
    return droppedTotal;
  }

  public List<Long> ids() {
    return List.copyOf(byId.keySet());
  }

  public void clear() {
    byId.clear();
  }

  private List<Message> trim() {
    if (byId.size() <= maxSize) return List.of();
    List<Message> dropped = new ArrayList<>(byId.size() - maxSize);
    while (byId.size() > maxSize) {
      dropped.add(byId.pollFirstEntry().getValue());
    }
    droppedTotal += dropped.size();
    return dropped;
  }
}
