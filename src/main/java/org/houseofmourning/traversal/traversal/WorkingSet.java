package org.houseofmourning.traversal.traversal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.houseofmourning.traversal.model.Message;

/**
 * Fixed-capacity, duplicate-free set of messages eligible for selection, in admission order.
 *
 * <p>Not thread-safe; owned by {@link TraversalCoordinator}.
 */
final class WorkingSet {

  private final int capacity;
  private final Map<Long, Message> members = new LinkedHashMap<>();

  WorkingSet(int capacity) {
    if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
    this.capacity = capacity;
  }

  /** @return false if the id is already present or the set is full */
  boolean add(Message message) {
    if (message == null) return false;
    if (members.size() >= capacity) return false;
    if (members.containsKey(message.id())) return false;
    members.put(message.id(), message);
    return true;
  }

  /** @return ids that were actually present */
  List<Long> removeAll(Collection<Long> ids) {
    List<Long> removed = new ArrayList<>(ids.size());
    for (Long id : ids) {
      if (id != null && members.remove(id) != null) removed.add(id);
    }
    return removed;
  }

  boolean contains(long id) {
    return members.containsKey(id);
  }

  int size() {
    return members.size();
  }

  int capacity() {
    return capacity;
  }

  int deficit() {
    return capacity - members.size();
  }

  List<Message> snapshot() {
    return List.copyOf(members.values());
  }

  void clear() {
    members.clear();
  }
}
