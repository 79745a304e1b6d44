package org.houseofmourning.traversal.model;

import java.util.List;
import java.util.Set;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Result of one pool replenishment request.
 *
 * @param messages messages in fill order: priority queue, then fresh above-watermark rows, then
 *     historical filler
 * @param priorityIds ids in {@code messages} that came from the priority path
 */
@ValueObject
public record MessageBatch(List<Message> messages, Set<Long> priorityIds) {

  public MessageBatch {
    messages = messages == null ? List.of() : List.copyOf(messages);
    priorityIds = priorityIds == null ? Set.of() : Set.copyOf(priorityIds);
  }

  public static MessageBatch empty() {
    return new MessageBatch(List.of(), Set.of());
  }

  public int size() {
    return messages.size();
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }
}
