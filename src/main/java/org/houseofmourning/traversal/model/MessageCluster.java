package org.houseofmourning.traversal.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * The group of messages foregrounded for one cycle.
 *
 * <p>A cluster with a {@code null} focus is the placeholder emitted while the store holds no
 * displayable messages. For a single-message working set {@code next} equals {@code focus}.
 */
@ValueObject
public record MessageCluster(
    Message focus,
    List<RelatedMessage> related,
    Message next,
    long durationMs,
    long totalShown,
    Instant createdAt) {

  public MessageCluster {
    related = related == null ? List.of() : List.copyOf(related);
    createdAt = Objects.requireNonNullElseGet(createdAt, Instant::now);
  }

  public static MessageCluster placeholder(long durationMs, long totalShown, Instant createdAt) {
    return new MessageCluster(null, List.of(), null, durationMs, totalShown, createdAt);
  }

  public boolean isPlaceholder() {
    return focus == null;
  }

  public Long focusId() {
    return focus == null ? null : focus.id();
  }

  public Long nextId() {
    return next == null ? null : next.id();
  }

  public List<Long> relatedIds() {
    return related.stream().map(RelatedMessage::id).toList();
  }

  public boolean relatedContains(long id) {
    for (RelatedMessage r : related) {
      if (r.id() == id) return true;
    }
    return false;
  }

  public MessageCluster withTotalShown(long total) {
    return new MessageCluster(focus, related, next, durationMs, total, createdAt);
  }
}
