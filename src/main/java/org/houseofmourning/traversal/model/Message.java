package org.houseofmourning.traversal.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A single grief message as read from the append-only store.
 *
 * <p>{@code id} is the sole ordering key. Instances are immutable once admitted; the engine never
 * mutates or deletes them.
 */
@ValueObject
public record Message(long id, String content, Instant createdAt, boolean approved, Instant deletedAt) {

  public Message {
    content = Objects.requireNonNull(content, "content");
    createdAt = Objects.requireNonNull(createdAt, "createdAt");
  }

  /** Convenience for an approved, non-deleted message. */
  public static Message visible(long id, String content, Instant createdAt) {
    return new Message(id, content, createdAt, true, null);
  }

  /** True when the message may be shown: approved and not soft-deleted. */
  public boolean isVisible() {
    return approved && deletedAt == null;
  }

  public int length() {
    return content.length();
  }
}
