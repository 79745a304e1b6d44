package org.houseofmourning.traversal.store;

import java.util.List;
import org.houseofmourning.traversal.model.Message;

/**
 * Narrow read/write contract over the append-only message table.
 *
 * <p>Every read returns only qualifying rows: {@code approved = true} and not soft-deleted.
 */
public interface MessageStore {

  /**
   * Up to {@code limit} qualifying messages with {@code id <= fromId} and {@code id <= ceilingId},
   * newest first.
   */
  List<Message> rangeBackward(long fromId, int limit, long ceilingId);

  /** All qualifying messages with {@code id > watermarkId}, oldest first. */
  List<Message> above(long watermarkId);

  /** Highest qualifying id, or {@code 0} when there is none. */
  long maxId();

  /** Number of qualifying messages. */
  long countVisible();

  /** Appends a new message. Used only by submission intake. */
  Message insert(String content, boolean approved);
}
