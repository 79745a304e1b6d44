package org.houseofmourning.traversal.store;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.houseofmourning.traversal.config.StoreProperties;
import org.houseofmourning.traversal.model.Message;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Retrying gateway in front of a {@link MessageStore}.
 *
 * <p>Reads retry transient data-access failures with capped exponential backoff and raise {@link
 * StoreUnavailableException} once the budget is spent. Non-transient failures are not retried.
 * Inserts are never retried because they are not idempotent.
 */
@InfrastructureLayer
public class RetryingMessageStore implements MessageStore {
  private static final Logger log = LoggerFactory.getLogger(RetryingMessageStore.class);

  /** Blocks the calling thread between attempts. Replaceable in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final MessageStore delegate;
  private final StoreProperties.Retry policy;
  private final Sleeper sleeper;

  public RetryingMessageStore(MessageStore delegate, StoreProperties.Retry policy) {
    this(delegate, policy, Thread::sleep);
  }

  public RetryingMessageStore(MessageStore delegate, StoreProperties.Retry policy, Sleeper sleeper) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.policy = Objects.requireNonNullElseGet(policy, StoreProperties.Retry::defaults);
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public List<Message> rangeBackward(long fromId, int limit, long ceilingId) {
    return read("rangeBackward", () -> delegate.rangeBackward(fromId, limit, ceilingId));
  }

  @Override
  public List<Message> above(long watermarkId) {
    return read("above", () -> delegate.above(watermarkId));
  }

  @Override
  public long maxId() {
    return read("maxId", delegate::maxId);
  }

  @Override
  public long countVisible() {
    return read("countVisible", delegate::countVisible);
  }

  @Override
  public Message insert(String content, boolean approved) {
    try {
      return delegate.insert(content, approved);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("insert", 1, e);
    }
  }

  private <T> T read(String operation, Supplier<T> call) {
    int maxAttempts = policy.maxAttempts();
    for (int attempt = 1; ; attempt++) {
      try {
        return call.get();
      } catch (DataAccessException e) {
        if (!isTransient(e)) {
          log.warn("[traversal] Store {} failed with a non-transient error", operation, e);
          throw new StoreUnavailableException(operation, attempt, e);
        }
        if (attempt >= maxAttempts) {
          log.warn("[traversal] Store {} still failing after {} attempts", operation, attempt, e);
          throw new StoreUnavailableException(operation, attempt, e);
        }

        long delayMs = policy.delayAfterAttempt(attempt);
        log.debug(
            "[traversal] Store {} attempt {} failed ({}); retrying in {}ms",
            operation,
            attempt,
            e.getMessage(),
            delayMs);
        try {
          sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new StoreUnavailableException(operation, attempt, e);
        }
      }
    }
  }

  static boolean isTransient(DataAccessException e) {
    return e instanceof TransientDataAccessException
        || e instanceof RecoverableDataAccessException
        || e instanceof DataAccessResourceFailureException;
  }
}
