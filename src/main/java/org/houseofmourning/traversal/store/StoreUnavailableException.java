package org.houseofmourning.traversal.store;

/**
 * The message store could not be reached, after retries where the operation allows them.
 *
 * <p>Callers are expected to degrade (skip the poll, accept a short batch) rather than fail.
 */
public class StoreUnavailableException extends RuntimeException {

  private final String operation;
  private final int attempts;

  public StoreUnavailableException(String operation, int attempts, Throwable cause) {
    super("Message store unavailable for " + operation + " after " + attempts + " attempt(s)", cause);
    this.operation = operation;
    this.attempts = attempts;
  }

  public String operation() {
    return operation;
  }

  public int attempts() {
    return attempts;
  }
}
