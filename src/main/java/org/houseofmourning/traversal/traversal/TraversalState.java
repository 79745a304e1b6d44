package org.houseofmourning.traversal.traversal;

/**
 * Coordinator lifecycle.
 *
 * <p>{@code UNINITIALIZED -> INITIALIZING -> RUNNING <-> PAUSED -> STOPPED}. Polling continues while
 * paused; only the cycle timer is suppressed. {@code STOPPED} is terminal.
 */
public enum TraversalState {
  UNINITIALIZED,
  INITIALIZING,
  RUNNING,
  PAUSED,
  STOPPED;

  public boolean isActive() {
    return this == RUNNING || this == PAUSED;
  }
}
