package org.houseofmourning.traversal.util;

import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/** Fallback shutdown hook for executors created via {@link EngineThreads}. */
@Component
@Lazy(false)
final class EngineThreadsLifecycle {

  @PreDestroy
  void shutdown() {
    EngineThreads.shutdownTrackedExecutorsNow();
  }
}
