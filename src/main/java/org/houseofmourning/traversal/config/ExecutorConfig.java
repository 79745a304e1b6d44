package org.houseofmourning.traversal.config;

import java.util.concurrent.ScheduledExecutorService;
import org.houseofmourning.traversal.util.EngineThreads;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>The engine scheduler is a single non-daemon thread: it serializes every timer callback and
 * keeps the headless process alive.
 */
@Configuration
public class ExecutorConfig {
  public static final String TRAVERSAL_ENGINE_SCHEDULER = "traversalEngineScheduler";
  public static final String TRAVERSAL_STATS_SCHEDULER = "traversalStatsScheduler";

  @Bean(name = TRAVERSAL_ENGINE_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService traversalEngineScheduler() {
    return EngineThreads.newSingleThreadScheduledExecutor("traversal-engine", false);
  }

  @Bean(name = TRAVERSAL_STATS_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService traversalStatsScheduler() {
    return EngineThreads.newSingleThreadScheduledExecutor("traversal-stats", true);
  }
}
