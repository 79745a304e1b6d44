package org.houseofmourning.traversal.util;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned, named executors. */
public final class EngineThreads {
  private static final Set<ExecutorService> TRACKED_EXECUTORS = ConcurrentHashMap.newKeySet();

  private EngineThreads() {}

  public static ThreadFactory namedFactory(String baseName, boolean daemon) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + seq.getAndIncrement());
      t.setDaemon(daemon);
      return t;
    };
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(
      String baseName, boolean daemon) {
    return track(Executors.newSingleThreadScheduledExecutor(namedFactory(baseName, daemon)));
  }

  public static int shutdownTrackedExecutorsNow() {
    int count = 0;
    for (ExecutorService exec : List.copyOf(TRACKED_EXECUTORS)) {
      if (exec == null) continue;
      if (exec.isShutdown() || exec.isTerminated()) continue;
      exec.shutdownNow();
      count++;
    }
    TRACKED_EXECUTORS.clear();
    return count;
  }

  private static <E extends ExecutorService> E track(E exec) {
    TRACKED_EXECUTORS.removeIf(e -> e == null || e.isShutdown() || e.isTerminated());
    TRACKED_EXECUTORS.add(exec);
    return exec;
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "traversal-thread" : s;
  }
}
