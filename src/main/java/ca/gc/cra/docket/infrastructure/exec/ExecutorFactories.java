package ca.gc.cra.docket.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Factory for the named, fixed-size worker pools used by the export pipeline.
 * <p><strong>Why:</strong> Comment enrichment and the concurrent collection fetch both need a bounded number of
 * threads with recognizable names in thread dumps and log lines.</p>
 * <p><strong>Thread-safety:</strong> Factory methods are thread-safe; callers own and shut down the pools.</p>
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Creates a fixed pool whose surplus tasks wait in an unbounded FIFO queue.
   *
   * @param size number of worker threads; must be positive
   * @param prefix thread name prefix, e.g. {@code docket-enrich}
   * @return executor; callers must shut it down
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  public static ExecutorService newWorkerPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "docket-worker" : prefix;
    UncaughtExceptionHandler handler =
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(handler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory);
  }
}
