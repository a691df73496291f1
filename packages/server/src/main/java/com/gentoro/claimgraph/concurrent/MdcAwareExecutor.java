package com.gentoro.claimgraph.concurrent;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.MDC;

/**
 * Fixed worker pool that carries the submitting thread's MDC (notably the build id) into each
 * task.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(MdcAwareExecutor.class);

  private final ExecutorService delegate;

  public MdcAwareExecutor(int threads) {
    this.delegate = Executors.newFixedThreadPool(Math.max(1, threads), new WorkerFactory());
  }

  @Override
  public void execute(Runnable command) {
    Map<String, String> parentMdc = MDC.getCopyOfContextMap();

    delegate.execute(
        () -> {
          if (parentMdc != null) {
            MDC.setContextMap(parentMdc);
          }
          try {
            command.run();
          } finally {
            MDC.clear();
          }
        });
  }

  @Override
  public void close() {
    delegate.shutdown();
    try {
      if (!delegate.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Worker pool did not terminate in time; forcing shutdown");
        delegate.shutdownNow();
      }
    } catch (InterruptedException e) {
      delegate.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class WorkerFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "claimgraph-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
