package com.gentoro.claimgraph.concurrent;

import com.gentoro.claimgraph.exception.ClaimGraphErrorCode;
import com.gentoro.claimgraph.exception.ClaimGraphException;
import com.gentoro.claimgraph.exception.ExceptionUtil;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fan-out/fan-in of one task per item on a shared executor.
 *
 * <p>At most {@code limit} tasks of a call run at once, gated by a counting semaphore; tasks
 * complete in any order. Both {@link #map} and {@link #forEach} return only after every task has
 * finished, so a stage never overlaps the next one. If any task failed, the first failure in input
 * order is rethrown after the join: {@link ClaimGraphException}s as they are, anything else as an
 * {@link UpstreamException}.
 */
public class BoundedFanOut {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(BoundedFanOut.class);

  private final Executor executor;

  public BoundedFanOut(Executor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /** Apply {@code task} to every item; results keep the input order. */
  public <T, R> List<R> map(String stage, List<T> items, int limit, Function<T, R> task) {
    if (limit < 1) {
      throw new ValidationException("Concurrency limit of %s must be positive".formatted(stage));
    }
    if (items.isEmpty()) {
      return List.of();
    }
    Semaphore permits = new Semaphore(limit, true);
    List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      futures.add(CompletableFuture.supplyAsync(() -> withPermit(permits, item, task), executor));
    }

    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    } catch (CompletionException e) {
      // allOf completes only once every task is done; report the first failure in input order
      for (CompletableFuture<R> f : futures) {
        if (f.isCompletedExceptionally()) {
          throw failure(stage, f);
        }
      }
      throw failureOf(stage, e);
    }

    List<R> results = new ArrayList<>(futures.size());
    for (CompletableFuture<R> f : futures) {
      results.add(f.join());
    }
    log.debug("Stage {} finished {} task(s)", stage, results.size());
    return results;
  }

  public <T> void forEach(String stage, List<T> items, int limit, Consumer<T> task) {
    map(
        stage,
        items,
        limit,
        item -> {
          task.accept(item);
          return Boolean.TRUE;
        });
  }

  private static <T, R> R withPermit(Semaphore permits, T item, Function<T, R> task) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ClaimGraphException(
          ClaimGraphErrorCode.CANCELLED, "Interrupted while waiting for a worker permit", e);
    }
    try {
      return task.apply(item);
    } finally {
      permits.release();
    }
  }

  private static ClaimGraphException failure(String stage, CompletableFuture<?> future) {
    try {
      future.join();
    } catch (CompletionException e) {
      return failureOf(stage, e);
    }
    return new UpstreamException("Stage %s failed".formatted(stage));
  }

  private static ClaimGraphException failureOf(String stage, Throwable t) {
    return ExceptionUtil.rethrowIfUnchecked(
        t, cause -> new UpstreamException("Stage %s failed".formatted(stage), cause));
  }
}
