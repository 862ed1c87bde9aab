package io.intellixity.unipage.union;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs independent calls on an executor and waits for all of them.\n
 *
 * Results come back in submission order. The first failure cancels the rest and is rethrown alone.
 */
final class FanOut {
  private FanOut() {}

  static <R> List<R> all(ExecutorService executor, List<Callable<R>> calls, Duration timeout, String phase) {
    if (calls.isEmpty()) return List.of();
    if (calls.size() == 1 && timeout == null) {
      return Collections.singletonList(callInline(calls.get(0)));
    }

    ExecutorCompletionService<R> ecs = new ExecutorCompletionService<>(executor);
    List<Future<R>> futures = new ArrayList<>(calls.size());
    try {
      for (Callable<R> c : calls) futures.add(ecs.submit(c));
    } catch (RejectedExecutionException e) {
      cancelAll(futures);
      throw new QueryException(ErrorKind.ENGINE_CONNECTIVITY, "Union " + phase + " could not be scheduled", e);
    }

    long deadline = (timeout == null) ? 0 : System.nanoTime() + timeout.toNanos();
    try {
      for (int done = 0; done < futures.size(); done++) {
        Future<R> f;
        if (timeout == null) {
          f = ecs.take();
        } else {
          long left = deadline - System.nanoTime();
          f = (left <= 0) ? null : ecs.poll(left, TimeUnit.NANOSECONDS);
          if (f == null) {
            throw new QueryException(ErrorKind.ENGINE_CONNECTIVITY, "Union " + phase + " timed out after " + timeout);
          }
        }
        f.get();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelAll(futures);
      throw new QueryException(ErrorKind.CANCELLED, "Union " + phase + " interrupted", e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      throw unwrap(e.getCause());
    } catch (RuntimeException e) {
      cancelAll(futures);
      throw e;
    }

    List<R> out = new ArrayList<>(futures.size());
    for (Future<R> f : futures) out.add(getDone(f));
    return out;
  }

  private static <R> R callInline(Callable<R> call) {
    try {
      return call.call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw unwrap(e);
    }
  }

  private static <R> R getDone(Future<R> f) {
    try {
      return f.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryException(ErrorKind.CANCELLED, "Interrupted", e);
    } catch (ExecutionException e) {
      throw unwrap(e.getCause());
    } catch (CancellationException e) {
      throw new QueryException(ErrorKind.CANCELLED, "Cancelled", e);
    }
  }

  private static RuntimeException unwrap(Throwable cause) {
    if (cause instanceof RuntimeException) return (RuntimeException) cause;
    if (cause instanceof Error) throw (Error) cause;
    return new QueryException(ErrorKind.QUERY_EXECUTION, String.valueOf(cause), cause);
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> f : futures) f.cancel(true);
  }
}
