package io.intellixity.unipage.union;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Execution settings of a union handler.\n
 *
 * - executor: runs per-source count/select calls (default: shared cached daemon pool)\n
 * - timeout: wait bound for the whole request, count and select phases together; null waits indefinitely\n
 * - unknownTotalPolicy: planner behavior for sources without a total\n
 */
public final class UnionOptions {
  private static final AtomicInteger THREADS = new AtomicInteger();
  private static volatile ExecutorService sharedExecutor;

  private final ExecutorService executor;
  private final Duration timeout;
  private final UnknownTotalPolicy unknownTotalPolicy;

  private UnionOptions(Builder b) {
    this.executor = b.executor;
    this.timeout = b.timeout;
    this.unknownTotalPolicy = b.unknownTotalPolicy;
  }

  public static UnionOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ExecutorService executor() {
    return (executor != null) ? executor : shared();
  }

  public Duration timeout() { return timeout; }
  public UnknownTotalPolicy unknownTotalPolicy() { return unknownTotalPolicy; }

  private static ExecutorService shared() {
    ExecutorService e = sharedExecutor;
    if (e == null) {
      synchronized (UnionOptions.class) {
        e = sharedExecutor;
        if (e == null) {
          ThreadFactory tf = r -> {
            Thread t = new Thread(r, "unipage-union-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
          };
          e = Executors.newCachedThreadPool(tf);
          sharedExecutor = e;
        }
      }
    }
    return e;
  }

  @Override
  public String toString() {
    return "UnionOptions{timeout=" + timeout + ", unknownTotalPolicy=" + unknownTotalPolicy
        + ", executor=" + (executor == null ? "shared" : executor.getClass().getSimpleName()) + "}";
  }

  public static final class Builder {
    private ExecutorService executor;
    private Duration timeout;
    private UnknownTotalPolicy unknownTotalPolicy = UnknownTotalPolicy.UNBOUNDED;

    private Builder() {}

    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public Builder timeout(Duration timeout) {
      if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
        throw new IllegalArgumentException("timeout must be positive: " + timeout);
      }
      this.timeout = timeout;
      return this;
    }

    public Builder unknownTotalPolicy(UnknownTotalPolicy policy) {
      this.unknownTotalPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    public UnionOptions build() {
      return new UnionOptions(this);
    }
  }
}
