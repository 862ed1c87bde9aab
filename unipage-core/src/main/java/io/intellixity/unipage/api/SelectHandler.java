package io.intellixity.unipage.api;

import io.intellixity.unipage.context.ContextualProvider;
import io.intellixity.unipage.context.ContextualValues;
import io.intellixity.unipage.exec.Result;
import io.intellixity.unipage.exec.SingleSourceExecutor;

import java.util.List;
import java.util.Objects;

/** Registered single-source endpoint. Thread-safe; build once, call per request. */
public final class SelectHandler<F, T> {
  private final SingleSourceExecutor<F, T> executor;
  private final List<ContextualProvider> contextualProviders;

  SelectHandler(SingleSourceExecutor<F, T> executor, List<ContextualProvider> contextualProviders) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.contextualProviders = ContextualProvider.copyOf(contextualProviders);
  }

  public String sourceId() {
    return executor.source().id();
  }

  public List<ContextualProvider> contextualProviders() {
    return contextualProviders;
  }

  /** Run the declared providers against a transport request. */
  public ContextualValues resolveContext(Object request) {
    return ContextualProvider.resolveAll(contextualProviders, request);
  }

  public Result<T> handle(F filters, int limit, int offset) {
    return handle(filters, limit, offset, ContextualValues.empty());
  }

  public Result<T> handle(F filters, int limit, int offset, ContextualValues values) {
    return executor.execute(filters, limit, offset, values);
  }
}
