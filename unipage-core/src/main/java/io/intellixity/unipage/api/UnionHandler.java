package io.intellixity.unipage.api;

import io.intellixity.unipage.context.ContextualProvider;
import io.intellixity.unipage.context.ContextualValues;
import io.intellixity.unipage.exec.Result;
import io.intellixity.unipage.union.UnionPaginationCoordinator;

import java.util.List;
import java.util.Objects;

/** Registered union endpoint over several sources. Thread-safe. */
public final class UnionHandler<F, T> {
  private final UnionPaginationCoordinator<F, T> coordinator;
  private final List<ContextualProvider> contextualProviders;

  UnionHandler(UnionPaginationCoordinator<F, T> coordinator, List<ContextualProvider> contextualProviders) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.contextualProviders = ContextualProvider.copyOf(contextualProviders);
  }

  public List<String> defaultPriority() {
    return coordinator.defaultPriority();
  }

  public List<ContextualProvider> contextualProviders() {
    return contextualProviders;
  }

  public ContextualValues resolveContext(Object request) {
    return ContextualProvider.resolveAll(contextualProviders, request);
  }

  public Result<T> handle(F filters, int limit, int offset) {
    return handle(filters, limit, offset, null, ContextualValues.empty());
  }

  /**
   * @param priorityOverride comma-separated source ids consulted first, or null for the default order
   */
  public Result<T> handle(F filters, int limit, int offset, String priorityOverride, ContextualValues values) {
    return coordinator.handle(filters, limit, offset, priorityOverride, values);
  }
}
