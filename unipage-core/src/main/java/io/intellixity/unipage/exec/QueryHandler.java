package io.intellixity.unipage.exec;

import java.util.Map;

/** A composed step of the pipeline: the terminal, or an interceptor wrapped around the rest of the chain. */
@FunctionalInterface
public interface QueryHandler {
  Result<Map<String, Object>> handle(QueryContext context);
}
