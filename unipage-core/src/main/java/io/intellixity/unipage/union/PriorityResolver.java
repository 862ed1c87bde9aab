package io.intellixity.unipage.union;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Effective source order for one union request.\n
 *
 * Override format: comma-separated source ids. Blank entries are ignored, repeats collapse to the first
 * occurrence, and registered sources the override does not mention follow in registration order.
 */
public final class PriorityResolver {
  private PriorityResolver() {}

  public static List<String> resolve(List<String> defaultPriority, List<String> registrationOrder, String override) {
    Objects.requireNonNull(defaultPriority, "defaultPriority");
    Objects.requireNonNull(registrationOrder, "registrationOrder");
    if (override == null || override.isBlank()) return List.copyOf(defaultPriority);

    Set<String> ordered = new LinkedHashSet<>();
    for (String raw : override.split(",")) {
      String id = raw.trim();
      if (id.isEmpty()) continue;
      if (!registrationOrder.contains(id)) {
        throw new QueryException(ErrorKind.UNKNOWN_PRIORITY_SOURCE,
            "Unknown source '" + id + "' in priority override; known sources: " + registrationOrder);
      }
      ordered.add(id);
    }
    ordered.addAll(registrationOrder);
    return List.copyOf(new ArrayList<>(ordered));
  }
}
