package io.intellixity.unipage.source;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.mapping.Json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parameter functions built from filter property names.\n
 *
 * Filters are read through Jackson, so records, beans and maps are all accepted. A name that the filter
 * object does not expose fails with {@link ErrorKind#INVALID_FILTER}.
 */
public final class QueryParams {
  private static final ObjectMapper JSON = Json.mapper();
  private static final Map<Class<?>, List<BeanPropertyDefinition>> PROPERTIES = new ConcurrentHashMap<>();

  private QueryParams() {}

  /** Values of the named filter properties, in the given order (names may repeat). */
  public static <F> FilterParams<F> fields(String... names) {
    List<String> fields = List.of(names);
    return filters -> values(filters, fields);
  }

  /** Named filter values followed by {@code limit, offset}. */
  public static <F> SelectParams<F> fieldsThenPage(String... names) {
    List<String> fields = List.of(names);
    return (filters, limit, offset) -> {
      List<Object> out = values(filters, fields);
      out.add(limit);
      out.add(offset);
      return out;
    };
  }

  /** Just {@code limit, offset}. */
  public static <F> SelectParams<F> page() {
    return (filters, limit, offset) -> List.of(limit, offset);
  }

  /**
   * Read filter properties as a map (property name to raw value).\n
   *
   * Values are read through the accessors Jackson discovers (record components, getters, public fields)
   * and keep their Java types, so they bind as the engine expects.
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asMap(Object filters) {
    if (filters == null) return Map.of();
    if (filters instanceof Map<?, ?> m) return (Map<String, Object>) m;
    List<BeanPropertyDefinition> props = PROPERTIES.computeIfAbsent(filters.getClass(), QueryParams::introspect);
    Map<String, Object> out = new LinkedHashMap<>();
    for (BeanPropertyDefinition p : props) {
      AnnotatedMember accessor = p.getAccessor();
      try {
        out.put(p.getName(), accessor.getValue(filters));
      } catch (IllegalArgumentException e) {
        throw new QueryException(ErrorKind.INVALID_FILTER, "Filter property '" + p.getName() + "' cannot be read", e);
      }
    }
    return out;
  }

  private static List<BeanPropertyDefinition> introspect(Class<?> type) {
    BeanDescription desc = JSON.getSerializationConfig().introspect(JSON.constructType(type));
    List<BeanPropertyDefinition> out = new ArrayList<>();
    for (BeanPropertyDefinition p : desc.findProperties()) {
      AnnotatedMember accessor = p.getAccessor();
      if (accessor == null) continue;
      accessor.fixAccess(true);
      out.add(p);
    }
    return List.copyOf(out);
  }

  private static List<Object> values(Object filters, List<String> fields) {
    Map<String, Object> props = asMap(filters);
    List<Object> out = new ArrayList<>(fields.size() + 2);
    for (String f : fields) {
      Objects.requireNonNull(f, "field");
      if (!props.containsKey(f)) {
        throw new QueryException(ErrorKind.INVALID_FILTER, "Unknown filter field: " + f);
      }
      out.add(props.get(f));
    }
    return out;
  }
}
