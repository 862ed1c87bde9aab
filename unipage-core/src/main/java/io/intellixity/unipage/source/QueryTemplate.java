package io.intellixity.unipage.source;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dynamic query shape: {@code __name__} placeholders replaced by identifiers taken from filters.
 * <p>
 * Every substituted value is validated by {@link SqlIdentifiers}; anything else fails with
 * {@link ErrorKind#INVALID_FILTER} before the query reaches an engine.
 *
 * <pre>
 * QueryText&lt;TableFilter&gt; q = QueryTemplate.&lt;TableFilter&gt;of("SELECT * FROM __table__ LIMIT ? OFFSET ?")
 *     .identifier("table", TableFilter::table)
 *     .build();
 * </pre>
 */
public final class QueryTemplate<F> {
  private final String template;
  private final Map<String, Function<? super F, ?>> identifiers = new LinkedHashMap<>();

  private QueryTemplate(String template) {
    this.template = template;
  }

  public static <F> QueryTemplate<F> of(String template) {
    Objects.requireNonNull(template, "template");
    if (template.isBlank()) throw new IllegalArgumentException("template is blank");
    return new QueryTemplate<>(template);
  }

  public QueryTemplate<F> identifier(String name, Function<? super F, ?> value) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    if (!template.contains(token(name))) {
      throw new IllegalArgumentException("Template has no placeholder " + token(name));
    }
    identifiers.put(name, value);
    return this;
  }

  /** Placeholders are replaced in one pass; substituted text is never scanned again. */
  public QueryText<F> build() {
    Map<String, Function<? super F, ?>> frozen = Collections.unmodifiableMap(new LinkedHashMap<>(identifiers));
    String text = template;
    Pattern tokens = tokenPattern(frozen.keySet());
    return filters -> {
      if (filters == null && !frozen.isEmpty()) {
        throw new QueryException(ErrorKind.INVALID_FILTER, "Filters are required to render this query");
      }
      if (tokens == null) return text;
      Map<String, String> resolved = new LinkedHashMap<>();
      for (var e : frozen.entrySet()) {
        resolved.put(e.getKey(), SqlIdentifiers.require(e.getKey(), e.getValue().apply(filters)));
      }
      Matcher m = tokens.matcher(text);
      StringBuilder out = new StringBuilder(text.length());
      while (m.find()) m.appendReplacement(out, Matcher.quoteReplacement(resolved.get(m.group(1))));
      m.appendTail(out);
      return out.toString();
    };
  }

  private static Pattern tokenPattern(Iterable<String> names) {
    StringJoiner alternatives = new StringJoiner("|");
    for (String name : names) alternatives.add(Pattern.quote(name));
    if (alternatives.length() == 0) return null;
    return Pattern.compile("__(" + alternatives + ")__");
  }

  private static String token(String name) {
    return "__" + name + "__";
  }
}
