package com.gentoro.clm.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One {@code [CATEGORY:VALUE:ATTR=VAL]} unit. Values are joined with the token's {@link Join}
 * style; attributes render in insertion order.
 */
public final class ResolvedToken {

  /** How multiple primary values are joined. */
  public enum Join {
    LIST(","),
    CHAIN(">"),
    FLOW("→");

    private final String separator;

    Join(String separator) {
      this.separator = separator;
    }

    public String separator() {
      return separator;
    }
  }

  private final TokenCategory category;
  private final List<String> values;
  private final Join join;
  private final Map<String, String> attributes;

  private ResolvedToken(
      TokenCategory category, List<String> values, Join join, Map<String, String> attributes) {
    this.category = Objects.requireNonNull(category, "category");
    this.values = List.copyOf(values);
    this.join = join;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static Builder builder(TokenCategory category) {
    return new Builder(category);
  }

  public static ResolvedToken of(TokenCategory category, String value) {
    return builder(category).value(value).build();
  }

  public TokenCategory category() {
    return category;
  }

  public List<String> values() {
    return values;
  }

  /** First value, or null for attribute-only tokens such as {@code [CONTACT:EMAIL=..]}. */
  public String primaryValue() {
    return values.isEmpty() ? null : values.get(0);
  }

  public Join join() {
    return join;
  }

  public Map<String, String> attributes() {
    return attributes;
  }

  public String render() {
    StringBuilder sb = new StringBuilder("[").append(category.name());
    if (!values.isEmpty()) {
      sb.append(':').append(String.join(join.separator(), values));
    }
    attributes.forEach((k, v) -> sb.append(':').append(k).append('=').append(v));
    return sb.append(']').toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResolvedToken other)) return false;
    return category == other.category
        && join == other.join
        && values.equals(other.values)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(category, values, join, attributes);
  }

  @Override
  public String toString() {
    return render();
  }

  public static final class Builder {
    private final TokenCategory category;
    private final List<String> values = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private Join join = Join.LIST;

    private Builder(TokenCategory category) {
      this.category = category;
    }

    public Builder value(String value) {
      if (value != null && !value.isBlank() && !values.contains(value)) {
        values.add(value);
      }
      return this;
    }

    public Builder values(List<String> list) {
      if (list != null) list.forEach(this::value);
      return this;
    }

    /** Ordered states joined with {@link Join#FLOW}; repeats are kept. */
    public Builder sequence(List<String> steps) {
      this.join = Join.FLOW;
      if (steps != null) {
        steps.stream().filter(s -> s != null && !s.isBlank()).forEach(values::add);
      }
      return this;
    }

    public Builder join(Join value) {
      this.join = value;
      return this;
    }

    /** Blank values are ignored; a repeated key keeps its first value. */
    public Builder attribute(String key, Object value) {
      if (key != null && value != null && !value.toString().isBlank()) {
        attributes.putIfAbsent(key, value.toString());
      }
      return this;
    }

    public boolean hasValues() {
      return !values.isEmpty();
    }

    public ResolvedToken build() {
      if (values.isEmpty() && attributes.isEmpty()) {
        throw new IllegalStateException(category + " token needs a value or an attribute");
      }
      return new ResolvedToken(category, values, join, attributes);
    }
  }
}
