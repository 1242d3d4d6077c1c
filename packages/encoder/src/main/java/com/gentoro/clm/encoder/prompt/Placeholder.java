package com.gentoro.clm.encoder.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A runtime placeholder inside prompt text.
 *
 * <p>Simple: {@code {{customer_name}}}. With default: {@code {{tone|friendly}}}.
 */
public sealed interface Placeholder {

  /** The marker exactly as written, braces included. */
  String raw();

  String name();

  static Placeholder parse(String raw, String inner) {
    int bar = inner.indexOf('|');
    if (bar < 0) {
      return new Simple(raw, inner.trim());
    }
    return new WithDefault(raw, inner.substring(0, bar).trim(), inner.substring(bar + 1).trim());
  }

  record Simple(@JsonProperty("raw") String raw, @JsonProperty("name") String name)
      implements Placeholder {}

  record WithDefault(
      @JsonProperty("raw") String raw,
      @JsonProperty("name") String name,
      @JsonProperty("default") String defaultValue)
      implements Placeholder {}
}
