package com.gentoro.clm.vocabulary;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Locale;

/**
 * Sentence-initial command words that map straight to an action and, optionally, a default target
 * (e.g. {@code list -> LIST over ITEMS}).
 */
public record ImperativeTemplate(
    @JsonProperty("triggers") List<String> triggers,
    @JsonProperty("action") String action,
    @JsonProperty("target") String target) {

  public ImperativeTemplate {
    triggers =
        triggers == null
            ? List.of()
            : triggers.stream().map(t -> t.trim().toLowerCase(Locale.ROOT)).toList();
  }
}
