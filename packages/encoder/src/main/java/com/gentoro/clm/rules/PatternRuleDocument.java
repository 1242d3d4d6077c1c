package com.gentoro.clm.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Rule resource as written in {@code rules/<lang>.yaml}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatternRuleDocument {

  /** One rule entry. Patterns are case-insensitive unless {@code case_sensitive} is set. */
  public record RuleSpec(
      @JsonProperty("pattern") String pattern,
      @JsonProperty("value") String value,
      @JsonProperty("case_sensitive") boolean caseSensitive) {}

  @JsonProperty("language")
  private String language;

  @JsonProperty("numbers")
  private Map<String, Integer> numbers = new LinkedHashMap<>();

  @JsonProperty("rules")
  private Map<String, List<RuleSpec>> rules = new LinkedHashMap<>();

  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }

  public Map<String, Integer> getNumbers() {
    return numbers;
  }

  public void setNumbers(Map<String, Integer> numbers) {
    this.numbers = numbers;
  }

  public Map<String, List<RuleSpec>> getRules() {
    return rules;
  }

  public void setRules(Map<String, List<RuleSpec>> rules) {
    this.rules = rules;
  }
}
