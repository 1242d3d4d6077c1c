package com.gentoro.clm.rules;

/**
 * Categories of pattern rules. Categories with a context key render as {@code [CTX:KEY=VALUE]};
 * {@link #ORDERING} templates carry their own key ({@code LIMIT=$1}) and attach to the action.
 */
public enum RuleCategory {
  DURATION("DURATION", false),
  TONE("TONE", true),
  STYLE("STYLE", true),
  AUDIENCE("AUDIENCE", true),
  LENGTH("LENGTH", true),
  COMPARISON("COMPARE", true),
  EXPLANATION("EXPLAIN", true),
  THRESHOLD("THRESHOLD", false),
  ORDERING(null, true),
  ROLE_CLAUSE(null, true),
  CONDITIONAL_CLAUSE(null, true),
  CATALOG(null, true),
  OUTPUT_ITEM(null, true),
  EMPTY_ON_NO_MATCH(null, true),
  SCHEMA_FIELDS(null, false),
  CONFIGURATION_CUE(null, true),
  ROLE(null, true),
  BASIC_RULES(null, true),
  CUSTOM_RULES(null, true),
  PRIORITY(null, true),
  META_INSTRUCTION(null, true),
  KEEP_CUE(null, true),
  TIMELINE(null, false);

  private final String contextKey;
  private final boolean normalizeCase;

  RuleCategory(String contextKey, boolean normalizeCase) {
    this.contextKey = contextKey;
    this.normalizeCase = normalizeCase;
  }

  /** Attribute key of the CTX token produced by this category, or null. */
  public String contextKey() {
    return contextKey;
  }

  /** Whether captured groups are upper-cased with spaces turned into underscores. */
  public boolean normalizeCase() {
    return normalizeCase;
  }
}
