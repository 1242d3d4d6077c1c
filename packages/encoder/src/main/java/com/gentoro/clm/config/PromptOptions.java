package com.gentoro.clm.config;

/**
 * Options of the task/configuration prompt encoder.
 *
 * @param inferTypes annotate the inlined output schema with field types
 * @param addAttrs annotate the inlined output schema with enumerated value ranges
 * @param unionStrategies run every intent strategy and union the results instead of stopping at
 *     the first strategy that matches
 * @param minIntentConfidence drop intent candidates below this confidence
 */
public record PromptOptions(
    boolean inferTypes, boolean addAttrs, boolean unionStrategies, double minIntentConfidence) {

  public static PromptOptions defaults() {
    return new PromptOptions(false, true, false, 0.0);
  }

  public PromptOptions withInferTypes(boolean value) {
    return new PromptOptions(value, addAttrs, unionStrategies, minIntentConfidence);
  }

  public PromptOptions withAddAttrs(boolean value) {
    return new PromptOptions(inferTypes, value, unionStrategies, minIntentConfidence);
  }

  public PromptOptions withUnionStrategies(boolean value) {
    return new PromptOptions(inferTypes, addAttrs, value, minIntentConfidence);
  }

  public PromptOptions withMinIntentConfidence(double value) {
    return new PromptOptions(inferTypes, addAttrs, unionStrategies, value);
  }
}
