package com.gentoro.clm.encoder.prompt;

import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.output.EncoderOutput;
import com.gentoro.clm.resolve.RuleEvaluator;
import com.gentoro.clm.resolve.intent.IntentResolver;
import com.gentoro.clm.rules.RuleCategory;

/**
 * Entry point for task and configuration prompts. Configuration mode is chosen when a
 * configuration cue appears near the start of the text or when the text carries {@code {{...}}}
 * placeholders; everything else is a task.
 */
public final class PromptEncoder {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(PromptEncoder.class);

  public enum Mode {
    TASK,
    CONFIGURATION
  }

  static final int CUE_WINDOW = 300;

  private final TaskPromptEncoder task;
  private final ConfigurationPromptEncoder configuration;

  public PromptEncoder() {
    this(IntentResolver.standard());
  }

  public PromptEncoder(IntentResolver intents) {
    this.task = new TaskPromptEncoder(intents);
    this.configuration = new ConfigurationPromptEncoder();
  }

  public EncoderOutput encode(String text, EncodingContext context) {
    RuleEvaluator rules = new RuleEvaluator(context);
    Mode mode = detectMode(text, rules);
    log.debug("Prompt mode {}", mode);
    return mode == Mode.CONFIGURATION
        ? configuration.encode(text, context, rules)
        : task.encode(text, context, rules);
  }

  static Mode detectMode(String text, RuleEvaluator rules) {
    if (PromptTemplate.hasPlaceholders(text)) {
      return Mode.CONFIGURATION;
    }
    String head = text.length() > CUE_WINDOW ? text.substring(0, CUE_WINDOW) : text;
    return rules.matches(RuleCategory.CONFIGURATION_CUE, head) ? Mode.CONFIGURATION : Mode.TASK;
  }
}
