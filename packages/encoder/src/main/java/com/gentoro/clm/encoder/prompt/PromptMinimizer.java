package com.gentoro.clm.encoder.prompt;

import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.nlp.LinguisticAnalyzer;
import com.gentoro.clm.nlp.Sentence;
import com.gentoro.clm.resolve.RuleEvaluator;
import com.gentoro.clm.resolve.RuleMatch;
import com.gentoro.clm.rules.RuleCategory;
import com.gentoro.clm.utility.TextUtility;
import com.gentoro.clm.vocabulary.Vocabulary;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips configuration-prompt sentences whose meaning is already carried by a token: rule
 * priority meta instructions, role restatements and output-format restatements. XML-like blocks
 * are kept verbatim; sentences carrying a restriction or a placeholder are always kept.
 */
final class PromptMinimizer {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(PromptMinimizer.class);

  private static final Pattern XML_BLOCK = Pattern.compile("(?s)<([A-Za-z_][\\w-]*)>.*?</\\1>");
  private static final int MIN_EXTRA_WORDS = 3;
  private static final int MAX_FORMAT_SENTENCE_WORDS = 12;

  private final Vocabulary vocabulary;
  private final LinguisticAnalyzer analyzer;
  private final RuleEvaluator rules;

  PromptMinimizer(Vocabulary vocabulary, LinguisticAnalyzer analyzer, RuleEvaluator rules) {
    this.vocabulary = vocabulary;
    this.analyzer = analyzer;
    this.rules = rules;
  }

  /**
   * @param roleCarried a role token was emitted
   * @param formatCarried an output token was emitted
   */
  String minimize(String text, boolean roleCarried, boolean formatCarried) {
    List<String> segments = new ArrayList<>();
    Matcher m = XML_BLOCK.matcher(text);
    int last = 0;
    while (m.find()) {
      addProse(segments, text.substring(last, m.start()), roleCarried, formatCarried);
      segments.add(TextUtility.collapseHorizontalWhitespace(m.group()));
      last = m.end();
    }
    addProse(segments, text.substring(last), roleCarried, formatCarried);
    return String.join("\n", segments);
  }

  private void addProse(
      List<String> segments, String prose, boolean roleCarried, boolean formatCarried) {
    if (prose.isBlank()) return;
    List<String> kept = new ArrayList<>();
    for (Sentence sentence : analyzer.analyze(prose).sentences()) {
      String s = sentence.text();
      if (keep(sentence, roleCarried, formatCarried)) {
        kept.add(s);
      } else {
        log.debug("Minimizer dropped: {}", s);
      }
    }
    if (!kept.isEmpty()) {
      segments.add(TextUtility.collapseWhitespace(String.join(" ", kept)));
    }
  }

  private boolean keep(Sentence sentence, boolean roleCarried, boolean formatCarried) {
    String s = sentence.text();
    if (PromptTemplate.hasPlaceholders(s) || rules.matches(RuleCategory.KEEP_CUE, s)) {
      return true;
    }
    if (rules.matches(RuleCategory.META_INSTRUCTION, s)) {
      return false;
    }
    if (roleCarried) {
      Optional<RuleMatch> clause = rules.first(RuleCategory.ROLE_CLAUSE, s);
      if (clause.isPresent() && extraWords(sentence, clause.get()) < MIN_EXTRA_WORDS) {
        return false;
      }
    }
    if (formatCarried && isFormatRestatement(sentence)) {
      return false;
    }
    return true;
  }

  /** Content words of the sentence outside the role clause. */
  private int extraWords(Sentence sentence, RuleMatch clause) {
    int count = 0;
    for (AnalyzedToken token : sentence.tokens()) {
      int offset = token.start() - sentence.start();
      if (offset >= clause.start() && offset < clause.end()) continue;
      if (token.isWord() && !vocabulary.isStopWord(token.lower())) count++;
    }
    return count;
  }

  private boolean isFormatRestatement(Sentence sentence) {
    long words = sentence.tokens().stream().filter(AnalyzedToken::isWord).count();
    if (words > MAX_FORMAT_SENTENCE_WORDS) return false;
    String lower = TextUtility.lower(sentence.text());
    if (vocabulary.phrases(VocabularyCategory.OUTPUT_FORMAT).containsAny(lower)) return true;
    return sentence.tokens().stream()
        .anyMatch(t -> vocabulary.lookup(VocabularyCategory.OUTPUT_FORMAT, t.lower(), null).isPresent());
  }
}
