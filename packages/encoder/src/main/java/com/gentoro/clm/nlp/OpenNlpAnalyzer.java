package com.gentoro.clm.nlp;

import com.gentoro.clm.utility.TextUtility;
import com.gentoro.clm.vocabulary.Vocabulary;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;

/**
 * {@link LinguisticAnalyzer} built on Apache OpenNLP. Tokenization uses the model-free {@link
 * SimpleTokenizer}, stems come from the Snowball stemmer of the language, and part-of-speech tags
 * come from a POS model when one is configured, otherwise from {@link HeuristicPosTagger}.
 */
public final class OpenNlpAnalyzer implements LinguisticAnalyzer {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(OpenNlpAnalyzer.class);

  private final String language;
  private final LanguageStemmer stemmer;
  private final PosTagger tagger;
  private final EntityRecognizer entityRecognizer = new EntityRecognizer();

  public OpenNlpAnalyzer(Vocabulary vocabulary, LanguageStemmer stemmer, Path posModel) {
    this.language = stemmer.language();
    this.stemmer = stemmer;
    this.tagger = posModel == null ? new HeuristicPosTagger(vocabulary) : new ModelPosTagger(posModel);
    log.info("Linguistic analyzer for '{}' ready (tagger={})", language, tagger.name());
  }

  @Override
  public AnalyzedText analyze(String text) {
    String source = text == null ? "" : text;
    List<Sentence> sentences = new ArrayList<>();
    for (int[] span : sentenceSpans(source)) {
      sentences.add(sentence(source, sentences.size(), span[0], span[1]));
    }
    return new AnalyzedText(source, sentences, entityRecognizer.recognize(source));
  }

  private Sentence sentence(String text, int index, int start, int end) {
    String sentenceText = text.substring(start, end);
    Span[] spans = SimpleTokenizer.INSTANCE.tokenizePos(sentenceText);
    List<String> words = new ArrayList<>(spans.length);
    List<String> stems = new ArrayList<>(spans.length);
    for (Span span : spans) {
      String word = sentenceText.substring(span.getStart(), span.getEnd());
      words.add(word);
      stems.add(stemmer.stem(word));
    }
    List<PartOfSpeech> tags = words.isEmpty() ? List.of() : tagger.tag(words, stems);
    List<AnalyzedToken> tokens = new ArrayList<>(spans.length);
    for (int i = 0; i < spans.length; i++) {
      String word = words.get(i);
      tokens.add(
          new AnalyzedToken(
              word,
              TextUtility.lower(word),
              stems.get(i),
              tags.get(i),
              start + spans[i].getStart(),
              start + spans[i].getEnd(),
              index,
              i));
    }
    return new Sentence(index, start, end, sentenceText, tokens);
  }

  /** Sentence boundaries: line breaks, and terminal punctuation followed by whitespace. */
  static List<int[]> sentenceSpans(String text) {
    List<int[]> spans = new ArrayList<>();
    int start = 0;
    int n = text.length();
    for (int i = 0; i < n; i++) {
      char c = text.charAt(i);
      boolean boundary = false;
      int end = i;
      if (c == '\n' || c == '\r') {
        boundary = true;
      } else if ((c == '.' || c == '!' || c == '?')
          && (i + 1 == n || Character.isWhitespace(text.charAt(i + 1)))) {
        boundary = true;
        end = i + 1;
      }
      if (boundary) {
        addSpan(text, spans, start, end);
        start = i + 1;
      }
    }
    addSpan(text, spans, start, n);
    return spans;
  }

  private static void addSpan(String text, List<int[]> spans, int start, int end) {
    while (start < end && Character.isWhitespace(text.charAt(start))) start++;
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
    if (end > start) {
      spans.add(new int[] {start, end});
    }
  }

  @Override
  public String stem(String word) {
    return stemmer.stem(word);
  }

  @Override
  public String language() {
    return language;
  }
}
