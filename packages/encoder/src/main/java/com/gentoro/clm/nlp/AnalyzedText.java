package com.gentoro.clm.nlp;

import com.gentoro.clm.utility.TextUtility;
import java.util.List;

/** Output of a {@link LinguisticAnalyzer}: sentences with tagged tokens plus named entities. */
public final class AnalyzedText {
  private final String text;
  private final String lower;
  private final List<Sentence> sentences;
  private final List<AnalyzedToken> tokens;
  private final List<NamedEntity> entities;

  public AnalyzedText(String text, List<Sentence> sentences, List<NamedEntity> entities) {
    this.text = text;
    this.lower = TextUtility.lower(text);
    this.sentences = List.copyOf(sentences);
    this.tokens = this.sentences.stream().flatMap(s -> s.tokens().stream()).toList();
    this.entities = List.copyOf(entities);
  }

  public String text() {
    return text;
  }

  /** The text lower-cased; offsets match {@link #text()}. */
  public String lower() {
    return lower;
  }

  public List<Sentence> sentences() {
    return sentences;
  }

  public List<AnalyzedToken> tokens() {
    return tokens;
  }

  public List<NamedEntity> entities() {
    return entities;
  }

  public List<NamedEntity> entities(EntityType type) {
    return entities.stream().filter(e -> e.type() == type).toList();
  }
}
