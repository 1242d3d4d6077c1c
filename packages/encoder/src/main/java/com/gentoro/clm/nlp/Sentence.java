package com.gentoro.clm.nlp;

import java.util.List;

/** A sentence span and its tokens. */
public record Sentence(int index, int start, int end, String text, List<AnalyzedToken> tokens) {

  public Sentence {
    tokens = List.copyOf(tokens);
  }

  /** First token that is a word, or null. */
  public AnalyzedToken firstWord() {
    return tokens.stream().filter(AnalyzedToken::isWord).findFirst().orElse(null);
  }

  public boolean isQuestion() {
    return text.stripTrailing().endsWith("?");
  }
}
