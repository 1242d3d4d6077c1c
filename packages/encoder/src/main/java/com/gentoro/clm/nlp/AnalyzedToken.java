package com.gentoro.clm.nlp;

/**
 * One token of analyzed text. Offsets are character positions in the original text, {@code end}
 * exclusive.
 */
public record AnalyzedToken(
    String text,
    String lower,
    String stem,
    PartOfSpeech pos,
    int start,
    int end,
    int sentenceIndex,
    int indexInSentence) {

  public boolean isWord() {
    return pos != PartOfSpeech.PUNCT && pos != PartOfSpeech.NUM;
  }
}
