package com.gentoro.clm.nlp;

import java.util.Locale;

/** Coarse part-of-speech classes. Both Penn Treebank and Universal tags map onto these. */
public enum PartOfSpeech {
  NOUN,
  VERB,
  ADJ,
  ADV,
  DET,
  PRON,
  PREP,
  CONJ,
  MODAL,
  NUM,
  PUNCT,
  OTHER;

  /** Map a tag produced by an OpenNLP POS model. */
  public static PartOfSpeech fromTag(String tag) {
    if (tag == null || tag.isEmpty()) {
      return OTHER;
    }
    String t = tag.toUpperCase(Locale.ROOT);
    if (t.startsWith("VB") || t.equals("VERB")) return VERB;
    if (t.startsWith("NN") || t.equals("NOUN") || t.equals("PROPN")) return NOUN;
    if (t.startsWith("JJ") || t.equals("ADJ")) return ADJ;
    if (t.startsWith("RB") || t.equals("ADV")) return ADV;
    if (t.equals("DT") || t.equals("PDT") || t.equals("WDT") || t.equals("DET")) return DET;
    if (t.startsWith("PRP") || t.startsWith("WP") || t.equals("PRON")) return PRON;
    if (t.equals("IN") || t.equals("TO") || t.equals("ADP")) return PREP;
    if (t.equals("CC") || t.equals("CCONJ") || t.equals("SCONJ")) return CONJ;
    if (t.equals("MD") || t.equals("AUX")) return MODAL;
    if (t.equals("CD") || t.equals("NUM")) return NUM;
    if (t.equals("PUNCT") || !Character.isLetter(t.charAt(0))) return PUNCT;
    return OTHER;
  }
}
