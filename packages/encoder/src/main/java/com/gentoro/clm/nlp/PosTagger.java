package com.gentoro.clm.nlp;

import java.util.List;

/** Assigns a part of speech to each token of one sentence. */
interface PosTagger {

  List<PartOfSpeech> tag(List<String> tokens, List<String> stems);

  String name();
}
