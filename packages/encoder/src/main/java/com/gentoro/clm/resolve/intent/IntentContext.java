package com.gentoro.clm.resolve.intent;

import com.gentoro.clm.nlp.AnalyzedText;
import com.gentoro.clm.resolve.ClauseFilter;
import com.gentoro.clm.vocabulary.Vocabulary;

/** Inputs shared by every intent strategy for one piece of text. */
public record IntentContext(AnalyzedText text, Vocabulary vocabulary, ClauseFilter clauses) {}
