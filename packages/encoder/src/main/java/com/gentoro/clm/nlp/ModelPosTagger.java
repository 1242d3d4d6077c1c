package com.gentoro.clm.nlp;

import com.gentoro.clm.exception.AnalyzerException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import opennlp.tools.postag.POSModel;
import opennlp.tools.postag.POSTaggerME;

/** Tagger backed by a maximum-entropy OpenNLP model file. */
final class ModelPosTagger implements PosTagger {
  private final POSModel model;
  private final ThreadLocal<POSTaggerME> tagger;
  private final String source;

  ModelPosTagger(Path modelPath) {
    this.source = modelPath.toString();
    try (InputStream in = Files.newInputStream(modelPath)) {
      this.model = new POSModel(in);
    } catch (IOException e) {
      throw new AnalyzerException("Failed to load POS model: " + modelPath, e);
    }
    // POSTaggerME keeps per-call state.
    this.tagger = ThreadLocal.withInitial(() -> new POSTaggerME(model));
  }

  @Override
  public List<PartOfSpeech> tag(List<String> tokens, List<String> stems) {
    String[] tags = tagger.get().tag(tokens.toArray(new String[0]));
    List<PartOfSpeech> out = new ArrayList<>(tags.length);
    for (String tag : tags) {
      out.add(PartOfSpeech.fromTag(tag));
    }
    return out;
  }

  @Override
  public String name() {
    return "model:" + source;
  }
}
