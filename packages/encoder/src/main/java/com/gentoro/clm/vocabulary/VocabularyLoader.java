package com.gentoro.clm.vocabulary;

import com.gentoro.clm.exception.VocabularyException;
import com.gentoro.clm.nlp.LanguageStemmer;
import com.gentoro.clm.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Reads vocabulary resources and overlays with the Jackson YAML mapper. */
public final class VocabularyLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(VocabularyLoader.class);

  public static final String CLASSPATH_PREFIX = "classpath:";

  private VocabularyLoader() {}

  /**
   * Load the base vocabulary for a language, merged with an optional overlay.
   *
   * @return empty when the language ships no vocabulary resource
   */
  public static Optional<Vocabulary> load(
      String language, String overlayLocation, LanguageStemmer stemmer) {
    Optional<VocabularyDocument> base = readDocument("vocabulary/" + language + ".yaml");
    if (base.isEmpty()) {
      return Optional.empty();
    }
    VocabularyDocument document = base.get();
    if (document.getLanguage() == null) {
      document.setLanguage(language);
    }
    if (overlayLocation != null && !overlayLocation.isBlank()) {
      VocabularyDocument overlay = readOverlay(overlayLocation);
      document = document.merge(overlay);
      log.info("Merged vocabulary overlay {} into '{}' vocabulary", overlayLocation, language);
    }
    Vocabulary vocabulary = new Vocabulary(document, stemmer);
    log.debug("Loaded {}", vocabulary);
    return Optional.of(vocabulary);
  }

  static Optional<VocabularyDocument> readDocument(String resource) {
    try (InputStream in = VocabularyLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        return Optional.empty();
      }
      return Optional.of(JacksonUtility.getYamlMapper().readValue(in, VocabularyDocument.class));
    } catch (IOException e) {
      throw new VocabularyException("Failed to read vocabulary resource: " + resource, e);
    }
  }

  static VocabularyDocument readOverlay(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      return readDocument(resource)
          .orElseThrow(() -> new VocabularyException("Vocabulary overlay not found: " + location));
    }
    Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new VocabularyException("Vocabulary overlay not found: " + location);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return JacksonUtility.getYamlMapper().readValue(in, VocabularyDocument.class);
    } catch (IOException e) {
      throw new VocabularyException("Failed to read vocabulary overlay: " + location, e);
    }
  }
}
