package com.gentoro.clm.output;

import com.gentoro.clm.encoder.ComponentKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What an encoder hands to the {@link OutputAssembler} before metrics and the fallback check.
 *
 * @param original the input as text
 * @param tokens rendered candidate tokens, in output order
 * @param compressed candidate compressed form
 * @param metadata encoder specific metadata
 */
public record EncoderOutput(
    ComponentKind component,
    String original,
    List<String> tokens,
    String compressed,
    Map<String, Object> metadata) {

  public EncoderOutput {
    tokens = List.copyOf(tokens);
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
