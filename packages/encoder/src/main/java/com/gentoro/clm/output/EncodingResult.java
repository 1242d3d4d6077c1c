package com.gentoro.clm.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.clm.encoder.ComponentKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one encode call. The compression ratio is derived from the token estimates and is
 * never negative.
 */
@JsonPropertyOrder({
  "component",
  "original",
  "compressed",
  "n_tokens",
  "c_tokens",
  "compression_ratio",
  "metadata"
})
public record EncodingResult(
    @JsonProperty("original") String original,
    @JsonProperty("component") ComponentKind component,
    @JsonProperty("compressed") String compressed,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("n_tokens") int nTokens,
    @JsonProperty("c_tokens") int cTokens) {

  public EncodingResult {
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** {@code (1 - cTokens / nTokens) * 100}, floored at zero, one decimal. */
  @JsonProperty("compression_ratio")
  public double compressionRatio() {
    if (nTokens <= 0) {
      return 0.0;
    }
    double ratio = (1.0 - (double) cTokens / nTokens) * 100.0;
    if (ratio <= 0) {
      return 0.0;
    }
    return Math.round(ratio * 10.0) / 10.0;
  }

  @JsonIgnore
  public boolean isFallback() {
    return Boolean.TRUE.equals(metadata.get(OutputAssembler.FALLBACK));
  }

  @JsonIgnore
  public boolean isDegraded() {
    return Boolean.TRUE.equals(metadata.get(OutputAssembler.DEGRADED));
  }

  @Override
  public String toString() {
    return "EncodingResult{component="
        + component
        + ", nTokens="
        + nTokens
        + ", cTokens="
        + cTokens
        + ", ratio="
        + compressionRatio()
        + ", compressed="
        + compressed
        + '}';
  }
}
