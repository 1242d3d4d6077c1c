package com.gentoro.clm.resolve;

import java.util.List;

/**
 * Objects an instruction operates on.
 *
 * @param targets canonical targets in source order, after subsumption
 * @param catalogImplied the text matches its input against a catalog or "a list of X"
 * @param catalogName name of that catalog when given, else null
 * @param outputItem singular item kind returned per match, e.g. {@code ID}, else null
 * @param domain dominant domain by keyword score, else null
 * @param extractionFields fields to extract, in source order
 */
public record TargetResolution(
    List<String> targets,
    boolean catalogImplied,
    String catalogName,
    String outputItem,
    String domain,
    List<String> extractionFields) {

  public TargetResolution {
    targets = List.copyOf(targets);
    extractionFields = List.copyOf(extractionFields);
  }
}
