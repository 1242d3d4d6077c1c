package com.gentoro.clm.config;

import java.util.Locale;

/** Named importance levels for structured-data fields. */
public enum FieldImportance {
  CRITICAL(1.0),
  HIGH(0.8),
  MEDIUM(0.5),
  LOW(0.2),
  NEVER(0.0);

  private final double score;

  FieldImportance(double score) {
    this.score = score;
  }

  public double score() {
    return score;
  }

  /** Accepts a level name ({@code high}) or a number ({@code 0.7}). */
  public static double parseScore(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Empty field importance");
    }
    String v = value.trim();
    try {
      return valueOf(v.toUpperCase(Locale.ROOT)).score();
    } catch (IllegalArgumentException notALevel) {
      return Double.parseDouble(v);
    }
  }
}
