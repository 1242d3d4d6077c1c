package com.gentoro.clm.output;

/** Approximates model token counts with a fixed characters-per-token ratio. */
public final class TokenEstimator {
  private final int charsPerToken;

  public TokenEstimator(int charsPerToken) {
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive, got " + charsPerToken);
    }
    this.charsPerToken = charsPerToken;
  }

  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + charsPerToken - 1) / charsPerToken;
  }

  public int charsPerToken() {
    return charsPerToken;
  }
}
