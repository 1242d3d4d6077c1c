package com.gentoro.clm.config;

/** Options of the transcript encoder. */
public record TranscriptOptions(String defaultChannel, int maxSentimentStates) {

  public TranscriptOptions {
    if (defaultChannel == null || defaultChannel.isBlank()) {
      defaultChannel = "VOICE";
    }
    if (maxSentimentStates < 2) {
      throw new IllegalArgumentException(
          "maxSentimentStates must keep at least start and end, got " + maxSentimentStates);
    }
  }

  public static TranscriptOptions defaults() {
    return new TranscriptOptions("VOICE", 4);
  }
}
