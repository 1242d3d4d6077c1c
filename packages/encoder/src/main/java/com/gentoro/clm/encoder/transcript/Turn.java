package com.gentoro.clm.encoder.transcript;

/**
 * One speaker turn.
 *
 * @param label the speaker label as written
 * @param seconds offset parsed from the timestamp, or null when the line had none
 */
public record Turn(int index, String label, Speaker speaker, Integer seconds, String text) {

  Turn withSpeaker(Speaker value) {
    return new Turn(index, label, value, seconds, text);
  }

  Turn append(String continuation) {
    return new Turn(index, label, speaker, seconds, text + " " + continuation.trim());
  }
}
