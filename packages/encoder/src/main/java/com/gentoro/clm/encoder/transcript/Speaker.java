package com.gentoro.clm.encoder.transcript;

/** Role of a transcript speaker. */
public enum Speaker {
  AGENT,
  CUSTOMER,
  SYSTEM
}
