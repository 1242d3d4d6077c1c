package com.gentoro.clm.token;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Closed set of token categories of the compressed grammar. */
public enum TokenCategory {
  REQ,
  TARGET,
  EXTRACT,
  CTX,
  OUT,
  REF,
  CALL,
  CUSTOMER,
  CONTACT,
  ISSUE,
  ACTION,
  RESOLUTION,
  SENTIMENT,
  DATASET;

  public static final Set<TokenCategory> PROMPT = EnumSet.of(REQ, TARGET, EXTRACT, CTX, OUT, REF);
  public static final Set<TokenCategory> TRANSCRIPT =
      EnumSet.of(CALL, CUSTOMER, CONTACT, ISSUE, ACTION, RESOLUTION, SENTIMENT);

  public static Optional<TokenCategory> parse(String name) {
    if (name == null) return Optional.empty();
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
