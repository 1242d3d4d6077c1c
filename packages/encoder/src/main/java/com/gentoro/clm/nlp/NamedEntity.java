package com.gentoro.clm.nlp;

/** An entity found in text; {@code value} is the normalized form (e.g. the bare reference id). */
public record NamedEntity(EntityType type, String value, int start, int end) {}
