package com.gentoro.clm.resolve;

import com.gentoro.clm.rules.RuleCategory;

/** A rendered pattern-rule hit with its span in the scanned text, {@code end} exclusive. */
public record RuleMatch(RuleCategory category, String value, int start, int end) {}
