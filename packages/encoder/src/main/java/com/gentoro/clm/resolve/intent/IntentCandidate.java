package com.gentoro.clm.resolve.intent;

/**
 * An action token proposed by a strategy.
 *
 * @param action canonical action token, e.g. {@code RANK}
 * @param confidence confidence of the proposing strategy
 * @param strategy name of the proposing strategy
 * @param position character offset of the evidence in the input
 * @param defaultTarget target implied by an imperative template, or null
 */
public record IntentCandidate(
    String action, double confidence, String strategy, int position, String defaultTarget) {}
