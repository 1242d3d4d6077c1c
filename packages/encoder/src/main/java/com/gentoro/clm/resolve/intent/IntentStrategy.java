package com.gentoro.clm.resolve.intent;

import java.util.List;

/** One rung of the intent ladder. Implementations are stateless. */
public interface IntentStrategy {

  String name();

  /** Confidence attached to every candidate this strategy proposes. */
  double confidence();

  /** Candidates in text order; empty when the strategy does not apply. */
  List<IntentCandidate> detect(IntentContext context);
}
