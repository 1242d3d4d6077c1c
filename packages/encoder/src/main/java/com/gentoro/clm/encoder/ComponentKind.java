package com.gentoro.clm.encoder;

import com.gentoro.clm.token.TokenCategory;
import java.util.EnumSet;
import java.util.Set;

/** Which encoder produced a result. */
public enum ComponentKind {
  SYSTEM_PROMPT(TokenCategory.PROMPT),
  TRANSCRIPT(TokenCategory.TRANSCRIPT),
  STRUCTURED_DATA(EnumSet.of(TokenCategory.DATASET));

  private final Set<TokenCategory> tokenCategories;

  ComponentKind(Set<TokenCategory> tokenCategories) {
    this.tokenCategories = tokenCategories;
  }

  /** Categories a token stream of this component may contain. */
  public Set<TokenCategory> tokenCategories() {
    return tokenCategories;
  }
}
