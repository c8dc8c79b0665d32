package com.flamingo.ai.arabicsearch.text;

/** How the normalizer treats teh marbuta (ة). */
public enum TehMarbutaPolicy {
  /** Leave ة untouched. */
  KEEP,
  /** Fold ة onto heh (ه). */
  TO_HEH
}
