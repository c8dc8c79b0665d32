package com.flamingo.ai.arabicsearch.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Expands normalized query terms with their one-hop synonyms. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SynonymExpander {

  private final SynonymDictionary dictionary;

  /**
   * Expands terms with the alternatives listed in the dictionary.
   *
   * <p>The original terms come first in input order, followed by the alternatives of each term in
   * dictionary order. Duplicates are dropped. Alternatives are not expanded further.
   *
   * @param normalizedTerms terms produced by {@link ArabicTextNormalizer#tokenize(String)}
   * @return the expanded terms
   */
  public List<String> expand(List<String> normalizedTerms) {
    Set<String> expanded = new LinkedHashSet<>(normalizedTerms);
    for (String term : normalizedTerms) {
      expanded.addAll(dictionary.alternativesOf(term));
    }
    if (expanded.size() > normalizedTerms.size()) {
      log.debug("Expanded {} terms to {}: {}", normalizedTerms.size(), expanded.size(), expanded);
    }
    return new ArrayList<>(expanded);
  }
}
