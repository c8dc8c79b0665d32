package com.flamingo.ai.arabicsearch.text;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableListMultimap;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * Immutable mapping of canonical Arabic terms to alternative forms.
 *
 * <p>Keys and alternatives are normalized on load with the same normalizer that processes queries,
 * so lookups by normalized query terms always line up. The mapping is directional: a key lists its
 * alternatives, alternatives do not point back to their key.
 */
@Slf4j
public final class SynonymDictionary {

  private static final TypeReference<LinkedHashMap<String, List<String>>> ENTRIES_TYPE =
      new TypeReference<>() {};

  private final ImmutableListMultimap<String, String> synonyms;

  private SynonymDictionary(ImmutableListMultimap<String, String> synonyms) {
    this.synonyms = synonyms;
  }

  /**
   * Builds a dictionary from raw entries.
   *
   * @param entries term to alternatives, in dictionary order
   * @param normalizer applied to every key and alternative
   * @return the dictionary
   */
  public static SynonymDictionary of(
      Map<String, List<String>> entries, ArabicTextNormalizer normalizer) {
    ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap.builder();
    for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
      String key = normalizer.normalize(entry.getKey());
      if (key.isEmpty()) {
        continue;
      }
      entry.getValue().stream()
          .map(normalizer::normalize)
          .filter(alternative -> !alternative.isEmpty() && !alternative.equals(key))
          .distinct()
          .forEach(alternative -> builder.put(key, alternative));
    }
    return new SynonymDictionary(builder.build());
  }

  /**
   * Loads a dictionary from a JSON object resource ({@code {"term": ["alt", ...], ...}}).
   *
   * @throws IllegalStateException if the resource is missing or malformed
   */
  public static SynonymDictionary load(
      Resource resource, ObjectMapper objectMapper, ArabicTextNormalizer normalizer) {
    try (InputStream in = resource.getInputStream()) {
      Map<String, List<String>> entries = objectMapper.readValue(in, ENTRIES_TYPE);
      SynonymDictionary dictionary = of(entries, normalizer);
      log.info(
          "Loaded synonym dictionary from {}: {} terms, {} alternatives",
          resource.getDescription(),
          dictionary.termCount(),
          dictionary.synonyms.size());
      return dictionary;
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to load synonym dictionary from " + resource.getDescription(), e);
    }
  }

  /** Returns the alternatives of a normalized term, empty when the term is unknown. */
  public List<String> alternativesOf(String normalizedTerm) {
    return synonyms.get(normalizedTerm);
  }

  public Set<String> terms() {
    return synonyms.keySet();
  }

  public int termCount() {
    return synonyms.keySet().size();
  }
}
