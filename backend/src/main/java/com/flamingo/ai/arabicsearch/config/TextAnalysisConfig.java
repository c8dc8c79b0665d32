package com.flamingo.ai.arabicsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.arabicsearch.text.ArabicTextNormalizer;
import com.flamingo.ai.arabicsearch.text.SynonymDictionary;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

/** Wires the synonym dictionary shared by all query processing. */
@Configuration
public class TextAnalysisConfig {

  @Bean
  public SynonymDictionary synonymDictionary(
      SearchProperties properties, ObjectMapper objectMapper, ArabicTextNormalizer normalizer) {
    return SynonymDictionary.load(
        new ClassPathResource(properties.getSynonyms().getResource()), objectMapper, normalizer);
  }
}
