package com.flamingo.ai.arabicsearch.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class SynonymExpanderTest {

  private ArabicTextNormalizer normalizer;
  private SynonymDictionary dictionary;
  private SynonymExpander expander;

  @BeforeEach
  void setUp() {
    normalizer = new ArabicTextNormalizer(TehMarbutaPolicy.KEEP, false);
    dictionary =
        SynonymDictionary.load(
            new ClassPathResource("synonyms/arabic-synonyms.json"), new ObjectMapper(), normalizer);
    expander = new SynonymExpander(dictionary);
  }

  @Nested
  @DisplayName("default dictionary")
  class DefaultDictionary {

    @Test
    @DisplayName("should load all twenty terms")
    void shouldLoadAllTerms() {
      assertThat(dictionary.termCount()).isEqualTo(20);
    }

    @Test
    @DisplayName("should expand prayer with its alternatives after the original term")
    void shouldExpandPrayer() {
      List<String> expanded = expander.expand(normalizer.tokenize(normalizer.normalize("صلاة")));

      assertThat(expanded)
          .containsExactly(
              "صلاة",
              normalizer.normalize("صلوات"),
              normalizer.normalize("صلاه"),
              normalizer.normalize("الصلاة"),
              normalizer.normalize("فريضة"));
    }

    @Test
    @DisplayName("should keep input order and drop duplicates")
    void shouldKeepOrderAndDeduplicate() {
      List<String> expanded = expander.expand(List.of("الصلاة", "صلاة"));

      assertThat(expanded).startsWith("الصلاة", "صلاة");
      assertThat(expanded).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("should pass unknown terms through unchanged")
    void shouldPassUnknownTermsThrough() {
      assertThat(expander.expand(List.of("كلمة", "اخرى"))).containsExactly("كلمة", "اخرى");
    }

    @Test
    @DisplayName("should return nothing for no terms")
    void shouldReturnNothingForNoTerms() {
      assertThat(expander.expand(List.of())).isEmpty();
    }
  }

  @Nested
  @DisplayName("expansion rules")
  class ExpansionRules {

    @Test
    @DisplayName("should expand one hop only")
    void shouldExpandOneHopOnly() {
      Map<String, List<String>> entries = new LinkedHashMap<>();
      entries.put("سفر", List.of("رحلة"));
      entries.put("رحلة", List.of("سياحة"));
      SynonymExpander chained = new SynonymExpander(SynonymDictionary.of(entries, normalizer));

      assertThat(chained.expand(List.of("سفر"))).containsExactly("سفر", "رحلة");
    }

    @Test
    @DisplayName("should be directional")
    void shouldBeDirectional() {
      assertThat(expander.expand(List.of("رمضان"))).containsExactly("رمضان");
    }

    @Test
    @DisplayName("should normalize dictionary entries with the configured policy")
    void shouldNormalizeEntriesOnLoad() {
      ArabicTextNormalizer toHeh = new ArabicTextNormalizer(TehMarbutaPolicy.TO_HEH, false);
      SynonymDictionary folded =
          SynonymDictionary.load(
              new ClassPathResource("synonyms/arabic-synonyms.json"), new ObjectMapper(), toHeh);
      SynonymExpander foldedExpander = new SynonymExpander(folded);

      List<String> expanded = foldedExpander.expand(List.of(toHeh.normalize("صلاة")));

      assertThat(expanded).first().isEqualTo("صلاه");
      assertThat(expanded).contains("صلوات", "الصلاه").doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("should not change the dictionary while expanding")
    void shouldNotMutateDictionary() {
      int before = dictionary.alternativesOf("صلاة").size();

      expander.expand(List.of("صلاة", "حج", "صوم"));

      assertThat(dictionary.alternativesOf("صلاة")).hasSize(before);
      assertThat(dictionary.termCount()).isEqualTo(20);
    }
  }

  @Test
  @DisplayName("should fail fast when the dictionary resource is missing")
  void shouldFailWhenResourceMissing() {
    assertThatThrownBy(
            () ->
                SynonymDictionary.load(
                    new ClassPathResource("synonyms/missing.json"), new ObjectMapper(), normalizer))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("synonym dictionary");
  }
}
