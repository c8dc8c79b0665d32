package com.flamingo.ai.arabicsearch.text;

import com.flamingo.ai.arabicsearch.config.SearchProperties;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes Arabic text so that spelling variants of the same word compare equal.
 *
 * <p>The steps run in a fixed order:
 *
 * <ol>
 *   <li>strip tashkeel (harakat U+064B..U+0652 and superscript alef U+0670)
 *   <li>remove tatweel (U+0640)
 *   <li>fold letter variants: hamza-carrying alefs and alef wasla onto bare alef, teh marbuta
 *       according to the configured {@link TehMarbutaPolicy}, yeh onto alef maqsura
 *   <li>optionally drop everything that is neither Arabic nor whitespace
 *   <li>collapse whitespace and trim
 * </ol>
 *
 * <p>The result is idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.
 */
@Component
@Slf4j
public class ArabicTextNormalizer {

  private static final Pattern TASHKEEL = Pattern.compile("[\\u064B-\\u0652\\u0670]");
  private static final Pattern TATWEEL = Pattern.compile("\\u0640+");
  private static final Pattern ALEF_VARIANTS = Pattern.compile("[\\u0623\\u0625\\u0622\\u0671]");
  private static final Pattern NON_ARABIC = Pattern.compile("[^\\u0600-\\u06FF\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final char ALEF = 'ا';
  private static final char TEH_MARBUTA = 'ة';
  private static final char HEH = 'ه';
  private static final char YEH = 'ي';
  private static final char ALEF_MAQSURA = 'ى';

  private final TehMarbutaPolicy tehMarbutaPolicy;
  private final boolean stripNonArabic;

  @Autowired
  public ArabicTextNormalizer(SearchProperties properties) {
    this(
        properties.getNormalization().getTehMarbutaPolicy(),
        properties.getNormalization().isStripNonArabic());
  }

  public ArabicTextNormalizer(TehMarbutaPolicy tehMarbutaPolicy, boolean stripNonArabic) {
    this.tehMarbutaPolicy = tehMarbutaPolicy;
    this.stripNonArabic = stripNonArabic;
    log.info(
        "Arabic normalizer configured: tehMarbuta={}, stripNonArabic={}",
        tehMarbutaPolicy,
        stripNonArabic);
  }

  /**
   * Normalizes raw text. Total: {@code null} and blank input yield an empty string.
   *
   * @param raw the raw text
   * @return the normalized text
   */
  public String normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return "";
    }
    String text = TASHKEEL.matcher(raw).replaceAll("");
    text = TATWEEL.matcher(text).replaceAll("");
    text = ALEF_VARIANTS.matcher(text).replaceAll(String.valueOf(ALEF));
    if (tehMarbutaPolicy == TehMarbutaPolicy.TO_HEH) {
      text = text.replace(TEH_MARBUTA, HEH);
    }
    text = text.replace(YEH, ALEF_MAQSURA);
    if (stripNonArabic) {
      text = NON_ARABIC.matcher(text).replaceAll(" ");
    }
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /**
   * Splits normalized text into terms.
   *
   * @param normalized text previously returned by {@link #normalize(String)}
   * @return the terms, empty for empty input
   */
  public List<String> tokenize(String normalized) {
    if (normalized == null || normalized.isEmpty()) {
      return List.of();
    }
    return List.of(normalized.split(" "));
  }

  public TehMarbutaPolicy getTehMarbutaPolicy() {
    return tehMarbutaPolicy;
  }
}
