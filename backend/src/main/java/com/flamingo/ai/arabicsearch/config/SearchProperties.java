package com.flamingo.ai.arabicsearch.config;

import com.flamingo.ai.arabicsearch.text.TehMarbutaPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for query processing, retrieval and embedding indexing. */
@Configuration
@ConfigurationProperties(prefix = "search")
@Getter
@Setter
public class SearchProperties {

  /** Index queried by every search mode. */
  private String index = "transcription_with_embeddings";

  /** Requested sizes above this value are clamped. */
  private int maxSize = 1000;

  /** Downgrade semantic requests to enhanced when the embedding model is unavailable. */
  private boolean semanticFallbackEnabled = true;

  private Normalization normalization = new Normalization();
  private Synonyms synonyms = new Synonyms();
  private Enhanced enhanced = new Enhanced();
  private Semantic semantic = new Semantic();
  private Backend backend = new Backend();
  private Embedding embedding = new Embedding();
  private Indexing indexing = new Indexing();

  @Getter
  @Setter
  public static class Normalization {
    private TehMarbutaPolicy tehMarbutaPolicy = TehMarbutaPolicy.KEEP;
    private boolean stripNonArabic = false;
  }

  @Getter
  @Setter
  public static class Synonyms {
    /** Classpath location of the synonym dictionary (JSON object of term to alternatives). */
    private String resource = "synonyms/arabic-synonyms.json";
  }

  @Getter
  @Setter
  public static class Enhanced {
    private float termBoost = 1.5f;
    private float phraseBoost = 5.0f;
    private float fuzzyBoost = 1.0f;
    private String fuzziness = "AUTO";
  }

  @Getter
  @Setter
  public static class Semantic {
    private int minCandidates = 100;
  }

  @Getter
  @Setter
  public static class Backend {
    /** Wait before the single retry of a failed backend call. */
    private Duration retryBackoff = Duration.ofMillis(200);
  }

  @Getter
  @Setter
  public static class Embedding {
    private String modelId = "text-embedding-3-small";
    private int chunkSize = 32;
    private String probeText = "صلاة الفجر";
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Cache {
      private boolean enabled = true;
      private long maxEntries = 10_000;
      private Duration ttl = Duration.ofHours(1);
    }
  }

  @Getter
  @Setter
  public static class Indexing {
    private String sourceIndex = "transcription";
    private String targetIndex = "transcription_with_embeddings";
    private int batchSize = 50;

    /** Sort fields that order the source corpus uniquely; used as the resume cursor. */
    private List<String> cursorFields = new ArrayList<>(List.of("video_link", "start"));

    private String checkpointDir = "./data/checkpoints";

    /** Failure entries kept in checkpoints and reports; counts stay exact beyond it. */
    private int maxReportedFailures = 1000;

    private boolean runOnStartup = false;
  }
}
