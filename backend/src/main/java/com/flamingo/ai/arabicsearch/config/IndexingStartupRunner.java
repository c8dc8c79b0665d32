package com.flamingo.ai.arabicsearch.config;

import com.flamingo.ai.arabicsearch.service.indexing.IndexingJobService;
import com.flamingo.ai.arabicsearch.service.indexing.IndexingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Startup bean that runs the embedding indexing pipeline once with the configured source and
 * target indices. Enabled with {@code search.indexing.run-on-startup=true}.
 *
 * <p>A failed run is logged and does not stop the application; the next run resumes from the
 * checkpoint.
 */
@Component
@ConditionalOnProperty(prefix = "search.indexing", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IndexingStartupRunner implements CommandLineRunner {

  private final IndexingJobService indexingJobService;

  @Override
  public void run(String... args) {
    log.info("Running embedding indexing on startup...");
    try {
      IndexingReport report = indexingJobService.runNow(null, null, null);
      log.info(
          "Startup indexing finished: processed={} failed={} pages={} in {}",
          report.documentsProcessed(),
          report.documentsFailed(),
          report.pagesProcessed(),
          report.duration());
    } catch (Exception e) {
      log.error("Startup indexing failed, will resume on next run: {}", e.getMessage(), e);
    }
  }
}
