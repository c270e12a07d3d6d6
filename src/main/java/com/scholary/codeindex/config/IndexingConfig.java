package com.scholary.codeindex.config;

import com.scholary.codeindex.worker.IndexingWorkerFactory;
import com.scholary.codeindex.worker.SourceFileIndexingWorker;
import java.time.Clock;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for indexing-related beans.
 *
 * <p>Enables the IndexingProperties to be loaded from application.yml and provides the default
 * worker factory, which real extractors replace by declaring their own {@link
 * IndexingWorkerFactory} bean.
 */
@Configuration
@EnableConfigurationProperties(IndexingProperties.class)
public class IndexingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public IndexingWorkerFactory indexingWorkerFactory(IndexingProperties properties) {
    Set<String> extensions = Set.copyOf(properties.worker().supportedExtensions());
    return projectName -> new SourceFileIndexingWorker(projectName, extensions);
  }
}
