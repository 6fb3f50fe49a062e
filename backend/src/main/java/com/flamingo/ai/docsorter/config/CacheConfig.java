package com.flamingo.ai.docsorter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docsorter.service.cache.CacheSnapshotStore;
import com.flamingo.ai.docsorter.service.cache.JsonFileCacheSnapshotStore;
import com.flamingo.ai.docsorter.service.cache.LruContentCache;
import java.nio.file.Path;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Content cache wiring and snapshot persistence. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class CacheConfig {

  private final AnalysisConfig analysisConfig;

  @Bean
  public CacheSnapshotStore cacheSnapshotStore(ObjectMapper objectMapper) {
    AnalysisConfig.Persistence persistence = analysisConfig.getCache().getPersistence();
    if (!persistence.isEnabled()) {
      return CacheSnapshotStore.NONE;
    }
    log.info("Content cache persistence enabled at {}", persistence.getPath());
    return new JsonFileCacheSnapshotStore(Path.of(persistence.getPath()), objectMapper);
  }

  @Bean(initMethod = "restore", destroyMethod = "flush")
  public LruContentCache contentCache(CacheSnapshotStore cacheSnapshotStore) {
    return new LruContentCache(
        analysisConfig.getCache().getCapacity(), cacheSnapshotStore, Clock.systemUTC());
  }
}
