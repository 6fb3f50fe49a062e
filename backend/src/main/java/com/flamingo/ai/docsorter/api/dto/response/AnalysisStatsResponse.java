package com.flamingo.ai.docsorter.api.dto.response;

import com.flamingo.ai.docsorter.service.analysis.ProcessingStatsSnapshot;
import com.flamingo.ai.docsorter.service.cache.CacheStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Processing and cache counters. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisStatsResponse {

  private ProcessingStatsSnapshot processing;
  private CacheStats cache;
}
