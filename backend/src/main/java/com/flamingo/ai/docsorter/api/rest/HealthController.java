package com.flamingo.ai.docsorter.api.rest;

import com.flamingo.ai.docsorter.service.ai.AiOrchestrator;
import com.flamingo.ai.docsorter.service.cache.ContentCache;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final AiOrchestrator aiOrchestrator;
  private final ContentCache contentCache;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "document-sorter");
    health.put("aiEnabled", aiOrchestrator.isEnabled());
    health.put("aiAvailable", aiOrchestrator.isAvailable());
    health.put("cacheSize", contentCache.size());
    return ResponseEntity.ok(health);
  }
}
