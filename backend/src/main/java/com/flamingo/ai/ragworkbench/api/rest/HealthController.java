package com.flamingo.ai.ragworkbench.api.rest;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
public class HealthController {

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "rag-workbench");
    health.put("strategies", ChunkingStrategyType.values().length);
    return ResponseEntity.ok(health);
  }
}
