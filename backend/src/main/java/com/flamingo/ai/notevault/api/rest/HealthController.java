package com.flamingo.ai.notevault.api.rest;

import com.flamingo.ai.notevault.service.health.HealthReport;
import com.flamingo.ai.notevault.service.health.HealthService;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Reports database, embedding model and queue state; 503 when the database is down. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    HealthReport report = healthService.check();

    Map<String, Object> embedding = new LinkedHashMap<>();
    embedding.put("initialized", report.getEmbedding().initialized());
    embedding.put("model", report.getEmbedding().modelId());
    embedding.put("dimensions", report.getEmbedding().dimensions());
    embedding.put("queue_size", report.getQueue().queueSize());
    embedding.put("processing_count", report.getQueue().processingCount());
    embedding.put("max_concurrent", report.getQueue().maxConcurrent());

    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", report.isHealthy() ? "UP" : "DOWN");
    health.put("timestamp", report.getTimestamp());
    health.put("service", "notevault");
    health.put("database", report.isDatabaseUp() ? "connected" : "disconnected");
    health.put("embedding", embedding);

    HttpStatus status = report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(health);
  }
}
