package com.flamingo.ai.notevault.service.health;

import com.flamingo.ai.notevault.service.embedding.EmbeddingProviderStatus;
import com.flamingo.ai.notevault.service.embedding.EmbeddingQueueStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of the service's dependencies. */
@Getter
@Builder
public class HealthReport {

  private final boolean databaseUp;
  private final EmbeddingProviderStatus embedding;
  private final EmbeddingQueueStatus queue;
  private final LocalDateTime timestamp;

  /** The service is usable as long as the database is reachable. */
  public boolean isHealthy() {
    return databaseUp;
  }
}
