package com.flamingo.ai.notevault.service.health;

import com.flamingo.ai.notevault.domain.repository.NoteRepository;
import com.flamingo.ai.notevault.service.embedding.EmbeddingJobQueue;
import com.flamingo.ai.notevault.service.embedding.EmbeddingProvider;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Implementation of HealthService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final NoteRepository noteRepository;
  private final EmbeddingProvider embeddingProvider;
  private final EmbeddingJobQueue embeddingJobQueue;

  @Override
  @Timed(value = "health.check", description = "Time to run the health check")
  public HealthReport check() {
    return HealthReport.builder()
        .databaseUp(isDatabaseUp())
        .embedding(embeddingProvider.getStatus())
        .queue(embeddingJobQueue.getStatus())
        .timestamp(LocalDateTime.now())
        .build();
  }

  private boolean isDatabaseUp() {
    try {
      noteRepository.count();
      return true;
    } catch (DataAccessException e) {
      log.error("Database health check failed: {}", e.getMessage());
      return false;
    }
  }
}
