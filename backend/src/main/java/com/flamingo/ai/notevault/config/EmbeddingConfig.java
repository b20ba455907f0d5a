package com.flamingo.ai.notevault.config;

import com.flamingo.ai.notevault.service.embedding.EmbeddingJobQueue;
import com.flamingo.ai.notevault.service.embedding.EmbeddingProvider;
import com.flamingo.ai.notevault.service.embedding.LangChain4jEmbeddingProvider;
import com.flamingo.ai.notevault.service.embedding.TextPreprocessor;
import com.flamingo.ai.notevault.service.note.NoteStore;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the embedding provider and the job queue with their collaborators. */
@Configuration
public class EmbeddingConfig {

  @Bean
  public EmbeddingProvider embeddingProvider(
      ObjectProvider<EmbeddingModel> embeddingModel,
      VaultConfig vaultConfig,
      MeterRegistry meterRegistry) {
    VaultConfig.Embedding embedding = vaultConfig.getEmbedding();
    return new LangChain4jEmbeddingProvider(
        embeddingModel::getObject,
        embedding.getModelName(),
        embedding.getDimensions(),
        meterRegistry);
  }

  @Bean(initMethod = "start", destroyMethod = "shutdown")
  public EmbeddingJobQueue embeddingJobQueue(
      NoteStore noteStore,
      EmbeddingProvider embeddingProvider,
      TextPreprocessor textPreprocessor,
      VaultConfig vaultConfig,
      @Qualifier("embeddingJobExecutor") Executor jobExecutor,
      @Qualifier("embeddingRetryScheduler") ScheduledExecutorService retryScheduler,
      MeterRegistry meterRegistry) {
    return new EmbeddingJobQueue(
        noteStore,
        embeddingProvider,
        textPreprocessor,
        vaultConfig,
        jobExecutor,
        retryScheduler,
        meterRegistry);
  }
}
