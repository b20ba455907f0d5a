package com.flamingo.ai.notevault.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.notevault.config.VaultConfig;
import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import com.flamingo.ai.notevault.exception.EmbeddingGenerationException;
import com.flamingo.ai.notevault.service.note.InMemoryNoteStore;
import com.flamingo.ai.notevault.service.note.InMemoryNoteStore.StatusUpdate;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingJobQueue Tests")
class EmbeddingJobQueueTest {

  private static final int DIMENSIONS = 384;
  private static final Duration WAIT = Duration.ofSeconds(10);

  @Mock private EmbeddingProvider embeddingProvider;

  private InMemoryNoteStore noteStore;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService jobExecutor;
  private ScheduledExecutorService retryScheduler;
  private EmbeddingJobQueue queue;
  private UUID userId;

  @BeforeEach
  void setUp() {
    noteStore = new InMemoryNoteStore();
    meterRegistry = new SimpleMeterRegistry();
    // unbounded pool, so any concurrency limit observed comes from the queue
    jobExecutor = Executors.newCachedThreadPool();
    retryScheduler = Executors.newSingleThreadScheduledExecutor();
    userId = UUID.randomUUID();
    queue = newQueue(5);
  }

  @AfterEach
  void tearDown() {
    queue.shutdown();
    jobExecutor.shutdownNow();
    retryScheduler.shutdownNow();
  }

  private EmbeddingJobQueue newQueue(int maxConcurrent) {
    return newQueue(maxConcurrent, new VaultConfig.Retry().getMaxAttempts());
  }

  private EmbeddingJobQueue newQueue(int maxConcurrent, int maxAttempts) {
    VaultConfig config = new VaultConfig();
    config.getQueue().setMaxConcurrent(maxConcurrent);
    config.getRetry().setMaxAttempts(maxAttempts);
    config.getQueue().setShutdownTimeoutMs(1000);
    config.getRetry().setInitialBackoffMs(1);
    return new EmbeddingJobQueue(
        noteStore,
        embeddingProvider,
        new TextPreprocessor(),
        config,
        jobExecutor,
        retryScheduler,
        meterRegistry);
  }

  private static float[] vector() {
    float[] vector = new float[DIMENSIONS];
    Arrays.fill(vector, 0.05f);
    return vector;
  }

  private double count(String name) {
    return meterRegistry.counter(name).count();
  }

  @Nested
  @DisplayName("Processing")
  class Processing {

    @Test
    @DisplayName("Should store a vector and mark the note completed")
    void shouldCompleteNote() throws Exception {
      Note note = noteStore.add(userId, "Trip", "# Paris\n\n**Louvre** visit", List.of());
      when(embeddingProvider.generateEmbedding(anyString())).thenReturn(vector());

      queue.start();
      queue.enqueue(note.getId());

      assertThat(queue.awaitIdle(WAIT)).isTrue();
      Note stored = noteStore.get(note.getId());
      assertThat(stored.getEmbeddingStatus()).isEqualTo(EmbeddingStatus.COMPLETED);
      assertThat(stored.getEmbeddingVector()).hasSize(DIMENSIONS);
      verify(embeddingProvider).generateEmbedding("Paris Louvre visit");
      assertThat(noteStore.statusUpdates())
          .containsExactly(
              new StatusUpdate(note.getId(), EmbeddingStatus.PROCESSING),
              new StatusUpdate(note.getId(), EmbeddingStatus.COMPLETED));
      assertThat(count("embedding.jobs.completed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should succeed after transient failures")
    void shouldRecoverAfterTransientFailures() throws Exception {
      Note note = noteStore.add(userId, "Flaky", "content", List.of());
      when(embeddingProvider.generateEmbedding(anyString()))
          .thenThrow(new EmbeddingGenerationException("boom"))
          .thenThrow(new EmbeddingGenerationException("boom again"))
          .thenReturn(vector());

      queue.start();
      queue.enqueue(note.getId());

      assertThat(queue.awaitIdle(WAIT)).isTrue();
      assertThat(noteStore.get(note.getId()).getEmbeddingStatus())
          .isEqualTo(EmbeddingStatus.COMPLETED);
      verify(embeddingProvider, times(3)).generateEmbedding(anyString());
      assertThat(count("embedding.jobs.retried")).isEqualTo(2.0);
      assertThat(count("embedding.jobs.failed")).isZero();
    }

    @Test
    @DisplayName("Should give up after four attempts and clear the vector")
    void shouldFailAfterFourAttempts() throws Exception {
      Note note = noteStore.addEmbedded(userId, "Old", "content", List.of(), vector());
      when(embeddingProvider.generateEmbedding(anyString()))
          .thenThrow(new EmbeddingGenerationException("model down"));

      queue.start();
      queue.enqueue(note.getId());

      assertThat(queue.awaitIdle(WAIT)).isTrue();
      Note stored = noteStore.get(note.getId());
      assertThat(stored.getEmbeddingStatus()).isEqualTo(EmbeddingStatus.FAILED);
      assertThat(stored.getEmbedding()).isNull();
      verify(embeddingProvider, times(4)).generateEmbedding(anyString());
      assertThat(count("embedding.jobs.failed")).isEqualTo(1.0);
      assertThat(queue.getStatus().processingCount()).isZero();
    }

    @Test
    @DisplayName("Should apply each queue's own attempt limit")
    void shouldKeepRetryPolicyPerQueue() throws Exception {
      EmbeddingJobQueue twoAttempts = newQueue(5, 2);
      Note note = noteStore.add(userId, "Short", "content", List.of());
      when(embeddingProvider.generateEmbedding(anyString()))
          .thenThrow(new EmbeddingGenerationException("model down"));

      try {
        twoAttempts.start();
        twoAttempts.enqueue(note.getId());
        assertThat(twoAttempts.awaitIdle(WAIT)).isTrue();
        verify(embeddingProvider, times(2)).generateEmbedding(anyString());

        queue.start();
        queue.enqueue(note.getId());
        assertThat(queue.awaitIdle(WAIT)).isTrue();
        verify(embeddingProvider, times(6)).generateEmbedding(anyString());
      } finally {
        twoAttempts.shutdown();
      }
      assertThat(noteStore.get(note.getId()).getEmbeddingStatus())
          .isEqualTo(EmbeddingStatus.FAILED);
    }

    @Test
    @DisplayName("Should fail a job and free its slot when retries cannot be scheduled")
    void shouldFailWhenRetrySchedulerIsShutDown() throws Exception {
      Note note = noteStore.add(userId, "Stuck", "content", List.of());
      when(embeddingProvider.generateEmbedding(anyString()))
          .thenThrow(new EmbeddingGenerationException("model down"));
      retryScheduler.shutdownNow();

      queue.start();
      queue.enqueue(note.getId());

      assertThat(queue.awaitIdle(WAIT)).isTrue();
      assertThat(noteStore.get(note.getId()).getEmbeddingStatus())
          .isEqualTo(EmbeddingStatus.FAILED);
      verify(embeddingProvider, times(1)).generateEmbedding(anyString());
      assertThat(count("embedding.jobs.failed")).isEqualTo(1.0);
      assertThat(queue.getStatus().processingCount()).isZero();
    }

    @Test
    @DisplayName("Should mark a missing note failed without retrying")
    void shouldFailMissingNoteWithoutRetry() throws Exception {
      UUID missing = UUID.randomUUID();

      queue.start();
      queue.enqueue(missing);

      assertThat(queue.awaitIdle(WAIT)).isTrue();
      verify(embeddingProvider, never()).generateEmbedding(anyString());
      assertThat(noteStore.findByIdCalls()).isEqualTo(1);
      assertThat(noteStore.statusUpdates())
          .containsExactly(
              new StatusUpdate(missing, EmbeddingStatus.PROCESSING),
              new StatusUpdate(missing, EmbeddingStatus.FAILED));
      assertThat(count("embedding.jobs.retried")).isZero();
    }
  }

  @Nested
  @DisplayName("Admission")
  class Admission {

    @Test
    @DisplayName("Should ignore a note that is already pending")
    void shouldIgnoreDuplicatePending() throws Exception {
      Note note = noteStore.add(userId, "Dup", "content", List.of());
      when(embeddingProvider.generateEmbedding(anyString())).thenReturn(vector());

      queue.enqueue(note.getId());
      queue.enqueue(note.getId());

      assertThat(queue.getStatus().queueSize()).isEqualTo(1);
      assertThat(count("embedding.jobs.duplicate")).isEqualTo(1.0);

      queue.start();
      assertThat(queue.awaitIdle(WAIT)).isTrue();
      verify(embeddingProvider, times(1)).generateEmbedding(anyString());
    }

    @Test
    @DisplayName("Should ignore a note that is being processed")
    void shouldIgnoreDuplicateActive() throws Exception {
      Note note = noteStore.add(userId, "Busy", "content", List.of());
      CountDownLatch entered = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      when(embeddingProvider.generateEmbedding(anyString()))
          .thenAnswer(
              invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return vector();
              });

      queue.start();
      queue.enqueue(note.getId());
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

      queue.enqueue(note.getId());

      EmbeddingQueueStatus status = queue.getStatus();
      assertThat(status.queueSize()).isZero();
      assertThat(status.processingCount()).isEqualTo(1);

      release.countDown();
      assertThat(queue.awaitIdle(WAIT)).isTrue();
      verify(embeddingProvider, times(1)).generateEmbedding(anyString());
    }

    @Test
    @DisplayName("Should process a note again once its previous job finished")
    void shouldAcceptNoteAgainAfterTerminalState() throws Exception {
      Note note = noteStore.add(userId, "Again", "content", List.of());
      when(embeddingProvider.generateEmbedding(anyString())).thenReturn(vector());

      queue.start();
      queue.enqueue(note.getId());
      assertThat(queue.awaitIdle(WAIT)).isTrue();
      queue.enqueue(note.getId());
      assertThat(queue.awaitIdle(WAIT)).isTrue();

      verify(embeddingProvider, times(2)).generateEmbedding(anyString());
      assertThat(count("embedding.jobs.duplicate")).isZero();
    }

    @Test
    @DisplayName("Should admit notes in enqueue order")
    void shouldAdmitInFifoOrder() throws Exception {
      queue = newQueue(1);
      List<String> seen = Collections.synchronizedList(new ArrayList<>());
      when(embeddingProvider.generateEmbedding(anyString()))
          .thenAnswer(
              invocation -> {
                seen.add(invocation.getArgument(0));
                return vector();
              });
      for (String content : List.of("first", "second", "third")) {
        queue.enqueue(noteStore.add(userId, content, content, List.of()).getId());
      }

      queue.start();

      assertThat(queue.awaitIdle(WAIT)).isTrue();
      assertThat(seen).containsExactly("first", "second", "third");
    }

    @Test
    @DisplayName("Should never run more than five jobs at once")
    void shouldBoundConcurrency() throws Exception {
      AtomicInteger inFlight = new AtomicInteger();
      AtomicInteger maxInFlight = new AtomicInteger();
      AtomicInteger maxReported = new AtomicInteger();
      when(embeddingProvider.generateEmbedding(anyString()))
          .thenAnswer(
              invocation -> {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                maxReported.accumulateAndGet(queue.getStatus().processingCount(), Math::max);
                Thread.sleep(20);
                inFlight.decrementAndGet();
                return vector();
              });
      List<UUID> ids = new ArrayList<>();
      for (int i = 0; i < 15; i++) {
        ids.add(noteStore.add(userId, "n" + i, "content " + i, List.of()).getId());
      }

      queue.start();
      ids.forEach(queue::enqueue);

      assertThat(queue.awaitIdle(WAIT)).isTrue();
      assertThat(maxInFlight.get()).isBetween(1, 5);
      assertThat(maxReported.get()).isBetween(1, 5);
      assertThat(ids)
          .allSatisfy(
              id ->
                  assertThat(noteStore.get(id).getEmbeddingStatus())
                      .isEqualTo(EmbeddingStatus.COMPLETED));
      assertThat(queue.getStatus()).isEqualTo(new EmbeddingQueueStatus(0, 0, 5));
    }

    @Test
    @DisplayName("Should ignore notes enqueued after shutdown")
    void shouldIgnoreEnqueueAfterShutdown() {
      queue.start();
      queue.shutdown();

      queue.enqueue(UUID.randomUUID());

      assertThat(queue.getStatus().queueSize()).isZero();
    }
  }

  @Nested
  @DisplayName("Retry policy")
  class RetryPolicy {

    @Test
    @DisplayName("Should back off 1s, 2s, then 4s by default")
    void shouldUseExponentialBackoff() {
      IntervalFunction backoff = EmbeddingJobQueue.backoff(new VaultConfig.Retry());

      assertThat(backoff.apply(1)).isEqualTo(1000L);
      assertThat(backoff.apply(2)).isEqualTo(2000L);
      assertThat(backoff.apply(3)).isEqualTo(4000L);
    }

    @Test
    @DisplayName("Should allow four attempts by default")
    void shouldAllowFourAttempts() {
      assertThat(
              EmbeddingJobQueue.retryConfig(new VaultConfig.Retry(), () -> true).getMaxAttempts())
          .isEqualTo(4);
    }
  }
}
