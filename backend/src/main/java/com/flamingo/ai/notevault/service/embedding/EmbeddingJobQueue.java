package com.flamingo.ai.notevault.service.embedding;

import com.flamingo.ai.notevault.config.VaultConfig;
import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import com.flamingo.ai.notevault.exception.NoteNotFoundException;
import com.flamingo.ai.notevault.service.note.NoteStore;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Bounded-concurrency queue that generates and stores note embeddings in the background.
 *
 * <p>A single driver thread admits note ids in FIFO order, one per free slot of a semaphore sized
 * to {@code maxConcurrent}, and hands each to an independent job. A job marks the note {@link
 * EmbeddingStatus#PROCESSING}, cleans its content, asks the {@link EmbeddingProvider} for a
 * vector and stores it as {@link EmbeddingStatus#COMPLETED}. Failed attempts are retried with
 * exponential backoff; once attempts are exhausted the note is marked {@link
 * EmbeddingStatus#FAILED} and its vector is cleared.
 *
 * <p>A note id is held in at most one of the pending queue and the active set, and is never
 * admitted twice while it is in either. The pending queue is unbounded and lives in memory only.
 *
 * <p>Retries are timed on the retry scheduler. Once that scheduler is shut down a failed attempt
 * is final, so the job still reaches {@link EmbeddingStatus#FAILED} and frees its slot.
 */
@Slf4j
public class EmbeddingJobQueue {

  static final String RETRY_NAME = "embedding-job";

  private final NoteStore noteStore;
  private final EmbeddingProvider embeddingProvider;
  private final TextPreprocessor textPreprocessor;
  private final Executor jobExecutor;
  private final ScheduledExecutorService retryScheduler;
  private final MeterRegistry meterRegistry;
  private final Retry retry;
  private final int maxConcurrent;
  private final int maxAttempts;
  private final long shutdownTimeoutMs;

  private final BlockingQueue<UUID> pending = new LinkedBlockingQueue<>();
  private final Set<UUID> active = ConcurrentHashMap.newKeySet();
  // pending + active, so the membership check on enqueue is a single atomic add
  private final Set<UUID> tracked = ConcurrentHashMap.newKeySet();
  private final Semaphore slots;
  private final Object idleMonitor = new Object();

  private volatile boolean running;
  private volatile boolean stopped;
  private ExecutorService driver;

  public EmbeddingJobQueue(
      NoteStore noteStore,
      EmbeddingProvider embeddingProvider,
      TextPreprocessor textPreprocessor,
      VaultConfig vaultConfig,
      Executor jobExecutor,
      ScheduledExecutorService retryScheduler,
      MeterRegistry meterRegistry) {
    this.noteStore = noteStore;
    this.embeddingProvider = embeddingProvider;
    this.textPreprocessor = textPreprocessor;
    this.jobExecutor = jobExecutor;
    this.retryScheduler = retryScheduler;
    this.meterRegistry = meterRegistry;
    this.maxConcurrent = vaultConfig.getQueue().getMaxConcurrent();
    this.maxAttempts = vaultConfig.getRetry().getMaxAttempts();
    this.shutdownTimeoutMs = vaultConfig.getQueue().getShutdownTimeoutMs();
    this.slots = new Semaphore(maxConcurrent);
    // owned by this queue, not shared through a registry
    this.retry =
        Retry.of(RETRY_NAME, retryConfig(vaultConfig.getRetry(), this::retriesAvailable));
    this.retry
        .getEventPublisher()
        .onRetry(
            event -> {
              meterRegistry.counter("embedding.jobs.retried").increment();
              log.debug(
                  "Retrying embedding job in {}ms (retry {})",
                  event.getWaitInterval().toMillis(),
                  event.getNumberOfRetryAttempts());
            });

    meterRegistry.gauge("embedding.queue.size", pending, Collection::size);
    meterRegistry.gauge("embedding.queue.active", active, Collection::size);
  }

  /** Starts the driver thread. Notes enqueued before this call are processed once it runs. */
  public synchronized void start() {
    if (running || stopped) {
      return;
    }
    running = true;
    driver = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("embed-driver-"));
    driver.execute(this::drive);
    log.info(
        "Embedding queue started (max concurrent: {}, attempts: {})", maxConcurrent, maxAttempts);
  }

  /**
   * Stops admitting new jobs and waits a bounded time for in-flight ones to reach a terminal
   * state. Pending ids are dropped.
   */
  public synchronized void shutdown() {
    if (!running) {
      stopped = true;
      return;
    }
    running = false;
    stopped = true;
    driver.shutdownNow();
    try {
      if (!driver.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
        log.warn("Embedding queue driver did not stop within {}ms", shutdownTimeoutMs);
      }
      if (!awaitCondition(active::isEmpty, Duration.ofMillis(shutdownTimeoutMs))) {
        log.warn("Embedding queue stopped with {} job(s) still in flight", active.size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (!pending.isEmpty()) {
      log.warn("Embedding queue stopped with {} pending note(s) left unprocessed", pending.size());
    }
    log.info("Embedding queue stopped");
  }

  /**
   * Schedules embedding generation for a note. Returns immediately; the outcome is only visible
   * through the note's embedding status. A note that is already waiting or being processed is
   * left alone.
   *
   * @param noteId the note to embed
   */
  public void enqueue(UUID noteId) {
    if (stopped) {
      log.warn("Embedding queue is stopped, ignoring note {}", noteId);
      return;
    }
    if (!tracked.add(noteId)) {
      meterRegistry.counter("embedding.jobs.duplicate").increment();
      log.info("Note {} already in queue or processing", noteId);
      return;
    }
    pending.add(noteId);
    log.info("Enqueued note {} for embedding. Queue size: {}", noteId, pending.size());
  }

  public EmbeddingQueueStatus getStatus() {
    return new EmbeddingQueueStatus(pending.size(), active.size(), maxConcurrent);
  }

  /**
   * Blocks until nothing is pending or in flight.
   *
   * @param timeout how long to wait at most
   * @return whether the queue became idle within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    return awaitCondition(tracked::isEmpty, timeout);
  }

  private void drive() {
    while (running) {
      UUID noteId;
      try {
        slots.acquire();
        try {
          noteId = pending.take();
        } catch (InterruptedException e) {
          slots.release();
          throw e;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      active.add(noteId);
      launch(new Job(noteId));
    }
    log.debug("Embedding queue driver exiting");
  }

  private void launch(Job job) {
    log.info(
        "Processing embedding for note {}. Concurrent: {}/{}",
        job.noteId,
        active.size(),
        maxConcurrent);
    CompletionStage<Void> outcome;
    try {
      outcome = retry.executeCompletionStage(retryScheduler, () -> attemptAsync(job));
    } catch (RuntimeException e) {
      outcome = CompletableFuture.failedFuture(e);
    }
    outcome.whenComplete((ignored, error) -> complete(job, error));
  }

  private CompletionStage<Void> attemptAsync(Job job) {
    try {
      return CompletableFuture.runAsync(() -> attempt(job), jobExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private void attempt(Job job) {
    int attempt = job.attempts.incrementAndGet();
    UUID noteId = job.noteId;
    try {
      noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.PROCESSING);
      Note note = noteStore.findById(noteId).orElseThrow(() -> new NoteNotFoundException(noteId));
      String text = textPreprocessor.clean(note.getContent());
      float[] vector = embeddingProvider.generateEmbedding(text);
      noteStore.updateEmbedding(noteId, vector);
    } catch (NoteNotFoundException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Embedding attempt {}/{} for note {} failed: {}",
          attempt,
          maxAttempts,
          noteId,
          e.getMessage());
      throw e;
    }
  }

  private void complete(Job job, Throwable error) {
    UUID noteId = job.noteId;
    try {
      if (error == null) {
        meterRegistry.counter("embedding.jobs.completed").increment();
        log.info("Embedding generated for note {} after {} attempt(s)", noteId, job.attempts.get());
        return;
      }
      Throwable cause = unwrap(error);
      if (cause instanceof NoteNotFoundException) {
        log.error("Note {} not found, marking embedding as failed", noteId);
      } else if (job.attempts.get() < maxAttempts && !retriesAvailable()) {
        log.error(
            "Embedding failed for note {} and the retry scheduler is shut down: {}",
            noteId,
            cause.getMessage());
      } else {
        log.error(
            "Embedding permanently failed for note {} after {} attempt(s): {}",
            noteId,
            job.attempts.get(),
            cause.getMessage());
      }
      meterRegistry.counter("embedding.jobs.failed").increment();
      markFailed(noteId);
    } finally {
      release(noteId);
    }
  }

  private void markFailed(UUID noteId) {
    try {
      noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.FAILED);
    } catch (RuntimeException e) {
      log.error("Failed to mark note {} as failed: {}", noteId, e.getMessage(), e);
    }
  }

  private void release(UUID noteId) {
    active.remove(noteId);
    slots.release();
    tracked.remove(noteId);
    synchronized (idleMonitor) {
      idleMonitor.notifyAll();
    }
    log.info("Finished processing note {}. Remaining in queue: {}", noteId, pending.size());
  }

  private boolean awaitCondition(BooleanSupplier condition, Duration timeout)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (idleMonitor) {
      while (!condition.getAsBoolean()) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          return false;
        }
        idleMonitor.wait(remainingMs);
      }
      return true;
    }
  }

  private boolean retriesAvailable() {
    return !retryScheduler.isShutdown();
  }

  /**
   * Retry policy for embedding jobs.
   *
   * @param retriesAvailable checked before each retry; a failure is final when it is false
   */
  @VisibleForTesting
  static RetryConfig retryConfig(VaultConfig.Retry config, BooleanSupplier retriesAvailable) {
    return RetryConfig.custom()
        .maxAttempts(Math.max(1, config.getMaxAttempts()))
        .intervalFunction(backoff(config))
        .retryOnException(
            error ->
                !(unwrap(error) instanceof NoteNotFoundException)
                    && retriesAvailable.getAsBoolean())
        .build();
  }

  /** Delay before retry {@code n} (1-based) is {@code initialBackoff * multiplier^(n-1)}. */
  @VisibleForTesting
  static IntervalFunction backoff(VaultConfig.Retry config) {
    return IntervalFunction.ofExponentialBackoff(
        Math.max(1L, config.getInitialBackoffMs()), Math.max(1.0, config.getMultiplier()));
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static final class Job {
    private final UUID noteId;
    private final AtomicInteger attempts = new AtomicInteger();

    private Job(UUID noteId) {
      this.noteId = noteId;
    }
  }
}
