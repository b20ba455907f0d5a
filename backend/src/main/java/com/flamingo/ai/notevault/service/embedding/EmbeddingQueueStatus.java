package com.flamingo.ai.notevault.service.embedding;

/**
 * Read-only snapshot of the embedding queue.
 *
 * @param queueSize notes waiting for a free slot
 * @param processingCount notes with a job in flight
 * @param maxConcurrent upper bound on {@code processingCount}
 */
public record EmbeddingQueueStatus(int queueSize, int processingCount, int maxConcurrent) {}
