package com.flamingo.ai.notevault.service.embedding;

/** Read-only snapshot of the embedding provider for health reporting. */
public record EmbeddingProviderStatus(boolean initialized, String modelId, int dimensions) {}
