package com.flamingo.ai.notevault.domain.enums;

/** Embedding lifecycle of a note. */
public enum EmbeddingStatus {
  /** Content saved; an embedding has not been generated for it yet. */
  PENDING,

  /** An embedding job is currently working on the note. */
  PROCESSING,

  /** The note carries a vector of the configured dimensions. */
  COMPLETED,

  /** All attempts failed; the note carries no vector. */
  FAILED
}
