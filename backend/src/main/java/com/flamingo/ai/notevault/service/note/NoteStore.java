package com.flamingo.ai.notevault.service.note;

import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persistence operations the embedding pipeline and search rely on. */
public interface NoteStore {

  Optional<Note> findById(UUID noteId);

  /**
   * Sets a note's embedding status. {@link EmbeddingStatus#FAILED} and {@link
   * EmbeddingStatus#PENDING} also clear the stored vector. Unknown ids are ignored.
   */
  void updateEmbeddingStatus(UUID noteId, EmbeddingStatus status);

  /** Stores the vector and marks the note {@link EmbeddingStatus#COMPLETED}. */
  void updateEmbedding(UUID noteId, float[] vector);

  /** Non-archived notes of the user whose embedding is {@link EmbeddingStatus#COMPLETED}. */
  List<Note> findSearchableNotes(UUID userId);

  /**
   * Non-archived notes of the user whose content matches every term of the query, each with its
   * lexical relevance score. Order is unspecified.
   */
  List<LexicalMatch> findLexicalMatches(UUID userId, String query);

  /** Ids of every note the user owns, archived ones included. */
  List<UUID> findNoteIdsByUser(UUID userId);
}
