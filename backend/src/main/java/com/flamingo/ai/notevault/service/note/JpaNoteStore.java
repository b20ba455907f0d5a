package com.flamingo.ai.notevault.service.note;

import com.flamingo.ai.notevault.domain.converter.EmbeddingVectorCodec;
import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import com.flamingo.ai.notevault.domain.repository.NoteRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link NoteStore} on Spring Data JPA.
 *
 * <p>Embedding writes are targeted updates keyed by id, so concurrent writers for the same note
 * resolve as last-writer-wins. SQLite allows a single writer at a time, so writes are retried a
 * few times on lock contention.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaNoteStore implements NoteStore {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final NoteRepository noteRepository;
  private final LexicalScorer lexicalScorer;

  @Override
  @Transactional(readOnly = true)
  public Optional<Note> findById(UUID noteId) {
    return noteRepository.findById(noteId);
  }

  @Override
  public void updateEmbeddingStatus(UUID noteId, EmbeddingStatus status) {
    int updated =
        withLockRetry(
            noteId,
            () ->
                status == EmbeddingStatus.FAILED || status == EmbeddingStatus.PENDING
                    ? noteRepository.clearEmbedding(noteId, status)
                    : noteRepository.updateEmbeddingStatus(noteId, status));
    if (updated == 0) {
      log.debug("No note {} to set embedding status {}", noteId, status);
    } else {
      log.debug("Note {} embedding status -> {}", noteId, status);
    }
  }

  @Override
  public void updateEmbedding(UUID noteId, float[] vector) {
    byte[] encoded = EmbeddingVectorCodec.encode(vector);
    int updated =
        withLockRetry(
            noteId,
            () -> noteRepository.updateEmbedding(noteId, encoded, EmbeddingStatus.COMPLETED));
    if (updated == 0) {
      log.debug("No note {} to store embedding for", noteId);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<Note> findSearchableNotes(UUID userId) {
    return noteRepository.findByUserIdAndArchivedFalseAndEmbeddingStatus(
        userId, EmbeddingStatus.COMPLETED);
  }

  @Override
  @Transactional(readOnly = true)
  public List<LexicalMatch> findLexicalMatches(UUID userId, String query) {
    if (lexicalScorer.queryTerms(query).isEmpty()) {
      log.debug("Query has no searchable terms: '{}'", query);
      return List.of();
    }
    List<LexicalMatch> matches =
        lexicalScorer.match(noteRepository.findByUserIdAndArchivedFalse(userId), query);
    log.debug("Lexical match for user {}: {} note(s)", userId, matches.size());
    return matches;
  }

  @Override
  @Transactional(readOnly = true)
  public List<UUID> findNoteIdsByUser(UUID userId) {
    return noteRepository.findIdsByUserId(userId);
  }

  private <T> T withLockRetry(UUID noteId, Supplier<T> write) {
    for (int attempt = 1; ; attempt++) {
      try {
        return write.get();
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update note {} after {} retries", noteId, MAX_RETRIES);
          throw e;
        }
        log.warn("SQLite lock contention on note {}, retry {}/{}", noteId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }
}
