package com.flamingo.ai.notevault.service.note;

import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import com.flamingo.ai.notevault.exception.NoteNotFoundException;
import com.flamingo.ai.notevault.service.embedding.EmbeddingJobQueue;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for whoever writes notes: resets embedding state and schedules regeneration.
 *
 * <p>Every call returns as soon as the notes are queued; embeddings are produced in the
 * background by {@link EmbeddingJobQueue}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteIndexingService {

  private final NoteStore noteStore;
  private final EmbeddingJobQueue embeddingJobQueue;

  /** Call after a note is created or its content changed. */
  public void onContentChanged(UUID noteId) {
    noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.PENDING);
    embeddingJobQueue.enqueue(noteId);
  }

  /**
   * Marks every note of the user pending and queues it.
   *
   * @return number of notes queued
   */
  public int reindexUser(UUID userId) {
    List<UUID> noteIds = noteStore.findNoteIdsByUser(userId);
    for (UUID noteId : noteIds) {
      onContentChanged(noteId);
    }
    log.info("Queued {} note(s) of user {} for reindexing", noteIds.size(), userId);
    return noteIds.size();
  }

  /**
   * Queues a single note after checking that it belongs to the user.
   *
   * @throws NoteNotFoundException if the note does not exist or belongs to someone else
   */
  public void reindexNote(UUID userId, UUID noteId) {
    Note note = noteStore.findById(noteId).orElseThrow(() -> new NoteNotFoundException(noteId));
    if (!userId.equals(note.getUserId())) {
      throw new NoteNotFoundException(noteId);
    }
    onContentChanged(noteId);
    log.info("Queued note {} for reindexing", noteId);
  }
}
