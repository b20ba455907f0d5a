package com.flamingo.ai.notevault.service.note;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.notevault.domain.converter.EmbeddingVectorCodec;
import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import com.flamingo.ai.notevault.domain.repository.NoteRepository;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaNoteStore Tests")
class JpaNoteStoreTest {

  @Mock private NoteRepository noteRepository;

  private JpaNoteStore noteStore;
  private UUID noteId;
  private UUID userId;

  @BeforeEach
  void setUp() {
    noteStore = new JpaNoteStore(noteRepository, new LexicalScorer());
    noteId = UUID.randomUUID();
    userId = UUID.randomUUID();
  }

  @Nested
  @DisplayName("Embedding writes")
  class EmbeddingWrites {

    @Test
    @DisplayName("Should clear the vector when marking failed")
    void shouldClearVectorOnFailed() {
      when(noteRepository.clearEmbedding(noteId, EmbeddingStatus.FAILED)).thenReturn(1);

      noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.FAILED);

      verify(noteRepository).clearEmbedding(noteId, EmbeddingStatus.FAILED);
      verify(noteRepository, never()).updateEmbeddingStatus(any(), any());
    }

    @Test
    @DisplayName("Should clear the vector when resetting to pending")
    void shouldClearVectorOnPending() {
      when(noteRepository.clearEmbedding(noteId, EmbeddingStatus.PENDING)).thenReturn(1);

      noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.PENDING);

      verify(noteRepository).clearEmbedding(noteId, EmbeddingStatus.PENDING);
    }

    @Test
    @DisplayName("Should keep the vector when marking processing")
    void shouldKeepVectorOnProcessing() {
      when(noteRepository.updateEmbeddingStatus(noteId, EmbeddingStatus.PROCESSING)).thenReturn(1);

      noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.PROCESSING);

      verify(noteRepository, never()).clearEmbedding(any(), any());
    }

    @Test
    @DisplayName("Should store the encoded vector as completed")
    void shouldStoreEncodedVector() {
      float[] vector = {0.5f, -0.25f};
      ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
      when(noteRepository.updateEmbedding(
              eq(noteId), bytes.capture(), eq(EmbeddingStatus.COMPLETED)))
          .thenReturn(1);

      noteStore.updateEmbedding(noteId, vector);

      assertThat(EmbeddingVectorCodec.decode(bytes.getValue())).containsExactly(0.5f, -0.25f);
    }

    @Test
    @DisplayName("Should retry on SQLite lock contention")
    void shouldRetryOnLockContention() {
      when(noteRepository.updateEmbeddingStatus(noteId, EmbeddingStatus.PROCESSING))
          .thenThrow(new CannotAcquireLockException("database is locked"))
          .thenReturn(1);

      noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.PROCESSING);

      verify(noteRepository, times(2)).updateEmbeddingStatus(noteId, EmbeddingStatus.PROCESSING);
    }

    @Test
    @DisplayName("Should give up after three lock failures")
    void shouldGiveUpAfterThreeLockFailures() {
      when(noteRepository.clearEmbedding(noteId, EmbeddingStatus.FAILED))
          .thenThrow(new CannotAcquireLockException("database is locked"));

      assertThatThrownBy(() -> noteStore.updateEmbeddingStatus(noteId, EmbeddingStatus.FAILED))
          .isInstanceOf(CannotAcquireLockException.class);
      verify(noteRepository, times(3)).clearEmbedding(noteId, EmbeddingStatus.FAILED);
    }
  }

  @Nested
  @DisplayName("Reads")
  class Reads {

    @Test
    @DisplayName("Should only search completed embeddings")
    void shouldFindSearchableNotes() {
      Note note = Note.builder().id(noteId).userId(userId).title("t").content("c").build();
      when(noteRepository.findByUserIdAndArchivedFalseAndEmbeddingStatus(
              userId, EmbeddingStatus.COMPLETED))
          .thenReturn(List.of(note));

      assertThat(noteStore.findSearchableNotes(userId)).containsExactly(note);
    }

    @Test
    @DisplayName("Should return scored lexical matches")
    void shouldFindLexicalMatches() {
      Note hit =
          Note.builder().id(noteId).userId(userId).title("Tax").content("tax return").build();
      Note miss =
          Note.builder().id(UUID.randomUUID()).userId(userId).title("x").content("other").build();
      when(noteRepository.findByUserIdAndArchivedFalse(userId)).thenReturn(List.of(hit, miss));

      List<LexicalMatch> matches = noteStore.findLexicalMatches(userId, "tax");

      assertThat(matches).extracting(LexicalMatch::note).containsExactly(hit);
      assertThat(matches.get(0).score()).isPositive();
    }

    @Test
    @DisplayName("Should match inflected forms of a query term")
    void shouldMatchStemmedTerms() {
      Note hit =
          Note.builder().id(noteId).userId(userId).title("Tax").content("tax return").build();
      when(noteRepository.findByUserIdAndArchivedFalse(userId)).thenReturn(List.of(hit));

      assertThat(noteStore.findLexicalMatches(userId, "Taxes"))
          .extracting(LexicalMatch::note)
          .containsExactly(hit);
    }

    @Test
    @DisplayName("Should skip the scan for a stop-word query")
    void shouldSkipStopWordQuery() {
      assertThat(noteStore.findLexicalMatches(userId, "the")).isEmpty();
      verify(noteRepository, never()).findByUserIdAndArchivedFalse(any());
    }
  }
}
