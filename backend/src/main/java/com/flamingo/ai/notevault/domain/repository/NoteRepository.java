package com.flamingo.ai.notevault.domain.repository;

import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Note entities. */
@Repository
public interface NoteRepository extends JpaRepository<Note, UUID> {

  /** Finds a user's live notes that have a usable embedding. */
  List<Note> findByUserIdAndArchivedFalseAndEmbeddingStatus(UUID userId, EmbeddingStatus status);

  /** Finds all live notes of a user. */
  List<Note> findByUserIdAndArchivedFalse(UUID userId);

  /** Lists the ids of every note a user owns, archived or not. */
  @Query("SELECT n.id FROM Note n WHERE n.userId = :userId ORDER BY n.createdAt ASC")
  List<UUID> findIdsByUserId(@Param("userId") UUID userId);

  /** Sets the embedding status and leaves the stored vector untouched. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Note n SET n.embeddingStatus = :status WHERE n.id = :id")
  int updateEmbeddingStatus(@Param("id") UUID id, @Param("status") EmbeddingStatus status);

  /** Sets the embedding status and drops the stored vector. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Note n SET n.embeddingStatus = :status, n.embedding = NULL WHERE n.id = :id")
  int clearEmbedding(@Param("id") UUID id, @Param("status") EmbeddingStatus status);

  /** Stores a vector together with its status. Last writer wins. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Note n SET n.embedding = :embedding, n.embeddingStatus = :status WHERE n.id = :id")
  int updateEmbedding(
      @Param("id") UUID id,
      @Param("embedding") byte[] embedding,
      @Param("status") EmbeddingStatus status);
}
