package com.flamingo.ai.notevault.domain.entity;

import com.flamingo.ai.notevault.domain.converter.EmbeddingVectorCodec;
import com.flamingo.ai.notevault.domain.converter.StringListConverter;
import com.flamingo.ai.notevault.domain.enums.EmbeddingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A user's note together with its embedding state. */
@Entity
@Table(name = "notes")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Note {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> tags = new ArrayList<>();

  @Column(nullable = false)
  @Builder.Default
  private boolean archived = false;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private EmbeddingStatus embeddingStatus = EmbeddingStatus.PENDING;

  /** Embedding vector as little-endian float32 values; see {@link EmbeddingVectorCodec}. */
  @Column(columnDefinition = "BLOB")
  private byte[] embedding;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Decoded embedding vector, or {@code null} when the note has none. */
  public float[] getEmbeddingVector() {
    return EmbeddingVectorCodec.decode(embedding);
  }

  public void setEmbeddingVector(float[] vector) {
    this.embedding = EmbeddingVectorCodec.encode(vector);
  }
}
