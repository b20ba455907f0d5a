package com.flamingo.ai.notevault.service.search;

import com.flamingo.ai.notevault.domain.entity.Note;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Immutable copy of the note fields a search result exposes. Null tags are dropped. */
public record NoteSnapshot(
    UUID id,
    UUID userId,
    String title,
    String content,
    List<String> tags,
    LocalDateTime createdAt,
    LocalDateTime updatedAt) {

  public static NoteSnapshot from(Note note) {
    return new NoteSnapshot(
        note.getId(),
        note.getUserId(),
        note.getTitle(),
        note.getContent(),
        note.getTags() == null
            ? List.of()
            : note.getTags().stream().filter(Objects::nonNull).toList(),
        note.getCreatedAt(),
        note.getUpdatedAt());
  }
}
