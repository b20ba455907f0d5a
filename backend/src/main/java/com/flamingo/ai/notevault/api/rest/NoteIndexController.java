package com.flamingo.ai.notevault.api.rest;

import com.flamingo.ai.notevault.api.dto.response.ReindexResponse;
import com.flamingo.ai.notevault.service.note.NoteIndexingService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for regenerating note embeddings. */
@RestController
@RequestMapping("/api/v1/notes")
@RequiredArgsConstructor
public class NoteIndexController {

  private final NoteIndexingService noteIndexingService;

  /** Queues every note of the caller for embedding regeneration. */
  @PostMapping("/reindex")
  public ResponseEntity<ReindexResponse> reindexAll(
      @RequestHeader(SearchController.USER_HEADER) UUID userId) {
    int queued = noteIndexingService.reindexUser(userId);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new ReindexResponse("Queued " + queued + " notes for reindexing", queued));
  }

  /** Queues one of the caller's notes for embedding regeneration. */
  @PostMapping("/{noteId}/reindex")
  public ResponseEntity<ReindexResponse> reindexNote(
      @RequestHeader(SearchController.USER_HEADER) UUID userId, @PathVariable UUID noteId) {
    noteIndexingService.reindexNote(userId, noteId);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new ReindexResponse("Note queued for reindexing", 1));
  }
}
