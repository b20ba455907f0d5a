package com.flamingo.ai.notevault.exception;

import java.util.UUID;

/** Exception thrown when a note does not exist or is not visible to the caller. */
public class NoteNotFoundException extends RuntimeException {

  private final UUID noteId;

  public NoteNotFoundException(UUID noteId) {
    super("Note not found: " + noteId);
    this.noteId = noteId;
  }

  public UUID getNoteId() {
    return noteId;
  }
}
