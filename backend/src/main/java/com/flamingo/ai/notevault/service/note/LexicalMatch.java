package com.flamingo.ai.notevault.service.note;

import com.flamingo.ai.notevault.domain.entity.Note;

/** A note matched by full-text search and its relevance score. */
public record LexicalMatch(Note note, double score) {}
