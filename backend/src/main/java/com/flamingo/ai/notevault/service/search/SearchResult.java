package com.flamingo.ai.notevault.service.search;

/**
 * One ranked hit.
 *
 * @param note the matching note
 * @param similarity cosine similarity on the semantic path, lexical score on the fallback path
 * @param rank 1-based position in the result list
 */
public record SearchResult(NoteSnapshot note, double similarity, int rank) {}
