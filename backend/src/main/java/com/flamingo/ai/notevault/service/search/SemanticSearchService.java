package com.flamingo.ai.notevault.service.search;

import com.flamingo.ai.notevault.domain.entity.Note;
import com.flamingo.ai.notevault.exception.EmbeddingDimensionMismatchException;
import com.flamingo.ai.notevault.exception.SearchException;
import com.flamingo.ai.notevault.service.embedding.EmbeddingProvider;
import com.flamingo.ai.notevault.service.embedding.TextPreprocessor;
import com.flamingo.ai.notevault.service.note.LexicalMatch;
import com.flamingo.ai.notevault.service.note.NoteStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ranks a user's notes by embedding similarity to a query, falling back to full-text search when
 * the embedding path fails for any reason.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticSearchService {

  private final EmbeddingProvider embeddingProvider;
  private final NoteStore noteStore;
  private final TextPreprocessor textPreprocessor;
  private final MeterRegistry meterRegistry;

  private record Scored(NoteSnapshot note, double score) {}

  /**
   * Searches the user's non-archived notes.
   *
   * @param userId owner whose notes are searched
   * @param query search text, already validated by the caller
   * @param limit maximum number of results
   * @param threshold minimum cosine similarity on the semantic path; ignored by the fallback
   * @param tags when non-empty, only notes carrying all of these tags are returned
   * @return ranked results and query metadata
   * @throws SearchException only if the lexical fallback fails as well
   */
  @Timed(value = "search.semantic", description = "Time for semantic search")
  public SemanticSearchResult semanticSearch(
      UUID userId, String query, int limit, double threshold, List<String> tags) {
    long start = System.nanoTime();
    List<String> requiredTags = tags == null ? List.of() : tags;

    List<Scored> ranked;
    SearchMode mode;
    try {
      ranked = semanticCandidates(userId, query, threshold, requiredTags);
      mode = SearchMode.SEMANTIC;
    } catch (EmbeddingDimensionMismatchException e) {
      log.warn(
          "Embedding dimensions differ for user {} (expected {}, got {}), "
              + "falling back to lexical search",
          userId,
          e.getExpected(),
          e.getActual());
      ranked = fallback(userId, query, requiredTags);
      mode = SearchMode.LEXICAL;
    } catch (RuntimeException e) {
      log.warn(
          "Semantic search failed for user {}, falling back to lexical search: {}",
          userId,
          e.getMessage());
      ranked = fallback(userId, query, requiredTags);
      mode = SearchMode.LEXICAL;
    }

    List<SearchResult> results = rank(ranked, limit);
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
    meterRegistry.counter("search.requests", "mode", mode.name().toLowerCase()).increment();
    log.debug(
        "{} search for user {} returned {} result(s) in {}ms",
        mode,
        userId,
        results.size(),
        elapsedMs);

    return new SemanticSearchResult(
        results, new QueryMetadata(query, elapsedMs, results.size(), mode));
  }

  private List<Scored> semanticCandidates(
      UUID userId, String query, double threshold, List<String> tags) {
    float[] queryVector = embeddingProvider.generateEmbedding(textPreprocessor.clean(query));

    List<Scored> candidates = new ArrayList<>();
    for (Note note : noteStore.findSearchableNotes(userId)) {
      float[] vector = note.getEmbeddingVector();
      if (vector == null) {
        log.warn("Note {} is marked completed but has no embedding, skipping", note.getId());
        continue;
      }
      double similarity = VectorMath.cosineSimilarity(queryVector, vector);
      if (!Double.isFinite(similarity)) {
        log.debug("Skipping note {} with zero-norm embedding", note.getId());
        continue;
      }
      if (similarity >= threshold && hasAllTags(note, tags)) {
        candidates.add(new Scored(NoteSnapshot.from(note), similarity));
      }
    }
    return candidates;
  }

  private List<Scored> fallback(UUID userId, String query, List<String> tags) {
    meterRegistry.counter("search.fallback").increment();
    return lexicalCandidates(userId, query, tags);
  }

  private List<Scored> lexicalCandidates(UUID userId, String query, List<String> tags) {
    List<LexicalMatch> matches;
    try {
      matches = noteStore.findLexicalMatches(userId, query);
    } catch (RuntimeException e) {
      meterRegistry.counter("search.failures").increment();
      log.error("Lexical fallback failed for user {}: {}", userId, e.getMessage(), e);
      throw new SearchException("Both semantic and lexical search failed", e);
    }

    List<Scored> candidates = new ArrayList<>();
    for (LexicalMatch match : matches) {
      if (hasAllTags(match.note(), tags)) {
        candidates.add(new Scored(NoteSnapshot.from(match.note()), match.score()));
      }
    }
    return candidates;
  }

  private static boolean hasAllTags(Note note, List<String> tags) {
    if (tags.isEmpty()) {
      return true;
    }
    return note.getTags() != null && note.getTags().containsAll(tags);
  }

  private static List<SearchResult> rank(List<Scored> candidates, int limit) {
    // List.sort is stable, so equal scores keep store order
    candidates.sort(Comparator.comparingDouble(Scored::score).reversed());
    int size = Math.min(Math.max(limit, 0), candidates.size());
    List<SearchResult> results = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      Scored scored = candidates.get(i);
      results.add(new SearchResult(scored.note(), scored.score(), i + 1));
    }
    return results;
  }
}
