package com.flamingo.ai.notevault.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.notevault.service.search.NoteSnapshot;
import com.flamingo.ai.notevault.service.search.SearchMode;
import com.flamingo.ai.notevault.service.search.SemanticSearchResult;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SearchResponse {

  private List<Hit> results;
  private Metadata queryMetadata;

  /** Creates a SearchResponse from a search result. */
  public static SearchResponse from(SemanticSearchResult result) {
    return SearchResponse.builder()
        .results(
            result.results().stream()
                .map(r -> new Hit(NoteView.from(r.note()), r.similarity(), r.rank()))
                .toList())
        .queryMetadata(
            new Metadata(
                result.metadata().query(),
                result.metadata().processingTimeMs(),
                result.metadata().totalResults(),
                result.metadata().searchMode()))
        .build();
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Hit(NoteView note, double similarity, int rank) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record NoteView(
      UUID id,
      UUID userId,
      String title,
      String content,
      List<String> tags,
      LocalDateTime createdAt,
      LocalDateTime updatedAt) {

    static NoteView from(NoteSnapshot note) {
      return new NoteView(
          note.id(),
          note.userId(),
          note.title(),
          note.content(),
          note.tags(),
          note.createdAt(),
          note.updatedAt());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Metadata(
      String query, long processingTimeMs, int totalResults, SearchMode searchMode) {}
}
