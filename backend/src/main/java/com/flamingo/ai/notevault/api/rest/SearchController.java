package com.flamingo.ai.notevault.api.rest;

import com.flamingo.ai.notevault.api.dto.request.SearchRequest;
import com.flamingo.ai.notevault.api.dto.response.SearchResponse;
import com.flamingo.ai.notevault.config.VaultConfig;
import com.flamingo.ai.notevault.service.search.SemanticSearchResult;
import com.flamingo.ai.notevault.service.search.SemanticSearchService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for semantic search over a user's notes. */
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

  static final String USER_HEADER = "X-User-Id";

  private final SemanticSearchService semanticSearchService;
  private final VaultConfig vaultConfig;

  /** Searches the caller's notes. */
  @PostMapping
  public ResponseEntity<SearchResponse> search(
      @RequestHeader(USER_HEADER) UUID userId, @Valid @RequestBody SearchRequest request) {
    VaultConfig.Search defaults = vaultConfig.getSearch();
    int limit =
        Math.min(
            request.getLimit() != null ? request.getLimit() : defaults.getDefaultLimit(),
            defaults.getMaxLimit());
    double threshold =
        request.getThreshold() != null ? request.getThreshold() : defaults.getDefaultThreshold();

    SemanticSearchResult result =
        semanticSearchService.semanticSearch(
            userId, request.getQuery(), limit, threshold, request.getTags());
    return ResponseEntity.ok(SearchResponse.from(result));
  }
}
