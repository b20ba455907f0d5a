package com.flamingo.ai.notevault.service.search;

import java.util.List;

/** Ranked results of a search together with its metadata. */
public record SemanticSearchResult(List<SearchResult> results, QueryMetadata metadata) {}
