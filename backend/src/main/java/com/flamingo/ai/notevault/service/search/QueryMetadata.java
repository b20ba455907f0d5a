package com.flamingo.ai.notevault.service.search;

/** Facts about a single search call. */
public record QueryMetadata(
    String query, long processingTimeMs, int totalResults, SearchMode searchMode) {}
