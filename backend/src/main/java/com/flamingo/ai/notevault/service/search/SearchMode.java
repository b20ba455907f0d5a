package com.flamingo.ai.notevault.service.search;

/** Which retrieval path produced a search result set. */
public enum SearchMode {
  SEMANTIC,
  LEXICAL
}
