package com.flamingo.ai.knowledge.service.retrieval;

import java.util.List;

/**
 * Outcome of a search.
 *
 * @param staleHitsDropped vector hits discarded because their chunk no longer exists
 */
public record SearchResults(
    SearchStrategy strategy, List<SearchHit> hits, int staleHitsDropped, long tookMillis) {

  public SearchResults {
    hits = List.copyOf(hits);
  }

  public boolean isDegraded() {
    return strategy == SearchStrategy.FALLBACK;
  }
}
