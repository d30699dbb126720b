package com.flamingo.ai.knowledge.service.reindex;

/**
 * Receives rebuild progress. Called from worker threads, so implementations must be thread-safe.
 */
@FunctionalInterface
public interface RebuildProgressListener {

  RebuildProgressListener NONE = progress -> {};

  void onProgress(RebuildProgress progress);
}
