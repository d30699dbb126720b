package com.flamingo.ai.knowledge.service.reindex;

import java.util.UUID;

/** Snapshot of a running rebuild. */
public record RebuildProgress(
    UUID knowledgeBaseId, int processed, int indexed, int failed, int total) {}
