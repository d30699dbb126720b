package com.flamingo.ai.knowledge.elasticsearch;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A chunk vector and its payload, keyed by chunk id in the tenant index. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorRecord {

  private UUID chunkId;
  private UUID documentId;
  private UUID knowledgeBaseId;
  private String content;
  private int orderIndex;
  private int charCount;
  private int tokenCount;
  @Builder.Default private Map<String, Object> metadata = new HashMap<>();
  private float[] vector;

  public String getId() {
    return chunkId.toString();
  }
}
