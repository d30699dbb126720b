package com.flamingo.ai.knowledge.config;

import com.flamingo.ai.knowledge.domain.enums.ChunkingStrategy;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for chunking, embedding, search and reindexing. */
@Configuration
@ConfigurationProperties(prefix = "retrieval")
@Getter
@Setter
public class RetrievalConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Search search = new Search();
  private Reindex reindex = new Reindex();
  private VectorStore vectorStore = new VectorStore();

  /** Defaults applied to knowledge bases created without explicit chunking settings. */
  @Getter
  @Setter
  public static class Chunking {
    private ChunkingStrategy strategy = ChunkingStrategy.RECURSIVE;
    private int size = 1000;
    private int overlap = 100;
  }

  @Getter
  @Setter
  public static class Embedding {
    private String defaultModel = "text-embedding-3-small";

    /** Known models and their vector dimensions. */
    private Map<String, Integer> models =
        new LinkedHashMap<>(
            Map.of(
                "text-embedding-3-small", 1536,
                "text-embedding-3-large", 3072,
                "text-embedding-ada-002", 1536));

    /** Maximum number of chunk texts sent in one embedding request. */
    private int batchSize = 32;

    /** Texts longer than this are truncated before embedding. */
    private int maxInputChars = 8000;
  }

  @Getter
  @Setter
  public static class Search {
    private int defaultLimit = 10;
    private double defaultThreshold = 0.7;
    private int maxLimit = 100;

    /** Score assigned to every hit of the text fallback. */
    private double fallbackScore = 0.5;

    /** Fallback fetches {@code limit * candidateMultiplier} rows before ranking them. */
    private int fallbackCandidateMultiplier = 5;

    /**
     * Upper bound on the rows one query term may match in the text fallback. Matches beyond it
     * are never considered, whatever their term frequency.
     */
    private int fallbackScanLimit = 1000;

    private int maxQueryTerms = 8;
  }

  @Getter
  @Setter
  public static class Reindex {
    private int concurrency = 4;
    private int progressInterval = 50;
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** Prefix of the per-tenant index name. */
    private String collectionPrefix = "org_";

    private long reconnectIntervalMs = 30_000L;

    /** kNN candidates per requested hit. */
    private int numCandidatesMultiplier = 10;
  }
}
