package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import com.flamingo.ai.knowledge.elasticsearch.VectorFilter;
import com.flamingo.ai.knowledge.elasticsearch.VectorHit;
import com.flamingo.ai.knowledge.elasticsearch.VectorStore;
import com.flamingo.ai.knowledge.exception.BackendUnavailableException;
import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.exception.RetrievalFailedException;
import com.flamingo.ai.knowledge.service.embedding.EmbeddingClient;
import com.flamingo.ai.knowledge.service.support.BoundedCalls;
import com.flamingo.ai.knowledge.service.usage.UsageService;
import com.flamingo.ai.knowledge.store.ChunkContext;
import com.flamingo.ai.knowledge.store.ChunkStore;
import com.flamingo.ai.knowledge.store.KnowledgeBaseInfo;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Answers semantic searches over a tenant's knowledge bases.
 *
 * <p>A search embeds the query, runs a filtered kNN search on the tenant index and joins the hits
 * with their chunk, document and knowledge base rows. When the embedding backend or the vector
 * store fails, the same knowledge-base scope is searched with a term-frequency text search over
 * the relational store instead; those results carry a fixed score and {@link
 * SearchStrategy#FALLBACK}. Each successful search appends one usage record.
 *
 * <p>Configuration errors are never answered by the fallback.
 */
@Service
@Slf4j
public class RetrievalService {

  private final EmbeddingClient embeddingClient;
  private final VectorStore vectorStore;
  private final ChunkStore chunkStore;
  private final UsageService usageService;
  private final LexicalScorer lexicalScorer;
  private final BoundedCalls boundedCalls;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;
  private final AsyncTaskExecutor retrievalExecutor;

  public RetrievalService(
      EmbeddingClient embeddingClient,
      VectorStore vectorStore,
      ChunkStore chunkStore,
      UsageService usageService,
      LexicalScorer lexicalScorer,
      BoundedCalls boundedCalls,
      RetrievalConfig retrievalConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalExecutor") AsyncTaskExecutor retrievalExecutor) {
    this.embeddingClient = embeddingClient;
    this.vectorStore = vectorStore;
    this.chunkStore = chunkStore;
    this.usageService = usageService;
    this.lexicalScorer = lexicalScorer;
    this.boundedCalls = boundedCalls;
    this.retrievalConfig = retrievalConfig;
    this.meterRegistry = meterRegistry;
    this.retrievalExecutor = retrievalExecutor;
  }

  /**
   * Runs {@link #search} on the retrieval pool. Cancelling the returned future with interruption
   * cancels the backend call in progress.
   */
  public Future<SearchResults> submit(SearchRequest request) {
    validate(request);
    return retrievalExecutor.submit(() -> search(request));
  }

  /**
   * Searches the tenant's knowledge bases.
   *
   * @throws IllegalArgumentException if the request is malformed
   * @throws ConfigException if the knowledge bases in scope cannot be searched together
   * @throws RetrievalFailedException if neither the vector path nor the fallback succeeded
   * @throws CancellationException if the calling thread was interrupted
   */
  @Timed(value = "retrieval.search", description = "Time to answer a search")
  public SearchResults search(SearchRequest request) {
    validate(request);
    long started = System.nanoTime();

    Scope scope = resolveScope(request);
    SearchResults results;
    if (scope.knowledgeBases().isEmpty()) {
      log.debug("Tenant {} has no knowledge base in scope", request.tenantId());
      results = new SearchResults(SearchStrategy.VECTOR, List.of(), 0, elapsedMillis(started));
    } else {
      results = execute(request, scope, started);
    }

    recordUsage(request.tenantId());
    meterRegistry
        .counter("retrieval.search.completed", "strategy", results.strategy().name())
        .increment();
    log.info(
        "Search for tenant {} returned {} hits via {} in {} ms",
        request.tenantId(),
        results.hits().size(),
        results.strategy(),
        results.tookMillis());
    return results;
  }

  private SearchResults execute(SearchRequest request, Scope scope, long started) {
    List<VectorHit> vectorHits = null;
    RuntimeException vectorFailure = null;
    try {
      vectorHits = vectorSearch(request, scope);
    } catch (ConfigException | CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      vectorFailure = e;
    }

    if (vectorFailure == null) {
      try {
        return enrich(request, scope, vectorHits, started);
      } catch (CancellationException e) {
        throw e;
      } catch (RuntimeException e) {
        throw failed(request, "Could not load chunks for vector hits", e);
      }
    }

    log.warn(
        "Vector search unavailable for tenant {}, falling back to text search: {}",
        request.tenantId(),
        vectorFailure.getMessage());
    meterRegistry
        .counter("retrieval.search.fallback", "cause", vectorFailure.getClass().getSimpleName())
        .increment();
    try {
      return fallbackSearch(request, scope, started);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      e.addSuppressed(vectorFailure);
      throw failed(request, "Vector search and text fallback both failed", e);
    }
  }

  private List<VectorHit> vectorSearch(SearchRequest request, Scope scope) {
    if (!vectorStore.isAvailable()) {
      throw new BackendUnavailableException("Vector store is degraded");
    }
    float[] queryVector =
        boundedCalls.call(
            BoundedCalls.EMBEDDING, () -> embeddingClient.embed(request.query(), scope.model()));
    EmbeddingClient.requireDimensions(queryVector, scope.dimensions(), scope.model());

    return boundedCalls.call(
        BoundedCalls.VECTOR_STORE,
        () ->
            vectorStore.search(
                request.tenantId(),
                queryVector,
                scope.limit(),
                scope.threshold(),
                scope.filter()));
  }

  private SearchResults enrich(
      SearchRequest request, Scope scope, List<VectorHit> vectorHits, long started) {
    if (vectorHits.isEmpty()) {
      return new SearchResults(SearchStrategy.VECTOR, List.of(), 0, elapsedMillis(started));
    }
    List<UUID> chunkIds = vectorHits.stream().map(VectorHit::chunkId).toList();
    Map<UUID, ChunkContext> rows = new HashMap<>();
    for (ChunkContext row :
        boundedCalls.call(
            BoundedCalls.CHUNK_STORE, () -> chunkStore.findChunks(request.tenantId(), chunkIds))) {
      rows.put(row.chunkId(), row);
    }

    List<SearchHit> hits = new ArrayList<>();
    int stale = 0;
    for (VectorHit vectorHit : vectorHits) {
      ChunkContext row = rows.get(vectorHit.chunkId());
      if (row == null || !scope.filter().accepts(row.knowledgeBaseId())) {
        stale++;
        continue;
      }
      if (hits.size() < scope.limit()) {
        hits.add(SearchHit.of(row, vectorHit.score(), request.includeContent()));
      }
    }
    if (stale > 0) {
      log.warn(
          "Dropped {} stale vector hits for tenant {}; a rebuild will remove them",
          stale,
          request.tenantId());
      meterRegistry.counter("retrieval.search.stale_hits").increment(stale);
    }
    return new SearchResults(SearchStrategy.VECTOR, hits, stale, elapsedMillis(started));
  }

  private SearchResults fallbackSearch(SearchRequest request, Scope scope, long started) {
    RetrievalConfig.Search settings = retrievalConfig.getSearch();
    List<String> terms = lexicalScorer.terms(request.query(), settings.getMaxQueryTerms());
    if (terms.isEmpty()) {
      return new SearchResults(SearchStrategy.FALLBACK, List.of(), 0, elapsedMillis(started));
    }
    int candidateLimit = scope.limit() * Math.max(1, settings.getFallbackCandidateMultiplier());
    List<ChunkContext> candidates =
        boundedCalls.call(
            BoundedCalls.CHUNK_STORE,
            () ->
                chunkStore.searchText(
                    request.tenantId(), scope.knowledgeBaseIds(), terms, candidateLimit));
    List<ChunkContext> eligible =
        candidates.stream()
            .filter(chunk -> request.tenantId().equals(chunk.tenantId()))
            .filter(chunk -> scope.filter().accepts(chunk.knowledgeBaseId()))
            .toList();

    List<SearchHit> hits =
        lexicalScorer.rank(terms, eligible).stream()
            .limit(scope.limit())
            .map(
                scored ->
                    SearchHit.of(
                        scored.chunk(), settings.getFallbackScore(), request.includeContent()))
            .toList();
    return new SearchResults(SearchStrategy.FALLBACK, hits, 0, elapsedMillis(started));
  }

  private Scope resolveScope(SearchRequest request) {
    List<KnowledgeBaseInfo> owned;
    try {
      owned =
          boundedCalls.call(
              BoundedCalls.CHUNK_STORE, () -> chunkStore.listKnowledgeBases(request.tenantId()));
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw failed(request, "Could not load knowledge bases", e);
    }

    List<KnowledgeBaseInfo> eligible = owned;
    if (request.scopedToKnowledgeBases()) {
      Set<UUID> requested = new HashSet<>(request.knowledgeBaseIds());
      eligible = owned.stream().filter(kb -> requested.contains(kb.id())).toList();
      if (eligible.size() < requested.size()) {
        log.debug(
            "Ignoring {} knowledge base ids not owned by tenant {}",
            requested.size() - eligible.size(),
            request.tenantId());
      }
    }

    Set<UUID> knowledgeBaseIds =
        request.scopedToKnowledgeBases()
            ? eligible.stream().map(KnowledgeBaseInfo::id).collect(Collectors.toSet())
            : Set.of();
    VectorFilter filter = VectorFilter.forKnowledgeBases(knowledgeBaseIds);

    if (eligible.isEmpty()) {
      return new Scope(eligible, knowledgeBaseIds, filter, null, 0, 0, 0.0);
    }

    Set<String> models = new LinkedHashSet<>();
    for (KnowledgeBaseInfo kb : eligible) {
      models.add(kb.settings().embeddingModel() + "/" + kb.settings().embeddingDimensions());
    }
    if (models.size() > 1) {
      throw new ConfigException(
          "Knowledge bases in scope use different embedding models " + models
              + "; search them separately");
    }
    KnowledgeBaseSettings settings = eligible.get(0).settings();
    KnowledgeBaseSettings single = eligible.size() == 1 ? settings : null;

    RetrievalConfig.Search defaults = retrievalConfig.getSearch();
    int limit =
        request.limit() != null
            ? request.limit()
            : single != null ? single.maxResults() : defaults.getDefaultLimit();
    double threshold =
        request.threshold() != null
            ? request.threshold()
            : single != null ? single.similarityThreshold() : defaults.getDefaultThreshold();

    return new Scope(
        eligible,
        knowledgeBaseIds,
        filter,
        settings.embeddingModel(),
        settings.embeddingDimensions(),
        Math.min(limit, defaults.getMaxLimit()),
        threshold);
  }

  private void validate(SearchRequest request) {
    if (request == null || request.query() == null || request.query().isBlank()) {
      throw new IllegalArgumentException("query must not be blank");
    }
    if (request.tenantId() == null) {
      throw new IllegalArgumentException("tenantId is required");
    }
    int maxLimit = retrievalConfig.getSearch().getMaxLimit();
    if (request.limit() != null && (request.limit() < 1 || request.limit() > maxLimit)) {
      throw new IllegalArgumentException("limit must be within [1, " + maxLimit + "]");
    }
    if (request.threshold() != null && (request.threshold() < 0.0 || request.threshold() > 1.0)) {
      throw new IllegalArgumentException("threshold must be within [0, 1]");
    }
  }

  private void recordUsage(UUID tenantId) {
    try {
      boundedCalls.run(BoundedCalls.CHUNK_STORE, () -> usageService.recordRetrieval(tenantId));
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to record retrieval usage for tenant {}: {}", tenantId, e.getMessage(), e);
      meterRegistry.counter("usage.record.failures").increment();
    }
  }

  private RetrievalFailedException failed(SearchRequest request, String message, Throwable cause) {
    log.error("Search failed for tenant {}: {}", request.tenantId(), message, cause);
    meterRegistry.counter("retrieval.search.failed").increment();
    return new RetrievalFailedException(message + ": " + cause.getMessage(), cause);
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }

  /** Knowledge bases and search parameters resolved for one request. */
  private record Scope(
      List<KnowledgeBaseInfo> knowledgeBases,
      Set<UUID> knowledgeBaseIds,
      VectorFilter filter,
      String model,
      int dimensions,
      int limit,
      double threshold) {}
}
