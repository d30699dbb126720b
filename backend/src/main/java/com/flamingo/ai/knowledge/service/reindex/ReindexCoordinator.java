package com.flamingo.ai.knowledge.service.reindex;

import com.flamingo.ai.knowledge.config.RetrievalConfig;
import com.flamingo.ai.knowledge.domain.model.KnowledgeBaseSettings;
import com.flamingo.ai.knowledge.elasticsearch.DistanceMetric;
import com.flamingo.ai.knowledge.elasticsearch.VectorRecord;
import com.flamingo.ai.knowledge.elasticsearch.VectorStore;
import com.flamingo.ai.knowledge.exception.ChunkProcessingException;
import com.flamingo.ai.knowledge.exception.ConfigException;
import com.flamingo.ai.knowledge.exception.KnowledgeBaseNotFoundException;
import com.flamingo.ai.knowledge.service.embedding.EmbeddingClient;
import com.flamingo.ai.knowledge.service.support.BoundedCalls;
import com.flamingo.ai.knowledge.store.ChunkContext;
import com.flamingo.ai.knowledge.store.ChunkStore;
import com.flamingo.ai.knowledge.store.DocumentInfo;
import com.flamingo.ai.knowledge.store.KnowledgeBaseInfo;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Re-embeds and re-upserts every chunk of a knowledge base.
 *
 * <p>Chunks are enumerated in a stable order (documents by creation, chunks by order index) and
 * processed on the shared reindex pool with a per-rebuild concurrency cap. A chunk that fails is
 * recorded and skipped. Upserts are keyed by chunk id, so re-running a rebuild converges to one
 * vector per chunk. After a clean, uncancelled pass, vectors whose chunk no longer exists are
 * removed.
 */
@Service
@Slf4j
public class ReindexCoordinator {

  private final ChunkStore chunkStore;
  private final EmbeddingClient embeddingClient;
  private final VectorStore vectorStore;
  private final BoundedCalls boundedCalls;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;
  private final Executor reindexExecutor;

  public ReindexCoordinator(
      ChunkStore chunkStore,
      EmbeddingClient embeddingClient,
      VectorStore vectorStore,
      BoundedCalls boundedCalls,
      RetrievalConfig retrievalConfig,
      MeterRegistry meterRegistry,
      @Qualifier("reindexExecutor") Executor reindexExecutor) {
    this.chunkStore = chunkStore;
    this.embeddingClient = embeddingClient;
    this.vectorStore = vectorStore;
    this.boundedCalls = boundedCalls;
    this.retrievalConfig = retrievalConfig;
    this.meterRegistry = meterRegistry;
    this.reindexExecutor = reindexExecutor;
  }

  /** Rebuilds without progress reporting or cancellation. */
  public RebuildReport rebuild(UUID knowledgeBaseId) {
    return rebuild(knowledgeBaseId, RebuildProgressListener.NONE, () -> false);
  }

  /**
   * Rebuilds the vectors of a knowledge base.
   *
   * @param listener receives progress every configured number of chunks and at the end
   * @param cancelled checked before each chunk starts; chunks already running complete
   * @throws KnowledgeBaseNotFoundException if the knowledge base does not exist
   * @throws ConfigException if the settings or the tenant collection are inconsistent
   */
  @Timed(value = "reindex.rebuild", description = "Time to rebuild a knowledge base")
  public RebuildReport rebuild(
      UUID knowledgeBaseId, RebuildProgressListener listener, BooleanSupplier cancelled) {
    long started = System.nanoTime();
    KnowledgeBaseInfo knowledgeBase =
        boundedCalls
            .call(BoundedCalls.CHUNK_STORE, () -> chunkStore.findKnowledgeBase(knowledgeBaseId))
            .orElseThrow(() -> new KnowledgeBaseNotFoundException(knowledgeBaseId));
    KnowledgeBaseSettings settings = knowledgeBase.settings();
    checkEmbeddingSettings(settings);

    List<ChunkContext> chunks = enumerateChunks(knowledgeBaseId);
    int total = chunks.size();
    log.info(
        "Rebuilding knowledge base {} (tenant {}, version {}): {} chunks with {}",
        knowledgeBaseId,
        knowledgeBase.tenantId(),
        knowledgeBase.settingsVersion(),
        total,
        settings.embeddingModel());

    if (total > 0) {
      boundedCalls.run(
          BoundedCalls.VECTOR_STORE,
          () ->
              vectorStore.ensureCollection(
                  knowledgeBase.tenantId(),
                  settings.embeddingDimensions(),
                  DistanceMetric.COSINE));
    }

    Tracker tracker =
        new Tracker(
            knowledgeBaseId,
            total,
            Math.max(1, retrievalConfig.getReindex().getProgressInterval()),
            listener);
    Semaphore permits = new Semaphore(Math.max(1, retrievalConfig.getReindex().getConcurrency()));
    List<CompletableFuture<Void>> inFlight = new ArrayList<>();
    boolean stopped = false;

    for (int position = 0; position < total && !stopped; position++) {
      if (cancelled.getAsBoolean()) {
        stopped = true;
        tracker.skip(total - position);
        break;
      }
      try {
        permits.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        stopped = true;
        tracker.skip(total - position);
        break;
      }
      if (cancelled.getAsBoolean()) {
        permits.release();
        stopped = true;
        tracker.skip(total - position);
        break;
      }

      ChunkContext chunk = chunks.get(position);
      int order = position;
      try {
        inFlight.add(
            CompletableFuture.runAsync(
                () -> {
                  try {
                    if (cancelled.getAsBoolean()) {
                      tracker.skip(1);
                      return;
                    }
                    indexChunk(knowledgeBase, chunk);
                    tracker.indexed();
                  } catch (RuntimeException e) {
                    tracker.failed(order, chunk.chunkId(), e);
                  } finally {
                    permits.release();
                  }
                },
                reindexExecutor));
      } catch (RejectedExecutionException e) {
        permits.release();
        tracker.failed(order, chunk.chunkId(), e);
      }
    }
    CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();

    boolean wasCancelled = stopped || tracker.skipped() > 0;
    long orphansRemoved = 0;
    if (!wasCancelled && tracker.failedCount() == 0) {
      orphansRemoved = sweepOrphans(knowledgeBase, chunks);
    }

    RebuildReport report =
        new RebuildReport(
            knowledgeBaseId,
            tracker.indexedCount(),
            total,
            tracker.failedChunkIds(),
            tracker.failureReasons(),
            tracker.skipped(),
            wasCancelled,
            orphansRemoved,
            Duration.ofNanos(System.nanoTime() - started));
    tracker.reportEnd();

    meterRegistry.counter("reindex.chunks.indexed").increment(report.indexed());
    meterRegistry.counter("reindex.chunks.failed").increment(report.failedChunkIds().size());
    log.info(
        "Rebuild of knowledge base {} finished: {}/{} indexed, {} failed, {} skipped{}, "
            + "{} orphans removed in {} ms",
        knowledgeBaseId,
        report.indexed(),
        total,
        report.failedChunkIds().size(),
        report.skipped(),
        wasCancelled ? " (cancelled)" : "",
        orphansRemoved,
        report.duration().toMillis());
    return report;
  }

  private void indexChunk(KnowledgeBaseInfo knowledgeBase, ChunkContext chunk) {
    KnowledgeBaseSettings settings = knowledgeBase.settings();
    try {
      float[] vector =
          boundedCalls.call(
              BoundedCalls.EMBEDDING,
              () -> embeddingClient.embed(chunk.content(), settings.embeddingModel()));
      EmbeddingClient.requireDimensions(
          vector, settings.embeddingDimensions(), settings.embeddingModel());

      VectorRecord record =
          VectorRecord.builder()
              .chunkId(chunk.chunkId())
              .documentId(chunk.documentId())
              .knowledgeBaseId(chunk.knowledgeBaseId())
              .content(chunk.content())
              .orderIndex(chunk.orderIndex())
              .charCount(chunk.characterCount())
              .tokenCount(chunk.tokenCount())
              .metadata(new LinkedHashMap<>(chunk.metadata()))
              .vector(vector)
              .build();
      boundedCalls.run(
          BoundedCalls.VECTOR_STORE,
          () -> vectorStore.upsert(knowledgeBase.tenantId(), List.of(record)));
    } catch (ChunkProcessingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ChunkProcessingException(
          chunk.chunkId(), "Failed to index chunk " + chunk.chunkId() + ": " + e.getMessage(), e);
    }
  }

  private List<ChunkContext> enumerateChunks(UUID knowledgeBaseId) {
    List<DocumentInfo> documents =
        boundedCalls.call(
            BoundedCalls.CHUNK_STORE, () -> chunkStore.listDocuments(knowledgeBaseId));
    List<ChunkContext> chunks = new ArrayList<>();
    for (DocumentInfo document : documents) {
      chunks.addAll(
          boundedCalls.call(
              BoundedCalls.CHUNK_STORE, () -> chunkStore.listChunksByDocument(document.id())));
    }
    return chunks;
  }

  private long sweepOrphans(KnowledgeBaseInfo knowledgeBase, List<ChunkContext> chunks) {
    Set<UUID> live = new HashSet<>();
    for (ChunkContext chunk : chunks) {
      live.add(chunk.chunkId());
    }
    try {
      return boundedCalls.call(
          BoundedCalls.VECTOR_STORE,
          () -> vectorStore.retainOnly(knowledgeBase.tenantId(), knowledgeBase.id(), live));
    } catch (RuntimeException e) {
      log.warn(
          "Orphan sweep for knowledge base {} failed, stale vectors remain: {}",
          knowledgeBase.id(),
          e.getMessage());
      meterRegistry.counter("reindex.orphan_sweep.failures").increment();
      return 0L;
    }
  }

  private void checkEmbeddingSettings(KnowledgeBaseSettings settings) {
    if (settings.embeddingDimensions() <= 0) {
      throw new ConfigException(
          "embedding dimensions must be positive, was " + settings.embeddingDimensions());
    }
    OptionalInt known = embeddingClient.dimensions(settings.embeddingModel());
    if (known.isPresent() && known.getAsInt() != settings.embeddingDimensions()) {
      throw new ConfigException(
          "Model "
              + settings.embeddingModel()
              + " produces "
              + known.getAsInt()
              + " dimensions but the knowledge base is configured for "
              + settings.embeddingDimensions());
    }
  }

  /** Thread-safe counters of one rebuild. */
  private static final class Tracker {

    private final UUID knowledgeBaseId;
    private final int total;
    private final int interval;
    private final RebuildProgressListener listener;
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger indexed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final ConcurrentSkipListMap<Integer, Failure> failures = new ConcurrentSkipListMap<>();

    private Tracker(
        UUID knowledgeBaseId, int total, int interval, RebuildProgressListener listener) {
      this.knowledgeBaseId = knowledgeBaseId;
      this.total = total;
      this.interval = interval;
      this.listener = listener;
    }

    void indexed() {
      indexed.incrementAndGet();
      completed();
    }

    void failed(int position, UUID chunkId, Exception error) {
      log.warn(
          "Chunk {} of knowledge base {} failed: {}", chunkId, knowledgeBaseId, error.getMessage());
      failures.put(position, new Failure(chunkId, error.getMessage()));
      completed();
    }

    void skip(int count) {
      skipped.addAndGet(count);
    }

    int indexedCount() {
      return indexed.get();
    }

    int failedCount() {
      return failures.size();
    }

    int skipped() {
      return skipped.get();
    }

    List<UUID> failedChunkIds() {
      return failures.values().stream().map(Failure::chunkId).toList();
    }

    Map<UUID, String> failureReasons() {
      Map<UUID, String> reasons = new LinkedHashMap<>();
      for (Failure failure : failures.values()) {
        reasons.put(failure.chunkId(), String.valueOf(failure.reason()));
      }
      return reasons;
    }

    void reportEnd() {
      int done = processed.get();
      if (done == 0 || done % interval != 0) {
        publish(done);
      }
    }

    private void completed() {
      int done = processed.incrementAndGet();
      if (done % interval == 0) {
        log.info(
            "Rebuild {}: {}/{} chunks processed ({} failed)",
            knowledgeBaseId,
            done,
            total,
            failures.size());
        publish(done);
      }
    }

    private void publish(int done) {
      try {
        listener.onProgress(
            new RebuildProgress(knowledgeBaseId, done, indexed.get(), failures.size(), total));
      } catch (RuntimeException e) {
        log.warn("Rebuild progress listener failed: {}", e.getMessage());
      }
    }

    private record Failure(UUID chunkId, String reason) {}
  }
}
