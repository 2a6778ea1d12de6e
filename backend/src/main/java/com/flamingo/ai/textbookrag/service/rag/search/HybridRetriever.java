package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.exception.SearchException;
import com.flamingo.ai.textbookrag.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ChunkFilter;
import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.RetrievalResult;
import com.flamingo.ai.textbookrag.service.rag.model.ScoredId;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval combining vector search and BM25 keyword search with weighted Reciprocal Rank
 * Fusion.
 *
 * <p>The vector share of the fused score is {@code rag.retrieval.default-alpha}, lowered to {@code
 * rag.retrieval.entity-alpha} for queries naming a numbered example or exercise, where exact
 * lexical matches matter more than semantic similarity. Both searches fetch {@code k *
 * candidate-multiplier} candidates and run concurrently on the retrieval executor.
 */
@Service
@Slf4j
public class HybridRetriever {

  private static final int RELATED_QUERY_CHARS = 500;

  private final EmbeddingProvider embeddingProvider;
  private final VectorIndex vectorIndex;
  private final KeywordIndex keywordIndex;
  private final ChunkStore chunkStore;
  private final QueryClassifier queryClassifier;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor retrievalExecutor;

  public HybridRetriever(
      EmbeddingProvider embeddingProvider,
      VectorIndex vectorIndex,
      KeywordIndex keywordIndex,
      ChunkStore chunkStore,
      QueryClassifier queryClassifier,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
    this.embeddingProvider = embeddingProvider;
    this.vectorIndex = vectorIndex;
    this.keywordIndex = keywordIndex;
    this.chunkStore = chunkStore;
    this.queryClassifier = queryClassifier;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.retrievalExecutor = retrievalExecutor;
  }

  /**
   * Retrieves the {@code k} best chunks for a query.
   *
   * @param query the search query
   * @param k number of results
   * @param filter metadata constraints; {@code null} or empty for none
   * @return results ordered by fused score, ranks starting at 1
   */
  @Timed(value = "rag.retrieve", description = "Time for hybrid retrieval")
  public List<RetrievalResult> retrieve(String query, int k, ChunkFilter filter) {
    ChunkFilter effective = ChunkFilter.orNone(filter);
    if (k <= 0 || (vectorIndex.size() == 0 && keywordIndex.size() == 0)) {
      return List.of();
    }

    Set<String> allowed = null;
    if (!effective.isEmpty()) {
      allowed =
          chunkStore.filter(effective).stream().map(Chunk::chunkId).collect(Collectors.toSet());
      if (allowed.isEmpty()) {
        log.debug("No chunks match filter {}", effective);
        return List.of();
      }
    }

    double alpha = alphaFor(query);
    long multiplier = ragConfig.getRetrieval().getCandidateMultiplier();
    int candidates = (int) Math.min(Integer.MAX_VALUE, k * multiplier);
    log.debug("Hybrid retrieval: k={}, candidates={}, alpha={}", k, candidates, alpha);

    final Set<String> allowedIds = allowed;
    CompletableFuture<List<ScoredId>> vectorFuture =
        CompletableFuture.supplyAsync(
            () -> vectorSearch(query, candidates, allowedIds), retrievalExecutor);
    CompletableFuture<List<ScoredId>> lexicalFuture =
        CompletableFuture.supplyAsync(
            () -> keywordIndex.search(query, candidates), retrievalExecutor);

    List<ScoredId> vectorResults = await(vectorFuture, "vector search");
    List<ScoredId> lexicalResults = await(lexicalFuture, "keyword search");
    log.debug(
        "Vector: {} candidates, keyword: {} candidates",
        vectorResults.size(),
        lexicalResults.size());

    List<ScoredId> fused =
        ReciprocalRankFusion.fuse(
            vectorResults, lexicalResults, alpha, ragConfig.getRetrieval().getRankConstant());
    if (allowedIds != null) {
      // keyword candidates are ranked over the whole index
      fused = fused.stream().filter(s -> allowedIds.contains(s.chunkId())).toList();
    }

    List<RetrievalResult> results = new ArrayList<>();
    for (ScoredId scored : fused.subList(0, Math.min(k, fused.size()))) {
      Optional<Chunk> chunk = chunkStore.get(scored.chunkId());
      if (chunk.isEmpty()) {
        log.warn("Skipping stale chunk id {} at retrieval", scored.chunkId());
        meterRegistry.counter("rag.retrieve.stale_ids").increment();
        continue;
      }
      results.add(new RetrievalResult(chunk.get(), scored.score(), results.size() + 1));
    }
    log.debug("Hybrid retrieval returned {} results", results.size());
    return results;
  }

  public List<RetrievalResult> retrieveByType(
      String query, ContentType contentType, int k, ChunkFilter filter) {
    return retrieve(query, k, ChunkFilter.orNone(filter).withContentType(contentType));
  }

  public List<RetrievalResult> retrieveByExample(
      String query, String exampleNumber, int k, ChunkFilter filter) {
    return retrieve(query, k, ChunkFilter.orNone(filter).withExampleNumber(exampleNumber));
  }

  public List<RetrievalResult> retrieveFromChapter(
      String query, String classLevel, int chapterNumber, int k) {
    return retrieve(query, k, ChunkFilter.forChapter(classLevel, chapterNumber));
  }

  /**
   * Chunks similar to a given chunk, using the start of its text as the query.
   *
   * @return up to {@code k} results excluding the chunk itself; empty if the id is unknown
   */
  public List<RetrievalResult> relatedChunks(String chunkId, int k) {
    Optional<Chunk> reference = chunkStore.get(chunkId);
    if (reference.isEmpty() || k <= 0) {
      return List.of();
    }
    String text = reference.get().text();
    String query =
        text.length() > RELATED_QUERY_CHARS ? text.substring(0, RELATED_QUERY_CHARS) : text;

    List<RetrievalResult> related = new ArrayList<>();
    int candidates = (int) Math.min(Integer.MAX_VALUE, k + 1L);
    for (RetrievalResult result : retrieve(query, candidates, null)) {
      if (!result.chunk().chunkId().equals(chunkId) && related.size() < k) {
        related.add(new RetrievalResult(result.chunk(), result.score(), related.size() + 1));
      }
    }
    return related;
  }

  /** Vector share of the fused score for this query. */
  double alphaFor(String query) {
    if (queryClassifier.isEntityQuery(query)) {
      log.debug("Entity query, favouring keyword search");
      return ragConfig.getRetrieval().getEntityAlpha();
    }
    return ragConfig.getRetrieval().getDefaultAlpha();
  }

  private List<ScoredId> vectorSearch(String query, int candidates, Set<String> allowedIds) {
    if (vectorIndex.size() == 0) {
      return List.of();
    }
    float[] embedding = embeddingProvider.embed(query);
    return allowedIds == null
        ? vectorIndex.search(embedding, candidates)
        : vectorIndex.searchFiltered(embedding, candidates, allowedIds);
  }

  private static List<ScoredId> await(CompletableFuture<List<ScoredId>> future, String stage) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new SearchException(stage, String.valueOf(cause.getMessage()), cause);
    }
  }
}
