package com.flamingo.ai.textbookrag.service.rag.search;

import static com.flamingo.ai.textbookrag.service.rag.search.TestChunks.chunk;
import static com.flamingo.ai.textbookrag.service.rag.search.TestChunks.example;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ChunkFilter;
import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.RetrievalResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HybridRetriever Tests")
class HybridRetrieverTest {

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private InMemoryVectorIndex vectorIndex;
  private Bm25KeywordIndex keywordIndex;
  private InMemoryChunkStore chunkStore;
  private AtomicInteger embedCalls;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    vectorIndex = new InMemoryVectorIndex();
    keywordIndex = new Bm25KeywordIndex(ragConfig);
    chunkStore = new InMemoryChunkStore();
    embedCalls = new AtomicInteger();
  }

  private HybridRetriever retriever(EmbeddingProvider embeddingProvider) {
    return new HybridRetriever(
        embeddingProvider,
        vectorIndex,
        keywordIndex,
        chunkStore,
        new QueryClassifier(ragConfig),
        ragConfig,
        meterRegistry,
        Runnable::run);
  }

  private HybridRetriever retriever() {
    EmbeddingProvider embedder = TestChunks.wordCountEmbedder();
    return retriever(
        text -> {
          embedCalls.incrementAndGet();
          return embedder.embed(text);
        });
  }

  private void index(Chunk... chunks) {
    EmbeddingProvider embedder = TestChunks.wordCountEmbedder();
    List<Chunk> batch = List.of(chunks);
    vectorIndex.add(
        batch.stream().map(c -> embedder.embed(c.text())).toList(),
        batch.stream().map(Chunk::chunkId).toList());
    chunkStore.put(batch);
    keywordIndex.index(chunkStore.all());
  }

  private void indexCorpus() {
    index(
        chunk("lim", ContentType.TEXT, "The limit of a function describes its behaviour"),
        chunk("der", ContentType.DEFINITION, "Definition: the derivative is the limit of ratios"),
        chunk("int", ContentType.TEXT, "The integral sums infinitely many small parts"),
        example("ex1", "1", "Example 1 find the derivative of x squared"),
        example("ex2", "2", "Example 2 evaluate the integral of x"));
  }

  private static List<String> ids(List<RetrievalResult> results) {
    return results.stream().map(r -> r.chunk().chunkId()).toList();
  }

  @Nested
  @DisplayName("retrieve")
  class Retrieve {

    @Test
    @DisplayName("should return best matching chunks with sequential ranks")
    void shouldReturnBestMatches_withSequentialRanks() {
      indexCorpus();

      List<RetrievalResult> results = retriever().retrieve("integral", 3, null);

      assertThat(results).hasSize(3);
      assertThat(ids(results).subList(0, 2)).containsExactlyInAnyOrder("int", "ex2");
      assertThat(results).extracting(RetrievalResult::rank).containsExactly(1, 2, 3);
      assertThat(results)
          .extracting(RetrievalResult::score)
          .isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    @DisplayName("should return nothing when both indexes are empty")
    void shouldReturnNothing_whenIndexesEmpty() {
      assertThat(retriever().retrieve("integral", 5, null)).isEmpty();
      assertThat(embedCalls.get()).isZero();
    }

    @Test
    @DisplayName("should return nothing for non-positive k")
    void shouldReturnNothing_forNonPositiveK() {
      indexCorpus();

      assertThat(retriever().retrieve("integral", 0, null)).isEmpty();
    }

    @Test
    @DisplayName("should only return chunks matching the filter")
    void shouldHonourFilter() {
      indexCorpus();

      List<RetrievalResult> results =
          retriever()
              .retrieve("integral", 5, ChunkFilter.none().withContentType(ContentType.EXAMPLE));

      assertThat(ids(results)).containsExactly("ex2", "ex1");
    }

    @Test
    @DisplayName("should return nothing when no chunk matches the filter")
    void shouldReturnNothing_whenFilterMatchesNothing() {
      indexCorpus();

      List<RetrievalResult> results =
          retriever().retrieve("integral", 5, ChunkFilter.forChapter("12", 9));

      assertThat(results).isEmpty();
      assertThat(embedCalls.get()).isZero();
    }

    @Test
    @DisplayName("should skip ids missing from the chunk store and count them")
    void shouldSkipStaleIds() {
      indexCorpus();
      index(chunk("gone", ContentType.TEXT, "integral integral integral"));
      chunkStore.deleteByDocument("maths-12");
      chunkStore.put(List.of(chunk("int", ContentType.TEXT, "The integral sums parts")));

      List<RetrievalResult> results = retriever().retrieve("integral", 3, null);

      assertThat(ids(results)).containsExactly("int");
      assertThat(results.get(0).rank()).isEqualTo(1);
      assertThat(meterRegistry.counter("rag.retrieve.stale_ids").count()).isPositive();
    }

    @Test
    @DisplayName("should propagate embedding failures")
    void shouldPropagateEmbeddingFailures() {
      indexCorpus();
      HybridRetriever failing =
          retriever(
              text -> {
                throw new IllegalStateException("embedding service down");
              });

      assertThatThrownBy(() -> failing.retrieve("integral", 3, null))
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("embedding service down");
    }

    @Test
    @DisplayName("should rethrow errors from a search unchanged")
    void shouldRethrowErrors_unchanged() {
      indexCorpus();
      HybridRetriever failing =
          retriever(
              text -> {
                throw new StackOverflowError("deep recursion");
              });

      assertThatThrownBy(() -> failing.retrieve("integral", 3, null))
          .isExactlyInstanceOf(StackOverflowError.class)
          .hasMessage("deep recursion");
    }
  }

  @Nested
  @DisplayName("alpha")
  class Alpha {

    @Test
    @DisplayName("should favour keyword search for numbered items")
    void shouldFavourKeywords_forEntityQueries() {
      HybridRetriever retriever = retriever();

      assertThat(retriever.alphaFor("Example 5")).isEqualTo(0.3);
      assertThat(retriever.alphaFor("exercise 2.1 question 3")).isEqualTo(0.3);
      assertThat(retriever.alphaFor("explain limits")).isEqualTo(0.7);
    }
  }

  @Nested
  @DisplayName("filtered helpers")
  class FilteredHelpers {

    @Test
    @DisplayName("should restrict to one example number")
    void shouldRestrictToExampleNumber() {
      indexCorpus();

      List<RetrievalResult> results = retriever().retrieveByExample("example", "2", 5, null);

      assertThat(ids(results)).containsExactly("ex2");
    }

    @Test
    @DisplayName("should restrict to one content type")
    void shouldRestrictToContentType() {
      indexCorpus();

      List<RetrievalResult> results =
          retriever().retrieveByType("derivative", ContentType.DEFINITION, 5, null);

      assertThat(ids(results)).containsExactly("der");
    }

    @Test
    @DisplayName("should restrict to one chapter")
    void shouldRestrictToChapter() {
      indexCorpus();

      assertThat(retriever().retrieveFromChapter("limit", "12", 1, 10)).hasSize(5);
      assertThat(retriever().retrieveFromChapter("limit", "11", 1, 10)).isEmpty();
    }

    @Test
    @DisplayName("should find related chunks excluding the chunk itself")
    void shouldFindRelatedChunks_excludingSelf() {
      indexCorpus();

      List<RetrievalResult> related = retriever().relatedChunks("int", 2);

      assertThat(related).hasSize(2);
      assertThat(ids(related)).doesNotContain("int");
      assertThat(related).extracting(RetrievalResult::rank).containsExactly(1, 2);
      assertThat(retriever().relatedChunks("unknown", 2)).isEmpty();
    }

    @Test
    @DisplayName("should return every other chunk when k is the largest int")
    void shouldReturnAllOtherChunks_whenKIsIntegerMax() {
      indexCorpus();

      List<RetrievalResult> related = retriever().relatedChunks("int", Integer.MAX_VALUE);

      assertThat(ids(related)).hasSize(4).doesNotContain("int");
      assertThat(retriever().relatedChunks("int", 0)).isEmpty();
    }
  }
}
