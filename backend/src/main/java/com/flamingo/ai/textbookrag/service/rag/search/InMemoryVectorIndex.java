package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.service.rag.model.ScoredId;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link VectorIndex} backed by a LangChain4j {@link InMemoryEmbeddingStore}. */
@Slf4j
@Component
public class InMemoryVectorIndex implements VectorIndex {

  private final InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
  private final Set<String> ids = ConcurrentHashMap.newKeySet();

  @Override
  public synchronized void add(List<float[]> vectors, List<String> chunkIds) {
    if (vectors.size() != chunkIds.size()) {
      throw new IllegalArgumentException(
          "Got " + vectors.size() + " vectors for " + chunkIds.size() + " ids");
    }
    List<String> existing = chunkIds.stream().filter(ids::contains).toList();
    if (!existing.isEmpty()) {
      store.removeAll(existing);
    }
    for (int i = 0; i < vectors.size(); i++) {
      store.add(chunkIds.get(i), Embedding.from(vectors.get(i)));
      ids.add(chunkIds.get(i));
    }
    log.debug("Added {} vectors, index size {}", vectors.size(), ids.size());
  }

  @Override
  public List<ScoredId> search(float[] vector, int k) {
    if (k <= 0 || ids.isEmpty()) {
      return List.of();
    }
    return toScoredIds(query(vector, k));
  }

  @Override
  public List<ScoredId> searchFiltered(float[] vector, int k, Set<String> allowedIds) {
    if (k <= 0 || ids.isEmpty() || allowedIds.isEmpty()) {
      return List.of();
    }
    List<ScoredId> results = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : query(vector, ids.size())) {
      if (allowedIds.contains(match.embeddingId())) {
        results.add(new ScoredId(match.embeddingId(), match.score()));
        if (results.size() == k) {
          break;
        }
      }
    }
    return results;
  }

  @Override
  public synchronized void remove(Collection<String> chunkIds) {
    List<String> present = chunkIds.stream().filter(ids::contains).toList();
    if (present.isEmpty()) {
      return;
    }
    store.removeAll(present);
    present.forEach(ids::remove);
    log.debug("Removed {} vectors, index size {}", present.size(), ids.size());
  }

  @Override
  public int size() {
    return ids.size();
  }

  private List<EmbeddingMatch<TextSegment>> query(float[] vector, int maxResults) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(vector))
            .maxResults(maxResults)
            .minScore(0.0)
            .build();
    return store.search(request).matches();
  }

  private static List<ScoredId> toScoredIds(List<EmbeddingMatch<TextSegment>> matches) {
    return matches.stream().map(m -> new ScoredId(m.embeddingId(), m.score())).toList();
  }
}
