package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ChunkFilter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Process-local {@link ChunkStore}. Chunks are immutable, so reads hand out the stored records. */
@Component
public class InMemoryChunkStore implements ChunkStore {

  private final Map<String, Chunk> chunks = new LinkedHashMap<>();

  @Override
  public synchronized void put(List<Chunk> batch) {
    for (Chunk chunk : batch) {
      chunks.put(chunk.chunkId(), chunk);
    }
  }

  @Override
  public synchronized Optional<Chunk> get(String chunkId) {
    return Optional.ofNullable(chunks.get(chunkId));
  }

  @Override
  public synchronized List<Chunk> filter(ChunkFilter filter) {
    ChunkFilter effective = ChunkFilter.orNone(filter);
    return chunks.values().stream().filter(effective::matches).toList();
  }

  @Override
  public synchronized List<String> deleteByDocument(String documentId) {
    List<String> removed = new ArrayList<>();
    Iterator<Chunk> it = chunks.values().iterator();
    while (it.hasNext()) {
      Chunk chunk = it.next();
      if (documentId.equals(chunk.documentId())) {
        removed.add(chunk.chunkId());
        it.remove();
      }
    }
    return removed;
  }

  @Override
  public synchronized List<Chunk> all() {
    return List.copyOf(chunks.values());
  }

  @Override
  public synchronized int size() {
    return chunks.size();
  }
}
