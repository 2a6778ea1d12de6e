package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ChunkFilter;
import java.util.List;
import java.util.Optional;

/** Storage for chunk records, keyed by chunk id. */
public interface ChunkStore {

  void put(List<Chunk> chunks);

  Optional<Chunk> get(String chunkId);

  /** Chunks matching every non-null field of the filter, in insertion order. */
  List<Chunk> filter(ChunkFilter filter);

  /**
   * Removes every chunk of a document.
   *
   * @return ids of the removed chunks
   */
  List<String> deleteByDocument(String documentId);

  /** All chunks in insertion order. */
  List<Chunk> all();

  int size();
}
