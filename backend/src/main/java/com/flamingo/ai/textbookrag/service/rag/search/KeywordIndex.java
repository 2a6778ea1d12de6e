package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ScoredId;
import java.util.List;

/** Lexical relevance ranking over chunk text. */
public interface KeywordIndex {

  /**
   * Replaces the whole index with the given chunks. Concurrent searches see either the previous
   * index or the new one, never a partial build.
   */
  void index(List<Chunk> chunks);

  /** Up to {@code k} chunk ids with positive scores, best first. */
  List<ScoredId> search(String query, int k);

  /** Number of indexed chunks. */
  int size();
}
