package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.service.rag.model.ScoredId;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/** Nearest-neighbour similarity search over chunk embeddings. */
public interface VectorIndex {

  /** Adds one vector per id; an id already present is replaced. */
  void add(List<float[]> vectors, List<String> ids);

  /** Up to {@code k} ids by descending similarity. */
  List<ScoredId> search(float[] vector, int k);

  /** Like {@link #search(float[], int)} but only considers {@code allowedIds}. */
  List<ScoredId> searchFiltered(float[] vector, int k, Set<String> allowedIds);

  void remove(Collection<String> ids);

  int size();
}
