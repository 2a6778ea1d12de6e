package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ScoredId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-memory BM25 index.
 *
 * <p>Tokens are the lower-cased, whitespace-separated words of the text, for documents and queries
 * alike. Every {@link #index(List)} call builds a fresh snapshot off to the side and swaps it in
 * atomically; searches always run against one complete snapshot.
 *
 * <p>Scoring: {@code score(D,Q) = Σ IDF(q) * f(q,D) * (k1 + 1) / (f(q,D) + k1 * (1 - b + b *
 * |D|/avgdl))} with {@code IDF(q) = ln((N - n(q) + 0.5) / (n(q) + 0.5) + 1)}.
 */
@Slf4j
@Component
public class Bm25KeywordIndex implements KeywordIndex {

  private final double k1;
  private final double b;
  private final AtomicReference<Snapshot> active = new AtomicReference<>(Snapshot.EMPTY);

  @Autowired
  public Bm25KeywordIndex(RagConfig ragConfig) {
    this(ragConfig.getKeyword().getK1(), ragConfig.getKeyword().getB());
  }

  Bm25KeywordIndex(double k1, double b) {
    this.k1 = k1;
    this.b = b;
  }

  /** Immutable index state. */
  private record Snapshot(
      List<String> ids,
      int[] lengths,
      Map<String, Map<Integer, Integer>> postings,
      double avgLength) {

    static final Snapshot EMPTY = new Snapshot(List.of(), new int[0], Map.of(), 0.0);
  }

  static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
        .filter(t -> !t.isEmpty())
        .toList();
  }

  @Override
  public void index(List<Chunk> chunks) {
    List<String> ids = new ArrayList<>(chunks.size());
    int[] lengths = new int[chunks.size()];
    Map<String, Map<Integer, Integer>> postings = new HashMap<>();
    long totalLength = 0;

    for (int doc = 0; doc < chunks.size(); doc++) {
      Chunk chunk = chunks.get(doc);
      List<String> tokens = tokenize(chunk.text());
      ids.add(chunk.chunkId());
      lengths[doc] = tokens.size();
      totalLength += tokens.size();
      for (String token : tokens) {
        postings.computeIfAbsent(token, t -> new HashMap<>()).merge(doc, 1, Integer::sum);
      }
    }

    double avgLength = chunks.isEmpty() ? 0.0 : (double) totalLength / chunks.size();
    active.set(new Snapshot(List.copyOf(ids), lengths, postings, avgLength));
    log.info("Rebuilt keyword index: {} chunks, {} terms", chunks.size(), postings.size());
  }

  @Override
  public List<ScoredId> search(String query, int k) {
    Snapshot snapshot = active.get();
    List<String> terms = tokenize(query);
    if (k <= 0 || terms.isEmpty() || snapshot.ids().isEmpty()) {
      return List.of();
    }

    int n = snapshot.ids().size();
    double[] scores = new double[n];
    for (String term : terms) {
      Map<Integer, Integer> termPostings = snapshot.postings().get(term);
      if (termPostings == null) {
        continue;
      }
      int df = termPostings.size();
      double idf = Math.log((n - df + 0.5) / (df + 0.5) + 1);
      for (Map.Entry<Integer, Integer> posting : termPostings.entrySet()) {
        int doc = posting.getKey();
        int tf = posting.getValue();
        double lengthNorm =
            snapshot.avgLength() == 0
                ? 1.0
                : 1 - b + b * (snapshot.lengths()[doc] / snapshot.avgLength());
        scores[doc] += idf * (tf * (k1 + 1)) / (tf + k1 * lengthNorm);
      }
    }

    List<ScoredId> results = new ArrayList<>();
    for (int doc = 0; doc < n; doc++) {
      if (scores[doc] > 0) {
        results.add(new ScoredId(snapshot.ids().get(doc), scores[doc]));
      }
    }
    // stable sort keeps index order among equal scores
    results.sort((x, y) -> Double.compare(y.score(), x.score()));
    return results.size() > k ? List.copyOf(results.subList(0, k)) : results;
  }

  @Override
  public int size() {
    return active.get().ids().size();
  }
}
