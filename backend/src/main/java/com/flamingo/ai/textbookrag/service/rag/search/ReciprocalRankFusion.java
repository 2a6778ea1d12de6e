package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.service.rag.model.ScoredId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted reciprocal-rank fusion of a vector ranking and a lexical ranking.
 *
 * <p>Each list contributes {@code weight / (rankConstant + rank)} per id, with 1-based ranks, the
 * vector list weighted by {@code alpha} and the lexical list by {@code 1 - alpha}. An id missing
 * from a list gets nothing from it. The input scores are ignored; only positions matter.
 *
 * <p>The output is sorted by fused score, descending. Ties keep first-seen order, vector list
 * first, so the same inputs always produce the same ranking.
 */
public final class ReciprocalRankFusion {

  private ReciprocalRankFusion() {}

  public static List<ScoredId> fuse(
      List<ScoredId> vector, List<ScoredId> lexical, double alpha, int rankConstant) {
    Map<String, Double> fused = new LinkedHashMap<>();
    accumulate(fused, vector, alpha, rankConstant);
    accumulate(fused, lexical, 1.0 - alpha, rankConstant);

    List<ScoredId> ranked = new ArrayList<>(fused.size());
    fused.forEach((id, score) -> ranked.add(new ScoredId(id, score)));
    ranked.sort((x, y) -> Double.compare(y.score(), x.score()));
    return ranked;
  }

  private static void accumulate(
      Map<String, Double> fused, List<ScoredId> ranking, double weight, int rankConstant) {
    for (int i = 0; i < ranking.size(); i++) {
      double contribution = weight / (rankConstant + i + 1);
      fused.merge(ranking.get(i).chunkId(), contribution, Double::sum);
    }
  }
}
