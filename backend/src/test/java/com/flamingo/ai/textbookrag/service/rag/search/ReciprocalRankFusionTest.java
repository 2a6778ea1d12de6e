package com.flamingo.ai.textbookrag.service.rag.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.textbookrag.service.rag.model.ScoredId;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReciprocalRankFusion Tests")
class ReciprocalRankFusionTest {

  private static ScoredId id(String chunkId, double score) {
    return new ScoredId(chunkId, score);
  }

  @Test
  @DisplayName("should reward ids found by both rankings")
  void shouldRewardIdsFoundByBoth() {
    List<ScoredId> fused =
        ReciprocalRankFusion.fuse(
            List.of(id("a", 0.9), id("b", 0.8)), List.of(id("b", 12.0), id("c", 3.0)), 0.5, 60);

    assertThat(fused).extracting(ScoredId::chunkId).containsExactly("b", "a", "c");
    assertThat(fused.get(0).score()).isCloseTo(0.5 / 62 + 0.5 / 61, within(1e-12));
    assertThat(fused.get(1).score()).isCloseTo(0.5 / 61, within(1e-12));
    assertThat(fused.get(2).score()).isCloseTo(0.5 / 62, within(1e-12));
  }

  @Test
  @DisplayName("should weight rankings by alpha")
  void shouldWeightByAlpha() {
    List<ScoredId> fused =
        ReciprocalRankFusion.fuse(List.of(id("a", 1)), List.of(id("b", 1)), 0.3, 60);

    assertThat(fused).extracting(ScoredId::chunkId).containsExactly("b", "a");
    assertThat(fused.get(0).score()).isCloseTo(0.7 / 61, within(1e-12));
  }

  @Test
  @DisplayName("should ignore input scores and use positions only")
  void shouldIgnoreInputScores() {
    List<ScoredId> fused =
        ReciprocalRankFusion.fuse(
            List.of(id("a", 0.01), id("b", 100.0)), List.of(), 1.0, 60);

    assertThat(fused).extracting(ScoredId::chunkId).containsExactly("a", "b");
  }

  @Test
  @DisplayName("should keep first-seen order for equal scores, vector first")
  void shouldKeepFirstSeenOrder_forTies() {
    List<ScoredId> fused =
        ReciprocalRankFusion.fuse(List.of(id("v", 1)), List.of(id("k", 1)), 0.5, 60);

    assertThat(fused).extracting(ScoredId::chunkId).containsExactly("v", "k");
  }

  @Test
  @DisplayName("should return empty list for empty inputs")
  void shouldReturnEmpty_forEmptyInputs() {
    assertThat(ReciprocalRankFusion.fuse(List.of(), List.of(), 0.7, 60)).isEmpty();
  }
}
