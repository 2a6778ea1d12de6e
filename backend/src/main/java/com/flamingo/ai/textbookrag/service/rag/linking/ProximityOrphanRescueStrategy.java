package com.flamingo.ai.textbookrag.service.rag.linking;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import com.flamingo.ai.textbookrag.service.rag.model.TextBlock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Places an orphan with the draft containing the text block nearest to it on the page.
 *
 * <p>The nearest block is found by Euclidean distance between bounding-box centres, within {@code
 * rag.linking.proximity.max-distance} PDF units. The orphan goes to the first draft of the group
 * whose text contains that block's text. Orphans without a bounding box, pages without positioned
 * blocks, and blocks that no draft contains fall back to the same-page rule.
 *
 * <p>Active when {@code rag.linking.orphan-strategy=proximity}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rag.linking.orphan-strategy", havingValue = "proximity")
public class ProximityOrphanRescueStrategy implements OrphanRescueStrategy {

  private final RagConfig ragConfig;

  @Override
  public Map<PageMedia, List<ChunkDraft>> place(
      List<ChunkDraft> group, List<PageMedia> orphans, Map<Integer, PageRecord> pages) {
    float maxDistance = ragConfig.getLinking().getProximity().getMaxDistance();
    Map<PageMedia, List<ChunkDraft>> placement = new LinkedHashMap<>();

    for (PageMedia orphan : orphans) {
      TextBlock nearest = nearestBlock(orphan, pages.get(orphan.pageNumber()), maxDistance);
      ChunkDraft owner = nearest == null ? null : owningDraft(group, orphan, nearest);
      if (owner != null) {
        log.debug("Placed orphan {} by proximity to '{}'", orphan.id(), abbreviate(nearest));
        placement.put(orphan, List.of(owner));
      } else {
        placement.put(orphan, SamePageOrphanRescueStrategy.samePage(group, orphan));
      }
    }
    return placement;
  }

  private static TextBlock nearestBlock(PageMedia orphan, PageRecord page, float maxDistance) {
    if (orphan.bbox() == null || page == null) {
      return null;
    }
    TextBlock nearest = null;
    double best = maxDistance;
    for (TextBlock block : page.blocks()) {
      if (block.bbox() == null || block.text().isBlank()) {
        continue;
      }
      double distance = orphan.bbox().centerDistanceTo(block.bbox());
      if (distance <= best) {
        best = distance;
        nearest = block;
      }
    }
    return nearest;
  }

  private static ChunkDraft owningDraft(List<ChunkDraft> group, PageMedia orphan, TextBlock block) {
    String needle = block.text().strip();
    for (ChunkDraft draft : group) {
      if (draft.getPageNumbers().contains(orphan.pageNumber())
          && draft.getText().contains(needle)) {
        return draft;
      }
    }
    return null;
  }

  private static String abbreviate(TextBlock block) {
    String text = block.text().strip();
    return text.length() <= 40 ? text : text.substring(0, 40) + "...";
  }

  @Override
  public String getStrategyName() {
    return "ProximityOrphanRescueStrategy";
  }
}
