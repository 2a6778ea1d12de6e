package com.flamingo.ai.textbookrag.service.rag.linking;

import com.flamingo.ai.textbookrag.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Attaches an orphan to every draft of the group whose recorded page equals the orphan's page. No
 * geometry is used. When no draft starts on that page, as with a figure-only page inside a
 * multi-page exercise, the orphan goes to the last draft starting before it whose span covers it.
 *
 * <p>Active when {@code rag.linking.orphan-strategy=same-page} (default).
 */
@Component
@ConditionalOnProperty(
    name = "rag.linking.orphan-strategy",
    havingValue = "same-page",
    matchIfMissing = true)
public class SamePageOrphanRescueStrategy implements OrphanRescueStrategy {

  @Override
  public Map<PageMedia, List<ChunkDraft>> place(
      List<ChunkDraft> group, List<PageMedia> orphans, Map<Integer, PageRecord> pages) {
    Map<PageMedia, List<ChunkDraft>> placement = new LinkedHashMap<>();
    for (PageMedia orphan : orphans) {
      placement.put(orphan, samePage(group, orphan));
    }
    return placement;
  }

  static List<ChunkDraft> samePage(List<ChunkDraft> group, PageMedia orphan) {
    List<ChunkDraft> matches =
        group.stream().filter(d -> d.getPageNumber() == orphan.pageNumber()).toList();
    if (!matches.isEmpty()) {
      return matches;
    }
    ChunkDraft covering = null;
    for (ChunkDraft draft : group) {
      if (draft.getPageNumber() < orphan.pageNumber()
          && draft.getPageNumbers().contains(orphan.pageNumber())) {
        covering = draft;
      }
    }
    return covering == null ? List.of() : List.of(covering);
  }

  @Override
  public String getStrategyName() {
    return "SamePageOrphanRescueStrategy";
  }
}
