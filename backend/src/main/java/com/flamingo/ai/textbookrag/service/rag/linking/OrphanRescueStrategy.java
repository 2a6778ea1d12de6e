package com.flamingo.ai.textbookrag.service.rag.linking;

import com.flamingo.ai.textbookrag.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import java.util.List;
import java.util.Map;

/**
 * Strategy for placing media that no chunk in a group cites explicitly.
 *
 * <p>Implementations decide, per orphan, which drafts of the group it belongs to. An orphan mapped
 * to an empty list (or absent from the result) is dropped by the caller.
 */
public interface OrphanRescueStrategy {

  /**
   * Chooses the drafts each orphan should be attached to.
   *
   * @param group drafts assembled from the same buffer, in text order
   * @param orphans media from the buffer's pages left unclaimed by explicit references
   * @param pages page records the buffer drew from, by page number
   * @return target drafts per orphan
   */
  Map<PageMedia, List<ChunkDraft>> place(
      List<ChunkDraft> group, List<PageMedia> orphans, Map<Integer, PageRecord> pages);

  /**
   * Returns a human-readable name of this strategy for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();
}
