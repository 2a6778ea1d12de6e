package com.flamingo.ai.textbookrag.api.dto.response;

import com.flamingo.ai.textbookrag.service.document.IndexingStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed indexing run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingResponse {

  private String documentId;
  private int pages;
  private int chunks;
  private boolean replaced;
  private long durationMs;

  public static IndexingResponse fromStats(IndexingStats stats) {
    return IndexingResponse.builder()
        .documentId(stats.documentId())
        .pages(stats.pages())
        .chunks(stats.chunks())
        .replaced(stats.replaced())
        .durationMs(stats.durationMs())
        .build();
  }
}
