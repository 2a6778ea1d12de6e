package com.flamingo.ai.textbookrag.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;

  /** Detected query intent, lower case; null for plain hybrid retrieval. */
  private String intent;

  private List<SearchResultResponse> results;

  /** Results rendered as a context block for answer generation. */
  private String context;
}
