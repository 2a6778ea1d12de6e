package com.flamingo.ai.textbookrag.api.dto.response;

import com.flamingo.ai.textbookrag.service.rag.model.RetrievalResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one ranked search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultResponse {

  private int rank;
  private double score;
  private ChunkResponse chunk;

  public static SearchResultResponse fromResult(RetrievalResult result) {
    return SearchResultResponse.builder()
        .rank(result.rank())
        .score(result.score())
        .chunk(ChunkResponse.fromChunk(result.chunk()))
        .build();
  }
}
