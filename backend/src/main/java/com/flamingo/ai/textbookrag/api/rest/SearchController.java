package com.flamingo.ai.textbookrag.api.rest;

import com.flamingo.ai.textbookrag.api.dto.request.SearchRequest;
import com.flamingo.ai.textbookrag.api.dto.response.SearchResponse;
import com.flamingo.ai.textbookrag.api.dto.response.SearchResultResponse;
import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.model.RetrievalResult;
import com.flamingo.ai.textbookrag.service.rag.search.HybridRetriever;
import com.flamingo.ai.textbookrag.service.rag.search.QueryClassifier;
import com.flamingo.ai.textbookrag.service.rag.search.RetrievalPipeline;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for textbook search. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

  private final RetrievalPipeline retrievalPipeline;
  private final HybridRetriever hybridRetriever;
  private final QueryClassifier queryClassifier;
  private final RagConfig ragConfig;

  /**
   * Intent-aware search. Numbered example lookups, example ranges and typed questions are routed
   * to filtered retrieval; the response carries the results rendered as a context block.
   */
  @PostMapping("/search")
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
    int topK = topK(request);
    String intent =
        queryClassifier.classify(request.getQuery()).intent().name().toLowerCase(Locale.ROOT);
    log.debug("Search '{}' (intent {}, topK {})", request.getQuery(), intent, topK);
    List<RetrievalResult> results =
        retrievalPipeline.search(request.getQuery(), topK, request.toFilter());
    return ResponseEntity.ok(
        SearchResponse.builder()
            .query(request.getQuery())
            .intent(intent)
            .results(results.stream().map(SearchResultResponse::fromResult).toList())
            .context(retrievalPipeline.formatForContext(results))
            .build());
  }

  /** Plain hybrid retrieval without intent routing. */
  @PostMapping("/retrieve")
  public ResponseEntity<SearchResponse> retrieve(@Valid @RequestBody SearchRequest request) {
    List<RetrievalResult> results =
        hybridRetriever.retrieve(request.getQuery(), topK(request), request.toFilter());
    return ResponseEntity.ok(
        SearchResponse.builder()
            .query(request.getQuery())
            .results(results.stream().map(SearchResultResponse::fromResult).toList())
            .context(retrievalPipeline.formatForContext(results))
            .build());
  }

  /** Chunks similar to the given chunk, excluding the chunk itself. */
  @GetMapping("/chunks/{chunkId}/related")
  public ResponseEntity<List<SearchResultResponse>> related(
      @PathVariable String chunkId,
      @RequestParam(defaultValue = "3")
          @Min(value = 1, message = "topK must be at least 1")
          @Max(value = 50, message = "topK must not exceed 50")
          int topK) {
    List<SearchResultResponse> results =
        hybridRetriever.relatedChunks(chunkId, topK).stream()
            .map(SearchResultResponse::fromResult)
            .toList();
    return ResponseEntity.ok(results);
  }

  private int topK(SearchRequest request) {
    return request.getTopK() != null ? request.getTopK() : ragConfig.getRetrieval().getTopK();
  }
}
