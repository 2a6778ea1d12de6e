package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * A chunk returned for a query with its fused score and 1-based rank.
 *
 * @param chunk the retrieved chunk
 * @param score fused relevance score
 * @param rank 1-based position in the result list
 */
public record RetrievalResult(Chunk chunk, double score, int rank) {}
