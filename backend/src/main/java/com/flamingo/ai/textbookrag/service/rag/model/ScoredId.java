package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * A chunk id with a score from one ranking (vector, lexical, or fused).
 *
 * @param chunkId chunk identifier
 * @param score ranking-specific score, higher is better
 */
public record ScoredId(String chunkId, double score) {}
