package com.flamingo.ai.textbookrag.service.document;

import java.util.Map;

/**
 * Sizes of the stores behind retrieval.
 *
 * @param documents indexed documents
 * @param chunks stored chunks
 * @param vectors vectors in the vector index
 * @param keywordEntries chunks in the keyword index
 * @param chunksByType stored chunks per content type value
 */
public record IndexStats(
    int documents, int chunks, int vectors, int keywordEntries, Map<String, Long> chunksByType) {}
