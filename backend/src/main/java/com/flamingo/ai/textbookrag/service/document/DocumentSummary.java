package com.flamingo.ai.textbookrag.service.document;

import java.util.List;

/**
 * An indexed document as seen through its chunks.
 *
 * @param documentId document id
 * @param classLevel class level of the book
 * @param totalChunks number of stored chunks
 * @param chapters distinct chapter numbers, ascending
 */
public record DocumentSummary(
    String documentId, String classLevel, int totalChunks, List<Integer> chapters) {}
