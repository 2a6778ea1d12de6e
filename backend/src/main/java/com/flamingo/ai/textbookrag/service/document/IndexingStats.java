package com.flamingo.ai.textbookrag.service.document;

/**
 * Outcome of indexing one document.
 *
 * @param documentId the indexed document
 * @param pages pages received
 * @param chunks chunks created
 * @param replaced whether an earlier version of the document was removed
 * @param durationMs wall-clock indexing time
 */
public record IndexingStats(
    String documentId, int pages, int chunks, boolean replaced, long durationMs) {}
