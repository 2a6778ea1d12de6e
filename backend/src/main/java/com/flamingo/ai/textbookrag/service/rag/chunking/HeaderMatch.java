package com.flamingo.ai.textbookrag.service.rag.chunking;

/**
 * One header occurrence in page text.
 *
 * @param kind header family
 * @param start offset of the first character of the header line
 * @param end offset just past the matched header text
 * @param label numeric label ("3", "3.1"), or {@code null} when the header carries none
 * @param title heading text following the label, empty when absent
 */
public record HeaderMatch(HeaderKind kind, int start, int end, String label, String title) {}
