package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * A delimited LaTeX equation found in chunk text.
 *
 * @param equationId position-based id within the chunk ({@code eq_1}, {@code eq_2}, ...)
 * @param latex equation body without delimiters
 * @param originalText the matched text including delimiters
 * @param inline whether it used inline delimiters
 * @param multiline whether the body spans several lines
 */
public record EquationData(
    String equationId, String latex, String originalText, boolean inline, boolean multiline) {}
