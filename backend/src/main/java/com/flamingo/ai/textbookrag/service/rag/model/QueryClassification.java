package com.flamingo.ai.textbookrag.service.rag.model;

import java.util.List;

/**
 * Result of classifying a query.
 *
 * @param intent the detected intent
 * @param exampleNumber explicitly named example number, or {@code null}
 * @param exampleRange explicitly named example range, expanded; empty when none
 * @param exerciseNumber explicitly named exercise/question/problem number, or {@code null}
 * @param entityQuery whether the query names a specific numbered item
 */
public record QueryClassification(
    QueryIntent intent,
    String exampleNumber,
    List<String> exampleRange,
    String exerciseNumber,
    boolean entityQuery) {

  public QueryClassification {
    exampleRange = exampleRange == null ? List.of() : List.copyOf(exampleRange);
  }

  public boolean hasExampleRange() {
    return !exampleRange.isEmpty();
  }

  public boolean hasEntity() {
    return exampleNumber != null || exerciseNumber != null || hasExampleRange();
  }
}
