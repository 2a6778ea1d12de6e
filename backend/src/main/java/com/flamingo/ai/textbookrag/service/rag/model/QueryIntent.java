package com.flamingo.ai.textbookrag.service.rag.model;

import java.util.Optional;

/** What a query is asking for. */
public enum QueryIntent {
  DEFINITION(ContentType.DEFINITION),
  THEOREM(ContentType.THEOREM),
  FORMULA(ContentType.FORMULA),
  EXAMPLE(ContentType.EXAMPLE),
  EXERCISE(ContentType.EXERCISE),
  CONCEPT(null);

  private final ContentType contentType;

  QueryIntent(ContentType contentType) {
    this.contentType = contentType;
  }

  /** The chunk content type this intent targets, if any. */
  public Optional<ContentType> contentType() {
    return Optional.ofNullable(contentType);
  }
}
