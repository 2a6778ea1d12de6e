package com.flamingo.ai.textbookrag.service.rag.model;

/** Header families that gather a multi-paragraph, possibly multi-page body. */
public enum CollectionKind {
  EXERCISE("Exercise", ContentType.EXERCISE),
  EXAMPLE("Example", ContentType.EXAMPLE),
  MISCELLANEOUS("Miscellaneous Exercise", ContentType.EXERCISE);

  private final String displayName;
  private final ContentType contentType;

  CollectionKind(String displayName, ContentType contentType) {
    this.displayName = displayName;
    this.contentType = contentType;
  }

  public String getDisplayName() {
    return displayName;
  }

  public ContentType getContentType() {
    return contentType;
  }
}
