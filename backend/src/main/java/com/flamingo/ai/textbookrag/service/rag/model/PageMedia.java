package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * Common view over images and tables detected on a page, used by reference linking and orphan
 * rescue. Identity is the {@link #id()}.
 */
public interface PageMedia {

  String id();

  int pageNumber();

  /** Position on the page, or {@code null} if unknown. */
  BoundingBox bbox();

  MediaKind kind();

  /** Text that may carry a figure/table number ("Fig 3.5 Graph of sin x"); may be empty. */
  String caption();
}
