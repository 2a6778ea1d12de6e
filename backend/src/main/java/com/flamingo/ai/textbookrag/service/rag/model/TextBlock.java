package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * A positioned run of text on a page (typically one line or paragraph from the extractor).
 *
 * @param text block text
 * @param bbox block position; may be {@code null} when the extractor has no geometry
 */
public record TextBlock(String text, BoundingBox bbox) {

  public TextBlock {
    text = text == null ? "" : text;
  }
}
