package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * Axis-aligned rectangle on a page, in PDF coordinate units.
 *
 * @param x0 left edge
 * @param y0 top edge
 * @param x1 right edge
 * @param y1 bottom edge
 */
public record BoundingBox(float x0, float y0, float x1, float y1) {

  public float centerX() {
    return (x0 + x1) / 2f;
  }

  public float centerY() {
    return (y0 + y1) / 2f;
  }

  /** Euclidean distance between the centres of two boxes. */
  public double centerDistanceTo(BoundingBox other) {
    double dx = centerX() - other.centerX();
    double dy = centerY() - other.centerY();
    return Math.sqrt(dx * dx + dy * dy);
  }
}
