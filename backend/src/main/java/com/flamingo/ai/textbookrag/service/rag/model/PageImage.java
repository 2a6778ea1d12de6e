package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * An image detected on a page.
 *
 * @param imageId extractor-assigned identifier, e.g. {@code fig_3_5}
 * @param imagePath location of the stored image (owned by the extractor)
 * @param bbox position on the page; may be {@code null}
 * @param caption caption or description text; never {@code null}
 * @param pageNumber 1-based page the image was found on
 */
public record PageImage(
    String imageId, String imagePath, BoundingBox bbox, String caption, int pageNumber)
    implements PageMedia {

  public PageImage {
    imagePath = imagePath == null ? "" : imagePath;
    caption = caption == null ? "" : caption;
  }

  @Override
  public String id() {
    return imageId;
  }

  @Override
  public MediaKind kind() {
    return MediaKind.IMAGE;
  }

  PageImage onPage(int page) {
    return page == pageNumber ? this : new PageImage(imageId, imagePath, bbox, caption, page);
  }
}
