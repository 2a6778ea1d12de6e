package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * A table detected on a page.
 *
 * @param tableId extractor-assigned identifier, e.g. {@code table_2_1}
 * @param body table content, typically GitHub-Flavored Markdown
 * @param bbox position on the page; may be {@code null}
 * @param pageNumber 1-based page the table was found on
 */
public record PageTable(String tableId, String body, BoundingBox bbox, int pageNumber)
    implements PageMedia {

  public PageTable {
    body = body == null ? "" : body;
  }

  @Override
  public String id() {
    return tableId;
  }

  @Override
  public MediaKind kind() {
    return MediaKind.TABLE;
  }

  /** The first line of the body, which is where extractors put the table title. */
  @Override
  public String caption() {
    int newline = body.indexOf('\n');
    return newline < 0 ? body : body.substring(0, newline);
  }

  PageTable onPage(int page) {
    return page == pageNumber ? this : new PageTable(tableId, body, bbox, page);
  }
}
